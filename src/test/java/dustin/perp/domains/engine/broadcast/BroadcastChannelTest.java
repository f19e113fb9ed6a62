package dustin.perp.domains.engine.broadcast;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * 손실 허용 브로드캐스트 채널 테스트
 */
class BroadcastChannelTest {

    @Test
    @DisplayName("모든 구독자가 같은 순서로 메시지를 받는다")
    void fanOutInOrder() throws Exception {
        BroadcastChannel<String> channel = new BroadcastChannel<>("test", 8);
        BroadcastReceiver<String> first = channel.subscribe();
        BroadcastReceiver<String> second = channel.subscribe();

        assertThat(channel.send("a")).isEqualTo(2);
        channel.send("b");

        assertThat(first.recv(10, TimeUnit.MILLISECONDS)).isEqualTo("a");
        assertThat(first.recv(10, TimeUnit.MILLISECONDS)).isEqualTo("b");
        assertThat(second.recv(10, TimeUnit.MILLISECONDS)).isEqualTo("a");
        assertThat(second.recv(10, TimeUnit.MILLISECONDS)).isEqualTo("b");
        assertThat(first.recv(10, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    @DisplayName("구독 이전에 보낸 메시지는 받지 않는다")
    void subscribeSeesOnlyLaterMessages() throws Exception {
        BroadcastChannel<String> channel = new BroadcastChannel<>("test", 8);
        assertThat(channel.send("before")).isZero();

        BroadcastReceiver<String> receiver = channel.subscribe();
        channel.send("after");

        assertThat(receiver.recv(10, TimeUnit.MILLISECONDS)).isEqualTo("after");
    }

    @Test
    @DisplayName("버퍼를 넘으면 느린 구독자는 건너뛴 개수와 함께 LaggedException 을 받고 가장 오래된 메시지부터 이어 받는다")
    void laggedReceiver() throws Exception {
        BroadcastChannel<Integer> channel = new BroadcastChannel<>("test", 4);
        BroadcastReceiver<Integer> receiver = channel.subscribe();

        for (int i = 0; i < 10; i++) {
            channel.send(i);
        }

        assertThatThrownBy(() -> receiver.recv(10, TimeUnit.MILLISECONDS))
                .isInstanceOf(LaggedException.class)
                .satisfies(e -> assertThat(((LaggedException) e).getSkipped()).isEqualTo(6));
        assertThat(receiver.recv(10, TimeUnit.MILLISECONDS)).isEqualTo(6);
        assertThat(receiver.recv(10, TimeUnit.MILLISECONDS)).isEqualTo(7);
    }

    @Test
    @DisplayName("닫힌 채널: 남은 메시지를 다 받은 뒤 ChannelClosedException")
    void closedAfterDrain() throws Exception {
        BroadcastChannel<String> channel = new BroadcastChannel<>("test", 4);
        BroadcastReceiver<String> receiver = channel.subscribe();
        channel.send("last");

        channel.close();

        assertThat(channel.send("ignored")).isZero();
        assertThat(receiver.recv(10, TimeUnit.MILLISECONDS)).isEqualTo("last");
        assertThatThrownBy(() -> receiver.recv(10, TimeUnit.MILLISECONDS))
                .isInstanceOf(ChannelClosedException.class);
    }

    @Test
    @DisplayName("대기 중인 구독자는 전송 시 깨어난다")
    void blockedReceiverWakesUp() throws Exception {
        BroadcastChannel<String> channel = new BroadcastChannel<>("test", 4);
        BroadcastReceiver<String> receiver = channel.subscribe();

        CompletableFuture<String> pending = CompletableFuture.supplyAsync(() -> {
            try {
                return receiver.recv(5, TimeUnit.SECONDS);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(50);
        channel.send("wake");

        assertThat(pending.get(5, TimeUnit.SECONDS)).isEqualTo("wake");
    }

    @Test
    @DisplayName("구독 해제 시 구독자 수가 줄어든다")
    void closeReceiverUnsubscribes() {
        BroadcastChannel<String> channel = new BroadcastChannel<>("test", 4);
        BroadcastReceiver<String> receiver = channel.subscribe();
        assertThat(channel.getReceiverCount()).isEqualTo(1);

        receiver.close();
        receiver.close();

        assertThat(channel.getReceiverCount()).isZero();
    }
}
