package dustin.perp.domains.engine.broadcast;

import java.util.concurrent.TimeUnit;

/**
 * 브로드캐스트 구독자
 * Broadcast Receiver
 * 
 * 한 스레드에서만 사용합니다.
 */
public class BroadcastReceiver<T> implements AutoCloseable {

    private final BroadcastChannel<T> channel;
    private long cursor;
    private boolean closed = false;

    BroadcastReceiver(BroadcastChannel<T> channel, long cursor) {
        this.channel = channel;
        this.cursor = cursor;
    }

    /**
     * 다음 메시지 수신
     *
     * @param timeout 최대 대기 시간
     * @param unit 시간 단위
     * @return 메시지, 대기 시간 안에 없으면 null
     * @throws LaggedException 읽기 전에 덮어쓰인 메시지가 있을 때 (커서는 가장 오래된 메시지로 이동)
     * @throws ChannelClosedException 채널이 닫히고 남은 메시지가 없을 때
     * @throws InterruptedException 대기 중 인터럽트
     */
    public T recv(long timeout, TimeUnit unit) throws LaggedException, ChannelClosedException, InterruptedException {
        return channel.poll(this, timeout, unit);
    }

    long getCursor() {
        return cursor;
    }

    void setCursor(long cursor) {
        this.cursor = cursor;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            channel.unsubscribe();
        }
    }
}
