// =====================================================
// BroadcastChannel - 손실 허용 다중 구독 채널
// =====================================================
// 역할: 매칭 엔진의 체결/오더북 이벤트를 여러 구독자에게 전달합니다.
//
// 핵심 설계:
// 1. 고정 크기 링 버퍼 + 단조 증가 시퀀스
// 2. 송신자는 구독자를 기다리지 않음 (버퍼가 차면 가장 오래된 메시지를 덮어씀)
// 3. 구독자마다 자기 커서를 가짐
//    - 덮어쓰인 메시지가 있으면 LaggedException(건너뛴 개수) 으로 알림
//    - 채널이 닫히고 남은 메시지가 없으면 ChannelClosedException
//
// 주의:
// - 전달 보장은 at-most-once 입니다. 느린 구독자는 메시지를 잃을 수 있습니다.
// =====================================================

package dustin.perp.domains.engine.broadcast;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 손실 허용 브로드캐스트 채널
 * Lossy multi-subscriber broadcast channel
 *
 * @param <T> 메시지 타입
 */
public class BroadcastChannel<T> {

    private final String name;
    private final Object[] buffer;
    private final int capacity;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition messageAvailable = lock.newCondition();

    /**
     * 다음에 기록될 시퀀스 번호
     */
    private long tail = 0;
    private boolean closed = false;

    private final AtomicInteger receiverCount = new AtomicInteger(0);

    public BroadcastChannel(String name, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.buffer = new Object[capacity];
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * 메시지 전송 (논블로킹)
     *
     * @param message 메시지
     * @return 현재 구독자 수 (채널이 닫혔으면 0)
     */
    public int send(T message) {
        lock.lock();
        try {
            if (closed) {
                return 0;
            }
            buffer[(int) (tail % capacity)] = message;
            tail++;
            messageAvailable.signalAll();
        } finally {
            lock.unlock();
        }
        return receiverCount.get();
    }

    /**
     * 구독 시작 - 구독 이후 전송된 메시지만 수신
     */
    public BroadcastReceiver<T> subscribe() {
        lock.lock();
        try {
            receiverCount.incrementAndGet();
            return new BroadcastReceiver<>(this, tail);
        } finally {
            lock.unlock();
        }
    }

    public int getReceiverCount() {
        return receiverCount.get();
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 채널 종료 - 대기 중인 모든 구독자를 깨움
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            messageAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void unsubscribe() {
        receiverCount.decrementAndGet();
    }

    /**
     * 구독자 커서 위치에서 다음 메시지를 꺼내고 커서를 전진시킴
     */
    @SuppressWarnings("unchecked")
    T poll(BroadcastReceiver<T> receiver, long timeout, TimeUnit unit)
            throws LaggedException, ChannelClosedException, InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (true) {
                long oldest = Math.max(0, tail - capacity);
                long next = receiver.getCursor();
                if (next < oldest) {
                    receiver.setCursor(oldest);
                    throw new LaggedException(oldest - next);
                }
                if (next < tail) {
                    T message = (T) buffer[(int) (next % capacity)];
                    receiver.setCursor(next + 1);
                    return message;
                }
                if (closed) {
                    throw new ChannelClosedException(name);
                }
                if (nanos <= 0) {
                    return null;
                }
                nanos = messageAvailable.awaitNanos(nanos);
            }
        } finally {
            lock.unlock();
        }
    }
}
