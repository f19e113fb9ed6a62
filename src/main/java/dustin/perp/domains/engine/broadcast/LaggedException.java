package dustin.perp.domains.engine.broadcast;

/**
 * 구독자가 뒤처져 메시지를 놓쳤을 때
 * Receiver lagged behind and missed messages
 */
public class LaggedException extends Exception {

    private final long skipped;

    public LaggedException(long skipped) {
        super("Receiver lagged, missed " + skipped + " messages");
        this.skipped = skipped;
    }

    public long getSkipped() {
        return skipped;
    }
}
