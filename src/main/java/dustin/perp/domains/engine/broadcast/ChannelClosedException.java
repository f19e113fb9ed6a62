package dustin.perp.domains.engine.broadcast;

/**
 * 채널이 닫혔을 때
 * Channel closed
 */
public class ChannelClosedException extends Exception {

    public ChannelClosedException(String channelName) {
        super("Broadcast channel closed: " + channelName);
    }
}
