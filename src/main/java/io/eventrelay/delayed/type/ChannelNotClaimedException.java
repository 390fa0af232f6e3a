package io.eventrelay.delayed.type;

/**
 * Raised on ack or nack of a channel that has no outstanding claim.
 */
public class ChannelNotClaimedException extends IllegalStateException {

    private final String channel;

    public ChannelNotClaimedException(final String channel, final String operation) {
        super("Cannot " + operation + " channel '" + channel + "': it is not claimed");
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
