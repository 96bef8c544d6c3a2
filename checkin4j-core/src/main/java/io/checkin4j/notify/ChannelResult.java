package io.checkin4j.notify;

/**
 * Result of handing one event to one channel.
 */
public record ChannelResult(String channelId, Status status, String detail) {

    public enum Status {
        SENT,
        SKIPPED,
        FAILED
    }

    public static ChannelResult sent(String channelId) {
        return new ChannelResult(channelId, Status.SENT, null);
    }

    public static ChannelResult skipped(String channelId, String detail) {
        return new ChannelResult(channelId, Status.SKIPPED, detail);
    }

    public static ChannelResult failed(String channelId, String detail) {
        return new ChannelResult(channelId, Status.FAILED, detail);
    }
}
