package com.playarr.livetv.util;

/**
 * Builds DynamoDB key values for the live TV tables.
 *
 * Programme sort keys are {@code channelId#start#stop} with both instants as zero-padded epoch
 * milliseconds, so a begins_with query on {@code channelId#} returns one channel's guide in start order.
 */
public final class LiveTvKeyFactory {

    public static final String DELIMITER = "#";
    private static final String EPOCH_FORMAT = "%015d";

    private LiveTvKeyFactory() {
    }

    public static String programSortKey(String channelId, long startMs, long stopMs) {
        return channelId + DELIMITER + String.format(EPOCH_FORMAT, startMs) + DELIMITER + String.format(EPOCH_FORMAT, stopMs);
    }

    public static String programChannelPrefix(String channelId) {
        return channelId + DELIMITER;
    }
}
