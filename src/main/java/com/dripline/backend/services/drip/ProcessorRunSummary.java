package com.dripline.backend.services.drip;

import com.dripline.backend.enums.Channel;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts from one processor run, per channel.
 */
public record ProcessorRunSummary(Map<Channel, ChannelCounts> channels, Duration duration) {

    public ProcessorRunSummary {
        channels = Collections.unmodifiableMap(new EnumMap<>(channels));
    }

    public ChannelCounts forChannel(Channel channel) {
        return channels.getOrDefault(channel, ChannelCounts.EMPTY);
    }

    public int totalSent() {
        return channels.values().stream().mapToInt(ChannelCounts::sent).sum();
    }

    public int totalFailed() {
        return channels.values().stream().mapToInt(ChannelCounts::failed).sum();
    }

    public int totalRetried() {
        return channels.values().stream().mapToInt(ChannelCounts::retried).sum();
    }

    public int totalSkipped() {
        return channels.values().stream().mapToInt(ChannelCounts::skipped).sum();
    }

    /**
     * @param selected due messages picked up for the channel
     * @param skipped  claimed by a concurrent run first
     */
    public record ChannelCounts(int selected, int sent, int failed, int retried, int skipped) {
        public static final ChannelCounts EMPTY = new ChannelCounts(0, 0, 0, 0, 0);
    }
}
