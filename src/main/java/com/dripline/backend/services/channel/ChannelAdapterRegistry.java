package com.dripline.backend.services.channel;

import com.dripline.backend.enums.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class ChannelAdapterRegistry {

    private final Map<Channel, ChannelAdapter> adapters = new EnumMap<>(Channel.class);

    public ChannelAdapterRegistry(List<ChannelAdapter> channelAdapters) {
        for (ChannelAdapter adapter : channelAdapters) {
            ChannelAdapter previous = adapters.put(adapter.channel(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Multiple channel adapters registered for " + adapter.channel() +
                        ": " + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName());
            }
        }
        for (Channel channel : Channel.values()) {
            if (!adapters.containsKey(channel)) {
                throw new IllegalStateException("No channel adapter registered for " + channel);
            }
        }
        log.info("Channel adapters registered: {}", adapters.keySet());
    }

    public ChannelAdapter forChannel(Channel channel) {
        return adapters.get(channel);
    }
}
