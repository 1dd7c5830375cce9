package com.dripline.backend.services.channel;

import com.dripline.backend.enums.Channel;

/**
 * Sends rendered drip content over one delivery channel.
 * <p>
 * Implementations report provider problems through {@link SendResult} rather than by throwing, and
 * must classify each failure as retryable (throttling, provider outage, network) or not.
 */
public interface ChannelAdapter {

    Channel channel();

    /**
     * Cheap syntactic check of a recipient address. Messages that fail it are never sent.
     */
    boolean validate(String address);

    SendResult send(OutboundMessage message);
}
