package com.dripline.backend.exceptions;

import com.dripline.backend.enums.Channel;

/**
 * Thrown when a provider callback fails its authenticity check. Nothing from the payload is applied.
 */
public class WebhookVerificationException extends RuntimeException {

    private final Channel channel;

    public WebhookVerificationException(Channel channel, String message) {
        super(message);
        this.channel = channel;
    }

    public Channel getChannel() {
        return channel;
    }
}
