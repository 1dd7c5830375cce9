package com.dripline.backend.exceptions;

import com.dripline.backend.enums.Channel;

public class InvalidWebhookPayloadException extends RuntimeException {

    private final Channel channel;

    public InvalidWebhookPayloadException(Channel channel, String message) {
        super(message);
        this.channel = channel;
    }

    public InvalidWebhookPayloadException(Channel channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public Channel getChannel() {
        return channel;
    }
}
