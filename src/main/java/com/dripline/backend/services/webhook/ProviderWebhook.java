package com.dripline.backend.services.webhook;

import com.dripline.backend.enums.Channel;

import java.util.Map;

/**
 * A provider callback as received over HTTP, before verification and parsing.
 *
 * @param requestUrl full URL the provider posted to, including any query string
 * @param rawBody    body exactly as received; signatures are computed over it
 * @param params     form parameters, empty for JSON callbacks
 * @param signature  provider signature header, may be null
 * @param timestamp  provider signature timestamp header, may be null
 */
public record ProviderWebhook(Channel channel,
                              String requestUrl,
                              String rawBody,
                              Map<String, String> params,
                              String signature,
                              String timestamp) {

    public ProviderWebhook {
        params = params != null ? Map.copyOf(params) : Map.of();
    }

    public static ProviderWebhook form(Channel channel, String requestUrl, Map<String, String> params, String signature) {
        return new ProviderWebhook(channel, requestUrl, null, params, signature, null);
    }

    public static ProviderWebhook json(Channel channel, String rawBody, String signature, String timestamp) {
        return new ProviderWebhook(channel, null, rawBody, Map.of(), signature, timestamp);
    }
}
