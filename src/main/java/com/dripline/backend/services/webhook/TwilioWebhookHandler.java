package com.dripline.backend.services.webhook;

import com.dripline.backend.config.DripEngineProperties;
import com.dripline.backend.enums.Channel;
import com.dripline.backend.enums.DeliveryEventType;
import com.dripline.backend.util.CorrelationIds;
import com.twilio.security.RequestValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Twilio SMS status callbacks (form-encoded, one status per request).
 * The status callback URL is {public-base-url}/api/webhooks/drip/sms/status?drip_message_id=drip-{id},
 * set per message by the SMS adapter.
 */
@Component
@Slf4j
public class TwilioWebhookHandler implements ProviderWebhookHandler {

    private final String authToken;
    private final DripEngineProperties properties;
    private final Clock clock;

    public TwilioWebhookHandler(@Value("${twilio.auth_token:}") String authToken,
                                DripEngineProperties properties,
                                Clock clock) {
        this.authToken = authToken;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Channel channel() {
        return Channel.SMS;
    }

    @Override
    public boolean verify(ProviderWebhook webhook) {
        if (!properties.webhook().validateSignature()) {
            log.debug("Twilio signature validation disabled");
            return true;
        }
        if (!StringUtils.hasText(authToken)) {
            log.warn("Twilio signature validation is enabled but twilio.auth_token is not configured; rejecting callback");
            return false;
        }
        if (!StringUtils.hasText(webhook.signature()) || !StringUtils.hasText(webhook.requestUrl())) {
            log.warn("Twilio callback without signature or URL");
            return false;
        }

        RequestValidator validator = new RequestValidator(authToken);
        boolean ok = validator.validate(webhook.requestUrl(), webhook.params(), webhook.signature());
        if (!ok) {
            log.debug("Signature validation failed for URL={} params={}", webhook.requestUrl(), webhook.params().keySet());
        }
        return ok;
    }

    @Override
    public List<DeliveryEvent> parse(ProviderWebhook webhook) {
        Map<String, String> params = webhook.params();
        String messageSid = firstNonBlank(params.get("MessageSid"), params.get("SmsSid"));
        String status = firstNonBlank(params.get("MessageStatus"), params.get("SmsStatus"));

        if (!StringUtils.hasText(messageSid) || !StringUtils.hasText(status)) {
            log.warn("Twilio callback missing MessageSid or MessageStatus: {}", params.keySet());
            return List.of();
        }

        String error = null;
        String errorCode = params.get("ErrorCode");
        if (StringUtils.hasText(errorCode)) {
            String errorMessage = params.get("ErrorMessage");
            error = "Twilio error " + errorCode + (StringUtils.hasText(errorMessage) ? ": " + errorMessage : "");
        }

        DeliveryEvent event = new DeliveryEvent(Channel.SMS, messageSid, dripMessageId(webhook.requestUrl()),
                mapStatus(status), status, OffsetDateTime.now(clock), error);
        return List.of(event);
    }

    // Set on the status callback URL when the message was sent
    static Long dripMessageId(String requestUrl) {
        if (!StringUtils.hasText(requestUrl)) {
            return null;
        }
        String correlationId = UriComponentsBuilder.fromUriString(requestUrl).build()
                .getQueryParams().getFirst(CorrelationIds.PARAMETER);
        return CorrelationIds.parseMessageId(correlationId);
    }

    static DeliveryEventType mapStatus(String status) {
        return switch (status.toLowerCase(Locale.ROOT)) {
            case "queued", "accepted", "sending", "sent" -> DeliveryEventType.SENT;
            case "delivered" -> DeliveryEventType.DELIVERED;
            case "read" -> DeliveryEventType.OPENED;
            case "undelivered", "failed" -> DeliveryEventType.FAILED;
            default -> DeliveryEventType.IGNORED;
        };
    }

    private static String firstNonBlank(String first, String second) {
        return StringUtils.hasText(first) ? first : second;
    }
}
