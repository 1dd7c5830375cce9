package com.dripline.backend.services.webhook;

import com.dripline.backend.config.DripEngineProperties;
import com.dripline.backend.enums.Channel;
import com.dripline.backend.enums.DeliveryEventType;
import com.dripline.backend.exceptions.InvalidWebhookPayloadException;
import com.dripline.backend.util.CorrelationIds;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sendgrid.helpers.eventwebhook.EventWebhook;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Security;
import java.security.interfaces.ECPublicKey;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * SendGrid event webhook (JSON array, many events per request).
 * Signed events carry an ECDSA signature over timestamp + body, checked against the webhook's
 * verification key (base64 public key from the SendGrid settings page).
 */
@Component
@Slf4j
public class SendGridWebhookHandler implements ProviderWebhookHandler {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private final ObjectMapper objectMapper;
    private final DripEngineProperties properties;
    private final Clock clock;

    public SendGridWebhookHandler(ObjectMapper objectMapper, DripEngineProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Channel channel() {
        return Channel.EMAIL;
    }

    @Override
    public boolean verify(ProviderWebhook webhook) {
        if (!properties.webhook().validateSignature()) {
            log.debug("SendGrid signature validation disabled");
            return true;
        }

        String verificationKey = properties.webhook().emailVerificationKey();
        if (!StringUtils.hasText(verificationKey)) {
            log.warn("Email signature validation is enabled but drip.webhook.email-verification-key is not configured; rejecting callback");
            return false;
        }
        if (!StringUtils.hasText(webhook.signature()) || !StringUtils.hasText(webhook.timestamp())) {
            log.warn("Missing signature or timestamp headers");
            return false;
        }

        byte[] payload = (webhook.rawBody() != null ? webhook.rawBody() : "").getBytes(StandardCharsets.UTF_8);
        try {
            EventWebhook eventWebhook = new EventWebhook();
            ECPublicKey publicKey = eventWebhook.ConvertPublicKeyToECDSA(verificationKey.trim());
            boolean valid = eventWebhook.VerifySignature(publicKey, payload, webhook.signature().trim(), webhook.timestamp());
            if (!valid) {
                log.warn("SendGrid signature mismatch");
            }
            return valid;
        } catch (GeneralSecurityException | IOException | IllegalArgumentException e) {
            log.warn("SendGrid signature could not be checked: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public List<DeliveryEvent> parse(ProviderWebhook webhook) {
        JsonNode events;
        try {
            events = objectMapper.readTree(webhook.rawBody() != null ? webhook.rawBody() : "");
        } catch (JsonProcessingException e) {
            throw new InvalidWebhookPayloadException(Channel.EMAIL, "Invalid JSON: " + e.getOriginalMessage(), e);
        }

        if (events == null || !events.isArray()) {
            throw new InvalidWebhookPayloadException(Channel.EMAIL, "Expected JSON array of events");
        }

        List<DeliveryEvent> parsed = new ArrayList<>();
        for (JsonNode event : events) {
            String eventType = getStringValue(event, "event");
            String messageId = cleanMessageId(getStringValue(event, "sg_message_id"));
            Long dripMessageId = CorrelationIds.parseMessageId(getStringValue(event, CorrelationIds.PARAMETER));

            if ((!StringUtils.hasText(messageId) && dripMessageId == null) || !StringUtils.hasText(eventType)) {
                log.warn("Skipping SendGrid event with missing fields: messageId={}, event={}", messageId, eventType);
                continue;
            }

            Long timestamp = getLongValue(event, "timestamp");
            OffsetDateTime occurredAt = timestamp != null
                    ? OffsetDateTime.ofInstant(Instant.ofEpochSecond(timestamp), ZoneOffset.UTC)
                    : OffsetDateTime.now(clock);

            DeliveryEventType type = mapEvent(eventType);
            String error = null;
            if (type == DeliveryEventType.BOUNCED) {
                String reason = getStringValue(event, "reason");
                error = "Email " + eventType.toLowerCase(Locale.ROOT) + (StringUtils.hasText(reason) ? ": " + reason : "");
            }

            parsed.add(new DeliveryEvent(Channel.EMAIL, messageId, dripMessageId, type, eventType, occurredAt, error));
        }
        return parsed;
    }

    static DeliveryEventType mapEvent(String eventType) {
        return switch (eventType.toLowerCase(Locale.ROOT)) {
            case "processed" -> DeliveryEventType.SENT;
            case "delivered" -> DeliveryEventType.DELIVERED;
            case "open" -> DeliveryEventType.OPENED;
            case "click" -> DeliveryEventType.CLICKED;
            case "bounce", "dropped", "blocked" -> DeliveryEventType.BOUNCED;
            default -> DeliveryEventType.IGNORED;
        };
    }

    // sg_message_id is the X-Message-Id from the send response plus a ".filter..." suffix
    static String cleanMessageId(String messageId) {
        if (!StringUtils.hasText(messageId)) {
            return null;
        }
        String clean = messageId.replaceAll("[<>]", "").trim();
        int filter = clean.indexOf(".filter");
        return filter > 0 ? clean.substring(0, filter) : clean;
    }

    private String getStringValue(JsonNode node, String fieldName) {
        JsonNode field = node.get(fieldName);
        return field != null && !field.isNull() ? field.asText() : null;
    }

    private Long getLongValue(JsonNode node, String fieldName) {
        JsonNode field = node.get(fieldName);
        return field != null && !field.isNull() && field.canConvertToLong() ? field.asLong() : null;
    }
}
