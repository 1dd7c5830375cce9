package com.dripline.backend.services.channel;

import java.util.Map;

/**
 * One rendered drip message as handed to a channel adapter.
 *
 * @param subject       only meaningful for channels that carry one, may be null
 * @param correlationId stable id of the drip message, attached to the provider request where supported
 * @param templateId    provider-side template to send instead of {@code content}, may be null
 * @param templateData  variables for the provider-side template
 */
public record OutboundMessage(String recipient,
                              String subject,
                              String content,
                              String correlationId,
                              String templateId,
                              Map<String, String> templateData) {

    public OutboundMessage {
        templateData = templateData != null ? Map.copyOf(templateData) : Map.of();
    }

    public static OutboundMessage of(String recipient, String subject, String content, String correlationId) {
        return new OutboundMessage(recipient, subject, content, correlationId, null, Map.of());
    }

    public boolean usesTemplate() {
        return templateId != null && !templateId.isBlank();
    }
}
