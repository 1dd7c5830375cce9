package com.dripline.backend.services.channel;

import com.dripline.backend.enums.Channel;
import com.dripline.backend.util.CorrelationIds;
import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.ASM;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import com.sendgrid.helpers.mail.objects.Personalization;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.regex.Pattern;

import static com.dripline.backend.util.ContactMasking.maskEmail;

@Component
@Slf4j
public class SendGridEmailAdapter implements ChannelAdapter {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

    private final SendGrid sendGrid;
    private final String fromEmail;
    private final String fromName;
    private final Integer unsubscribeGroupId;

    public SendGridEmailAdapter(@Value("${sendgrid.api.key:}") String apiKey,
                                @Value("${sendgrid.from.email:}") String fromEmail,
                                @Value("${sendgrid.from.name:}") String fromName,
                                @Value("${sendgrid.unsubscribe-group-id:}") Integer unsubscribeGroupId) {
        this(new SendGrid(apiKey), fromEmail, fromName, unsubscribeGroupId);
    }

    SendGridEmailAdapter(SendGrid sendGrid, String fromEmail, String fromName, Integer unsubscribeGroupId) {
        this.sendGrid = sendGrid;
        this.fromEmail = fromEmail;
        this.fromName = fromName;
        this.unsubscribeGroupId = unsubscribeGroupId;
    }

    @Override
    public Channel channel() {
        return Channel.EMAIL;
    }

    @Override
    public boolean validate(String address) {
        return address != null && EMAIL_PATTERN.matcher(address).matches();
    }

    @Override
    public SendResult send(OutboundMessage message) {
        String correlationId = message.correlationId();
        String address = message.recipient();

        try {
            Request request = new Request();
            request.setMethod(Method.POST);
            request.setEndpoint("mail/send");
            request.setBody(buildMail(message).build());

            Response response = sendGrid.api(request);
            int status = response.getStatusCode();

            if (status >= 200 && status < 300) {
                String messageId = headerValue(response.getHeaders(), "X-Message-Id");
                if (messageId == null || messageId.isBlank()) {
                    // Callbacks still carry the drip_message_id custom arg
                    log.warn("SendGrid accepted {} without an X-Message-Id header, tracking it by correlation id",
                            correlationId);
                    return SendResult.success(correlationId);
                }
                log.info("Email {} accepted by SendGrid for {} - id: {}", correlationId, maskEmail(address), messageId);
                return SendResult.success(messageId);
            }

            boolean retryable = status == 429 || status >= 500;
            log.warn("SendGrid rejected {} for {} with status {}: {}",
                    correlationId, maskEmail(address), status, response.getBody());
            return SendResult.failure(retryable, "SendGrid error " + status + ": " + response.getBody());

        } catch (IOException e) {
            log.warn("IOException sending {} via SendGrid: {}", correlationId, e.getMessage());
            return SendResult.retryableFailure("SendGrid IO error: " + e.getMessage());
        }
    }

    Mail buildMail(OutboundMessage message) {
        Mail mail = new Mail();
        mail.setFrom(new Email(fromEmail, fromName));

        Personalization personalization = new Personalization();
        personalization.addTo(new Email(message.recipient()));

        if (message.usesTemplate()) {
            mail.setTemplateId(message.templateId());
            message.templateData().forEach(personalization::addDynamicTemplateData);
        } else {
            mail.setSubject(message.subject() != null ? message.subject() : "");
            mail.addContent(new Content("text/html", message.content()));
        }

        mail.addPersonalization(personalization);
        mail.addCustomArg(CorrelationIds.PARAMETER, message.correlationId());

        if (unsubscribeGroupId != null) {
            ASM asm = new ASM();
            asm.setGroupId(unsubscribeGroupId);
            mail.setASM(asm);
        }
        return mail;
    }

    private static String headerValue(Map<String, String> headers, String name) {
        if (headers == null) {
            return null;
        }
        return headers.entrySet().stream()
                .filter(entry -> name.equalsIgnoreCase(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }
}
