package com.dripline.backend.services.channel;

import com.dripline.backend.config.DripEngineProperties;
import com.dripline.backend.enums.Channel;
import com.dripline.backend.util.CorrelationIds;
import com.twilio.Twilio;
import com.twilio.exception.ApiConnectionException;
import com.twilio.exception.ApiException;
import com.twilio.exception.TwilioException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.rest.api.v2010.account.MessageCreator;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.regex.Pattern;

import static com.dripline.backend.util.ContactMasking.maskPhoneNumber;

@Component
@Slf4j
public class TwilioSmsAdapter implements ChannelAdapter {

    static final String STATUS_CALLBACK_PATH = "/api/webhooks/drip/sms/status";

    private static final Pattern E164_PATTERN = Pattern.compile("^\\+[1-9]\\d{1,14}$");
    private static final int MAX_BODY_LENGTH = 1600;

    @Value("${twilio.account_sid:}")
    private String accountSid;

    @Value("${twilio.auth_token:}")
    private String authToken;

    @Value("${twilio.phone_number:}")
    private String fromPhoneNumber;

    private final DripEngineProperties properties;

    private volatile boolean initialized;

    public TwilioSmsAdapter(DripEngineProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void initializeTwilio() {
        if (isBlank(accountSid) || isBlank(authToken) || isBlank(fromPhoneNumber)) {
            log.warn("Twilio credentials not configured. Drip SMS sends will be retried until they are.");
            return;
        }
        Twilio.init(accountSid, authToken);
        initialized = true;
        log.info("Twilio initialized for drip SMS");
    }

    @Override
    public Channel channel() {
        return Channel.SMS;
    }

    @Override
    public boolean validate(String address) {
        return address != null && E164_PATTERN.matcher(address).matches();
    }

    @Override
    public SendResult send(OutboundMessage outbound) {
        if (!initialized) {
            return SendResult.retryableFailure("Twilio is not configured");
        }

        String address = outbound.recipient();
        String correlationId = outbound.correlationId();
        String body = outbound.content();
        if (body.length() > MAX_BODY_LENGTH) {
            log.warn("SMS body for {} too long ({} chars), truncating", correlationId, body.length());
            body = body.substring(0, MAX_BODY_LENGTH - 3) + "...";
        }

        try {
            MessageCreator creator = Message.creator(
                    new PhoneNumber(address),
                    new PhoneNumber(fromPhoneNumber),
                    body);

            String callbackUrl = statusCallbackUrl(correlationId);
            if (callbackUrl != null) {
                creator.setStatusCallback(URI.create(callbackUrl));
            }

            Message message = creator.create();
            log.info("SMS {} accepted by Twilio for {} - SID: {}", correlationId, maskPhoneNumber(address), message.getSid());
            return SendResult.success(message.getSid());

        } catch (ApiConnectionException e) {
            log.warn("Twilio unreachable sending {}: {}", correlationId, e.getMessage());
            return SendResult.retryableFailure("Twilio connection error: " + e.getMessage());
        } catch (ApiException e) {
            boolean retryable = isRetryableStatus(e.getStatusCode());
            log.warn("Twilio rejected {} for {} (status {}, code {}): {}",
                    correlationId, maskPhoneNumber(address), e.getStatusCode(), e.getCode(), e.getMessage());
            return SendResult.failure(retryable, "Twilio error " + e.getStatusCode() + ": " + e.getMessage());
        } catch (TwilioException e) {
            log.warn("Twilio client error sending {}: {}", correlationId, e.getMessage());
            return SendResult.retryableFailure("Twilio client error: " + e.getMessage());
        }
    }

    // Twilio posts status callbacks to this URL as given, so the drip message id comes back with them
    String statusCallbackUrl(String correlationId) {
        String baseUrl = properties.webhook().publicBaseUrl();
        if (isBlank(baseUrl)) {
            return null;
        }
        return UriComponentsBuilder.fromHttpUrl(stripTrailingSlash(baseUrl) + STATUS_CALLBACK_PATH)
                .queryParam(CorrelationIds.PARAMETER, correlationId)
                .build()
                .toUriString();
    }

    static boolean isRetryableStatus(Integer statusCode) {
        return statusCode == null || statusCode == 429 || statusCode >= 500;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
