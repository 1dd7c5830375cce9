package com.dripline.backend.controllers.drip;

import com.dripline.backend.config.DripEngineProperties;
import com.dripline.backend.enums.Channel;
import com.dripline.backend.services.webhook.DripWebhookReconciler;
import com.dripline.backend.services.webhook.ProviderWebhook;
import com.dripline.backend.services.webhook.ReconcileOutcome;
import com.dripline.backend.services.webhook.ReconcileReport;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.HashMap;
import java.util.Map;

/**
 * Provider delivery callbacks for drip messages.
 * Twilio status callback: {public-base-url}/api/webhooks/drip/sms/status (POST, form)
 * SendGrid event webhook: {public-base-url}/api/webhooks/drip/email/events (POST, JSON array)
 * <p>
 * Responds 404 when every event names an unknown message so the provider redelivers later.
 */
@RestController
@RequestMapping("/api/webhooks/drip")
@RequiredArgsConstructor
@Slf4j
public class DripWebhookController {

    private final DripWebhookReconciler reconciler;
    private final DripEngineProperties properties;

    @PostMapping("/sms/status")
    public ResponseEntity<Map<String, Object>> handleSmsStatus(
            @RequestParam Map<String, String> params,
            @RequestHeader(value = "X-Twilio-Signature", required = false) String signature,
            HttpServletRequest request) {

        log.debug("Twilio drip status callback: SID={}, Status={}", params.get("MessageSid"), params.get("MessageStatus"));
        ProviderWebhook webhook = ProviderWebhook.form(Channel.SMS, resolveRequestUrl(request),
                formParams(params, request.getQueryString()), signature);
        return respond(reconciler.ingest(webhook));
    }

    @PostMapping("/email/events")
    public ResponseEntity<Map<String, Object>> handleEmailEvents(
            @RequestBody String requestBody,
            @RequestHeader(value = "X-Twilio-Email-Event-Webhook-Signature", required = false) String signature,
            @RequestHeader(value = "X-Twilio-Email-Event-Webhook-Timestamp", required = false) String timestamp) {

        log.debug("SendGrid drip event webhook received. Body length: {}", requestBody.length());
        ProviderWebhook webhook = ProviderWebhook.json(Channel.EMAIL, requestBody, signature, timestamp);
        return respond(reconciler.ingest(webhook));
    }

    private ResponseEntity<Map<String, Object>> respond(ReconcileReport report) {
        Map<String, Object> body = new HashMap<>();
        body.put("channel", report.channel());
        body.put("events", report.outcomes().size());
        body.put("applied", report.count(ReconcileOutcome.APPLIED));
        body.put("ignored", report.count(ReconcileOutcome.IGNORED_STALE) + report.count(ReconcileOutcome.UNSUPPORTED));
        body.put("unknown", report.count(ReconcileOutcome.UNKNOWN_MESSAGE));

        if (report.allUnknown()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
        }
        return ResponseEntity.ok(body);
    }

    // Twilio signs query parameters as part of the URL and only POST fields as parameters
    static Map<String, String> formParams(Map<String, String> params, String queryString) {
        if (!StringUtils.hasText(queryString)) {
            return params;
        }
        Map<String, String> form = new HashMap<>(params);
        UriComponentsBuilder.fromUriString("?" + queryString).build().getQueryParams().keySet()
                .forEach(form::remove);
        return form;
    }

    // Twilio signs the public URL it called, which differs from the local one behind a proxy
    private String resolveRequestUrl(HttpServletRequest request) {
        String publicBaseUrl = properties.webhook().publicBaseUrl();
        String url;
        if (StringUtils.hasText(publicBaseUrl)) {
            String base = publicBaseUrl.endsWith("/") ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1) : publicBaseUrl;
            url = base + request.getRequestURI();
        } else {
            url = request.getRequestURL().toString();
        }
        String qs = request.getQueryString();
        if (qs != null && !qs.isEmpty()) {
            url = url + "?" + qs;
        }
        return url;
    }
}
