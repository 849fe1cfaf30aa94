package com.hagglehub.gateway.http;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hagglehub.ingest.PayloadNormalizer;
import com.hagglehub.observability.MetricsConfig;
import com.hagglehub.pipeline.InboundPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Mailgun inbound route target. Always answers 200 once the payload is normalized and
 * queued, so the provider never retries and duplicates a message.
 */
@RestController
public class MailgunWebhookController {

    private static final Logger log = LoggerFactory.getLogger(MailgunWebhookController.class);
    private static final String PATH = "/webhooks/email/mailgun";

    private final PayloadNormalizer normalizer;
    private final InboundPipeline pipeline;
    private final MetricsConfig metrics;
    private final ObjectMapper mapper = new ObjectMapper();

    public MailgunWebhookController(PayloadNormalizer normalizer, InboundPipeline pipeline, MetricsConfig metrics) {
        this.normalizer = normalizer;
        this.pipeline = pipeline;
        this.metrics = metrics;
    }

    @PostMapping(path = PATH, consumes = {
            MediaType.APPLICATION_FORM_URLENCODED_VALUE, MediaType.MULTIPART_FORM_DATA_VALUE})
    public ResponseEntity<String> form(@RequestParam MultiValueMap<String, String> fields) {
        return acknowledge(fields);
    }

    @PostMapping(path = PATH)
    public ResponseEntity<String> json(@RequestBody(required = false) String body) {
        return acknowledge(parseJson(body));
    }

    private ResponseEntity<String> acknowledge(Map<String, ?> fields) {
        try {
            metrics.webhooksReceived().increment();
            var message = normalizer.normalize(fields);
            log.info("Inbound email {} from '{}' to '{}' subject='{}'",
                    message.messageId(), message.sender(), message.recipient(), message.subject());
            pipeline.submit(message);
        } catch (RuntimeException e) {
            log.error("Inbound webhook handling failed, acknowledging anyway", e);
        }
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body("OK");
    }

    private Map<String, Object> parseJson(String body) {
        if (body == null || body.isBlank()) return Map.of();
        try {
            var node = mapper.readTree(body);
            if (!node.isObject()) return Map.of();
            return mapper.convertValue(node, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            log.warn("Webhook body is not a JSON object, treating as empty: {}", e.getMessage());
            return Map.of();
        }
    }
}
