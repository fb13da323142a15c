package com.libragraph.stageflow.core.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

/**
 * Posts critical health reports to the configured alert webhook.
 * Delivery failures are logged and reported as {@code false}; they never propagate.
 */
@ApplicationScoped
public class AlertNotifier {

    private static final Logger log = Logger.getLogger(AlertNotifier.class);

    private static final int TIMEOUT_SECONDS = 10;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @ConfigProperty(name = "health.alert-webhook-url")
    Optional<String> webhookUrl;

    @Inject
    public AlertNotifier(ObjectMapper objectMapper) {
        this(objectMapper, HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(5))
                .build());
    }

    AlertNotifier(ObjectMapper objectMapper, HttpClient httpClient) {
        this.objectMapper = objectMapper;
        this.httpClient = httpClient;
        this.webhookUrl = Optional.empty();
    }

    /**
     * Sends {@code report} when it carries at least one critical alert and a webhook is configured.
     *
     * @return true when the webhook accepted the notification
     */
    public boolean notify(HealthReport report) {
        if (!report.hasCriticalAlert()) {
            return false;
        }
        Optional<String> url = webhookUrl.filter(u -> !u.isBlank());
        if (url.isEmpty()) {
            log.debug("Critical health alert raised but no alert webhook is configured");
            return false;
        }
        try {
            HttpRequest request = HttpRequest.newBuilder(URI.create(url.get()))
                    .timeout(Duration.ofSeconds(TIMEOUT_SECONDS))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body(report))))
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                log.warnf("Alert webhook returned %d: %s", response.statusCode(), response.body());
                return false;
            }
            log.infof("Sent health alert (%d alerts) to webhook", report.health().alertCount());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while sending health alert");
            return false;
        } catch (Exception e) {
            log.errorf(e, "Failed to send health alert to %s", url.get());
            return false;
        }
    }

    ObjectNode body(HealthReport report) {
        HealthReport.Health health = report.health();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("title", "Pipeline health: " + health.status());
        body.put("status", health.status());
        body.put("timestamp", health.timestamp().toString());
        body.put("alert_count", health.alertCount());
        body.set("alerts", objectMapper.valueToTree(health.alerts()));
        return body;
    }
}
