package com.lmspush.destination;

import com.lmspush.content.ContentRecord;
import com.lmspush.statement.ActivityStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * Shared HTTP POST delivery with bearer authentication.
 *
 * Response classification: 2xx delivered, 5xx retryable, 4xx fatal.
 * Transport errors are retryable; any other status (1xx, 3xx) is fatal.
 */
public abstract class HttpDestinationAdapter implements DestinationAdapter {

    private static final int MAX_REASON_BODY = 500;
    static final String UNREADABLE_BODY = "<unreadable body>";

    private final Logger log = LoggerFactory.getLogger(getClass());

    private final RestClient restClient;

    protected HttpDestinationAdapter(RestClient restClient) {
        this.restClient = restClient;
    }

    /** Short label used in failure reasons, e.g. "LRS". */
    protected abstract String label();

    protected abstract URI targetUri(DestinationConfig destination);

    protected abstract Object payload(ActivityStatement statement, ContentRecord content);

    protected void addHeaders(HttpHeaders headers) {
    }

    @Override
    public DeliveryOutcome deliver(ActivityStatement statement, ContentRecord content, DestinationConfig destination) {
        URI target;
        try {
            target = targetUri(destination);
        } catch (IllegalArgumentException ex) {
            return DeliveryOutcome.fatal(label() + " endpoint is invalid: " + ex.getMessage());
        }

        try {
            return restClient.post()
                .uri(target)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    if (destination.hasCredential()) {
                        headers.setBearerAuth(destination.authToken());
                    }
                    addHeaders(headers);
                })
                .body(payload(statement, content))
                .exchange((request, response) -> {
                    int status = response.getStatusCode().value();
                    return classify(status, readBody(response));
                });
        } catch (RestClientException ex) {
            log.debug("{} transport failure for destination={}", label(), destination.name(), ex);
            return DeliveryOutcome.retryable(label() + " push failed: " + ex.getMessage());
        }
    }

    /**
     * A body that cannot be read never changes the classification of a status already received.
     */
    private String readBody(ClientHttpResponse response) {
        try {
            return StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            log.debug("{} response body unreadable: {}", label(), ex.getMessage());
            return UNREADABLE_BODY;
        }
    }

    DeliveryOutcome classify(int status, String body) {
        if (status >= 200 && status < 300) {
            return DeliveryOutcome.delivered(status);
        }
        String reason = label() + " push failed with HTTP " + status + ": " + abbreviate(body);
        if (status >= 500 && status < 600) {
            return DeliveryOutcome.retryable(reason);
        }
        return DeliveryOutcome.fatal(reason);
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "<empty body>";
        }
        String trimmed = body.strip();
        return trimmed.length() <= MAX_REASON_BODY ? trimmed : trimmed.substring(0, MAX_REASON_BODY) + "...";
    }
}
