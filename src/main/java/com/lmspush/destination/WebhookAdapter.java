package com.lmspush.destination;

import com.lmspush.content.ContentRecord;
import com.lmspush.statement.ActivityStatement;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.time.Clock;

/**
 * Posts a {@link WebhookPayload} to an arbitrary endpoint.
 */
public class WebhookAdapter extends HttpDestinationAdapter {

    private final Clock clock;

    public WebhookAdapter(RestClient restClient, Clock clock) {
        super(restClient);
        this.clock = clock;
    }

    @Override
    public DestinationKind kind() {
        return DestinationKind.WEBHOOK;
    }

    @Override
    protected String label() {
        return "Webhook";
    }

    @Override
    protected URI targetUri(DestinationConfig destination) {
        return URI.create(destination.endpoint());
    }

    @Override
    protected Object payload(ActivityStatement statement, ContentRecord content) {
        return new WebhookPayload(statement, WebhookPayload.ContentMetadata.from(content), clock.instant());
    }
}
