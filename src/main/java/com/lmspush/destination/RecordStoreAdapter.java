package com.lmspush.destination;

import com.lmspush.content.ContentRecord;
import com.lmspush.statement.ActivityStatement;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

import java.net.URI;

/**
 * Posts statements to a learning record store's {@code /statements} resource.
 */
public class RecordStoreAdapter extends HttpDestinationAdapter {

    static final String VERSION_HEADER = "X-Experience-API-Version";

    private final String xapiVersion;

    public RecordStoreAdapter(RestClient restClient, String xapiVersion) {
        super(restClient);
        this.xapiVersion = xapiVersion;
    }

    @Override
    public DestinationKind kind() {
        return DestinationKind.RECORD_STORE;
    }

    @Override
    protected String label() {
        return "LRS";
    }

    @Override
    protected URI targetUri(DestinationConfig destination) {
        String endpoint = destination.endpoint();
        while (endpoint.endsWith("/")) {
            endpoint = endpoint.substring(0, endpoint.length() - 1);
        }
        return URI.create(endpoint + "/statements");
    }

    @Override
    protected Object payload(ActivityStatement statement, ContentRecord content) {
        return statement;
    }

    @Override
    protected void addHeaders(HttpHeaders headers) {
        headers.set(VERSION_HEADER, xapiVersion);
    }
}
