package com.lmspush.destination;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;

@Configuration
public class DestinationConfiguration {

    @Bean
    public RestClient deliveryRestClient(RestClient.Builder builder, DeliveryProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(properties.connectTimeout())
            .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.readTimeout());
        return builder.requestFactory(requestFactory).build();
    }

    @Bean
    public RecordStoreAdapter recordStoreAdapter(RestClient deliveryRestClient, DeliveryProperties properties) {
        return new RecordStoreAdapter(deliveryRestClient, properties.xapiVersion());
    }

    @Bean
    public WebhookAdapter webhookAdapter(RestClient deliveryRestClient, Clock clock) {
        return new WebhookAdapter(deliveryRestClient, clock);
    }

    /**
     * One adapter per destination kind. A new kind means a new adapter bean here.
     */
    @Bean
    public DestinationAdapters destinationAdapters(RecordStoreAdapter recordStoreAdapter,
                                                   WebhookAdapter webhookAdapter) {
        return new DestinationAdapters(List.of(recordStoreAdapter, webhookAdapter));
    }
}
