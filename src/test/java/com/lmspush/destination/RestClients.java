package com.lmspush.destination;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestClient;

/**
 * {@link RestClient.Builder}s whose JSON converter writes dates the way the application does
 * (ISO-8601 strings, not epoch numbers).
 */
final class RestClients {

    private RestClients() {
    }

    static RestClient.Builder jsonBuilder() {
        JsonMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
        return RestClient.builder()
            .messageConverters(converters -> converters.replaceAll(converter ->
                converter instanceof MappingJackson2HttpMessageConverter
                    ? new MappingJackson2HttpMessageConverter(mapper)
                    : converter));
    }
}
