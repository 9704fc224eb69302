package com.lmspush.destination;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Destinations registered at startup ({@code lmspush.destinations[*]}).
 */
@ConfigurationProperties(prefix = "lmspush")
public record DestinationProperties(List<Destination> destinations) {

    public DestinationProperties {
        destinations = destinations == null ? List.of() : List.copyOf(destinations);
    }

    public record Destination(
        String name,
        DestinationKind kind,
        String endpoint,
        String authToken,
        String ruleId
    ) {

        DestinationConfig toConfig() {
            return new DestinationConfig(name, kind, endpoint, authToken, ruleId);
        }
    }
}
