package com.lmspush.destination;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A configured external endpoint that receives statements, looked up by {@code name}.
 * {@code ruleId} optionally names the filter rule applied to pushes for this destination.
 */
public record DestinationConfig(
    @JsonProperty("name") String name,
    @JsonProperty("kind") @JsonAlias("type") DestinationKind kind,
    @JsonProperty("endpoint") String endpoint,
    @JsonProperty(value = "auth_token", access = JsonProperty.Access.WRITE_ONLY) String authToken,
    @JsonProperty("rule_id") String ruleId
) {

    public boolean hasCredential() {
        return authToken != null && !authToken.isBlank();
    }

    public boolean hasRule() {
        return ruleId != null && !ruleId.isBlank();
    }

    @Override
    public String toString() {
        return "DestinationConfig[name=" + name + ", kind=" + kind + ", endpoint=" + endpoint
            + ", credential=" + (hasCredential() ? "***" : "none") + ", ruleId=" + ruleId + "]";
    }
}
