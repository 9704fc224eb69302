package com.lmspush.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.lmspush.destination.DestinationConfig;
import com.lmspush.destination.DestinationKind;
import com.lmspush.destination.DestinationService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Destination registration. Credentials are accepted but never echoed back.
 */
@RestController
@RequestMapping("/v1/destinations")
public class DestinationController {

    private final DestinationService destinationService;

    public DestinationController(DestinationService destinationService) {
        this.destinationService = destinationService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public DestinationView register(@RequestBody DestinationConfig destination) {
        return DestinationView.from(destinationService.register(destination));
    }

    @GetMapping
    public List<DestinationView> list() {
        return destinationService.list().stream()
            .map(DestinationView::from)
            .toList();
    }

    public record DestinationView(
        @JsonProperty("name") String name,
        @JsonProperty("kind") DestinationKind kind,
        @JsonProperty("endpoint") String endpoint,
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("has_credential") boolean hasCredential
    ) {

        static DestinationView from(DestinationConfig config) {
            return new DestinationView(config.name(), config.kind(), config.endpoint(),
                config.ruleId(), config.hasCredential());
        }
    }
}
