package com.lmspush.destination;

import com.lmspush.content.ContentValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Optional;

/**
 * Destination registration and lookup. Seeds the configured destinations on startup.
 *
 * A destination's rule reference is not checked here: a dangling reference surfaces
 * as a configuration failure on the push that hits it.
 */
@Service
public class DestinationService {

    private static final Logger log = LoggerFactory.getLogger(DestinationService.class);

    private final DestinationRepository repository;

    public DestinationService(DestinationRepository repository, DestinationProperties properties) {
        this.repository = repository;
        for (DestinationProperties.Destination seed : properties.destinations()) {
            register(seed.toConfig());
        }
    }

    public DestinationConfig register(DestinationConfig destination) {
        validate(destination);
        DestinationConfig registered = repository.add(destination);
        log.info("Registered destination {}", registered);
        return registered;
    }

    public Optional<DestinationConfig> find(String name) {
        return repository.findByName(name);
    }

    public List<DestinationConfig> list() {
        return repository.findAll();
    }

    private void validate(DestinationConfig destination) {
        if (destination == null) {
            throw new ContentValidationException("destination definition is required");
        }
        if (destination.name() == null || destination.name().isBlank()) {
            throw new ContentValidationException("destination.name is required");
        }
        if (destination.kind() == null) {
            throw new ContentValidationException("destination.kind is required");
        }
        if (destination.endpoint() == null || destination.endpoint().isBlank()) {
            throw new ContentValidationException("destination.endpoint is required");
        }
        try {
            URI uri = new URI(destination.endpoint());
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new ContentValidationException("destination.endpoint must be an absolute http(s) URL");
            }
        } catch (URISyntaxException ex) {
            throw new ContentValidationException("destination.endpoint is not a valid URL: " + ex.getMessage());
        }
    }
}
