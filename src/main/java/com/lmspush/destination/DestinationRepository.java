package com.lmspush.destination;

import java.util.List;
import java.util.Optional;

public interface DestinationRepository {
    /**
     * @throws DuplicateDestinationException if the name is already registered
     */
    DestinationConfig add(DestinationConfig destination);

    Optional<DestinationConfig> findByName(String name);

    List<DestinationConfig> findAll();
}
