package com.lmspush.destination;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryDestinationRepository implements DestinationRepository {

    private final ConcurrentHashMap<String, DestinationConfig> byName = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> registrationOrder = new CopyOnWriteArrayList<>();

    @Override
    public DestinationConfig add(DestinationConfig destination) {
        if (byName.putIfAbsent(destination.name(), destination) != null) {
            throw new DuplicateDestinationException(destination.name());
        }
        registrationOrder.add(destination.name());
        return destination;
    }

    @Override
    public Optional<DestinationConfig> findByName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byName.get(name));
    }

    @Override
    public List<DestinationConfig> findAll() {
        List<DestinationConfig> all = new ArrayList<>();
        for (String name : registrationOrder) {
            DestinationConfig destination = byName.get(name);
            if (destination != null) {
                all.add(destination);
            }
        }
        return all;
    }
}
