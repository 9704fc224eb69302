package com.lmspush.destination;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Adapter lookup table keyed on destination kind, fixed at construction.
 */
public class DestinationAdapters {

    private final Map<DestinationKind, DestinationAdapter> byKind;

    public DestinationAdapters(List<DestinationAdapter> adapters) {
        Map<DestinationKind, DestinationAdapter> table = new EnumMap<>(DestinationKind.class);
        for (DestinationAdapter adapter : adapters) {
            DestinationAdapter previous = table.put(adapter.kind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("more than one adapter registered for destination kind "
                    + adapter.kind().getValue());
            }
        }
        this.byKind = Collections.unmodifiableMap(table);
    }

    public Optional<DestinationAdapter> forKind(DestinationKind kind) {
        return Optional.ofNullable(byKind.get(kind));
    }
}
