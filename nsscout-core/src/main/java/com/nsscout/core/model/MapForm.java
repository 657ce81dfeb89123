package com.nsscout.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A map literal {@code {:k v}}. Entries keep source order.
 *
 * @param entries key/value pairs
 */
public record MapForm(Map<Form, Form> entries) implements Form {

    public static final MapForm EMPTY = new MapForm(Map.of());

    public MapForm {
        entries = entries == null || entries.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public Optional<Form> get(Form key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Returns a new map with the entries of {@code other} added, replacing existing keys.
     *
     * @param other entries to merge in
     * @return merged map
     */
    public MapForm merge(MapForm other) {
        if (other.isEmpty()) {
            return this;
        }
        Map<Form, Form> merged = new LinkedHashMap<>(entries);
        merged.putAll(other.entries());
        return new MapForm(merged);
    }

    public MapForm assoc(Form key, Form value) {
        Map<Form, Form> updated = new LinkedHashMap<>(entries);
        updated.put(key, value);
        return new MapForm(updated);
    }

    @Override
    public String toString() {
        return entries.entrySet().stream()
            .map(e -> e.getKey() + " " + e.getValue())
            .collect(Collectors.joining(", ", "{", "}"));
    }
}
