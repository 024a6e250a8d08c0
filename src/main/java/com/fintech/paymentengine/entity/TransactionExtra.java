package com.fintech.paymentengine.entity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Provider continuation state attached to a transaction (session tokens, 3-D-Secure
 * references and the like).
 * <p>
 * Keys are namespaced by the owning gateway ({@code "<namespace>.<key>"}) so that adapters
 * cannot read or overwrite each other's entries. Each adapter documents the keys it uses.
 */
public class TransactionExtra {

    private final Map<String, String> values;

    public TransactionExtra() {
        this.values = new LinkedHashMap<>();
    }

    public TransactionExtra(Map<String, String> values) {
        this.values = new LinkedHashMap<>(values == null ? Map.of() : values);
    }

    public Optional<String> get(String namespace, String key) {
        return Optional.ofNullable(values.get(qualify(namespace, key)));
    }

    public void put(String namespace, String key, String value) {
        if (value == null) {
            values.remove(qualify(namespace, key));
        } else {
            values.put(qualify(namespace, key), value);
        }
    }

    public void putAll(String namespace, Map<String, String> entries) {
        if (entries != null) {
            entries.forEach((key, value) -> put(namespace, key, value));
        }
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    private static String qualify(String namespace, String key) {
        if (namespace == null || namespace.isBlank() || key == null || key.isBlank()) {
            throw new IllegalArgumentException("Extra keys need a namespace and a key");
        }
        return namespace + "." + key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TransactionExtra)) {
            return false;
        }
        return values.equals(((TransactionExtra) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
