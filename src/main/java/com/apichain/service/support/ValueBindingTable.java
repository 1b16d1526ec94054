package com.apichain.service.support;

import com.apichain.model.OperationKey;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Attribute values observed so far in one sequence run, most recent last.
 * <p>
 * Not thread-safe: every run owns its own table.
 */
public class ValueBindingTable {

    /**
     * A bound value and the operation whose response produced it; {@code source} is {@code null} for seeded values.
     */
    public record Binding(Object value, OperationKey source) {
    }

    private final LinkedHashMap<String, Binding> bindings = new LinkedHashMap<>();

    public void seed(Map<String, Object> values) {
        values.forEach((name, value) -> bind(name, value, null));
    }

    /**
     * Binds {@code name}, replacing any earlier value and making it the most recent binding.
     */
    public void bind(String name, Object value, OperationKey source) {
        bindings.remove(name);
        bindings.put(name, new Binding(value, source));
    }

    public Optional<Binding> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /**
     * Finds the most recent binding whose name matches {@code consumed} under {@link AttributeMatcher} rules.
     */
    public Optional<Binding> lookupLoose(String consumed) {
        Binding exact = bindings.get(consumed);
        if (exact != null) {
            return Optional.of(exact);
        }
        List<Map.Entry<String, Binding>> entries = new ArrayList<>(bindings.entrySet());
        for (int i = entries.size() - 1; i >= 0; i--) {
            Map.Entry<String, Binding> entry = entries.get(i);
            String producerPath = entry.getValue().source() == null ? null : entry.getValue().source().getPath();
            if (AttributeMatcher.matches(entry.getKey(), consumed, producerPath)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> copy = new LinkedHashMap<>();
        bindings.forEach((name, binding) -> copy.put(name, binding.value()));
        return copy;
    }

    public int size() {
        return bindings.size();
    }
}
