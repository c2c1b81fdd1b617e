package org.calista.clausegraph.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable, key-sorted feature map of a node candidate.
 *
 * Values are booleans, numbers or strings. {@link #flag(String)} uses truthiness: {@code true},
 * any nonzero finite number, or a non-empty string. {@link #number(String)} defaults to 0.
 */
public final class FeatureVector {

    private static final FeatureVector EMPTY = new FeatureVector(Map.of());

    private final Map<String, Object> values;

    private FeatureVector(Map<String, Object> values) {
        this.values = values;
    }

    @JsonCreator
    public static FeatureVector of(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) return EMPTY;
        TreeMap<String, Object> copy = new TreeMap<>();
        for (Map.Entry<String, ?> e : raw.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            Object v = e.getValue();
            if (!(v instanceof Boolean) && !(v instanceof Number) && !(v instanceof String)) {
                throw new IllegalArgumentException("feature '" + e.getKey() + "' must be bool, number or string, got "
                        + v.getClass().getSimpleName());
            }
            copy.put(e.getKey(), v);
        }
        return new FeatureVector(Collections.unmodifiableMap(copy));
    }

    public static FeatureVector empty() {
        return EMPTY;
    }

    public boolean flag(String key) {
        Object v = values.get(key);
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) && d != 0.0;
        }
        if (v instanceof String s) return !s.isEmpty();
        return false;
    }

    public double number(String key) {
        Object v = values.get(key);
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : 0.0;
        }
        if (v instanceof Boolean b) return b ? 1.0 : 0.0;
        return 0.0;
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector other)) return false;
        return values.equals(other.values);
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
