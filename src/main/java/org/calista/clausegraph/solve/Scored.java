package org.calista.clausegraph.solve;

import java.util.Objects;

/**
 * Small immutable scored wrapper used while ranking competing candidates.
 */
public final class Scored<T> {
    public final T item;
    public final double score;

    public Scored(T item, double score) {
        this.item = Objects.requireNonNull(item, "item");
        this.score = score;
    }

    public static <T> Scored<T> of(T item, double score) {
        return new Scored<>(item, score);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof Scored<?> s)) return false;
        return Double.doubleToLongBits(score) == Double.doubleToLongBits(s.score) && item.equals(s.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, Double.doubleToLongBits(score));
    }

    @Override
    public String toString() {
        return "Scored{score=" + score + ", item=" + item + '}';
    }
}
