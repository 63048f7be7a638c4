package com.funnelscope.service.core.funnel.aggregate;

import java.util.Arrays;

/** Append-only list of conversion times in seconds. Merging concatenates, so statistics are never averaged twice. */
public final class ConversionTimeSamples {
    private double[] values;
    private int size;

    public ConversionTimeSamples() {
        this.values = new double[8];
    }

    public void add(double seconds) {
        ensureCapacity(size + 1);
        values[size++] = seconds;
    }

    public void addAll(ConversionTimeSamples other) {
        ensureCapacity(size + other.size);
        System.arraycopy(other.values, 0, values, size, other.size);
        size += other.size;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public double get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " of " + size);
        }
        return values[index];
    }

    /** Sum in insertion order. */
    public double sum() {
        double total = 0.0d;
        for (int i = 0; i < size; i++) {
            total += values[i];
        }
        return total;
    }

    public double[] sortedCopy() {
        double[] copy = Arrays.copyOf(values, size);
        Arrays.sort(copy);
        return copy;
    }

    private void ensureCapacity(int required) {
        if (required > values.length) {
            values = Arrays.copyOf(values, Math.max(required, values.length * 2));
        }
    }
}
