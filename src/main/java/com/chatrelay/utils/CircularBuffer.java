/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.chatrelay.utils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Thread-safe bounded buffer that keeps the most recent elements.
 *
 * <p>Once the buffer holds {@code capacity} elements, each new element evicts
 * the oldest one. Used by {@link LoggerUtil} to keep a rolling window of the
 * last log lines.
 *
 * @param <T> the type of elements stored in the buffer
 */
public class CircularBuffer<T> {

    private final ArrayDeque<T> elements;
    private final int capacity;

    /**
     * @param capacity maximum number of elements to keep
     * @throws IllegalArgumentException if capacity is less than 1
     */
    public CircularBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(capacity);
    }

    public synchronized void add(T element) {
        if (elements.size() == capacity) {
            elements.pollFirst();
        }
        elements.addLast(element);
    }

    /**
     * Returns the last {@code count} elements, oldest first.
     *
     * @param count number of elements wanted
     * @return up to {@code count} elements
     * @throws IllegalArgumentException if count is negative
     */
    public synchronized List<T> getLast(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count cannot be negative");
        }
        int skip = Math.max(0, elements.size() - count);
        List<T> result = new ArrayList<>(elements.size() - skip);
        Iterator<T> it = elements.iterator();
        for (int i = 0; it.hasNext(); i++) {
            T next = it.next();
            if (i >= skip) {
                result.add(next);
            }
        }
        return result;
    }

    public synchronized List<T> getAll() {
        return new ArrayList<>(elements);
    }

    public synchronized int size() {
        return elements.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized void clear() {
        elements.clear();
    }
}
