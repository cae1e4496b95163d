package com.phillippitts.huevoice.service.dispatch;

import com.phillippitts.huevoice.domain.UndoEntry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Bounded LIFO of undo entries; pushing onto a full stack drops the oldest entry.
 *
 * <p>Not thread-safe: only the dispatcher worker touches it.
 */
public class UndoStack {

    private final int capacity;
    private final Deque<UndoEntry> entries = new ArrayDeque<>();

    public UndoStack(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    public void push(UndoEntry entry) {
        entries.addFirst(entry);
        while (entries.size() > capacity) {
            entries.removeLast();
        }
    }

    public Optional<UndoEntry> pop() {
        return Optional.ofNullable(entries.pollFirst());
    }

    public Optional<UndoEntry> peek() {
        return Optional.ofNullable(entries.peekFirst());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
