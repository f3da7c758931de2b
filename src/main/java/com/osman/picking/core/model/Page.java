package com.osman.picking.core.model;

import java.util.List;

/**
 * One physical sheet: up to {@code capacity} consecutive rows in their original order.
 *
 * @param number   1-based page number
 * @param capacity slots on the sheet
 * @param rows     filled slots, never more than {@code capacity}
 */
public record Page<T>(int number, int capacity, List<T> rows) {

    public Page {
        rows = List.copyOf(rows);
        if (rows.size() > capacity) {
            throw new IllegalArgumentException("Page %d holds %d rows but has %d slots".formatted(number, rows.size(), capacity));
        }
    }

    /**
     * Row in the given slot, or {@code null} for a padding slot.
     */
    public T slot(int index) {
        if (index < 0 || index >= capacity) {
            throw new IndexOutOfBoundsException("Slot " + index + " outside 0.." + (capacity - 1));
        }
        return index < rows.size() ? rows.get(index) : null;
    }

    public int paddingSlots() {
        return capacity - rows.size();
    }
}
