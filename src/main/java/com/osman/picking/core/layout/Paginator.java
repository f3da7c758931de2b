package com.osman.picking.core.layout;

import com.osman.picking.core.model.Page;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits an ordered row sequence into fixed-capacity pages.
 * <p>
 * Row {@code i} lands on page {@code i / capacity}, slot {@code i % capacity}; only the last page may be
 * partially filled.
 */
public final class Paginator {

    private Paginator() {
    }

    public static <T> List<Page<T>> paginate(List<T> rows, int capacity) {
        Objects.requireNonNull(rows, "rows");
        if (capacity < 1) {
            throw new IllegalArgumentException("Page capacity must be at least 1: " + capacity);
        }
        List<Page<T>> pages = new ArrayList<>(pageCount(rows.size(), capacity));
        for (int start = 0; start < rows.size(); start += capacity) {
            int end = Math.min(start + capacity, rows.size());
            pages.add(new Page<>(pages.size() + 1, capacity, rows.subList(start, end)));
        }
        return pages;
    }

    public static int pageCount(int rowCount, int capacity) {
        return (rowCount + capacity - 1) / capacity;
    }
}
