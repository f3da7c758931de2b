package com.osman.picking.core.bom;

import com.osman.picking.core.model.BomEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bill of materials grouped by parent item code; each parent's components keep their sequence order.
 */
public final class BomTable {
    private static final BomTable EMPTY = new BomTable(Map.of());

    private final Map<String, List<BomEntry>> componentsByParent;

    BomTable(Map<String, List<BomEntry>> componentsByParent) {
        Map<String, List<BomEntry>> copy = new LinkedHashMap<>();
        componentsByParent.forEach((parent, entries) -> copy.put(parent, List.copyOf(entries)));
        this.componentsByParent = Collections.unmodifiableMap(copy);
    }

    public static BomTable empty() {
        return EMPTY;
    }

    public static BomTable of(Map<String, List<BomEntry>> componentsByParent) {
        return new BomTable(componentsByParent);
    }

    public boolean isEmpty() {
        return componentsByParent.isEmpty();
    }

    public boolean isParent(String itemCode) {
        return componentsByParent.containsKey(itemCode);
    }

    public List<BomEntry> componentsOf(String parentItemCode) {
        return componentsByParent.getOrDefault(parentItemCode, List.of());
    }

    public int parentCount() {
        return componentsByParent.size();
    }
}
