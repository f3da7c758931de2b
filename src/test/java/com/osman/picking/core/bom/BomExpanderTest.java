package com.osman.picking.core.bom;

import com.osman.picking.PickingFixtures;
import com.osman.picking.core.model.BomEntry;
import com.osman.picking.core.model.ShipmentRow;
import com.osman.picking.core.model.UnresolvedReference;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BomExpanderTest {

    private final List<ShipmentRow> shipment = List.of(
        PickingFixtures.shipmentRow(1, "A", "1"),
        PickingFixtures.shipmentRow(2, "KIT", "2"),
        PickingFixtures.shipmentRow(3, "B", "5"));

    @Test
    void emptyTableLeavesRowsUntouched() {
        BomExpansion expansion = new BomExpander().expand(shipment, BomTable.empty());

        assertEquals(shipment, expansion.rows());
        assertTrue(expansion.nested().isEmpty());
    }

    @Test
    void parentIsReplacedInPlaceByItsComponents() {
        BomTable table = BomTable.of(Map.of("KIT", List.of(
            entry("KIT", "P-1", "3", "10"),
            entry("KIT", "P-2", "0.5", "20"))));

        List<ShipmentRow> rows = new BomExpander().expand(shipment, table).rows();

        assertEquals(List.of("A", "P-1", "P-2", "B"), rows.stream().map(ShipmentRow::itemCode).toList());
        assertEquals(List.of("1", "2-1", "2-2", "3"), rows.stream().map(ShipmentRow::displayNumber).toList());
        ShipmentRow first = rows.get(1);
        assertEquals(0, new BigDecimal("6").compareTo(first.quantity()));
        assertEquals("2 × 3", first.lineage().quantityNote());
        assertEquals("KIT", first.lineage().parentItemCode());
        assertEquals("Part P-1", first.lineage().componentName());
        assertEquals(0, BigDecimal.ONE.compareTo(rows.get(2).quantity()));
    }

    @Test
    void keepParentRowPrintsParentBeforeComponents() {
        BomTable table = BomTable.of(Map.of("KIT", List.of(entry("KIT", "P-1", "1", "1"))));

        List<ShipmentRow> rows = new BomExpander(true).expand(shipment, table).rows();

        assertEquals(List.of("A", "KIT", "P-1", "B"), rows.stream().map(ShipmentRow::itemCode).toList());
        assertEquals("2", rows.get(1).displayNumber());
        assertEquals("2-1", rows.get(2).displayNumber());
    }

    @Test
    void nestedAssemblyIsReportedInsteadOfExpanded() {
        BomTable table = BomTable.of(Map.of(
            "KIT", List.of(entry("KIT", "SUB", "1", "1"), entry("KIT", "P-1", "1", "2")),
            "SUB", List.of(entry("SUB", "P-9", "1", "1"))));

        BomExpansion expansion = new BomExpander().expand(shipment, table);

        assertEquals(List.of("A", "P-1", "B"), expansion.rows().stream().map(ShipmentRow::itemCode).toList());
        assertEquals(1, expansion.nested().size());
        UnresolvedReference nested = expansion.nested().get(0);
        assertEquals("SUB", nested.itemCode());
        assertEquals("2-1", nested.displayNumber());
        assertEquals(UnresolvedReference.Reason.NESTED_BOM, nested.reason());
        assertEquals("2-2", expansion.rows().get(1).displayNumber());
    }

    @Test
    void shipmentWithoutParentsIsReturnedAsIs() {
        BomTable table = BomTable.of(Map.of("OTHER", List.of(entry("OTHER", "P-1", "1", "1"))));

        BomExpansion expansion = new BomExpander().expand(shipment, table);

        assertEquals(shipment, expansion.rows());
        assertSame(shipment.get(0), expansion.rows().get(0));
    }

    static BomEntry entry(String parent, String component, String quantity, String sequence) {
        return new BomEntry(parent, component, new BigDecimal(quantity), sequence, "Part " + component, "pcs", "buy");
    }
}
