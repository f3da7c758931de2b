package com.osman.picking.core;

import com.osman.picking.core.model.Page;
import com.osman.picking.core.model.PickingRow;
import com.osman.picking.core.model.RunReport;
import com.osman.picking.core.pdf.RenderOutcome;

import java.nio.file.Path;
import java.util.List;

/**
 * What a successful run produced. Paths point at the published files in the output directory.
 */
public record PipelineResult(RunReport report,
                             List<Page<PickingRow>> pages,
                             List<PickingRow> rows,
                             Path documentPath,
                             Path markupPath,
                             Path reportPath,
                             RenderOutcome outcome) {

    public PipelineResult {
        pages = List.copyOf(pages);
        rows = List.copyOf(rows);
    }
}
