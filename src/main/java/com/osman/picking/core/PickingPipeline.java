package com.osman.picking.core;

import com.osman.picking.config.PipelineConfig;
import com.osman.picking.core.bom.BomExpander;
import com.osman.picking.core.bom.BomExpansion;
import com.osman.picking.core.bom.BomTable;
import com.osman.picking.core.bom.BomTableReader;
import com.osman.picking.core.code.ScannableCodeGenerator;
import com.osman.picking.core.fs.OutputArtifacts;
import com.osman.picking.core.fs.StagedOutputDirectory;
import com.osman.picking.core.join.EnrichmentEngine;
import com.osman.picking.core.join.JoinResult;
import com.osman.picking.core.layout.Paginator;
import com.osman.picking.core.model.ItemMasterRecord;
import com.osman.picking.core.model.Page;
import com.osman.picking.core.model.PickingRow;
import com.osman.picking.core.model.RunReport;
import com.osman.picking.core.model.ShipmentRow;
import com.osman.picking.core.model.UnresolvedReference;
import com.osman.picking.core.pdf.DocumentRenderer;
import com.osman.picking.core.pdf.RenderBackend;
import com.osman.picking.core.pdf.RenderBackends;
import com.osman.picking.core.pdf.RenderOutcome;
import com.osman.picking.core.render.TemplateRenderer;
import com.osman.picking.core.sheet.ColumnSchema;
import com.osman.picking.core.sheet.InputTables;
import com.osman.picking.core.sheet.SheetRow;
import com.osman.picking.core.sheet.SpreadsheetLoader;
import com.osman.picking.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs the picking stages in order: load, expand, join, encode, paginate, lay out, render.
 * <p>
 * Every run starts from fresh state; the pipeline itself only holds configuration and may run repeatedly.
 * Output is staged and published only when the document was rendered, so a failed run leaves the output
 * directory as it was.
 */
public class PickingPipeline {
    private static final Logger LOGGER = AppLogger.get();

    private final PipelineConfig config;
    private final List<RenderBackend> backends;
    private final SpreadsheetLoader loader;

    public PickingPipeline(PipelineConfig config) {
        this(config, RenderBackends.fromConfig(config.render(), config.grid()));
    }

    public PickingPipeline(PipelineConfig config, List<RenderBackend> backends) {
        this(config, backends, new SpreadsheetLoader());
    }

    PickingPipeline(PipelineConfig config, List<RenderBackend> backends, SpreadsheetLoader loader) {
        this.config = Objects.requireNonNull(config, "config");
        this.backends = List.copyOf(backends);
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    public PipelineResult run(PickingRequest request) throws PickingException {
        List<ShipmentRow> shipment = InputTables.toShipmentRows(load(request.shipment(), config.shipmentSchema()));
        Map<String, ItemMasterRecord> master = InputTables.toMasterIndex(load(request.master(), config.masterSchema()));
        BomTable bom = request.bomFile().isPresent()
            ? BomTableReader.read(load(request.bom(), config.bomSchema()))
            : BomTable.empty();
        LOGGER.info(() -> "Loaded %d shipment rows, %d master items, %d BOM parents"
            .formatted(shipment.size(), master.size(), bom.parentCount()));

        BomExpansion expansion = new BomExpander(config.bom().keepParentRow()).expand(shipment, bom);
        if (expansion.rows().size() != shipment.size() || !expansion.nested().isEmpty()) {
            LOGGER.info(() -> "BOM expansion: %d rows -> %d rows".formatted(shipment.size(), expansion.rows().size()));
        }

        JoinResult joined = new EnrichmentEngine().join(expansion.rows(), master);
        List<UnresolvedReference> unresolved = new ArrayList<>(expansion.nested());
        unresolved.addAll(joined.unresolved());
        unresolved.sort(Comparator.comparingInt(UnresolvedReference::sourceRow));
        LOGGER.info(() -> "Joined %d rows, %d unresolved".formatted(joined.rows().size(), unresolved.size()));

        List<Page<PickingRow>> pages = Paginator.paginate(joined.rows(), config.itemsPerPage());
        TemplateRenderer template = new TemplateRenderer(config.grid());
        DocumentRenderer renderer = new DocumentRenderer(backends);

        try (StagedOutputDirectory output = new StagedOutputDirectory(request.outputDirectory())) {
            ScannableCodeGenerator codes = new ScannableCodeGenerator(config.code(), output);
            for (PickingRow row : joined.rows()) {
                codes.attach(row);
            }
            LOGGER.info(() -> "Generated %d code images, %d encoding failures"
                .formatted(codes.artifactCount(), codes.failures().size()));

            Path markup = output.writeMarkup(template.renderDocument(pages));
            LOGGER.info(() -> "Laid out %d pages".formatted(pages.size()));

            RenderOutcome outcome = renderer.render(markup, output.documentTarget());

            int codeFailures = (int) joined.rows().stream().filter(row -> row.codeFailure().isPresent()).count();
            RunReport report = new RunReport(
                joined.rows().size(),
                unresolved.size(),
                codeFailures,
                outcome.backendName(),
                pages.size(),
                codes.artifactCount(),
                unresolved,
                codes.failures(),
                outcome.attempts());
            output.writeReport(report);
            output.commit();
            LOGGER.info(report::summary);

            return new PipelineResult(report, pages, joined.rows(),
                output.canonical(OutputArtifacts.DOCUMENT_FILENAME),
                output.canonical(OutputArtifacts.MARKUP_FILENAME),
                output.canonical(RunReport.DEFAULT_FILENAME),
                outcome);
        } catch (IOException e) {
            throw new PickingException(ErrorKind.INPUT, "Cannot write output to " + request.outputDirectory()
                + ": " + e.getMessage(), e);
        }
    }

    private List<SheetRow> load(Path file, ColumnSchema schema) throws PickingException {
        try {
            return loader.load(file, schema);
        } catch (IOException e) {
            throw new PickingException(ErrorKind.INPUT, "Cannot read %s file %s: %s"
                .formatted(schema.table(), file, e.getMessage()), e);
        }
    }
}
