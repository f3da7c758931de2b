package com.osman.picking.config;

import com.osman.picking.core.code.CodeFormat;
import com.osman.picking.core.sheet.ColumnSchema;
import com.osman.picking.core.sheet.ColumnSchema.Field;
import com.osman.picking.core.sheet.ColumnType;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.osman.picking.core.sheet.InputFields.CLIENT_CODE;
import static com.osman.picking.core.sheet.InputFields.COMPONENT_ITEM_CODE;
import static com.osman.picking.core.sheet.InputFields.COMPONENT_NAME;
import static com.osman.picking.core.sheet.InputFields.COMPONENT_TYPE;
import static com.osman.picking.core.sheet.InputFields.DESCRIPTION;
import static com.osman.picking.core.sheet.InputFields.ITEM_CODE;
import static com.osman.picking.core.sheet.InputFields.ITEM_TYPE;
import static com.osman.picking.core.sheet.InputFields.LOCATION;
import static com.osman.picking.core.sheet.InputFields.NOTICE;
import static com.osman.picking.core.sheet.InputFields.ORDER_NUMBER;
import static com.osman.picking.core.sheet.InputFields.PARENT_ITEM_CODE;
import static com.osman.picking.core.sheet.InputFields.QUANTITY;
import static com.osman.picking.core.sheet.InputFields.QUANTITY_PER_PARENT;
import static com.osman.picking.core.sheet.InputFields.SEQUENCE;
import static com.osman.picking.core.sheet.InputFields.SHIP_DATE;
import static com.osman.picking.core.sheet.InputFields.UNIT;

/**
 * Immutable pipeline configuration: input table layouts, BOM handling, code symbology, sheet grid and
 * rendering backends. Keys missing from a JSON file keep their defaults.
 */
public record PipelineConfig(int itemsPerPage,
                             ColumnSchema shipmentSchema,
                             ColumnSchema masterSchema,
                             ColumnSchema bomSchema,
                             BomOptions bom,
                             CodeOptions code,
                             GridSpec grid,
                             RenderOptions render) {

    public static final String BUNDLED_RESOURCE = "picking-config.json";

    public PipelineConfig {
        if (itemsPerPage < 1) {
            throw new IllegalArgumentException("itemsPerPage must be at least 1: " + itemsPerPage);
        }
        if (grid.slotsPerPage() != itemsPerPage) {
            throw new IllegalArgumentException("itemsPerPage (%d) differs from grid slotsPerPage (%d)"
                .formatted(itemsPerPage, grid.slotsPerPage()));
        }
    }

    /**
     * Built-in configuration without reading any file.
     */
    public static PipelineConfig builtIn() {
        return new PipelineConfig(6, defaultShipmentSchema(), defaultMasterSchema(), defaultBomSchema(),
            BomOptions.defaults(), CodeOptions.defaults(), GridSpec.defaults(), RenderOptions.defaults());
    }

    /**
     * Configuration bundled on the classpath, falling back to {@link #builtIn()} when the resource is absent.
     */
    public static PipelineConfig bundled() throws IOException {
        try (InputStream stream = PipelineConfig.class.getClassLoader().getResourceAsStream(BUNDLED_RESOURCE)) {
            if (stream == null) {
                return builtIn();
            }
            return parse(new String(stream.readAllBytes(), StandardCharsets.UTF_8), BUNDLED_RESOURCE);
        }
    }

    public static PipelineConfig load(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8), path.toString());
    }

    static PipelineConfig parse(String content, String source) throws IOException {
        try {
            return fromJson(new JSONObject(content));
        } catch (JSONException | IllegalArgumentException ex) {
            throw new IOException("Invalid configuration " + source + ": " + ex.getMessage(), ex);
        }
    }

    public static PipelineConfig fromJson(JSONObject root) {
        PipelineConfig base = builtIn();
        int itemsPerPage = root.optInt("itemsPerPage", base.itemsPerPage());

        JSONObject tables = root.optJSONObject("tables");
        ColumnSchema shipment = base.shipmentSchema();
        ColumnSchema master = base.masterSchema();
        ColumnSchema bomSchema = base.bomSchema();
        if (tables != null) {
            shipment = mergeSchema(shipment, tables.optJSONObject("shipment"));
            master = mergeSchema(master, tables.optJSONObject("master"));
            bomSchema = mergeSchema(bomSchema, tables.optJSONObject("bom"));
        }

        JSONObject bomObj = root.optJSONObject("bom");
        BomOptions bom = bomObj == null
            ? base.bom()
            : new BomOptions(bomObj.optBoolean("keepParentRow", base.bom().keepParentRow()));

        JSONObject codeObj = root.optJSONObject("code");
        CodeOptions code = base.code();
        if (codeObj != null) {
            code = new CodeOptions(
                CodeFormat.fromConfig(codeObj.optString("format", code.format().configName())),
                codeObj.optInt("sizePx", code.sizePx()),
                codeObj.optString("charset", code.charset()));
        }

        GridSpec grid = parseGrid(root.optJSONObject("grid"), itemsPerPage);

        JSONObject renderObj = root.optJSONObject("render");
        RenderOptions render = base.render();
        if (renderObj != null) {
            List<String> backends = render.backends();
            JSONArray backendArray = renderObj.optJSONArray("backends");
            if (backendArray != null) {
                backends = new ArrayList<>();
                for (int i = 0; i < backendArray.length(); i++) {
                    backends.add(backendArray.getString(i).trim().toLowerCase(Locale.ROOT));
                }
            }
            render = new RenderOptions(
                backends,
                renderObj.optString("wkhtmltopdf", render.wkhtmltopdf()),
                renderObj.optLong("timeoutSeconds", render.timeoutSeconds()),
                renderObj.optString("fontDir", render.fontDirectory()),
                renderObj.optInt("dpi", render.dpi()));
        }

        return new PipelineConfig(itemsPerPage, shipment, master, bomSchema, bom, code, grid, render);
    }

    private static GridSpec parseGrid(JSONObject gridObj, int itemsPerPage) {
        GridSpec defaults = GridSpec.defaults();
        if (gridObj == null) {
            if (itemsPerPage == defaults.slotsPerPage()) {
                return defaults;
            }
            return new GridSpec(itemsPerPage, defaults.sheetWidthMm(), defaults.sheetHeightMm(),
                GridSpec.evenSlotHeight(defaults.sheetHeightMm(), itemsPerPage), defaults.printerMarginMm(),
                defaults.slotPaddingMm(), defaults.codeSizeMm(), defaults.labelFontPx(), defaults.headerFontPx(),
                defaults.codePosition());
        }
        int slots = gridObj.optInt("slotsPerPage", itemsPerPage);
        double sheetHeight = gridObj.optDouble("sheetHeightMm", defaults.sheetHeightMm());
        return new GridSpec(
            slots,
            gridObj.optDouble("sheetWidthMm", defaults.sheetWidthMm()),
            sheetHeight,
            gridObj.optDouble("slotHeightMm", GridSpec.evenSlotHeight(sheetHeight, slots)),
            gridObj.optDouble("printerMarginMm", defaults.printerMarginMm()),
            gridObj.optDouble("slotPaddingMm", defaults.slotPaddingMm()),
            gridObj.optDouble("codeSizeMm", defaults.codeSizeMm()),
            gridObj.optDouble("fontSizeLabelPx", defaults.labelFontPx()),
            gridObj.optDouble("fontSizeHeaderPx", defaults.headerFontPx()),
            GridSpec.CodePosition.fromConfig(gridObj.optString("codePosition", defaults.codePosition().configName())));
    }

    private static ColumnSchema mergeSchema(ColumnSchema base, JSONObject tableObj) {
        if (tableObj == null) {
            return base;
        }
        ColumnSchema merged = base;
        JSONObject fields = tableObj.optJSONObject("fields");
        if (fields != null) {
            for (String name : fields.keySet()) {
                JSONObject fieldObj = fields.getJSONObject(name);
                Field existing = merged.field(name);
                ColumnType type = fieldObj.has("type")
                    ? ColumnType.valueOf(fieldObj.getString("type").trim().toUpperCase(Locale.ROOT))
                    : existing != null ? existing.type() : ColumnType.TEXT;
                boolean required = fieldObj.optBoolean("required", existing != null && existing.required());
                List<String> aliases = new ArrayList<>();
                JSONArray columns = fieldObj.optJSONArray("columns");
                if (columns != null) {
                    for (int i = 0; i < columns.length(); i++) {
                        aliases.add(columns.getString(i));
                    }
                } else if (fieldObj.has("columns")) {
                    aliases.add(fieldObj.getString("columns"));
                } else if (existing != null) {
                    aliases.addAll(existing.aliases());
                }
                merged = merged.with(new Field(name, type, required, aliases));
            }
        }
        String key = tableObj.optString("key", merged.keyField());
        return new ColumnSchema(merged.table(), key, merged.fields());
    }

    static ColumnSchema defaultShipmentSchema() {
        return new ColumnSchema("shipment", ITEM_CODE, List.of(
            Field.required(ITEM_CODE, ColumnType.TEXT, "item_code", "Item Code", "品目コード"),
            Field.required(QUANTITY, ColumnType.DECIMAL, "quantity", "Quantity", "出荷数量"),
            Field.required(CLIENT_CODE, ColumnType.TEXT, "destination", "client_code", "Client", "客先略号"),
            Field.optional(SHIP_DATE, ColumnType.TEXT, "ship_date", "Ship Date", "出荷予定日"),
            Field.optional(ORDER_NUMBER, ColumnType.TEXT, "order_number", "Order No", "得意先発注番号"),
            Field.optional(LOCATION, ColumnType.TEXT, "location", "Location", "保管場所"),
            Field.optional(NOTICE, ColumnType.TEXT, "notice", "Notes", "備考"),
            Field.optional(ITEM_TYPE, ColumnType.TEXT, "item_type", "Item Type", "品目種別")));
    }

    static ColumnSchema defaultMasterSchema() {
        return new ColumnSchema("item master", ITEM_CODE, List.of(
            Field.required(ITEM_CODE, ColumnType.TEXT, "item_code", "Item Code", "品目コード"),
            Field.required(DESCRIPTION, ColumnType.TEXT, "description", "Description", "品目テキストマスタ", "品目テキスト"),
            Field.required(UNIT, ColumnType.TEXT, "unit", "Unit", "単位", "基本数量単位"),
            Field.optional(LOCATION, ColumnType.TEXT, "location", "Picking Location", "ピッキング可能ロケ地"),
            Field.optional(ITEM_TYPE, ColumnType.TEXT, "item_type", "Item Type", "品目種別"),
            Field.optional(ORDER_NUMBER, ColumnType.TEXT, "order_number", "Order No", "得意先発注番号"),
            Field.optional(NOTICE, ColumnType.TEXT, "notice", "Notes", "備考")));
    }

    static ColumnSchema defaultBomSchema() {
        return new ColumnSchema("bom", PARENT_ITEM_CODE, List.of(
            Field.required(PARENT_ITEM_CODE, ColumnType.TEXT, "parent_item_code", "★◎製造工程品目コード"),
            Field.required(COMPONENT_ITEM_CODE, ColumnType.TEXT, "component_item_code", "★◎製造工程品目コード.1"),
            Field.required(QUANTITY_PER_PARENT, ColumnType.DECIMAL, "quantity_per_parent", "★○数量"),
            Field.optional(SEQUENCE, ColumnType.TEXT, "sequence", "★◎明細番号"),
            Field.optional(COMPONENT_NAME, ColumnType.TEXT, "component_name", "製造品目テキスト.1"),
            Field.optional(UNIT, ColumnType.TEXT, "unit", "構成品目数量単位"),
            Field.optional(COMPONENT_TYPE, ColumnType.TEXT, "component_type", "調達タイプ")));
    }

    /**
     * @param keepParentRow keep the shipment line in front of its components instead of replacing it
     */
    public record BomOptions(boolean keepParentRow) {
        public static BomOptions defaults() {
            return new BomOptions(false);
        }
    }

    /**
     * @param format  symbology
     * @param sizePx  edge of a QR image, height of a Code 128 image
     * @param charset character set item codes are encoded in (QR only)
     */
    public record CodeOptions(CodeFormat format, int sizePx, String charset) {
        public CodeOptions {
            if (sizePx < 32) {
                throw new IllegalArgumentException("Code image size below 32 px: " + sizePx);
            }
            if (charset == null || charset.isBlank()) {
                charset = StandardCharsets.UTF_8.name();
            }
        }

        public static CodeOptions defaults() {
            return new CodeOptions(CodeFormat.QR_CODE, 240, StandardCharsets.UTF_8.name());
        }
    }

    /**
     * @param backends       backend names in priority order
     * @param wkhtmltopdf    executable name or absolute path
     * @param timeoutSeconds upper bound for one external rendering process
     * @param fontDirectory  folder of .ttf/.otf/.ttc faces registered for the in-process renderer, empty for
     *                       system fonts only
     * @param dpi            raster resolution of the in-process renderer
     */
    public record RenderOptions(List<String> backends,
                                String wkhtmltopdf,
                                long timeoutSeconds,
                                String fontDirectory,
                                int dpi) {
        public static final int DEFAULT_DPI = 300;

        public RenderOptions {
            backends = List.copyOf(backends);
            if (backends.isEmpty()) {
                throw new IllegalArgumentException("At least one rendering backend must be configured");
            }
            if (timeoutSeconds <= 0) {
                throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
            }
            if (dpi < 72 || dpi > 1200) {
                throw new IllegalArgumentException("dpi must be between 72 and 1200: " + dpi);
            }
            wkhtmltopdf = wkhtmltopdf == null || wkhtmltopdf.isBlank() ? "wkhtmltopdf" : wkhtmltopdf.trim();
            fontDirectory = fontDirectory == null ? "" : fontDirectory.trim();
        }

        public static RenderOptions defaults() {
            return new RenderOptions(List.of("wkhtmltopdf", "batik"), "wkhtmltopdf", 120, "", DEFAULT_DPI);
        }

        public RenderOptions withWkhtmltopdf(String executable) {
            return new RenderOptions(backends, executable, timeoutSeconds, fontDirectory, dpi);
        }

        public RenderOptions withFontDirectory(String directory) {
            return new RenderOptions(backends, wkhtmltopdf, timeoutSeconds, directory, dpi);
        }

        public RenderOptions withBackends(List<String> names) {
            return new RenderOptions(names, wkhtmltopdf, timeoutSeconds, fontDirectory, dpi);
        }
    }

    public PipelineConfig withRender(RenderOptions options) {
        return new PipelineConfig(itemsPerPage, shipmentSchema, masterSchema, bomSchema, bom, code, grid, options);
    }
}
