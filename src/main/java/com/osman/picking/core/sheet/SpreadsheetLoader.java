package com.osman.picking.core.sheet;

import com.osman.picking.logging.AppLogger;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Reads spreadsheet exports (Excel workbooks or delimited text) into typed rows following a {@link ColumnSchema}.
 */
public class SpreadsheetLoader {
    private static final Logger LOGGER = AppLogger.get();

    /** Exports often carry a title block above the header, so the first few rows are candidates. */
    static final int HEADER_SEARCH_ROWS = 5;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Loads the first sheet of {@code file} and coerces every schema field.
     *
     * @param file   .xlsx, .xlsm, .xls, .csv, .tsv or .txt (tab separated)
     * @param schema expected columns
     * @return data rows in file order
     * @throws IOException          if the file cannot be read
     * @throws SchemaException      if required columns are absent
     * @throws CellParseException   if a cell does not match its declared type
     */
    public List<SheetRow> load(Path file, ColumnSchema schema) throws IOException, SchemaException, CellParseException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, schema.table() + " file not found");
        }
        List<List<String>> grid = readGrid(file);
        int headerIndex = detectHeaderRow(grid, schema);
        List<String> headers = headerIndex < grid.size() ? grid.get(headerIndex) : List.of();
        Map<String, Integer> columns = resolveColumns(headers, schema, file);

        List<SheetRow> rows = new ArrayList<>();
        for (int i = headerIndex + 1; i < grid.size(); i++) {
            List<String> cells = grid.get(i);
            if (isBlank(cells)) {
                continue;
            }
            int rowNumber = i + 1;
            Map<String, Object> values = new LinkedHashMap<>();
            for (ColumnSchema.Field field : schema.fields()) {
                Integer index = columns.get(field.name());
                if (index == null) {
                    continue;
                }
                String raw = cellAt(cells, index);
                values.put(field.name(), coerce(file, rowNumber, headers.get(index), field, raw));
            }
            rows.add(new SheetRow(rowNumber, values));
        }
        LOGGER.fine(() -> "Loaded %d %s rows from %s (header at row %d)"
            .formatted(rows.size(), schema.table(), file.getFileName(), headerIndex + 1));
        return rows;
    }

    /**
     * Normalises a header for comparison: NFKC folding and no whitespace at all.
     */
    public static String normalizeHeader(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = Normalizer.normalize(raw.strip(), Normalizer.Form.NFKC);
        return WHITESPACE.matcher(normalized).replaceAll("");
    }

    static int detectHeaderRow(List<List<String>> grid, ColumnSchema schema) {
        int limit = Math.min(HEADER_SEARCH_ROWS, grid.size());
        for (int i = 0; i < limit; i++) {
            if (containsAnyAlias(grid.get(i), schema.key())) {
                return i;
            }
        }
        for (int i = 0; i < limit; i++) {
            for (ColumnSchema.Field field : schema.fields()) {
                if (containsAnyAlias(grid.get(i), field)) {
                    return i;
                }
            }
        }
        return 0;
    }

    private static boolean containsAnyAlias(List<String> headers, ColumnSchema.Field field) {
        List<String> normalized = headers.stream().map(SpreadsheetLoader::normalizeHeader).toList();
        return field.aliases().stream()
            .map(SpreadsheetLoader::normalizeHeader)
            .anyMatch(normalized::contains);
    }

    private static Map<String, Integer> resolveColumns(List<String> headers, ColumnSchema schema, Path file)
        throws SchemaException {
        Map<String, Integer> headerIndex = new HashMap<>();
        Map<String, Integer> occurrences = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String normalized = normalizeHeader(headers.get(i));
            if (normalized.isEmpty()) {
                continue;
            }
            // repeated headers are addressed as "name.1", "name.2", ...
            int seen = occurrences.merge(normalized, 1, Integer::sum) - 1;
            headerIndex.putIfAbsent(seen == 0 ? normalized : normalized + "." + seen, i);
        }

        Map<String, Integer> columns = new LinkedHashMap<>();
        List<String> missing = new ArrayList<>();
        for (ColumnSchema.Field field : schema.fields()) {
            Integer index = field.aliases().stream()
                .map(alias -> headerIndex.get(normalizeHeader(alias)))
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
            if (index != null) {
                columns.put(field.name(), index);
            } else if (field.required()) {
                missing.add(field.name() + " " + field.aliases());
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaException(schema.table(), file, missing);
        }
        return columns;
    }

    private static Object coerce(Path file, int rowNumber, String header, ColumnSchema.Field field, String raw)
        throws CellParseException {
        if (raw.isEmpty()) {
            if (field.type() == ColumnType.TEXT) {
                return "";
            }
            if (field.required()) {
                throw new CellParseException(file, rowNumber, header, field.type(), raw);
            }
            return null;
        }
        try {
            return field.type().coerce(raw);
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new CellParseException(file, rowNumber, header, field.type(), raw);
        }
    }

    private static List<List<String>> readGrid(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) {
            return readDelimited(file, ',');
        }
        if (name.endsWith(".tsv") || name.endsWith(".txt")) {
            return readDelimited(file, '\t');
        }
        return readWorkbook(file);
    }

    private static List<List<String>> readWorkbook(Path file) throws IOException {
        List<List<String>> grid = new ArrayList<>();
        try (InputStream in = Files.newInputStream(file);
             Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                return grid;
            }
            Sheet sheet = workbook.getSheetAt(0);
            for (int r = 0; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                List<String> cells = new ArrayList<>();
                if (row != null && row.getLastCellNum() > 0) {
                    for (int c = 0; c < row.getLastCellNum(); c++) {
                        cells.add(cellText(row.getCell(c)));
                    }
                }
                grid.add(cells);
            }
        }
        return grid;
    }

    static String cellText(Cell cell) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        return switch (type) {
            case STRING -> cell.getStringCellValue().strip();
            case NUMERIC -> DateUtil.isCellDateFormatted(cell)
                ? cell.getLocalDateTimeCellValue().toLocalDate().toString()
                : BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
            case BOOLEAN -> String.valueOf(cell.getBooleanCellValue());
            default -> "";
        };
    }

    private static List<List<String>> readDelimited(Path file, char delimiter) throws IOException {
        List<List<String>> grid = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            boolean first = true;
            while ((line = reader.readLine()) != null) {
                if (first && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                    line = line.substring(1);
                }
                first = false;
                grid.add(splitLine(line, delimiter));
            }
        }
        return grid;
    }

    static List<String> splitLine(String line, char delimiter) {
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quoted) {
                if (ch == '"' && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else if (ch == '"') {
                    quoted = false;
                } else {
                    current.append(ch);
                }
            } else if (ch == '"' && current.toString().isBlank()) {
                current.setLength(0);
                quoted = true;
            } else if (ch == delimiter) {
                cells.add(current.toString().strip());
                current.setLength(0);
            } else {
                current.append(ch);
            }
        }
        cells.add(current.toString().strip());
        return cells;
    }

    private static String cellAt(List<String> cells, int index) {
        return index < cells.size() && cells.get(index) != null ? cells.get(index) : "";
    }

    private static boolean isBlank(List<String> cells) {
        return cells.stream().allMatch(cell -> cell == null || cell.isBlank());
    }
}
