package com.osman.picking.cli;

import com.osman.picking.PickingFixtures;
import com.osman.picking.config.ConfigService;
import com.osman.picking.config.PreferencesStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PickingDocumentToolTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
    private final PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);

    private PreferencesStore preferences;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        preferences = PreferencesStore.forNode("cli-test-" + System.nanoTime());
        configService = ConfigService.using(preferences);
    }

    @AfterEach
    void tearDown() {
        preferences.clear();
    }

    @Test
    void parsesBothOptionForms() {
        Map<String, String> options = PickingDocumentTool.parse(
            new String[]{"--shipment", "s.xlsx", "--master=m.xlsx", "--remember-config"});

        assertEquals("s.xlsx", options.get("--shipment"));
        assertEquals("m.xlsx", options.get("--master"));
        assertEquals("true", options.get("--remember-config"));
    }

    @Test
    void rejectsUnknownAndEmptyOptions() {
        assertThrows(IllegalArgumentException.class, () -> PickingDocumentTool.parse(new String[]{"--pages", "2"}));
        assertThrows(IllegalArgumentException.class, () -> PickingDocumentTool.parse(new String[]{"--out="}));
        assertThrows(IllegalArgumentException.class, () -> PickingDocumentTool.parse(new String[]{"--bom"}));
    }

    @Test
    void missingRequiredInputIsUsageError() {
        int exit = PickingDocumentTool.run(new String[]{"--shipment", "s.xlsx"}, configService, out, err);

        assertEquals(PickingDocumentTool.EXIT_USAGE, exit);
        assertTrue(errText().contains("Usage:"));
    }

    @Test
    void helpPrintsUsage() {
        assertEquals(PickingDocumentTool.EXIT_OK,
            PickingDocumentTool.run(new String[]{"--help"}, configService, out, err));
        assertTrue(outText().contains("--shipment"));
    }

    @Test
    void buildsDocumentAndRemembersConfiguration() throws Exception {
        Path config = batikConfig();
        Path shipment = PickingFixtures.shipment(tempDir.resolve("shipment.xlsx"), List.of("A", "B"));
        Path master = PickingFixtures.master(tempDir.resolve("master.xlsx"), List.of("A", "B"));

        int exit = PickingDocumentTool.run(new String[]{
            "--shipment", shipment.toString(),
            "--master", master.toString(),
            "--config", config.toString(),
            "--remember-config"}, configService, out, err);

        assertEquals(PickingDocumentTool.EXIT_OK, exit, errText());
        Path document = tempDir.resolve("picking-output").resolve("picking.pdf");
        assertTrue(Files.isRegularFile(document));
        assertTrue(outText().contains("2 processed / 0 excluded"));
        assertTrue(outText().contains("Document: " + document.toAbsolutePath()));
        assertEquals(config.toAbsolutePath(), configService.configuredPath().orElseThrow());
    }

    @Test
    void pipelineFailureReportsKindAndExitsWithFailure() throws Exception {
        Path config = batikConfig();
        Path master = PickingFixtures.master(tempDir.resolve("master.xlsx"), List.of("A"));

        int exit = PickingDocumentTool.run(new String[]{
            "--shipment", tempDir.resolve("absent.xlsx").toString(),
            "--master", master.toString(),
            "--out", tempDir.resolve("out").toString(),
            "--config", config.toString()}, configService, out, err);

        assertEquals(PickingDocumentTool.EXIT_FAILURE, exit);
        assertTrue(errText().startsWith("INPUT: "), errText());
        assertFalse(Files.exists(tempDir.resolve("out")));
    }

    @Test
    void malformedConfigurationIsUsageError() throws Exception {
        Path config = tempDir.resolve("broken.json");
        Files.writeString(config, "{ not json");

        int exit = PickingDocumentTool.run(new String[]{
            "--shipment", "s.xlsx", "--master", "m.xlsx", "--config", config.toString()}, configService, out, err);

        assertEquals(PickingDocumentTool.EXIT_USAGE, exit);
        assertTrue(errText().contains("Invalid configuration"));
    }

    @Test
    void unknownBackendIsUsageError() throws Exception {
        Path config = tempDir.resolve("picking.json");
        Files.writeString(config, "{\"render\": {\"backends\": [\"princexml\"]}}");

        int exit = PickingDocumentTool.run(new String[]{
            "--shipment", "s.xlsx", "--master", "m.xlsx", "--config", config.toString()}, configService, out, err);

        assertEquals(PickingDocumentTool.EXIT_USAGE, exit);
        assertTrue(errText().contains("Unknown rendering backend 'princexml'"), errText());
    }

    @Test
    void fontDirectoryOptionIsUsedAndRemembered() throws Exception {
        Path config = batikConfig();
        Path fonts = tempDir.resolve("no-fonts");
        Path shipment = PickingFixtures.shipment(tempDir.resolve("shipment.xlsx"), List.of("A"));
        Path master = PickingFixtures.master(tempDir.resolve("master.xlsx"), List.of("A"));

        int exit = PickingDocumentTool.run(new String[]{
            "--shipment", shipment.toString(),
            "--master", master.toString(),
            "--out", tempDir.resolve("out").toString(),
            "--config", config.toString(),
            "--font-dir", fonts.toString(),
            "--remember-config"}, configService, out, err);

        assertEquals(PickingDocumentTool.EXIT_FAILURE, exit);
        assertTrue(errText().startsWith("RENDER: "), errText());
        assertTrue(errText().contains("batik: unavailable"), errText());
        assertEquals(fonts.toAbsolutePath(), preferences.getPath("font.dir").orElseThrow());
    }

    @Test
    void defaultOutputSitsNextToShipment() {
        Path shipment = tempDir.resolve("exports").resolve("shipment.xlsx");

        assertEquals(tempDir.resolve("exports").resolve("picking-output").toAbsolutePath(),
            PickingDocumentTool.defaultOutputDirectory(shipment));
    }

    private Path batikConfig() throws Exception {
        Path config = tempDir.resolve("picking.json");
        Files.writeString(config, "{\"render\": {\"backends\": [\"batik\"], \"dpi\": 100}}");
        return config;
    }

    private String outText() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String errText() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }
}
