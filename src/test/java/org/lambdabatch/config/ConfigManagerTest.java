package org.lambdabatch.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lambdabatch.io.PatternFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigManagerTest {

    @TempDir
    Path tempDir;

    private Path resource(String name) throws Exception {
        return Path.of(ConfigManagerTest.class.getResource("/" + name).toURI());
    }

    private ProcessingConfig processing(Path calibration, Integer points, List<String> formats, Boolean pattern, Boolean cake) {
        return new ProcessingConfig(calibration, tempDir.resolve("out"), null, points, 36, formats, pattern, cake,
                null, null, null);
    }

    @Test
    void testLoad_bindsYamlAndAppliesDefaults() throws Exception {
        AppConfig config = ConfigManager.load(resource("test-config.yaml"));

        assertTrue(config.watchMode());
        assertEquals(AppConfig.DEFAULT_ENGINE, config.integrationEngine());
        assertTrue(config.inputFiles().isEmpty());

        ProcessingConfig processing = config.processing();
        assertEquals(Path.of("calibration.poni"), processing.calibrationFile());
        assertEquals(500, processing.integrationPoints());
        assertEquals(1000, processing.radialPoints2D());
        assertEquals(90, processing.azimuthBins());
        assertEquals(List.of("chi", "xy"), processing.patternFormats());
        assertTrue(processing.exportPattern());
        assertFalse(processing.exportCake());
        assertTrue(processing.applyMaskToPattern());
        assertFalse(processing.applyMaskToCake());
        assertFalse(processing.overwrite());

        WatchConfig watch = config.watch();
        assertEquals(Path.of("raw"), watch.watchDir());
        assertEquals(1500L, watch.stabilityWindowMillis());
        assertEquals(1000L, watch.pollIntervalMillis());
        assertEquals(WatchConfig.DEFAULT_FILE_PATTERN, watch.filePattern());
        assertTrue(watch.recursive());
    }

    @Test
    void testLoad_missingFile() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> ConfigManager.load(tempDir.resolve("none.yaml")));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void testLoad_malformedYaml() throws IOException {
        Path bad = Files.writeString(tempDir.resolve("bad.yaml"), "mode: batch\nprocessing: {calibrationFile: [unterminated\n");
        assertThrows(ConfigurationException.class, () -> ConfigManager.load(bad));
    }

    @Test
    void testProcessingConfig_defaults() {
        ProcessingConfig config = new ProcessingConfig(null, null, null, null, null, null, null, null, null, null, null);

        assertEquals(4857, config.integrationPoints());
        assertEquals(9714, config.radialPoints2D());
        assertEquals(360, config.azimuthBins());
        assertEquals(List.of("chi"), config.patternFormats());
        assertTrue(config.exportPattern());
        assertTrue(config.exportCake());
    }

    @Test
    void testValidate_createsOutputDirectory() throws Exception {
        Path calibration = Files.writeString(tempDir.resolve("cal.poni"), "Distance: 0.2\n");
        ProcessingConfig config = processing(calibration, 100, List.of("chi"), null, null);

        ConfigManager.validate(config);

        assertTrue(Files.isDirectory(tempDir.resolve("out")));
    }

    @Test
    void testValidate_rejectsBadProcessingSettings() throws Exception {
        Path calibration = Files.writeString(tempDir.resolve("cal.poni"), "Distance: 0.2\n");

        assertThrows(ConfigurationException.class, () -> ConfigManager.validate(processing(tempDir.resolve("missing.poni"), 100, null, null, null)));
        assertThrows(ConfigurationException.class, () -> ConfigManager.validate(processing(null, 100, null, null, null)));
        assertThrows(ConfigurationException.class, () -> ConfigManager.validate(processing(calibration, 0, null, null, null)));
        assertThrows(ConfigurationException.class, () -> ConfigManager.validate(processing(calibration, 100, List.of("tiff"), null, null)));
        assertThrows(ConfigurationException.class, () -> ConfigManager.validate(processing(calibration, 100, null, false, false)));
    }

    @Test
    void testValidate_rejectsOversizedResolution() throws Exception {
        Path calibration = Files.writeString(tempDir.resolve("cal.poni"), "Distance: 0.2\n");

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigManager.validate(processing(calibration, (1 << 30) + 1, null, null, null)));
        assertTrue(e.getMessage().contains("integrationPoints"));
        assertThrows(ConfigurationException.class,
                () -> ConfigManager.validate(processing(calibration, Integer.MAX_VALUE, null, true, false)));

        ProcessingConfig largest = new ProcessingConfig(calibration, tempDir.resolve("out"), null,
                ProcessingConfig.MAX_INTEGRATION_POINTS, ProcessingConfig.MAX_AZIMUTH_BINS, null, null, null, null, null, null);
        ConfigurationException tooBig = assertThrows(ConfigurationException.class, () -> ConfigManager.validate(largest));
        assertTrue(tooBig.getMessage().contains("too large"));

        ConfigManager.validate(processing(calibration, ProcessingConfig.MAX_INTEGRATION_POINTS, null, true, false));
    }

    @Test
    void testValidate_modeRequirements() throws Exception {
        Path calibration = Files.writeString(tempDir.resolve("cal.poni"), "Distance: 0.2\n");
        ProcessingConfig processing = processing(calibration, 100, null, null, null);

        AppConfig batchWithoutInput = new AppConfig("batch", null, null, null, processing, null);
        assertThrows(ConfigurationException.class, () -> ConfigManager.validate(batchWithoutInput));

        AppConfig watchWithoutDir = new AppConfig("watch", null, null, null, processing, null);
        assertThrows(ConfigurationException.class, () -> ConfigManager.validate(watchWithoutDir));

        AppConfig unknownMode = new AppConfig("stream", tempDir, null, null, processing, null);
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> ConfigManager.validate(unknownMode));
        assertTrue(e.getMessage().contains("stream"));

        AppConfig noProcessing = new AppConfig(null, tempDir, null, null, null, null);
        assertThrows(ConfigurationException.class, () -> ConfigManager.validate(noProcessing));

        ConfigManager.validate(new AppConfig(" Batch ", tempDir, null, null, processing, null));
        ConfigManager.validate(new AppConfig("watch", null, null, null, processing,
                new WatchConfig(tempDir, null, null, null, false)));
    }

    @Test
    void testPatternFormats_deduplicatesInOrder() throws Exception {
        ProcessingConfig config = processing(null, 100, List.of("xy", "chi", ".XY", "dat"), null, null);

        assertEquals(List.of(PatternFormat.XY, PatternFormat.CHI, PatternFormat.DAT), ConfigManager.patternFormats(config));
    }
}
