package org.lambdabatch.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.lambdabatch.io.PatternFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Loads and validates the YAML run configuration.
 */
public class ConfigManager {
    private static final Logger APP_LOGGER = Logger.getLogger(ConfigManager.class.getName());
    public static final Path DEFAULT_CONFIG = Path.of("conf", "config.yaml");
    static AppConfig appConfig;

    static {
        System.setProperty("java.util.logging.SimpleFormatter.format", "[%1$tF %1$tT] [%4$-7s] %3$s - %5$s %6$s%n");
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        Logger rootLogger = Logger.getLogger("");
        for (java.util.logging.Handler h : rootLogger.getHandlers()) {
            rootLogger.removeHandler(h);
        }
        rootLogger.addHandler(handler);
        rootLogger.setLevel(Level.INFO);
    }

    private ConfigManager() {
    }

    public static AppConfig getConfig() throws ConfigurationException {
        if (appConfig == null) {
            appConfig = load(DEFAULT_CONFIG);
        }
        return appConfig;
    }

    public static AppConfig load(Path configPath) throws ConfigurationException {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigurationException("Configuration file not found: " + configPath.toAbsolutePath());
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            AppConfig config = mapper.readValue(configPath.toFile(), AppConfig.class);
            APP_LOGGER.info("Loaded configuration from " + configPath.toAbsolutePath());
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot parse configuration " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static void validate(AppConfig config) throws ConfigurationException {
        if (config.processing() == null) throw new ConfigurationException("Missing 'processing' section");
        validate(config.processing());
        if (config.watchMode()) {
            Path watchDir = config.watch().watchDir();
            if (watchDir == null) throw new ConfigurationException("Watch mode needs 'watch.watchDir'");
            if (!Files.isDirectory(watchDir)) throw new ConfigurationException("Watch directory does not exist: " + watchDir);
            if (config.watch().stabilityWindowMillis() < 0 || config.watch().pollIntervalMillis() <= 0) {
                throw new ConfigurationException("Watch timings must be positive");
            }
        } else if (AppConfig.MODE_BATCH.equals(config.mode())) {
            if (config.inputFiles().isEmpty() && config.inputDir() == null) {
                throw new ConfigurationException("Batch mode needs 'inputFiles' or 'inputDir'");
            }
        } else {
            throw new ConfigurationException("Unknown mode '" + config.mode() + "' (expected batch or watch)");
        }
    }

    /**
     * Checks the settings the batch engine depends on and creates the output directory when absent.
     */
    public static void validate(ProcessingConfig config) throws ConfigurationException {
        Path calibration = config.calibrationFile();
        if (calibration == null) throw new ConfigurationException("Calibration file is required");
        if (!Files.isRegularFile(calibration)) throw new ConfigurationException("Calibration file not found: " + calibration);
        if (!Files.isReadable(calibration)) throw new ConfigurationException("Calibration file is not readable: " + calibration);

        if (config.outputDir() == null) throw new ConfigurationException("Output directory is required");
        if (config.integrationPoints() <= 0) throw new ConfigurationException("integrationPoints must be positive: " + config.integrationPoints());
        if (config.azimuthBins() <= 0) throw new ConfigurationException("azimuthBins must be positive: " + config.azimuthBins());
        if (config.integrationPoints() > ProcessingConfig.MAX_INTEGRATION_POINTS) {
            throw new ConfigurationException("integrationPoints must not exceed " + ProcessingConfig.MAX_INTEGRATION_POINTS + ": " + config.integrationPoints());
        }
        if (config.azimuthBins() > ProcessingConfig.MAX_AZIMUTH_BINS) {
            throw new ConfigurationException("azimuthBins must not exceed " + ProcessingConfig.MAX_AZIMUTH_BINS + ": " + config.azimuthBins());
        }
        if (config.exportCake() && (long) config.azimuthBins() * config.radialPoints2D() > ProcessingConfig.MAX_CAKE_CELLS) {
            throw new ConfigurationException(String.format("2-D map of %d x %d bins is too large",
                    config.azimuthBins(), config.radialPoints2D()));
        }
        if (!config.exportPattern() && !config.exportCake()) throw new ConfigurationException("No export kind enabled");
        patternFormats(config);

        try {
            Files.createDirectories(config.outputDir());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot create output directory " + config.outputDir() + ": " + e.getMessage(), e);
        }
    }

    public static List<PatternFormat> patternFormats(ProcessingConfig config) throws ConfigurationException {
        List<PatternFormat> formats = new ArrayList<>();
        for (String name : config.patternFormats()) {
            PatternFormat format = PatternFormat.fromExtension(name)
                    .orElseThrow(() -> new ConfigurationException("Unknown pattern format: " + name));
            if (!formats.contains(format)) formats.add(format);
        }
        return formats;
    }
}
