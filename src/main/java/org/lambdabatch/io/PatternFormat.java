package org.lambdabatch.io;

import org.lambdabatch.plugin.Pattern;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Text formats a 1-D pattern can be exported to.
 */
public enum PatternFormat {

    /** Fit2D style: title, axis label, intensity label and point count, then two columns. */
    CHI("chi") {
        @Override
        void writeHeader(BufferedWriter out, Path target, Pattern pattern) throws IOException {
            out.write(target.getFileName().toString());
            out.newLine();
            out.write("2-Theta Angle (Degrees)");
            out.newLine();
            out.write("Intensity");
            out.newLine();
            out.write(String.format(Locale.ROOT, "%8d", pattern.size()));
            out.newLine();
        }
    },
    XY("xy") {
        @Override
        void writeHeader(BufferedWriter out, Path target, Pattern pattern) throws IOException {
            out.write("# " + target.getFileName());
            out.newLine();
            out.write("# 2th_deg intensity");
            out.newLine();
        }
    },
    DAT("dat") {
        @Override
        void writeHeader(BufferedWriter out, Path target, Pattern pattern) throws IOException {
            out.write("# " + target.getFileName());
            out.newLine();
            out.write("# points: " + pattern.size());
            out.newLine();
            out.write("# 2th_deg\tintensity");
            out.newLine();
        }
    };

    private final String extension;

    PatternFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    abstract void writeHeader(BufferedWriter out, Path target, Pattern pattern) throws IOException;

    public void write(Pattern pattern, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (BufferedWriter out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writeHeader(out, target, pattern);
            String separator = this == DAT ? "\t" : "  ";
            for (int i = 0; i < pattern.size(); i++) {
                out.write(String.format(Locale.ROOT, "%.8e%s%.8e", pattern.radial()[i], separator, pattern.intensity()[i]));
                out.newLine();
            }
        }
    }

    public static Optional<PatternFormat> fromExtension(String extension) {
        if (extension == null) return Optional.empty();
        String normalized = extension.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) normalized = normalized.substring(1);
        for (PatternFormat format : values()) {
            if (format.extension.equals(normalized)) return Optional.of(format);
        }
        return Optional.empty();
    }
}
