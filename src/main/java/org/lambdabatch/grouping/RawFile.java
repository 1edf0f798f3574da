package org.lambdabatch.grouping;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A detector file with its module tag and base identity parsed from the file name.
 * <p>
 * {@code run_m2_part0.nxs} has tag {@link ModuleTag#MODULE_2} and base {@code run};
 * {@code run.h5} has tag {@link ModuleTag#NONE} and base {@code run}. The base identity keeps the
 * parent directory so equally named acquisitions in different folders never merge.
 */
public record RawFile(Path path, ModuleTag moduleTag, String baseIdentity) {

    private static final Pattern MODULE_SUFFIX = Pattern.compile("^(.*)_m([1-3])(_part\\d+)?\\.[^.]+$");

    public RawFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(moduleTag, "moduleTag");
        Objects.requireNonNull(baseIdentity, "baseIdentity");
    }

    public static RawFile parse(Path path) {
        String fileName = path.getFileName().toString();
        Path parent = path.getParent();
        Matcher m = MODULE_SUFFIX.matcher(fileName);
        if (m.matches()) {
            String base = m.group(1);
            return new RawFile(path, ModuleTag.ofIndex(Integer.parseInt(m.group(2))), withParent(parent, base));
        }
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        return new RawFile(path, ModuleTag.NONE, withParent(parent, base));
    }

    private static String withParent(Path parent, String base) {
        return parent == null ? base : parent.resolve(base).toString();
    }

    /** File-name part of the base identity, used to name output artifacts. */
    public String baseName() {
        return Path.of(baseIdentity).getFileName().toString();
    }

    public boolean isModuleFile() {
        return moduleTag != ModuleTag.NONE;
    }
}
