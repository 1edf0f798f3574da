package org.lambdabatch.grouping;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Groups raw detector files into file sets.
 * <p>
 * Untagged files become single-file sets. Module files are bucketed by base identity and only a
 * bucket holding module-1, module-2 and module-3 exactly once becomes a set; any other bucket is
 * dropped with a warning. The result is sorted by base identity (then path), so grouping the same
 * files twice gives the same order.
 */
public final class FileSetGrouper {

    private static final Logger LOGGER = Logger.getLogger(FileSetGrouper.class.getName());

    private static final Comparator<FileSet> SET_ORDER = Comparator
            .comparing(FileSet::baseIdentity)
            .thenComparing(fs -> fs.firstPath().toString());

    private FileSetGrouper() {
    }

    public static GroupingResult groupPaths(final Collection<Path> paths) {
        final Set<RawFile> rawFiles = new LinkedHashSet<>();
        for (Path p : paths) rawFiles.add(RawFile.parse(p));
        return group(rawFiles);
    }

    public static GroupingResult group(final Collection<RawFile> rawFiles) {
        final List<FileSet> sets = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
        final Map<String, List<RawFile>> buckets = new TreeMap<>();
        final Set<Path> seen = new LinkedHashSet<>();

        for (RawFile raw : rawFiles) {
            if (!seen.add(raw.path())) continue;
            if (raw.isModuleFile()) {
                buckets.computeIfAbsent(raw.baseIdentity(), k -> new ArrayList<>()).add(raw);
            } else {
                sets.add(new FileSet(List.of(raw)));
            }
        }

        int multiModule = 0;
        for (Map.Entry<String, List<RawFile>> bucket : buckets.entrySet()) {
            final Map<ModuleTag, List<RawFile>> byTag = new EnumMap<>(ModuleTag.class);
            for (RawFile raw : bucket.getValue()) {
                byTag.computeIfAbsent(raw.moduleTag(), k -> new ArrayList<>()).add(raw);
            }
            final Set<ModuleTag> missing = EnumSet.copyOf(FileSet.allModules());
            missing.removeAll(byTag.keySet());
            final Set<ModuleTag> duplicated = EnumSet.noneOf(ModuleTag.class);
            byTag.forEach((tag, files) -> {
                if (files.size() > 1) duplicated.add(tag);
            });

            if (missing.isEmpty() && duplicated.isEmpty()) {
                sets.add(new FileSet(List.of(
                        byTag.get(ModuleTag.MODULE_1).get(0),
                        byTag.get(ModuleTag.MODULE_2).get(0),
                        byTag.get(ModuleTag.MODULE_3).get(0))));
                multiModule++;
                continue;
            }

            final StringBuilder msg = new StringBuilder("Incomplete multi-module file set for ")
                    .append(bucket.getKey()).append(": ").append(bucket.getValue().size()).append(" file(s)");
            if (!missing.isEmpty()) msg.append(", missing ").append(missing);
            if (!duplicated.isEmpty()) msg.append(", duplicate ").append(duplicated);
            warnings.add(msg.toString());
            LOGGER.warning(msg.toString());
        }

        sets.sort(SET_ORDER);
        LOGGER.info(String.format("Grouped into %d file set(s): %d multi-module, %d single file(s), %d dropped",
                sets.size(), multiModule, sets.size() - multiModule, warnings.size()));
        return new GroupingResult(sets, warnings);
    }
}
