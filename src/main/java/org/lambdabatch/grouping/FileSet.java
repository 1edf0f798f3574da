package org.lambdabatch.grouping;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * One logical acquisition: a single untagged file, or the three module files of a multi-module
 * detector ordered module-1, module-2, module-3.
 */
public record FileSet(List<RawFile> members) {

    private static final Set<ModuleTag> ALL_MODULES = EnumSet.of(ModuleTag.MODULE_1, ModuleTag.MODULE_2, ModuleTag.MODULE_3);

    public FileSet {
        members = List.copyOf(members);
        if (members.size() == 1) {
            if (members.get(0).moduleTag() != ModuleTag.NONE) {
                throw new IllegalArgumentException("Single-file set must be untagged: " + members.get(0).path());
            }
        } else if (members.size() == 3) {
            for (int i = 0; i < 3; i++) {
                RawFile member = members.get(i);
                if (member.moduleTag() != ModuleTag.ofIndex(i + 1)) {
                    throw new IllegalArgumentException("Multi-module set must be ordered module-1..3, got " + member.moduleTag() + " at " + i);
                }
                if (!member.baseIdentity().equals(members.get(0).baseIdentity())) {
                    throw new IllegalArgumentException("Module files do not share a base identity: " + member.path());
                }
            }
        } else {
            throw new IllegalArgumentException("A file set has 1 or 3 members, got " + members.size());
        }
    }

    public static FileSet single(Path path) {
        return new FileSet(List.of(RawFile.parse(path)));
    }

    public static Set<ModuleTag> allModules() {
        return ALL_MODULES;
    }

    public int arity() {
        return members.size();
    }

    public boolean isMultiModule() {
        return members.size() == 3;
    }

    public String baseIdentity() {
        return members.get(0).baseIdentity();
    }

    /** Base name shared by every output artifact derived from this set. */
    public String outputName() {
        return members.get(0).baseName();
    }

    public List<Path> paths() {
        return members.stream().map(RawFile::path).toList();
    }

    public Path firstPath() {
        return members.get(0).path();
    }
}
