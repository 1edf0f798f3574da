package org.lambdabatch.grouping;

import java.util.List;

public record GroupingResult(List<FileSet> fileSets, List<String> warnings) {

    public GroupingResult {
        fileSets = List.copyOf(fileSets);
        warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() {
        return fileSets.isEmpty();
    }
}
