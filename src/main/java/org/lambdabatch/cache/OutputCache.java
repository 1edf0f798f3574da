package org.lambdabatch.cache;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides per artifact whether an existing output can be reused.
 * <p>
 * Patterns are reused when the file exists. Map companions are reused only when all three exist
 * and their stored shapes match the requested resolution; otherwise the whole group is rewritten.
 * Nothing is cached between calls: every decision reads the filesystem through the inspector.
 */
public class OutputCache {

    private static final Logger LOGGER = Logger.getLogger(OutputCache.class.getName());

    private final ArtifactInspector inspector;

    public OutputCache(ArtifactInspector inspector) {
        this.inspector = Objects.requireNonNull(inspector);
    }

    public Map<ArtifactSpec, OutputDecision> decide(final List<ArtifactSpec> specs, final boolean overwrite) {
        final Map<ArtifactSpec, OutputDecision> decisions = new LinkedHashMap<>();
        final Map<Path, List<ArtifactSpec>> cakeGroups = new LinkedHashMap<>();

        for (ArtifactSpec spec : specs) {
            if (overwrite) {
                decisions.put(spec, OutputDecision.ABSENT);
            } else if (spec.kind().isCake()) {
                decisions.put(spec, null);
                cakeGroups.computeIfAbsent(spec.target().getParent(), k -> new ArrayList<>()).add(spec);
            } else {
                decisions.put(spec, inspector.exists(spec.target()) ? OutputDecision.SKIP : OutputDecision.ABSENT);
            }
        }

        for (List<ArtifactSpec> group : cakeGroups.values()) {
            decideCakeGroup(group, decisions);
        }
        return decisions;
    }

    private void decideCakeGroup(final List<ArtifactSpec> group, final Map<ArtifactSpec, OutputDecision> decisions) {
        boolean groupValid = true;
        for (ArtifactSpec spec : group) {
            OutputDecision d = decideCake(spec);
            decisions.put(spec, d);
            if (d.needsRegeneration()) groupValid = false;
        }
        if (groupValid) return;

        // companions must stay mutually consistent, so a single bad file invalidates the group
        for (ArtifactSpec spec : group) {
            if (decisions.get(spec) == OutputDecision.SKIP) decisions.put(spec, OutputDecision.INVALID);
        }
    }

    private OutputDecision decideCake(final ArtifactSpec spec) {
        if (!inspector.exists(spec.target())) return OutputDecision.ABSENT;
        try {
            int[] actual = inspector.shape(spec.target());
            if (spec.shapeMatches(actual)) return OutputDecision.SKIP;
            LOGGER.info(String.format("Cached %s %s has shape %s, expected %s; regenerating",
                    spec.kind(), spec.target().getFileName(), Arrays.toString(actual), spec.expectedShape()));
            return OutputDecision.INVALID;
        } catch (IOException | RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not inspect cached " + spec.target() + ", regenerating: " + e.getMessage());
            return OutputDecision.INVALID;
        }
    }

    public static boolean allSkip(final Map<ArtifactSpec, OutputDecision> decisions) {
        return !decisions.isEmpty() && decisions.values().stream().noneMatch(OutputDecision::needsRegeneration);
    }
}
