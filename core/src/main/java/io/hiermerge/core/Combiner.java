// file: core/src/main/java/io/hiermerge/core/Combiner.java
package io.hiermerge.core;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Combination driver: normalize, merge, denormalize, strip.
 * <p>
 * Steps:
 *  1) Normalize each fragment's content on its own (keyed lists to mappings).
 *  2) Merge all fragments, most specific first.
 *  3) Denormalize the annotated result, keeping leaf annotations.
 *  4) Strip provenance to get the plain tree.
 * <p>
 * Fail-fast: the first exception from any step propagates and no partial
 * result is produced. Holds only immutable collaborators, so one instance can
 * serve concurrent calls.
 */
public final class Combiner {
    private static final Logger log = Logger.getLogger(Combiner.class.getName());

    private final ListMapNormalizer normalizer;
    private final ProvenanceMerger merger = new ProvenanceMerger();

    public Combiner(PathPatternResolver resolver) {
        this.normalizer = new ListMapNormalizer(Objects.requireNonNull(resolver, "resolver"));
    }

    public CombineResult combine(List<Fragment> fragments) {
        Objects.requireNonNull(fragments, "fragments");

        var normalized = fragments.stream()
                .map(f -> f.withContent(normalizer.normalize(f.content())))
                .toList();

        var outcome = merger.merge(normalized);
        MappingNode annotated = normalizer.denormalize(outcome.tree());
        var plain = ProvenanceStripper.strip(annotated);

        log.info(() -> "Combined %d fragments into %d top-level keys (%d merge events)"
                .formatted(fragments.size(), plain.size(), outcome.events().size()));
        return new CombineResult(plain, annotated, outcome.events());
    }
}
