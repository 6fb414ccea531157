// file: core/src/main/java/io/hiermerge/core/CombineResult.java
package io.hiermerge.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of one combination.
 * <p>
 *  - plainTree:     merged configuration, ready for consumption.
 *  - annotatedTree: same structure, every leaf carrying its provenance.
 *  - diagnostics:   merge decisions taken along the way, in order.
 */
public record CombineResult(
        Map<String, Object> plainTree,
        MappingNode annotatedTree,
        List<MergeEvent> diagnostics
) {
    public CombineResult {
        Objects.requireNonNull(plainTree, "plainTree");
        Objects.requireNonNull(annotatedTree, "annotatedTree");
        diagnostics = List.copyOf(diagnostics);
    }
}
