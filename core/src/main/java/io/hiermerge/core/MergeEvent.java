// file: core/src/main/java/io/hiermerge/core/MergeEvent.java
package io.hiermerge.core;

/**
 * One merge decision worth reporting. Collected per call and returned with
 * the result, never accumulated globally.
 * <p>
 * Kinds:
 *  - SHADOWED:        the incoming value lost to the value already in place.
 *  - WEIGHT_OVERRIDE: a broader fragment replaced an existing value or subtree because
 *                     its weight was strictly higher.
 *  - EMPTY_REPLACED:  an empty value gave way to a mapping, or to a same-level
 *                     value of higher weight.
 */
public record MergeEvent(
        Kind kind,
        String keyPath,
        String winnerSource,
        int winnerDepth,
        int winnerWeight,
        String loserSource,
        int loserDepth,
        int loserWeight
) {
    public enum Kind { SHADOWED, WEIGHT_OVERRIDE, EMPTY_REPLACED }

    static MergeEvent of(Kind kind, String keyPath, AnnotatedLeaf winner, AnnotatedLeaf loser) {
        return new MergeEvent(kind, keyPath,
                winner.sourcePath(), winner.depth(), winner.weight(),
                loser.sourcePath(), loser.depth(), loser.weight());
    }

    /** Single-line description suitable for logs and CLI output. */
    public String describe() {
        return "%s %s: kept %s (level %d, weight %d) over %s (level %d, weight %d)".formatted(
                kind, keyPath, winnerSource, winnerDepth, winnerWeight, loserSource, loserDepth, loserWeight);
    }
}
