// file: core/src/main/java/io/hiermerge/core/PathPatternResolver.java
package io.hiermerge.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Decides whether a list at a structural path is merged element-wise, and by
 * which field.
 * <p>
 * Contract:
 *  - The path (mapping keys from the root down to the list) is joined with ':'.
 *  - Rules are tried in table order. The first pattern found anywhere in the
 *    joined path wins; rules are never re-sorted by specificity, so a table
 *    must list narrow patterns before broad ones that would also match.
 *  - No match means the list is an opaque leaf.
 * <p>
 * Immutable; one instance can serve any number of concurrent combinations.
 */
public final class PathPatternResolver {

    private record CompiledRule(MergeKeyRule rule, Pattern pattern) {}

    private final List<CompiledRule> rules;

    public PathPatternResolver(List<MergeKeyRule> rules) {
        Objects.requireNonNull(rules, "rules");
        var compiled = new ArrayList<CompiledRule>(rules.size());
        for (MergeKeyRule rule : rules) {
            try {
                compiled.add(new CompiledRule(rule, Pattern.compile(rule.pattern())));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid merge-key pattern: " + rule.pattern(), e);
            }
        }
        this.rules = List.copyOf(compiled);
    }

    /** Build from an ordered {@code pattern -> keyField} map; iteration order is table order. */
    public static PathPatternResolver fromMap(Map<String, String> table) {
        var rules = new ArrayList<MergeKeyRule>(table.size());
        table.forEach((pattern, keyField) -> rules.add(new MergeKeyRule(pattern, keyField)));
        return new PathPatternResolver(rules);
    }

    /** Resolver with no rules: every list is opaque. */
    public static PathPatternResolver empty() {
        return new PathPatternResolver(List.of());
    }

    public Optional<String> resolve(List<String> path) {
        return resolve(Trees.join(path));
    }

    public Optional<String> resolve(String joinedPath) {
        for (CompiledRule r : rules) {
            if (r.pattern().matcher(joinedPath).find()) {
                return Optional.of(r.rule().keyField());
            }
        }
        return Optional.empty();
    }

    public List<MergeKeyRule> rules() {
        return rules.stream().map(CompiledRule::rule).toList();
    }
}
