// file: core/src/main/java/io/hiermerge/core/ProvenanceMerger.java
package io.hiermerge.core;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recursive combiner of normalized fragments into one annotated tree.
 * <p>
 * Algorithm:
 *  - Fragments are applied in ascending depth (most specific first). The sort
 *    is stable, so fragments at the same depth keep their input order.
 *  - Mappings merge key-wise; nested mappings recurse.
 *  - Leaf rule, for a key that already holds a leaf:
 *      1) Same depth and the existing value is non-empty: ConflictException.
 *         Weight never breaks a same-depth tie.
 *      2) Otherwise the incoming value replaces the existing one only if its
 *         weight is strictly higher. Equal weights keep the more specific value.
 *  - Mapping against leaf, either way round: an empty side gives way to the
 *    other. Otherwise the same depth is a STRUCTURE conflict, and different
 *    depths follow the leaf rule for the whole subtree: the existing node stays
 *    unless the incoming weight is strictly higher.
 * <p>
 * Stateless: each call builds its own tree and event list.
 */
public final class ProvenanceMerger {
    private static final Logger log = Logger.getLogger(ProvenanceMerger.class.getName());

    /** Merged tree plus the decisions taken while building it. */
    public record MergeOutcome(MappingNode tree, List<MergeEvent> events) {
        public MergeOutcome {
            events = List.copyOf(events);
        }
    }

    /**
     * Mutable mapping used while merging. Remembers the fragment that created
     * it so structure conflicts and events can name a source.
     */
    private static final class Branch {
        final Map<String, Object> children = new LinkedHashMap<>();
        final AnnotatedLeaf owner;
        boolean keyed;

        Branch(AnnotatedLeaf owner) { this.owner = owner; }
    }

    /**
     * Merge fragments whose content has already been normalized.
     *
     * @throws ConflictException on a same-level or structural collision
     */
    public MergeOutcome merge(List<Fragment> fragments) {
        var ordered = fragments.stream()
                .sorted(Comparator.comparingInt(Fragment::depth))
                .toList();

        var events = new ArrayList<MergeEvent>();
        var root = new Branch(null);
        for (Fragment f : ordered) {
            mergeInto(root, f.content(), List.of(), f, events);
        }
        return new MergeOutcome(freeze(root), events);
    }

    private void mergeInto(Branch target, Map<String, Object> content, List<String> path,
                           Fragment fragment, List<MergeEvent> events) {
        for (var e : content.entrySet()) {
            String key = e.getKey();
            Object incoming = e.getValue();
            var keyPath = Trees.append(path, key);

            if (incoming instanceof Map<?, ?> mapping) {
                Branch child = branchFor(target, key, keyPath, mapping, fragment, events);
                if (child != null) {
                    if (mapping instanceof KeyedMapping) child.keyed = true;
                    @SuppressWarnings("unchecked")
                    var nested = (Map<String, Object>) mapping;
                    mergeInto(child, nested, keyPath, fragment, events);
                }
                continue;
            }

            var candidate = AnnotatedLeaf.from(incoming, fragment);
            if (!target.children.containsKey(key)) {
                target.children.put(key, candidate);
                continue;
            }

            Object existing = target.children.get(key);
            if (existing instanceof Branch branch) {
                leafAgainstBranch(target, key, keyPath, branch, candidate, events);
                continue;
            }
            applyLeafRule(target, key, keyPath, (AnnotatedLeaf) existing, candidate, events);
        }
    }

    /**
     * Branch to merge a mapping into, creating or replacing as needed.
     * Returns null when an empty mapping meets an existing value and there is
     * nothing to merge.
     */
    private Branch branchFor(Branch target, String key, List<String> keyPath, Map<?, ?> mapping,
                             Fragment fragment, List<MergeEvent> events) {
        Object existing = target.children.get(key);
        if (existing instanceof Branch branch) return branch;

        var self = AnnotatedLeaf.from(null, fragment);
        if (existing instanceof AnnotatedLeaf leaf) {
            String joined = Trees.join(keyPath);
            if (mapping.isEmpty()) {
                record(events, MergeEvent.of(MergeEvent.Kind.SHADOWED, joined, leaf, self));
                return null;
            }
            if (Trees.isEmpty(leaf.value())) {
                record(events, MergeEvent.of(MergeEvent.Kind.EMPTY_REPLACED, joined, self, leaf));
            } else if (leaf.depth() == self.depth()) {
                throw ConflictException.structure(joined,
                        self.sourcePath(), self.depth(), leaf.sourcePath(), leaf.depth());
            } else if (self.weight() > leaf.weight()) {
                record(events, MergeEvent.of(MergeEvent.Kind.WEIGHT_OVERRIDE, joined, self, leaf));
            } else {
                record(events, MergeEvent.of(MergeEvent.Kind.SHADOWED, joined, leaf, self));
                return null;
            }
        }
        var created = new Branch(self);
        target.children.put(key, created);
        return created;
    }

    /** A leaf arriving where an earlier fragment put a mapping. */
    private void leafAgainstBranch(Branch target, String key, List<String> keyPath, Branch branch,
                                   AnnotatedLeaf candidate, List<MergeEvent> events) {
        String joined = Trees.join(keyPath);
        if (Trees.isEmpty(candidate.value())) {
            record(events, MergeEvent.of(MergeEvent.Kind.SHADOWED, joined, branch.owner, candidate));
            return;
        }
        if (branch.owner.depth() == candidate.depth()) {
            throw ConflictException.structure(joined,
                    branch.owner.sourcePath(), branch.owner.depth(),
                    candidate.sourcePath(), candidate.depth());
        }
        if (candidate.weight() > branch.owner.weight()) {
            target.children.put(key, candidate);
            record(events, MergeEvent.of(MergeEvent.Kind.WEIGHT_OVERRIDE, joined, candidate, branch.owner));
        } else {
            record(events, MergeEvent.of(MergeEvent.Kind.SHADOWED, joined, branch.owner, candidate));
        }
    }

    private void applyLeafRule(Branch target, String key, List<String> keyPath,
                               AnnotatedLeaf existing, AnnotatedLeaf candidate, List<MergeEvent> events) {
        boolean sameLevel = existing.depth() == candidate.depth();
        if (sameLevel && !Trees.isEmpty(existing.value())) {
            throw ConflictException.sameLevel(Trees.join(keyPath), existing.depth(),
                    candidate.sourcePath(), existing.sourcePath());
        }
        if (candidate.weight() > existing.weight()) {
            target.children.put(key, candidate);
            var kind = sameLevel ? MergeEvent.Kind.EMPTY_REPLACED : MergeEvent.Kind.WEIGHT_OVERRIDE;
            record(events, MergeEvent.of(kind, Trees.join(keyPath), candidate, existing));
        } else {
            record(events, MergeEvent.of(MergeEvent.Kind.SHADOWED, Trees.join(keyPath), existing, candidate));
        }
    }

    private static void record(List<MergeEvent> events, MergeEvent event) {
        events.add(event);
        if (log.isLoggable(Level.FINE)) {
            log.fine(event.describe());
        }
    }

    private static MappingNode freeze(Branch branch) {
        var out = new LinkedHashMap<String, Node>(branch.children.size() * 2);
        branch.children.forEach((key, child) ->
                out.put(key, child instanceof Branch b ? freeze(b) : (AnnotatedLeaf) child));
        return new MappingNode(out, branch.keyed);
    }
}
