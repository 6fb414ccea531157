// file: loader/src/main/java/io/hiermerge/loader/FragmentQuery.java
package io.hiermerge.loader;

import io.hiermerge.core.Fragment;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * What to load for one target entity.
 * <p>
 * Fields:
 *  - root:          top of the fragment hierarchy (never itself read).
 *  - entity:        name of the entity directory somewhere below root.
 *  - filespecs:     filename globs selecting fragment files, e.g. "oc-*.yml".
 *  - tags:          requested tags; "all" is always implied.
 *  - defaultWeight: weight of documents that declare none.
 *  - variables:     values for template placeholders.
 */
public record FragmentQuery(
        Path root,
        String entity,
        List<String> filespecs,
        List<String> tags,
        int defaultWeight,
        Map<String, Object> variables
) {
    public FragmentQuery {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(entity, "entity");
        if (entity.isBlank()) throw new IllegalArgumentException("entity must not be blank");
        if (filespecs == null || filespecs.isEmpty()) throw new IllegalArgumentException("filespecs must not be empty");
        filespecs = List.copyOf(filespecs);
        tags = tags == null ? List.of() : List.copyOf(tags);
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static FragmentQuery of(Path root, String entity, List<String> filespecs) {
        return new FragmentQuery(root, entity, filespecs, List.of(), Fragment.DEFAULT_WEIGHT, Map.of());
    }
}
