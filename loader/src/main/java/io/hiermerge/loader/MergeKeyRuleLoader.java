// file: loader/src/main/java/io/hiermerge/loader/MergeKeyRuleLoader.java
package io.hiermerge.loader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.hiermerge.core.PathPatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.logging.Logger;

/**
 * Reads merge-key tables: a YAML (or JSON) mapping of {@code pattern: keyField}.
 * <p>
 * File order is table order and must be preserved: the resolver takes the
 * first matching pattern, and the bundled table relies on that.
 */
public final class MergeKeyRuleLoader {
    private static final Logger log = Logger.getLogger(MergeKeyRuleLoader.class.getName());

    static final String DEFAULT_RESOURCE = "/default-merge-keys.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<LinkedHashMap<String, String>> TABLE = new TypeReference<>() {};

    private MergeKeyRuleLoader() {
        // utility
    }

    /** The bundled table for the OpenConfig-based data model. */
    public static PathPatternResolver defaults() {
        try (InputStream in = MergeKeyRuleLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IllegalStateException("Missing resource " + DEFAULT_RESOURCE);
            return PathPatternResolver.fromMap(YAML.readValue(in, TABLE));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static PathPatternResolver fromFile(Path path) {
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FragmentLoadException(path.toString(), "cannot read merge-key table", e);
        }
        var resolver = parse(path.toString(), content);
        log.fine(() -> "Read %d merge-key rules from %s".formatted(resolver.rules().size(), path));
        return resolver;
    }

    public static PathPatternResolver fromString(String content) {
        return parse("<inline>", content);
    }

    private static PathPatternResolver parse(String source, String content) {
        if (content.isBlank()) return PathPatternResolver.empty();
        try {
            return fromTable(source, YAML.readValue(content, TABLE));
        } catch (IOException e) {
            throw new FragmentLoadException(source, "cannot parse merge-key table", e);
        }
    }

    private static PathPatternResolver fromTable(String source, LinkedHashMap<String, String> table) {
        if (table == null) return PathPatternResolver.empty();
        try {
            return PathPatternResolver.fromMap(table);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new FragmentLoadException(source, e.getMessage(), e);
        }
    }
}
