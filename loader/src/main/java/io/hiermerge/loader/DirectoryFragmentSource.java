// file: loader/src/main/java/io/hiermerge/loader/DirectoryFragmentSource.java
package io.hiermerge.loader;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.hiermerge.core.Fragment;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Fragment source backed by a directory hierarchy of YAML files.
 * <p>
 * Layout:
 *   root/
 *     org.yml                 (never read: root itself is excluded)
 *     region-east/
 *       region.yml            depth 2
 *       site-1/
 *         site.yml            depth 1
 *         router-1/
 *           device.yml        depth 0
 * <p>
 * Discovery:
 *  - The entity directory is the shallowest directory below root named after
 *    the entity (ties broken by path order).
 *  - From there we walk up to, but not including, root. Depth starts at 0 and
 *    grows by one per level.
 *  - In each directory, regular files whose name matches any filespec glob
 *    are read in name order.
 * <p>
 * Each file is rendered (Jinja by default), then parsed as a multi-document
 * YAML stream. Per document:
 *  - mdd_tags (default ["all"]) is intersected with the requested tags plus
 *    "all"; no overlap means the document is skipped.
 *  - weight defaults to the query's default weight.
 *  - mdd_data (default empty) becomes the fragment content.
 */
public final class DirectoryFragmentSource implements FragmentSource {
    private static final Logger log = Logger.getLogger(DirectoryFragmentSource.class.getName());

    static final String TAGS_FIELD = "mdd_tags";
    static final String WEIGHT_FIELD = "weight";
    static final String DATA_FIELD = "mdd_data";
    static final String ALL_TAG = "all";

    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
    private final TemplateRenderer renderer;

    public DirectoryFragmentSource() {
        this(new JinjaTemplateRenderer());
    }

    public DirectoryFragmentSource(TemplateRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    @Override
    public List<Fragment> load(FragmentQuery query) {
        Path root = query.root().toAbsolutePath().normalize();
        Path entityDir = findEntityDirectory(root, query.entity())
                .orElseThrow(() -> new FragmentLoadException(root.toString(),
                        "no directory named '%s' below the root".formatted(query.entity())));

        var matchers = query.filespecs().stream()
                .map(spec -> FileSystems.getDefault().getPathMatcher("glob:" + spec))
                .toList();
        var requested = new LinkedHashSet<>(query.tags());
        requested.add(ALL_TAG);

        var fragments = new ArrayList<Fragment>();
        int files = 0;
        int depth = 0;
        for (Path dir = entityDir; !dir.equals(root); dir = dir.getParent(), depth++) {
            for (Path file : matchingFiles(dir, matchers)) {
                files++;
                readFile(file, depth, requested, query, fragments);
            }
        }

        int fileCount = files;
        log.info(() -> "Loaded %d fragments for %s from %d files across %d levels"
                .formatted(fragments.size(), query.entity(), fileCount, root.relativize(entityDir).getNameCount()));
        if (fileCount == 0) {
            log.warning(() -> "No files matching " + query.filespecs() + " from " + entityDir + " up to " + root);
        }
        return List.copyOf(fragments);
    }

    private Optional<Path> findEntityDirectory(Path root, String entity) {
        try (Stream<Path> paths = Files.walk(root)) {
            return paths
                    .filter(p -> !p.equals(root))
                    .filter(Files::isDirectory)
                    .filter(p -> p.getFileName().toString().equals(entity))
                    .min(Comparator.comparingInt(Path::getNameCount).thenComparing(Path::toString));
        } catch (IOException | UncheckedIOException e) {
            throw new FragmentLoadException(root.toString(), "cannot walk directory tree", e);
        }
    }

    private List<Path> matchingFiles(Path dir, List<PathMatcher> matchers) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> matchers.stream().anyMatch(m -> m.matches(p.getFileName())))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new FragmentLoadException(dir.toString(), "cannot list directory", e);
        }
    }

    private void readFile(Path file, int depth, Set<String> requested, FragmentQuery query, List<Fragment> out) {
        String source = file.toString();
        String rendered;
        try {
            rendered = renderer.render(Files.readString(file, StandardCharsets.UTF_8), query.variables());
        } catch (IOException e) {
            throw new FragmentLoadException(source, "cannot read file", e);
        } catch (TemplateException e) {
            throw new FragmentLoadException(source, e.getMessage(), e);
        }

        try (MappingIterator<Object> docs = yaml.readerFor(Object.class).readValues(rendered)) {
            int index = 0;
            while (docs.hasNextValue()) {
                Object doc = docs.nextValue();
                index++;
                if (doc == null) continue;
                if (!(doc instanceof Map<?, ?> document)) {
                    throw new FragmentLoadException(source, "document %d is not a mapping".formatted(index));
                }
                toFragment(document, source, index, depth, requested, query.defaultWeight()).ifPresent(out::add);
            }
        } catch (IOException e) {
            throw new FragmentLoadException(source, "invalid YAML: " + e.getMessage(), e);
        }
    }

    private Optional<Fragment> toFragment(Map<?, ?> document, String source, int index, int depth,
                                          Set<String> requested, int defaultWeight) {
        var matched = new LinkedHashSet<String>();
        for (String tag : documentTags(document, source, index)) {
            if (requested.contains(tag)) matched.add(tag);
        }
        if (matched.isEmpty()) {
            log.fine(() -> "Skipping document %d of %s: tags do not match %s".formatted(index, source, requested));
            return Optional.empty();
        }

        Object weight = document.containsKey(WEIGHT_FIELD) ? document.get(WEIGHT_FIELD) : defaultWeight;
        if (!(weight instanceof Integer w)) {
            throw new FragmentLoadException(source, "document %d: '%s' must be an integer, got %s"
                    .formatted(index, WEIGHT_FIELD, weight));
        }

        Object data = document.get(DATA_FIELD);
        if (data != null && !(data instanceof Map<?, ?>)) {
            throw new FragmentLoadException(source, "document %d: '%s' must be a mapping".formatted(index, DATA_FIELD));
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> content = data == null ? Map.of() : (Map<String, Object>) data;

        if (log.isLoggable(Level.FINE)) {
            log.fine("Including document %d of %s at depth %d (tags=%s, weight=%d)"
                    .formatted(index, source, depth, matched, w));
        }
        return Optional.of(new Fragment(content, source, matched, w, depth));
    }

    private static List<String> documentTags(Map<?, ?> document, String source, int index) {
        Object raw = document.get(TAGS_FIELD);
        if (raw == null) return List.of(ALL_TAG);
        if (raw instanceof String s) return List.of(s);
        if (raw instanceof List<?> list) {
            var tags = new ArrayList<String>(list.size());
            for (Object tag : list) tags.add(String.valueOf(tag));
            return tags;
        }
        throw new FragmentLoadException(source, "document %d: '%s' must be a list of strings".formatted(index, TAGS_FIELD));
    }
}
