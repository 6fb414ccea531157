// file: loader/src/test/java/io/hiermerge/loader/DirectoryFragmentSourceTest.java
package io.hiermerge.loader;

import io.hiermerge.core.Fragment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryFragmentSourceTest {

    @TempDir
    Path root;

    private Path device;
    private final DirectoryFragmentSource source = new DirectoryFragmentSource();

    @BeforeEach
    void layout() throws IOException {
        device = Files.createDirectories(root.resolve("east").resolve("site-1").resolve("router-1"));
        write(root.resolve("oc-org.yml"), "mdd_data: {org: true}\n");
        write(root.resolve("east").resolve("oc-region.yml"), "mdd_data: {ntp: region}\n");
        write(root.resolve("east").resolve("site-1").resolve("oc-site.yml"), "mdd_data: {ntp: site}\n");
        write(device.resolve("oc-device.yml"), "mdd_data: {hostname: r1}\n");
    }

    private static void write(Path file, String text) throws IOException {
        Files.writeString(file, text);
    }

    private static Map<String, Integer> depthBySource(List<Fragment> fragments) {
        var out = new LinkedHashMap<String, Integer>();
        for (Fragment f : fragments) out.put(Path.of(f.sourcePath()).getFileName().toString(), f.depth());
        return out;
    }

    @Test
    void depth_counts_levels_above_the_entity_and_root_is_excluded() {
        var fragments = source.load(FragmentQuery.of(root, "router-1", List.of("oc-*.yml")));

        assertEquals(Map.of("oc-device.yml", 0, "oc-site.yml", 1, "oc-region.yml", 2), depthBySource(fragments));
        assertEquals(Map.of("hostname", "r1"), fragments.get(0).content());
    }

    @Test
    void only_files_matching_a_filespec_are_read_in_name_order() throws IOException {
        write(device.resolve("oc-b.yml"), "mdd_data: {b: 1}\n");
        write(device.resolve("oc-a.yml"), "mdd_data: {a: 1}\n");
        write(device.resolve("notes.txt"), "not yaml: [\n");
        write(device.resolve("cfg-x.yml"), "mdd_data: {x: 1}\n");

        var fragments = source.load(FragmentQuery.of(root, "router-1", List.of("oc-*.yml", "cfg-*.yml")));

        var names = fragments.stream().filter(f -> f.depth() == 0)
                .map(f -> Path.of(f.sourcePath()).getFileName().toString()).toList();
        assertEquals(List.of("cfg-x.yml", "oc-a.yml", "oc-b.yml", "oc-device.yml"), names);
    }

    @Test
    void documents_are_filtered_by_tags() throws IOException {
        write(device.resolve("oc-tags.yml"), """
                mdd_tags: [region-east]
                mdd_data: {east: 1}
                ---
                mdd_tags: [region-west]
                mdd_data: {west: 1}
                ---
                mdd_data: {untagged: 1}
                ---
                mdd_tags: all
                mdd_data: {everyone: 1}
                """);
        var query = new FragmentQuery(root, "router-1", List.of("oc-tags.yml"), List.of("region-east"), 1000, Map.of());

        var fragments = source.load(query);

        assertEquals(3, fragments.size());
        assertEquals(Map.of("east", 1), fragments.get(0).content());
        assertEquals(Set.of("region-east"), fragments.get(0).tags());
        assertEquals(Map.of("untagged", 1), fragments.get(1).content());
        assertEquals(Set.of("all"), fragments.get(1).tags());
        assertEquals(Map.of("everyone", 1), fragments.get(2).content());
    }

    @Test
    void weight_defaults_to_query_weight() throws IOException {
        write(device.resolve("oc-w.yml"), """
                weight: 2000
                mdd_data: {a: 1}
                ---
                mdd_data: {b: 1}
                """);
        var query = new FragmentQuery(root, "router-1", List.of("oc-w.yml"), List.of(), 500, Map.of());

        var fragments = source.load(query);

        assertEquals(2000, fragments.get(0).weight());
        assertEquals(500, fragments.get(1).weight());
    }

    @Test
    void missing_data_yields_empty_content() throws IOException {
        write(device.resolve("oc-empty.yml"), """
                mdd_tags: [all]
                ---
                mdd_data: {a: 1}
                """);

        var fragments = source.load(FragmentQuery.of(root, "router-1", List.of("oc-empty.yml")));

        assertEquals(2, fragments.size());
        assertTrue(fragments.get(0).content().isEmpty());
        assertEquals(Map.of("a", 1), fragments.get(1).content());
    }

    @Test
    void placeholders_are_rendered_before_parsing() throws IOException {
        write(device.resolve("oc-t.yml"), "mdd_data: {hostname: '{{ inventory_hostname }}'}\n");
        var query = new FragmentQuery(root, "router-1", List.of("oc-t.yml"), List.of(), 1000,
                Map.of("inventory_hostname", "router-1"));

        var fragments = source.load(query);

        assertEquals(Map.of("hostname", "router-1"), fragments.get(0).content());
    }

    @Test
    void jinja_blocks_are_rendered_by_default() throws IOException {
        write(device.resolve("oc-j.yml"), """
                mdd_data:
                {% if site_ntp %}
                  ntp: {{ site_ntp }}
                {% endif %}
                  hostname: {{ inventory_hostname }}
                """);
        var query = new FragmentQuery(root, "router-1", List.of("oc-j.yml"), List.of(), 1000,
                Map.of("inventory_hostname", "router-1", "site_ntp", "10.0.0.1"));

        var fragments = source.load(query);

        assertEquals(Map.of("ntp", "10.0.0.1", "hostname", "router-1"), fragments.get(0).content());
    }

    @Test
    void verbatim_renderer_leaves_placeholders_alone() throws IOException {
        write(device.resolve("oc-t.yml"), "mdd_data: {hostname: '{{ inventory_hostname }}'}\n");

        var fragments = new DirectoryFragmentSource(TemplateRenderer.verbatim())
                .load(FragmentQuery.of(root, "router-1", List.of("oc-t.yml")));

        assertEquals(Map.of("hostname", "{{ inventory_hostname }}"), fragments.get(0).content());
    }

    @Test
    void undefined_placeholder_names_the_file() throws IOException {
        Path file = device.resolve("oc-t.yml");
        write(file, "mdd_data: {hostname: '{{ nope }}'}\n");

        var ex = assertThrows(FragmentLoadException.class,
                () -> source.load(FragmentQuery.of(root, "router-1", List.of("oc-t.yml"))));
        assertEquals(file.toAbsolutePath().normalize().toString(), ex.file());
        assertInstanceOf(TemplateException.class, ex.getCause());
    }

    @Test
    void invalid_yaml_is_fatal() throws IOException {
        write(device.resolve("oc-bad.yml"), "mdd_data: {a: [1, 2\n");

        var ex = assertThrows(FragmentLoadException.class,
                () -> source.load(FragmentQuery.of(root, "router-1", List.of("oc-*.yml"))));
        assertTrue(ex.getMessage().startsWith("An error occurred loading file "));
        assertTrue(ex.getMessage().contains("invalid YAML"));
    }

    @Test
    void malformed_fields_are_rejected() throws IOException {
        write(device.resolve("oc-w.yml"), "weight: heavy\nmdd_data: {a: 1}\n");
        assertThrows(FragmentLoadException.class,
                () -> source.load(FragmentQuery.of(root, "router-1", List.of("oc-w.yml"))));

        write(device.resolve("oc-d.yml"), "mdd_data: [1, 2]\n");
        assertThrows(FragmentLoadException.class,
                () -> source.load(FragmentQuery.of(root, "router-1", List.of("oc-d.yml"))));

        write(device.resolve("oc-s.yml"), "just a string\n");
        assertThrows(FragmentLoadException.class,
                () -> source.load(FragmentQuery.of(root, "router-1", List.of("oc-s.yml"))));
    }

    @Test
    void unknown_entity_is_fatal() {
        var ex = assertThrows(FragmentLoadException.class,
                () -> source.load(FragmentQuery.of(root, "router-9", List.of("oc-*.yml"))));
        assertTrue(ex.getMessage().contains("router-9"));
    }

    @Test
    void shallowest_entity_directory_wins() throws IOException {
        Path other = Files.createDirectories(root.resolve("west").resolve("a").resolve("b").resolve("router-1"));
        write(other.resolve("oc-device.yml"), "mdd_data: {hostname: wrong}\n");

        var fragments = source.load(FragmentQuery.of(root, "router-1", List.of("oc-device.yml")));

        assertEquals(Map.of("hostname", "r1"), fragments.get(0).content());
    }

    @Test
    void no_matching_files_yields_no_fragments() {
        assertTrue(source.load(FragmentQuery.of(root, "router-1", List.of("*.json"))).isEmpty());
    }
}
