// file: core/src/test/java/io/hiermerge/core/CombinerTest.java
package io.hiermerge.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behavior of normalize -> merge -> denormalize -> strip.
 */
class CombinerTest {

    private final Combiner combiner = new Combiner(new PathPatternResolver(List.of(new MergeKeyRule("iface", "name"))));

    @Test
    void keyed_lists_merge_by_element_identity() {
        var device = Fragment.of(Map.of("iface", List.of(Map.of("name", "eth0", "mtu", 1500))), "dev.yml", 0);
        var site = Fragment.of(Map.of("iface", List.of(
                Map.of("name", "eth0", "desc", "wan"),
                Map.of("name", "eth1", "mtu", 9000))), "site.yml", 1);

        var result = combiner.combine(List.of(device, site));

        assertEquals(Map.of("iface", List.of(
                Map.of("name", "eth0", "mtu", 1500, "desc", "wan"),
                Map.of("name", "eth1", "mtu", 9000))), result.plainTree());
    }

    @Test
    void distinct_keys_from_two_fragments_form_a_two_element_list() {
        var a = Fragment.of(Map.of("iface", List.of(Map.of("name", "eth0"))), "a.yml", 0);
        var b = Fragment.of(Map.of("iface", List.of(Map.of("name", "eth1"))), "b.yml", 1);

        var iface = (List<?>) combiner.combine(List.of(a, b)).plainTree().get("iface");

        assertEquals(2, iface.size());
    }

    @Test
    void same_key_elements_merge_field_by_field_with_depth_rules() {
        var device = Fragment.of(Map.of("iface", List.of(Map.of("name", "eth0", "mtu", 1500))), "dev.yml", 0);
        var region = new Fragment(Map.of("iface", List.of(Map.of("name", "eth0", "mtu", 9216))),
                "region.yml", Set.of("all"), 2000, 2);

        var result = combiner.combine(List.of(device, region));

        var eth0 = (Map<?, ?>) ((List<?>) result.plainTree().get("iface")).get(0);
        assertEquals(9216, eth0.get("mtu"));
        assertEquals(MergeEvent.Kind.WEIGHT_OVERRIDE, result.diagnostics().stream()
                .filter(e -> e.keyPath().equals("iface:eth0:mtu"))
                .findFirst()
                .orElseThrow()
                .kind());
    }

    @Test
    void annotated_tree_mirrors_plain_tree_structure() {
        var device = Fragment.of(Map.of("iface", List.of(Map.of("name", "eth0", "mtu", 1500))), "dev.yml", 0);
        var site = Fragment.of(Map.of("iface", List.of(Map.of("name", "eth1"))), "site.yml", 1);

        var result = combiner.combine(List.of(site, device));

        var iface = (SequenceNode) result.annotatedTree().get("iface");
        assertEquals(2, iface.size());
        var eth1Name = (AnnotatedLeaf) ((MappingNode) iface.get(1)).get("name");
        assertEquals("eth1", eth1Name.value());
        assertEquals("site.yml", eth1Name.sourcePath());
        assertEquals(1, eth1Name.depth());
        assertEquals(result.plainTree(), ProvenanceStripper.strip(result.annotatedTree()));
    }

    @Test
    void plain_mappings_matching_the_pattern_are_not_turned_into_lists() {
        var content = Map.of(
                "iface", List.of(Map.of("name", "eth0", "opts", Map.of("a", 1))),
                "iface_settings", Map.of("x", 1));

        var result = combiner.combine(List.of(Fragment.of(content, "dev.yml", 0)));

        assertEquals(content, result.plainTree());
        var eth0 = (MappingNode) ((SequenceNode) result.annotatedTree().get("iface")).get(0);
        assertInstanceOf(MappingNode.class, eth0.get("opts"));
        assertInstanceOf(MappingNode.class, result.annotatedTree().get("iface_settings"));
    }

    @Test
    void conflict_inside_keyed_element_fails_the_whole_combination() {
        var a = Fragment.of(Map.of("iface", List.of(Map.of("name", "eth0", "mtu", 1500))), "a.yml", 0);
        var b = Fragment.of(Map.of("iface", List.of(Map.of("name", "eth0", "mtu", 9000))), "b.yml", 0);

        var ex = assertThrows(ConflictException.class, () -> combiner.combine(List.of(a, b)));

        assertEquals("iface:eth0:mtu", ex.keyPath());
    }

    @Test
    void normalization_errors_propagate() {
        var bad = Fragment.of(Map.of("iface", List.of(Map.of("mtu", 1500))), "bad.yml", 0);

        assertThrows(MissingMergeKeyException.class, () -> combiner.combine(List.of(bad)));
    }

    @Test
    void opaque_list_of_mappings_keeps_nested_keyed_lists_intact() {
        var nested = new Combiner(PathPatternResolver.fromMap(Map.of("statements$", "seq")));
        var content = Map.of("policies", List.of(
                Map.of("name", "p1", "statements", List.of(Map.of("seq", 10, "action", "deny")))));

        var result = nested.combine(List.of(Fragment.of(content, "p.yml", 0)));

        assertEquals(content, result.plainTree());
    }
}
