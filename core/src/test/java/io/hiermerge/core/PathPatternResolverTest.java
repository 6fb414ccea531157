// file: core/src/test/java/io/hiermerge/core/PathPatternResolverTest.java
package io.hiermerge.core;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PathPatternResolverTest {

    @Test
    void first_matching_rule_wins_even_when_a_later_rule_is_more_specific() {
        var resolver = new PathPatternResolver(List.of(
                new MergeKeyRule("interface", "id"),
                new MergeKeyRule("interfaces:interface$", "name")
        ));

        assertEquals(Optional.of("id"), resolver.resolve(List.of("interfaces", "interface")));
    }

    @Test
    void pattern_may_match_anywhere_in_the_joined_path() {
        var resolver = new PathPatternResolver(List.of(new MergeKeyRule("acl-set$", "name")));

        assertEquals(Optional.of("name"), resolver.resolve(List.of("mdd", "acl", "acl-sets", "acl-set")));
        assertEquals(Optional.empty(), resolver.resolve(List.of("mdd", "acl", "acl-set", "entries")));
    }

    @Test
    void path_segments_are_joined_with_colons() {
        var resolver = new PathPatternResolver(List.of(
                new MergeKeyRule("^vrfs:[a-zA-Z0-9_-]+:routes$", "prefix")
        ));

        assertEquals(Optional.of("prefix"), resolver.resolve(List.of("vrfs", "blue", "routes")));
        assertEquals(Optional.of("prefix"), resolver.resolve("vrfs:red:routes"));
        assertTrue(resolver.resolve(List.of("routes")).isEmpty());
    }

    @Test
    void table_order_follows_map_iteration_order() {
        var table = new LinkedHashMap<String, String>();
        table.put("server", "address");
        table.put("ntp:server", "host");

        var resolver = PathPatternResolver.fromMap(table);

        assertEquals(Optional.of("address"), resolver.resolve(List.of("ntp", "server")));
        assertEquals("server", resolver.rules().get(0).pattern());
    }

    @Test
    void empty_resolver_matches_nothing() {
        assertTrue(PathPatternResolver.empty().resolve(List.of("anything")).isEmpty());
    }

    @Test
    void invalid_pattern_is_rejected_up_front() {
        var ex = assertThrows(IllegalArgumentException.class,
                () -> new PathPatternResolver(List.of(new MergeKeyRule("iface[", "name"))));
        assertTrue(ex.getMessage().contains("iface["));
    }
}
