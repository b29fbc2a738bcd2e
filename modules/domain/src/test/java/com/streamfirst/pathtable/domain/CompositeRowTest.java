package com.streamfirst.pathtable.domain;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.junit.jupiter.api.Assertions.assertEquals;

class CompositeRowTest {

    @Test
    void testBlocksArePrefixStripped() {
        CompositeRow row = CompositeRow.builder()
            .putShared("c", "France")
            .putShared("k", "OVH")
            .putField("contact", "email", "info@ovh.fr")
            .putField("finance", "revenue", 10.0)
            .build();

        assertThat(row.prefixes()).containsExactly("shared", "contact", "finance");
        assertThat(row.block("shared")).containsExactly(entry("c", "France"), entry("k", "OVH"));
        assertEquals("info@ovh.fr", row.field("contact", "email"));
        assertEquals("France", row.shared("c"));
        assertThat(row.block("missing")).isEmpty();
    }

    @Test
    void testFieldNamesMayContainSeparator() {
        CompositeRow row = CompositeRow.of(Map.of("finance.v1.total", 3));

        assertThat(row.prefixes()).containsExactly("finance");
        assertEquals(3L, row.block("finance").get("v1.total"));
    }
}
