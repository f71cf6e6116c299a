package com.nzila.core.hash;

import net.jqwik.api.*;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.StringLength;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property-based tests for canonical JSON serialization and hashing.
 */
class CanonicalJsonPropertyTest {

    @Property(tries = 100)
    @Label("Key insertion order never changes the canonical bytes")
    void insertionOrderIndependent(
            @ForAll @Size(min = 1, max = 20) Map<@AlphaChars @StringLength(min = 1, max = 12) String,
                    @StringLength(max = 30) String> entries) {

        Map<String, Object> forward = new LinkedHashMap<>(entries);
        List<String> keys = new ArrayList<>(entries.keySet());
        Collections.reverse(keys);
        Map<String, Object> reversed = new LinkedHashMap<>();
        keys.forEach(k -> reversed.put(k, entries.get(k)));

        assertThat(CanonicalJson.write(forward)).isEqualTo(CanonicalJson.write(reversed));
        assertThat(CanonicalJson.hash(forward)).isEqualTo(CanonicalJson.hash(reversed));
    }

    @Property(tries = 50)
    @Label("Canonicalizing canonical JSON is a fixed point")
    void canonicalizeIsIdempotent(
            @ForAll @Size(max = 10) Map<@AlphaChars @StringLength(min = 1, max = 8) String, Integer> entries) {
        String once = CanonicalJson.write(new HashMap<>(entries));
        assertThat(CanonicalJson.canonicalize(once)).isEqualTo(once);
    }

    @Example
    void nestedMapsAreSorted() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("z", 1);
        inner.put("a", 2);
        Map<String, Object> outer = new LinkedHashMap<>();
        outer.put("b", inner);
        outer.put("a", "x");

        assertThat(CanonicalJson.write(outer)).isEqualTo("{\"a\":\"x\",\"b\":{\"a\":2,\"z\":1}}");
    }

    @Example
    void sha256IsLowerHex() {
        assertThat(ContentHashing.sha256("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(ContentHashing.matches("ab", "ab")).isTrue();
        assertThat(ContentHashing.matches("ab", null)).isFalse();
    }
}
