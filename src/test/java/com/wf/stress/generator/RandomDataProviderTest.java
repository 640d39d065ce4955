package com.wf.stress.generator;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RandomDataProviderTest {

    private final RandomDataProvider random = new RandomDataProvider();

    @Test
    void shouldCoverWholeSizeRange() {
        Set<Integer> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            int size = random.randomSize(3);
            assertThat(size).isBetween(1, 3);
            seen.add(size);
        }

        assertThat(seen).containsExactlyInAnyOrder(1, 2, 3);
    }

    @Test
    void shouldRejectNonPositiveMax() {
        assertThatThrownBy(() -> random.randomSize(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldGenerateExactLengthLowercase() {
        assertThat(random.randomLowercaseOfLength(16)).matches("[a-z]{16}");
    }

    @Test
    void shouldPickFromList() {
        List<String> options = List.of("x", "y");

        assertThat(random.randomElement(options)).isIn(options);
    }
}
