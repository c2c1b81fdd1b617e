package org.calista.clausegraph.solve.aggregate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RunIds")
class RunIdsTest {

    @Test
    @DisplayName("Should hash the section key with sorted ids into a prefixed 16-char id")
    void shouldMatchKnownDigest_whenIdsUnsorted() {
        String id = RunIds.parseRunId("sec-1", List.of("ii1", "a1", "i1", "b1"), List.of());

        assertThat(id).isEqualTo("p2_ec83fb4324988fa4");
    }

    @Test
    @DisplayName("Should hash the bare section key when nothing was selected")
    void shouldHashKeyOnly_whenNoIds() {
        assertThat(RunIds.parseRunId("section::unknown", List.of(), List.of())).isEqualTo("p2_16caa8aeb3ea2204");
    }

    @Test
    @DisplayName("Should change when the abstained set changes")
    void shouldDiffer_whenAbstainedTokensDiffer() {
        String a = RunIds.parseRunId("sec", List.of("n1"), List.of());
        String b = RunIds.parseRunId("sec", List.of("n1"), List.of("t9"));

        assertThat(a).matches("p2_[0-9a-f]{16}");
        assertThat(b).matches("p2_[0-9a-f]{16}");
        assertThat(a).isNotEqualTo(b);
    }
}
