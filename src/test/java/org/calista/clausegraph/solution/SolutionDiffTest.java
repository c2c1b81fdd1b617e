package org.calista.clausegraph.solution;

import org.calista.clausegraph.GraphFixtures;
import org.calista.clausegraph.core.SolverOptions;
import org.calista.clausegraph.solve.CandidateGraphSolver;
import org.calista.clausegraph.solve.ParseStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SolutionDiff")
class SolutionDiffTest {

    private final CandidateGraphSolver solver = CandidateGraphSolver.withDefaults();

    @Test
    @DisplayName("Should report no change for two solves of the same input")
    void shouldBeUnchanged_whenSameInput() {
        SolverSolution a = solver.solve(GraphFixtures.simpleSection(), "sec-1");
        SolverSolution b = solver.solve(GraphFixtures.simpleSection(), "sec-1");

        SolutionDiff d = SolutionDiff.compare(a, b);

        assertThat(d.isUnchanged()).isTrue();
        assertThat(d.sharedClauseIds).isEqualTo(4);
        assertThat(d.onlyLeftClauseIds).isEmpty();
    }

    @Test
    @DisplayName("Should list lost clauses and the status flip under stricter thresholds")
    void shouldReportLostClauses_whenThresholdsTightened() {
        SolverSolution base = solver.solve(GraphFixtures.simpleSection(), "sec-1");
        SolverSolution strict = solver.solve(GraphFixtures.simpleSection(), "sec-1",
                SolverOptions.builder().abstainMarginThreshold(0.29).build());

        SolutionDiff d = SolutionDiff.compare(base, strict);

        // t2 margin is 0.28, so (i) is lost; everything else keeps margin 0.30
        assertThat(d.runIdChanged).isTrue();
        assertThat(d.leftStatus).isEqualTo(ParseStatus.ACCEPTED);
        assertThat(d.rightStatus).isEqualTo(ParseStatus.REVIEW);
        assertThat(d.statusChanged).isTrue();
        assertThat(d.onlyLeftClauseIds).containsExactly("a.i");
        assertThat(d.onlyRightClauseIds).isEmpty();
        assertThat(d.leftNodeCount).isEqualTo(4);
        assertThat(d.rightNodeCount).isEqualTo(3);
        assertThat(d.isUnchanged()).isFalse();
    }

    @Test
    @DisplayName("Should refuse to compare different sections")
    void shouldReject_whenSectionKeysDiffer() {
        SolverSolution a = solver.solve(GraphFixtures.simpleSection(), "sec-1");
        SolverSolution b = solver.solve(GraphFixtures.simpleSection(), "sec-2");

        assertThatThrownBy(() -> SolutionDiff.compare(a, b)).isInstanceOf(IllegalArgumentException.class);
    }
}
