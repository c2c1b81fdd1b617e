package org.calista.clausegraph.batch;

import org.calista.clausegraph.solution.SolverSolution;
import org.calista.clausegraph.solve.ParseStatus;
import org.calista.clausegraph.util.LogFmt;

import java.util.List;
import java.util.Objects;

/**
 * Counts over one batch run.
 */
public final class BatchReport {

    public final int sections;
    public final int accepted;
    public final int review;
    public final int abstain;
    public final int abstainedTokens;
    public final int warnings;
    public final int badLines;

    private BatchReport(int sections, int accepted, int review, int abstain,
                        int abstainedTokens, int warnings, int badLines) {
        this.sections = sections;
        this.accepted = accepted;
        this.review = review;
        this.abstain = abstain;
        this.abstainedTokens = abstainedTokens;
        this.warnings = warnings;
        this.badLines = badLines;
    }

    public static BatchReport of(List<SolverSolution> solutions, GraphStore.LoadReport load) {
        Objects.requireNonNull(solutions, "solutions");
        int accepted = 0, review = 0, abstain = 0, abstainedTokens = 0, warnings = 0;
        for (SolverSolution s : solutions) {
            if (s.sectionParseStatus == ParseStatus.ACCEPTED) accepted++;
            else if (s.sectionParseStatus == ParseStatus.REVIEW) review++;
            else abstain++;
            abstainedTokens += s.abstainedTokenIds.size();
            warnings += s.solverDiagnostics.warnings.size();
        }
        return new BatchReport(solutions.size(), accepted, review, abstain, abstainedTokens, warnings,
                load == null ? 0 : load.bad);
    }

    public String toBox() {
        return LogFmt.box("Clause graph batch", b -> b
                .kv("sections", sections)
                .kv("bad lines", badLines)
                .sep()
                .kv("accepted", accepted)
                .kv("review", review)
                .kv("abstain", abstain)
                .sep()
                .kv("abstained tokens", abstainedTokens)
                .kv("warnings", warnings));
    }

    @Override
    public String toString() {
        return "BatchReport{sections=" + sections + ", accepted=" + accepted + ", review=" + review
                + ", abstain=" + abstain + ", abstainedTokens=" + abstainedTokens + ", warnings=" + warnings
                + ", badLines=" + badLines + "}";
    }
}
