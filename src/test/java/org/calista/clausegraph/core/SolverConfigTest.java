package org.calista.clausegraph.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.clausegraph.io.FileIO;
import org.calista.clausegraph.solution.SolutionCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SolverConfig and SolverOptions")
class SolverConfigTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = SolutionCodec.defaultMapper();

    @Test
    @DisplayName("Should create a default config file when none exists")
    void shouldWriteDefaults_whenFileMissing() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("config/solver.json");

        SolverConfig cfg = SolverConfig.loadOrCreate(io, file, mapper);

        assertThat(Files.exists(file)).isTrue();
        assertThat(cfg.solver.abstainMarginThreshold).isEqualTo(0.08);
        assertThat(cfg.solver.reviewMarginThreshold).isEqualTo(0.20);
        assertThat(cfg.solver.sectionAbstainRatioThreshold).isEqualTo(0.40);
        assertThat(cfg.solver.parserVersion).isEqualTo("parser_v2_solver_v1");
        assertThat(Files.readString(file)).contains("\"abstainMarginThreshold\" : 0.08");
    }

    @Test
    @DisplayName("Should recreate defaults when the file is blank")
    void shouldRecreate_whenFileBlank() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("solver.json");
        Files.writeString(file, "   ");

        SolverConfig cfg = SolverConfig.loadOrCreate(io, file, mapper);

        assertThat(cfg.baseDir).isEqualTo("data");
        assertThat(Files.readString(file)).contains("\"solver\"");
    }

    @Test
    @DisplayName("Should normalize invalid values on load and ignore unknown keys")
    void shouldNormalize_whenValuesInvalid() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = dir.resolve("solver.json");
        Files.writeString(file, "{\"baseDir\":\"\",\"legacy\":true,"
                + "\"solver\":{\"abstainMarginThreshold\":0.25,\"reviewMarginThreshold\":0.1,\"minTop1Score\":-1},"
                + "\"batch\":{\"parallelism\":3,\"queueCapacity\":0,\"threadNamePrefix\":\"\"}}");

        SolverConfig cfg = SolverConfig.loadOrCreate(io, file, mapper);

        assertThat(cfg.baseDir).isEqualTo("data");
        assertThat(cfg.solver.abstainMarginThreshold).isEqualTo(0.25);
        assertThat(cfg.solver.reviewMarginThreshold).isEqualTo(0.25);
        assertThat(cfg.solver.minTop1Score).isEqualTo(0.12);
        assertThat(cfg.batch.parallelism).isEqualTo(3);
        assertThat(cfg.batch.queueCapacity).isEqualTo(1024);
        assertThat(cfg.batch.threadNamePrefix).isEqualTo("section-solve-");
    }

    @Test
    @DisplayName("Should build options from the config section")
    void shouldMapConfig_whenBuildingOptions() {
        SolverConfig.Solver s = new SolverConfig.Solver();
        s.parserVersion = "parser_v2_test";
        s.sectionAbstainRatioThreshold = 0.5;
        s.singleCandidateGap = 0.4;

        SolverOptions o = SolverOptions.from(s);

        assertThat(o.parserVersion).isEqualTo("parser_v2_test");
        assertThat(o.sectionAbstainRatioThreshold).isEqualTo(0.5);
        assertThat(o.singleCandidateGap).isEqualTo(0.4);
        assertThat(o.abstainMarginThreshold).isEqualTo(0.08);
    }

    @Test
    @DisplayName("Should fall back to defaults for non-finite or negative thresholds")
    void shouldFallBack_whenThresholdInvalid() {
        SolverOptions o = SolverOptions.builder()
                .abstainMarginThreshold(Double.NaN)
                .reviewMarginThreshold(-0.5)
                .build();

        assertThat(o.abstainMarginThreshold).isEqualTo(SolverOptions.DEFAULT_ABSTAIN_MARGIN_THRESHOLD);
        assertThat(o.reviewMarginThreshold).isEqualTo(SolverOptions.DEFAULT_REVIEW_MARGIN_THRESHOLD);
    }

    @Test
    @DisplayName("Should reject a blank parser version instead of substituting the default")
    void shouldThrow_whenParserVersionBlank() {
        assertThatThrownBy(() -> SolverOptions.builder().parserVersion(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parserVersion");
        assertThatThrownBy(() -> SolverOptions.builder().parserVersion(null).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(SolverOptions.builder().parserVersion(" pv ").build().parserVersion).isEqualTo(" pv ");
    }
}
