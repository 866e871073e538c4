package io.github.yok.qst.out;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.qst.core.linearalgebra.PauliBasisAlgebra;
import io.github.yok.qst.core.measurement.MeasurementSimulator;
import io.github.yok.qst.core.model.QubitConfig;
import io.github.yok.qst.core.pipeline.TomographyPipeline;
import io.github.yok.qst.core.pipeline.TomographyResult;
import io.github.yok.qst.core.reduced.ReducedStateExtractor;
import io.github.yok.qst.core.solver.BobyqaLocalOptimizer;
import io.github.yok.qst.core.solver.MultiStartMaximumLikelihoodEstimator;
import io.github.yok.qst.core.solver.MultiStartSettings;
import io.github.yok.qst.core.state.FidelityEvaluator;
import io.github.yok.qst.core.state.HypersphericalStateParameterizer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvResultWriterTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("5 種類の CSV が命名規約どおりに出力される")
    void writesAllResultFiles() throws IOException {
        TomographyResult result = runTwoQubits();

        new CsvResultWriter(dir.toString()).write(result);

        for (String kind : new String[] {"parameters", "amplitudes", "bloch", "outcomes", "meta"}) {
            assertThat(dir.resolve(CsvResultWriter.buildFileName(kind, 2, 3L))).exists();
        }

        List<String> parameters = read("parameters");
        assertThat(parameters.get(0)).isEqualTo("i,theta.true,phi.true,theta.estimated,phi.estimated");
        assertThat(parameters).hasSize(1 + 3);

        List<String> amplitudes = read("amplitudes");
        assertThat(amplitudes).hasSize(1 + 4);
        assertThat(amplitudes.get(2)).startsWith("1,01,");

        assertThat(read("bloch")).hasSize(1 + 2);
        assertThat(read("outcomes")).hasSize(1 + 15);
        assertThat(read("outcomes").get(1)).startsWith("IX,200,");

        List<String> meta = read("meta");
        assertThat(meta).contains("input.n,2", "input.seed,3", "input.shots.X,200",
                "attempts,4");
        assertThat(meta).anyMatch(line -> line.startsWith("fidelity,"));
    }

    @Test
    @DisplayName("出力先や結果が無い場合は拒否する")
    void rejectsMissingDirectory() {
        assertThatThrownBy(() -> new CsvResultWriter(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CsvResultWriter(dir.toString()).write(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private List<String> read(String kind) throws IOException {
        return Files.readAllLines(dir.resolve(CsvResultWriter.buildFileName(kind, 2, 3L)),
                StandardCharsets.UTF_8);
    }

    private static TomographyResult runTwoQubits() {
        HypersphericalStateParameterizer parameterizer = new HypersphericalStateParameterizer();
        PauliBasisAlgebra algebra = new PauliBasisAlgebra();
        TomographyPipeline pipeline = new TomographyPipeline(parameterizer, algebra,
                new MeasurementSimulator(algebra),
                new MultiStartMaximumLikelihoodEstimator(parameterizer, algebra,
                        new BobyqaLocalOptimizer(0.5, 1e-6, 5000),
                        new MultiStartSettings(4, 1e-6, 1, Duration.ZERO)),
                new FidelityEvaluator(), new ReducedStateExtractor());
        return pipeline.run(pipeline.create(QubitConfig.of(2, 200, 300, 400), 3L));
    }
}
