package io.github.yok.qst.out;

import io.github.yok.qst.core.linearalgebra.BasisSetting;
import io.github.yok.qst.core.linearalgebra.Pauli;
import io.github.yok.qst.core.measurement.OutcomeSet;
import io.github.yok.qst.core.pipeline.TomographyResult;
import io.github.yok.qst.core.reduced.BlochVector;
import io.github.yok.qst.core.reduced.QubitReducedState;
import io.github.yok.qst.core.state.ParameterVector;
import io.github.yok.qst.core.state.QubitOrdering;
import io.github.yok.qst.core.state.StateVector;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.math3.complex.Complex;

/**
 * トモグラフィ結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（n は量子ビット数、seed は乱数シード）。
 * </p>
 *
 * <ul>
 * <li>{@code qst_parameters_n=2_seed=42.csv}（真と推定の θ, φ）</li>
 * <li>{@code qst_amplitudes_n=2_seed=42.csv}（真と再構成の振幅、確率）</li>
 * <li>{@code qst_bloch_n=2_seed=42.csv}（量子ビットごとのブロッホベクトル）</li>
 * <li>{@code qst_outcomes_n=2_seed=42.csv}（基底設定ごとの n+, n-, 期待値）</li>
 * <li>{@code qst_meta_n=2_seed=42.csv}（忠実度、目的関数値、試行回数など）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "qst";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * トモグラフィ結果を出力します。
     *
     * @param result トモグラフィ結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(TomographyResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        if (!Double.isFinite(result.getFidelity())) {
            throw new IllegalArgumentException("忠実度は有限値である必要があります: " + result.getFidelity());
        }

        try {
            Files.createDirectories(outputDir);

            writeParametersCsv(result);
            writeAmplitudesCsv(result);
            writeBlochCsv(result);
            writeOutcomesCsv(result);
            writeMetaCsv(result);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 真と推定の角度列を出力します。
     *
     * @param result トモグラフィ結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeParametersCsv(TomographyResult result) throws IOException {
        ParameterVector t = result.getTrueParameters();
        ParameterVector e = result.getEstimatedParameters();

        try (Writer w = Files.newBufferedWriter(file("parameters", result), StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("i", "theta.true", "phi.true", "theta.estimated",
                                "phi.estimated")
                        .build().print(w)) {

            for (int i = 0; i < t.size(); i++) {
                pr.printRecord(i, t.theta(i), t.phi(i), e.theta(i), e.phi(i));
            }
        }
    }

    /**
     * 真と再構成の振幅を出力します。
     *
     * @param result トモグラフィ結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeAmplitudesCsv(TomographyResult result) throws IOException {
        StateVector t = result.getTrueState();
        StateVector r = result.getReconstructedState();
        int n = t.qubitCount();

        try (Writer w = Files.newBufferedWriter(file("amplitudes", result), StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("index", "basis", "true.re", "true.im", "true.prob",
                                "reconstructed.re", "reconstructed.im", "reconstructed.prob")
                        .build().print(w)) {

            for (int k = 0; k < t.dimension(); k++) {
                Complex a = t.amplitude(k);
                Complex b = r.amplitude(k);
                pr.printRecord(k, basisLabel(k, n), a.getReal(), a.getImaginary(),
                        a.abs() * a.abs(), b.getReal(), b.getImaginary(), b.abs() * b.abs());
            }
        }
    }

    /**
     * 量子ビットごとのブロッホベクトルと純度を出力します。
     *
     * @param result トモグラフィ結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeBlochCsv(TomographyResult result) throws IOException {
        List<QubitReducedState> t = result.getTrueReducedStates();
        List<QubitReducedState> r = result.getReconstructedReducedStates();

        try (Writer w = Files.newBufferedWriter(file("bloch", result), StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("qubit", "true.x", "true.y", "true.z", "true.purity",
                                "reconstructed.x", "reconstructed.y", "reconstructed.z",
                                "reconstructed.purity")
                        .build().print(w)) {

            for (int q = 0; q < t.size(); q++) {
                BlochVector a = t.get(q).getBlochVector();
                BlochVector b = r.get(q).getBlochVector();
                pr.printRecord(q, a.getX(), a.getY(), a.getZ(),
                        t.get(q).getDensityMatrix().purity(), b.getX(), b.getY(), b.getZ(),
                        r.get(q).getDensityMatrix().purity());
            }
        }
    }

    /**
     * 基底設定ごとの測定件数と期待値を出力します。
     *
     * @param result トモグラフィ結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeOutcomesCsv(TomographyResult result) throws IOException {
        OutcomeSet outcomes = result.getOutcomes();

        try (Writer w = Files.newBufferedWriter(file("outcomes", result), StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("setting", "shots", "plus", "minus", "expectation")
                        .build().print(w)) {

            for (BasisSetting setting : outcomes.settings()) {
                pr.printRecord(setting.label(), outcomes.shots(setting),
                        outcomes.plusCount(setting), outcomes.minusCount(setting),
                        outcomes.empiricalExpectation(setting));
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param result トモグラフィ結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(TomographyResult result) throws IOException {
        try (Writer w = Files.newBufferedWriter(file("meta", result), StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("input.n", result.getConfig().getQubitCount());
            pr.printRecord("input.seed", result.getSeed());
            for (Map.Entry<Pauli, Integer> e : result.getConfig().getShotsPerAxis().entrySet()) {
                pr.printRecord("input.shots." + e.getKey(), e.getValue());
            }

            pr.printRecord("fidelity", result.getFidelity());
            pr.printRecord("objective.estimated", result.getEstimation().getObjective());
            pr.printRecord("objective.true", result.getTrueObjective());

            pr.printRecord("attempts", result.getEstimation().getAttempts());
            pr.printRecord("attempts.succeeded", result.getEstimation().getSucceededAttempts());
            pr.printRecord("attempts.best", result.getEstimation().getBestAttempt());

            pr.printRecord("norm.true", result.getTrueState().norm());
            pr.printRecord("norm.reconstructed", result.getReconstructedState().norm());
        }
    }

    private Path file(String kind, TomographyResult result) {
        return outputDir.resolve(buildFileName(kind, result.getConfig().getQubitCount(),
                result.getSeed()));
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code qst_meta_n=2_seed=42.csv}
     * </p>
     *
     * @param kind 量の識別子（parameters/amplitudes/bloch/outcomes/meta）
     * @param qubitCount 量子ビット数です
     * @param seed 乱数シードです
     * @return ファイル名です
     */
    static String buildFileName(String kind, int qubitCount, long seed) {
        return FILE_HEAD + "_" + kind + "_n=" + qubitCount + "_seed=" + seed + ".csv";
    }

    /**
     * 計算基底インデックスを 0101 形式のビット列（量子ビット 0 が左端）にします。
     */
    private static String basisLabel(int index, int qubitCount) {
        StringBuilder sb = new StringBuilder(qubitCount);
        for (int q = 0; q < qubitCount; q++) {
            sb.append(QubitOrdering.bitOf(index, q, qubitCount));
        }
        return sb.toString();
    }
}
