package io.github.yok.qst.app;

import io.github.yok.qst.core.model.QubitConfig;
import io.github.yok.qst.core.pipeline.TomographyPipeline;
import io.github.yok.qst.core.pipeline.TomographyResult;
import io.github.yok.qst.core.pipeline.TomographySession;
import io.github.yok.qst.core.reduced.BlochVector;
import io.github.yok.qst.core.reduced.QubitReducedState;
import io.github.yok.qst.core.state.ParameterVector;
import io.github.yok.qst.out.ResultWriter;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で qst-mle を実行するクラスです。
 *
 * <p>
 * 量子ビット数をスキャンし、各量子ビット数について真の状態の生成、測定の模擬、最尤推定、忠実度の計算を行います。
 * 設定の誤り（角度列の長さなど）は、すべての量子ビット数について測定の模擬より前に検出します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class QstCliRunner implements CommandLineRunner {

    /**
     * qst-mle の設定値（qst.*）です。
     */
    private final QstProperties properties;

    /**
     * トモグラフィの実行パイプラインです。
     */
    private final TomographyPipeline pipeline;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== qst-mle start: maximum likelihood state tomography ===");
        System.out.print(properties.toMultilineString());

        List<Integer> qubitCounts = properties.getModel().getQubitCountScan().getValues();
        if (qubitCounts == null || qubitCounts.isEmpty()) {
            throw new IllegalStateException("qubitCountScan.values は必須です（量子ビット数の一覧を指定してください）");
        }

        Long configuredSeed = properties.getRandom().getSeed();
        long seed = (configuredSeed != null) ? configuredSeed : new SecureRandom().nextLong();
        System.out.println("乱数シード: " + seed + (configuredSeed != null ? "（指定）" : "（生成）"));

        // 先にすべてのセッションを作り、設定の誤りを測定の模擬より前に検出する
        List<TomographySession> sessions = new ArrayList<>(qubitCounts.size());
        for (Integer n : qubitCounts) {
            if (n == null) {
                throw new IllegalStateException("qubitCountScan.values に null が含まれています");
            }
            QubitConfig config = QubitConfig.of(n, properties.getShots().getX(),
                    properties.getShots().getY(), properties.getShots().getZ());
            sessions.add(pipeline.create(config, seed, suppliedParameters(n)));
        }

        for (int i = 0; i < sessions.size(); i++) {
            TomographySession session = sessions.get(i);
            int n = session.getConfig().getQubitCount();

            System.out.println("=== 量子ビット数ごとの計算 ===");
            System.out.println("入力: n=" + n + ", shots=" + session.getConfig().getShotsPerAxis()
                    + "（step=" + (i + 1) + "/" + sessions.size() + "）");

            TomographyResult result = pipeline.run(session);
            resultWriter.write(result);

            System.out.println("結果: fidelity=" + fmt5(result.getFidelity()) + ", NLL(推定)="
                    + fmt5(result.getEstimation().getObjective()) + ", NLL(真)="
                    + fmt5(result.getTrueObjective()) + ", 成功試行="
                    + result.getEstimation().getSucceededAttempts() + "/"
                    + result.getEstimation().getAttempts());
            for (int q = 0; q < n; q++) {
                System.out.println("結果: qubit" + q + " bloch(真)="
                        + fmt(result.getTrueReducedStates().get(q)) + ", bloch(推定)="
                        + fmt(result.getReconstructedReducedStates().get(q)));
            }
        }
    }

    /**
     * 設定で真の角度列が与えられていれば、量子ビット数 n の角度列として返します。
     *
     * @param n 量子ビット数です
     * @return 角度列です（未指定の場合は null）
     */
    private ParameterVector suppliedParameters(int n) {
        QstProperties.TrueState ts = properties.getTrueState();
        if (!ts.isSupplied()) {
            return null;
        }
        return ParameterVector.of(n, toArray(ts.getThetas()), toArray(ts.getPhis()));
    }

    private static double[] toArray(List<Double> values) {
        double[] array = new double[values.size()];
        for (int i = 0; i < array.length; i++) {
            Double v = values.get(i);
            if (v == null) {
                throw new IllegalStateException("trueState に null が含まれています: index=" + i);
            }
            array[i] = v;
        }
        return array;
    }

    private static String fmt(QubitReducedState state) {
        BlochVector v = state.getBlochVector();
        return "(" + fmt5(v.getX()) + ", " + fmt5(v.getY()) + ", " + fmt5(v.getZ()) + ")";
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
