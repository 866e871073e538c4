package io.github.yok.qst.app;

import java.time.Duration;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * qst-mle の設定値（qst.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "qst")
public class QstProperties {

    /**
     * モデル設定です。
     */
    @Valid
    private Model model = new Model();

    /**
     * 軸ごとのショット数です。
     */
    @Valid
    private Shots shots = new Shots();

    /**
     * 外部から与える真の状態の角度列です。
     */
    private TrueState trueState = new TrueState();

    /**
     * 乱数設定です。
     */
    private Random random = new Random();

    /**
     * 最尤推定（多点スタート）の設定です。
     */
    @Valid
    private Estimation estimation = new Estimation();

    /**
     * 確率計算の設定です。
     */
    private Probability probability = new Probability();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "qst")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Model m = getModel();
        Shots s = getShots();
        TrueState ts = getTrueState();
        Estimation e = getEstimation();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "model",
                // qubitCountScan.values: 計算する量子ビット数の一覧
                "qubitCountScan.values", m.getQubitCountScan().getValues());

        appendSection(sb, nl, "shots",
                "x", s.getX(),
                "y", s.getY(),
                "z", s.getZ());

        appendSection(sb, nl, "trueState",
                // 空の場合は乱数で真の状態を生成
                "thetas", ts.getThetas(),
                "phis", ts.getPhis());

        appendSection(sb, nl, "random",
                "seed", getRandom().getSeed());

        appendSection(sb, nl, "estimation",
                // restarts: 多点スタートの試行回数
                "restarts", e.getRestarts(),
                // phiUpperMargin: φ の上限を 2π - δ とする余白 δ
                "phiUpperMargin", e.getPhiUpperMargin(),
                "initialTrustRegionRadius", e.getInitialTrustRegionRadius(),
                "stoppingTrustRegionRadius", e.getStoppingTrustRegionRadius(),
                "maxEvaluations", e.getMaxEvaluations(),
                // parallelism: 0 は利用可能なプロセッサ数
                "parallelism", e.getParallelism(),
                "attemptTimeout", e.getAttemptTimeout());

        appendSection(sb, nl, "probability",
                "tolerance", getProbability().getTolerance());

        appendSection(sb, nl, "output",
                "dir", getOutput().getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Model {

        /**
         * 量子ビット数を指定して計算を繰り返す設定です。
         */
        @Valid
        private QubitCountScan qubitCountScan = new QubitCountScan();

        @Data
        public static class QubitCountScan {

            /**
             * 計算する量子ビット数の一覧です。
             */
            @NotEmpty
            private List<@NotNull @Min(1) Integer> values = List.of(1, 2);
        }
    }

    @Data
    public static class Shots {

        /**
         * X 軸のショット数です。
         */
        @Min(1)
        private int x = 1000;

        /**
         * Y 軸のショット数です。
         */
        @Min(1)
        private int y = 1000;

        /**
         * Z 軸のショット数です。
         */
        @Min(1)
        private int z = 1000;
    }

    @Data
    public static class TrueState {

        /**
         * 真の θ 列です（空の場合は乱数）。
         */
        private List<Double> thetas = List.of();

        /**
         * 真の φ 列です（空の場合は乱数）。
         */
        private List<Double> phis = List.of();

        /**
         * θ, φ の両方が指定されているかどうかを返します。
         *
         * @return 両方が空でない場合 true です
         */
        public boolean isSupplied() {
            return thetas != null && !thetas.isEmpty() && phis != null && !phis.isEmpty();
        }
    }

    @Data
    public static class Random {

        /**
         * 乱数シードです（未指定の場合は起動時に生成）。
         */
        private Long seed;
    }

    @Data
    public static class Estimation {

        /**
         * 多点スタートの試行回数です。
         */
        @Min(1)
        private int restarts = 50;

        /**
         * φ の上限を 2π - δ とする余白 δ です。
         */
        private double phiUpperMargin = 1e-6;

        /**
         * BOBYQA の信頼領域の初期半径です。
         */
        private double initialTrustRegionRadius = 0.5;

        /**
         * BOBYQA の停止半径です。
         */
        private double stoppingTrustRegionRadius = 1e-8;

        /**
         * 1 試行あたりの目的関数の最大評価回数です。
         */
        @Min(1)
        private int maxEvaluations = 20000;

        /**
         * 並列度です（0 は利用可能なプロセッサ数）。
         */
        @Min(0)
        private int parallelism = 0;

        /**
         * 全試行に対する制限時間です（0 は無制限）。
         */
        private Duration attemptTimeout = Duration.ZERO;
    }

    @Data
    public static class Probability {

        /**
         * 確率の虚部・範囲外の許容誤差です。
         */
        private double tolerance = 1e-9;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
