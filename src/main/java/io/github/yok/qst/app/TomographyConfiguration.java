package io.github.yok.qst.app;

import io.github.yok.qst.core.linearalgebra.PauliBasisAlgebra;
import io.github.yok.qst.core.measurement.MeasurementSimulator;
import io.github.yok.qst.core.pipeline.TomographyPipeline;
import io.github.yok.qst.core.reduced.ReducedStateExtractor;
import io.github.yok.qst.core.solver.BobyqaLocalOptimizer;
import io.github.yok.qst.core.solver.LocalOptimizer;
import io.github.yok.qst.core.solver.MultiStartMaximumLikelihoodEstimator;
import io.github.yok.qst.core.solver.MultiStartSettings;
import io.github.yok.qst.core.solver.ParameterEstimator;
import io.github.yok.qst.core.state.FidelityEvaluator;
import io.github.yok.qst.core.state.HypersphericalStateParameterizer;
import io.github.yok.qst.core.state.StateParameterizer;
import io.github.yok.qst.out.CsvResultWriter;
import io.github.yok.qst.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 超球座標パラメータ化 + Pauli 積測定 + 多点スタート最尤推定の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class TomographyConfiguration {

    /**
     * qst-mle の設定値（qst.*）です。
     */
    private final QstProperties p;

    /**
     * 角度列から状態を生成するコンポーネントを生成します。
     *
     * @return パラメータ化です
     */
    @Bean
    public StateParameterizer stateParameterizer() {
        return new HypersphericalStateParameterizer();
    }

    /**
     * Pauli 演算子と測定確率の計算コンポーネントを生成します。
     *
     * @return 計算コンポーネントです
     */
    @Bean
    public PauliBasisAlgebra pauliBasisAlgebra() {
        return new PauliBasisAlgebra(p.getProbability().getTolerance());
    }

    /**
     * 測定の模擬コンポーネントを生成します。
     *
     * @param algebra 測定確率の計算コンポーネントです
     * @return 測定の模擬コンポーネントです
     */
    @Bean
    public MeasurementSimulator measurementSimulator(PauliBasisAlgebra algebra) {
        return new MeasurementSimulator(algebra);
    }

    /**
     * 局所最適化器（BOBYQA）を生成します。
     *
     * @return 局所最適化器です
     */
    @Bean
    public LocalOptimizer localOptimizer() {
        QstProperties.Estimation e = p.getEstimation();
        return new BobyqaLocalOptimizer(e.getInitialTrustRegionRadius(),
                e.getStoppingTrustRegionRadius(), e.getMaxEvaluations());
    }

    /**
     * 多点スタート最尤推定器を生成します。
     *
     * @param parameterizer パラメータ化です
     * @param algebra 測定確率の計算コンポーネントです
     * @param localOptimizer 局所最適化器です
     * @return 推定器です
     */
    @Bean
    public ParameterEstimator parameterEstimator(StateParameterizer parameterizer,
            PauliBasisAlgebra algebra, LocalOptimizer localOptimizer) {
        QstProperties.Estimation e = p.getEstimation();
        int parallelism = e.getParallelism() > 0 ? e.getParallelism()
                : Runtime.getRuntime().availableProcessors();
        MultiStartSettings settings = new MultiStartSettings(e.getRestarts(),
                e.getPhiUpperMargin(), parallelism, e.getAttemptTimeout());
        return new MultiStartMaximumLikelihoodEstimator(parameterizer, algebra, localOptimizer,
                settings);
    }

    /**
     * トモグラフィの実行パイプラインを生成します。
     *
     * @param parameterizer パラメータ化です
     * @param algebra 測定確率の計算コンポーネントです
     * @param simulator 測定の模擬コンポーネントです
     * @param estimator 推定器です
     * @return パイプラインです
     */
    @Bean
    public TomographyPipeline tomographyPipeline(StateParameterizer parameterizer,
            PauliBasisAlgebra algebra, MeasurementSimulator simulator,
            ParameterEstimator estimator) {
        return new TomographyPipeline(parameterizer, algebra, simulator, estimator,
                new FidelityEvaluator(), new ReducedStateExtractor());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
