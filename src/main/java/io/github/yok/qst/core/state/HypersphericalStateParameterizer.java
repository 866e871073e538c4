package io.github.yok.qst.core.state;

import org.apache.commons.math3.complex.Complex;

/**
 * 超球座標による「剥ぎ取り」構成で純粋状態を生成するクラスです。
 *
 * <p>
 * 残差振幅 r=1 から始め、i=0..d-2 について {@code a_i = r cos(θ_i/2)}（i ≥ 1 では位相 {@code e^{iφ_{i-1}}} を付与）、
 * {@code r ← r sin(θ_i/2)} と更新します。 最後の振幅 {@code a_{d-1}} は残差 r をすべて受け取り、位相 {@code φ_{d-2}}
 * を持ちます。 Σ|a_i|^2 は構成上 1 になるため、再正規化は行いません。
 * </p>
 */
public final class HypersphericalStateParameterizer implements StateParameterizer {

    @Override
    public StateVector generateState(ParameterVector parameters) {
        if (parameters == null) {
            throw new IllegalArgumentException("parameters は null 不可です");
        }
        int dim = parameters.size() + 1;
        int last = dim - 1;

        Complex[] amplitudes = new Complex[dim];
        double residual = 1.0;

        for (int i = 0; i < last; i++) {
            double halfTheta = parameters.theta(i) / 2.0;
            double magnitude = residual * Math.cos(halfTheta);
            amplitudes[i] = (i == 0) ? new Complex(magnitude, 0.0)
                    : withPhase(magnitude, parameters.phi(i - 1));
            residual *= Math.sin(halfTheta);
        }
        amplitudes[last] = withPhase(residual, parameters.phi(last - 1));

        return new StateVector(amplitudes);
    }

    /**
     * 大きさ（負値も可）と位相から複素数を作ります。
     */
    private static Complex withPhase(double magnitude, double phase) {
        return new Complex(magnitude * Math.cos(phase), magnitude * Math.sin(phase));
    }
}
