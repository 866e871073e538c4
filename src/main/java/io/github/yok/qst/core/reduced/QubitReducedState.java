package io.github.yok.qst.core.reduced;

import lombok.Value;

/**
 * 1 量子ビットの縮約密度行列とブロッホベクトルの組です。
 */
@Value
public class QubitReducedState {

    /**
     * 量子ビット番号です。
     */
    int qubit;

    /**
     * 縮約密度行列です。
     */
    ReducedDensityMatrix densityMatrix;

    /**
     * ブロッホベクトルです。
     */
    BlochVector blochVector;
}
