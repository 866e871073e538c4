package io.github.yok.qst.core.pipeline;

import io.github.yok.qst.core.model.QubitConfig;
import io.github.yok.qst.core.state.ParameterVector;
import io.github.yok.qst.core.state.StateVector;
import lombok.Value;

/**
 * 1 回のトモグラフィ実行の入力（設定、シード、真の状態）を保持するクラスです。
 */
@Value
public class TomographySession {

    /**
     * 量子ビット数とショット数の設定です。
     */
    QubitConfig config;

    /**
     * 実行全体の乱数シードです。
     */
    long seed;

    /**
     * 真の角度列です。
     */
    ParameterVector trueParameters;

    /**
     * 真の状態です。
     */
    StateVector trueState;

    /**
     * 真の角度列が外部から与えられたかどうかです。
     */
    boolean suppliedParameters;
}
