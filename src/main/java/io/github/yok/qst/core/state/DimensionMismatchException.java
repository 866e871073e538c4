package io.github.yok.qst.core.state;

import lombok.Getter;

/**
 * 角度列の長さや状態の次元が量子ビット数と一致しない場合に発生する例外です。
 */
@Getter
public class DimensionMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 期待した長さです（不定の場合は -1）。
     */
    private final int expected;

    /**
     * 実際の長さです。
     */
    private final int actual;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     * @param expected 期待した長さです（不定の場合は -1）
     * @param actual 実際の長さです
     */
    public DimensionMismatchException(String message, int expected, int actual) {
        super(message + ": expected=" + expected + ", actual=" + actual);
        this.expected = expected;
        this.actual = actual;
    }
}
