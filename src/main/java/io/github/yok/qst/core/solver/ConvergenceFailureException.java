package io.github.yok.qst.core.solver;

import lombok.Getter;

/**
 * 多点スタート推定のすべての試行が数値的に失敗した場合に発生する例外です。
 */
@Getter
public class ConvergenceFailureException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 実行した試行回数です。
     */
    private final int attempts;

    /**
     * 例外を生成します。
     *
     * @param attempts 実行した試行回数です
     * @param lastCause 最後に失敗した試行の原因です（null 可）
     */
    public ConvergenceFailureException(int attempts, Throwable lastCause) {
        super("最尤推定のすべての試行が失敗しました: attempts=" + attempts, lastCause);
        this.attempts = attempts;
    }
}
