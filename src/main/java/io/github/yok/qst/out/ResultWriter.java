package io.github.yok.qst.out;

import io.github.yok.qst.core.pipeline.TomographyResult;

/**
 * トモグラフィ結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * トモグラフィ結果を出力します。
     *
     * @param result トモグラフィ結果です
     */
    void write(TomographyResult result);
}
