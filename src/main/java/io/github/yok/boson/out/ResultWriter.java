package io.github.yok.boson.out;

/**
 * 演算子パイプラインの結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 結果を出力します。
     *
     * @param report 実行結果です
     */
    void write(OperatorReport report);
}
