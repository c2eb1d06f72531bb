package io.github.yok.boson.out;

import io.github.yok.boson.core.algebra.BosonicOperator;
import io.github.yok.boson.core.realization.SparseRealization;
import lombok.Value;

/**
 * 演算子パイプラインの実行結果（出力対象）を保持するクラスです。
 */
@Value
public class OperatorReport {

    /**
     * 出力ファイル名に使うラベルです。
     */
    String label;

    /**
     * 入力演算子です。
     */
    BosonicOperator input;

    /**
     * パイプライン適用後の演算子です。
     */
    BosonicOperator result;

    /**
     * 行列表現です（行列化を行わない場合は null）。
     */
    SparseRealization realization;

    /**
     * 変換・正規順序化・行列化に用いた ħ です。
     */
    double hbar;

    /**
     * 行列表現を含むかを返します。
     *
     * @return 含む場合は true です
     */
    public boolean hasRealization() {
        return realization != null;
    }
}
