package io.github.yok.boson.app;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.boson.core.algebra.Algebra;
import io.github.yok.boson.core.algebra.BosonicOperator;
import io.github.yok.boson.core.conversion.QuadratureConverter;
import io.github.yok.boson.core.ordering.NormalOrderer;
import io.github.yok.boson.core.realization.FockBasis;
import io.github.yok.boson.core.realization.OperatorRealizer;
import io.github.yok.boson.core.realization.SparseRealization;
import io.github.yok.boson.core.weyl.WeylQuantizer;
import io.github.yok.boson.out.OperatorReport;
import lombok.extern.slf4j.Slf4j;

/**
 * 入力演算子に対して、対称順序化 → 代数変換 → 正規順序化 → 行列化 を設定に従って順に適用するクラスです。
 *
 * <p>
 * 各段は新しい演算子を返し、入力は変更しません。
 * </p>
 */
@Slf4j
public final class OperatorPipeline {

    /**
     * 正規順序化器です。
     */
    private final NormalOrderer normalOrderer;

    /**
     * 代数変換器です。
     */
    private final QuadratureConverter converter;

    /**
     * 対称順序化器です。
     */
    private final WeylQuantizer weylQuantizer;

    /**
     * 行列化器です。
     */
    private final OperatorRealizer realizer;

    /**
     * パイプラインの段の設定です。
     */
    private final BosonAlgebraProperties.Pipeline stages;

    /**
     * 行列表現の設定です。
     */
    private final BosonAlgebraProperties.Realization realization;

    /**
     * パイプラインを生成します。
     *
     * @param normalOrderer 正規順序化器です（null 不可）
     * @param converter 代数変換器です（null 不可）
     * @param weylQuantizer 対称順序化器です（null 不可）
     * @param realizer 行列化器です（null 不可）
     * @param stages パイプラインの段の設定です（null 不可）
     * @param realization 行列表現の設定です（null 不可）
     * @throws IllegalArgumentException 設定値が不正な場合に発生します
     */
    public OperatorPipeline(NormalOrderer normalOrderer, QuadratureConverter converter,
            WeylQuantizer weylQuantizer, OperatorRealizer realizer,
            BosonAlgebraProperties.Pipeline stages,
            BosonAlgebraProperties.Realization realization) {
        this.normalOrderer = checkNotNull(normalOrderer, "normalOrderer は null 不可です");
        this.converter = checkNotNull(converter, "converter は null 不可です");
        this.weylQuantizer = checkNotNull(weylQuantizer, "weylQuantizer は null 不可です");
        this.realizer = checkNotNull(realizer, "realizer は null 不可です");
        this.stages = checkNotNull(stages, "pipeline は null 不可です");
        this.realization = checkNotNull(realization, "realization は null 不可です");

        checkArgument(normalOrderer.getHbar() == converter.getHbar(),
                "正規順序化器と変換器の hbar が一致しません: %s vs %s", normalOrderer.getHbar(),
                converter.getHbar());
        if (realization.isEnabled()) {
            checkArgument(realization.getTruncation() >= 1, "realization.truncation は 1 以上が必要です: %s",
                    realization.getTruncation());
            checkArgument(realization.getModes() >= 0, "realization.modes は 0 以上が必要です: %s",
                    realization.getModes());
        }
    }

    /**
     * パイプラインを実行します。
     *
     * @param label 出力用のラベルです
     * @param input 入力演算子です（null 不可）
     * @return 実行結果です
     */
    public OperatorReport process(String label, BosonicOperator input) {
        checkNotNull(input, "input は null 不可です");

        BosonicOperator current = input;

        // 1) 対称順序化（入力の各項を単項式とみなす）
        if (stages.isSymmetrize()) {
            current = weylQuantizer.symmetricOrdering(current);
            log.info("対称順序化しました。項数={}", current.termCount());
        }

        // 2) 代数変換
        Algebra target = stages.getConvertTo();
        if (target != null && target != current.getAlgebra()) {
            current = target == Algebra.QUADRATURE ? converter.toQuadrature(current)
                    : converter.toLadder(current);
            log.info("{} 代数に変換しました。項数={}", target, current.termCount());
        }

        // 3) 正規順序化
        if (stages.isNormalOrder()) {
            current = normalOrderer.normalOrder(current);
            log.info("正規順序化しました。項数={}、最大次数={}", current.termCount(), current.manyBodyOrder());
        }

        // 4) 行列化
        SparseRealization matrix = null;
        if (realization.isEnabled()) {
            int modes = realization.getModes() > 0 ? realization.getModes()
                    : Math.max(1, current.modeCount());
            matrix = realizer.realize(current, new FockBasis(realization.getTruncation(), modes));
        }

        return new OperatorReport(label, input, current, matrix, normalOrderer.getHbar());
    }
}
