package io.github.yok.boson.app;

import io.github.yok.boson.core.conversion.QuadratureConverter;
import io.github.yok.boson.core.ordering.NormalOrderer;
import io.github.yok.boson.core.realization.FockSpaceRealizer;
import io.github.yok.boson.core.realization.OperatorRealizer;
import io.github.yok.boson.core.weyl.WeylQuantizer;
import io.github.yok.boson.out.CsvResultWriter;
import io.github.yok.boson.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 演算子代数の各コンポーネント（正規順序化・変換・対称順序化・行列化・出力）の Bean 定義を行う設定クラスです。
 *
 * <p>
 * ħ は設定値 {@code boson.hbar} をすべてのコンポーネントで共有します。
 * </p>
 */
@Configuration
@RequiredArgsConstructor
public class BosonAlgebraConfiguration {

    /**
     * boson-algebra の設定値（boson.*）です。
     */
    private final BosonAlgebraProperties p;

    /**
     * 正規順序化器を生成します。
     *
     * @return 正規順序化器です
     */
    @Bean
    public NormalOrderer normalOrderer() {
        return new NormalOrderer(p.getHbar());
    }

    /**
     * ラダー ⇄ 直交位相の変換器を生成します。
     *
     * @return 変換器です
     */
    @Bean
    public QuadratureConverter quadratureConverter() {
        return new QuadratureConverter(p.getHbar());
    }

    /**
     * Weyl 量子化（対称順序化）器を生成します。
     *
     * @return 対称順序化器です
     */
    @Bean
    public WeylQuantizer weylQuantizer() {
        return new WeylQuantizer();
    }

    /**
     * 行列化器を生成します。
     *
     * @param converter 直交位相 → ラダー変換器です
     * @return 行列化器です
     */
    @Bean
    public OperatorRealizer operatorRealizer(QuadratureConverter converter) {
        return new FockSpaceRealizer(converter);
    }

    /**
     * 設定値から入力演算子を組み立てるファクトリを生成します。
     *
     * @return ファクトリです
     */
    @Bean
    public ConfiguredOperatorFactory configuredOperatorFactory() {
        return new ConfiguredOperatorFactory();
    }

    /**
     * 演算子パイプラインを生成します。
     *
     * @param normalOrderer 正規順序化器です
     * @param converter 変換器です
     * @param weylQuantizer 対称順序化器です
     * @param realizer 行列化器です
     * @return パイプラインです
     */
    @Bean
    public OperatorPipeline operatorPipeline(NormalOrderer normalOrderer,
            QuadratureConverter converter, WeylQuantizer weylQuantizer, OperatorRealizer realizer) {
        return new OperatorPipeline(normalOrderer, converter, weylQuantizer, realizer,
                p.getPipeline(), p.getRealization());
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
