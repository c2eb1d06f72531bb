package io.github.yok.boson.app;

import io.github.yok.boson.core.algebra.BosonicOperator;
import io.github.yok.boson.out.OperatorReport;
import io.github.yok.boson.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * CLI で boson-algebra を実行するクラスです。
 *
 * <p>
 * 設定値から入力演算子を組み立て、パイプライン（対称順序化・変換・正規順序化・行列化）を適用して結果を出力します。
 * {@code boson.cli.enabled=false} の場合は登録されません。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "boson.cli", name = "enabled", havingValue = "true",
        matchIfMissing = true)
public class BosonAlgebraCliRunner implements CommandLineRunner {

    /**
     * boson-algebra の設定値（boson.*）です。
     */
    private final BosonAlgebraProperties properties;

    /**
     * 入力演算子のファクトリです。
     */
    private final ConfiguredOperatorFactory operatorFactory;

    /**
     * 演算子パイプラインです。
     */
    private final OperatorPipeline pipeline;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== boson-algebra start ===");
        System.out.print(properties.toMultilineString());

        String label = properties.getInput().getLabel();
        if (label == null || label.isEmpty()) {
            throw new IllegalStateException("input.label は必須です");
        }

        BosonicOperator input = operatorFactory.create(properties.getInput());
        log.info("入力演算子を組み立てました。ラベル={}、代数={}、項数={}", label, input.getAlgebra(),
                input.termCount());

        OperatorReport report = pipeline.process(label, input);

        resultWriter.write(report);

        BosonicOperator result = report.getResult();
        System.out.println("結果: 代数=" + result.getAlgebra() + ", 項数=" + result.termCount()
                + ", 正規順序=" + result.isNormalOrdered() + ", エルミート=" + result.isHermitian());
        if (report.hasRealization()) {
            System.out.println("結果: 行列次元=" + report.getRealization().dimension() + ", 非零要素数="
                    + report.getRealization().nonZeroCount());
        }
        System.out.println(result);
    }
}
