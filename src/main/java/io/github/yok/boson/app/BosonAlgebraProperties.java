package io.github.yok.boson.app;

import io.github.yok.boson.core.algebra.Algebra;
import io.github.yok.boson.core.algebra.FactorKind;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import javax.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * boson-algebra の設定値（boson.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の入力演算子とパイプラインの構成に使用します。 入力演算子は文字列表記ではなく、項ごとの係数と因子（モード番号と種類）の構造で指定します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "boson")
public class BosonAlgebraProperties {

    /**
     * ħ（直交位相の交換子 [q, p] = iħ の大きさ）です。
     */
    @Positive
    private double hbar = 1.0;

    /**
     * 入力演算子の設定です。
     */
    @Valid
    private Input input = new Input();

    /**
     * パイプラインの設定です。
     */
    private Pipeline pipeline = new Pipeline();

    /**
     * 行列表現の設定です。
     */
    private Realization realization = new Realization();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * CLI 実行の設定です。
     */
    private Cli cli = new Cli();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "boson")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Input in = getInput();
        Pipeline pl = getPipeline();
        Realization r = getRealization();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        sb.append("  hbar: ").append(getHbar()).append(nl);

        appendSection(sb, nl, "input",
                // label: 出力ファイル名に使うラベル
                "label", in.getLabel(),
                // algebra: LADDER/QUADRATURE
                "algebra", in.getAlgebra(),
                // terms: 項の個数
                "terms", in.getTerms() == null ? 0 : in.getTerms().size());

        appendSection(sb, nl, "pipeline",
                // symmetrize: 対称順序化（McCoy）を行うかどうか
                "symmetrize", pl.isSymmetrize(),
                // convertTo: 変換先の代数（未指定なら変換しない）
                "convertTo", pl.getConvertTo(),
                // normalOrder: 正規順序化を行うかどうか
                "normalOrder", pl.isNormalOrder());

        appendSection(sb, nl, "realization",
                // enabled: 行列表現を構築するかどうか
                "enabled", r.isEnabled(),
                // truncation: モードあたりの打ち切り次元 N
                "truncation", r.getTruncation(),
                // modes: モード数 M（0 なら演算子から推定）
                "modes", r.getModes());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Input {

        /**
         * 出力ファイル名に使うラベルです。
         */
        private String label = "operator";

        /**
         * 入力演算子の代数です。
         */
        @NotNull
        private Algebra algebra = Algebra.LADDER;

        /**
         * 入力演算子の項の一覧です。
         */
        @NotEmpty
        @Valid
        private List<TermEntry> terms = List.of();
    }

    @Data
    public static class TermEntry {

        /**
         * 係数の実部です。
         */
        private double real = 1.0;

        /**
         * 係数の虚部です。
         */
        private double imag = 0.0;

        /**
         * 因子の列です（空なら恒等項）。
         */
        @Valid
        private List<FactorEntry> factors = List.of();
    }

    @Data
    public static class FactorEntry {

        /**
         * モード番号です。
         */
        @PositiveOrZero
        private int mode;

        /**
         * 因子の種類です。
         */
        @NotNull
        private FactorKind kind;
    }

    @Data
    public static class Pipeline {

        /**
         * 対称順序化（McCoy）を行うかどうかです。
         */
        private boolean symmetrize = false;

        /**
         * 変換先の代数です（null の場合は変換しません）。
         */
        private Algebra convertTo;

        /**
         * 正規順序化を行うかどうかです。
         */
        private boolean normalOrder = true;
    }

    @Data
    public static class Realization {

        /**
         * 行列表現を構築するかどうかです。
         */
        private boolean enabled = true;

        /**
         * モードあたりの打ち切り次元 N です。
         */
        private int truncation = 4;

        /**
         * モード数 M です（0 の場合は演算子から推定します）。
         */
        private int modes = 0;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }

    @Data
    public static class Cli {

        /**
         * 起動時に CLI を実行するかどうかです。
         */
        private boolean enabled = true;
    }
}
