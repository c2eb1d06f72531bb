package io.github.yok.boson.core.realization;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.boson.core.algebra.Algebra;
import io.github.yok.boson.core.algebra.BosonicOperator;
import io.github.yok.boson.core.algebra.Factor;
import io.github.yok.boson.core.algebra.Term;
import io.github.yok.boson.core.conversion.QuadratureConverter;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;

/**
 * ラダー演算子の厳密な作用を基底状態ごとに適用して、演算子の行列表現を構築するクラスです。
 *
 * <ul>
 * <li>{@code b_i|n⟩ = √n |n-1⟩}</li>
 * <li>{@code b_i†|n⟩ = √(n+1) |n+1⟩}</li>
 * </ul>
 *
 * <p>
 * 打ち切り：占有数 N-1 に生成演算子を作用させた場合、および占有数 0 に消滅演算子を作用させた場合は、その基底状態への寄与を 0 とします
 * （打ち切りより上の情報は捨て、折り返しはしません）。 直交位相演算子は同じ ħ でラダー表現に変換してから適用します。
 * </p>
 *
 * <p>
 * 行列の次元は N^M で増えるため、N と M の大きさは呼び出し側で抑えてください。
 * </p>
 */
@Slf4j
public final class FockSpaceRealizer implements OperatorRealizer {

    /**
     * 直交位相演算子をラダー表現に変換する変換器です。
     */
    private final QuadratureConverter converter;

    /**
     * ħ=1 の実現器を生成します。
     */
    public FockSpaceRealizer() {
        this(new QuadratureConverter());
    }

    /**
     * 指定した ħ の実現器を生成します。
     *
     * @param hbar ħ です（正の有限値）
     */
    public FockSpaceRealizer(double hbar) {
        this(new QuadratureConverter(hbar));
    }

    /**
     * 変換器を指定して実現器を生成します。
     *
     * @param converter 直交位相 → ラダー変換器です（null 不可）
     */
    public FockSpaceRealizer(QuadratureConverter converter) {
        this.converter = checkNotNull(converter, "converter は null 不可です");
    }

    public double getHbar() {
        return converter.getHbar();
    }

    /**
     * モード数を演算子から推定して（{@code max(1, modeCount())}）行列表現を構築します。
     *
     * @param operator 演算子です
     * @param truncation モードあたりの打ち切り次元 N です（1 以上）
     * @return 行列表現です
     */
    public SparseRealization realize(BosonicOperator operator, int truncation) {
        checkNotNull(operator, "operator は null 不可です");
        return realize(operator, truncation, Math.max(1, operator.modeCount()));
    }

    /**
     * 行列表現を構築します。
     *
     * @param operator 演算子です
     * @param truncation モードあたりの打ち切り次元 N です（1 以上）
     * @param modeCount モード数 M です（1 以上）
     * @return 行列表現です
     */
    public SparseRealization realize(BosonicOperator operator, int truncation, int modeCount) {
        return realize(operator, new FockBasis(truncation, modeCount));
    }

    /**
     * 行列表現を構築します。
     *
     * @param operator 演算子です（null 不可）
     * @param basis 打ち切りフォック基底です（null 不可）
     * @return 行列表現です
     * @throws IllegalArgumentException 演算子のモード番号が基底のモード数以上の場合に発生します
     */
    @Override
    public SparseRealization realize(BosonicOperator operator, FockBasis basis) {
        checkNotNull(operator, "operator は null 不可です");
        checkNotNull(basis, "basis は null 不可です");
        checkArgument(operator.modeCount() <= basis.modeCount(),
                "演算子のモード番号 %s が基底のモード数 %s 以上です", operator.modeCount() - 1, basis.modeCount());

        BosonicOperator ladder = operator.getAlgebra() == Algebra.QUADRATURE
                ? converter.toLadder(operator)
                : operator;

        long t0 = System.nanoTime();
        SparseRealization.Builder b = SparseRealization.builder(basis);
        int dim = basis.dimension();

        for (int col = 0; col < dim; col++) {
            int[] occupations = basis.occupationsOf(col);
            for (Map.Entry<Term, Complex> e : ladder.getTerms().entrySet()) {
                applyTerm(e.getKey(), e.getValue(), occupations, col, basis, b);
            }
        }

        SparseRealization realization = b.build();
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("行列表現を構築しました。次元={}、非零要素数={}、項数={}、所要時間={}ms", dim,
                realization.nonZeroCount(), ladder.termCount(), elapsedMs);
        return realization;
    }

    /**
     * 1 つの項を基底状態 {@code |occupations⟩} に右から順に作用させ、結果を行列要素として足し込みます。
     *
     * <p>
     * ラダー演算子の単項式は基底状態を単一の基底状態（のスカラー倍）に写すため、1 列あたり高々 1 要素です。
     * </p>
     *
     * @param term ラダー代数の項です
     * @param coefficient 係数です
     * @param occupations 列に対応する占有数です（変更しません）
     * @param col 列インデックスです
     * @param basis 基底です
     * @param out 行列要素の蓄積器です
     */
    private static void applyTerm(Term term, Complex coefficient, int[] occupations, int col,
            FockBasis basis, SparseRealization.Builder out) {
        int[] state = occupations.clone();
        int cutoff = basis.truncation();
        // 振幅の 2 乗（整数の積）を保持し、最後に 1 回だけ平方根を取る
        double squaredAmplitude = 1.0;

        for (int k = term.size() - 1; k >= 0; k--) {
            Factor f = term.factor(k);
            int n = state[f.getMode()];
            switch (f.getKind()) {
                case LOWER:
                    if (n == 0) {
                        return;
                    }
                    squaredAmplitude *= n;
                    state[f.getMode()] = n - 1;
                    break;
                case RAISE:
                    if (n + 1 >= cutoff) {
                        return;
                    }
                    squaredAmplitude *= n + 1;
                    state[f.getMode()] = n + 1;
                    break;
                default:
                    throw new IllegalStateException("ラダー因子ではありません: " + f);
            }
        }

        out.add(basis.indexOf(state), col, coefficient.multiply(Math.sqrt(squaredAmplitude)));
    }
}
