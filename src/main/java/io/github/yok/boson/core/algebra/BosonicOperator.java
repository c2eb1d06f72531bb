package io.github.yok.boson.core.algebra;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.commons.math3.complex.Complex;

/**
 * 項（{@link Term}）から複素係数への写像として表される演算子（重み付きの項の和）です。
 *
 * <p>
 * 1 つの演算子はラダー代数か直交位相代数のどちらか一方に属し、異なる代数の演算子同士の演算は {@link IllegalArgumentException}
 * になります。代数間の変換は {@code QuadratureConverter} を経由します。
 * </p>
 *
 * <p>
 * 係数がちょうど 0 になった項は常に取り除かれます。インスタンスは不変であり、すべての演算は新しい演算子を返します。
 * 逐次的に項を足し込みたい場合は {@link Builder} を使用します。
 * </p>
 */
public final class BosonicOperator {

    /**
     * 演算子が属する代数です。
     */
    private final Algebra algebra;

    /**
     * 項から係数への写像です（挿入順、係数 0 の項は含みません）。
     */
    private final ImmutableMap<Term, Complex> terms;

    private BosonicOperator(Algebra algebra, ImmutableMap<Term, Complex> terms) {
        this.algebra = algebra;
        this.terms = terms;
    }

    /**
     * 零演算子を返します。
     *
     * @param algebra 代数です（null 不可）
     * @return 零演算子です
     */
    public static BosonicOperator zero(Algebra algebra) {
        checkNotNull(algebra, "algebra は null 不可です");
        return new BosonicOperator(algebra, ImmutableMap.of());
    }

    /**
     * 恒等演算子を返します。
     *
     * @param algebra 代数です（null 不可）
     * @return 恒等演算子です
     */
    public static BosonicOperator identity(Algebra algebra) {
        return of(algebra, Term.IDENTITY, Complex.ONE);
    }

    /**
     * 単一の項からなる演算子を生成します。
     *
     * @param algebra 代数です（null 不可）
     * @param term 項です（null 不可）
     * @param coefficient 係数です（null 不可）
     * @return 演算子です
     * @throws IllegalArgumentException 項が代数に属さない場合に発生します
     */
    public static BosonicOperator of(Algebra algebra, Term term, Complex coefficient) {
        return builder(algebra).add(term, coefficient).build();
    }

    /**
     * 因子の列と係数から単一の項の演算子を生成します。
     *
     * @param algebra 代数です（null 不可）
     * @param coefficient 係数です（null 不可）
     * @param factors 因子の列です
     * @return 演算子です
     * @throws IllegalArgumentException 因子が代数に属さない場合に発生します
     */
    public static BosonicOperator of(Algebra algebra, Complex coefficient, Factor... factors) {
        return of(algebra, Term.of(factors), coefficient);
    }

    /**
     * 係数 1 のラダー演算子の単項を生成します。
     *
     * @param factors ラダー因子の列です
     * @return 演算子です
     */
    public static BosonicOperator ladder(Factor... factors) {
        return of(Algebra.LADDER, Complex.ONE, factors);
    }

    /**
     * 係数 1 の直交位相演算子の単項を生成します。
     *
     * @param factors 直交位相因子の列です
     * @return 演算子です
     */
    public static BosonicOperator quadrature(Factor... factors) {
        return of(Algebra.QUADRATURE, Complex.ONE, factors);
    }

    /**
     * 指定した代数の空の蓄積器を返します。
     *
     * @param algebra 代数です（null 不可）
     * @return 蓄積器です
     */
    public static Builder builder(Algebra algebra) {
        return new Builder(algebra);
    }

    /**
     * 代数を返します。
     *
     * @return 代数です
     */
    public Algebra getAlgebra() {
        return algebra;
    }

    /**
     * 項から係数への写像を返します。
     *
     * @return 不変な写像です
     */
    public ImmutableMap<Term, Complex> getTerms() {
        return terms;
    }

    /**
     * 指定した項の係数を返します。
     *
     * @param term 項です
     * @return 係数です（含まれない場合は 0）
     */
    public Complex coefficientOf(Term term) {
        Complex c = terms.get(term);
        return c == null ? Complex.ZERO : c;
    }

    /**
     * 恒等項の係数（定数項）を返します。
     *
     * @return 定数項です
     */
    public Complex constant() {
        return coefficientOf(Term.IDENTITY);
    }

    public int termCount() {
        return terms.size();
    }

    public boolean isZero() {
        return terms.isEmpty();
    }

    /**
     * 最も長い項の因子数を返します。
     *
     * @return 因子数の最大値です（零演算子は 0）
     */
    public int manyBodyOrder() {
        int order = 0;
        for (Term t : terms.keySet()) {
            order = Math.max(order, t.size());
        }
        return order;
    }

    /**
     * 演算子が作用するモード数（最大モード番号 + 1）を返します。
     *
     * @return モード数です（因子を含まない場合は 0）
     */
    public int modeCount() {
        int max = -1;
        for (Term t : terms.keySet()) {
            max = Math.max(max, t.maxMode());
        }
        return max + 1;
    }

    /**
     * 和を返します。
     *
     * @param other 同じ代数の演算子です
     * @return 和です
     * @throws IllegalArgumentException 代数が異なる場合に発生します
     */
    public BosonicOperator plus(BosonicOperator other) {
        requireSameAlgebra(other);
        return builder(algebra).addAll(this).addAll(other).build();
    }

    /**
     * 差を返します。
     *
     * @param other 同じ代数の演算子です
     * @return 差です
     * @throws IllegalArgumentException 代数が異なる場合に発生します
     */
    public BosonicOperator minus(BosonicOperator other) {
        requireSameAlgebra(other);
        return plus(other.negate());
    }

    public BosonicOperator negate() {
        return times(-1.0);
    }

    /**
     * スカラー倍を返します。
     *
     * @param scalar スカラーです（null 不可）
     * @return スカラー倍です（0 倍は零演算子）
     */
    public BosonicOperator times(Complex scalar) {
        checkNotNull(scalar, "scalar は null 不可です");
        Builder b = builder(algebra);
        for (Map.Entry<Term, Complex> e : terms.entrySet()) {
            b.add(e.getKey(), e.getValue().multiply(scalar));
        }
        return b.build();
    }

    public BosonicOperator times(double scalar) {
        return times(new Complex(scalar));
    }

    /**
     * 演算子積（項の連結の双線形拡張）を返します。
     *
     * @param right 右側の演算子です（同じ代数）
     * @return 積です
     * @throws IllegalArgumentException 代数が異なる場合に発生します
     */
    public BosonicOperator times(BosonicOperator right) {
        requireSameAlgebra(right);
        Builder b = builder(algebra);
        for (Map.Entry<Term, Complex> l : terms.entrySet()) {
            for (Map.Entry<Term, Complex> r : right.terms.entrySet()) {
                b.add(l.getKey().concat(r.getKey()), l.getValue().multiply(r.getValue()));
            }
        }
        return b.build();
    }

    /**
     * スカラーで割った演算子を返します。
     *
     * @param divisor 除数です（0 不可）
     * @return 商です
     * @throws IllegalArgumentException divisor が 0 の場合に発生します
     */
    public BosonicOperator dividedBy(Complex divisor) {
        checkNotNull(divisor, "divisor は null 不可です");
        checkArgument(!isExactZero(divisor), "0 で割ることはできません");
        return times(Complex.ONE.divide(divisor));
    }

    public BosonicOperator dividedBy(double divisor) {
        return dividedBy(new Complex(divisor));
    }

    /**
     * べき乗を返します。
     *
     * @param exponent 指数です（0 以上。0 の場合は恒等演算子）
     * @return べき乗です
     * @throws IllegalArgumentException exponent が負の場合に発生します
     */
    public BosonicOperator pow(int exponent) {
        checkArgument(exponent >= 0, "exponent は 0 以上が必要です: %s", exponent);
        BosonicOperator result = identity(algebra);
        for (int i = 0; i < exponent; i++) {
            result = result.times(this);
        }
        return result;
    }

    /**
     * エルミート共役を返します。
     *
     * <p>
     * 各項の因子の順序を反転し（ラダー因子は生成と消滅を入れ替え）、係数を複素共役にして足し合わせます。
     * </p>
     *
     * @return エルミート共役です
     */
    public BosonicOperator conjugate() {
        Builder b = builder(algebra);
        for (Map.Entry<Term, Complex> e : terms.entrySet()) {
            b.add(e.getKey().adjoint(), e.getValue().conjugate());
        }
        return b.build();
    }

    /**
     * エルミート共役と厳密に等しいかを返します。
     *
     * <p>
     * 許容誤差は用いません。近似的に判定したい場合は正規順序化や {@link #compress(double)} を先に適用してください。
     * </p>
     *
     * @return エルミートの場合は true です
     */
    public boolean isHermitian() {
        return equals(conjugate());
    }

    /**
     * すべての項が正規順序を満たすかを返します。
     *
     * @return 正規順序の場合は true です
     */
    public boolean isNormalOrdered() {
        for (Term t : terms.keySet()) {
            if (!t.isNormalOrdered()) {
                return false;
            }
        }
        return true;
    }

    /**
     * すべての項で生成演算子と消滅演算子の個数が等しいかを返します（ラダー代数専用）。
     *
     * @return 粒子数を保存する場合は true です
     * @throws IllegalStateException ラダー代数でない場合に発生します
     */
    public boolean isBosonPreserving() {
        checkState(algebra == Algebra.LADDER, "isBosonPreserving はラダー代数の演算子のみ対象です: %s",
                algebra);
        for (Term t : terms.keySet()) {
            if (t.count(FactorKind.RAISE) != t.count(FactorKind.LOWER)) {
                return false;
            }
        }
        return true;
    }

    /**
     * すべての項が 2 因子以下かを返します（直交位相代数専用）。
     *
     * @return ガウス型の場合は true です
     * @throws IllegalStateException 直交位相代数でない場合に発生します
     */
    public boolean isGaussian() {
        checkState(algebra == Algebra.QUADRATURE, "isGaussian は直交位相代数の演算子のみ対象です: %s",
                algebra);
        for (Term t : terms.keySet()) {
            if (t.size() > 2) {
                return false;
            }
        }
        return true;
    }

    /**
     * 小さな係数を切り捨てた演算子を返します。
     *
     * <p>
     * {@code |c| <= tolerance} の項を取り除き、実部・虚部のうち絶対値が tolerance 以下のものを 0 にします。
     * </p>
     *
     * @param tolerance 許容誤差です（0 以上）
     * @return 圧縮した演算子です
     */
    public BosonicOperator compress(double tolerance) {
        checkArgument(tolerance >= 0.0, "tolerance は 0 以上が必要です: %s", tolerance);
        Builder b = builder(algebra);
        for (Map.Entry<Term, Complex> e : terms.entrySet()) {
            Complex c = e.getValue();
            if (c.abs() <= tolerance) {
                continue;
            }
            double re = Math.abs(c.getReal()) <= tolerance ? 0.0 : c.getReal();
            double im = Math.abs(c.getImaginary()) <= tolerance ? 0.0 : c.getImaginary();
            b.add(e.getKey(), new Complex(re, im));
        }
        return b.build();
    }

    /**
     * 各項の係数差の絶対値が tolerance 以下かを返します。
     *
     * @param other 比較対象です（同じ代数）
     * @param tolerance 許容誤差です（0 以上）
     * @return 近似的に等しい場合は true です
     * @throws IllegalArgumentException 代数が異なる場合に発生します
     */
    public boolean isClose(BosonicOperator other, double tolerance) {
        requireSameAlgebra(other);
        checkArgument(tolerance >= 0.0, "tolerance は 0 以上が必要です: %s", tolerance);
        for (Map.Entry<Term, Complex> e : terms.entrySet()) {
            if (e.getValue().subtract(other.coefficientOf(e.getKey())).abs() > tolerance) {
                return false;
            }
        }
        for (Map.Entry<Term, Complex> e : other.terms.entrySet()) {
            if (!terms.containsKey(e.getKey()) && e.getValue().abs() > tolerance) {
                return false;
            }
        }
        return true;
    }

    /**
     * 係数の {@code order} ノルム {@code (Σ|c|^order)^(1/order)} を返します。
     *
     * @param order ノルムの次数です（正）
     * @return ノルムです
     */
    public double inducedNorm(double order) {
        checkArgument(order > 0.0, "order は正の値が必要です: %s", order);
        double sum = 0.0;
        for (Complex c : terms.values()) {
            sum += Math.pow(c.abs(), order);
        }
        return Math.pow(sum, 1.0 / order);
    }

    private void requireSameAlgebra(BosonicOperator other) {
        checkNotNull(other, "other は null 不可です");
        checkArgument(other.algebra == algebra, "異なる代数の演算子は組み合わせられません: %s と %s", algebra,
                other.algebra);
    }

    /**
     * 係数がちょうど 0 かを返します。
     *
     * @param c 係数です
     * @return 実部・虚部ともに 0 の場合は true です
     */
    static boolean isExactZero(Complex c) {
        return c.getReal() == 0.0 && c.getImaginary() == 0.0;
    }

    /**
     * 代数と係数写像が厳密に一致するかを返します（許容誤差なし）。
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BosonicOperator)) {
            return false;
        }
        BosonicOperator other = (BosonicOperator) o;
        if (algebra != other.algebra || terms.size() != other.terms.size()) {
            return false;
        }
        for (Map.Entry<Term, Complex> e : terms.entrySet()) {
            Complex c = other.terms.get(e.getKey());
            if (c == null || c.getReal() != e.getValue().getReal()
                    || c.getImaginary() != e.getValue().getImaginary()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        // 係数は厳密比較のため、ハッシュは項の集合だけから作る
        return Objects.hash(algebra, terms.keySet());
    }

    @Override
    public String toString() {
        if (terms.isEmpty()) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Term, Complex> e : terms.entrySet()) {
            if (sb.length() > 0) {
                sb.append(" +\n");
            }
            Complex c = e.getValue();
            sb.append('(').append(c.getReal());
            if (c.getImaginary() != 0.0) {
                sb.append(c.getImaginary() < 0.0 ? "-" : "+").append(Math.abs(c.getImaginary()))
                        .append('i');
            }
            sb.append(") ").append(e.getKey());
        }
        return sb.toString();
    }

    /**
     * 項を逐次足し込むための可変な蓄積器です。
     *
     * <p>
     * 同じ項の係数は合算され、ちょうど 0 になった項はその時点で取り除かれます。 スレッドセーフではありません。
     * </p>
     */
    public static final class Builder {

        /**
         * 蓄積先の代数です。
         */
        private final Algebra algebra;

        /**
         * 項から係数への可変写像です。
         */
        private final Map<Term, Complex> terms = new LinkedHashMap<>();

        private Builder(Algebra algebra) {
            this.algebra = checkNotNull(algebra, "algebra は null 不可です");
        }

        /**
         * 項を足し込みます。
         *
         * @param term 項です（null 不可、代数に属すること）
         * @param coefficient 係数です（null 不可）
         * @return この蓄積器です
         * @throws IllegalArgumentException 項が代数に属さない場合に発生します
         */
        public Builder add(Term term, Complex coefficient) {
            checkNotNull(term, "term は null 不可です");
            checkNotNull(coefficient, "coefficient は null 不可です");
            checkArgument(term.belongsTo(algebra), "項 %s は %s 代数に属しません", term, algebra);
            if (isExactZero(coefficient)) {
                return this;
            }
            Complex sum = terms.merge(term, coefficient, Complex::add);
            if (isExactZero(sum)) {
                terms.remove(term);
            }
            return this;
        }

        /**
         * 演算子のすべての項を足し込みます。
         *
         * @param operator 同じ代数の演算子です
         * @return この蓄積器です
         * @throws IllegalArgumentException 代数が異なる場合に発生します
         */
        public Builder addAll(BosonicOperator operator) {
            checkNotNull(operator, "operator は null 不可です");
            checkArgument(operator.algebra == algebra, "異なる代数の演算子は組み合わせられません: %s と %s",
                    algebra, operator.algebra);
            for (Map.Entry<Term, Complex> e : operator.terms.entrySet()) {
                add(e.getKey(), e.getValue());
            }
            return this;
        }

        /**
         * 蓄積した内容から不変な演算子を生成します。
         *
         * @return 演算子です
         */
        public BosonicOperator build() {
            return new BosonicOperator(algebra, ImmutableMap.copyOf(terms));
        }
    }
}
