package io.github.yok.boson.core.ordering;

import static com.google.common.base.Preconditions.checkNotNull;
import io.github.yok.boson.core.algebra.Algebra;
import io.github.yok.boson.core.algebra.BosonicOperator;
import io.github.yok.boson.core.algebra.Factor;
import io.github.yok.boson.core.algebra.Term;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.complex.Complex;

/**
 * 交換関係を用いて演算子を正規順序に書き換えるクラスです。
 *
 * <p>
 * 正規順序は、ラダー代数では「生成 → 消滅」、直交位相代数では「位置 → 運動量」の順で、 同じ種類の中ではモード番号の非減少順です。
 * </p>
 *
 * <p>
 * 各項は隣接ペアの挿入ソートで並べ替えます。
 * </p>
 * <ul>
 * <li>異なるモードのペアは可換なので、そのまま入れ替えます。</li>
 * <li>同じモードで種類の順序が逆のペア（{@code b b†} や {@code p q}）は入れ替えたうえで、 ペアを取り除いた短い項に交換子の値（{@code 1} または
 * {@code -iħ}）を掛けて作業リストに積みます。</li>
 * </ul>
 *
 * <p>
 * 入れ替えは同じ長さの項の転倒数を、縮約は項の長さを 2 ずつ減らすため、書き換えは必ず停止します。 深い再帰は使わず、明示的な作業リストで処理します。
 * </p>
 */
@Slf4j
public final class NormalOrderer {

    /**
     * ħ です（直交位相代数の交換子 {@code [q, p] = iħ} の大きさ）。
     */
    @Getter
    private final double hbar;

    /**
     * ħ=1 の正規順序化器を生成します。
     */
    public NormalOrderer() {
        this(1.0);
    }

    /**
     * 正規順序化器を生成します。
     *
     * @param hbar ħ です（正の有限値）
     * @throws IllegalArgumentException hbar が正の有限値でない場合に発生します
     */
    public NormalOrderer(double hbar) {
        this.hbar = Algebra.checkHbar(hbar);
    }

    /**
     * 演算子を正規順序に書き換えた新しい演算子を返します。
     *
     * @param operator 演算子です（null 不可）
     * @return 正規順序化した演算子です
     */
    public BosonicOperator normalOrder(BosonicOperator operator) {
        checkNotNull(operator, "operator は null 不可です");

        Algebra algebra = operator.getAlgebra();
        Complex contraction = algebra.contraction(hbar);
        BosonicOperator.Builder out = BosonicOperator.builder(algebra);

        for (Map.Entry<Term, Complex> e : operator.getTerms().entrySet()) {
            normalOrderTerm(e.getKey(), e.getValue(), contraction, out);
        }

        BosonicOperator result = out.build();
        log.debug("正規順序化しました。代数={}、入力項数={}、出力項数={}", algebra, operator.termCount(),
                result.termCount());
        return result;
    }

    /**
     * 1 つの項を正規順序に書き換え、結果を蓄積器に足し込みます。
     *
     * @param term 項です
     * @param coefficient 係数です
     * @param contraction 同一モードの入れ替えで生じる縮約項の係数です
     * @param out 蓄積器です
     */
    private static void normalOrderTerm(Term term, Complex coefficient, Complex contraction,
            BosonicOperator.Builder out) {

        Deque<Pending> work = new ArrayDeque<>();
        work.push(new Pending(new ArrayList<>(term.getFactors()), coefficient));

        while (!work.isEmpty()) {
            Pending p = work.pop();
            List<Factor> f = p.factors;

            // 先頭側は常に整列済み（挿入ソート）
            for (int i = 1; i < f.size(); i++) {
                for (int j = i; j > 0; j--) {
                    Factor left = f.get(j - 1);
                    Factor right = f.get(j);
                    if (left.precedesOrEquals(right)) {
                        break;
                    }

                    boolean kindInverted = left.getKind().rank() > right.getKind().rank();
                    if (kindInverted && left.getMode() == right.getMode()) {
                        work.push(new Pending(withoutPair(f, j - 1),
                                p.coefficient.multiply(contraction)));
                    }

                    f.set(j - 1, right);
                    f.set(j, left);
                }
            }

            out.add(Term.of(f), p.coefficient);
        }
    }

    /**
     * 位置 {@code index} と {@code index+1} の因子を取り除いたリストを返します。
     *
     * @param factors 因子リストです
     * @param index 取り除くペアの左側の位置です
     * @return 新しいリストです
     */
    private static List<Factor> withoutPair(List<Factor> factors, int index) {
        List<Factor> shorter = new ArrayList<>(factors.size() - 2);
        shorter.addAll(factors.subList(0, index));
        shorter.addAll(factors.subList(index + 2, factors.size()));
        return shorter;
    }

    /**
     * 作業リスト上の未処理の項です。
     */
    private static final class Pending {

        /**
         * 因子の列（並べ替えのため可変）です。
         */
        private final List<Factor> factors;

        /**
         * 係数です。
         */
        private final Complex coefficient;

        private Pending(List<Factor> factors, Complex coefficient) {
            this.factors = factors;
            this.coefficient = coefficient;
        }
    }
}
