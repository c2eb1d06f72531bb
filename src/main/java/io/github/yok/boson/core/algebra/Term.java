package io.github.yok.boson.core.algebra;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 演算子因子の順序付き列（積）を表す不変クラスです。
 *
 * <p>
 * 空の列は恒等演算子を表します。因子は非可換であるため、等価性とハッシュ値は列の順序を含めた構造で決まります。 1 つの項に含まれる因子はすべて同じ代数に属する必要があります。
 * </p>
 */
public final class Term implements Iterable<Factor> {

    /**
     * 恒等演算子（空の列）です。
     */
    public static final Term IDENTITY = new Term(ImmutableList.of());

    /**
     * 因子の列です。
     */
    private final ImmutableList<Factor> factors;

    private Term(ImmutableList<Factor> factors) {
        this.factors = factors;
    }

    /**
     * 因子の列から項を生成します。
     *
     * @param factors 因子です（null 不可）
     * @return 項です
     * @throws IllegalArgumentException 異なる代数の因子が混在する場合に発生します
     */
    public static Term of(Factor... factors) {
        checkNotNull(factors, "factors は null 不可です");
        return of(ImmutableList.copyOf(factors));
    }

    /**
     * 因子のリストから項を生成します。
     *
     * @param factors 因子のリストです（null 不可、要素も null 不可）
     * @return 項です
     * @throws IllegalArgumentException 異なる代数の因子が混在する場合に発生します
     */
    public static Term of(List<Factor> factors) {
        checkNotNull(factors, "factors は null 不可です");
        if (factors.isEmpty()) {
            return IDENTITY;
        }
        ImmutableList<Factor> copy = ImmutableList.copyOf(factors);
        Algebra algebra = copy.get(0).getKind().algebra();
        for (Factor f : copy) {
            checkArgument(f.getKind().algebra() == algebra,
                    "1 つの項に異なる代数の因子は混在できません: %s", copy);
        }
        return new Term(copy);
    }

    /**
     * 因子の列を返します。
     *
     * @return 不変な因子リストです
     */
    public ImmutableList<Factor> getFactors() {
        return factors;
    }

    /**
     * 因子数を返します。
     *
     * @return 因子数です
     */
    public int size() {
        return factors.size();
    }

    /**
     * 恒等演算子（空の列）かを返します。
     *
     * @return 恒等演算子の場合は true です
     */
    public boolean isIdentity() {
        return factors.isEmpty();
    }

    /**
     * 指定位置の因子を返します。
     *
     * @param index 位置です
     * @return 因子です
     */
    public Factor factor(int index) {
        return factors.get(index);
    }

    /**
     * 項が属する代数を返します。
     *
     * @return 代数です（恒等演算子はどちらの代数にも属するため空です）
     */
    public Optional<Algebra> algebra() {
        if (factors.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(factors.get(0).getKind().algebra());
    }

    /**
     * 指定した代数の演算子に含めてよい項かを返します。
     *
     * @param target 代数です
     * @return 含めてよい場合は true です
     */
    public boolean belongsTo(Algebra target) {
        return factors.isEmpty() || factors.get(0).getKind().algebra() == target;
    }

    /**
     * 右側に別の項を連結した積を返します。
     *
     * @param right 右側の項です
     * @return 連結した項です
     */
    public Term concat(Term right) {
        if (right.isIdentity()) {
            return this;
        }
        if (isIdentity()) {
            return right;
        }
        return of(ImmutableList.<Factor>builderWithExpectedSize(size() + right.size())
                .addAll(factors).addAll(right.factors).build());
    }

    /**
     * エルミート共役の項を返します（順序を反転し、各因子を共役にします）。
     *
     * @return 共役項です
     */
    public Term adjoint() {
        if (isIdentity()) {
            return this;
        }
        ImmutableList.Builder<Factor> b = ImmutableList.builderWithExpectedSize(size());
        for (Factor f : factors.reverse()) {
            b.add(f.adjoint());
        }
        return new Term(b.build());
    }

    /**
     * 項が正規順序（左側の種類が先、同種ではモード番号の非減少）を満たすかを返します。
     *
     * <p>
     * 構造の検査のみで、書き換えは行いません。
     * </p>
     *
     * @return 正規順序の場合は true です
     */
    public boolean isNormalOrdered() {
        for (int i = 1; i < factors.size(); i++) {
            if (!factors.get(i - 1).precedesOrEquals(factors.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 指定した種類の因子数を返します。
     *
     * @param kind 種類です
     * @return 因子数です
     */
    public int count(FactorKind kind) {
        int n = 0;
        for (Factor f : factors) {
            if (f.getKind() == kind) {
                n++;
            }
        }
        return n;
    }

    /**
     * 項に現れる最大のモード番号を返します。
     *
     * @return 最大モード番号です（恒等演算子は -1）
     */
    public int maxMode() {
        int max = -1;
        for (Factor f : factors) {
            max = Math.max(max, f.getMode());
        }
        return max;
    }

    @Override
    public Iterator<Factor> iterator() {
        return factors.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Term)) {
            return false;
        }
        return factors.equals(((Term) o).factors);
    }

    @Override
    public int hashCode() {
        return factors.hashCode();
    }

    @Override
    public String toString() {
        return factors.stream().map(Factor::toString).collect(Collectors.joining(" ", "[", "]"));
    }
}
