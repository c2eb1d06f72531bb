package io.github.yok.boson.core.realization;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.TreeMap;
import lombok.Getter;
import lombok.Value;
import org.apache.commons.math3.complex.Complex;
import org.ejml.data.ZMatrixRMaj;

/**
 * 打ち切りフォック基底上の演算子の行列表現（非零要素のみを保持する疎行列）です。
 *
 * <p>
 * 要素は行優先（row * dimension + col）の順に保持します。外部の線形代数ルーチン向けに、 EJML の密な複素行列 {@link ZMatrixRMaj}
 * へ変換できます。
 * </p>
 */
public final class SparseRealization {

    /**
     * 表現に用いた基底です。
     */
    @Getter
    private final FockBasis basis;

    /**
     * 行優先インデックスから値への写像です（非零要素のみ）。
     */
    private final ImmutableSortedMap<Long, Complex> elements;

    private SparseRealization(FockBasis basis, ImmutableSortedMap<Long, Complex> elements) {
        this.basis = basis;
        this.elements = elements;
    }

    /**
     * 行列の次元（行数 = 列数）を返します。
     *
     * @return 次元です
     */
    public int dimension() {
        return basis.dimension();
    }

    /**
     * 非零要素の個数を返します。
     *
     * @return 非零要素数です
     */
    public int nonZeroCount() {
        return elements.size();
    }

    /**
     * 指定位置の要素を返します。
     *
     * @param row 行です
     * @param col 列です
     * @return 要素です（非零要素でなければ 0）
     */
    public Complex get(int row, int col) {
        checkIndex(row, col, basis.dimension());
        Complex c = elements.get(key(row, col, basis.dimension()));
        return c == null ? Complex.ZERO : c;
    }

    /**
     * 非零要素を行優先の順で返します。
     *
     * @return 非零要素のリストです
     */
    public ImmutableList<MatrixElement> nonZeroElements() {
        int dim = basis.dimension();
        ImmutableList.Builder<MatrixElement> b = ImmutableList.builderWithExpectedSize(elements.size());
        for (Map.Entry<Long, Complex> e : elements.entrySet()) {
            long k = e.getKey();
            b.add(new MatrixElement((int) (k / dim), (int) (k % dim), e.getValue()));
        }
        return b.build();
    }

    /**
     * 密な複素行列に変換します。
     *
     * @return dimension × dimension の複素行列です
     */
    public ZMatrixRMaj toDenseMatrix() {
        int dim = basis.dimension();
        ZMatrixRMaj matrix = new ZMatrixRMaj(dim, dim);
        for (Map.Entry<Long, Complex> e : elements.entrySet()) {
            long k = e.getKey();
            Complex c = e.getValue();
            matrix.set((int) (k / dim), (int) (k % dim), c.getReal(), c.getImaginary());
        }
        return matrix;
    }

    static Builder builder(FockBasis basis) {
        return new Builder(basis);
    }

    private static long key(int row, int col, int dim) {
        return (long) row * dim + col;
    }

    private static void checkIndex(int row, int col, int dim) {
        checkArgument(row >= 0 && row < dim && col >= 0 && col < dim, "行列インデックスが範囲外です: (%s, %s)",
                row, col);
    }

    /**
     * 行列要素 1 つ（行、列、値）です。
     */
    @Value
    public static class MatrixElement {

        /**
         * 行インデックスです。
         */
        int row;

        /**
         * 列インデックスです。
         */
        int col;

        /**
         * 値です。
         */
        Complex value;
    }

    /**
     * 行列要素を足し込むための蓄積器です（同じ位置の値は合算され、0 になれば取り除かれます）。
     */
    static final class Builder {

        private final FockBasis basis;

        private final Map<Long, Complex> elements = new TreeMap<>();

        private Builder(FockBasis basis) {
            this.basis = checkNotNull(basis, "basis は null 不可です");
        }

        Builder add(int row, int col, Complex value) {
            checkIndex(row, col, basis.dimension());
            long k = key(row, col, basis.dimension());
            Complex sum = elements.merge(k, value, Complex::add);
            if (sum.getReal() == 0.0 && sum.getImaginary() == 0.0) {
                elements.remove(k);
            }
            return this;
        }

        SparseRealization build() {
            return new SparseRealization(basis, ImmutableSortedMap.copyOf(elements));
        }
    }
}
