package io.github.yok.ssa.core.linearalgebra;

import io.github.yok.ssa.core.error.NumericFailureException;
import java.util.Arrays;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;

/**
 * EJML を用いて、密行列の特異値分解を行うクラスです。
 *
 * <p>
 * 全成分が必要な場合はコンパクト形式（r = min(m, n)）で特異値分解します。 上位 rank 成分だけが必要な場合は、短い辺の側のグラム行列
 * （m ≤ n なら X·Xᵀ、m &gt; n なら Xᵀ·X）を対称固有分解し、保持する成分についてのみ反対側の特異ベクトルを X から求めます。
 * 長い系列では右特異ベクトル行列（K×K 相当）の計算を省けるため、切り詰めた分の計算量が減ります。
 * </p>
 *
 * <p>
 * いずれの経路でも特異値を降順に並べ替え、特異ベクトルも同じ順序に揃えて返します。 同値の特異値は EJML が返した順序を維持します。
 * </p>
 */
@Slf4j
public final class EjmlSingularValueDecompositionBackend implements SingularValueDecompositionBackend {

    /**
     * グラム行列経由で扱う成分の下限（σ_i / σ_1）です。
     *
     * <p>
     * これを下回る成分を含む場合は、グラム行列の丸め誤差が特異ベクトルに効くためコンパクト特異値分解に切り替えます。
     * </p>
     */
    static final double GRAM_RELATIVE_TOLERANCE = 1e-5;

    /**
     * 行列を特異値分解し、上位 rank 成分を特異値降順で返します。
     *
     * @param matrix m×n の行列です
     * @param rank 必要な上位成分数です（1 以上 min(m, n) 以下）
     * @return 特異値降順の分解結果です（列数は rank 以上）
     * @throws IllegalArgumentException matrix が null、空、または rank が範囲外の場合に発生します
     * @throws NumericFailureException 分解に失敗した、または非有限値が得られた場合に発生します
     */
    @Override
    public SingularValueDecompositionResult decomposeAndSortDescending(DMatrixRMaj matrix,
            int rank) {
        if (matrix == null) {
            throw new IllegalArgumentException("matrix は null 不可です");
        }
        int rows = matrix.numRows;
        int cols = matrix.numCols;
        if (rows < 1 || cols < 1) {
            throw new IllegalArgumentException("matrix は 1x1 以上が必要です: " + rows + "x" + cols);
        }
        int fullRank = Math.min(rows, cols);
        if (rank < 1 || rank > fullRank) {
            throw new IllegalArgumentException(
                    "rank は 1 以上 " + fullRank + " 以下を指定してください: " + rank);
        }

        if (rank < fullRank) {
            SingularValueDecompositionResult leading = decomposeLeadingViaGram(matrix, rank);
            if (leading != null) {
                return leading;
            }
            log.debug("上位成分に小さい特異値が含まれるため、コンパクト特異値分解に切り替えます。rank={}", rank);
        }
        return decomposeCompact(matrix);
    }

    /**
     * コンパクト形式で全成分を特異値分解します。
     *
     * @param matrix m×n の行列です
     * @return 特異値降順の分解結果です（列数は min(m, n)）
     */
    private static SingularValueDecompositionResult decomposeCompact(DMatrixRMaj matrix) {
        int rows = matrix.numRows;
        int cols = matrix.numCols;

        SingularValueDecomposition_F64<DMatrixRMaj> svd =
                DecompositionFactory_DDRM.svd(rows, cols, true, true, true);

        // EJML は入力を書き換える場合があるため、呼び出し元の行列は守ります。
        DMatrixRMaj input = svd.inputModified() ? matrix.copy() : matrix;
        if (!svd.decompose(input)) {
            throw new NumericFailureException("特異値分解に失敗しました（EJML）: " + rows + "x" + cols);
        }

        int r = svd.numberOfSingularValues();
        double[] values = Arrays.copyOf(svd.getSingularValues(), r);

        // 列 = 特異ベクトル という表現で取り出します。
        DMatrixRMaj u = svd.getU(null, false);
        DMatrixRMaj v = svd.getV(null, false);
        if (u == null || v == null) {
            throw new NumericFailureException("特異ベクトルが取得できません（EJML）");
        }

        ensureFinite(values, "特異値");
        ensureFinite(u.data, "左特異ベクトル");
        ensureFinite(v.data, "右特異ベクトル");

        int[] order = argsortDescending(values);

        double[] sortedValues = new double[r];
        DMatrixRMaj sortedU = new DMatrixRMaj(rows, r);
        DMatrixRMaj sortedV = new DMatrixRMaj(cols, r);

        for (int newCol = 0; newCol < r; newCol++) {
            int oldCol = order[newCol];

            // 丸め誤差で僅かに負になった特異値は 0 に揃えます。
            sortedValues[newCol] = Math.max(0.0, values[oldCol]);

            for (int row = 0; row < rows; row++) {
                sortedU.set(row, newCol, u.get(row, oldCol));
            }
            for (int row = 0; row < cols; row++) {
                sortedV.set(row, newCol, v.get(row, oldCol));
            }
        }

        return new SingularValueDecompositionResult(sortedValues, sortedU, sortedV);
    }

    /**
     * 短い辺の側のグラム行列を固有分解し、上位 rank 成分だけを求めます。
     *
     * <p>
     * グラム行列の固有ベクトルを一方の特異ベクトルとし、もう一方は X（または Xᵀ）を掛けて得たベクトルのノルムを特異値、
     * 正規化したものを特異ベクトルとします。
     * </p>
     *
     * @param matrix m×n の行列です
     * @param rank 必要な上位成分数です（min(m, n) 未満）
     * @return 特異値降順の分解結果です。上位成分に小さすぎる特異値が含まれる場合は null です
     * @throws NumericFailureException 固有分解に失敗した、または非有限値が得られた場合に発生します
     */
    private static SingularValueDecompositionResult decomposeLeadingViaGram(DMatrixRMaj matrix,
            int rank) {
        int rows = matrix.numRows;
        int cols = matrix.numCols;

        // 行側（L×L のラグ共分散）と列側のうち小さい方を使います。
        boolean rowSide = rows <= cols;
        int dim = rowSide ? rows : cols;

        DMatrixRMaj gram = new DMatrixRMaj(dim, dim);
        if (rowSide) {
            CommonOps_DDRM.multTransB(matrix, matrix, gram);
        } else {
            CommonOps_DDRM.multTransA(matrix, matrix, gram);
        }

        EigenDecomposition_F64<DMatrixRMaj> eig = DecompositionFactory_DDRM.eig(dim, true, true);
        if (!eig.decompose(gram)) {
            throw new NumericFailureException("固有分解に失敗しました（EJML）: " + dim + "x" + dim);
        }

        // 実対称のため、固有値は実数部のみを使います。
        double[] eigenvalues = new double[dim];
        for (int col = 0; col < dim; col++) {
            eigenvalues[col] = eig.getEigenvalue(col).getReal();
        }
        ensureFinite(eigenvalues, "固有値");

        int[] order = argsortDescending(eigenvalues);

        // near: グラム行列の固有ベクトル（上位 rank 本）
        DMatrixRMaj near = new DMatrixRMaj(dim, rank);
        for (int newCol = 0; newCol < rank; newCol++) {
            DMatrixRMaj vec = eig.getEigenVector(order[newCol]);
            if (vec == null) {
                throw new NumericFailureException("固有ベクトルが取得できません（EJML）: col=" + order[newCol]);
            }
            for (int row = 0; row < dim; row++) {
                near.set(row, newCol, vec.get(row, 0));
            }
        }
        ensureFinite(near.data, "固有ベクトル");

        // far: 反対側の特異ベクトル（正規化前は σ_i 倍）
        DMatrixRMaj far = new DMatrixRMaj(rowSide ? cols : rows, rank);
        if (rowSide) {
            CommonOps_DDRM.multTransA(matrix, near, far);
        } else {
            CommonOps_DDRM.mult(matrix, near, far);
        }
        ensureFinite(far.data, rowSide ? "右特異ベクトル" : "左特異ベクトル");

        double[] sortedValues = new double[rank];
        for (int c = 0; c < rank; c++) {
            double sigma = columnNorm(far, c);
            if (sigma <= 0.0 || (c > 0 && sigma < GRAM_RELATIVE_TOLERANCE * sortedValues[0])) {
                return null;
            }
            sortedValues[c] = sigma;
            for (int row = 0; row < far.numRows; row++) {
                far.set(row, c, far.get(row, c) / sigma);
            }
        }

        // ノルムの計算で順序が入れ替わった場合（ほぼ同値の組）は安定ソートで揃え直します。
        int[] byNorm = argsortDescending(sortedValues);
        double[] values = new double[rank];
        DMatrixRMaj sortedNear = new DMatrixRMaj(near.numRows, rank);
        DMatrixRMaj sortedFar = new DMatrixRMaj(far.numRows, rank);
        for (int newCol = 0; newCol < rank; newCol++) {
            int oldCol = byNorm[newCol];
            values[newCol] = sortedValues[oldCol];
            for (int row = 0; row < near.numRows; row++) {
                sortedNear.set(row, newCol, near.get(row, oldCol));
            }
            for (int row = 0; row < far.numRows; row++) {
                sortedFar.set(row, newCol, far.get(row, oldCol));
            }
        }

        return rowSide ? new SingularValueDecompositionResult(values, sortedNear, sortedFar)
                : new SingularValueDecompositionResult(values, sortedFar, sortedNear);
    }

    /**
     * 行列の列ベクトルのユークリッドノルムを返します。
     *
     * @param m 行列です
     * @param col 列番号です
     * @return ノルムです
     */
    private static double columnNorm(DMatrixRMaj m, int col) {
        double sum = 0.0;
        for (int row = 0; row < m.numRows; row++) {
            double x = m.get(row, col);
            sum += x * x;
        }
        return Math.sqrt(sum);
    }

    /**
     * 配列を降順ソートしたときのインデックス順（argsort）を返します。
     *
     * <p>
     * 安定ソートのため、同値の要素は元の順序を維持します。
     * </p>
     *
     * @param values 対象配列です
     * @return 降順のインデックス配列です
     */
    static int[] argsortDescending(double[] values) {
        Integer[] indices = new Integer[values.length];
        for (int i = 0; i < values.length; i++) {
            indices[i] = i;
        }

        Arrays.sort(indices, (i, j) -> Double.compare(values[j], values[i]));

        int[] order = new int[values.length];
        for (int i = 0; i < values.length; i++) {
            order[i] = indices[i];
        }
        return order;
    }

    /**
     * 配列がすべて有限値であることを確認します。
     *
     * @param data 配列です
     * @param label メッセージ用のラベルです
     * @throws NumericFailureException 非有限値が含まれる場合に発生します
     */
    private static void ensureFinite(double[] data, String label) {
        for (double x : data) {
            if (!Double.isFinite(x)) {
                throw new NumericFailureException(label + "に非有限値が含まれています（EJML）");
            }
        }
    }
}
