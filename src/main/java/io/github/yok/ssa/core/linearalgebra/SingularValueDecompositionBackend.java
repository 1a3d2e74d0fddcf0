package io.github.yok.ssa.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 密行列の特異値分解を提供するバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用する線形代数ライブラリを差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface SingularValueDecompositionBackend {

    /**
     * 行列を特異値分解し、全成分（r = min(m, n)）を特異値降順で返します。
     *
     * @param matrix m×n の行列です（変更されません）
     * @return 特異値降順の分解結果です
     * @throws io.github.yok.ssa.core.error.NumericFailureException 分解に失敗した場合に発生します
     */
    default SingularValueDecompositionResult decomposeAndSortDescending(DMatrixRMaj matrix) {
        if (matrix == null) {
            throw new IllegalArgumentException("matrix は null 不可です");
        }
        return decomposeAndSortDescending(matrix, Math.min(matrix.numRows, matrix.numCols));
    }

    /**
     * 行列を特異値分解し、上位 rank 成分だけを特異値降順で返します。
     *
     * <p>
     * rank が min(m, n) より小さい場合、実装は残りの成分の計算を省略してかまいません。 返す結果の列数は rank 以上です。
     * </p>
     *
     * @param matrix m×n の行列です（変更されません）
     * @param rank 必要な上位成分数です（1 以上 min(m, n) 以下）
     * @return 特異値降順の分解結果です
     * @throws IllegalArgumentException matrix が null、または rank が範囲外の場合に発生します
     * @throws io.github.yok.ssa.core.error.NumericFailureException 分解に失敗した場合に発生します
     */
    SingularValueDecompositionResult decomposeAndSortDescending(DMatrixRMaj matrix, int rank);

    /**
     * 特異値分解の結果を保持するクラスです。
     *
     * <p>
     * 左特異ベクトル行列・右特異ベクトル行列はいずれも「列が特異ベクトル」である前提で、 列の順序は特異値の順序と一致します。
     * </p>
     */
    @Value
    class SingularValueDecompositionResult {

        /**
         * 特異値配列です（降順）。
         */
        double[] singularValues;

        /**
         * 左特異ベクトル行列（m×r）です。
         */
        DMatrixRMaj leftVectors;

        /**
         * 右特異ベクトル行列（n×r）です。
         */
        DMatrixRMaj rightVectors;
    }
}
