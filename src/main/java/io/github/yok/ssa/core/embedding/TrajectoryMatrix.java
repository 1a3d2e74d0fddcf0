package io.github.yok.ssa.core.embedding;

import io.github.yok.ssa.core.series.TimeSeries;
import lombok.Getter;
import org.ejml.data.DMatrixRMaj;

/**
 * 時系列から得られる L×K の軌道行列（Hankel 行列）を表すクラスです。
 *
 * <p>
 * 独自の記憶領域は持たず、要素 (i, j) を {@code series[i + j]}（0 始まり）として時系列から都度読み出します。
 * SVD への入力が必要な場合のみ {@link #toMatrix()} で実体化します。
 * </p>
 */
@Getter
public final class TrajectoryMatrix {

    /**
     * 埋め込み元の時系列です。
     */
    private final TimeSeries series;

    /**
     * 行数（窓長 L）です。
     */
    private final int rows;

    /**
     * 列数（K = N - L + 1）です。
     */
    private final int columns;

    /**
     * 軌道行列を生成します。形状の検証は {@link Embedder} が行います。
     *
     * @param series 時系列です
     * @param windowLength 窓長 L です
     */
    TrajectoryMatrix(TimeSeries series, int windowLength) {
        this.series = series;
        this.rows = windowLength;
        this.columns = series.length() - windowLength + 1;
    }

    /**
     * 要素 (i, j) を返します（0 始まり）。
     *
     * @param i 行インデックスです（0 以上 L 未満）
     * @param j 列インデックスです（0 以上 K 未満）
     * @return 要素の値です
     * @throws IndexOutOfBoundsException 範囲外の場合に発生します
     */
    public double get(int i, int j) {
        if (i < 0 || i >= rows || j < 0 || j >= columns) {
            throw new IndexOutOfBoundsException(
                    "軌道行列の範囲外です: (" + i + ", " + j + ") / " + rows + "x" + columns);
        }
        return series.get(i + j);
    }

    /**
     * 元の時系列長 N を返します。
     *
     * @return 時系列長です
     */
    public int seriesLength() {
        return series.length();
    }

    /**
     * 軌道行列のフロベニウスノルムの二乗を返します。
     *
     * <p>
     * 位置 t の値は反対角線上に c(t) 回現れるため、Σ c(t)·x[t]² として行列を作らずに計算します。
     * </p>
     *
     * @return フロベニウスノルムの二乗です
     */
    public double frobeniusNormSquared() {
        int n = series.length();
        int minDim = Math.min(rows, columns);
        double sum = 0.0;
        for (int t = 0; t < n; t++) {
            double x = series.get(t);
            sum += antiDiagonalCount(t, rows, columns, minDim) * x * x;
        }
        return sum;
    }

    /**
     * 軌道行列を EJML の密行列として実体化します。
     *
     * @return L×K の行列です
     */
    public DMatrixRMaj toMatrix() {
        DMatrixRMaj m = new DMatrixRMaj(rows, columns);
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                m.unsafe_set(i, j, series.get(i + j));
            }
        }
        return m;
    }

    /**
     * 反対角線 i + j = k 上のセル数を返します。
     *
     * @param k 反対角線の番号です（0 以上 N 未満）
     * @param rows 行数 L です
     * @param columns 列数 K です
     * @param minDim min(L, K) です
     * @return セル数です
     */
    static int antiDiagonalCount(int k, int rows, int columns, int minDim) {
        int n = rows + columns - 1;
        return Math.min(Math.min(k + 1, n - k), minDim);
    }
}
