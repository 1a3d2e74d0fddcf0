package io.github.yok.ssa.core.embedding;

import io.github.yok.ssa.core.error.EmptySeriesException;
import io.github.yok.ssa.core.error.InvalidWindowLengthException;
import io.github.yok.ssa.core.series.TimeSeries;

/**
 * 時系列を窓長 L で埋め込み、軌道行列を生成するクラスです。
 *
 * <p>
 * 状態を持たないため、複数スレッドから共有して使用できます。
 * </p>
 */
public final class Embedder {

    /**
     * 時系列を埋め込みます。
     *
     * @param series 時系列です
     * @param windowLength 窓長 L です（2 以上 N-1 以下）
     * @return L×K の軌道行列です
     * @throws EmptySeriesException series が null、または長さが 2 未満の場合に発生します
     * @throws InvalidWindowLengthException L が範囲外の場合に発生します
     */
    public TrajectoryMatrix embed(TimeSeries series, int windowLength) {
        // N の検証は L より先に行う
        if (series == null || series.length() < 2) {
            throw new EmptySeriesException(series == null ? 0 : series.length());
        }
        int n = series.length();
        if (windowLength < 2 || windowLength > n - 1) {
            throw new InvalidWindowLengthException(windowLength, n);
        }
        return new TrajectoryMatrix(series, windowLength);
    }
}
