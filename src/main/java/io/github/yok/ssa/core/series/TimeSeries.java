package io.github.yok.ssa.core.series;

import io.github.yok.ssa.core.error.EmptySeriesException;
import java.util.Arrays;

/**
 * 実数値の時系列を保持する不変クラスです。
 *
 * <p>
 * 長さ N は 2 以上で、生成後に値が変わることはありません。 入力系列と再構成系列の両方をこの型で表します。
 * </p>
 */
public final class TimeSeries {

    /**
     * 系列の値です（防御的コピーを保持します）。
     */
    private final double[] values;

    private TimeSeries(double[] values) {
        this.values = values;
    }

    /**
     * 値の配列から時系列を生成します。
     *
     * @param values 系列の値です（コピーされます）
     * @return 時系列です
     * @throws EmptySeriesException values が null、または長さが 2 未満の場合に発生します
     * @throws IllegalArgumentException 非有限値が含まれる場合に発生します
     */
    public static TimeSeries of(double... values) {
        if (values == null || values.length < 2) {
            throw new EmptySeriesException(values == null ? 0 : values.length);
        }
        for (int t = 0; t < values.length; t++) {
            if (!Double.isFinite(values[t])) {
                throw new IllegalArgumentException("時系列に非有限値が含まれています: t=" + t + ", value="
                        + values[t]);
            }
        }
        return new TimeSeries(values.clone());
    }

    /**
     * 系列長 N を返します。
     *
     * @return 系列長です
     */
    public int length() {
        return values.length;
    }

    /**
     * 位置 t（0 始まり）の値を返します。
     *
     * @param t 位置です
     * @return 値です
     */
    public double get(int t) {
        return values[t];
    }

    /**
     * 値の配列をコピーして返します。
     *
     * @return 値の配列です
     */
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeSeries)) {
            return false;
        }
        return Arrays.equals(values, ((TimeSeries) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "TimeSeries(N=" + values.length + ")";
    }
}
