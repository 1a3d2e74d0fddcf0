package io.github.yok.ssa.core.decomposition;

import java.util.List;
import lombok.Getter;

/**
 * ひとつの (時系列, 窓長) の組に対する SSA 分解結果を保持する不変クラスです。
 *
 * <p>
 * 固有三つ組は特異値の降順に並び、インデックスは 1 から d まで振られます。
 * </p>
 */
@Getter
public final class Decomposition {

    /**
     * 元の時系列長 N です。
     */
    private final int seriesLength;

    /**
     * 窓長 L です。
     */
    private final int windowLength;

    /**
     * 軌道行列の列数 K です。
     */
    private final int columnCount;

    /**
     * 軌道行列のフロベニウスノルムの二乗です。
     */
    private final double trajectoryNormSquared;

    /**
     * 上位成分のみに切り詰めたかどうかです。
     */
    private final boolean truncated;

    /**
     * 固有三つ組の列（降順、不変）です。
     */
    private final List<EigenTriple> triples;

    /**
     * 分解結果を生成します。
     *
     * @param seriesLength 時系列長 N です
     * @param windowLength 窓長 L です
     * @param trajectoryNormSquared 軌道行列のフロベニウスノルムの二乗です
     * @param truncated 切り詰めたかどうかです
     * @param triples 固有三つ組の列です（インデックスは 1..d の連番が必要です）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public Decomposition(int seriesLength, int windowLength, double trajectoryNormSquared,
            boolean truncated, List<EigenTriple> triples) {
        if (windowLength < 1 || windowLength > seriesLength) {
            throw new IllegalArgumentException(
                    "windowLength が不正です: L=" + windowLength + ", N=" + seriesLength);
        }
        if (triples == null || triples.isEmpty()) {
            throw new IllegalArgumentException("triples は 1 件以上が必要です");
        }
        int k = seriesLength - windowLength + 1;
        double previous = Double.POSITIVE_INFINITY;
        for (int i = 0; i < triples.size(); i++) {
            EigenTriple t = triples.get(i);
            if (t.getIndex() != i + 1) {
                throw new IllegalArgumentException(
                        "triples のインデックスが連番ではありません: position=" + i + ", index=" + t.getIndex());
            }
            if (t.getSingularValue() > previous) {
                throw new IllegalArgumentException("triples が特異値の降順に並んでいません: index=" + t.getIndex());
            }
            if (t.getLeftVector().length != windowLength || t.getFactorVector().length != k) {
                throw new IllegalArgumentException("固有三つ組のベクトル長が L/K と一致しません: index=" + t.getIndex());
            }
            previous = t.getSingularValue();
        }
        this.seriesLength = seriesLength;
        this.windowLength = windowLength;
        this.columnCount = k;
        this.trajectoryNormSquared = trajectoryNormSquared;
        this.truncated = truncated;
        this.triples = List.copyOf(triples);
    }

    /**
     * 保持する固有三つ組の数 d を返します。
     *
     * @return 固有三つ組の数です
     */
    public int size() {
        return triples.size();
    }

    /**
     * 1 始まりのインデックスで固有三つ組を返します。
     *
     * @param index インデックスです（1 以上 d 以下）
     * @return 固有三つ組です
     * @throws IndexOutOfBoundsException 範囲外の場合に発生します
     */
    public EigenTriple triple(int index) {
        if (index < 1 || index > triples.size()) {
            throw new IndexOutOfBoundsException(
                    "固有三つ組のインデックスが範囲外です: " + index + " / " + triples.size());
        }
        return triples.get(index - 1);
    }

    /**
     * 特異値を降順で返します。
     *
     * @return 特異値の配列です（コピー）
     */
    public double[] singularValues() {
        double[] s = new double[triples.size()];
        for (int i = 0; i < s.length; i++) {
            s[i] = triples.get(i).getSingularValue();
        }
        return s;
    }

    /**
     * 各成分の寄与率 σ_i² / ||X||_F² を返します。
     *
     * <p>
     * 切り詰めていない場合は総和が 1 になります。
     * </p>
     *
     * @return 寄与率の配列です
     */
    public double[] contributions() {
        double[] c = new double[triples.size()];
        if (trajectoryNormSquared <= 0.0) {
            return c;
        }
        for (int i = 0; i < c.length; i++) {
            double s = triples.get(i).getSingularValue();
            c[i] = s * s / trajectoryNormSquared;
        }
        return c;
    }
}
