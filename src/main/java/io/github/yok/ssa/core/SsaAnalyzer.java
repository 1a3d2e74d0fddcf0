package io.github.yok.ssa.core;

import io.github.yok.ssa.core.cancel.CancellationSignal;
import io.github.yok.ssa.core.decomposition.Decomposer;
import io.github.yok.ssa.core.decomposition.Decomposition;
import io.github.yok.ssa.core.embedding.Embedder;
import io.github.yok.ssa.core.embedding.TrajectoryMatrix;
import io.github.yok.ssa.core.grouping.Grouper;
import io.github.yok.ssa.core.grouping.Grouping;
import io.github.yok.ssa.core.linearalgebra.EjmlSingularValueDecompositionBackend;
import io.github.yok.ssa.core.reconstruction.Reconstructor;
import io.github.yok.ssa.core.series.TimeSeries;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;

/**
 * 特異スペクトル解析（SSA）の入口となるクラスです。
 *
 * <p>
 * 埋め込み → 特異値分解 → グループ化 → 再構成、を順に呼び出します。 各段は不変の結果を返すだけで状態を持たないため、
 * 独立した系列であれば複数スレッドから同時に使用できます。
 * </p>
 */
@RequiredArgsConstructor
public final class SsaAnalyzer {

    /**
     * 埋め込みです。
     */
    private final Embedder embedder;

    /**
     * 分解器です。
     */
    private final Decomposer decomposer;

    /**
     * グループ分けの検証です。
     */
    private final Grouper grouper;

    /**
     * 再構成です。
     */
    private final Reconstructor reconstructor;

    /**
     * 時系列を分解します。
     *
     * @param series 時系列です（長さ 2 以上）
     * @param windowLength 窓長 L です（2 以上 N-1 以下）
     * @param truncateTo 保持する上位成分数です（null の場合は全成分）
     * @return 分解結果です
     * @throws io.github.yok.ssa.core.error.EmptySeriesException 系列長が 2 未満の場合に発生します
     * @throws io.github.yok.ssa.core.error.InvalidWindowLengthException L が範囲外の場合に発生します
     * @throws io.github.yok.ssa.core.error.NumericFailureException 特異値分解に失敗した場合に発生します
     */
    public Decomposition decompose(double[] series, int windowLength, Integer truncateTo) {
        return decompose(series, windowLength, truncateTo, CancellationSignal.none());
    }

    /**
     * 打ち切り通知を指定して時系列を分解します。
     *
     * @param series 時系列です（長さ 2 以上）
     * @param windowLength 窓長 L です（2 以上 N-1 以下）
     * @param truncateTo 保持する上位成分数です（null の場合は全成分）
     * @param cancellation 打ち切り通知です
     * @return 分解結果です
     * @throws java.util.concurrent.CancellationException 打ち切りが要求された場合に発生します
     */
    public Decomposition decompose(double[] series, int windowLength, Integer truncateTo,
            CancellationSignal cancellation) {
        return decompose(TimeSeries.of(series), windowLength, truncateTo, cancellation);
    }

    /**
     * 打ち切り通知を指定して時系列を分解します。
     *
     * @param series 時系列です
     * @param windowLength 窓長 L です（2 以上 N-1 以下）
     * @param truncateTo 保持する上位成分数です（null の場合は全成分）
     * @param cancellation 打ち切り通知です
     * @return 分解結果です
     */
    public Decomposition decompose(TimeSeries series, int windowLength, Integer truncateTo,
            CancellationSignal cancellation) {
        TrajectoryMatrix trajectory = embedder.embed(series, windowLength);
        return decomposer.decompose(trajectory, truncateTo, cancellation);
    }

    /**
     * グループごとに時系列を再構成します。
     *
     * @param decomposition 分解結果です
     * @param groups グループ名 → 1 始まりのインデックス列です
     * @return グループ名 → 再構成系列です（groups の反復順）
     * @throws io.github.yok.ssa.core.error.EigenTripleIndexOutOfRangeException インデックスが範囲外の場合に発生します
     * @throws io.github.yok.ssa.core.error.ShapeMismatchException 再構成系列の長さが N と一致しない場合に発生します
     */
    public Map<String, TimeSeries> reconstruct(Decomposition decomposition,
            Map<String, List<Integer>> groups) {
        return reconstruct(decomposition, groups, CancellationSignal.none());
    }

    /**
     * 打ち切り通知を指定して、グループごとに時系列を再構成します。
     *
     * @param decomposition 分解結果です
     * @param groups グループ名 → 1 始まりのインデックス列です
     * @param cancellation 打ち切り通知です
     * @return グループ名 → 再構成系列です（groups の反復順）
     */
    public Map<String, TimeSeries> reconstruct(Decomposition decomposition,
            Map<String, List<Integer>> groups, CancellationSignal cancellation) {
        Grouping grouping = grouper.group(decomposition, groups);
        return reconstructor.reconstruct(decomposition, grouping, cancellation);
    }

    /**
     * 特異値を降順で返します。
     *
     * @param decomposition 分解結果です
     * @return 特異値の配列です
     */
    public double[] singularValues(Decomposition decomposition) {
        if (decomposition == null) {
            throw new IllegalArgumentException("decomposition は null 不可です");
        }
        return decomposition.singularValues();
    }

    /**
     * 既定の構成（EJML バックエンド）で生成します。
     *
     * @return 解析器です
     */
    public static SsaAnalyzer withDefaults() {
        return new SsaAnalyzer(new Embedder(),
                new Decomposer(new EjmlSingularValueDecompositionBackend()), new Grouper(),
                new Reconstructor());
    }
}
