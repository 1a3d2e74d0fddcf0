package io.github.yok.ssa.core.reconstruction;

import io.github.yok.ssa.core.cancel.CancellationSignal;
import io.github.yok.ssa.core.decomposition.Decomposition;
import io.github.yok.ssa.core.decomposition.EigenTriple;
import io.github.yok.ssa.core.error.ShapeMismatchException;
import io.github.yok.ssa.core.grouping.Grouping;
import io.github.yok.ssa.core.series.TimeSeries;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * グループごとに時系列を再構成するクラスです。
 *
 * <p>
 * グループに属する固有三つ組の階数 1 行列 σ_i · U_i ⊗ V_i を足し合わせ、得られた L×K 行列を対角平均（Hankel 化）して長さ N の系列に戻します。
 * 分解結果は変更しません。
 * </p>
 */
@Slf4j
public final class Reconstructor {

    /**
     * すべてのグループを再構成します（打ち切りなし）。
     *
     * @param decomposition 分解結果です
     * @param grouping 検証済みのグループ分けです
     * @return グループ名 → 再構成系列（グループ分けの順序）です
     */
    public Map<String, TimeSeries> reconstruct(Decomposition decomposition, Grouping grouping) {
        return reconstruct(decomposition, grouping, CancellationSignal.none());
    }

    /**
     * すべてのグループを再構成します。
     *
     * @param decomposition 分解結果です
     * @param grouping 検証済みのグループ分けです（同じ分解から作られたものが必要です）
     * @param cancellation 打ち切り通知です（グループの境界で確認します）
     * @return グループ名 → 再構成系列（グループ分けの順序）です
     * @throws IllegalArgumentException 引数が null、またはグループ分けが別の分解に対するものの場合に発生します
     * @throws ShapeMismatchException 再構成系列の長さが N と一致しない場合に発生します
     * @throws java.util.concurrent.CancellationException 打ち切りが要求された場合に発生します
     */
    public Map<String, TimeSeries> reconstruct(Decomposition decomposition, Grouping grouping,
            CancellationSignal cancellation) {
        if (decomposition == null) {
            throw new IllegalArgumentException("decomposition は null 不可です");
        }
        if (grouping == null) {
            throw new IllegalArgumentException("grouping は null 不可です");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation は null 不可です");
        }
        if (grouping.getTripleCount() != decomposition.size()) {
            throw new IllegalArgumentException("grouping は別の分解に対して検証されています: grouping.d="
                    + grouping.getTripleCount() + ", decomposition.d=" + decomposition.size());
        }

        int n = decomposition.getSeriesLength();
        Map<String, TimeSeries> result = new LinkedHashMap<>();

        for (String name : grouping.names()) {
            cancellation.throwIfCancelled("グループ '" + name + "' の再構成");

            List<Integer> indices = grouping.indicesOf(name);

            // 1) 部分行列 M_g = Σ σ_i U_i ⊗ V_i
            DMatrixRMaj partial = sumOfElementaryMatrices(decomposition, indices);

            // 2) 対角平均
            double[] values = diagonalAverage(partial);

            // 3) 長さの検証（不一致は再構成計算の不具合）
            if (values.length != n) {
                throw new ShapeMismatchException(name, n, values.length);
            }

            log.debug("グループ '{}' を再構成しました。成分={}", name, indices);
            result.put(name, TimeSeries.of(values));
        }

        return result;
    }

    /**
     * 指定した固有三つ組の階数 1 行列の和を求めます。
     *
     * @param decomposition 分解結果です
     * @param indices 1 始まりのインデックス列です
     * @return L×K の行列です
     */
    static DMatrixRMaj sumOfElementaryMatrices(Decomposition decomposition, List<Integer> indices) {
        int l = decomposition.getWindowLength();
        int k = decomposition.getColumnCount();
        DMatrixRMaj m = new DMatrixRMaj(l, k);

        for (int index : indices) {
            EigenTriple triple = decomposition.triple(index);
            double sigma = triple.getSingularValue();
            for (int i = 0; i < l; i++) {
                double su = sigma * triple.left(i);
                for (int j = 0; j < k; j++) {
                    m.unsafe_set(i, j, m.unsafe_get(i, j) + su * triple.factor(j));
                }
            }
        }
        return m;
    }

    /**
     * 行列を対角平均（Hankel 化）して系列に変換します。
     *
     * <p>
     * 出力位置 t（0 始まり）の値は、i + j = t を満たすセルの算術平均です。 端ではセル数が min(L, K) より少なくなります。
     * </p>
     *
     * @param m L×K の行列です
     * @return 長さ L + K - 1 の系列です
     */
    static double[] diagonalAverage(DMatrixRMaj m) {
        int l = m.numRows;
        int k = m.numCols;
        int n = l + k - 1;

        double[] sums = new double[n];
        int[] counts = new int[n];
        for (int i = 0; i < l; i++) {
            for (int j = 0; j < k; j++) {
                sums[i + j] += m.unsafe_get(i, j);
                counts[i + j]++;
            }
        }

        double[] out = new double[n];
        for (int t = 0; t < n; t++) {
            out[t] = sums[t] / counts[t];
        }
        return out;
    }
}
