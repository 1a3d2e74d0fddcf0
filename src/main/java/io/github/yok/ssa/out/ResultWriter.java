package io.github.yok.ssa.out;

import io.github.yok.ssa.core.decomposition.Decomposition;
import io.github.yok.ssa.core.series.TimeSeries;
import java.util.Map;

/**
 * 解析結果を出力する処理のインタフェースです。
 *
 * <p>
 * 分解結果と再構成系列は読み取り専用の入力として扱います。
 * </p>
 */
public interface ResultWriter {

    /**
     * 元の時系列・分解結果・再構成系列を出力します。
     *
     * @param series 元の時系列です
     * @param decomposition 分解結果です
     * @param reconstructions グループ名 → 再構成系列です
     */
    void write(TimeSeries series, Decomposition decomposition,
            Map<String, TimeSeries> reconstructions);
}
