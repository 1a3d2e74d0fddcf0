package io.github.yok.ssa.signal;

import io.github.yok.ssa.core.series.TimeSeries;

/**
 * 解析対象の合成時系列を生成するインタフェースです。
 *
 * <p>
 * 乱数源は実装側が持ち、シードを明示して注入します。
 * </p>
 */
public interface SignalGenerator {

    /**
     * 合成時系列を生成します。
     *
     * @return 時系列です
     */
    TimeSeries generate();
}
