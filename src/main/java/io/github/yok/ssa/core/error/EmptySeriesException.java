package io.github.yok.ssa.core.error;

import lombok.Getter;

/**
 * 時系列の長さが 2 未満の場合に発生する例外です。
 */
@Getter
public class EmptySeriesException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 時系列長です。
     */
    private final int seriesLength;

    /**
     * 例外を生成します。
     *
     * @param seriesLength 指定された時系列長です
     */
    public EmptySeriesException(int seriesLength) {
        super("時系列の長さは 2 以上が必要です: N=" + seriesLength);
        this.seriesLength = seriesLength;
    }
}
