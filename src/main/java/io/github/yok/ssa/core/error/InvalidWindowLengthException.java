package io.github.yok.ssa.core.error;

import lombok.Getter;

/**
 * 窓長 L が許容範囲 [2, N-1] の外にある場合に発生する例外です。
 *
 * <p>
 * 軌道行列の形状（L または K が 1 未満）が縮退している場合にも使用します。
 * </p>
 */
@Getter
public class InvalidWindowLengthException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 指定された窓長です。
     */
    private final int windowLength;

    /**
     * 時系列長です。
     */
    private final int seriesLength;

    /**
     * 例外を生成します。
     *
     * @param windowLength 指定された窓長 L です
     * @param seriesLength 時系列長 N です
     */
    public InvalidWindowLengthException(int windowLength, int seriesLength) {
        this(windowLength, seriesLength, "窓長 L は 2 以上 N-1 以下を指定してください: L=" + windowLength
                + ", N=" + seriesLength);
    }

    /**
     * メッセージを指定して例外を生成します。
     *
     * @param windowLength 指定された窓長 L です
     * @param seriesLength 時系列長 N です
     * @param message メッセージです
     */
    public InvalidWindowLengthException(int windowLength, int seriesLength, String message) {
        super(message);
        this.windowLength = windowLength;
        this.seriesLength = seriesLength;
    }
}
