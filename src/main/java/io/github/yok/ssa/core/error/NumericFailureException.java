package io.github.yok.ssa.core.error;

/**
 * 特異値分解が収束しない、または非有限値を返した場合に発生する例外です。
 *
 * <p>
 * 計算は決定的なため、再試行は行いません。
 * </p>
 */
public class NumericFailureException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public NumericFailureException(String message) {
        super(message);
    }

    /**
     * 原因を指定して例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public NumericFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
