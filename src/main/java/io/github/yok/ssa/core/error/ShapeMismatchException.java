package io.github.yok.ssa.core.error;

/**
 * 再構成系列の長さが元の時系列長 N と一致しない場合に発生する例外です。
 *
 * <p>
 * 利用者の入力ではなく再構成計算の不具合を表すため、回復は試みません。
 * </p>
 */
public class ShapeMismatchException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param groupName グループ名です
     * @param expectedLength 期待する長さ N です
     * @param actualLength 実際の長さです
     */
    public ShapeMismatchException(String groupName, int expectedLength, int actualLength) {
        super("再構成系列の長さが一致しません: group=" + groupName + ", expected=" + expectedLength
                + ", actual=" + actualLength);
    }
}
