package io.github.yok.ssa.core.error;

import lombok.Getter;

/**
 * グループが固有三つ組の範囲 [1, d] 外のインデックスを参照した場合に発生する例外です。
 */
@Getter
public class EigenTripleIndexOutOfRangeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 問題のあったグループ名です。
     */
    private final String groupName;

    /**
     * 範囲外のインデックスです。
     */
    private final int index;

    /**
     * 分解が保持する固有三つ組の数 d です。
     */
    private final int tripleCount;

    /**
     * 例外を生成します。
     *
     * @param groupName グループ名です
     * @param index 範囲外のインデックスです
     * @param tripleCount 固有三つ組の数 d です
     */
    public EigenTripleIndexOutOfRangeException(String groupName, int index, int tripleCount) {
        super("グループ '" + groupName + "' のインデックス " + index + " は範囲 [1, " + tripleCount
                + "] の外です");
        this.groupName = groupName;
        this.index = index;
        this.tripleCount = tripleCount;
    }
}
