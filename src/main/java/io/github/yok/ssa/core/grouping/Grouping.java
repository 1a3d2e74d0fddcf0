package io.github.yok.ssa.core.grouping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;

/**
 * 検証済みのグループ分け（グループ名 → 固有三つ組インデックスの順序付き集合）を保持する不変クラスです。
 *
 * <p>
 * {@link Grouper} のみが生成し、すべてのインデックスが [1, d] にあることを保証します。
 * </p>
 */
public final class Grouping {

    /**
     * 検証に用いた固有三つ組の数 d です。
     */
    @Getter
    private final int tripleCount;

    /**
     * グループ名 → インデックス列（呼び出し元の順序を保持）です。
     */
    private final Map<String, List<Integer>> groups;

    Grouping(int tripleCount, LinkedHashMap<String, List<Integer>> groups) {
        this.tripleCount = tripleCount;
        LinkedHashMap<String, List<Integer>> copy = new LinkedHashMap<>();
        groups.forEach((name, indices) -> copy.put(name, List.copyOf(indices)));
        this.groups = Collections.unmodifiableMap(copy);
    }

    /**
     * グループ名を指定順で返します。
     *
     * @return グループ名の集合です
     */
    public Set<String> names() {
        return groups.keySet();
    }

    /**
     * グループのインデックス列を返します。
     *
     * @param name グループ名です
     * @return 1 始まりのインデックス列です
     * @throws IllegalArgumentException 存在しないグループ名の場合に発生します
     */
    public List<Integer> indicesOf(String name) {
        List<Integer> indices = groups.get(name);
        if (indices == null) {
            throw new IllegalArgumentException("存在しないグループです: " + name);
        }
        return indices;
    }

    /**
     * グループ数を返します。
     *
     * @return グループ数です
     */
    public int size() {
        return groups.size();
    }

    /**
     * グループ分けを不変マップとして返します。
     *
     * @return グループ名 → インデックス列です
     */
    public Map<String, List<Integer>> asMap() {
        return groups;
    }

    @Override
    public String toString() {
        return "Grouping" + groups;
    }
}
