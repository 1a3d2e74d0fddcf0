package io.github.yok.ssa.core.grouping;

import io.github.yok.ssa.core.decomposition.Decomposition;
import io.github.yok.ssa.core.error.EigenTripleIndexOutOfRangeException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * グループ指定を分解結果に照らして検証し、{@link Grouping} を生成するクラスです。
 *
 * <p>
 * 残差（どのグループにも属さない成分）は自動では作りません。必要な場合は呼び出し元が残りのインデックスを明示します。
 * </p>
 */
@Slf4j
public final class Grouper {

    /**
     * グループ指定を検証します。
     *
     * @param decomposition 分解結果です
     * @param groupSpec グループ名 → 1 始まりのインデックス列です（反復順を保持します）
     * @return 検証済みのグループ分けです
     * @throws IllegalArgumentException 引数が null・空、グループ名が空、またはインデックス列が空の場合に発生します
     * @throws EigenTripleIndexOutOfRangeException インデックスが [1, d] の外にある場合に発生します
     */
    public Grouping group(Decomposition decomposition, Map<String, List<Integer>> groupSpec) {
        if (decomposition == null) {
            throw new IllegalArgumentException("decomposition は null 不可です");
        }
        if (groupSpec == null || groupSpec.isEmpty()) {
            throw new IllegalArgumentException("groupSpec は 1 グループ以上が必要です");
        }

        int d = decomposition.size();
        LinkedHashMap<String, List<Integer>> validated = new LinkedHashMap<>();

        for (Map.Entry<String, List<Integer>> e : groupSpec.entrySet()) {
            String name = e.getKey();
            List<Integer> indices = e.getValue();

            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("グループ名は空にできません");
            }
            if (indices == null || indices.isEmpty()) {
                throw new IllegalArgumentException("グループ '" + name + "' のインデックス列が空です");
            }

            // 順序付き集合（重複は最初の出現のみ残す）
            LinkedHashSet<Integer> unique = new LinkedHashSet<>();
            for (Integer index : indices) {
                if (index == null) {
                    throw new IllegalArgumentException("グループ '" + name + "' に null のインデックスが含まれています");
                }
                if (index < 1 || index > d) {
                    throw new EigenTripleIndexOutOfRangeException(name, index, d);
                }
                unique.add(index);
            }
            if (unique.size() != indices.size()) {
                log.debug("グループ '{}' の重複インデックスを除去しました: {} → {}", name, indices, unique);
            }
            validated.put(name, new ArrayList<>(unique));
        }

        return new Grouping(d, validated);
    }
}
