package io.github.yok.ssa.core.grouping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.yok.ssa.core.SsaAnalyzer;
import io.github.yok.ssa.core.decomposition.Decomposition;
import io.github.yok.ssa.core.error.EigenTripleIndexOutOfRangeException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GrouperTest {

    private final Grouper grouper = new Grouper();

    private Decomposition decomposition;

    @BeforeEach
    void setUp() {
        double[] x = new double[12];
        for (int t = 0; t < x.length; t++) {
            x[t] = Math.sin(t) + 0.1 * t;
        }
        // L=4 → d=4
        decomposition = SsaAnalyzer.withDefaults().decompose(x, 4, null);
    }

    @Test
    void keepsGroupOrderAndAllowsOverlap() {
        Map<String, List<Integer>> groupSpec = new LinkedHashMap<>();
        groupSpec.put("trend", List.of(1));
        groupSpec.put("season", List.of(2, 3));
        groupSpec.put("all", List.of(1, 2, 3, 4));

        Grouping g = grouper.group(decomposition, groupSpec);

        assertThat(g.names()).containsExactly("trend", "season", "all");
        assertThat(g.indicesOf("season")).containsExactly(2, 3);
        assertThat(g.getTripleCount()).isEqualTo(4);
        assertThat(g.size()).isEqualTo(3);
    }

    @Test
    void collapsesDuplicateIndicesKeepingFirstOccurrence() {
        Grouping g = grouper.group(decomposition, Map.of("g", List.of(3, 1, 3, 2, 1)));

        assertThat(g.indicesOf("g")).containsExactly(3, 1, 2);
    }

    @Test
    void reportsGroupAndIndexWhenOutOfRange() {
        Map<String, List<Integer>> groupSpec = new LinkedHashMap<>();
        groupSpec.put("ok", List.of(1, 2));
        groupSpec.put("noise", List.of(3, 5));

        assertThatThrownBy(() -> grouper.group(decomposition, groupSpec))
                .isInstanceOfSatisfying(EigenTripleIndexOutOfRangeException.class, e -> {
                    assertThat(e.getGroupName()).isEqualTo("noise");
                    assertThat(e.getIndex()).isEqualTo(5);
                    assertThat(e.getTripleCount()).isEqualTo(4);
                }).hasMessageContaining("noise").hasMessageContaining("5");

        assertThatThrownBy(() -> grouper.group(decomposition, Map.of("zero", List.of(0))))
                .isInstanceOf(EigenTripleIndexOutOfRangeException.class);
    }

    @Test
    void rejectsEmptySpecifications() {
        assertThatThrownBy(() -> grouper.group(decomposition, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> grouper.group(decomposition, Map.of("empty", List.of())))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("empty");
        assertThatThrownBy(() -> grouper.group(decomposition, Map.of(" ", List.of(1))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> grouper.group(decomposition, Map.of("nulls", Arrays.asList(1, null))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void groupingIsNotAffectedByLaterChangesToTheInput() {
        Map<String, List<Integer>> groupSpec = new LinkedHashMap<>();
        List<Integer> indices = new ArrayList<>(List.of(1, 2));
        groupSpec.put("a", indices);

        Grouping g = grouper.group(decomposition, groupSpec);
        indices.add(3);
        groupSpec.put("b", List.of(4));

        assertThat(g.names()).containsExactly("a");
        assertThat(g.indicesOf("a")).containsExactly(1, 2);
        assertThatThrownBy(() -> g.asMap().put("c", List.of(1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
