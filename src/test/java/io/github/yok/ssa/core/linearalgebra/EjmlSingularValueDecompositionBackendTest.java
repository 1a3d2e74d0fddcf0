package io.github.yok.ssa.core.linearalgebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.ssa.core.linearalgebra.SingularValueDecompositionBackend.SingularValueDecompositionResult;
import org.ejml.data.DMatrixRMaj;
import org.junit.jupiter.api.Test;

class EjmlSingularValueDecompositionBackendTest {

    private final EjmlSingularValueDecompositionBackend backend =
            new EjmlSingularValueDecompositionBackend();

    @Test
    void returnsDescendingValuesThatRebuildTheMatrix() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{1, 0, 2, -1}, {3, 1, 0, 2}, {0, 4, 1, 1}});

        SingularValueDecompositionResult r = backend.decomposeAndSortDescending(a);

        double[] s = r.getSingularValues();
        assertThat(s).hasSize(3);
        for (int i = 1; i < s.length; i++) {
            assertThat(s[i]).isLessThanOrEqualTo(s[i - 1]);
        }
        assertThat(r.getLeftVectors().numRows).isEqualTo(3);
        assertThat(r.getRightVectors().numRows).isEqualTo(4);

        // A = Σ σ_c u_c v_c^T
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 4; j++) {
                double sum = 0.0;
                for (int c = 0; c < s.length; c++) {
                    sum += s[c] * r.getLeftVectors().get(i, c) * r.getRightVectors().get(j, c);
                }
                assertThat(sum).isCloseTo(a.get(i, j), within(1e-10));
            }
        }
    }

    @Test
    void handlesTallMatrices() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{2, 0}, {0, 5}, {0, 0}, {1, 1}});

        SingularValueDecompositionResult r = backend.decomposeAndSortDescending(a);

        assertThat(r.getSingularValues()).hasSize(2);
        assertThat(r.getLeftVectors().numCols).isEqualTo(2);
        assertThat(r.getRightVectors().numRows).isEqualTo(2);
        assertThat(r.getSingularValues()[0]).isGreaterThanOrEqualTo(r.getSingularValues()[1]);
    }

    @Test
    void leavesInputUntouched() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{1, 2, 3}, {2, 3, 4}});
        DMatrixRMaj before = a.copy();

        backend.decomposeAndSortDescending(a);

        assertThat(a.data).containsExactly(before.data);
    }

    @Test
    void leadingComponentsMatchFullDecomposition() {
        DMatrixRMaj wide = new DMatrixRMaj(
                new double[][] {{4, 1, 0, 2, 1}, {1, 3, 1, 0, 2}, {0, 1, 2, 1, 0}, {2, 0, 1, 1, 3}});
        DMatrixRMaj tall = new DMatrixRMaj(4, 3);
        for (int i = 0; i < 4; i++) {
            for (int j = 0; j < 3; j++) {
                tall.set(i, j, wide.get(i, j) + 0.5 * wide.get(i, j + 2));
            }
        }

        for (DMatrixRMaj a : new DMatrixRMaj[] {wide, tall}) {
            SingularValueDecompositionResult full = backend.decomposeAndSortDescending(a);
            SingularValueDecompositionResult top = backend.decomposeAndSortDescending(a, 2);

            assertThat(top.getSingularValues()).hasSize(2);
            assertThat(top.getLeftVectors().numRows).isEqualTo(a.numRows);
            assertThat(top.getRightVectors().numRows).isEqualTo(a.numCols);
            for (int c = 0; c < 2; c++) {
                assertThat(top.getSingularValues()[c])
                        .isCloseTo(full.getSingularValues()[c], within(1e-10));
                // 符号に依存しない比較
                for (int i = 0; i < a.numRows; i++) {
                    for (int j = 0; j < a.numCols; j++) {
                        assertThat(top.getLeftVectors().get(i, c) * top.getRightVectors().get(j, c))
                                .isCloseTo(full.getLeftVectors().get(i, c)
                                        * full.getRightVectors().get(j, c), within(1e-9));
                    }
                }
            }
        }
    }

    @Test
    void leadingComponentsLeaveInputUntouched() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{1, 2, 3, 0}, {2, 3, 4, 1}, {5, 0, 1, 2}});
        DMatrixRMaj before = a.copy();

        backend.decomposeAndSortDescending(a, 1);

        assertThat(a.data).containsExactly(before.data);
    }

    @Test
    void rejectsRankOutsideDimension() {
        DMatrixRMaj a = new DMatrixRMaj(new double[][] {{1, 2, 3}, {2, 3, 5}});

        assertThatThrownBy(() -> backend.decomposeAndSortDescending(a, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> backend.decomposeAndSortDescending(a, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void argsortKeepsOriginalOrderForTies() {
        int[] order = EjmlSingularValueDecompositionBackend
                .argsortDescending(new double[] {1.0, 3.0, 1.0, 3.0, 2.0});

        assertThat(order).containsExactly(1, 3, 4, 0, 2);
    }

    @Test
    void rejectsNullMatrix() {
        assertThatThrownBy(() -> backend.decomposeAndSortDescending(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
