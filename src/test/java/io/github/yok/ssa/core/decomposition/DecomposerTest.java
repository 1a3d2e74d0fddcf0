package io.github.yok.ssa.core.decomposition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.ssa.core.cancel.CancellationSignal;
import io.github.yok.ssa.core.embedding.Embedder;
import io.github.yok.ssa.core.embedding.TrajectoryMatrix;
import io.github.yok.ssa.core.error.NumericFailureException;
import io.github.yok.ssa.core.linearalgebra.EjmlSingularValueDecompositionBackend;
import io.github.yok.ssa.core.series.TimeSeries;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class DecomposerTest {

    private final Embedder embedder = new Embedder();

    private final Decomposer decomposer =
            new Decomposer(new EjmlSingularValueDecompositionBackend());

    private static TimeSeries noisySeries(int n, long seed) {
        Random random = new Random(seed);
        double[] x = new double[n];
        for (int t = 0; t < n; t++) {
            x[t] = 0.05 * t + Math.sin(2.0 * Math.PI * t / 12.0) + 0.3 * random.nextGaussian();
        }
        return TimeSeries.of(x);
    }

    @Test
    void singularValuesAreNonNegativeAndNonIncreasing() {
        Decomposition d = decomposer.decompose(embedder.embed(noisySeries(120, 7L), 30), null);

        double[] s = d.singularValues();
        assertThat(s).hasSize(30);
        for (int i = 0; i < s.length; i++) {
            assertThat(s[i]).isGreaterThanOrEqualTo(0.0);
            if (i > 0) {
                assertThat(s[i]).isLessThanOrEqualTo(s[i - 1]);
            }
        }
        assertThat(d.isTruncated()).isFalse();
    }

    @Test
    void squaredSingularValuesSumToTrajectoryEnergy() {
        TrajectoryMatrix x = embedder.embed(noisySeries(90, 11L), 40);
        Decomposition d = decomposer.decompose(x, null);

        double sum = 0.0;
        for (double s : d.singularValues()) {
            sum += s * s;
        }
        double expected = x.frobeniusNormSquared();

        assertThat(Math.abs(sum - expected) / expected).isLessThan(1e-6);

        double contributionTotal = 0.0;
        for (double c : d.contributions()) {
            contributionTotal += c;
        }
        assertThat(contributionTotal).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void dimensionIsMinOfWindowAndWidth() {
        // L > K の場合は d = K
        Decomposition d = decomposer.decompose(embedder.embed(noisySeries(20, 3L), 15), null);

        assertThat(d.getWindowLength()).isEqualTo(15);
        assertThat(d.getColumnCount()).isEqualTo(6);
        assertThat(d.size()).isEqualTo(6);
        assertThat(d.triple(1).getLeftVector()).hasSize(15);
        assertThat(d.triple(1).getFactorVector()).hasSize(6);
    }

    @Test
    void vectorsHaveUnitNorm() {
        Decomposition d = decomposer.decompose(embedder.embed(noisySeries(50, 5L), 10), null);

        for (EigenTriple t : d.getTriples()) {
            assertThat(norm(t.getLeftVector())).isCloseTo(1.0, within(1e-9));
            assertThat(norm(t.getFactorVector())).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void truncationKeepsLeadingTriples() {
        TrajectoryMatrix x = embedder.embed(noisySeries(100, 13L), 25);
        Decomposition full = decomposer.decompose(x, null);
        Decomposition top = decomposer.decompose(x, 4);

        assertThat(top.size()).isEqualTo(4);
        assertThat(top.isTruncated()).isTrue();
        for (int i = 1; i <= 4; i++) {
            assertThat(top.triple(i).getIndex()).isEqualTo(i);
            assertThat(top.triple(i).getSingularValue())
                    .isCloseTo(full.triple(i).getSingularValue(), within(1e-9));
        }
    }

    @Test
    void truncatedRunMatchesLeadingPartOfFullRun() {
        TrajectoryMatrix x = embedder.embed(noisySeries(300, 17L), 100);
        Decomposition full = decomposer.decompose(x, null);
        Decomposition top = decomposer.decompose(x, 3);

        assertThat(top.size()).isEqualTo(3);
        for (EigenTriple t : top.getTriples()) {
            assertThat(norm(t.getLeftVector())).isCloseTo(1.0, within(1e-9));
            assertThat(norm(t.getFactorVector())).isCloseTo(1.0, within(1e-9));
            assertThat(t.getSingularValue()).isCloseTo(
                    full.triple(t.getIndex()).getSingularValue(), within(1e-8));
        }

        // 符号に依存しない比較: 第 1 成分の σU⊗V と、上位 3 成分の和
        assertMatricesClose(rankOneSum(top, 1, 1), rankOneSum(full, 1, 1), 1e-7);
        assertMatricesClose(rankOneSum(top, 1, 3), rankOneSum(full, 1, 3), 1e-7);
    }

    @Test
    void truncatedRunOnTallTrajectoryMatchesFullRun() {
        // L > K の場合は列側から求める
        TrajectoryMatrix x = embedder.embed(noisySeries(120, 19L), 90);
        Decomposition full = decomposer.decompose(x, null);
        Decomposition top = decomposer.decompose(x, 2);

        assertThat(top.triple(1).getLeftVector()).hasSize(90);
        assertThat(top.triple(1).getFactorVector()).hasSize(31);
        assertThat(norm(top.triple(2).getLeftVector())).isCloseTo(1.0, within(1e-9));
        assertMatricesClose(rankOneSum(top, 1, 1), rankOneSum(full, 1, 1), 1e-7);
    }

    @Test
    void truncationPastNumericalRankStillYieldsUnitVectors() {
        // 純粋な正弦波は階数 2 のため、第 3 成分の特異値はほぼ 0
        double[] v = new double[80];
        for (int t = 0; t < v.length; t++) {
            v[t] = Math.sin(2.0 * Math.PI * t / 10.0);
        }
        Decomposition d = decomposer.decompose(embedder.embed(TimeSeries.of(v), 20), 3);

        assertThat(d.size()).isEqualTo(3);
        assertThat(d.triple(3).getSingularValue()).isLessThan(1e-8);
        for (EigenTriple t : d.getTriples()) {
            assertThat(norm(t.getLeftVector())).isCloseTo(1.0, within(1e-9));
            assertThat(norm(t.getFactorVector())).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void backendIsAskedOnlyForKeptComponents() {
        AtomicInteger requested = new AtomicInteger();
        Decomposer recording = new Decomposer((m, rank) -> {
            requested.set(rank);
            return new EjmlSingularValueDecompositionBackend().decomposeAndSortDescending(m, rank);
        });
        TrajectoryMatrix x = embedder.embed(noisySeries(60, 2L), 20);

        recording.decompose(x, 4);
        assertThat(requested).hasValue(4);

        recording.decompose(x, null);
        assertThat(requested).hasValue(20);

        recording.decompose(x, 500);
        assertThat(requested).hasValue(20);
    }

    @Test
    void truncationAboveRankKeepsAllTriples() {
        Decomposition d = decomposer.decompose(embedder.embed(noisySeries(30, 1L), 10), 500);

        assertThat(d.size()).isEqualTo(10);
        assertThat(d.isTruncated()).isFalse();
    }

    @Test
    void rejectsNonPositiveTruncation() {
        TrajectoryMatrix x = embedder.embed(noisySeries(30, 1L), 10);

        assertThatThrownBy(() -> decomposer.decompose(x, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void numericFailurePropagatesWithoutRetry() {
        AtomicInteger calls = new AtomicInteger();
        Decomposer failing = new Decomposer((m, rank) -> {
            calls.incrementAndGet();
            throw new NumericFailureException("not converged");
        });
        TrajectoryMatrix x = embedder.embed(noisySeries(30, 1L), 10);

        assertThatThrownBy(() -> failing.decompose(x, null))
                .isInstanceOf(NumericFailureException.class).hasMessage("not converged");
        assertThat(calls).hasValue(1);
    }

    @Test
    void cancelledBeforeFactorizationSkipsBackend() {
        AtomicInteger calls = new AtomicInteger();
        Decomposer counting = new Decomposer((m, rank) -> {
            calls.incrementAndGet();
            return new EjmlSingularValueDecompositionBackend().decomposeAndSortDescending(m, rank);
        });
        TrajectoryMatrix x = embedder.embed(noisySeries(30, 1L), 10);

        assertThatThrownBy(() -> counting.decompose(x, null, () -> true))
                .isInstanceOf(CancellationException.class);
        assertThat(calls).hasValue(0);
    }

    @Test
    void cancelledDuringFactorizationDiscardsResult() {
        AtomicInteger checks = new AtomicInteger();
        // 1 回目（分解前）は継続、2 回目（分解後）で打ち切り
        CancellationSignal cancelAfterFirstCheck = () -> checks.incrementAndGet() > 1;
        TrajectoryMatrix x = embedder.embed(noisySeries(30, 1L), 10);

        assertThatThrownBy(() -> decomposer.decompose(x, null, cancelAfterFirstCheck))
                .isInstanceOf(CancellationException.class);
    }

    @Test
    void deadlineAbandonsSlowFactorization() {
        CountDownLatch release = new CountDownLatch(1);
        Decomposer slow = new Decomposer((m, rank) -> {
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new EjmlSingularValueDecompositionBackend().decomposeAndSortDescending(m, rank);
        });
        TrajectoryMatrix x = embedder.embed(noisySeries(30, 1L), 10);

        long t0 = System.nanoTime();
        try {
            assertThatThrownBy(() -> slow.decompose(x, null,
                    CancellationSignal.deadline(Duration.ofMillis(100))))
                            .isInstanceOf(CancellationException.class);
            assertThat(Duration.ofNanos(System.nanoTime() - t0)).isLessThan(Duration.ofSeconds(5));
        } finally {
            release.countDown();
        }
    }

    @Test
    void numericFailurePropagatesUnwrappedWhenCancellable() {
        Decomposer failing = new Decomposer((m, rank) -> {
            throw new NumericFailureException("not converged");
        });
        TrajectoryMatrix x = embedder.embed(noisySeries(30, 1L), 10);

        assertThatThrownBy(() -> failing.decompose(x, null, () -> false))
                .isInstanceOf(NumericFailureException.class).hasMessage("not converged");
    }

    @Test
    void rejectsNullArguments() {
        assertThatThrownBy(() -> new Decomposer(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Decomposer(new EjmlSingularValueDecompositionBackend(), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> decomposer.decompose(null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static double[][] rankOneSum(Decomposition d, int from, int to) {
        double[][] m = new double[d.getWindowLength()][d.getColumnCount()];
        for (int index = from; index <= to; index++) {
            EigenTriple t = d.triple(index);
            for (int i = 0; i < m.length; i++) {
                for (int j = 0; j < m[i].length; j++) {
                    m[i][j] += t.getSingularValue() * t.left(i) * t.factor(j);
                }
            }
        }
        return m;
    }

    private static void assertMatricesClose(double[][] actual, double[][] expected,
            double tolerance) {
        for (int i = 0; i < expected.length; i++) {
            for (int j = 0; j < expected[i].length; j++) {
                assertThat(actual[i][j]).isCloseTo(expected[i][j], within(tolerance));
            }
        }
    }

    private static double norm(double[] v) {
        double s = 0.0;
        for (double x : v) {
            s += x * x;
        }
        return Math.sqrt(s);
    }
}
