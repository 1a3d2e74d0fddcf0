package io.github.yok.ssa.core.decomposition;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.yok.ssa.core.cancel.CancellationSignal;
import io.github.yok.ssa.core.embedding.TrajectoryMatrix;
import io.github.yok.ssa.core.error.InvalidWindowLengthException;
import io.github.yok.ssa.core.error.NumericFailureException;
import io.github.yok.ssa.core.linearalgebra.SingularValueDecompositionBackend;
import io.github.yok.ssa.core.linearalgebra.SingularValueDecompositionBackend.SingularValueDecompositionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * 軌道行列を特異値分解し、降順に並んだ固有三つ組の列（{@link Decomposition}）を生成するクラスです。
 *
 * <p>
 * 数値的な分解そのものは {@link SingularValueDecompositionBackend} に委譲し、ここでは形状の検証・並び順・切り詰めのみを扱います。
 * 保持する成分数はバックエンドに渡すため、切り詰めた分の計算は省かれます。
 * </p>
 *
 * <p>
 * 打ち切り通知が指定された場合、バックエンドの呼び出しは別スレッドで実行し、待機中も通知を一定間隔で確認します。
 * 打ち切られた時点で呼び出し元には {@link CancellationException} を返します。 EJML の計算自体は割り込みに応じないため、
 * 放棄した計算はワーカースレッド（デーモン）上で最後まで進み、その結果は破棄されます。
 * </p>
 */
@Slf4j
public final class Decomposer {

    /**
     * 特異値分解バックエンドです。
     */
    private final SingularValueDecompositionBackend svdBackend;

    /**
     * 打ち切り可能な分解を実行するスレッドプールです。
     */
    private final ExecutorService factorizationExecutor;

    /**
     * 打ち切り通知を確認する間隔（ミリ秒）です。
     */
    private static final long CANCELLATION_POLL_MILLIS = 20L;

    /**
     * 既定のスレッドプール（デーモンスレッド）です。
     */
    private static final ExecutorService DEFAULT_EXECUTOR = Executors.newCachedThreadPool(
            new ThreadFactoryBuilder().setNameFormat("ssa-factorization-%d").setDaemon(true)
                    .build());

    /**
     * 既定のスレッドプールを使う分解器を生成します。
     *
     * @param svdBackend 特異値分解バックエンドです（null 不可）
     * @throws IllegalArgumentException svdBackend が null の場合に発生します
     */
    public Decomposer(SingularValueDecompositionBackend svdBackend) {
        this(svdBackend, DEFAULT_EXECUTOR);
    }

    /**
     * 分解器を生成します。
     *
     * @param svdBackend 特異値分解バックエンドです（null 不可）
     * @param factorizationExecutor 打ち切り可能な分解を実行するスレッドプールです（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public Decomposer(SingularValueDecompositionBackend svdBackend,
            ExecutorService factorizationExecutor) {
        if (svdBackend == null) {
            throw new IllegalArgumentException("svdBackend は null 不可です");
        }
        if (factorizationExecutor == null) {
            throw new IllegalArgumentException("factorizationExecutor は null 不可です");
        }
        this.svdBackend = svdBackend;
        this.factorizationExecutor = factorizationExecutor;
    }

    /**
     * 軌道行列を分解します（打ち切りなし）。
     *
     * @param trajectory 軌道行列です
     * @param truncateTo 保持する上位成分数です（null の場合は全成分）
     * @return 分解結果です
     */
    public Decomposition decompose(TrajectoryMatrix trajectory, Integer truncateTo) {
        return decompose(trajectory, truncateTo, CancellationSignal.none());
    }

    /**
     * 軌道行列を分解します。
     *
     * @param trajectory 軌道行列です
     * @param truncateTo 保持する上位成分数です（null の場合は全成分、d を超える値は d に丸めます）
     * @param cancellation 打ち切り通知です
     * @return 分解結果です
     * @throws IllegalArgumentException trajectory が null、または truncateTo が 1 未満の場合に発生します
     * @throws InvalidWindowLengthException 軌道行列の形状が縮退している場合に発生します
     * @throws io.github.yok.ssa.core.error.NumericFailureException 特異値分解に失敗した場合に発生します
     * @throws java.util.concurrent.CancellationException 打ち切りが要求された場合に発生します
     */
    public Decomposition decompose(TrajectoryMatrix trajectory, Integer truncateTo,
            CancellationSignal cancellation) {
        if (trajectory == null) {
            throw new IllegalArgumentException("trajectory は null 不可です");
        }
        if (cancellation == null) {
            throw new IllegalArgumentException("cancellation は null 不可です");
        }

        int l = trajectory.getRows();
        int k = trajectory.getColumns();
        int n = trajectory.seriesLength();
        if (l < 1 || k < 1) {
            throw new InvalidWindowLengthException(l, n,
                    "軌道行列の形状が縮退しています: L=" + l + ", K=" + k);
        }
        if (truncateTo != null && truncateTo < 1) {
            throw new IllegalArgumentException("truncateTo は 1 以上を指定してください: " + truncateTo);
        }

        int fullRank = Math.min(l, k);
        int d = fullRank;
        if (truncateTo != null) {
            if (truncateTo > fullRank) {
                log.warn("truncateTo が成分数を超えているため全成分を保持します。truncateTo={}、d={}", truncateTo,
                        fullRank);
            } else {
                d = truncateTo;
            }
        }

        cancellation.throwIfCancelled("特異値分解の前");

        long t0 = System.nanoTime();
        log.info("特異値分解を開始します。N={}、L={}、K={}、保持成分数={}", n, l, k, d);

        // 1) 軌道行列を実体化
        DMatrixRMaj x = trajectory.toMatrix();

        // 2) 特異値分解（降順、上位 d 成分）
        SingularValueDecompositionResult svd = factorize(x, d, cancellation);

        cancellation.throwIfCancelled("特異値分解の後");

        // 3) 上位 d 成分を固有三つ組へ詰め替え
        List<EigenTriple> triples = toTriples(svd, l, k, d);

        double normSquared = trajectory.frobeniusNormSquared();
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;

        log.info("特異値分解が完了しました。所要時間={}ms、σ1={}、σd={}", elapsedMs,
                fmt5(triples.get(0).getSingularValue()),
                fmt5(triples.get(triples.size() - 1).getSingularValue()));

        return new Decomposition(n, l, normSquared, d < fullRank, triples);
    }

    /**
     * バックエンドで上位 d 成分を求めます。
     *
     * <p>
     * 打ち切り通知が {@link CancellationSignal#none()} の場合は呼び出し元のスレッドで直接実行します。 それ以外はスレッドプールで実行し、
     * 完了を待つ間も通知を確認して、打ち切りが要求されればすぐに戻ります。
     * </p>
     *
     * @param x 軌道行列です
     * @param d 保持する成分数です
     * @param cancellation 打ち切り通知です
     * @return 特異値降順の分解結果です
     * @throws CancellationException 待機中に打ち切りが要求された、または割り込まれた場合に発生します
     */
    private SingularValueDecompositionResult factorize(DMatrixRMaj x, int d,
            CancellationSignal cancellation) {
        if (cancellation == CancellationSignal.none()) {
            return svdBackend.decomposeAndSortDescending(x, d);
        }

        Future<SingularValueDecompositionResult> future =
                factorizationExecutor.submit(() -> svdBackend.decomposeAndSortDescending(x, d));
        try {
            while (true) {
                try {
                    return future.get(CANCELLATION_POLL_MILLIS, TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    if (cancellation.isCancelled()) {
                        future.cancel(true);
                        log.warn("特異値分解の完了を待たずに打ち切りました。保持成分数={}", d);
                        throw new CancellationException("処理が打ち切られました: 特異値分解の途中");
                    }
                }
            }
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("特異値分解の待機中に割り込まれました");
            cancelled.initCause(e);
            throw cancelled;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new NumericFailureException("特異値分解が異常終了しました", cause);
        }
    }

    /**
     * 分解結果の上位 d 成分を固有三つ組の列に変換します。
     *
     * @param svd 降順の分解結果です
     * @param l 行数 L です
     * @param k 列数 K です
     * @param d 保持する成分数です
     * @return 固有三つ組の列です
     * @throws IllegalStateException バックエンドの結果の形状が期待と異なる場合に発生します
     */
    private static List<EigenTriple> toTriples(SingularValueDecompositionResult svd, int l, int k,
            int d) {
        double[] values = svd.getSingularValues();
        DMatrixRMaj u = svd.getLeftVectors();
        DMatrixRMaj v = svd.getRightVectors();

        if (values.length < d || u.numRows != l || v.numRows != k || u.numCols < d
                || v.numCols < d) {
            throw new IllegalStateException("特異値分解の結果の形状が不正です: values=" + values.length + ", U="
                    + u.numRows + "x" + u.numCols + ", V=" + v.numRows + "x" + v.numCols);
        }

        List<EigenTriple> triples = new ArrayList<>(d);
        for (int c = 0; c < d; c++) {
            double[] left = new double[l];
            for (int i = 0; i < l; i++) {
                left[i] = u.get(i, c);
            }
            double[] factor = new double[k];
            for (int j = 0; j < k; j++) {
                factor[j] = v.get(j, c);
            }
            triples.add(new EigenTriple(c + 1, values[c], left, factor));
        }
        return triples;
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
