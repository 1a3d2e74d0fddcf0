package io.github.yok.ssa.app;

import io.github.yok.ssa.core.SsaAnalyzer;
import io.github.yok.ssa.core.cancel.CancellationSignal;
import io.github.yok.ssa.core.decomposition.Decomposition;
import io.github.yok.ssa.core.series.TimeSeries;
import io.github.yok.ssa.out.ResultWriter;
import io.github.yok.ssa.signal.SignalGenerator;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で ssa-decomposer を実行するクラスです。
 *
 * <p>
 * 合成信号を生成し、窓長 L で分解し、指定されたグループごとに再構成して出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class SsaCliRunner implements CommandLineRunner {

    /**
     * 要約に表示する先頭特異値の個数です。
     */
    private static final int LEADING_VALUES = 10;

    /**
     * ssa-decomposer の設定値（ssa.*）です。
     */
    private final SsaProperties properties;

    /**
     * 合成信号の生成器です。
     */
    private final SignalGenerator signalGenerator;

    /**
     * SSA 解析器です。
     */
    private final SsaAnalyzer analyzer;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== ssa-decomposer start: decompose and reconstruct ===");
        System.out.print(properties.toMultilineString());

        Integer windowLength = properties.getEmbedding().getWindowLength();
        if (windowLength == null) {
            throw new IllegalStateException("embedding.windowLength は必須です（自動決定は行いません）");
        }
        Map<String, List<Integer>> groups = properties.getGrouping().getGroups();
        if (groups == null || groups.isEmpty()) {
            throw new IllegalStateException("grouping.groups は必須です（グループ名とインデックスを指定してください）");
        }

        // timeout 未指定なら打ち切りなし
        Duration timeout = properties.getDecomposition().getTimeout();
        CancellationSignal cancellation =
                (timeout != null) ? CancellationSignal.deadline(timeout) : CancellationSignal.none();

        TimeSeries series = signalGenerator.generate();
        System.out.println("入力: N=" + series.length() + ", L=" + windowLength + ", truncateTo="
                + properties.getDecomposition().getTruncateTo());

        Decomposition decomposition = analyzer.decompose(series, windowLength,
                properties.getDecomposition().getTruncateTo(), cancellation);

        System.out.println("=== 特異値（先頭" + Math.min(LEADING_VALUES, decomposition.size()) + "件） ===");
        double[] sigma = analyzer.singularValues(decomposition);
        double[] contribution = decomposition.contributions();
        for (int i = 0; i < Math.min(LEADING_VALUES, sigma.length); i++) {
            System.out.println("  " + (i + 1) + ": σ=" + fmt5(sigma[i]) + ", 寄与率="
                    + fmt5(contribution[i]));
        }

        Map<String, TimeSeries> reconstructions =
                analyzer.reconstruct(decomposition, groups, cancellation);

        resultWriter.write(series, decomposition, reconstructions);

        System.out.println("=== 再構成 ===");
        reconstructions.forEach((name, rec) -> System.out.println("結果: group=" + name
                + ", indices=" + groups.get(name) + ", RMS(入力との差)=" + fmt5(rmsDifference(series, rec))));
    }

    /**
     * 2 系列の差の二乗平均平方根を返します。
     *
     * @param a 系列です
     * @param b 系列です（a と同じ長さ）
     * @return RMS です
     */
    static double rmsDifference(TimeSeries a, TimeSeries b) {
        double sum = 0.0;
        for (int t = 0; t < a.length(); t++) {
            double d = a.get(t) - b.get(t);
            sum += d * d;
        }
        return Math.sqrt(sum / a.length());
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
