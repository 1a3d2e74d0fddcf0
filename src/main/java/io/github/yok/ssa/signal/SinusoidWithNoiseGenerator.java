package io.github.yok.ssa.signal;

import static com.google.common.base.Preconditions.checkArgument;

import io.github.yok.ssa.core.series.TimeSeries;
import java.util.Random;
import lombok.Getter;

/**
 * 線形トレンド + 正弦波 + 正規ノイズの合成時系列を生成するクラスです。
 *
 * <p>
 * {@code x[t] = slope·t + amplitude·sin(2πt/period) + ε_t}（t = 1..periods·period、ε_t ~ N(0, noiseSd²)）です。
 * 同じシードからは同じ系列が得られます。
 * </p>
 */
@Getter
public final class SinusoidWithNoiseGenerator implements SignalGenerator {

    /**
     * 周期（サンプル数）です。
     */
    private final int period;

    /**
     * 周期の繰り返し回数です。
     */
    private final int periods;

    /**
     * 振幅です。
     */
    private final double amplitude;

    /**
     * 線形トレンドの傾き（1 サンプルあたり）です。
     */
    private final double trendSlope;

    /**
     * ノイズの標準偏差です。
     */
    private final double noiseSd;

    /**
     * 乱数のシードです。
     */
    private final long seed;

    /**
     * 生成器を作成します。
     *
     * @param period 周期です（2 以上）
     * @param periods 周期の繰り返し回数です（1 以上）
     * @param amplitude 振幅です（有限値）
     * @param trendSlope トレンドの傾きです（有限値）
     * @param noiseSd ノイズの標準偏差です（0 以上）
     * @param seed 乱数のシードです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public SinusoidWithNoiseGenerator(int period, int periods, double amplitude, double trendSlope,
            double noiseSd, long seed) {
        checkArgument(period >= 2, "period は 2 以上が必要です: %s", period);
        checkArgument(periods >= 1, "periods は 1 以上が必要です: %s", periods);
        checkArgument(Double.isFinite(amplitude), "amplitude は有限値が必要です: %s", amplitude);
        checkArgument(Double.isFinite(trendSlope), "trendSlope は有限値が必要です: %s", trendSlope);
        checkArgument(noiseSd >= 0.0 && Double.isFinite(noiseSd), "noiseSd は 0 以上が必要です: %s",
                noiseSd);
        checkArgument((long) period * periods <= Integer.MAX_VALUE, "系列長が大きすぎます: %s x %s", period,
                periods);
        this.period = period;
        this.periods = periods;
        this.amplitude = amplitude;
        this.trendSlope = trendSlope;
        this.noiseSd = noiseSd;
        this.seed = seed;
    }

    /**
     * 合成時系列を生成します。
     *
     * <p>
     * 呼び出しごとにシードから乱数源を作り直すため、何度呼んでも同じ系列を返します。
     * </p>
     *
     * @return 長さ periods·period の時系列です
     */
    @Override
    public TimeSeries generate() {
        Random random = new Random(seed);
        int n = period * periods;
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            int t = i + 1;
            double noise = noiseSd > 0.0 ? noiseSd * random.nextGaussian() : 0.0;
            x[i] = trendSlope * t + amplitude * Math.sin(2.0 * Math.PI * t / period) + noise;
        }
        return TimeSeries.of(x);
    }
}
