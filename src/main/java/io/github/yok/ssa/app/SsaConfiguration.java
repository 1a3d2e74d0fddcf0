package io.github.yok.ssa.app;

import io.github.yok.ssa.core.SsaAnalyzer;
import io.github.yok.ssa.core.decomposition.Decomposer;
import io.github.yok.ssa.core.embedding.Embedder;
import io.github.yok.ssa.core.grouping.Grouper;
import io.github.yok.ssa.core.linearalgebra.EjmlSingularValueDecompositionBackend;
import io.github.yok.ssa.core.linearalgebra.SingularValueDecompositionBackend;
import io.github.yok.ssa.core.reconstruction.Reconstructor;
import io.github.yok.ssa.out.CsvResultWriter;
import io.github.yok.ssa.out.ResultWriter;
import io.github.yok.ssa.signal.SignalGenerator;
import io.github.yok.ssa.signal.SinusoidWithNoiseGenerator;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * SSA の各段（埋め込み・分解・グループ化・再構成）と入出力の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class SsaConfiguration {

    /**
     * ssa-decomposer の設定値（ssa.*）です。
     */
    private final SsaProperties p;

    /**
     * 特異値分解バックエンドを生成します。
     *
     * @return 特異値分解バックエンドです
     */
    @Bean
    public SingularValueDecompositionBackend singularValueDecompositionBackend() {
        return new EjmlSingularValueDecompositionBackend();
    }

    /**
     * SSA 解析器を生成します。
     *
     * @param svdBackend 特異値分解バックエンドです
     * @return 解析器です
     */
    @Bean
    public SsaAnalyzer ssaAnalyzer(SingularValueDecompositionBackend svdBackend) {
        return new SsaAnalyzer(new Embedder(), new Decomposer(svdBackend), new Grouper(),
                new Reconstructor());
    }

    /**
     * 合成信号の生成器を生成します。
     *
     * @return 生成器です
     */
    @Bean
    public SignalGenerator signalGenerator() {
        SsaProperties.Signal s = p.getSignal();
        return new SinusoidWithNoiseGenerator(s.getPeriod(), s.getPeriods(), s.getAmplitude(),
                s.getTrendSlope(), s.getNoiseSd(), s.getSeed());
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
