package io.github.yok.ssa.app;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * ssa-decomposer の設定値（ssa.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "ssa")
public class SsaProperties {

    /**
     * 埋め込み設定です。
     */
    @Valid
    private Embedding embedding = new Embedding();

    /**
     * 分解設定です。
     */
    @Valid
    private DecompositionSettings decomposition = new DecompositionSettings();

    /**
     * グループ分け設定です。
     */
    @Valid
    private GroupingSettings grouping = new GroupingSettings();

    /**
     * 合成信号の設定です。
     */
    @Valid
    private Signal signal = new Signal();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "ssa")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Embedding e = getEmbedding();
        DecompositionSettings d = getDecomposition();
        GroupingSettings g = getGrouping();
        Signal s = getSignal();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "embedding",
                // windowLength: 窓長 L（既定値なし）
                "windowLength", e.getWindowLength());

        appendSection(sb, nl, "decomposition",
                // truncateTo: 保持する上位成分数（未指定なら全成分）
                "truncateTo", d.getTruncateTo(),
                // timeout: 分解の時間予算（未指定なら無制限）
                "timeout", d.getTimeout());

        appendSection(sb, nl, "grouping",
                // groups: グループ名 → 固有三つ組インデックス（1 始まり）
                "groups", g.getGroups());

        appendSection(sb, nl, "signal",
                // period: 周期（サンプル数）
                "period", s.getPeriod(),
                // periods: 周期の繰り返し回数
                "periods", s.getPeriods(),
                // amplitude: 振幅
                "amplitude", s.getAmplitude(),
                // trendSlope: 線形トレンドの傾き
                "trendSlope", s.getTrendSlope(),
                // noiseSd: ノイズの標準偏差
                "noiseSd", s.getNoiseSd(),
                // seed: 乱数シード
                "seed", s.getSeed());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Embedding {

        /**
         * 窓長 L です。
         *
         * <p>
         * 自動決定は行わないため必須です（2 以上 N-1 以下）。
         * </p>
         */
        @NotNull
        @Min(2)
        private Integer windowLength;
    }

    @Data
    public static class DecompositionSettings {

        /**
         * 保持する上位成分数です（未指定なら全成分）。
         */
        @Min(1)
        private Integer truncateTo;

        /**
         * 分解の時間予算です（未指定なら無制限）。
         */
        private Duration timeout;
    }

    @Data
    public static class GroupingSettings {

        /**
         * グループ名 → 固有三つ組インデックス（1 始まり）の一覧です。
         *
         * <p>
         * 残差グループは自動では作らないため、必要なら残りのインデックスを列挙してください。
         * </p>
         */
        @NotEmpty
        private Map<String, List<Integer>> groups = new LinkedHashMap<>();
    }

    @Data
    public static class Signal {

        /**
         * 周期（サンプル数）です。
         */
        @Min(2)
        private int period = 260;

        /**
         * 周期の繰り返し回数です。
         */
        @Min(1)
        private int periods = 5;

        /**
         * 振幅です。
         */
        private double amplitude = 1.0;

        /**
         * 線形トレンドの傾き（1 サンプルあたり）です。
         */
        private double trendSlope = 0.0;

        /**
         * ノイズの標準偏差です。
         */
        @PositiveOrZero
        private double noiseSd = 0.5;

        /**
         * 乱数シードです。
         */
        private long seed = 12345L;
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
