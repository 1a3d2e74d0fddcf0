package io.github.yok.ssa.out;

import io.github.yok.ssa.core.decomposition.Decomposition;
import io.github.yok.ssa.core.series.TimeSeries;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 解析結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（N は時系列長、L は窓長）。
 * </p>
 *
 * <ul>
 * <li>{@code ssa_singularValues_N=1300_L=260.csv}（特異値と寄与率）</li>
 * <li>{@code ssa_reconstruction_N=1300_L=260.csv}（元系列とグループごとの再構成系列）</li>
 * <li>{@code ssa_meta_N=1300_L=260.csv}（N, L, K, d などの補助情報）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "ssa";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException outputDir が空の場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 元の時系列・分解結果・再構成系列を出力します。
     *
     * @param series 元の時系列です
     * @param decomposition 分解結果です
     * @param reconstructions グループ名 → 再構成系列です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(TimeSeries series, Decomposition decomposition,
            Map<String, TimeSeries> reconstructions) {

        if (series == null) {
            throw new IllegalArgumentException("series は null 不可です");
        }
        if (decomposition == null) {
            throw new IllegalArgumentException("decomposition は null 不可です");
        }
        if (reconstructions == null) {
            throw new IllegalArgumentException("reconstructions は null 不可です");
        }
        if (series.length() != decomposition.getSeriesLength()) {
            throw new IllegalArgumentException("series と decomposition の長さが一致しません: "
                    + series.length() + " vs " + decomposition.getSeriesLength());
        }
        for (Map.Entry<String, TimeSeries> e : reconstructions.entrySet()) {
            if (e.getValue() == null || e.getValue().length() != series.length()) {
                throw new IllegalArgumentException("再構成系列の長さが N と一致しません: group=" + e.getKey());
            }
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 特異値・寄与率
            writeSingularValuesCsv(decomposition);

            // 2) 再構成系列
            writeReconstructionCsv(series, decomposition, reconstructions);

            // 3) メタ
            writeMetaCsv(decomposition, reconstructions);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 特異値と寄与率を出力します。
     *
     * @param decomposition 分解結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeSingularValuesCsv(Decomposition decomposition) throws IOException {
        Path file = outputDir.resolve(buildFileName("singularValues", decomposition));

        double[] sigma = decomposition.singularValues();
        double[] contribution = decomposition.contributions();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("index", "singularValue", "contribution").build().print(w)) {

            for (int i = 0; i < sigma.length; i++) {
                pr.printRecord(i + 1, sigma[i], contribution[i]);
            }
        }
    }

    /**
     * 元系列とグループごとの再構成系列を列として並べて出力します。
     *
     * @param series 元の時系列です
     * @param decomposition 分解結果です
     * @param reconstructions グループ名 → 再構成系列です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeReconstructionCsv(TimeSeries series, Decomposition decomposition,
            Map<String, TimeSeries> reconstructions) throws IOException {
        Path file = outputDir.resolve(buildFileName("reconstruction", decomposition));

        List<String> header = new ArrayList<>();
        header.add("t");
        header.add("original");
        List<TimeSeries> columns = new ArrayList<>();
        reconstructions.forEach((name, s) -> {
            header.add(name);
            columns.add(s);
        });

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader(header.toArray(new String[0])).build().print(w)) {

            List<Object> record = new ArrayList<>(header.size());
            for (int t = 0; t < series.length(); t++) {
                record.clear();
                record.add(t + 1);
                record.add(series.get(t));
                for (TimeSeries s : columns) {
                    record.add(s.get(t));
                }
                pr.printRecord(record);
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param decomposition 分解結果です
     * @param reconstructions グループ名 → 再構成系列です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(Decomposition decomposition, Map<String, TimeSeries> reconstructions)
            throws IOException {
        Path file = outputDir.resolve(buildFileName("meta", decomposition));

        double contributionTotal = 0.0;
        for (double c : decomposition.contributions()) {
            contributionTotal += c;
        }

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("N", decomposition.getSeriesLength());
            pr.printRecord("L", decomposition.getWindowLength());
            pr.printRecord("K", decomposition.getColumnCount());
            pr.printRecord("d", decomposition.size());
            pr.printRecord("truncated", decomposition.isTruncated());
            pr.printRecord("trajectoryNormSquared", decomposition.getTrajectoryNormSquared());
            pr.printRecord("contributionTotal", contributionTotal);
            pr.printRecord("groups", String.join(";", reconstructions.keySet()));
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code ssa_reconstruction_N=1300_L=260.csv}
     * </p>
     *
     * @param kind 出力の識別子（singularValues/reconstruction/meta）
     * @param decomposition 分解結果です
     * @return ファイル名です
     */
    static String buildFileName(String kind, Decomposition decomposition) {
        return FILE_HEAD + "_" + kind + "_N=" + decomposition.getSeriesLength() + "_L="
                + decomposition.getWindowLength() + ".csv";
    }
}
