package io.github.yok.boson.out;

import io.github.yok.boson.core.algebra.BosonicOperator;
import io.github.yok.boson.core.algebra.Term;
import io.github.yok.boson.core.realization.SparseRealization;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.math3.complex.Complex;

/**
 * 演算子パイプラインの結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（label は入力のラベル）。
 * </p>
 *
 * <ul>
 * <li>{@code boson_terms_<label>.csv}（項と係数）</li>
 * <li>{@code boson_matrix_<label>.csv}（行列表現の非零要素。行列化した場合のみ）</li>
 * <li>{@code boson_meta_<label>.csv}（代数、ħ、次元などの補助情報）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "boson";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /**
     * 実行結果を出力します。
     *
     * @param report 実行結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(OperatorReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report は null 不可です");
        }
        if (report.getLabel() == null || report.getLabel().isEmpty()) {
            throw new IllegalArgumentException("label は必須です");
        }
        if (report.getResult() == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }

        try {
            Files.createDirectories(outputDir);

            // 1) 項と係数
            writeTermsCsv(report.getLabel(), report.getResult());

            // 2) 行列要素（非零のみ）
            if (report.hasRealization()) {
                writeMatrixCsv(report.getLabel(), report.getRealization());
            }

            // 3) メタ
            writeMetaCsv(report);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * 項と係数を出力します。
     *
     * @param label ラベルです
     * @param operator 演算子です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeTermsCsv(String label, BosonicOperator operator) throws IOException {
        Path file = outputDir.resolve(buildFileName("terms", label));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("term", "real", "imag").build().print(w)) {

            for (Map.Entry<Term, Complex> e : operator.getTerms().entrySet()) {
                Complex c = e.getValue();
                pr.printRecord(e.getKey(), c.getReal(), c.getImaginary());
            }
        }
    }

    /**
     * 行列表現の非零要素を出力します。
     *
     * @param label ラベルです
     * @param realization 行列表現です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMatrixCsv(String label, SparseRealization realization) throws IOException {
        Path file = outputDir.resolve(buildFileName("matrix", label));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("row", "col", "real", "imag").build().print(w)) {

            for (SparseRealization.MatrixElement el : realization.nonZeroElements()) {
                pr.printRecord(el.getRow(), el.getCol(), el.getValue().getReal(),
                        el.getValue().getImaginary());
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param report 実行結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(OperatorReport report) throws IOException {
        Path file = outputDir.resolve(buildFileName("meta", report.getLabel()));
        BosonicOperator result = report.getResult();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("hbar", report.getHbar());

            if (report.getInput() != null) {
                pr.printRecord("input.algebra", report.getInput().getAlgebra());
                pr.printRecord("input.termCount", report.getInput().termCount());
            }

            pr.printRecord("result.algebra", result.getAlgebra());
            pr.printRecord("result.termCount", result.termCount());
            pr.printRecord("result.manyBodyOrder", result.manyBodyOrder());
            pr.printRecord("result.normalOrdered", result.isNormalOrdered());
            pr.printRecord("result.hermitian", result.isHermitian());

            if (report.hasRealization()) {
                SparseRealization r = report.getRealization();
                pr.printRecord("matrix.truncation", r.getBasis().truncation());
                pr.printRecord("matrix.modeCount", r.getBasis().modeCount());
                pr.printRecord("matrix.dimension", r.dimension());
                pr.printRecord("matrix.nonZeroCount", r.nonZeroCount());
            }
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code boson_terms_number.csv}
     * </p>
     *
     * @param kind 出力の識別子（terms/matrix/meta）
     * @param label ラベルです
     * @return ファイル名です
     */
    static String buildFileName(String kind, String label) {
        return FILE_HEAD + "_" + kind + "_" + label + ".csv";
    }
}
