package infra.output;

import domain.model.FormatResult;
import domain.model.FormatWarning;
import domain.output.ResultWriter;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CSV report writer.
 *
 * <p>CSV has no sheets, so results and warnings go into one file with a leading {@code kind}
 * column ({@code result} / {@code warning}).</p>
 */
public final class CsvResultWriter implements ResultWriter {

    static final String[] HEADER = {"kind", "status_or_code", "file", "statement", "elapsedMs", "message", "detail"};

    @Override
    public void write(Path resultCsv, List<FormatResult> results, List<FormatWarning> warnings) {
        if (resultCsv == null) throw new IllegalArgumentException("resultCsv is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");

        try {
            Path parent = resultCsv.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create resultCsv parent dir: " + resultCsv, e);
        }

        CSVFormat format = CSVFormat.DEFAULT
                .builder()
                .setHeader(HEADER)
                .build();

        try (BufferedWriter out = Files.newBufferedWriter(resultCsv, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(out, format)) {
            for (FormatResult it : results) {
                printer.printRecord("result", it.getStatus(), it.getFile(), it.getStatements(),
                        it.getElapsedMs(), it.getMessage(), nullToEmpty(it.getDetail()));
            }
            for (FormatWarning w : warnings) {
                printer.printRecord("warning", w.getCode().name(), w.getSource(), w.getStatementIndex(),
                        "", w.getMessage(), w.getDetail());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write csv: " + resultCsv, e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
