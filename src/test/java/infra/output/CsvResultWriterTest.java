package infra.output;

import domain.model.FormatResult;
import domain.model.FormatWarning;
import domain.model.FormatWarningCode;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvResultWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_write_results_then_warnings_with_kind_column() throws Exception {
        Path csv = tempDir.resolve("reports").resolve("result.csv");
        List<FormatResult> results = List.of(
                new FormatResult(FormatResult.FORMATTED, "a.sql", 2, "", null, 12),
                new FormatResult(FormatResult.FAILED, "b.sql", 0, "MalformedSqlException", "Invalid SQL syntax, near \"where\"", 3));
        List<FormatWarning> warnings = List.of(
                new FormatWarning(FormatWarningCode.UNSUPPORTED_STATEMENT_FALLBACK, "a.sql", 2, "rendered verbatim: INSERT", ""));

        new CsvResultWriter().write(csv, results, warnings);

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .build();
        try (Reader in = Files.newBufferedReader(csv, StandardCharsets.UTF_8);
             CSVParser parser = format.parse(in)) {
            assertEquals(List.of(CsvResultWriter.HEADER), parser.getHeaderNames());

            List<CSVRecord> rows = parser.getRecords();
            assertEquals(3, rows.size());
            assertEquals("result", rows.get(0).get("kind"));
            assertEquals("FORMATTED", rows.get(0).get("status_or_code"));
            assertEquals("2", rows.get(0).get("statement"));
            assertEquals("Invalid SQL syntax, near \"where\"", rows.get(1).get("detail"));
            assertEquals("warning", rows.get(2).get("kind"));
            assertEquals("UNSUPPORTED_STATEMENT_FALLBACK", rows.get(2).get("status_or_code"));
        }
    }

    @Test
    void should_reject_missing_arguments() {
        CsvResultWriter w = new CsvResultWriter();

        assertThrows(IllegalArgumentException.class, () -> w.write(null, List.of(), List.of()));
        assertThrows(IllegalArgumentException.class, () -> w.write(tempDir.resolve("x.csv"), null, List.of()));
    }
}
