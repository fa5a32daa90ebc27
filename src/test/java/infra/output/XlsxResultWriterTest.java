package infra.output;

import domain.model.FormatResult;
import domain.model.FormatWarning;
import domain.model.FormatWarningCode;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class XlsxResultWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void should_write_result_and_warning_sheets() throws Exception {
        Path xlsx = tempDir.resolve("result.xlsx");
        List<FormatResult> results = List.of(
                new FormatResult(FormatResult.UNCHANGED, "a.sql", 1, "", null, 4),
                new FormatResult(FormatResult.SKIP, "empty.sql", "SQL_TEXT_EMPTY"));
        List<FormatWarning> warnings = List.of(
                FormatWarning.of(FormatWarningCode.SQL_TEXT_EMPTY, "empty.sql", "SQL text empty"));

        new XlsxResultWriter().write(xlsx, results, warnings);

        assertTrue(Files.exists(xlsx));
        try (InputStream in = Files.newInputStream(xlsx);
             Workbook wb = new XSSFWorkbook(in)) {
            Sheet result = wb.getSheet("result");
            assertNotNull(result);
            assertEquals(2, result.getLastRowNum());
            assertEquals("status", result.getRow(0).getCell(0).getStringCellValue());
            Row first = result.getRow(1);
            assertEquals("UNCHANGED", first.getCell(0).getStringCellValue());
            assertEquals("a.sql", first.getCell(1).getStringCellValue());
            assertEquals(1.0, first.getCell(2).getNumericCellValue());
            assertEquals("SKIP", result.getRow(2).getCell(0).getStringCellValue());

            Sheet warn = wb.getSheet("warnings");
            assertNotNull(warn);
            assertEquals(1, warn.getLastRowNum());
            assertEquals("SQL_TEXT_EMPTY", warn.getRow(1).getCell(0).getStringCellValue());
            assertEquals("empty.sql", warn.getRow(1).getCell(1).getStringCellValue());
        }
    }
}
