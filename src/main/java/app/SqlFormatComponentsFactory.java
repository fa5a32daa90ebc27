package app;

import cli.CliPathResolver;
import domain.format.FallbackPolicy;
import domain.format.SqlFormatter;
import domain.model.FormatWarningSink;
import domain.output.ResultWriter;
import domain.output.SqlOutputWriter;
import infra.output.CsvResultWriter;
import infra.output.FileSqlOutputWriter;
import infra.output.NullResultWriter;
import infra.output.NullSqlOutputWriter;
import infra.output.XlsxResultWriter;
import infra.sql.SqlFileScanner;

import java.nio.file.Path;

/**
 * Object-assembly factory for {@link SqlFormatCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration/logging; object creation lives here.
 */
final class SqlFormatComponentsFactory {

    SqlFormatter createFormatter(FallbackPolicy policy, FormatWarningSink warningSink) {
        return new SqlFormatter(policy, warningSink);
    }

    SqlFileScanner createScanner() {
        return new SqlFileScanner();
    }

    SqlOutputWriter createSqlOutputWriter(boolean enable) {
        if (!enable) return new NullSqlOutputWriter();
        return new FileSqlOutputWriter();
    }

    /** Report format follows the file extension: {@code .xlsx} via POI, anything else as CSV. */
    ResultWriter createResultWriter(boolean enable, Path resultFile) {
        if (!enable || resultFile == null) return new NullResultWriter();
        return CliPathResolver.isXlsx(resultFile) ? new XlsxResultWriter() : new CsvResultWriter();
    }
}
