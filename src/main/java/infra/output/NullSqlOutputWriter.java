package infra.output;

import domain.output.SqlOutputWriter;

import java.nio.file.Path;

/**
 * No-op implementation (check mode).
 */
public final class NullSqlOutputWriter implements SqlOutputWriter {
    @Override
    public void write(Path target, String sqlText) {
        // intentionally no-op
    }
}
