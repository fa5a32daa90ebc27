package infra.output;

import domain.output.SqlOutputWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link SqlOutputWriter} that stores formatted SQL into files (UTF-8).
 * <p>
 * Parent directories are created on demand. Writing to the input path itself is how
 * {@code --inPlace} works.
 */
public final class FileSqlOutputWriter implements SqlOutputWriter {

    @Override
    public void write(Path target, String sqlText) {
        if (target == null) throw new IllegalArgumentException("target is null");

        Path parent = target.toAbsolutePath()
                .normalize()
                .getParent();
        try {
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + parent, e);
        }

        try {
            Files.writeString(target, sqlText == null ? "" : sqlText, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write sql: " + target, e);
        }
    }
}
