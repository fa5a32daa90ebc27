package infra.sql;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Collects the {@code .sql} files to format.
 *
 * <p>The input is either a single file (returned as is, whatever its extension) or a directory,
 * walked recursively for {@code *.sql}. Results are sorted by path so runs are reproducible.</p>
 *
 * <p>An output directory below the input directory is skipped, so earlier runs' copies are not
 * picked up as input.</p>
 */
public final class SqlFileScanner {

    private static final String SQL_SUFFIX = ".sql";

    public List<Path> scan(Path input) {
        return scan(input, null);
    }

    /**
     * @param excludeDir directory whose files are left out, typically the output directory when it
     *                   lives below the input; ignored when null or when it is the input itself
     */
    public List<Path> scan(Path input, Path excludeDir) {
        if (input == null) throw new IllegalArgumentException("input is null");
        Path root = input.toAbsolutePath()
                .normalize();
        if (!Files.exists(root)) throw new IllegalArgumentException("input not found: " + root);

        if (Files.isRegularFile(root)) return List.of(root);

        Path excluded = (excludeDir == null) ? null : excludeDir.toAbsolutePath()
                .normalize();
        if (excluded != null && (excluded.equals(root) || !excluded.startsWith(root))) excluded = null;
        Path skip = excluded;

        List<Path> out = new ArrayList<>(256);
        try (Stream<Path> s = Files.walk(root)) {
            s.filter(Files::isRegularFile)
                    .filter(p -> skip == null || !p.startsWith(skip))
                    .filter(p -> p.getFileName()
                            .toString()
                            .toLowerCase(Locale.ROOT)
                            .endsWith(SQL_SUFFIX))
                    .forEach(out::add);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to scan sql files under: " + root, e);
        }
        out.sort(Comparator.comparing(Path::toString));
        return out;
    }
}
