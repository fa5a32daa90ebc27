package infra.sql;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlFileScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void should_walk_directory_for_sql_files_sorted() throws Exception {
        Files.createDirectories(tempDir.resolve("b"));
        Files.writeString(tempDir.resolve("b").resolve("two.sql"), "select 2");
        Files.writeString(tempDir.resolve("a.SQL"), "select 1");
        Files.writeString(tempDir.resolve("notes.txt"), "not sql");

        List<Path> files = new SqlFileScanner().scan(tempDir);

        assertEquals(2, files.size());
        assertTrue(files.get(0).endsWith("a.SQL"), files.toString());
        assertTrue(files.get(1).endsWith(Path.of("b", "two.sql")), files.toString());
    }

    @Test
    void should_return_single_file_as_is() throws Exception {
        Path f = tempDir.resolve("query.txt");
        Files.writeString(f, "select 1");

        List<Path> files = new SqlFileScanner().scan(f);

        assertEquals(List.of(f.toAbsolutePath().normalize()), files);
    }

    @Test
    void should_skip_output_dir_below_input() throws Exception {
        Path out = tempDir.resolve("output").resolve("formatted");
        Files.createDirectories(out);
        Files.writeString(tempDir.resolve("q.sql"), "select 1");
        Files.writeString(out.resolve("q.sql"), "SELECT 1\n;\n");

        List<Path> files = new SqlFileScanner().scan(tempDir, out);

        assertEquals(List.of(tempDir.resolve("q.sql").toAbsolutePath().normalize()), files);
    }

    @Test
    void should_ignore_exclude_dir_outside_input_or_equal_to_it() throws Exception {
        Path in = tempDir.resolve("in");
        Files.createDirectories(in);
        Files.writeString(in.resolve("q.sql"), "select 1");

        assertEquals(1, new SqlFileScanner().scan(in, tempDir.resolve("out")).size());
        assertEquals(1, new SqlFileScanner().scan(in, in).size());
    }

    @Test
    void should_reject_missing_input() {
        assertThrows(IllegalArgumentException.class, () -> new SqlFileScanner().scan(tempDir.resolve("missing")));
    }
}
