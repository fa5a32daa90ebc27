package domain.format;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * File-driven cases under {@code src/test/resources/inputs/<case>/}: {@code input.sql} must format to
 * {@code output.sql}, and {@code output.sql} must already be canonical.
 */
class FormattingInOutTest {

    private final SqlFormatter formatter = new SqlFormatter(FallbackPolicy.STRICT, null);

    @ParameterizedTest
    @ValueSource(strings = {
            "single_col",
            "multiple_cols",
            "join",
            "filter_group_order",
            "nested_cte",
            "cte_multiple_with",
            "multiple_statements",
    })
    void input_formats_to_expected_output(String name) throws IOException {
        String input = read(name, "input.sql");
        String expected = read(name, "output.sql");

        assertEquals(expected, formatter.format(input, name));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "single_col",
            "multiple_cols",
            "join",
            "filter_group_order",
            "nested_cte",
            "cte_multiple_with",
            "multiple_statements",
    })
    void expected_output_is_a_fixed_point(String name) throws IOException {
        String expected = read(name, "output.sql");

        assertEquals(expected, formatter.format(expected, name));
    }

    private static String read(String name, String file) throws IOException {
        String path = "/inputs/" + name + "/" + file;
        try (InputStream in = FormattingInOutTest.class.getResourceAsStream(path)) {
            assertNotNull(in, "missing fixture: " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
