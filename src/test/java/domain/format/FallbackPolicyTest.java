package domain.format;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FallbackPolicyTest {

    @Test
    void blank_means_lenient() {
        assertEquals(FallbackPolicy.LENIENT, FallbackPolicy.parse(null));
        assertEquals(FallbackPolicy.LENIENT, FallbackPolicy.parse("  "));
    }

    @Test
    void names_are_case_insensitive() {
        assertEquals(FallbackPolicy.STRICT, FallbackPolicy.parse("STRICT"));
        assertEquals(FallbackPolicy.STRICT, FallbackPolicy.parse(" fail "));
        assertEquals(FallbackPolicy.LENIENT, FallbackPolicy.parse("Verbatim"));
    }

    @Test
    void unknown_name_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> FallbackPolicy.parse("sometimes"));
    }
}
