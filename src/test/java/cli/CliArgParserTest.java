package cli;

import domain.format.FallbackPolicy;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    @Test
    void should_parse_key_value_separated_and_bare_flags() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{
                "--in=sql", "--out", "formatted", "--check", "ignored", "--policy=strict"});

        assertEquals("sql", m.get("in"));
        assertEquals("formatted", m.get("out"));
        assertEquals("ignored", m.get("check"));
        assertEquals("strict", m.get("policy"));
    }

    @Test
    void flag_is_true_when_present_without_value() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--inPlace", "--failFast=false"});

        assertTrue(CliArgParser.flag(m, "inPlace"));
        assertFalse(CliArgParser.flag(m, "failFast"));
        assertFalse(CliArgParser.flag(m, "check"));
    }

    @Test
    void numbers_fall_back_to_default() {
        assertEquals(100, CliArgParser.parseInt("abc", 100));
        assertEquals(7, CliArgParser.parseInt(" 7 ", 100));
        assertEquals(500L, CliArgParser.parseLong(null, 500L));
    }

    @Test
    void policy_argument_wins_over_default() {
        assertEquals(FallbackPolicy.STRICT, CliArgParser.parsePolicy(Map.of("policy", "strict")));
        assertThrows(IllegalArgumentException.class, () -> CliArgParser.parsePolicy(Map.of("policy", "maybe")));
    }
}
