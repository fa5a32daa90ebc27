package domain.format;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlCommentDetectorTest {

    @Test
    void finds_line_and_block_comments() {
        assertTrue(SqlCommentDetector.containsComment("-- business rule\nselect a from t"));
        assertTrue(SqlCommentDetector.containsComment("select a /* col */ from t"));
        assertTrue(SqlCommentDetector.containsComment("select a from t --"));
    }

    @Test
    void ignores_markers_inside_literals_and_quoted_identifiers() {
        assertFalse(SqlCommentDetector.containsComment("select '-- not a comment' from t"));
        assertFalse(SqlCommentDetector.containsComment("select 'it''s /* fine' from t"));
        assertFalse(SqlCommentDetector.containsComment("select \"a--b\" from t"));
        assertFalse(SqlCommentDetector.containsComment("select `x/*y` from t"));
    }

    @Test
    void comment_after_escaped_quote_is_found() {
        assertTrue(SqlCommentDetector.containsComment("select 'it''s' -- note\nfrom t"));
    }

    @Test
    void plain_sql_has_no_comment() {
        assertFalse(SqlCommentDetector.containsComment("select a - 1, b / 2 from t"));
        assertFalse(SqlCommentDetector.containsComment(""));
        assertFalse(SqlCommentDetector.containsComment(null));
    }
}
