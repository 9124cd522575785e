import com.pascals.compiler.error.LexicalException;
import com.pascals.compiler.text.CharacterReader;
import com.pascals.compiler.text.Position;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CharacterReaderTest {

    @Test
    void advance_tracks_line_and_column() {
        CharacterReader r = new CharacterReader("ab\ncd");
        r.advance();
        r.advance();
        assertEquals(new Position(2, 1, 3), r.position());
        r.advance();
        assertEquals(new Position(3, 2, 1), r.position());
        assertEquals('c', r.current());
        assertEquals('d', r.peek(1));
        assertEquals('\0', r.peek(5));
    }

    @Test
    void current_is_nul_at_end_and_advance_stops() {
        CharacterReader r = new CharacterReader("x");
        r.advance();
        assertTrue(r.eof());
        assertEquals('\0', r.current());
        r.advance();
        assertEquals(1, r.position().index);
    }

    @Test
    void reset_returns_to_saved_position() {
        CharacterReader r = new CharacterReader("hello");
        r.advance();
        Position saved = r.position();
        r.advance();
        r.advance();
        r.reset(saved);
        assertEquals('e', r.current());
        assertThrows(IllegalArgumentException.class, () -> r.reset(new Position(99, 1, 100)));
    }

    @Test
    void seek_recomputes_lines() {
        CharacterReader r = new CharacterReader("a\nb\nc");
        r.seek(4);
        assertEquals(3, r.position().line);
        assertEquals(1, r.position().column);
        r.seek(1);
        assertEquals(new Position(1, 1, 2), r.position());
    }

    @Test
    void expect_consumes_or_throws_with_position() {
        CharacterReader r = new CharacterReader("a\nb");
        r.expect('a');
        r.expect('\n');
        LexicalException e = assertThrows(LexicalException.class, () -> r.expect('x'));
        assertEquals(2, e.getPosition().line);
        assertEquals(1, e.getPosition().column);
        assertEquals(2, e.getOffset());
    }
}
