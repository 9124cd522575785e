import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pascals.compiler.PascalsCli;
import com.pascals.debug.Debug;
import com.pascals.debug.DebugSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PascalsCliTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    @AfterEach
    void resetDebug() {
        Debug.get().setSink(null);
    }

    private int run(String... args) {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return PascalsCli.run(args, out, err);
    }

    private String out() { return outBytes.toString(StandardCharsets.UTF_8); }
    private String err() { return errBytes.toString(StandardCharsets.UTF_8); }

    private Path write(String name, String content) throws IOException {
        Path p = dir.resolve(name);
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void analyzes_program_and_reports_summary() throws IOException {
        Path src = write("students.pas", Fixtures.program("students.pas"));
        assertEquals(0, run(src.toString()));
        assertTrue(out().startsWith("OK: program 'Comprehensive', "), out());
        assertTrue(out().contains(" symbols"));
        assertEquals("", err());
    }

    @Test
    void tokens_mode_prints_json_array() throws IOException {
        Path src = write("t.pas", "program p; mulai selesai.");
        assertEquals(0, run("--tokens", src.toString()));
        JsonNode tokens = new ObjectMapper().readTree(out());
        assertTrue(tokens.isArray());
        assertEquals("KEYWORD", tokens.get(0).get("kind").asText());
    }

    @Test
    void ast_mode_skips_analysis() throws IOException {
        Path src = write("t.pas", "program p; mulai y := 1 selesai.");
        assertEquals(0, run(src.toString(), "--ast"));
        assertEquals("Program", new ObjectMapper().readTree(out()).get("type").asText());
    }

    @Test
    void symbols_and_decorated_modes() throws IOException {
        Path src = write("c.pas", Fixtures.program("control.pas"));
        assertEquals(0, run(src.toString(), "--symbols"));
        JsonNode st = new ObjectMapper().readTree(out());
        assertTrue(st.has("tab"));
        assertTrue(st.has("atab"));
        assertTrue(st.has("btab"));

        outBytes.reset();
        assertEquals(0, run(src.toString(), "--decorated"));
        assertTrue(new ObjectMapper().readTree(out()).has("decoration"));
    }

    @Test
    void syntax_error_prints_location_and_context() throws IOException {
        Path src = write("bad.pas", "program p;\nmulai x := ; selesai.\n");
        assertEquals(1, run(src.toString()));
        String err = err();
        assertTrue(err.contains("UnexpectedTokenException: Expected expression, got SEMICOLON ';'"), err);
        assertTrue(err.contains("at line 2, column 12"), err);
        assertTrue(err.contains("> 2 | mulai x := ; selesai."), err);
        assertEquals("", out());
    }

    @Test
    void semantic_error_has_no_location() throws IOException {
        Path src = write("sem.pas", "program p; mulai z := 1 selesai.");
        assertEquals(1, run(src.toString()));
        assertTrue(err().contains("UndeclaredIdentifierException: Undeclared identifier 'z'"), err());
        assertFalse(err().contains("at line"));
    }

    @Test
    void usage_errors() throws IOException {
        Path src = write("t.pas", "program p; mulai selesai.");
        assertEquals(2, run());
        assertTrue(err().contains("Usage:"));
        assertEquals(2, run("--bogus", src.toString()));
        assertEquals(2, run(src.toString(), src.toString()));
        assertEquals(2, run(src.toString(), "--ast", "--tokens"));
        assertEquals(2, run(src.toString(), "--config"));
    }

    @Test
    void missing_source_is_io_error() {
        assertEquals(3, run(dir.resolve("absent.pas").toString()));
        assertTrue(err().startsWith("I/O error"));
    }

    @Test
    void missing_config_is_io_error() throws IOException {
        Path src = write("t.pas", "program p; mulai selesai.");
        assertEquals(3, run(src.toString(), "--config", dir.resolve("none.json").toString()));
    }

    @Test
    void broken_config_is_reported() throws IOException {
        Path src = write("t.pas", "program p; mulai selesai.");
        Path json = write("dfa.json", "{ nope");
        assertEquals(1, run(src.toString(), "--config", json.toString()));
        assertTrue(err().contains("Invalid DFA configuration"), err());

        Path kinds = write("kinds.json", String.join("\n",
            "{ \"start_state\": \"S0\",",
            "  \"final_states\": { \"A\": \"NOT_A_KIND\" },",
            "  \"transitions\": [[\"S0\", \"a\", \"A\"]] }"));
        assertEquals(1, run(src.toString(), "--config", kinds.toString()));
    }

    @Test
    void verbose_routes_debug_output_to_stderr() throws IOException {
        Path src = write("t.pas", "program p; mulai selesai.");
        assertEquals(0, run("--verbose", src.toString()));
        assertTrue(err().contains("pascals.lexer"), err());
        assertTrue(err().contains("[DEBUG]"));
    }

    @Test
    void previous_sink_is_restored() throws IOException {
        DebugSink mine = (level, tag, message, error) -> { };
        Debug.get().setSink(mine);
        Path src = write("t.pas", "program p; mulai selesai.");
        run(src.toString());
        assertSame(mine, Debug.get().getSink());
    }
}
