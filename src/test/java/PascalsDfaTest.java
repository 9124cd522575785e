import com.pascals.compiler.automaton.Dfa;
import com.pascals.compiler.automaton.DfaConfig;
import com.pascals.compiler.automaton.DfaConfigException;
import com.pascals.compiler.automaton.DfaConfigLoader;
import com.pascals.compiler.lexer.TokenType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PascalsDfaTest {

    // 'a' has its own literal edge next to the LETTER class
    private static final String SMALL = String.join("\n",
        "{",
        "  \"start_state\": \"S0\",",
        "  \"final_states\": { \"A\": \"KEYWORD\", \"ID\": \"IDENTIFIER\", \"NUM\": \"NUMBER\" },",
        "  \"char_classes\": { \"LETTER\": \"[a-z]\", \"DIGIT\": \"[0-9]\" },",
        "  \"transitions\": [",
        "    [\"S0\", \"a\", \"A\"],",
        "    [\"S0\", \"LETTER\", \"ID\"],",
        "    [\"A\", \"LETTER\", \"ID\"],",
        "    [\"ID\", \"LETTER\", \"ID\"],",
        "    [\"S0\", \"DIGIT\", \"NUM\"],",
        "    [\"NUM\", \"DIGIT\", \"NUM\"]",
        "  ],",
        "  \"keywords\": [\"Mulai\"],",
        "  \"reserved_map\": { \"Benar\": \"KEYWORD\" }",
        "}"
    );

    @Test
    void literal_edge_wins_over_char_class() {
        Dfa dfa = new Dfa(DfaConfigLoader.fromJson(SMALL));
        assertEquals("A", dfa.step('a'));
        assertEquals(TokenType.KEYWORD, dfa.getTokenType());

        dfa.reset();
        assertEquals("ID", dfa.step('b'));
        assertEquals(TokenType.IDENTIFIER, dfa.getTokenType());
    }

    @Test
    void can_transition_does_not_move() {
        Dfa dfa = new Dfa(DfaConfigLoader.fromJson(SMALL));
        assertTrue(dfa.canTransition('7'));
        assertEquals("S0", dfa.getCurrentState());
        assertFalse(dfa.canTransition('#'));
    }

    @Test
    void stuck_step_returns_null_and_keeps_state() {
        Dfa dfa = new Dfa(DfaConfigLoader.fromJson(SMALL));
        dfa.step('1');
        assertNull(dfa.step('x'));
        assertEquals("NUM", dfa.getCurrentState());
    }

    @Test
    void start_state_is_not_final() {
        Dfa dfa = new Dfa(DfaConfigLoader.fromJson(SMALL));
        assertNull(dfa.getTokenType());
        assertFalse(dfa.isFinal(dfa.getStartState()));
        assertTrue(dfa.isFinal("NUM"));
    }

    @Test
    void keyword_and_reserved_lookups_ignore_case() {
        DfaConfig config = DfaConfigLoader.fromJson(SMALL);
        assertTrue(config.isKeyword("MULAI"));
        assertTrue(config.isKeyword("mulai"));
        assertEquals(TokenType.KEYWORD, config.reservedType("BENAR"));
        assertNull(config.reservedType("salah"));
    }

    @Test
    void loader_rejects_malformed_json() {
        assertThrows(DfaConfigException.class, () -> DfaConfigLoader.fromJson("{ not json"));
        assertThrows(DfaConfigException.class, () -> DfaConfigLoader.fromJson("[]"));
        assertThrows(DfaConfigException.class, () -> DfaConfigLoader.fromJson(
            "{\"start_state\":\"S0\",\"transitions\":[[\"S0\",\"a\"]]}"));
    }

    @Test
    void missing_resource_is_a_config_error() {
        assertThrows(DfaConfigException.class, () -> DfaConfigLoader.loadResource("/pascals/nope.json"));
    }

    @Test
    void shipped_rules_load() {
        DfaConfig config = DfaConfigLoader.loadDefault();
        assertEquals("S0", config.getStartState());
        assertTrue(config.isKeyword("mulai"));
        assertTrue(config.isKeyword("rekaman"));
        assertEquals(TokenType.LOGICAL_OPERATOR, config.reservedType("dan"));
        assertEquals(TokenType.ARITHMETIC_OPERATOR, config.reservedType("bagi"));
    }
}
