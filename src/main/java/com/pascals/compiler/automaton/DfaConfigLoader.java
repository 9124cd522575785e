package com.pascals.compiler.automaton;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads a {@link DfaConfig} from its JSON form:
 *
 * <pre>
 * { "start_state": "S0",
 *   "final_states": { "ID": "IDENTIFIER", ... },
 *   "char_classes": { "LETTER": "[A-Za-z_]", ... },
 *   "transitions": [ ["S0", "LETTER", "ID"], ... ],
 *   "keywords": [ "program", ... ],
 *   "reserved_map": { "benar": "KEYWORD", ... } }
 * </pre>
 */
public final class DfaConfigLoader {

    public static final String DEFAULT_RESOURCE = "/pascals/dfa_rules.json";

    private static final ObjectMapper om = new ObjectMapper();

    private DfaConfigLoader() {}

    /** The rules shipped with the front-end. */
    public static DfaConfig loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static DfaConfig loadResource(String resource) {
        try (InputStream in = DfaConfigLoader.class.getResourceAsStream(resource)) {
            if (in == null) throw new DfaConfigException("Config resource not found: " + resource);
            return fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DfaConfigException("Failed to read config resource " + resource, e);
        }
    }

    public static DfaConfig loadFile(Path path) throws IOException {
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static DfaConfig fromJson(String json) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DfaConfigException("DFA config is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new DfaConfigException("DFA config must be a JSON object");
        }

        String start = root.path("start_state").asText("");
        Map<String, String> finals = stringMap(root, "final_states");
        Map<String, String> classes = stringMap(root, "char_classes");
        Map<String, String> reserved = stringMap(root, "reserved_map");

        List<DfaConfig.Transition> transitions = new ArrayList<>();
        JsonNode tn = root.path("transitions");
        if (!tn.isMissingNode() && !tn.isArray()) {
            throw new DfaConfigException("transitions must be an array of [from_state, input_sym, to_state]");
        }
        int i = 0;
        for (JsonNode t : tn) {
            if (!t.isArray() || t.size() != 3) {
                throw new DfaConfigException("Transition at index " + i
                        + " must be a triple: [from_state, input_sym, to_state]. Got: " + t);
            }
            transitions.add(new DfaConfig.Transition(t.get(0).asText(), t.get(1).asText(), t.get(2).asText()));
            i++;
        }

        List<String> keywords = new ArrayList<>();
        for (JsonNode k : root.path("keywords")) keywords.add(k.asText());

        return new DfaConfig(start, finals, classes, transitions, keywords, reserved);
    }

    private static Map<String, String> stringMap(JsonNode root, String field) {
        Map<String, String> out = new LinkedHashMap<>();
        JsonNode n = root.path(field);
        if (n.isMissingNode() || n.isNull()) return out;
        if (!n.isObject()) throw new DfaConfigException(field + " must be a JSON object");
        Iterator<Map.Entry<String, JsonNode>> it = n.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), e.getValue().asText());
        }
        return out;
    }
}
