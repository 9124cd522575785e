package com.pascals.compiler.util;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pascals.compiler.ast.Declaration;
import com.pascals.compiler.lexer.Token;
import com.pascals.compiler.semantic.ArrayEntry;
import com.pascals.compiler.semantic.BlockEntry;
import com.pascals.compiler.semantic.Decoration;
import com.pascals.compiler.semantic.Decorations;
import com.pascals.compiler.semantic.SymbolEntry;
import com.pascals.compiler.semantic.SymbolTable;

/** JSON views of each pipeline stage's output. */
public final class JsonReports {
    private static final ObjectMapper om = new ObjectMapper();

    private JsonReports() {}

    public static JsonNode tokens(List<Token> tokens) {
        ArrayNode out = om.createArrayNode();
        for (Token t : tokens) {
            ObjectNode n = out.addObject();
            n.put("kind", t.type.name());
            n.put("text", t.text);
            n.put("start", t.start);
            n.put("end", t.end);
        }
        return out;
    }

    public static JsonNode ast(Declaration.Program program) {
        return om.valueToTree(program.toMap());
    }

    /** The tree with each decorated node's analysis result under {@code "decoration"}. */
    public static JsonNode decoratedAst(Declaration.Program program, Decorations decorations) {
        return om.valueToTree(program.toMap(node -> {
            Decoration d = decorations.get(node);
            if (d == null) return null;
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("type", d.type.toString());
            if (d.hasSymbol()) m.put("tab_index", d.tabIndex);
            m.put("level", d.level);
            return m;
        }));
    }

    public static JsonNode symbolTable(SymbolTable table) {
        ObjectNode root = om.createObjectNode();

        ArrayNode tab = root.putArray("tab");
        List<SymbolEntry> entries = table.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            SymbolEntry e = entries.get(i);
            ObjectNode n = tab.addObject();
            n.put("index", i);
            n.put("name", e.name);
            n.put("kind", e.kind.name());
            n.put("type", e.type.toString());
            n.put("level", e.level);
            n.put("address", e.address);
            n.put("ref", e.ref);
            n.put("normal", e.byValue);
            n.put("link", e.link);
        }

        ArrayNode atab = root.putArray("atab");
        for (ArrayEntry a : table.getArrayEntries()) {
            ObjectNode n = atab.addObject();
            n.put("index_type", a.indexType.toString());
            n.put("element_type", a.elementType.toString());
            n.put("low", a.low);
            n.put("high", a.high);
            n.put("element_size", a.elementSize);
            n.put("size", a.size);
        }

        ArrayNode btab = root.putArray("btab");
        for (BlockEntry b : table.getBlockEntries()) {
            ObjectNode n = btab.addObject();
            n.put("last", b.getLast());
            n.put("lpar", b.getParamListOffset());
            n.put("psze", b.getParamSize());
            n.put("vsze", b.getVarSize());
        }
        return root;
    }

    public static String pretty(JsonNode n) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(n);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
