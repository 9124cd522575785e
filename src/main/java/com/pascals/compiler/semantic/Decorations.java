package com.pascals.compiler.semantic;

import java.util.IdentityHashMap;
import java.util.Map;

import com.pascals.compiler.ast.Node;

/** Side table of analysis results keyed by node identity. */
public final class Decorations {
    private final Map<Node, Decoration> byNode = new IdentityHashMap<>();

    void put(Node node, Decoration decoration) {
        byNode.put(node, decoration);
    }

    /** Decoration of {@code node}, or null if analysis did not decorate it. */
    public Decoration get(Node node) {
        return byNode.get(node);
    }

    public Type typeOf(Node node) {
        Decoration d = byNode.get(node);
        return d == null ? null : d.type;
    }

    public boolean contains(Node node) {
        return byNode.containsKey(node);
    }

    public int size() {
        return byNode.size();
    }
}
