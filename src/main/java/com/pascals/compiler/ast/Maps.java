package com.pascals.compiler.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class Maps {

    private Maps() {}

    static Map<String, Object> node(String type) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type);
        return m;
    }

    static Map<String, Object> node(String type, Node node, Annotator a) {
        Map<String, Object> m = node(type);
        Object decoration = a.annotate(node);
        if (decoration != null) m.put("decoration", decoration);
        return m;
    }

    static Object of(Node n, Annotator a) {
        return n == null ? null : n.toMap(a);
    }

    static List<Object> of(List<? extends Node> nodes, Annotator a) {
        List<Object> out = new ArrayList<>(nodes.size());
        for (Node n : nodes) out.add(n.toMap(a));
        return out;
    }
}
