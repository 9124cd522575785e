package com.pascals.compiler.semantic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Identifiers predeclared at level 0 before a program is analyzed. */
public final class BuiltinDefinitions {

    public static final class Builtin {
        public final String name;
        public final ObjectKind kind;
        public final Type type;

        Builtin(String name, ObjectKind kind, Type type) {
            this.name = name;
            this.kind = kind;
            this.type = type;
        }
    }

    private final List<Builtin> entries;

    private BuiltinDefinitions(List<Builtin> entries) {
        this.entries = Collections.unmodifiableList(entries);
    }

    public static BuiltinDefinitions standard() {
        return builder()
                .constant("salah", Type.BOOLEAN)
                .constant("benar", Type.BOOLEAN)
                .type("integer", Type.INTEGER)
                .type("real", Type.REAL)
                .type("boolean", Type.BOOLEAN)
                .type("char", Type.CHAR)
                .type("string", Type.STRING)
                .procedure("write")
                .procedure("writeln")
                .procedure("read")
                .procedure("readln")
                .function("abs", Type.INTEGER)
                .function("sqr", Type.INTEGER)
                .function("sqrt", Type.REAL)
                .function("sin", Type.REAL)
                .function("cos", Type.REAL)
                .function("exp", Type.REAL)
                .function("ln", Type.REAL)
                .function("odd", Type.BOOLEAN)
                .function("ord", Type.INTEGER)
                .function("chr", Type.CHAR)
                .function("succ", Type.INTEGER)
                .function("pred", Type.INTEGER)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Builtin> getEntries() {
        return entries;
    }

    /** Built-in type names (lowercase) to their types. */
    public Map<String, Type> typeNames() {
        Map<String, Type> out = new LinkedHashMap<>();
        for (Builtin b : entries) {
            if (b.kind == ObjectKind.TYPE) out.put(b.name.toLowerCase(Locale.ROOT), b.type);
        }
        return out;
    }

    public static final class Builder {
        private final List<Builtin> entries = new ArrayList<>();

        public Builder constant(String name, Type type) { return add(name, ObjectKind.CONSTANT, type); }
        public Builder type(String name, Type type) { return add(name, ObjectKind.TYPE, type); }
        public Builder procedure(String name) { return add(name, ObjectKind.PROCEDURE, Type.VOID); }
        public Builder function(String name, Type result) { return add(name, ObjectKind.FUNCTION, result); }

        private Builder add(String name, ObjectKind kind, Type type) {
            entries.add(new Builtin(name, kind, type));
            return this;
        }

        public BuiltinDefinitions build() {
            return new BuiltinDefinitions(new ArrayList<>(entries));
        }
    }
}
