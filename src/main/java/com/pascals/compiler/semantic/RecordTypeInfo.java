package com.pascals.compiler.semantic;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Record layout: fields in declaration order, each at the running sum of the sizes before it. */
public final class RecordTypeInfo {

    public static final class Field {
        public final String name;
        public final Type type;
        public final long offset;

        public Field(String name, Type type, long offset) {
            this.name = name;
            this.type = type;
            this.offset = offset;
        }
    }

    private final Map<String, Field> fields;
    private final long size;

    public RecordTypeInfo(List<Field> fields) {
        Map<String, Field> byName = new LinkedHashMap<>();
        long total = 0;
        for (Field f : fields) {
            byName.put(key(f.name), f);
            total += f.type.size();
        }
        this.fields = Collections.unmodifiableMap(byName);
        this.size = total;
    }

    public Field field(String name) {
        return fields.get(key(name));
    }

    public Collection<Field> getFields() {
        return fields.values();
    }

    public long getSize() {
        return size;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
