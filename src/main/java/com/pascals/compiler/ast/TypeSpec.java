package com.pascals.compiler.ast;

import java.util.List;
import java.util.Map;

public class TypeSpec {

    public interface TypeNode extends Node {}

    /** A built-in type keyword or the name of a declared type. */
    public static final class SimpleType implements TypeNode {
        public final String name;

        public SimpleType(String name) {
            this.name = name;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitSimpleType(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("SimpleType", this, a);
            m.put("name", name);
            return m;
        }
    }

    /**
     * {@code larik [low..high] dari element} or {@code larik [index] dari element}.
     * Exactly one of the bound pair and {@code indexType} is set.
     */
    public static final class ArrayType implements TypeNode {
        public final Expr.Expression low;
        public final Expr.Expression high;
        public final SimpleType indexType;
        public final TypeNode elementType;

        public ArrayType(Expr.Expression low, Expr.Expression high, TypeNode elementType) {
            this(low, high, null, elementType);
        }

        public ArrayType(SimpleType indexType, TypeNode elementType) {
            this(null, null, indexType, elementType);
        }

        private ArrayType(Expr.Expression low, Expr.Expression high, SimpleType indexType, TypeNode elementType) {
            this.low = low;
            this.high = high;
            this.indexType = indexType;
            this.elementType = elementType;
        }

        public boolean hasBounds() {
            return indexType == null;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitArrayType(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("ArrayType", this, a);
            if (hasBounds()) {
                m.put("low", low.toMap(a));
                m.put("high", high.toMap(a));
            } else {
                m.put("index_type", indexType.toMap(a));
            }
            m.put("element_type", elementType.toMap(a));
            return m;
        }
    }

    public static final class RecordType implements TypeNode {
        public final List<Declaration.VarDeclaration> fields;

        public RecordType(List<Declaration.VarDeclaration> fields) {
            this.fields = List.copyOf(fields);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitRecordType(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("RecordType", this, a);
            m.put("fields", Maps.of(fields, a));
            return m;
        }
    }

    /** {@code low..high} over integer or char constants. */
    public static final class SubrangeType implements TypeNode {
        public final Expr.Expression low;
        public final Expr.Expression high;

        public SubrangeType(Expr.Expression low, Expr.Expression high) {
            this.low = low;
            this.high = high;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitSubrangeType(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("SubrangeType", this, a);
            m.put("low", low.toMap(a));
            m.put("high", high.toMap(a));
            return m;
        }
    }
}
