package com.pascals.compiler.ast;

import java.util.List;
import java.util.Map;

public class Expr {

    public interface Expression extends Node {}

    public static final class BinaryOp implements Expression {
        public final Expression left;
        public final String operator;
        public final Expression right;

        public BinaryOp(Expression left, String operator, Expression right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitBinaryOp(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("BinaryOp", this, a);
            m.put("left", left.toMap(a));
            m.put("operator", operator);
            m.put("right", right.toMap(a));
            return m;
        }
    }

    public static final class UnaryOp implements Expression {
        public final String operator;
        public final Expression operand;

        public UnaryOp(String operator, Expression operand) {
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitUnaryOp(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("UnaryOp", this, a);
            m.put("operator", operator);
            m.put("operand", operand.toMap(a));
            return m;
        }
    }

    /**
     * A variable reference with its access chain. The head carries the identifier; each
     * node after it is one step, either an index step ({@code indices} non-empty, one array
     * level per index) or a field step ({@code field} set). {@code a[i].f} is
     * {@code a -> [i] -> .f}.
     */
    public static final class Variable implements Expression {
        public final String name;
        public final List<Expression> indices;
        public final String field;
        public final Variable next;

        public Variable(String name, Variable next) {
            this(name, List.of(), null, next);
        }

        private Variable(String name, List<Expression> indices, String field, Variable next) {
            this.name = name;
            this.indices = List.copyOf(indices);
            this.field = field;
            this.next = next;
        }

        public static Variable indexStep(List<Expression> indices, Variable next) {
            if (indices.isEmpty()) throw new IllegalArgumentException("index step without indices");
            return new Variable(null, indices, null, next);
        }

        public static Variable fieldStep(String field, Variable next) {
            return new Variable(null, List.of(), field, next);
        }

        public boolean isIndexStep() {
            return !indices.isEmpty();
        }

        public boolean isFieldStep() {
            return field != null;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitVariable(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("Variable", this, a);
            if (name != null) m.put("name", name);
            if (isIndexStep()) m.put("indices", Maps.of(indices, a));
            if (field != null) m.put("field", field);
            m.put("next", Maps.of(next, a));
            return m;
        }
    }

    /** {@code value} is a Long, or a Double when the literal has a fraction or exponent. */
    public static final class NumberLiteral implements Expression {
        public final Number value;

        public NumberLiteral(Number value) {
            this.value = value;
        }

        public boolean isReal() {
            return value instanceof Double;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitNumberLiteral(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("Number", this, a);
            m.put("value", value);
            return m;
        }
    }

    public static final class StringLiteral implements Expression {
        public final String value;

        public StringLiteral(String value) {
            this.value = value;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitStringLiteral(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("String", this, a);
            m.put("value", value);
            return m;
        }
    }

    public static final class CharLiteral implements Expression {
        public final char value;

        public CharLiteral(char value) {
            this.value = value;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitCharLiteral(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("Char", this, a);
            m.put("value", String.valueOf(value));
            return m;
        }
    }

    public static final class BooleanLiteral implements Expression {
        public final boolean value;

        public BooleanLiteral(boolean value) {
            this.value = value;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitBooleanLiteral(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("Boolean", this, a);
            m.put("value", value);
            return m;
        }
    }

    public static final class FunctionCall implements Expression {
        public final String name;
        public final List<Expression> arguments;

        public FunctionCall(String name, List<Expression> arguments) {
            this.name = name;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitFunctionCall(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("FunctionCall", this, a);
            m.put("name", name);
            m.put("arguments", Maps.of(arguments, a));
            return m;
        }
    }
}
