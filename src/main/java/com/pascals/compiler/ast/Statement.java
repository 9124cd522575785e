package com.pascals.compiler.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class Statement {

    public interface Stmt extends Node {}

    public static final class CompoundStatement implements Stmt {
        public final List<Stmt> statements;

        public CompoundStatement(List<Stmt> statements) {
            this.statements = List.copyOf(statements);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitCompoundStatement(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("CompoundStatement", this, a);
            m.put("statements", Maps.of(statements, a));
            return m;
        }
    }

    public static final class AssignmentStatement implements Stmt {
        public final Expr.Variable target;
        public final Expr.Expression value;

        public AssignmentStatement(Expr.Variable target, Expr.Expression value) {
            this.target = target;
            this.value = value;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitAssignmentStatement(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("AssignmentStatement", this, a);
            m.put("variable", target.toMap(a));
            m.put("expression", value.toMap(a));
            return m;
        }
    }

    public static final class IfStatement implements Stmt {
        public final Expr.Expression condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch;

        public IfStatement(Expr.Expression condition, Stmt thenBranch, Stmt elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitIfStatement(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("IfStatement", this, a);
            m.put("condition", condition.toMap(a));
            m.put("then_statement", thenBranch.toMap(a));
            m.put("else_statement", Maps.of(elseBranch, a));
            return m;
        }
    }

    public static final class WhileStatement implements Stmt {
        public final Expr.Expression condition;
        public final Stmt body;

        public WhileStatement(Expr.Expression condition, Stmt body) {
            this.condition = condition;
            this.body = body;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitWhileStatement(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("WhileStatement", this, a);
            m.put("condition", condition.toMap(a));
            m.put("body", body.toMap(a));
            return m;
        }
    }

    public static final class ForStatement implements Stmt {
        public static final String UP = "ke";
        public static final String DOWN = "turun-ke";

        public final String variable;
        public final Expr.Expression start;
        public final String direction;
        public final Expr.Expression end;
        public final Stmt body;

        public ForStatement(String variable, Expr.Expression start, String direction, Expr.Expression end, Stmt body) {
            this.variable = variable;
            this.start = start;
            this.direction = direction;
            this.end = end;
            this.body = body;
        }

        public boolean isDownward() {
            return DOWN.equalsIgnoreCase(direction);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitForStatement(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("ForStatement", this, a);
            m.put("variable", variable);
            m.put("start", start.toMap(a));
            m.put("direction", direction);
            m.put("end", end.toMap(a));
            m.put("body", body.toMap(a));
            return m;
        }
    }

    public static final class RepeatStatement implements Stmt {
        public final List<Stmt> body;
        public final Expr.Expression condition;

        public RepeatStatement(List<Stmt> body, Expr.Expression condition) {
            this.body = List.copyOf(body);
            this.condition = condition;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitRepeatStatement(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("RepeatStatement", this, a);
            m.put("statements", Maps.of(body, a));
            m.put("condition", condition.toMap(a));
            return m;
        }
    }

    /** One {@code c1, c2: stmt} arm. Constants are Long, Double, String or Boolean values. */
    public static final class CaseBranch {
        public final List<Object> constants;
        public final Stmt body;

        public CaseBranch(List<Object> constants, Stmt body) {
            this.constants = List.copyOf(constants);
            this.body = body;
        }

        Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("CaseBranch");
            m.put("constants", constants);
            m.put("statement", body.toMap(a));
            return m;
        }
    }

    public static final class CaseStatement implements Stmt {
        public final Expr.Expression selector;
        public final List<CaseBranch> branches;

        public CaseStatement(Expr.Expression selector, List<CaseBranch> branches) {
            this.selector = selector;
            this.branches = List.copyOf(branches);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitCaseStatement(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("CaseStatement", this, a);
            m.put("expression", selector.toMap(a));
            List<Object> arms = new ArrayList<>(branches.size());
            for (CaseBranch b : branches) arms.add(b.toMap(a));
            m.put("branches", arms);
            return m;
        }
    }

    public static final class ProcedureCall implements Stmt {
        public final String name;
        public final List<Expr.Expression> arguments;

        public ProcedureCall(String name, List<Expr.Expression> arguments) {
            this.name = name;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitProcedureCall(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            Map<String, Object> m = Maps.node("ProcedureCall", this, a);
            m.put("name", name);
            m.put("arguments", Maps.of(arguments, a));
            return m;
        }
    }

    public static final class EmptyStatement implements Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) { return visitor.visitEmptyStatement(this); }

        @Override
        public Map<String, Object> toMap(Annotator a) {
            return Maps.node("EmptyStatement", this, a);
        }
    }
}
