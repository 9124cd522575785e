package com.pascals.compiler.util;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import com.pascals.compiler.ast.Declaration;
import com.pascals.compiler.ast.Expr;
import com.pascals.compiler.ast.Node;
import com.pascals.compiler.ast.NodeVisitor;
import com.pascals.compiler.ast.Statement;
import com.pascals.compiler.ast.TypeSpec;

/**
 * Structural checks on a parsed tree: every node is reached once, names and operators are
 * non-empty, access chains are well formed and loop directions are known. Throws
 * {@link AstContractException} on the first violation.
 */
public final class AstContract implements NodeVisitor<Void> {
    private final Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());

    private AstContract() {}

    public static void validate(Declaration.Program program) {
        new AstContract().check(program);
    }

    private void check(Node node) {
        if (node == null) throw new AstContractException("missing child node");
        if (!seen.add(node)) {
            throw new AstContractException(node.getClass().getSimpleName() + " is shared between parents");
        }
        node.accept(this);
    }

    private void checkAll(List<? extends Node> nodes) {
        for (Node n : nodes) check(n);
    }

    private static void requireName(String name, String what) {
        if (name == null || name.isEmpty()) throw new AstContractException(what + " has no name");
    }

    @Override
    public Void visitProgram(Declaration.Program node) {
        requireName(node.name, "Program");
        check(node.block);
        return null;
    }

    @Override
    public Void visitBlock(Declaration.Block node) {
        checkAll(node.declarations);
        check(node.body);
        return null;
    }

    @Override
    public Void visitVarDeclaration(Declaration.VarDeclaration node) {
        if (node.names.isEmpty()) throw new AstContractException("VarDeclaration without identifiers");
        for (String n : node.names) requireName(n, "VarDeclaration identifier");
        check(node.typeSpec);
        return null;
    }

    @Override
    public Void visitConstDeclaration(Declaration.ConstDeclaration node) {
        requireName(node.name, "ConstDeclaration");
        if (node.value == null) throw new AstContractException("ConstDeclaration '" + node.name + "' has no value");
        return null;
    }

    @Override
    public Void visitTypeDeclaration(Declaration.TypeDeclaration node) {
        requireName(node.name, "TypeDeclaration");
        check(node.typeSpec);
        return null;
    }

    @Override
    public Void visitProcedureDeclaration(Declaration.ProcedureDeclaration node) {
        requireName(node.name, "ProcedureDeclaration");
        checkAll(node.parameters);
        check(node.block);
        return null;
    }

    @Override
    public Void visitFunctionDeclaration(Declaration.FunctionDeclaration node) {
        requireName(node.name, "FunctionDeclaration");
        checkAll(node.parameters);
        check(node.returnType);
        check(node.block);
        return null;
    }

    @Override
    public Void visitParameter(Declaration.Parameter node) {
        if (node.names.isEmpty()) throw new AstContractException("Parameter group without identifiers");
        check(node.typeSpec);
        return null;
    }

    @Override
    public Void visitSimpleType(TypeSpec.SimpleType node) {
        requireName(node.name, "SimpleType");
        return null;
    }

    @Override
    public Void visitArrayType(TypeSpec.ArrayType node) {
        if (node.hasBounds()) {
            check(node.low);
            check(node.high);
        } else {
            check(node.indexType);
        }
        check(node.elementType);
        return null;
    }

    @Override
    public Void visitRecordType(TypeSpec.RecordType node) {
        checkAll(node.fields);
        return null;
    }

    @Override
    public Void visitSubrangeType(TypeSpec.SubrangeType node) {
        check(node.low);
        check(node.high);
        return null;
    }

    @Override
    public Void visitCompoundStatement(Statement.CompoundStatement node) {
        checkAll(node.statements);
        return null;
    }

    @Override
    public Void visitAssignmentStatement(Statement.AssignmentStatement node) {
        check(node.target);
        check(node.value);
        return null;
    }

    @Override
    public Void visitIfStatement(Statement.IfStatement node) {
        check(node.condition);
        check(node.thenBranch);
        if (node.elseBranch != null) check(node.elseBranch);
        return null;
    }

    @Override
    public Void visitWhileStatement(Statement.WhileStatement node) {
        check(node.condition);
        check(node.body);
        return null;
    }

    @Override
    public Void visitForStatement(Statement.ForStatement node) {
        requireName(node.variable, "ForStatement variable");
        if (!Statement.ForStatement.UP.equals(node.direction) && !Statement.ForStatement.DOWN.equals(node.direction)) {
            throw new AstContractException("ForStatement direction '" + node.direction + "'");
        }
        check(node.start);
        check(node.end);
        check(node.body);
        return null;
    }

    @Override
    public Void visitRepeatStatement(Statement.RepeatStatement node) {
        checkAll(node.body);
        check(node.condition);
        return null;
    }

    @Override
    public Void visitCaseStatement(Statement.CaseStatement node) {
        check(node.selector);
        for (Statement.CaseBranch b : node.branches) {
            if (b.constants.isEmpty()) throw new AstContractException("case branch without constants");
            check(b.body);
        }
        return null;
    }

    @Override
    public Void visitProcedureCall(Statement.ProcedureCall node) {
        requireName(node.name, "ProcedureCall");
        checkAll(node.arguments);
        return null;
    }

    @Override
    public Void visitEmptyStatement(Statement.EmptyStatement node) {
        return null;
    }

    @Override
    public Void visitBinaryOp(Expr.BinaryOp node) {
        requireName(node.operator, "BinaryOp operator");
        check(node.left);
        check(node.right);
        return null;
    }

    @Override
    public Void visitUnaryOp(Expr.UnaryOp node) {
        requireName(node.operator, "UnaryOp operator");
        check(node.operand);
        return null;
    }

    @Override
    public Void visitVariable(Expr.Variable node) {
        requireName(node.name, "Variable");
        for (Expr.Variable step = node.next; step != null; step = step.next) {
            if (!seen.add(step)) throw new AstContractException("access step of '" + node.name + "' is shared");
            if (step.name != null) throw new AstContractException("access step of '" + node.name + "' carries a name");
            if (step.isIndexStep() == step.isFieldStep()) {
                throw new AstContractException("access step of '" + node.name + "' must be an index or a field");
            }
            checkAll(step.indices);
        }
        return null;
    }

    @Override
    public Void visitNumberLiteral(Expr.NumberLiteral node) {
        if (node.value == null) throw new AstContractException("Number without value");
        return null;
    }

    @Override
    public Void visitStringLiteral(Expr.StringLiteral node) {
        if (node.value == null) throw new AstContractException("String without value");
        return null;
    }

    @Override
    public Void visitCharLiteral(Expr.CharLiteral node) {
        return null;
    }

    @Override
    public Void visitBooleanLiteral(Expr.BooleanLiteral node) {
        return null;
    }

    @Override
    public Void visitFunctionCall(Expr.FunctionCall node) {
        requireName(node.name, "FunctionCall");
        checkAll(node.arguments);
        return null;
    }
}
