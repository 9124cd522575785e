package com.pascals.compiler.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.pascals.compiler.ast.Declaration;
import com.pascals.compiler.ast.Expr;
import com.pascals.compiler.ast.Node;
import com.pascals.compiler.ast.NodeVisitor;
import com.pascals.compiler.ast.Statement;
import com.pascals.compiler.ast.TypeSpec;
import com.pascals.compiler.error.DuplicateDeclarationException;
import com.pascals.compiler.error.InvalidArrayIndexException;
import com.pascals.compiler.error.InvalidFunctionCallException;
import com.pascals.compiler.error.InvalidOperationException;
import com.pascals.compiler.error.InvalidRecordAccessException;
import com.pascals.compiler.error.TypeMismatchException;
import com.pascals.compiler.error.UndeclaredIdentifierException;
import com.pascals.debug.Debug;

/**
 * Single-pass checker. Builds the symbol table while walking the tree, infers expression
 * types bottom-up and stops at the first violation. Results go to {@link #getDecorations()};
 * the tree itself is never modified.
 *
 * <p>Every {@code visit*} returns the node's type; declarations and statements return
 * {@link Type#VOID}. An instance analyzes one program.
 */
public class SemanticVisitor implements NodeVisitor<Type> {
    private static final String TAG = "pascals.semantic";

    private final SymbolTable symbols = new SymbolTable();
    private final Decorations decorations = new Decorations();
    private final Map<String, Type> typeNames;
    private Type currentFunctionType;
    private boolean used;

    public SemanticVisitor() {
        this(BuiltinDefinitions.standard());
    }

    public SemanticVisitor(BuiltinDefinitions builtins) {
        this.typeNames = builtins.typeNames();
        for (BuiltinDefinitions.Builtin b : builtins.getEntries()) {
            symbols.enter(b.name, b.kind, b.type, 0, 0, true);
        }
    }

    public Decorations analyze(Declaration.Program program) {
        if (used) throw new IllegalStateException("SemanticVisitor instances analyze a single program");
        used = true;
        program.accept(this);
        Debug.get().d(TAG, "analyzed '" + program.name + "': " + symbols.getEntries().size() + " symbols, "
                + symbols.getBlockEntries().size() + " blocks, " + decorations.size() + " decorated nodes");
        return decorations;
    }

    public SymbolTable getSymbolTable() {
        return symbols;
    }

    public Decorations getDecorations() {
        return decorations;
    }

    private Type visit(Node node) {
        return node.accept(this);
    }

    private Type decorate(Node node, Type type) {
        decorations.put(node, new Decoration(type, SymbolTable.NO_ENTRY, symbols.getLevel()));
        return type;
    }

    private void requireUnique(String name) {
        if (symbols.lookupCurrentScope(name) != SymbolTable.NO_ENTRY) {
            throw new DuplicateDeclarationException(name);
        }
    }

    // -------------------------
    // Declarations
    // -------------------------

    @Override
    public Type visitProgram(Declaration.Program node) {
        int index = symbols.enter(node.name, ObjectKind.PROGRAM, Type.VOID, 0, 0, true);
        decorations.put(node, new Decoration(Type.VOID, index, 0));
        visit(node.block);
        return Type.VOID;
    }

    @Override
    public Type visitBlock(Declaration.Block node) {
        for (Declaration.Decl decl : node.declarations) visit(decl);
        visit(node.body);
        return Type.VOID;
    }

    @Override
    public Type visitVarDeclaration(Declaration.VarDeclaration node) {
        Type type = visit(node.typeSpec);
        int ref = type.isArray() ? type.getArrayInfo().getRefIndex() : 0;

        int index = SymbolTable.NO_ENTRY;
        for (String name : node.names) {
            requireUnique(name);
            index = symbols.enter(name, ObjectKind.VARIABLE, type, symbols.getLevel(), ref, true);
        }
        decorations.put(node, new Decoration(type, index, symbols.getLevel()));
        return Type.VOID;
    }

    @Override
    public Type visitConstDeclaration(Declaration.ConstDeclaration node) {
        requireUnique(node.name);
        Type type = constantType(node.value);
        int index = symbols.enter(node.name, ObjectKind.CONSTANT, type);
        decorations.put(node, new Decoration(type, index, symbols.getLevel()));
        return Type.VOID;
    }

    @Override
    public Type visitTypeDeclaration(Declaration.TypeDeclaration node) {
        requireUnique(node.name);
        Type type = visit(node.typeSpec);
        typeNames.put(node.name.toLowerCase(Locale.ROOT), type);
        int index = symbols.enter(node.name, ObjectKind.TYPE, type);
        decorations.put(node, new Decoration(type, index, symbols.getLevel()));
        return Type.VOID;
    }

    @Override
    public Type visitProcedureDeclaration(Declaration.ProcedureDeclaration node) {
        requireUnique(node.name);
        int index = openSubprogram(node.name, ObjectKind.PROCEDURE, Type.VOID, node.parameters);
        decorations.put(node, new Decoration(Type.VOID, index, symbols.getLevel() - 1));
        visit(node.block);
        symbols.exitScope();
        return Type.VOID;
    }

    @Override
    public Type visitFunctionDeclaration(Declaration.FunctionDeclaration node) {
        requireUnique(node.name);
        Type returnType = visit(node.returnType);
        int index = openSubprogram(node.name, ObjectKind.FUNCTION, returnType, node.parameters);
        decorations.put(node, new Decoration(returnType, index, symbols.getLevel() - 1));

        Type outer = currentFunctionType;
        currentFunctionType = returnType;
        try {
            visit(node.block);
        } finally {
            currentFunctionType = outer;
        }
        symbols.exitScope();
        return Type.VOID;
    }

    /** Opens the subprogram's scope; its own symbol goes to the enclosing level so recursion resolves. */
    private int openSubprogram(String name, ObjectKind kind, Type type, List<Declaration.Parameter> params) {
        symbols.enterScope();
        int block = symbols.displayAt(symbols.getLevel());
        int index = symbols.enter(name, kind, type, symbols.getLevel() - 1, block, true);
        for (Declaration.Parameter p : params) visit(p);
        symbols.markParameters();
        Debug.get().t(TAG, kind + " " + name + " -> block " + block + " at level " + symbols.getLevel());
        return index;
    }

    @Override
    public Type visitParameter(Declaration.Parameter node) {
        Type type = visit(node.typeSpec);
        int ref = type.isArray() ? type.getArrayInfo().getRefIndex() : 0;
        int index = SymbolTable.NO_ENTRY;
        for (String name : node.names) {
            requireUnique(name);
            index = symbols.enter(name, ObjectKind.VARIABLE, type, symbols.getLevel(), ref, !node.byReference);
        }
        decorations.put(node, new Decoration(type, index, symbols.getLevel()));
        return Type.VOID;
    }

    // -------------------------
    // Types
    // -------------------------

    @Override
    public Type visitSimpleType(TypeSpec.SimpleType node) {
        Type known = typeNames.get(node.name.toLowerCase(Locale.ROOT));
        if (known != null) return decorate(node, known);

        int index = symbols.lookup(node.name);
        if (index != SymbolTable.NO_ENTRY) {
            SymbolEntry entry = symbols.getEntry(index);
            if (entry.kind == ObjectKind.TYPE) return decorate(node, entry.type);
        }
        throw new UndeclaredIdentifierException(node.name);
    }

    @Override
    public Type visitArrayType(TypeSpec.ArrayType node) {
        Type element = visit(node.elementType);

        Type indexType;
        long low;
        long high;
        boolean literalBounds = true;
        if (node.hasBounds()) {
            literalBounds = isLiteralBound(node.low) && isLiteralBound(node.high);
            low = foldBound(node.low);
            high = foldBound(node.high);
            indexType = node.low instanceof Expr.CharLiteral ? Type.CHAR : Type.INTEGER;
        } else {
            indexType = visit(node.indexType);
            if (!indexType.isOrdinal()) {
                throw new InvalidArrayIndexException("array index type must be ordinal, got " + indexType);
            }
            low = 0;
            high = indexType.getKind() == TypeKind.BOOLEAN ? 1 : indexType.getKind() == TypeKind.CHAR ? 255 : 0;
        }
        if (literalBounds && high < low) {
            throw new InvalidArrayIndexException("array bounds " + low + ".." + high + " are empty");
        }

        long elementSize = element.size();
        int ref = symbols.enterArray(indexType, element, low, high, elementSize);
        return decorate(node, Type.array(new ArrayTypeInfo(indexType, element, low, high, elementSize, ref)));
    }

    @Override
    public Type visitRecordType(TypeSpec.RecordType node) {
        List<RecordTypeInfo.Field> fields = new ArrayList<>();
        List<String> seen = new ArrayList<>();
        long offset = 0;
        for (Declaration.VarDeclaration decl : node.fields) {
            Type type = visit(decl.typeSpec);
            for (String name : decl.names) {
                String key = name.toLowerCase(Locale.ROOT);
                if (seen.contains(key)) throw new DuplicateDeclarationException(name);
                seen.add(key);
                fields.add(new RecordTypeInfo.Field(name, type, offset));
                offset += type.size();
            }
        }
        return decorate(node, Type.record(new RecordTypeInfo(fields)));
    }

    @Override
    public Type visitSubrangeType(TypeSpec.SubrangeType node) {
        Type low = visit(node.low);
        Type high = visit(node.high);
        if (low.getKind() != high.getKind() || !low.isOrdinal()) {
            throw new TypeMismatchException(low.toString(), high.toString(), "subrange bounds");
        }
        if (foldBound(node.high) < foldBound(node.low)) {
            throw new InvalidArrayIndexException("subrange " + foldBound(node.low) + ".." + foldBound(node.high) + " is empty");
        }
        return decorate(node, low);
    }

    // -------------------------
    // Statements
    // -------------------------

    @Override
    public Type visitCompoundStatement(Statement.CompoundStatement node) {
        for (Statement.Stmt s : node.statements) visit(s);
        return Type.VOID;
    }

    @Override
    public Type visitAssignmentStatement(Statement.AssignmentStatement node) {
        Type target = visit(node.target);
        SymbolEntry assigned = symbols.getEntry(decorations.get(node.target).tabIndex);
        if (assigned.kind == ObjectKind.FUNCTION && currentFunctionType == null) {
            throw new InvalidFunctionCallException("result of '" + assigned.name + "' assigned outside a function body", assigned.name);
        }
        Type value = visit(node.value);
        if (!target.compatibleWith(value)) {
            throw new TypeMismatchException(target.toString(), value.toString(), "assignment");
        }
        return Type.VOID;
    }

    @Override
    public Type visitIfStatement(Statement.IfStatement node) {
        requireBoolean(visit(node.condition), "if condition");
        visit(node.thenBranch);
        if (node.elseBranch != null) visit(node.elseBranch);
        return Type.VOID;
    }

    @Override
    public Type visitWhileStatement(Statement.WhileStatement node) {
        requireBoolean(visit(node.condition), "while condition");
        visit(node.body);
        return Type.VOID;
    }

    @Override
    public Type visitForStatement(Statement.ForStatement node) {
        Type start = visit(node.start);
        Type end = visit(node.end);
        if (!start.isOrdinal()) throw new TypeMismatchException("ordinal type", start.toString(), "for start");
        if (!end.isOrdinal()) throw new TypeMismatchException("ordinal type", end.toString(), "for end");

        int index = symbols.lookupCurrentScope(node.variable);
        if (index == SymbolTable.NO_ENTRY) {
            index = symbols.enter(node.variable, ObjectKind.VARIABLE, Type.INTEGER);
        }
        SymbolEntry counter = symbols.getEntry(index);
        decorations.put(node, new Decoration(counter.type, index, counter.level));

        visit(node.body);
        return Type.VOID;
    }

    @Override
    public Type visitRepeatStatement(Statement.RepeatStatement node) {
        for (Statement.Stmt s : node.body) visit(s);
        requireBoolean(visit(node.condition), "repeat condition");
        return Type.VOID;
    }

    @Override
    public Type visitCaseStatement(Statement.CaseStatement node) {
        visit(node.selector);
        for (Statement.CaseBranch branch : node.branches) visit(branch.body);
        return Type.VOID;
    }

    @Override
    public Type visitProcedureCall(Statement.ProcedureCall node) {
        int index = resolveCallee(node.name, ObjectKind.PROCEDURE);
        for (Expr.Expression arg : node.arguments) visit(arg);
        decorations.put(node, new Decoration(Type.VOID, index, symbols.getEntry(index).level));
        return Type.VOID;
    }

    @Override
    public Type visitEmptyStatement(Statement.EmptyStatement node) {
        return Type.VOID;
    }

    private static void requireBoolean(Type type, String context) {
        if (type.getKind() != TypeKind.BOOLEAN) {
            throw new TypeMismatchException("boolean", type.toString(), context);
        }
    }

    // -------------------------
    // Expressions
    // -------------------------

    @Override
    public Type visitBinaryOp(Expr.BinaryOp node) {
        Type left = visit(node.left);
        Type right = visit(node.right);
        String op = node.operator.toLowerCase(Locale.ROOT);

        Type result;
        switch (op) {
            case "+":
            case "-":
            case "*":
            case "/":
                if (!left.isNumeric() || !right.isNumeric()) throw invalid(op, left, right);
                result = left.getKind() == TypeKind.REAL || right.getKind() == TypeKind.REAL ? Type.REAL : Type.INTEGER;
                break;
            case "bagi":
            case "div":
            case "mod":
                if (left.getKind() != TypeKind.INTEGER || right.getKind() != TypeKind.INTEGER) throw invalid(op, left, right);
                result = Type.INTEGER;
                break;
            case "dan":
            case "and":
            case "atau":
            case "or":
                if (left.getKind() != TypeKind.BOOLEAN || right.getKind() != TypeKind.BOOLEAN) throw invalid(op, left, right);
                result = Type.BOOLEAN;
                break;
            case "=":
            case "<>":
            case "<":
            case "<=":
            case ">":
            case ">=":
                if (!left.compatibleWith(right) && !right.compatibleWith(left)) {
                    throw new TypeMismatchException(left.toString(), right.toString(), "comparison " + op);
                }
                result = Type.BOOLEAN;
                break;
            default:
                throw new InvalidOperationException(op, "unknown");
        }
        return decorate(node, result);
    }

    private static InvalidOperationException invalid(String op, Type left, Type right) {
        return new InvalidOperationException(op, left + " and " + right);
    }

    @Override
    public Type visitUnaryOp(Expr.UnaryOp node) {
        Type operand = visit(node.operand);
        String op = node.operator.toLowerCase(Locale.ROOT);
        switch (op) {
            case "+":
            case "-":
                if (!operand.isNumeric()) throw new InvalidOperationException(op, operand.toString());
                return decorate(node, operand);
            case "tidak":
            case "not":
                if (operand.getKind() != TypeKind.BOOLEAN) throw new InvalidOperationException(op, operand.toString());
                return decorate(node, Type.BOOLEAN);
            default:
                throw new InvalidOperationException(op, "unknown");
        }
    }

    @Override
    public Type visitVariable(Expr.Variable node) {
        int index = symbols.lookup(node.name);
        if (index == SymbolTable.NO_ENTRY) throw new UndeclaredIdentifierException(node.name);
        SymbolEntry entry = symbols.getEntry(index);

        Type current = entry.type;
        String path = node.name;
        for (Expr.Variable step = node.next; step != null; step = step.next) {
            if (step.isIndexStep()) {
                for (Expr.Expression indexExpr : step.indices) {
                    if (!current.isArray()) {
                        throw new InvalidArrayIndexException("'" + path + "' is not an array");
                    }
                    Type indexType = visit(indexExpr);
                    if (!indexType.isOrdinal()) {
                        throw new InvalidArrayIndexException("index of '" + path + "' must be ordinal, got " + indexType);
                    }
                    current = current.getArrayInfo().getElementType();
                }
                path += "[]";
            } else {
                if (!current.isRecord()) throw new InvalidRecordAccessException(path, step.field);
                RecordTypeInfo.Field field = current.getRecordInfo().field(step.field);
                if (field == null) throw new InvalidRecordAccessException(path, step.field);
                current = field.type;
                path += "." + step.field;
            }
            decorations.put(step, new Decoration(current, SymbolTable.NO_ENTRY, entry.level));
        }

        decorations.put(node, new Decoration(current, index, entry.level));
        return current;
    }

    @Override
    public Type visitNumberLiteral(Expr.NumberLiteral node) {
        return decorate(node, node.isReal() ? Type.REAL : Type.INTEGER);
    }

    @Override
    public Type visitStringLiteral(Expr.StringLiteral node) {
        return decorate(node, Type.STRING);
    }

    @Override
    public Type visitCharLiteral(Expr.CharLiteral node) {
        return decorate(node, Type.CHAR);
    }

    @Override
    public Type visitBooleanLiteral(Expr.BooleanLiteral node) {
        return decorate(node, Type.BOOLEAN);
    }

    @Override
    public Type visitFunctionCall(Expr.FunctionCall node) {
        int index = resolveCallee(node.name, ObjectKind.FUNCTION);
        for (Expr.Expression arg : node.arguments) visit(arg);
        SymbolEntry entry = symbols.getEntry(index);
        decorations.put(node, new Decoration(entry.type, index, entry.level));
        return entry.type;
    }

    private int resolveCallee(String name, ObjectKind expected) {
        int index = symbols.lookup(name);
        if (index == SymbolTable.NO_ENTRY) throw new UndeclaredIdentifierException(name);
        if (symbols.getEntry(index).kind != expected) {
            String what = expected == ObjectKind.FUNCTION ? "function" : "procedure";
            throw new InvalidFunctionCallException("'" + name + "' is not a " + what, name);
        }
        return index;
    }

    // -------------------------
    // Constant folding
    // -------------------------

    private static Type constantType(Object value) {
        if (value instanceof Boolean) return Type.BOOLEAN;
        if (value instanceof Long || value instanceof Integer) return Type.INTEGER;
        if (value instanceof Double) return Type.REAL;
        if (value instanceof String) return ((String) value).length() == 1 ? Type.CHAR : Type.STRING;
        return Type.INTEGER;
    }

    // bounds naming constants or expressions fold to 0 and are not range-checked
    private static boolean isLiteralBound(Expr.Expression bound) {
        if (bound instanceof Expr.NumberLiteral) return !((Expr.NumberLiteral) bound).isReal();
        if (bound instanceof Expr.CharLiteral) return true;
        if (bound instanceof Expr.UnaryOp && ((Expr.UnaryOp) bound).operator.equals("-")) {
            return isLiteralBound(((Expr.UnaryOp) bound).operand);
        }
        return false;
    }

    /** Integer literals fold to their value, char literals to their code point, anything else to 0. */
    private static long foldBound(Expr.Expression bound) {
        if (bound instanceof Expr.NumberLiteral && !((Expr.NumberLiteral) bound).isReal()) {
            return ((Expr.NumberLiteral) bound).value.longValue();
        }
        if (bound instanceof Expr.CharLiteral) {
            return ((Expr.CharLiteral) bound).value;
        }
        if (bound instanceof Expr.UnaryOp && ((Expr.UnaryOp) bound).operator.equals("-")) {
            return -foldBound(((Expr.UnaryOp) bound).operand);
        }
        return 0;
    }
}
