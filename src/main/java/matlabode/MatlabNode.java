package matlabode;

import java.util.*;

/**
 * Abstract syntax tree for MATLAB source.
 *
 * The set of node kinds is closed: every variant is a nested final class and
 * the constructor is private, so code that needs to handle every kind
 * implements {@link Visitor}. Nodes are immutable values with structural
 * equality. Lists held by a node are unmodifiable copies.
 */
public abstract class MatlabNode {

    private MatlabNode() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Name at the root of a reference: "x" for x, x(1), x{2}, x.a.b and
     * x(1).c; null for anything that is not a reference.
     */
    public static String getBaseName(MatlabNode node) {
        if (node instanceof Identifier) {
            return ((Identifier) node).getName();
        } else if (node instanceof ArrayOrFunCall) {
            return getBaseName(((ArrayOrFunCall) node).getName());
        } else if (node instanceof ArrayRef) {
            return getBaseName(((ArrayRef) node).getName());
        } else if (node instanceof FunCall) {
            return getBaseName(((FunCall) node).getName());
        } else if (node instanceof StructRef) {
            return getBaseName(((StructRef) node).getBase());
        }
        return null;
    }

    private static <T> List<T> copy(List<? extends T> list) {
        return list == null ? Collections.<T>emptyList() : Collections.unmodifiableList(new ArrayList<T>(list));
    }

    private static String describe(String kind, Object... fields) {
        StringBuilder sb = new StringBuilder(kind).append('(');
        for (int i = 0; i < fields.length; i += 2) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(fields[i]).append('=').append(fields[i + 1]);
        }
        return sb.append(')').toString();
    }

    // =====================================================================
    // VISITOR
    // =====================================================================

    public interface Visitor<R> {
        R visitNumberLiteral(NumberLiteral node);
        R visitStringLiteral(StringLiteral node);
        R visitBooleanLiteral(BooleanLiteral node);
        R visitSpecial(Special node);
        R visitArray(Array node);
        R visitFunHandle(FunHandle node);
        R visitAnonFun(AnonFun node);
        R visitIdentifier(Identifier node);
        R visitArrayRef(ArrayRef node);
        R visitFunCall(FunCall node);
        R visitArrayOrFunCall(ArrayOrFunCall node);
        R visitStructRef(StructRef node);
        R visitUnaryOp(UnaryOp node);
        R visitBinaryOp(BinaryOp node);
        R visitTernaryOp(TernaryOp node);
        R visitTranspose(Transpose node);
        R visitAssignment(Assignment node);
        R visitFunDef(FunDef node);
        R visitIf(If node);
        R visitElseif(Elseif node);
        R visitElse(Else node);
        R visitWhile(While node);
        R visitFor(For node);
        R visitSwitch(Switch node);
        R visitCase(Case node);
        R visitOtherwise(Otherwise node);
        R visitTryCatch(TryCatch node);
        R visitBranch(Branch node);
        R visitShellCommand(ShellCommand node);
        R visitMatlabCommand(MatlabCommand node);
        R visitComment(Comment node);
    }

    // =====================================================================
    // LITERALS
    // =====================================================================

    /** Numeric literal, kept as written so "1e3" and "1000" stay distinct. */
    public static final class NumberLiteral extends MatlabNode {
        private final String text;

        public NumberLiteral(String text) {
            this.text = Objects.requireNonNull(text);
        }

        public String getText() { return text; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitNumberLiteral(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof NumberLiteral && text.equals(((NumberLiteral) o).text);
        }

        @Override
        public int hashCode() { return Objects.hash("number", text); }

        @Override
        public String toString() { return describe("NumberLiteral", "text", text); }
    }

    /** String literal; the value has quote escapes already removed. */
    public static final class StringLiteral extends MatlabNode {
        private final String value;
        private final boolean doubleQuoted;

        public StringLiteral(String value, boolean doubleQuoted) {
            this.value = Objects.requireNonNull(value);
            this.doubleQuoted = doubleQuoted;
        }

        public String getValue() { return value; }
        public boolean isDoubleQuoted() { return doubleQuoted; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitStringLiteral(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof StringLiteral)) {
                return false;
            }
            StringLiteral other = (StringLiteral) o;
            return value.equals(other.value) && doubleQuoted == other.doubleQuoted;
        }

        @Override
        public int hashCode() { return Objects.hash("string", value, doubleQuoted); }

        @Override
        public String toString() { return describe("StringLiteral", "value", "'" + value + "'", "doubleQuoted", doubleQuoted); }
    }

    public static final class BooleanLiteral extends MatlabNode {
        private final boolean value;

        public BooleanLiteral(boolean value) {
            this.value = value;
        }

        public boolean getValue() { return value; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitBooleanLiteral(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof BooleanLiteral && value == ((BooleanLiteral) o).value;
        }

        @Override
        public int hashCode() { return Objects.hash("boolean", value); }

        @Override
        public String toString() { return describe("BooleanLiteral", "value", value); }
    }

    /** A bare ":" (whole dimension), "~" (ignored output) or "end" (last index). */
    public static final class Special extends MatlabNode {
        public static final String COLON = ":";
        public static final String TILDE = "~";
        public static final String END = "end";

        private final String value;

        public Special(String value) {
            if (!COLON.equals(value) && !TILDE.equals(value) && !END.equals(value)) {
                throw new IllegalArgumentException("Not a special value: " + value);
            }
            this.value = value;
        }

        public String getValue() { return value; }

        public boolean isColon() { return COLON.equals(value); }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSpecial(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Special && value.equals(((Special) o).value);
        }

        @Override
        public int hashCode() { return Objects.hash("special", value); }

        @Override
        public String toString() { return describe("Special", "value", value); }
    }

    /**
     * Matrix "[...]" or cell array "{...}" literal. Rows are always a list of
     * lists; "[]" has no rows and "[1 2]" has one row of two elements.
     */
    public static final class Array extends MatlabNode {
        private final boolean cell;
        private final List<List<MatlabNode>> rows;

        public Array(boolean cell, List<? extends List<? extends MatlabNode>> rows) {
            this.cell = cell;
            List<List<MatlabNode>> copied = new ArrayList<>();
            for (List<? extends MatlabNode> row : rows) {
                copied.add(copy(row));
            }
            this.rows = Collections.unmodifiableList(copied);
        }

        public boolean isCell() { return cell; }
        public List<List<MatlabNode>> getRows() { return rows; }

        public boolean isEmpty() { return rows.isEmpty(); }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitArray(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Array)) {
                return false;
            }
            Array other = (Array) o;
            return cell == other.cell && rows.equals(other.rows);
        }

        @Override
        public int hashCode() { return Objects.hash("array", cell, rows); }

        @Override
        public String toString() { return describe("Array", "isCell", cell, "rows", rows); }
    }

    // =====================================================================
    // FUNCTION VALUES
    // =====================================================================

    /** Named handle "@f". */
    public static final class FunHandle extends MatlabNode {
        private final Identifier name;

        public FunHandle(Identifier name) {
            this.name = Objects.requireNonNull(name);
        }

        public Identifier getName() { return name; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitFunHandle(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof FunHandle && name.equals(((FunHandle) o).name);
        }

        @Override
        public int hashCode() { return Objects.hash("handle", name); }

        @Override
        public String toString() { return describe("FunHandle", "name", name); }
    }

    /** Anonymous function "@(t, y) body". */
    public static final class AnonFun extends MatlabNode {
        private final List<MatlabNode> params;
        private final MatlabNode body;

        public AnonFun(List<? extends MatlabNode> params, MatlabNode body) {
            this.params = copy(params);
            this.body = Objects.requireNonNull(body);
        }

        public List<MatlabNode> getParams() { return params; }
        public MatlabNode getBody() { return body; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitAnonFun(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof AnonFun)) {
                return false;
            }
            AnonFun other = (AnonFun) o;
            return params.equals(other.params) && body.equals(other.body);
        }

        @Override
        public int hashCode() { return Objects.hash("anon", params, body); }

        @Override
        public String toString() { return describe("AnonFun", "params", params, "body", body); }
    }

    // =====================================================================
    // REFERENCES
    // =====================================================================

    public static final class Identifier extends MatlabNode {
        private final String name;

        public Identifier(String name) {
            this.name = Objects.requireNonNull(name);
        }

        public String getName() { return name; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitIdentifier(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Identifier && name.equals(((Identifier) o).name);
        }

        @Override
        public int hashCode() { return Objects.hash("id", name); }

        @Override
        public String toString() { return describe("Identifier", "name", name); }
    }

    /** Indexing into an array, x(i), or into a cell array, c{i}. */
    public static final class ArrayRef extends MatlabNode {
        private final MatlabNode name;
        private final List<MatlabNode> args;
        private final boolean cell;

        public ArrayRef(MatlabNode name, List<? extends MatlabNode> args, boolean cell) {
            this.name = Objects.requireNonNull(name);
            this.args = copy(args);
            this.cell = cell;
        }

        public MatlabNode getName() { return name; }
        public List<MatlabNode> getArgs() { return args; }
        public boolean isCell() { return cell; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitArrayRef(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ArrayRef)) {
                return false;
            }
            ArrayRef other = (ArrayRef) o;
            return name.equals(other.name) && args.equals(other.args) && cell == other.cell;
        }

        @Override
        public int hashCode() { return Objects.hash("arrayref", name, args, cell); }

        @Override
        public String toString() { return describe("ArrayRef", "name", name, "args", args, "isCell", cell); }
    }

    public static final class FunCall extends MatlabNode {
        private final MatlabNode name;
        private final List<MatlabNode> args;

        public FunCall(MatlabNode name, List<? extends MatlabNode> args) {
            this.name = Objects.requireNonNull(name);
            this.args = copy(args);
        }

        public MatlabNode getName() { return name; }
        public List<MatlabNode> getArgs() { return args; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitFunCall(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof FunCall)) {
                return false;
            }
            FunCall other = (FunCall) o;
            return name.equals(other.name) && args.equals(other.args);
        }

        @Override
        public int hashCode() { return Objects.hash("funcall", name, args); }

        @Override
        public String toString() { return describe("FunCall", "name", name, "args", args); }
    }

    /** "name(args)" whose kind could not be decided from what precedes it. */
    public static final class ArrayOrFunCall extends MatlabNode {
        private final MatlabNode name;
        private final List<MatlabNode> args;

        public ArrayOrFunCall(MatlabNode name, List<? extends MatlabNode> args) {
            this.name = Objects.requireNonNull(name);
            this.args = copy(args);
        }

        public MatlabNode getName() { return name; }
        public List<MatlabNode> getArgs() { return args; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitArrayOrFunCall(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ArrayOrFunCall)) {
                return false;
            }
            ArrayOrFunCall other = (ArrayOrFunCall) o;
            return name.equals(other.name) && args.equals(other.args);
        }

        @Override
        public int hashCode() { return Objects.hash("ambiguous", name, args); }

        @Override
        public String toString() { return describe("ArrayOrFunCall", "name", name, "args", args); }
    }

    /** Field access s.f, or s.(expr) when dynamicAccess is set. */
    public static final class StructRef extends MatlabNode {
        private final MatlabNode base;
        private final MatlabNode field;
        private final boolean dynamicAccess;

        public StructRef(MatlabNode base, MatlabNode field, boolean dynamicAccess) {
            this.base = Objects.requireNonNull(base);
            this.field = Objects.requireNonNull(field);
            this.dynamicAccess = dynamicAccess;
        }

        public MatlabNode getBase() { return base; }
        public MatlabNode getField() { return field; }
        public boolean isDynamicAccess() { return dynamicAccess; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitStructRef(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof StructRef)) {
                return false;
            }
            StructRef other = (StructRef) o;
            return base.equals(other.base) && field.equals(other.field) && dynamicAccess == other.dynamicAccess;
        }

        @Override
        public int hashCode() { return Objects.hash("struct", base, field, dynamicAccess); }

        @Override
        public String toString() { return describe("StructRef", "base", base, "field", field, "dynamicAccess", dynamicAccess); }
    }

    // =====================================================================
    // OPERATORS
    // =====================================================================

    public static final class UnaryOp extends MatlabNode {
        private final String op;
        private final MatlabNode operand;

        public UnaryOp(String op, MatlabNode operand) {
            this.op = Objects.requireNonNull(op);
            this.operand = Objects.requireNonNull(operand);
        }

        public String getOp() { return op; }
        public MatlabNode getOperand() { return operand; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitUnaryOp(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof UnaryOp)) {
                return false;
            }
            UnaryOp other = (UnaryOp) o;
            return op.equals(other.op) && operand.equals(other.operand);
        }

        @Override
        public int hashCode() { return Objects.hash("unary", op, operand); }

        @Override
        public String toString() { return describe("UnaryOp", "op", op, "operand", operand); }
    }

    /** Binary operator; the two-operand range a:b is op ":". */
    public static final class BinaryOp extends MatlabNode {
        private final String op;
        private final MatlabNode left;
        private final MatlabNode right;

        public BinaryOp(String op, MatlabNode left, MatlabNode right) {
            this.op = Objects.requireNonNull(op);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        public String getOp() { return op; }
        public MatlabNode getLeft() { return left; }
        public MatlabNode getRight() { return right; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitBinaryOp(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof BinaryOp)) {
                return false;
            }
            BinaryOp other = (BinaryOp) o;
            return op.equals(other.op) && left.equals(other.left) && right.equals(other.right);
        }

        @Override
        public int hashCode() { return Objects.hash("binary", op, left, right); }

        @Override
        public String toString() { return describe("BinaryOp", "op", op, "left", left, "right", right); }
    }

    /** Three-operand range start:step:stop. */
    public static final class TernaryOp extends MatlabNode {
        private final MatlabNode left;
        private final MatlabNode middle;
        private final MatlabNode right;

        public TernaryOp(MatlabNode left, MatlabNode middle, MatlabNode right) {
            this.left = Objects.requireNonNull(left);
            this.middle = Objects.requireNonNull(middle);
            this.right = Objects.requireNonNull(right);
        }

        public MatlabNode getLeft() { return left; }
        public MatlabNode getMiddle() { return middle; }
        public MatlabNode getRight() { return right; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitTernaryOp(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof TernaryOp)) {
                return false;
            }
            TernaryOp other = (TernaryOp) o;
            return left.equals(other.left) && middle.equals(other.middle) && right.equals(other.right);
        }

        @Override
        public int hashCode() { return Objects.hash("ternary", left, middle, right); }

        @Override
        public String toString() { return describe("TernaryOp", "left", left, "middle", middle, "right", right); }
    }

    /** Postfix "'" (conjugate transpose) or ".'" (plain transpose). */
    public static final class Transpose extends MatlabNode {
        private final String op;
        private final MatlabNode operand;

        public Transpose(String op, MatlabNode operand) {
            this.op = Objects.requireNonNull(op);
            this.operand = Objects.requireNonNull(operand);
        }

        public String getOp() { return op; }
        public MatlabNode getOperand() { return operand; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitTranspose(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Transpose)) {
                return false;
            }
            Transpose other = (Transpose) o;
            return op.equals(other.op) && operand.equals(other.operand);
        }

        @Override
        public int hashCode() { return Objects.hash("transpose", op, operand); }

        @Override
        public String toString() { return describe("Transpose", "op", op, "operand", operand); }
    }

    // =====================================================================
    // STATEMENTS
    // =====================================================================

    public static final class Assignment extends MatlabNode {
        private final MatlabNode lhs;
        private final MatlabNode rhs;

        public Assignment(MatlabNode lhs, MatlabNode rhs) {
            this.lhs = Objects.requireNonNull(lhs);
            this.rhs = Objects.requireNonNull(rhs);
        }

        public MatlabNode getLhs() { return lhs; }
        public MatlabNode getRhs() { return rhs; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitAssignment(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Assignment)) {
                return false;
            }
            Assignment other = (Assignment) o;
            return lhs.equals(other.lhs) && rhs.equals(other.rhs);
        }

        @Override
        public int hashCode() { return Objects.hash("assign", lhs, rhs); }

        @Override
        public String toString() { return describe("Assignment", "lhs", lhs, "rhs", rhs); }
    }

    /** Function definition. Parameters and outputs may include Special("~"). */
    public static final class FunDef extends MatlabNode {
        private final Identifier name;
        private final List<MatlabNode> params;
        private final List<MatlabNode> returns;
        private final List<MatlabNode> body;

        public FunDef(Identifier name, List<? extends MatlabNode> params,
                      List<? extends MatlabNode> returns, List<? extends MatlabNode> body) {
            this.name = Objects.requireNonNull(name);
            this.params = copy(params);
            this.returns = copy(returns);
            this.body = copy(body);
        }

        public Identifier getName() { return name; }
        public List<MatlabNode> getParams() { return params; }
        public List<MatlabNode> getReturns() { return returns; }
        public List<MatlabNode> getBody() { return body; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitFunDef(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof FunDef)) {
                return false;
            }
            FunDef other = (FunDef) o;
            return name.equals(other.name) && params.equals(other.params)
                && returns.equals(other.returns) && body.equals(other.body);
        }

        @Override
        public int hashCode() { return Objects.hash("fundef", name, params, returns, body); }

        @Override
        public String toString() {
            return describe("FunDef", "name", name, "params", params, "returns", returns, "body", body);
        }
    }

    public static final class If extends MatlabNode {
        private final MatlabNode condition;
        private final List<MatlabNode> body;
        private final List<Elseif> elseifs;
        private final Else elseClause;

        public If(MatlabNode condition, List<? extends MatlabNode> body, List<Elseif> elseifs, Else elseClause) {
            this.condition = Objects.requireNonNull(condition);
            this.body = copy(body);
            this.elseifs = copy(elseifs);
            this.elseClause = elseClause;
        }

        public MatlabNode getCondition() { return condition; }
        public List<MatlabNode> getBody() { return body; }
        public List<Elseif> getElseifs() { return elseifs; }

        /** The else branch, or null when there is none. */
        public Else getElseClause() { return elseClause; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitIf(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof If)) {
                return false;
            }
            If other = (If) o;
            return condition.equals(other.condition) && body.equals(other.body)
                && elseifs.equals(other.elseifs) && Objects.equals(elseClause, other.elseClause);
        }

        @Override
        public int hashCode() { return Objects.hash("if", condition, body, elseifs, elseClause); }

        @Override
        public String toString() {
            return describe("If", "condition", condition, "body", body, "elseifs", elseifs, "else", elseClause);
        }
    }

    public static final class Elseif extends MatlabNode {
        private final MatlabNode condition;
        private final List<MatlabNode> body;

        public Elseif(MatlabNode condition, List<? extends MatlabNode> body) {
            this.condition = Objects.requireNonNull(condition);
            this.body = copy(body);
        }

        public MatlabNode getCondition() { return condition; }
        public List<MatlabNode> getBody() { return body; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitElseif(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Elseif)) {
                return false;
            }
            Elseif other = (Elseif) o;
            return condition.equals(other.condition) && body.equals(other.body);
        }

        @Override
        public int hashCode() { return Objects.hash("elseif", condition, body); }

        @Override
        public String toString() { return describe("Elseif", "condition", condition, "body", body); }
    }

    public static final class Else extends MatlabNode {
        private final List<MatlabNode> body;

        public Else(List<? extends MatlabNode> body) {
            this.body = copy(body);
        }

        public List<MatlabNode> getBody() { return body; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitElse(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Else && body.equals(((Else) o).body);
        }

        @Override
        public int hashCode() { return Objects.hash("else", body); }

        @Override
        public String toString() { return describe("Else", "body", body); }
    }

    public static final class While extends MatlabNode {
        private final MatlabNode condition;
        private final List<MatlabNode> body;

        public While(MatlabNode condition, List<? extends MatlabNode> body) {
            this.condition = Objects.requireNonNull(condition);
            this.body = copy(body);
        }

        public MatlabNode getCondition() { return condition; }
        public List<MatlabNode> getBody() { return body; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitWhile(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof While)) {
                return false;
            }
            While other = (While) o;
            return condition.equals(other.condition) && body.equals(other.body);
        }

        @Override
        public int hashCode() { return Objects.hash("while", condition, body); }

        @Override
        public String toString() { return describe("While", "condition", condition, "body", body); }
    }

    public static final class For extends MatlabNode {
        private final Identifier variable;
        private final MatlabNode expression;
        private final List<MatlabNode> body;

        public For(Identifier variable, MatlabNode expression, List<? extends MatlabNode> body) {
            this.variable = Objects.requireNonNull(variable);
            this.expression = Objects.requireNonNull(expression);
            this.body = copy(body);
        }

        public Identifier getVariable() { return variable; }
        public MatlabNode getExpression() { return expression; }
        public List<MatlabNode> getBody() { return body; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitFor(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof For)) {
                return false;
            }
            For other = (For) o;
            return variable.equals(other.variable) && expression.equals(other.expression) && body.equals(other.body);
        }

        @Override
        public int hashCode() { return Objects.hash("for", variable, expression, body); }

        @Override
        public String toString() { return describe("For", "variable", variable, "expression", expression, "body", body); }
    }

    public static final class Switch extends MatlabNode {
        private final MatlabNode subject;
        private final List<Case> cases;
        private final Otherwise otherwise;

        public Switch(MatlabNode subject, List<Case> cases, Otherwise otherwise) {
            this.subject = Objects.requireNonNull(subject);
            this.cases = copy(cases);
            this.otherwise = otherwise;
        }

        public MatlabNode getSubject() { return subject; }
        public List<Case> getCases() { return cases; }

        /** The otherwise branch, or null when there is none. */
        public Otherwise getOtherwise() { return otherwise; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitSwitch(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Switch)) {
                return false;
            }
            Switch other = (Switch) o;
            return subject.equals(other.subject) && cases.equals(other.cases) && Objects.equals(otherwise, other.otherwise);
        }

        @Override
        public int hashCode() { return Objects.hash("switch", subject, cases, otherwise); }

        @Override
        public String toString() { return describe("Switch", "subject", subject, "cases", cases, "otherwise", otherwise); }
    }

    public static final class Case extends MatlabNode {
        private final MatlabNode value;
        private final List<MatlabNode> body;

        public Case(MatlabNode value, List<? extends MatlabNode> body) {
            this.value = Objects.requireNonNull(value);
            this.body = copy(body);
        }

        public MatlabNode getValue() { return value; }
        public List<MatlabNode> getBody() { return body; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitCase(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Case)) {
                return false;
            }
            Case other = (Case) o;
            return value.equals(other.value) && body.equals(other.body);
        }

        @Override
        public int hashCode() { return Objects.hash("case", value, body); }

        @Override
        public String toString() { return describe("Case", "value", value, "body", body); }
    }

    public static final class Otherwise extends MatlabNode {
        private final List<MatlabNode> body;

        public Otherwise(List<? extends MatlabNode> body) {
            this.body = copy(body);
        }

        public List<MatlabNode> getBody() { return body; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitOtherwise(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Otherwise && body.equals(((Otherwise) o).body);
        }

        @Override
        public int hashCode() { return Objects.hash("otherwise", body); }

        @Override
        public String toString() { return describe("Otherwise", "body", body); }
    }

    /** try/catch; catchVariable is null when the catch names no exception. */
    public static final class TryCatch extends MatlabNode {
        private final List<MatlabNode> body;
        private final Identifier catchVariable;
        private final List<MatlabNode> catchBody;

        public TryCatch(List<? extends MatlabNode> body, Identifier catchVariable, List<? extends MatlabNode> catchBody) {
            this.body = copy(body);
            this.catchVariable = catchVariable;
            this.catchBody = copy(catchBody);
        }

        public List<MatlabNode> getBody() { return body; }
        public Identifier getCatchVariable() { return catchVariable; }
        public List<MatlabNode> getCatchBody() { return catchBody; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitTryCatch(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof TryCatch)) {
                return false;
            }
            TryCatch other = (TryCatch) o;
            return body.equals(other.body) && Objects.equals(catchVariable, other.catchVariable)
                && catchBody.equals(other.catchBody);
        }

        @Override
        public int hashCode() { return Objects.hash("try", body, catchVariable, catchBody); }

        @Override
        public String toString() {
            return describe("TryCatch", "body", body, "catchVariable", catchVariable, "catchBody", catchBody);
        }
    }

    public static final class Branch extends MatlabNode {
        public enum Kind { BREAK, CONTINUE, RETURN }

        private final Kind kind;

        public Branch(Kind kind) {
            this.kind = Objects.requireNonNull(kind);
        }

        public Kind getKind() { return kind; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitBranch(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Branch && kind == ((Branch) o).kind;
        }

        @Override
        public int hashCode() { return Objects.hash("branch", kind); }

        @Override
        public String toString() { return describe("Branch", "kind", kind); }
    }

    /** "!command", passed to the operating system; a trailing "&" runs it in the background. */
    public static final class ShellCommand extends MatlabNode {
        private final String command;
        private final boolean background;

        public ShellCommand(String command, boolean background) {
            this.command = Objects.requireNonNull(command);
            this.background = background;
        }

        public String getCommand() { return command; }
        public boolean isBackground() { return background; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitShellCommand(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ShellCommand)) {
                return false;
            }
            ShellCommand other = (ShellCommand) o;
            return command.equals(other.command) && background == other.background;
        }

        @Override
        public int hashCode() { return Objects.hash("shell", command, background); }

        @Override
        public String toString() { return describe("ShellCommand", "command", command, "background", background); }
    }

    /** Command syntax such as "hold on"; also global and persistent declarations. */
    public static final class MatlabCommand extends MatlabNode {
        private final String name;
        private final List<String> args;

        public MatlabCommand(String name, List<String> args) {
            this.name = Objects.requireNonNull(name);
            this.args = copy(args);
        }

        public String getName() { return name; }
        public List<String> getArgs() { return args; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitMatlabCommand(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof MatlabCommand)) {
                return false;
            }
            MatlabCommand other = (MatlabCommand) o;
            return name.equals(other.name) && args.equals(other.args);
        }

        @Override
        public int hashCode() { return Objects.hash("command", name, args); }

        @Override
        public String toString() { return describe("MatlabCommand", "name", name, "args", args); }
    }

    /** Comment text without the leading "%" (or the "%{ %}" markers for block comments). */
    public static final class Comment extends MatlabNode {
        private final String text;
        private final boolean block;

        public Comment(String text, boolean block) {
            this.text = Objects.requireNonNull(text);
            this.block = block;
        }

        public String getText() { return text; }
        public boolean isBlock() { return block; }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitComment(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Comment)) {
                return false;
            }
            Comment other = (Comment) o;
            return text.equals(other.text) && block == other.block;
        }

        @Override
        public int hashCode() { return Objects.hash("comment", text, block); }

        @Override
        public String toString() { return describe("Comment", "text", text, "block", block); }
    }
}
