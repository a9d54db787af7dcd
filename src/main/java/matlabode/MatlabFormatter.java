package matlabode;

import matlabode.MatlabNode.*;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Renders nodes back to MATLAB source.
 *
 * Normal mode produces readable code that parses back to equal nodes.
 * Compact mode drops all optional whitespace and is used for the normalized
 * assignment keys of {@link MatlabContext}: "x", "x(1)", "c{2}", "s.f",
 * "[t,y]".
 */
public final class MatlabFormatter implements MatlabNode.Visitor<String> {

    private static final String INDENT = "    ";
    private static final Pattern PLAIN_COMMAND_WORD = Pattern.compile("-?[A-Za-z0-9_][A-Za-z0-9_.]*");

    // Binding strength, loosest first
    private static final int ANONYMOUS = 1;
    private static final int SHORT_OR = 2;
    private static final int SHORT_AND = 3;
    private static final int ELEMENT_OR = 4;
    private static final int ELEMENT_AND = 5;
    private static final int RELATIONAL = 6;
    private static final int RANGE = 7;
    private static final int ADDITIVE = 8;
    private static final int MULTIPLICATIVE = 9;
    private static final int POWER = 10;
    private static final int UNARY = 11;
    private static final int POSTFIX = 12;
    private static final int ATOM = 13;

    private final boolean compact;
    private int depth;

    private MatlabFormatter(boolean compact) {
        this.compact = compact;
    }

    /** Source text for a statement list, one statement per line. */
    public static String format(List<? extends MatlabNode> nodes) {
        return new MatlabFormatter(false).lines(nodes);
    }

    public static String format(MatlabNode node) {
        return new MatlabFormatter(false).statement(node);
    }

    /** Whitespace-free rendering used as an assignment key. */
    public static String toKey(MatlabNode node) {
        return new MatlabFormatter(true).expression(node);
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    private String pad() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
        return sb.toString();
    }

    private String lines(List<? extends MatlabNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (MatlabNode node : nodes) {
            sb.append(statement(node)).append('\n');
        }
        return sb.toString();
    }

    private String body(List<? extends MatlabNode> nodes) {
        depth++;
        try {
            return lines(nodes);
        } finally {
            depth--;
        }
    }

    private String statement(MatlabNode node) {
        return isStatement(node) ? node.accept(this) : pad() + expression(node);
    }

    private static boolean isStatement(MatlabNode node) {
        return node instanceof Assignment || node instanceof FunDef || node instanceof If
            || node instanceof Elseif || node instanceof Else || node instanceof While
            || node instanceof For || node instanceof Switch || node instanceof Case
            || node instanceof Otherwise || node instanceof TryCatch || node instanceof Branch
            || node instanceof ShellCommand || node instanceof MatlabCommand || node instanceof Comment;
    }

    private String expression(MatlabNode node) {
        return node.accept(this);
    }

    private String separator() {
        return compact ? "," : ", ";
    }

    private String join(List<? extends MatlabNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (MatlabNode node : nodes) {
            if (sb.length() > 0) {
                sb.append(separator());
            }
            sb.append(expression(node));
        }
        return sb.toString();
    }

    private static int precedence(MatlabNode node) {
        if (node instanceof AnonFun) {
            return ANONYMOUS;
        } else if (node instanceof Transpose) {
            return POSTFIX;
        } else if (node instanceof UnaryOp) {
            return UNARY;
        } else if (node instanceof TernaryOp) {
            return RANGE;
        } else if (node instanceof BinaryOp) {
            return precedence(((BinaryOp) node).getOp());
        }
        return ATOM;
    }

    private static int precedence(String op) {
        switch (op) {
            case "||": return SHORT_OR;
            case "&&": return SHORT_AND;
            case "|": return ELEMENT_OR;
            case "&": return ELEMENT_AND;
            case "<": case "<=": case ">": case ">=": case "==": case "~=": return RELATIONAL;
            case ":": return RANGE;
            case "+": case "-": return ADDITIVE;
            case "^": case ".^": return POWER;
            default: return MULTIPLICATIVE;
        }
    }

    private String operand(MatlabNode node, boolean parenthesize) {
        String text = expression(node);
        return parenthesize ? "(" + text + ")" : text;
    }

    // =====================================================================
    // LITERALS AND VALUES
    // =====================================================================

    @Override
    public String visitNumberLiteral(NumberLiteral node) {
        return node.getText();
    }

    @Override
    public String visitStringLiteral(StringLiteral node) {
        if (node.isDoubleQuoted()) {
            return '"' + node.getValue().replace("\"", "\"\"") + '"';
        }
        return '\'' + node.getValue().replace("'", "''") + '\'';
    }

    @Override
    public String visitBooleanLiteral(BooleanLiteral node) {
        return node.getValue() ? "true" : "false";
    }

    @Override
    public String visitSpecial(Special node) {
        return node.getValue();
    }

    @Override
    public String visitArray(Array node) {
        StringBuilder sb = new StringBuilder(node.isCell() ? "{" : "[");
        boolean firstRow = true;
        for (List<MatlabNode> row : node.getRows()) {
            if (!firstRow) {
                sb.append(compact ? ";" : "; ");
            }
            firstRow = false;
            boolean firstElement = true;
            for (MatlabNode element : row) {
                if (!firstElement) {
                    sb.append(separator());
                }
                firstElement = false;
                // Spaces inside an anonymous function would split the element
                sb.append(operand(element, element instanceof AnonFun));
            }
        }
        return sb.append(node.isCell() ? "}" : "]").toString();
    }

    @Override
    public String visitFunHandle(FunHandle node) {
        return "@" + node.getName().getName();
    }

    @Override
    public String visitAnonFun(AnonFun node) {
        return "@(" + join(node.getParams()) + (compact ? ")" : ") ") + expression(node.getBody());
    }

    // =====================================================================
    // REFERENCES
    // =====================================================================

    @Override
    public String visitIdentifier(Identifier node) {
        return node.getName();
    }

    @Override
    public String visitArrayRef(ArrayRef node) {
        String open = node.isCell() ? "{" : "(";
        String close = node.isCell() ? "}" : ")";
        return expression(node.getName()) + open + join(node.getArgs()) + close;
    }

    @Override
    public String visitFunCall(FunCall node) {
        return expression(node.getName()) + "(" + join(node.getArgs()) + ")";
    }

    @Override
    public String visitArrayOrFunCall(ArrayOrFunCall node) {
        return expression(node.getName()) + "(" + join(node.getArgs()) + ")";
    }

    @Override
    public String visitStructRef(StructRef node) {
        if (node.isDynamicAccess()) {
            return expression(node.getBase()) + ".(" + expression(node.getField()) + ")";
        }
        return expression(node.getBase()) + "." + expression(node.getField());
    }

    // =====================================================================
    // OPERATORS
    // =====================================================================

    @Override
    public String visitUnaryOp(UnaryOp node) {
        return node.getOp() + operand(node.getOperand(), precedence(node.getOperand()) < UNARY);
    }

    @Override
    public String visitBinaryOp(BinaryOp node) {
        int level = precedence(node.getOp());
        // Ranges never nest without parentheses; "a:b:c" would read back as a ternary
        boolean range = level == RANGE;
        int left = precedence(node.getLeft());
        int right = precedence(node.getRight());
        String space = compact ? "" : " ";
        boolean tight = compact || range || level == POWER;
        String op = tight ? node.getOp() : space + node.getOp() + space;
        return operand(node.getLeft(), range ? left <= RANGE : left < level)
            + op
            + operand(node.getRight(), right <= level);
    }

    @Override
    public String visitTernaryOp(TernaryOp node) {
        return operand(node.getLeft(), precedence(node.getLeft()) <= RANGE)
            + ":" + operand(node.getMiddle(), precedence(node.getMiddle()) <= RANGE)
            + ":" + operand(node.getRight(), precedence(node.getRight()) <= RANGE);
    }

    @Override
    public String visitTranspose(Transpose node) {
        // A quote right after a string literal would continue the string
        boolean parens = precedence(node.getOperand()) < POSTFIX || node.getOperand() instanceof StringLiteral;
        return operand(node.getOperand(), parens) + node.getOp();
    }

    // =====================================================================
    // STATEMENTS
    // =====================================================================

    @Override
    public String visitAssignment(Assignment node) {
        return pad() + expression(node.getLhs()) + (compact ? "=" : " = ") + expression(node.getRhs());
    }

    @Override
    public String visitFunDef(FunDef node) {
        StringBuilder sb = new StringBuilder(pad()).append("function ");
        List<MatlabNode> returns = node.getReturns();
        if (returns.size() == 1) {
            sb.append(expression(returns.get(0))).append(" = ");
        } else if (returns.size() > 1) {
            sb.append('[').append(join(returns)).append("] = ");
        }
        sb.append(node.getName().getName());
        sb.append('(').append(join(node.getParams())).append(")\n");
        sb.append(body(node.getBody()));
        return sb.append(pad()).append("end").toString();
    }

    @Override
    public String visitIf(If node) {
        StringBuilder sb = new StringBuilder(pad()).append("if ").append(expression(node.getCondition())).append('\n');
        sb.append(body(node.getBody()));
        for (Elseif clause : node.getElseifs()) {
            sb.append(visitElseif(clause)).append('\n');
        }
        if (node.getElseClause() != null) {
            sb.append(visitElse(node.getElseClause())).append('\n');
        }
        return sb.append(pad()).append("end").toString();
    }

    @Override
    public String visitElseif(Elseif node) {
        String text = pad() + "elseif " + expression(node.getCondition()) + "\n" + body(node.getBody());
        return text.substring(0, text.length() - 1);
    }

    @Override
    public String visitElse(Else node) {
        return pad() + "else" + trailing(body(node.getBody()));
    }

    @Override
    public String visitWhile(While node) {
        return pad() + "while " + expression(node.getCondition()) + "\n"
            + body(node.getBody()) + pad() + "end";
    }

    @Override
    public String visitFor(For node) {
        return pad() + "for " + node.getVariable().getName() + " = " + expression(node.getExpression()) + "\n"
            + body(node.getBody()) + pad() + "end";
    }

    @Override
    public String visitSwitch(Switch node) {
        StringBuilder sb = new StringBuilder(pad()).append("switch ").append(expression(node.getSubject())).append('\n');
        depth++;
        try {
            for (Case clause : node.getCases()) {
                sb.append(visitCase(clause)).append('\n');
            }
            if (node.getOtherwise() != null) {
                sb.append(visitOtherwise(node.getOtherwise())).append('\n');
            }
        } finally {
            depth--;
        }
        return sb.append(pad()).append("end").toString();
    }

    @Override
    public String visitCase(Case node) {
        return pad() + "case " + expression(node.getValue()) + trailing(body(node.getBody()));
    }

    @Override
    public String visitOtherwise(Otherwise node) {
        return pad() + "otherwise" + trailing(body(node.getBody()));
    }

    @Override
    public String visitTryCatch(TryCatch node) {
        StringBuilder sb = new StringBuilder(pad()).append("try\n").append(body(node.getBody()));
        if (node.getCatchVariable() != null || !node.getCatchBody().isEmpty()) {
            sb.append(pad()).append("catch");
            if (node.getCatchVariable() != null) {
                sb.append(' ').append(node.getCatchVariable().getName());
            }
            sb.append('\n').append(body(node.getCatchBody()));
        }
        return sb.append(pad()).append("end").toString();
    }

    @Override
    public String visitBranch(Branch node) {
        return pad() + node.getKind().name().toLowerCase(Locale.ROOT);
    }

    @Override
    public String visitShellCommand(ShellCommand node) {
        return pad() + "!" + node.getCommand() + (node.isBackground() ? " &" : "");
    }

    @Override
    public String visitMatlabCommand(MatlabCommand node) {
        StringBuilder sb = new StringBuilder(pad()).append(node.getName());
        for (String arg : node.getArgs()) {
            sb.append(' ');
            if (PLAIN_COMMAND_WORD.matcher(arg).matches()) {
                sb.append(arg);
            } else {
                sb.append('\'').append(arg.replace("'", "''")).append('\'');
            }
        }
        return sb.toString();
    }

    @Override
    public String visitComment(Comment node) {
        return pad() + (node.isBlock() ? "%{" + node.getText() + "%}" : "%" + node.getText());
    }

    // "\n" plus the body without its last newline, or nothing for an empty body
    private static String trailing(String body) {
        return body.isEmpty() ? "" : "\n" + body.substring(0, body.length() - 1);
    }
}
