package matlabode;

import matlabode.MatlabNode.*;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Builds {@link MatlabNode} trees from the parse tree.
 *
 * This pass is purely syntactic: every "name(args)" becomes an
 * {@link ArrayOrFunCall} and no symbol information is consulted.
 * {@link MatlabSemanticAnalyzer} decides kinds afterwards.
 */
public class MatlabNodeBuilder extends MatlabBaseVisitor<MatlabNode> {

    private static final Logger log = LoggerFactory.getLogger(MatlabNodeBuilder.class);

    /**
     * Statements of the program, in document order. Unsupported constructs
     * abort the build with a {@link ParseCancellationException} whose cause
     * is an {@link UnsupportedConstructException}.
     */
    public List<MatlabNode> buildProgram(MatlabParser.ProgramContext ctx) {
        List<MatlabNode> nodes = buildBlock(ctx.block());
        log.debug("Built {} top-level node(s)", nodes.size());
        return nodes;
    }

    // =====================================================================
    // BLOCKS AND FUNCTIONS
    // =====================================================================

    private List<MatlabNode> buildBlock(MatlabParser.BlockContext ctx) {
        List<MatlabNode> nodes = new ArrayList<>();
        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            if (child instanceof MatlabParser.SeparatorContext) {
                MatlabNode comment = buildComment((MatlabParser.SeparatorContext) child);
                if (comment != null) {
                    nodes.add(comment);
                }
            } else if (child instanceof MatlabParser.StatementContext) {
                MatlabParser.StatementContext statement = (MatlabParser.StatementContext) child;
                if (statement.functionDef() != null) {
                    nodes.addAll(buildFunctionDef(statement.functionDef()));
                } else {
                    nodes.add(visit(statement.getChild(0)));
                }
            }
        }
        return nodes;
    }

    private MatlabNode buildComment(MatlabParser.SeparatorContext ctx) {
        if (ctx.COMMENT() != null) {
            return new Comment(ctx.COMMENT().getText().substring(1), false);
        }
        if (ctx.BLOCK_COMMENT() != null) {
            String text = ctx.BLOCK_COMMENT().getText();
            return new Comment(text.substring(2, text.length() - 2), true);
        }
        return null;
    }

    /**
     * The definition itself, followed by any sibling functions hoisted out of
     * its body. In a file whose functions have no closing "end", each
     * "function" line starts a new sibling rather than a nested function, but
     * the grammar can only see it as a statement of the preceding body.
     */
    private List<MatlabNode> buildFunctionDef(MatlabParser.FunctionDefContext ctx) {
        List<MatlabNode> body = new ArrayList<>();
        List<MatlabNode> siblings = new ArrayList<>();
        boolean open = ctx.END() == null;

        MatlabParser.BlockContext block = ctx.block();
        for (int i = 0; i < block.getChildCount(); i++) {
            ParseTree child = block.getChild(i);
            if (open && child instanceof MatlabParser.StatementContext
                    && ((MatlabParser.StatementContext) child).functionDef() != null
                    && ((MatlabParser.StatementContext) child).functionDef().END() == null) {
                siblings.addAll(buildFunctionDef(((MatlabParser.StatementContext) child).functionDef()));
            } else if (!siblings.isEmpty()) {
                // Trailing separators after a hoisted function belong to it
                continue;
            } else if (child instanceof MatlabParser.SeparatorContext) {
                MatlabNode comment = buildComment((MatlabParser.SeparatorContext) child);
                if (comment != null) {
                    body.add(comment);
                }
            } else if (child instanceof MatlabParser.StatementContext) {
                MatlabParser.StatementContext statement = (MatlabParser.StatementContext) child;
                if (statement.functionDef() != null) {
                    body.addAll(buildFunctionDef(statement.functionDef()));
                } else {
                    body.add(visit(statement.getChild(0)));
                }
            }
        }

        List<MatlabNode> returns = new ArrayList<>();
        MatlabParser.FunctionOutputsContext outputs = ctx.functionOutputs();
        if (outputs != null) {
            if (outputs.ID() != null) {
                returns.add(new Identifier(outputs.ID().getText()));
            } else {
                for (MatlabParser.ParameterNameContext name : outputs.parameterName()) {
                    returns.add(buildParameterName(name));
                }
            }
        }

        List<MatlabNode> params = new ArrayList<>();
        if (ctx.functionParameters() != null) {
            for (MatlabParser.ParameterNameContext name : ctx.functionParameters().parameterName()) {
                params.add(buildParameterName(name));
            }
        }

        List<MatlabNode> result = new ArrayList<>();
        result.add(new FunDef(new Identifier(ctx.ID().getText()), params, returns, body));
        result.addAll(siblings);
        return result;
    }

    private MatlabNode buildParameterName(MatlabParser.ParameterNameContext ctx) {
        return ctx.NOT() != null ? new Special(Special.TILDE) : new Identifier(ctx.ID().getText());
    }

    // =====================================================================
    // CONTROL FLOW
    // =====================================================================

    @Override
    public MatlabNode visitIfStatement(MatlabParser.IfStatementContext ctx) {
        List<Elseif> elseifs = new ArrayList<>();
        for (MatlabParser.ElseifClauseContext clause : ctx.elseifClause()) {
            elseifs.add(new Elseif(visit(clause.expression()), buildBlock(clause.block())));
        }
        Else elseClause = ctx.elseClause() == null ? null : new Else(buildBlock(ctx.elseClause().block()));
        return new If(visit(ctx.expression()), buildBlock(ctx.block()), elseifs, elseClause);
    }

    @Override
    public MatlabNode visitWhileStatement(MatlabParser.WhileStatementContext ctx) {
        return new While(visit(ctx.expression()), buildBlock(ctx.block()));
    }

    @Override
    public MatlabNode visitForStatement(MatlabParser.ForStatementContext ctx) {
        return new For(new Identifier(ctx.ID().getText()), visit(ctx.expression()), buildBlock(ctx.block()));
    }

    @Override
    public MatlabNode visitSwitchStatement(MatlabParser.SwitchStatementContext ctx) {
        List<Case> cases = new ArrayList<>();
        for (MatlabParser.CaseClauseContext clause : ctx.caseClause()) {
            cases.add(new Case(visit(clause.expression()), buildBlock(clause.block())));
        }
        Otherwise otherwise = ctx.otherwiseClause() == null
            ? null : new Otherwise(buildBlock(ctx.otherwiseClause().block()));
        return new Switch(visit(ctx.expression()), cases, otherwise);
    }

    @Override
    public MatlabNode visitTryStatement(MatlabParser.TryStatementContext ctx) {
        MatlabParser.CatchClauseContext clause = ctx.catchClause();
        if (clause == null) {
            return new TryCatch(buildBlock(ctx.block()), null, Collections.<MatlabNode>emptyList());
        }
        Identifier variable = clause.ID() == null ? null : new Identifier(clause.ID().getText());
        return new TryCatch(buildBlock(ctx.block()), variable, buildBlock(clause.block()));
    }

    @Override
    public MatlabNode visitBranchStatement(MatlabParser.BranchStatementContext ctx) {
        if (ctx.BREAK() != null) {
            return new Branch(Branch.Kind.BREAK);
        }
        return new Branch(ctx.CONTINUE() != null ? Branch.Kind.CONTINUE : Branch.Kind.RETURN);
    }

    // =====================================================================
    // SIMPLE STATEMENTS
    // =====================================================================

    @Override
    public MatlabNode visitScopeDeclaration(MatlabParser.ScopeDeclarationContext ctx) {
        List<String> names = new ArrayList<>();
        for (TerminalNode id : ctx.ID()) {
            names.add(id.getText());
        }
        return new MatlabCommand(ctx.getStart().getText(), names);
    }

    @Override
    public MatlabNode visitCommandStatement(MatlabParser.CommandStatementContext ctx) {
        List<String> args = new ArrayList<>();
        for (TerminalNode arg : ctx.COMMAND_ARG()) {
            args.add(arg.getText());
        }
        return new MatlabCommand(ctx.COMMAND_NAME().getText(), args);
    }

    @Override
    public MatlabNode visitShellCommand(MatlabParser.ShellCommandContext ctx) {
        String command = ctx.SHELL_COMMAND().getText().substring(1).trim();
        boolean background = command.endsWith("&");
        if (background) {
            command = command.substring(0, command.length() - 1).trim();
        }
        return new ShellCommand(command, background);
    }

    @Override
    public MatlabNode visitAssignment(MatlabParser.AssignmentContext ctx) {
        MatlabParser.AssignmentTargetContext target = ctx.assignmentTarget();
        MatlabNode lhs = target.reference() != null
            ? buildReference(target.reference())
            : buildArray(false, target.matrix().row());
        return new Assignment(lhs, visit(ctx.expression()));
    }

    @Override
    public MatlabNode visitExpressionStatement(MatlabParser.ExpressionStatementContext ctx) {
        return visit(ctx.expression());
    }

    // =====================================================================
    // OPERATORS
    // =====================================================================

    @Override
    public MatlabNode visitTransposeExpr(MatlabParser.TransposeExprContext ctx) {
        return new Transpose(ctx.op.getText(), visit(ctx.expression()));
    }

    @Override
    public MatlabNode visitPowerExpr(MatlabParser.PowerExprContext ctx) {
        return binary(ctx.op, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public MatlabNode visitUnaryExpr(MatlabParser.UnaryExprContext ctx) {
        return new UnaryOp(ctx.op.getText(), visit(ctx.expression()));
    }

    @Override
    public MatlabNode visitMultiplicativeExpr(MatlabParser.MultiplicativeExprContext ctx) {
        return binary(ctx.op, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public MatlabNode visitAdditiveExpr(MatlabParser.AdditiveExprContext ctx) {
        return binary(ctx.op, ctx.expression(0), ctx.expression(1));
    }

    /** "a:b:c" parses as (a:b):c and is folded into a ternary; "(a:b):c" is not. */
    @Override
    public MatlabNode visitRangeExpr(MatlabParser.RangeExprContext ctx) {
        MatlabNode left = visit(ctx.expression(0));
        MatlabNode right = visit(ctx.expression(1));
        if (ctx.expression(0) instanceof MatlabParser.RangeExprContext && left instanceof BinaryOp
                && ":".equals(((BinaryOp) left).getOp())) {
            BinaryOp range = (BinaryOp) left;
            return new TernaryOp(range.getLeft(), range.getRight(), right);
        }
        return new BinaryOp(":", left, right);
    }

    @Override
    public MatlabNode visitRelationalExpr(MatlabParser.RelationalExprContext ctx) {
        return binary(ctx.op, ctx.expression(0), ctx.expression(1));
    }

    @Override
    public MatlabNode visitElementAndExpr(MatlabParser.ElementAndExprContext ctx) {
        return new BinaryOp("&", visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public MatlabNode visitElementOrExpr(MatlabParser.ElementOrExprContext ctx) {
        return new BinaryOp("|", visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public MatlabNode visitShortAndExpr(MatlabParser.ShortAndExprContext ctx) {
        return new BinaryOp("&&", visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public MatlabNode visitShortOrExpr(MatlabParser.ShortOrExprContext ctx) {
        return new BinaryOp("||", visit(ctx.expression(0)), visit(ctx.expression(1)));
    }

    @Override
    public MatlabNode visitPrimaryExpr(MatlabParser.PrimaryExprContext ctx) {
        return visit(ctx.primary());
    }

    private MatlabNode binary(Token op, MatlabParser.ExpressionContext left, MatlabParser.ExpressionContext right) {
        return new BinaryOp(op.getText(), visit(left), visit(right));
    }

    // =====================================================================
    // PRIMARIES
    // =====================================================================

    @Override
    public MatlabNode visitReferencePrimary(MatlabParser.ReferencePrimaryContext ctx) {
        MatlabParser.ReferenceContext reference = ctx.reference();
        if (reference.referenceSuffix().isEmpty()) {
            String name = reference.ID().getText();
            if ("true".equals(name) || "false".equals(name)) {
                return new BooleanLiteral("true".equals(name));
            }
        }
        return buildReference(reference);
    }

    @Override
    public MatlabNode visitNumberPrimary(MatlabParser.NumberPrimaryContext ctx) {
        return new NumberLiteral(ctx.NUMBER().getText());
    }

    @Override
    public MatlabNode visitImaginaryPrimary(MatlabParser.ImaginaryPrimaryContext ctx) {
        throw unsupported("the complex number " + ctx.getText(), ctx);
    }

    @Override
    public MatlabNode visitStringPrimary(MatlabParser.StringPrimaryContext ctx) {
        if (ctx.STRING() != null) {
            String text = ctx.STRING().getText();
            return new StringLiteral(text.substring(1, text.length() - 1).replace("''", "'"), false);
        }
        String text = ctx.DQSTRING().getText();
        return new StringLiteral(text.substring(1, text.length() - 1).replace("\"\"", "\""), true);
    }

    @Override
    public MatlabNode visitEndPrimary(MatlabParser.EndPrimaryContext ctx) {
        return new Special(Special.END);
    }

    @Override
    public MatlabNode visitMatrixPrimary(MatlabParser.MatrixPrimaryContext ctx) {
        return buildArray(false, ctx.matrix().row());
    }

    @Override
    public MatlabNode visitCellPrimary(MatlabParser.CellPrimaryContext ctx) {
        return buildArray(true, ctx.cellArray().row());
    }

    @Override
    public MatlabNode visitHandlePrimary(MatlabParser.HandlePrimaryContext ctx) {
        return new FunHandle(new Identifier(ctx.ID().getText()));
    }

    @Override
    public MatlabNode visitAnonymousPrimary(MatlabParser.AnonymousPrimaryContext ctx) {
        List<MatlabNode> params = new ArrayList<>();
        for (MatlabParser.ParameterNameContext name : ctx.parameterName()) {
            params.add(buildParameterName(name));
        }
        return new AnonFun(params, visit(ctx.expression()));
    }

    @Override
    public MatlabNode visitParenPrimary(MatlabParser.ParenPrimaryContext ctx) {
        return visit(ctx.expression());
    }

    // =====================================================================
    // REFERENCES AND ARRAYS
    // =====================================================================

    private MatlabNode buildReference(MatlabParser.ReferenceContext ctx) {
        MatlabNode node = new Identifier(ctx.ID().getText());
        for (MatlabParser.ReferenceSuffixContext suffix : ctx.referenceSuffix()) {
            if (suffix instanceof MatlabParser.CallOrIndexSuffixContext) {
                node = new ArrayOrFunCall(node, buildArguments(((MatlabParser.CallOrIndexSuffixContext) suffix).arguments()));
            } else if (suffix instanceof MatlabParser.CellIndexSuffixContext) {
                node = new ArrayRef(node, buildArguments(((MatlabParser.CellIndexSuffixContext) suffix).arguments()), true);
            } else if (suffix instanceof MatlabParser.FieldSuffixContext) {
                node = new StructRef(node, new Identifier(((MatlabParser.FieldSuffixContext) suffix).ID().getText()), false);
            } else {
                if (node instanceof StructRef && ((StructRef) node).isDynamicAccess()) {
                    throw unsupported("a multi-level dynamic field reference", suffix);
                }
                MatlabParser.DynamicFieldSuffixContext dynamic = (MatlabParser.DynamicFieldSuffixContext) suffix;
                node = new StructRef(node, visit(dynamic.expression()), true);
            }
        }
        return node;
    }

    private List<MatlabNode> buildArguments(MatlabParser.ArgumentsContext ctx) {
        List<MatlabNode> args = new ArrayList<>();
        if (ctx != null) {
            for (MatlabParser.ArgumentContext argument : ctx.argument()) {
                args.add(argument.COLON() != null ? new Special(Special.COLON) : visit(argument.expression()));
            }
        }
        return args;
    }

    private Array buildArray(boolean cell, List<MatlabParser.RowContext> rowContexts) {
        List<List<MatlabNode>> rows = new ArrayList<>();
        for (MatlabParser.RowContext row : rowContexts) {
            List<MatlabNode> elements = new ArrayList<>();
            for (MatlabParser.ElementContext element : row.element()) {
                elements.add(element.NOT() != null ? new Special(Special.TILDE) : visit(element.expression()));
            }
            rows.add(elements);
        }
        return new Array(cell, rows);
    }

    private static ParseCancellationException unsupported(String construct, ParserRuleContext ctx) {
        Token start = ctx.getStart();
        return new ParseCancellationException(
            new UnsupportedConstructException(construct, start.getLine(), start.getCharPositionInLine() + 1));
    }
}
