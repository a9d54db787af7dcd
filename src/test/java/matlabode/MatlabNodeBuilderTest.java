package matlabode;

import matlabode.MatlabNode.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatlabNodeBuilderTest {

    private static List<MatlabNode> build(String text) throws OdeConversionException {
        return new MatlabASTParser().buildNodes(text, "test");
    }

    private static MatlabNode rhs(String text) throws OdeConversionException {
        List<MatlabNode> nodes = build(text);
        assertEquals(1, nodes.size(), "statements in " + text);
        return ((Assignment) nodes.get(0)).getRhs();
    }

    private static Identifier id(String name) {
        return new Identifier(name);
    }

    private static NumberLiteral num(String text) {
        return new NumberLiteral(text);
    }

    @SafeVarargs
    private static Array matrix(List<MatlabNode>... rows) {
        return new Array(false, Arrays.asList(rows));
    }

    private static List<MatlabNode> row(MatlabNode... elements) {
        return Arrays.asList(elements);
    }

    // =====================================================================
    // ARRAYS
    // =====================================================================

    @Test
    void rowVectorHasOneRow() throws Exception {
        assertEquals(matrix(row(num("1"), num("2"))), rhs("x = [1 2];"));
        assertEquals(matrix(row(num("1"), num("2"))), rhs("x = [1, 2];"));
    }

    @Test
    void semicolonAndNewlineStartRows() throws Exception {
        Array expected = matrix(row(num("1"), num("2")), row(num("3"), num("4")));
        assertEquals(expected, rhs("x = [1 2; 3 4];"));
        assertEquals(expected, rhs("x = [1 2\n3 4];"));
    }

    @Test
    void emptyMatrixAndCell() throws Exception {
        assertTrue(((Array) rhs("x = [];")).isEmpty());
        Array cell = (Array) rhs("c = {};");
        assertTrue(cell.isCell());
        assertTrue(cell.isEmpty());
    }

    @Test
    void spacingDecidesElementCount() throws Exception {
        assertEquals(matrix(row(id("a"), new UnaryOp("-", id("b")))), rhs("x = [a -b];"));
        assertEquals(matrix(row(new BinaryOp("-", id("a"), id("b")))), rhs("x = [a - b];"));
    }

    @Test
    void cellArrayHoldsMixedValues() throws Exception {
        Array cell = (Array) rhs("c = {1, 'two', [3 4]};");
        assertTrue(cell.isCell());
        assertEquals(row(num("1"), new StringLiteral("two", false), matrix(row(num("3"), num("4")))),
                     cell.getRows().get(0));
    }

    // =====================================================================
    // OPERATORS
    // =====================================================================

    @Test
    void unaryMinusBindsTighterThanPower() throws Exception {
        assertEquals(new BinaryOp("^", new UnaryOp("-", id("a")), id("b")), rhs("y = -a^b;"));
        assertEquals(new BinaryOp("^", num("2"), new UnaryOp("-", num("2"))), rhs("y = 2^-2;"));
    }

    @Test
    void multiplicationBindsTighterThanAddition() throws Exception {
        assertEquals(new BinaryOp("+", id("a"), new BinaryOp("*", id("b"), id("c"))), rhs("y = a + b * c;"));
        assertEquals(new BinaryOp("-", new BinaryOp("-", id("a"), id("b")), id("c")), rhs("y = a - b - c;"));
    }

    @Test
    void transposeBindsTightest() throws Exception {
        assertEquals(new BinaryOp("*", new Transpose("'", id("a")), id("b")), rhs("y = a'*b;"));
        assertEquals(new Transpose(".'", id("b")), rhs("y = b.';"));
    }

    @Test
    void logicalOperatorPrecedence() throws Exception {
        assertEquals(new BinaryOp("&", new BinaryOp("<", id("a"), id("b")), id("c")), rhs("y = a < b & c;"));
        assertEquals(new BinaryOp("||", id("a"), new BinaryOp("&&", id("b"), id("c"))), rhs("y = a || b && c;"));
    }

    @Test
    void threePartRangeIsTernary() throws Exception {
        assertEquals(new TernaryOp(num("1"), num("2"), num("10")), rhs("r = 1:2:10;"));
        assertEquals(new BinaryOp(":", new BinaryOp(":", num("1"), num("2")), num("10")), rhs("r = (1:2):10;"));
        assertEquals(new BinaryOp(":", num("1"), new BinaryOp("+", id("n"), num("1"))), rhs("r = 1:n+1;"));
    }

    // =====================================================================
    // REFERENCES
    // =====================================================================

    @Test
    void everyCallIsAmbiguousBeforeResolution() throws Exception {
        assertEquals(new ArrayOrFunCall(id("sin"), row(num("1"))), rhs("y = sin(1);"));
        assertEquals(new ArrayOrFunCall(id("f"), row(num("1"), new Special(Special.COLON))), rhs("y = f(1, :);"));
        assertEquals(new ArrayOrFunCall(id("x"), row(new Special(Special.END))), rhs("y = x(end);"));
        assertEquals(new ArrayOrFunCall(id("tic"), Collections.<MatlabNode>emptyList()), rhs("y = tic();"));
    }

    @Test
    void cellIndexIsArrayReference() throws Exception {
        assertEquals(new ArrayRef(id("c"), row(num("2")), true), rhs("y = c{2};"));
    }

    @Test
    void fieldAccess() throws Exception {
        assertEquals(new StructRef(id("s"), id("a"), false), rhs("y = s.a;"));
        assertEquals(new StructRef(id("s"), id("name"), true), rhs("y = s.(name);"));
        assertEquals(new StructRef(new ArrayOrFunCall(new StructRef(id("s"), id("a"), false), row(num("2"))), id("b"), false),
                     rhs("y = s.a(2).b;"));
    }

    @Test
    void handlesAndAnonymousFunctions() throws Exception {
        assertEquals(new FunHandle(id("sin")), rhs("h = @sin;"));
        assertEquals(new AnonFun(row(id("x")), new BinaryOp(".^", id("x"), num("2"))), rhs("g = @(x) x.^2;"));
    }

    @Test
    void literals() throws Exception {
        assertEquals(new BooleanLiteral(true), rhs("t = true;"));
        assertEquals(new StringLiteral("it's", false), rhs("s = 'it''s';"));
        assertEquals(new StringLiteral("say \"hi\"", true), rhs("s = \"say \"\"hi\"\"\";"));
        assertEquals(num("2e-3"), rhs("k = 2e-3;"));
    }

    @Test
    void multipleOutputTargetWithIgnoredValue() throws Exception {
        Assignment assignment = (Assignment) build("[~, idx] = max(v);").get(0);
        assertEquals(matrix(row(new Special(Special.TILDE), id("idx"))), assignment.getLhs());
    }

    // =====================================================================
    // STATEMENTS
    // =====================================================================

    @Test
    void functionsWithoutEndAreSiblings() throws Exception {
        List<MatlabNode> nodes = build("function a\nx = 1;\nfunction b\ny = 2;\n");
        assertEquals(2, nodes.size());
        FunDef a = (FunDef) nodes.get(0);
        FunDef b = (FunDef) nodes.get(1);
        assertEquals("a", a.getName().getName());
        assertEquals(1, a.getBody().size());
        assertEquals("b", b.getName().getName());
        assertEquals(1, b.getBody().size());
    }

    @Test
    void functionsWithEndNest() throws Exception {
        List<MatlabNode> nodes = build("function outer\n  function inner\n  end\nend\n");
        assertEquals(1, nodes.size());
        FunDef outer = (FunDef) nodes.get(0);
        assertEquals(1, outer.getBody().size());
        assertEquals("inner", ((FunDef) outer.getBody().get(0)).getName().getName());
    }

    @Test
    void functionSignature() throws Exception {
        FunDef def = (FunDef) build("function [a, b] = pair(x, ~)\n  a = x; b = ~x;\nend").get(0);
        assertEquals(row(id("a"), id("b")), def.getReturns());
        assertEquals(row(id("x"), new Special(Special.TILDE)), def.getParams());
        assertEquals(2, def.getBody().size());
    }

    @Test
    void ifWithElseifAndElse() throws Exception {
        If node = (If) build("if x > 1\n y = 1;\nelseif x < 0\n y = 2;\nelse\n y = 3;\nend").get(0);
        assertEquals(new BinaryOp(">", id("x"), num("1")), node.getCondition());
        assertEquals(1, node.getElseifs().size());
        assertNotNull(node.getElseClause());
        assertEquals(1, node.getElseClause().getBody().size());
    }

    @Test
    void loopsSwitchAndTry() throws Exception {
        For loop = (For) build("for i = 1:3\n s = s + i;\nend").get(0);
        assertEquals("i", loop.getVariable().getName());
        assertEquals(new BinaryOp(":", num("1"), num("3")), loop.getExpression());

        Switch choice = (Switch) build("switch m\n case 'a'\n  v = 1;\n case {1, 2}\n  v = 2;\n otherwise\n  v = 3;\nend").get(0);
        assertEquals(2, choice.getCases().size());
        assertNotNull(choice.getOtherwise());

        TryCatch attempt = (TryCatch) build("try\n risky(1);\ncatch err\n disp(err);\nend").get(0);
        assertEquals(id("err"), attempt.getCatchVariable());
        assertEquals(1, attempt.getCatchBody().size());

        While repeat = (While) build("while n > 0\n n = n - 1;\n break\nend").get(0);
        assertEquals(new Branch(Branch.Kind.BREAK), repeat.getBody().get(1));
    }

    @Test
    void commentsBecomeNodes() throws Exception {
        List<MatlabNode> nodes = build("% hello\nx = 1; % trailing\n%{\nblock\n%}\n");
        assertEquals(new Comment(" hello", false), nodes.get(0));
        assertTrue(nodes.get(1) instanceof Assignment);
        assertEquals(new Comment(" trailing", false), nodes.get(2));
        assertEquals(new Comment("\nblock\n", true), nodes.get(3));
    }

    @Test
    void commandsAndDeclarations() throws Exception {
        List<MatlabNode> nodes = build("hold on\nglobal a b\n!ls -l &\n");
        assertEquals(new MatlabCommand("hold", words("on")), nodes.get(0));
        assertEquals(new MatlabCommand("global", words("a", "b")), nodes.get(1));
        assertEquals(new ShellCommand("ls -l", true), nodes.get(2));
    }

    private static List<String> words(String... words) {
        return Arrays.asList(words);
    }

    // =====================================================================
    // ERRORS
    // =====================================================================

    @Test
    void unbalancedBracketIsSyntaxError() {
        assertThrows(MatlabSyntaxException.class, () -> build("x = [1 2"));
    }

    @Test
    void unterminatedStringIsSyntaxError() {
        assertThrows(MatlabSyntaxException.class, () -> build("s = 'abc\n"));
    }

    @Test
    void syntaxErrorReportsPosition() {
        MatlabSyntaxException e = assertThrows(MatlabSyntaxException.class, () -> build("x = 1;\ny = (1 + 2;"));
        assertEquals("test", e.getSourceName());
        assertEquals(2, e.getLine());
        assertTrue(e.getMessage().startsWith("test:2:"));
    }

    @Test
    void complexNumbersAreUnsupported() {
        UnsupportedConstructException e = assertThrows(UnsupportedConstructException.class, () -> build("z = 3 + 2i;"));
        assertEquals(1, e.getLine());
        assertEquals(9, e.getColumn());
    }

    @Test
    void classDefinitionsAreUnsupported() {
        assertThrows(UnsupportedConstructException.class, () -> build("classdef Foo\nend\n"));
    }

    @Test
    void multiLevelDynamicFieldIsUnsupported() {
        assertThrows(UnsupportedConstructException.class, () -> build("v = s.(a).(b);"));
    }
}
