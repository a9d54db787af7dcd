package matlabode;

import matlabode.MatlabNode.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatlabFormatterTest {

    private static List<MatlabNode> build(String text) throws OdeConversionException {
        return new MatlabASTParser().buildNodes(text, "test");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "x = [1 2; 3 4];",
        "y = -a^b + c'*d;",
        "y = 2^-2 - -b;",
        "r = 1:2:10; q = (1:2):5; p = 1:n+1;",
        "s.a(2).b = {1, 'two', [3 4]};",
        "v = s.(name);",
        "f = @(t, y) [y(2); -y(1)];",
        "h = @sin;",
        "msg = 'it''s'; d = \"q\";",
        "z = a(end) .* b.';",
        "s = ('abc')'; u = (\"q\").';",
        "x = [a -b, c - d];",
        "w = a && (b || c) & ~d;",
        "[~, idx] = max(v(:, 1));",
        "if x > 1\n y = 1;\nelseif x < 0\n y = 2;\nelse\n y = 3;\nend",
        "for k = 1:10\n total = total + k;\nend",
        "while n > 0\n n = n - 1;\n if n == 5\n  break\n end\nend",
        "switch mode\n case 'a'\n  v = 1;\n case {1, 2}\n  v = 2;\n otherwise\n  v = 3;\nend",
        "try\n risky(1);\ncatch err\n disp(err);\nend",
        "function [a, b] = pair(x, ~)\n a = x;\n b = ~x;\nend",
        "% comment\nx = 1; % trailing\n%{\nblock\n%}",
        "global G H\nhold on\ndisp 'two words'\n!echo hi &",
        "tspan=[0 300]; xinit=[0;0]; a=1; function dx=f(t,x) dx=[a*x(1); -a*x(2)]; end; [t,x]=ode45(@f,tspan,xinit);"
    })
    void formattedSourceParsesBackToEqualNodes(String source) throws Exception {
        List<MatlabNode> nodes = build(source);
        String text = MatlabFormatter.format(nodes);
        assertEquals(nodes, build(text), text);
    }

    @Test
    void formatsExpressionsWithMinimalParentheses() throws Exception {
        Identifier a = new Identifier("a");
        Identifier b = new Identifier("b");
        Identifier c = new Identifier("c");
        assertEquals("(a + b) * c", MatlabFormatter.format(new BinaryOp("*", new BinaryOp("+", a, b), c)));
        assertEquals("a * (b + c)", MatlabFormatter.format(new BinaryOp("*", a, new BinaryOp("+", b, c))));
        assertEquals("a - (b - c)", MatlabFormatter.format(new BinaryOp("-", a, new BinaryOp("-", b, c))));
        assertEquals("a^b", MatlabFormatter.format(new BinaryOp("^", a, b)));
        assertEquals("-(a + b)", MatlabFormatter.format(new UnaryOp("-", new BinaryOp("+", a, b))));
        assertEquals("(a * b)'", MatlabFormatter.format(new Transpose("'", new BinaryOp("*", a, b))));
        assertEquals("('abc')'", MatlabFormatter.format(new Transpose("'", new StringLiteral("abc", false))));
    }

    @Test
    void formatsStatementsWithIndentedBodies() throws Exception {
        String text = MatlabFormatter.format(build("function dy = f(t, y)\ndy = [y(2); -y(1)];\nend"));
        assertEquals("function dy = f(t, y)\n    dy = [y(2); -y(1)]\nend\n", text);
    }

    @Test
    void keysHaveNoWhitespace() throws Exception {
        Assignment assignment = (Assignment) build("[t, y] = ode45(@f, [0 1], x0);").get(0);
        assertEquals("[t,y]", MatlabFormatter.toKey(assignment.getLhs()));
        assertEquals("ode45(@f,[0,1],x0)", MatlabFormatter.toKey(assignment.getRhs()));
        assertEquals("s.a{2}", MatlabFormatter.toKey(new ArrayRef(
            new StructRef(new Identifier("s"), new Identifier("a"), false),
            Arrays.asList(new NumberLiteral("2")), true)));
    }

    @Test
    void commandArgumentsAreQuotedWhenNeeded() {
        assertEquals("format long", MatlabFormatter.format(new MatlabCommand("format", Arrays.asList("long"))));
        assertEquals("disp 'a b'", MatlabFormatter.format(new MatlabCommand("disp", Arrays.asList("a b"))));
    }
}
