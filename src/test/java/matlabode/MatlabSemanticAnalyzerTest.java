package matlabode;

import matlabode.MatlabContext.SymbolType;
import matlabode.MatlabNode.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatlabSemanticAnalyzerTest {

    private final MatlabASTParser parser = new MatlabASTParser();

    private MatlabContext parse(String text) throws OdeConversionException {
        return parser.parseString(text);
    }

    @Test
    void indexedVariableIsArrayReference() throws Exception {
        MatlabContext root = parse("x = [1 2 3];\ny = x(2);");
        assertEquals(new ArrayRef(new Identifier("x"), Arrays.asList(new NumberLiteral("2")), false),
                     root.getAssignments().get("y"));
    }

    @Test
    void knownFunctionIsCallAndRecorded() throws Exception {
        MatlabContext root = parse("y = sin(0.5);");
        assertTrue(root.getAssignments().get("y") instanceof FunCall);
        assertEquals(Arrays.asList(Arrays.asList(new NumberLiteral("0.5"))), root.getCalls().get("sin"));
    }

    @Test
    void unknownNameStaysAmbiguous() throws Exception {
        MatlabContext root = parse("y = foo(2);");
        assertTrue(root.getAssignments().get("y") instanceof ArrayOrFunCall);
        assertFalse(root.getCalls().containsKey("foo"));
    }

    @Test
    void resolutionOnlySeesEarlierAssignments() throws Exception {
        MatlabContext root = parse("y = g(1);\ng = [1 2];\nz = g(1);");
        assertTrue(root.getAssignments().get("y") instanceof ArrayOrFunCall);
        assertTrue(root.getAssignments().get("z") instanceof ArrayRef);
    }

    @Test
    void rightHandSideIsResolvedBeforeTarget() throws Exception {
        MatlabContext root = parse("x = x(1);");
        assertTrue(root.getAssignments().get("x") instanceof ArrayOrFunCall);
        assertEquals(SymbolType.VARIABLE, root.getTypes().get("x"));
    }

    @Test
    void functionDefinitionKeepsEarlierVariable() throws Exception {
        MatlabContext root = parse("g = [1 2];\nfunction r = g(x)\n  r = x;\nend\nz = g(1);");
        assertEquals(SymbolType.VARIABLE, root.getTypes().get("g"));
        assertTrue(root.getAssignments().get("z") instanceof ArrayRef);
        assertNotNull(root.getFunctions().get("g"));
    }

    @Test
    void variableShadowsKnownFunction() throws Exception {
        MatlabContext root = parse("sum = [1 2];\ny = sum(1);");
        assertTrue(root.getAssignments().get("y") instanceof ArrayRef);
        assertFalse(root.getCalls().containsKey("sum"));
    }

    @Test
    void assignmentTargetIsAlwaysArrayReference() throws Exception {
        MatlabContext root = parse("x(2) = 5;\nsum(3) = 1;");
        Assignment first = (Assignment) root.getNodes().get(0);
        Assignment second = (Assignment) root.getNodes().get(1);
        assertTrue(first.getLhs() instanceof ArrayRef);
        assertTrue(second.getLhs() instanceof ArrayRef);
        assertEquals(new NumberLiteral("5"), root.getAssignments().get("x(2)"));
        assertFalse(root.getCalls().containsKey("sum"));
    }

    @Test
    void bareColonArgumentMeansArray() throws Exception {
        MatlabContext root = parse("y = foo(:, 1);");
        assertTrue(root.getAssignments().get("y") instanceof ArrayRef);
    }

    @Test
    void assignmentKeysAreNormalized() throws Exception {
        MatlabContext root = parse("[t, y] = deal(1, 2);\ns.a = 1;\nc{2} = 3;\nm(1, 2) = 4;");
        assertEquals(Arrays.asList("[t,y]", "s.a", "c{2}", "m(1,2)"),
                     Arrays.asList(root.getAssignments().keySet().toArray()));
        assertEquals(SymbolType.VARIABLE, root.getTypes().get("t"));
        assertEquals(SymbolType.VARIABLE, root.getTypes().get("y"));
        assertEquals(SymbolType.VARIABLE, root.getTypes().get("s"));
    }

    @Test
    void latestAssignmentWins() throws Exception {
        MatlabContext root = parse("a = 1;\na = 2;");
        assertEquals(new NumberLiteral("2"), root.getAssignments().get("a"));
    }

    @Test
    void callsAreKeptInDocumentOrder() throws Exception {
        MatlabContext root = parse("a = sin(1);\nb = cos(2);\nc = sin(3);");
        List<List<MatlabNode>> sinCalls = root.getCalls().get("sin");
        assertEquals(2, sinCalls.size());
        assertEquals(new NumberLiteral("1"), sinCalls.get(0).get(0));
        assertEquals(new NumberLiteral("3"), sinCalls.get(1).get(0));
        assertEquals(Arrays.asList("sin", "cos"), Arrays.asList(root.getCalls().keySet().toArray()));
    }

    @Test
    void functionDefinitionOpensContext() throws Exception {
        MatlabContext root = parse("function r = f(a)\n  r = a(1) + helper(2);\nend");
        assertEquals(SymbolType.FUNCTION, root.getTypes().get("f"));

        MatlabContext f = root.getFunctions().get("f");
        assertNotNull(f);
        assertSame(root, f.getParent());
        assertEquals("<string>/f", f.getPath());
        assertEquals(Arrays.asList(new Identifier("a")), f.getParameters());
        assertEquals(Arrays.asList(new Identifier("r")), f.getReturns());
        assertEquals(SymbolType.VARIABLE, f.getTypes().get("a"));
        assertEquals(SymbolType.VARIABLE, f.getTypes().get("r"));

        BinaryOp sum = (BinaryOp) f.getAssignments().get("r");
        assertTrue(sum.getLeft() instanceof ArrayRef);
        assertTrue(sum.getRight() instanceof ArrayOrFunCall);
        assertEquals(f.getDefinition().getBody(), f.getNodes());
        assertTrue(root.getAssignments().isEmpty());
    }

    @Test
    void functionSeesEnclosingVariables() throws Exception {
        MatlabContext root = parse("k = [1 2];\nfunction r = f(t)\n  r = k(1);\nend");
        MatlabContext f = root.getFunctions().get("f");
        assertTrue(f.getAssignments().get("r") instanceof ArrayRef);
        assertNull(f.getTypes().get("k"));
        assertTrue(f.isVariable("k"));
    }

    @Test
    void siblingFunctionsDoNotShareVariables() throws Exception {
        MatlabContext root = parse("function a1\n  vals = 1;\nend\nfunction b1\n  w = vals(1);\nend");
        MatlabContext b1 = root.getFunctions().get("b1");
        assertTrue(b1.getAssignments().get("w") instanceof ArrayOrFunCall);
    }

    @Test
    void nestedFunctionsAreVisibleOnlyFromTheirParent() throws Exception {
        MatlabContext root = parse("function outer\n  function inner\n  end\nend");
        MatlabContext outer = root.getFunctions().get("outer");
        assertNotNull(outer.getFunctions().get("inner"));
        assertNull(root.lookupFunction("inner"));
        assertSame(outer.getFunctions().get("inner"), outer.getFunctions().get("inner").lookupFunction("inner"));
        assertEquals("<string>/outer/inner", outer.getFunctions().get("inner").getPath());
    }

    @Test
    void loopAndCatchVariablesAreDeclared() throws Exception {
        MatlabContext root = parse("for idx = 1:3\n  z = idx(1);\nend\ntry\n  q = 1;\ncatch err\n  m = err(1);\nend");
        assertTrue(root.getAssignments().get("z") instanceof ArrayRef);
        assertTrue(root.getAssignments().get("m") instanceof ArrayRef);
    }

    @Test
    void globalNamesAreVariables() throws Exception {
        MatlabContext root = parse("global G\ny = G(1);");
        assertTrue(root.getAssignments().get("y") instanceof ArrayRef);
        assertEquals(SymbolType.VARIABLE, root.getTypes().get("G"));
    }

    @Test
    void anonymousParametersAreVariablesInsideBodyOnly() throws Exception {
        MatlabContext root = parse("h = @(q) q(2);\nz = q(2);");
        AnonFun h = (AnonFun) root.getAssignments().get("h");
        assertTrue(h.getBody() instanceof ArrayRef);
        assertTrue(root.getAssignments().get("z") instanceof ArrayOrFunCall);
        assertNull(root.getTypes().get("q"));
    }

    @Test
    void callsInsideExpressionsAreResolved() throws Exception {
        MatlabContext root = parse("v = [sin(1); foo(2)];\nif cos(0) > 0\n  w = 1;\nend");
        Array v = (Array) root.getAssignments().get("v");
        assertTrue(v.getRows().get(0).get(0) instanceof FunCall);
        assertTrue(v.getRows().get(1).get(0) instanceof ArrayOrFunCall);
        assertTrue(root.getCalls().containsKey("cos"));
    }

    @Test
    void rootContextHoldsResolvedStatements() throws Exception {
        MatlabContext root = parse("% note\nx = 1;\nhold on");
        assertTrue(root.isRoot());
        assertEquals("<string>", root.getName());
        assertNull(root.getFile());
        assertEquals(3, root.getNodes().size());
        assertTrue(root.getNodes().get(0) instanceof Comment);
        assertTrue(root.getNodes().get(2) instanceof MatlabCommand);
    }
}
