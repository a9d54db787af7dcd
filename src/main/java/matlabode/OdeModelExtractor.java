package matlabode;

import matlabode.MatlabNode.*;
import matlabode.OdeModel.Equation;
import matlabode.OdeModel.ParameterBinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the single ODE solver invocation in a resolved file and normalizes
 * it into an {@link OdeModel}.
 *
 * The derivative passed to the solver may be a handle to a function defined
 * in the file, an anonymous function returning a column vector, an anonymous
 * function forwarding to a defined function, or a variable holding either.
 * A derivative function must return a single vector, built either as one
 * array literal or element by element ("dy(1) = ...; dy(2) = ...").
 *
 * Extraction reads the context tree only and has no side effects.
 */
public class OdeModelExtractor {

    private static final Logger log = LoggerFactory.getLogger(OdeModelExtractor.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    private final ConverterConfiguration configuration;

    public OdeModelExtractor() {
        this(new ConverterConfiguration());
    }

    public OdeModelExtractor(ConverterConfiguration configuration) {
        this.configuration = configuration;
    }

    // Where the solver's derivative argument leads
    private static final class DerivativeTarget {
        final MatlabNode handle;
        final MatlabContext function;
        final AnonFun anonymous;

        DerivativeTarget(MatlabNode handle, MatlabContext function, AnonFun anonymous) {
            this.handle = handle;
            this.function = function;
            this.anonymous = anonymous;
        }
    }

    public OdeModel extractOdeModel(MatlabContext root) throws ModelShapeException {
        MatlabContext working = selectWorkingContext(root);
        log.debug("Extracting ODE model from context {}", working.getPath());

        // =====================================================================
        // 1. The solver call
        // =====================================================================

        List<String> solvers = new ArrayList<>();
        List<List<MatlabNode>> invocations = new ArrayList<>();
        for (Map.Entry<String, List<List<MatlabNode>>> entry : working.getCalls().entrySet()) {
            if (!configuration.getSolverNames().contains(entry.getKey())) {
                continue;
            }
            for (List<MatlabNode> args : entry.getValue()) {
                if (args.size() < 3) {
                    log.warn("Ignoring {} call with {} argument(s); a solver needs a derivative, "
                             + "a time span and initial conditions", entry.getKey(), args.size());
                    continue;
                }
                solvers.add(entry.getKey());
                invocations.add(args);
            }
        }
        if (solvers.isEmpty()) {
            throw new NoSolverCallFoundException(working.getPath());
        }
        if (solvers.size() > 1) {
            throw new MultipleSolverCallsFoundException(solvers);
        }

        String solver = solvers.get(0);
        List<MatlabNode> args = invocations.get(0);
        List<MatlabNode> statements = working.getNodes();
        int callIndex = statementIndexOf(statements, args);
        List<Assignment> assignmentsBefore = new ArrayList<>();
        collectAssignmentsBefore(statements, args, assignmentsBefore);
        Map<String, MatlabNode> valuesBefore = identifierValues(assignmentsBefore);

        // =====================================================================
        // 2. The derivative and its equations
        // =====================================================================

        DerivativeTarget target = resolveDerivative(args.get(0), working, valuesBefore, new HashSet<String>());
        List<Equation> equations;
        List<ParameterBinding> localParameters = new ArrayList<>();
        String functionName = null;
        String independentVariable;
        String stateVariable;

        if (target.function != null) {
            FunDef definition = target.function.getDefinition();
            functionName = definition.getName().getName();
            if (definition.getReturns().size() != 1 || !(definition.getReturns().get(0) instanceof Identifier)) {
                throw new MalformedDerivativeBodyException("the derivative function " + functionName
                    + " must return exactly one value, but it returns " + definition.getReturns().size());
            }
            if (definition.getParams().size() < 2) {
                throw new MalformedDerivativeBodyException("the derivative function " + functionName
                    + " must take at least a time and a state parameter");
            }
            independentVariable = parameterName(definition.getParams().get(0));
            stateVariable = parameterName(definition.getParams().get(1));
            String output = ((Identifier) definition.getReturns().get(0)).getName();
            equations = equationsFromBody(definition.getBody(), output, functionName);
            if (configuration.isCollectLocalParameters()) {
                localParameters = localBindings(definition.getBody(), output);
            }
        } else {
            AnonFun anonymous = target.anonymous;
            if (anonymous.getParams().size() < 2) {
                throw new MalformedDerivativeBodyException(
                    "the anonymous derivative must take at least a time and a state parameter");
            }
            independentVariable = parameterName(anonymous.getParams().get(0));
            stateVariable = parameterName(anonymous.getParams().get(1));
            equations = equationsFromArray((Array) anonymous.getBody(), "the anonymous derivative");
        }

        // =====================================================================
        // 3. Parameters, time span and initial conditions
        // =====================================================================

        Set<String> skipped = new HashSet<>();
        for (MatlabNode arg : args.subList(1, 3)) {
            if (arg instanceof Identifier) {
                skipped.add(((Identifier) arg).getName());
            }
        }
        List<ParameterBinding> parameters = scalarBindings(assignmentsBefore, skipped);

        MatlabNode timeSpan = resolveValue(args.get(1), working, valuesBefore);
        MatlabNode initialConditions = resolveValue(args.get(2), working, valuesBefore);
        List<String> outputs = callIndex < statements.size()
            ? outputVariables(statements.get(callIndex), args) : Collections.<String>emptyList();

        List<Comment> comments = new ArrayList<>();
        collectComments(statements, comments);
        if (target.function != null) {
            collectComments(target.function.getNodes(), comments);
        }
        Map<Integer, String> stateNames = stateNames(comments, stateVariable, equations.size());

        OdeModel model = new OdeModel(solver, target.handle, functionName, independentVariable, stateVariable,
                                      timeSpan, initialConditions, equations, parameters, localParameters,
                                      outputs, args.subList(3, args.size()), stateNames);
        log.info("Extracted {} model with {} state(s) and {} parameter(s)",
                 solver, equations.size(), parameters.size());
        return model;
    }

    // =====================================================================
    // WORKING CONTEXT
    // =====================================================================

    /**
     * A function file (only function definitions at the top level, no
     * assignments and no solver call of its own) is analyzed inside its
     * first function, the one MATLAB runs.
     */
    private MatlabContext selectWorkingContext(MatlabContext root) {
        if (!configuration.isUseFunctionFileContext() || root.getFunctions().isEmpty()
                || !root.getAssignments().isEmpty()) {
            return root;
        }
        for (String name : root.getCalls().keySet()) {
            if (configuration.getSolverNames().contains(name)) {
                return root;
            }
        }
        MatlabContext main = root.getFunctions().values().iterator().next();
        log.debug("Treating {} as a function file with main function {}", root.getName(), main.getName());
        return main;
    }

    // =====================================================================
    // DERIVATIVE RESOLUTION
    // =====================================================================

    private DerivativeTarget resolveDerivative(MatlabNode derivativeArg, MatlabContext working,
                                               Map<String, MatlabNode> valuesBefore, Set<String> followed)
            throws UnresolvableDerivativeReferenceException {
        if (derivativeArg instanceof FunHandle) {
            String name = ((FunHandle) derivativeArg).getName().getName();
            return new DerivativeTarget(derivativeArg, definedFunction(name, working), null);
        }
        if (derivativeArg instanceof StringLiteral) {
            // Older code passes the function name as a string: ode45('f', ...)
            String name = ((StringLiteral) derivativeArg).getValue();
            return new DerivativeTarget(new FunHandle(new Identifier(name)), definedFunction(name, working), null);
        }
        if (derivativeArg instanceof AnonFun) {
            AnonFun anonymous = (AnonFun) derivativeArg;
            MatlabNode body = anonymous.getBody();
            if (body instanceof Array && !((Array) body).isCell()) {
                return new DerivativeTarget(derivativeArg, null, anonymous);
            }
            String called = calledName(body);
            if (called != null && working.lookupFunction(called) != null) {
                log.debug("Anonymous derivative forwards to function {}", called);
                return new DerivativeTarget(derivativeArg, working.lookupFunction(called), null);
            }
            throw new UnresolvableDerivativeReferenceException(
                "the anonymous derivative " + MatlabFormatter.format(derivativeArg)
                + " neither builds a vector nor calls a function defined in the file");
        }
        if (derivativeArg instanceof Identifier) {
            String name = ((Identifier) derivativeArg).getName();
            if (followed.add(name)) {
                MatlabNode value = valuesBefore.containsKey(name) ? valuesBefore.get(name) : enclosingValue(name, working);
                if (value != null) {
                    log.debug("Following derivative variable {}", name);
                    return resolveDerivative(value, working, valuesBefore, followed);
                }
            }
            throw new UnresolvableDerivativeReferenceException(
                "the derivative argument " + name + " is not assigned a function handle before the solver call");
        }
        throw new UnresolvableDerivativeReferenceException(
            "the derivative argument " + MatlabFormatter.format(derivativeArg) + " is not a function handle");
    }

    private static MatlabContext definedFunction(String name, MatlabContext working)
            throws UnresolvableDerivativeReferenceException {
        MatlabContext function = working.lookupFunction(name);
        if (function == null) {
            throw new UnresolvableDerivativeReferenceException(
                "the derivative function " + name + " is not defined in this file");
        }
        return function;
    }

    private static String calledName(MatlabNode body) {
        if (body instanceof FunCall || body instanceof ArrayOrFunCall || body instanceof ArrayRef) {
            return MatlabNode.getBaseName(body);
        }
        return null;
    }

    private static String parameterName(MatlabNode param) {
        return param instanceof Identifier ? ((Identifier) param).getName() : null;
    }

    // =====================================================================
    // EQUATIONS
    // =====================================================================

    /**
     * Walks the body in document order. A whole assignment to the output
     * replaces everything before it; element assignments with literal
     * indices then fill in or override single rows.
     */
    private List<Equation> equationsFromBody(List<MatlabNode> body, String output, String functionName)
            throws MalformedDerivativeBodyException {
        String where = "the derivative function " + functionName;
        MatlabNode whole = null;
        SortedMap<Integer, MatlabNode> elements = new TreeMap<>();

        for (Assignment assignment : assignmentsIn(body)) {
            MatlabNode lhs = assignment.getLhs();
            if (lhs instanceof Identifier && ((Identifier) lhs).getName().equals(output)) {
                whole = assignment.getRhs();
                elements.clear();
            } else if (lhs instanceof ArrayRef && output.equals(MatlabNode.getBaseName(lhs))
                    && ((ArrayRef) lhs).getName() instanceof Identifier) {
                ArrayRef element = (ArrayRef) lhs;
                Integer index = elementIndex(element);
                if (index == null) {
                    throw new MalformedDerivativeBodyException(where + " assigns " + MatlabFormatter.toKey(lhs)
                        + "; only integer literal indices are supported");
                }
                elements.put(index, assignment.getRhs());
            }
        }

        SortedMap<Integer, MatlabNode> rows = new TreeMap<>();
        if (whole instanceof Array && !((Array) whole).isCell()) {
            for (Equation equation : equationsFromArray((Array) whole, where)) {
                rows.put(equation.getStateIndex(), equation.getRhs());
            }
        } else if (elements.isEmpty()) {
            throw new MalformedDerivativeBodyException(whole == null
                ? where + " never assigns its output " + output
                : where + " assigns " + output + " something other than a vector literal");
        }
        rows.putAll(elements);

        List<Equation> equations = new ArrayList<>();
        int expected = 1;
        for (Map.Entry<Integer, MatlabNode> row : rows.entrySet()) {
            if (row.getKey() != expected) {
                throw new MalformedDerivativeBodyException(where + " does not assign " + output + "(" + expected + ")");
            }
            equations.add(new Equation(expected++, row.getValue()));
        }
        return equations;
    }

    /** One equation per row of a column vector, or per element of a single row. */
    private static List<Equation> equationsFromArray(Array array, String where) throws MalformedDerivativeBodyException {
        List<List<MatlabNode>> rows = array.getRows();
        if (rows.isEmpty()) {
            throw new MalformedDerivativeBodyException(where + " returns an empty vector");
        }
        List<Equation> equations = new ArrayList<>();
        if (rows.size() == 1) {
            int index = 1;
            for (MatlabNode element : rows.get(0)) {
                equations.add(new Equation(index++, element));
            }
            return equations;
        }
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).size() != 1) {
                throw new MalformedDerivativeBodyException(where + " returns a matrix; row " + (i + 1)
                    + " has " + rows.get(i).size() + " elements");
            }
            equations.add(new Equation(i + 1, rows.get(i).get(0)));
        }
        return equations;
    }

    // dy(3) or dy(3, 1)
    private static Integer elementIndex(ArrayRef element) {
        List<MatlabNode> args = element.getArgs();
        if (element.isCell() || args.isEmpty() || args.size() > 2) {
            return null;
        }
        if (args.size() == 2 && !isIntegerLiteral(args.get(1), 1)) {
            return null;
        }
        MatlabNode first = args.get(0);
        if (first instanceof NumberLiteral && ((NumberLiteral) first).getText().matches("[0-9]+")) {
            int index = Integer.parseInt(((NumberLiteral) first).getText());
            return index > 0 ? index : null;
        }
        return null;
    }

    private static boolean isIntegerLiteral(MatlabNode node, int value) {
        return node instanceof NumberLiteral && ((NumberLiteral) node).getText().equals(String.valueOf(value));
    }

    // =====================================================================
    // BINDINGS
    // =====================================================================

    /** Latest value assigned to each plain identifier by these assignments. */
    private static Map<String, MatlabNode> identifierValues(List<Assignment> assignments) {
        Map<String, MatlabNode> values = new HashMap<>();
        for (Assignment assignment : assignments) {
            if (assignment.getLhs() instanceof Identifier) {
                values.put(((Identifier) assignment.getLhs()).getName(), assignment.getRhs());
            }
        }
        return values;
    }

    // Assignments in the working context itself after the call must not leak in
    private static MatlabNode enclosingValue(String name, MatlabContext working) {
        return working.getParent() != null ? working.getParent().lookupAssignment(name) : null;
    }

    /** A reassigned name keeps its first position and takes its latest value. */
    private List<ParameterBinding> scalarBindings(List<Assignment> assignments, Set<String> skipped) {
        Map<String, MatlabNode> bindings = new LinkedHashMap<>();
        for (Assignment assignment : assignments) {
            if (!(assignment.getLhs() instanceof Identifier)) {
                continue;
            }
            String name = ((Identifier) assignment.getLhs()).getName();
            if (!skipped.contains(name) && isScalar(assignment.getRhs())) {
                bindings.put(name, assignment.getRhs());
            }
        }
        List<ParameterBinding> result = new ArrayList<>();
        for (Map.Entry<String, MatlabNode> entry : bindings.entrySet()) {
            result.add(new ParameterBinding(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    private List<ParameterBinding> localBindings(List<MatlabNode> body, String output) {
        return scalarBindings(assignmentsIn(body), Collections.singleton(output));
    }

    private boolean isScalar(MatlabNode value) {
        if (value instanceof NumberLiteral || value instanceof BooleanLiteral
                || value instanceof Identifier || value instanceof StructRef) {
            return true;
        } else if (value instanceof UnaryOp) {
            return isScalar(((UnaryOp) value).getOperand());
        } else if (value instanceof Transpose) {
            return isScalar(((Transpose) value).getOperand());
        } else if (value instanceof BinaryOp) {
            BinaryOp op = (BinaryOp) value;
            return !":".equals(op.getOp()) && isScalar(op.getLeft()) && isScalar(op.getRight());
        } else if (value instanceof FunCall || value instanceof ArrayOrFunCall || value instanceof ArrayRef) {
            String called = MatlabNode.getBaseName(value);
            return !configuration.getIgnoredBindingFunctions().contains(called)
                && !configuration.getArrayConstructors().contains(called);
        }
        return false;
    }

    // =====================================================================
    // STATE NAMES
    // =====================================================================

    /**
     * Reads labels like "% x(2) [IFNb_env]" from comments. Punctuation around
     * the word after "x(n)" is dropped; a later comment for the same index wins.
     */
    private static Map<Integer, String> stateNames(List<Comment> comments, String stateVariable, int stateCount) {
        Map<Integer, String> names = new HashMap<>();
        if (stateVariable == null) {
            return names;
        }
        Pattern label = Pattern.compile("\\b" + Pattern.quote(stateVariable) + "\\((\\d{1,9})\\)\\s+(\\S+)");
        for (Comment comment : comments) {
            Matcher matcher = label.matcher(comment.getText());
            while (matcher.find()) {
                int index = Integer.parseInt(matcher.group(1));
                String guess = matcher.group(2).replaceAll("^\\W+|\\W+$", "");
                if (index >= 1 && index <= stateCount && IDENTIFIER.matcher(guess).matches()) {
                    names.put(index, guess);
                }
            }
        }
        log.debug("State names from comments: {}", names);
        return names;
    }

    private static void collectComments(List<MatlabNode> statements, List<Comment> out) {
        for (MatlabNode statement : statements) {
            if (statement instanceof Comment) {
                out.add((Comment) statement);
            } else if (!(statement instanceof FunDef)) {
                collectComments(statement.accept(CHILDREN), out);
            }
        }
    }

    private static MatlabNode resolveValue(MatlabNode arg, MatlabContext working, Map<String, MatlabNode> valuesBefore) {
        if (!(arg instanceof Identifier)) {
            return arg;
        }
        String name = ((Identifier) arg).getName();
        MatlabNode value = valuesBefore.get(name);
        if (value == null) {
            value = enclosingValue(name, working);
        }
        return value != null ? value : arg;
    }

    private static List<String> outputVariables(MatlabNode statement, List<MatlabNode> args) {
        List<String> names = new ArrayList<>();
        if (!(statement instanceof Assignment)) {
            return names;
        }
        Assignment assignment = (Assignment) statement;
        if (!(assignment.getRhs() instanceof FunCall) || ((FunCall) assignment.getRhs()).getArgs() != args) {
            return names;
        }
        MatlabNode lhs = assignment.getLhs();
        if (lhs instanceof Array) {
            for (List<MatlabNode> row : ((Array) lhs).getRows()) {
                for (MatlabNode element : row) {
                    if (element instanceof Identifier) {
                        names.add(((Identifier) element).getName());
                    }
                }
            }
        } else if (lhs instanceof Identifier) {
            names.add(((Identifier) lhs).getName());
        }
        return names;
    }

    // =====================================================================
    // TREE WALKING
    // =====================================================================

    /** Index of the top-level statement containing the call with these arguments. */
    private static int statementIndexOf(List<MatlabNode> statements, List<MatlabNode> args) {
        for (int i = 0; i < statements.size(); i++) {
            if (containsCall(statements.get(i), args)) {
                return i;
            }
        }
        return statements.size();
    }

    private static boolean containsCall(MatlabNode node, List<MatlabNode> args) {
        if (node instanceof FunCall && ((FunCall) node).getArgs() == args) {
            return true;
        }
        if (node instanceof FunDef) {
            return false;
        }
        for (MatlabNode child : node.accept(CHILDREN)) {
            if (containsCall(child, args)) {
                return true;
            }
        }
        return false;
    }

    /** Assignments in document order, descending into control flow but not into nested functions. */
    private static List<Assignment> assignmentsIn(List<MatlabNode> statements) {
        List<Assignment> assignments = new ArrayList<>();
        collectAssignments(statements, assignments);
        return assignments;
    }

    /**
     * Assignments in document order up to the statement holding the call.
     * Returns whether that statement was reached.
     */
    private static boolean collectAssignmentsBefore(List<MatlabNode> statements, List<MatlabNode> args,
                                                    List<Assignment> out) {
        for (MatlabNode statement : statements) {
            if (containsCall(statement, args)) {
                if (!(statement instanceof Assignment)) {
                    collectAssignmentsBefore(statement.accept(CHILDREN), args, out);
                }
                return true;
            }
            if (statement instanceof Assignment) {
                out.add((Assignment) statement);
            } else if (!(statement instanceof FunDef)) {
                collectAssignments(statement.accept(CHILDREN), out);
            }
        }
        return false;
    }

    private static void collectAssignments(List<MatlabNode> statements, List<Assignment> out) {
        for (MatlabNode statement : statements) {
            if (statement instanceof Assignment) {
                out.add((Assignment) statement);
            } else if (!(statement instanceof FunDef)) {
                collectAssignments(statement.accept(CHILDREN), out);
            }
        }
    }

    private static final ChildNodes CHILDREN = new ChildNodes();

    /** Direct children of a node, in source order. */
    private static final class ChildNodes implements MatlabNode.Visitor<List<MatlabNode>> {

        private static List<MatlabNode> of(MatlabNode... nodes) {
            List<MatlabNode> children = new ArrayList<>();
            for (MatlabNode node : nodes) {
                if (node != null) {
                    children.add(node);
                }
            }
            return children;
        }

        private static List<MatlabNode> concat(List<MatlabNode> head, List<? extends MatlabNode> tail) {
            List<MatlabNode> children = new ArrayList<>(head);
            children.addAll(tail);
            return children;
        }

        @Override public List<MatlabNode> visitNumberLiteral(NumberLiteral node) { return of(); }
        @Override public List<MatlabNode> visitStringLiteral(StringLiteral node) { return of(); }
        @Override public List<MatlabNode> visitBooleanLiteral(BooleanLiteral node) { return of(); }
        @Override public List<MatlabNode> visitSpecial(Special node) { return of(); }

        @Override
        public List<MatlabNode> visitArray(Array node) {
            List<MatlabNode> children = new ArrayList<>();
            for (List<MatlabNode> row : node.getRows()) {
                children.addAll(row);
            }
            return children;
        }

        @Override public List<MatlabNode> visitFunHandle(FunHandle node) { return of(node.getName()); }
        @Override public List<MatlabNode> visitAnonFun(AnonFun node) { return concat(node.getParams(), of(node.getBody())); }
        @Override public List<MatlabNode> visitIdentifier(Identifier node) { return of(); }
        @Override public List<MatlabNode> visitArrayRef(ArrayRef node) { return concat(of(node.getName()), node.getArgs()); }
        @Override public List<MatlabNode> visitFunCall(FunCall node) { return concat(of(node.getName()), node.getArgs()); }
        @Override public List<MatlabNode> visitArrayOrFunCall(ArrayOrFunCall node) { return concat(of(node.getName()), node.getArgs()); }
        @Override public List<MatlabNode> visitStructRef(StructRef node) { return of(node.getBase(), node.getField()); }
        @Override public List<MatlabNode> visitUnaryOp(UnaryOp node) { return of(node.getOperand()); }
        @Override public List<MatlabNode> visitBinaryOp(BinaryOp node) { return of(node.getLeft(), node.getRight()); }
        @Override public List<MatlabNode> visitTernaryOp(TernaryOp node) { return of(node.getLeft(), node.getMiddle(), node.getRight()); }
        @Override public List<MatlabNode> visitTranspose(Transpose node) { return of(node.getOperand()); }
        @Override public List<MatlabNode> visitAssignment(Assignment node) { return of(node.getLhs(), node.getRhs()); }
        @Override public List<MatlabNode> visitFunDef(FunDef node) { return node.getBody(); }

        @Override
        public List<MatlabNode> visitIf(If node) {
            List<MatlabNode> children = concat(of(node.getCondition()), node.getBody());
            children.addAll(node.getElseifs());
            return concat(children, of(node.getElseClause()));
        }

        @Override public List<MatlabNode> visitElseif(Elseif node) { return concat(of(node.getCondition()), node.getBody()); }
        @Override public List<MatlabNode> visitElse(Else node) { return node.getBody(); }
        @Override public List<MatlabNode> visitWhile(While node) { return concat(of(node.getCondition()), node.getBody()); }
        @Override public List<MatlabNode> visitFor(For node) { return concat(of(node.getVariable(), node.getExpression()), node.getBody()); }

        @Override
        public List<MatlabNode> visitSwitch(Switch node) {
            List<MatlabNode> children = concat(of(node.getSubject()), node.getCases());
            return concat(children, of(node.getOtherwise()));
        }

        @Override public List<MatlabNode> visitCase(Case node) { return concat(of(node.getValue()), node.getBody()); }
        @Override public List<MatlabNode> visitOtherwise(Otherwise node) { return node.getBody(); }
        @Override public List<MatlabNode> visitTryCatch(TryCatch node) { return concat(node.getBody(), node.getCatchBody()); }
        @Override public List<MatlabNode> visitBranch(Branch node) { return of(); }
        @Override public List<MatlabNode> visitShellCommand(ShellCommand node) { return of(); }
        @Override public List<MatlabNode> visitMatlabCommand(MatlabCommand node) { return of(); }
        @Override public List<MatlabNode> visitComment(Comment node) { return of(); }
    }
}
