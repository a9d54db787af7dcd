package matlabode;

import matlabode.MatlabNode.*;
import matlabode.MatlabContext.SymbolType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;

/**
 * Builds the {@link MatlabContext} tree and settles what each "name(args)"
 * means.
 *
 * The pass runs once, left to right in document order, and rebuilds every
 * node with resolved kinds. A name is only known to be a variable from
 * assignments, parameters and declarations seen before the reference, the
 * same information a reader of the file has at that point. The first
 * matching rule decides an {@link ArrayOrFunCall}:
 * <ol>
 *   <li>the target of an assignment, or indexed with a bare ":" - array</li>
 *   <li>the name is a variable in this scope or an enclosing one - array</li>
 *   <li>the name is a known MATLAB function - function call</li>
 *   <li>otherwise it stays ambiguous</li>
 * </ol>
 * Resolution never fails; whatever the source says is represented.
 */
public class MatlabSemanticAnalyzer implements MatlabNode.Visitor<MatlabNode> {

    private static final Logger log = LoggerFactory.getLogger(MatlabSemanticAnalyzer.class);

    private final KnownFunctionTable knownFunctions;

    // Analysis state
    private final Deque<MatlabContext> contextStack = new ArrayDeque<>();
    private final Deque<Set<String>> anonymousParameters = new ArrayDeque<>();

    public MatlabSemanticAnalyzer(KnownFunctionTable knownFunctions) {
        this.knownFunctions = Objects.requireNonNull(knownFunctions);
    }

    /**
     * Resolves a statement list and returns the root context holding it.
     *
     * @param name name of the root context, usually the file name
     * @param file source file, or null when the text did not come from a file
     */
    public MatlabContext analyze(List<MatlabNode> nodes, String name, Path file) {
        contextStack.clear();
        anonymousParameters.clear();

        MatlabContext root = new MatlabContext(name, null);
        root.setFile(file);
        pushContext(root);
        try {
            root.setNodes(resolveAll(nodes));
        } finally {
            popContext();
        }
        log.debug("Analyzed {}: {} function(s), {} assignment(s)",
                  name, root.getFunctions().size(), root.getAssignments().size());
        return root;
    }

    // =====================================================================
    // CONTEXT MANAGEMENT
    // =====================================================================

    private void pushContext(MatlabContext context) {
        contextStack.push(context);
        log.debug("Pushed context: {}", context.getPath());
    }

    private void popContext() {
        MatlabContext popped = contextStack.pop();
        log.debug("Popped context: {}", popped.getPath());
    }

    private MatlabContext current() {
        return contextStack.peek();
    }

    private boolean isVariable(String name) {
        if (name == null) {
            return false;
        }
        for (Set<String> params : anonymousParameters) {
            if (params.contains(name)) {
                return true;
            }
        }
        return current().isVariable(name);
    }

    private void declareVariable(MatlabNode target) {
        if (target instanceof Array) {
            for (List<MatlabNode> row : ((Array) target).getRows()) {
                for (MatlabNode element : row) {
                    declareVariable(element);
                }
            }
            return;
        }
        String name = MatlabNode.getBaseName(target);
        if (name != null) {
            current().putType(name, SymbolType.VARIABLE);
        }
    }

    // =====================================================================
    // RESOLUTION HELPERS
    // =====================================================================

    private MatlabNode resolve(MatlabNode node) {
        return node.accept(this);
    }

    private List<MatlabNode> resolveAll(List<? extends MatlabNode> nodes) {
        List<MatlabNode> resolved = new ArrayList<>(nodes.size());
        for (MatlabNode node : nodes) {
            resolved.add(resolve(node));
        }
        return resolved;
    }

    /**
     * Resolves an assignment target. The outermost indexing is always an
     * array reference; subscripts inside it are resolved normally.
     */
    private MatlabNode resolveLhs(MatlabNode target) {
        if (target instanceof ArrayOrFunCall) {
            ArrayOrFunCall ref = (ArrayOrFunCall) target;
            return new ArrayRef(resolveLhs(ref.getName()), resolveAll(ref.getArgs()), false);
        } else if (target instanceof ArrayRef) {
            ArrayRef ref = (ArrayRef) target;
            return new ArrayRef(resolveLhs(ref.getName()), resolveAll(ref.getArgs()), ref.isCell());
        } else if (target instanceof FunCall) {
            FunCall ref = (FunCall) target;
            return new ArrayRef(resolveLhs(ref.getName()), resolveAll(ref.getArgs()), false);
        } else if (target instanceof StructRef) {
            StructRef ref = (StructRef) target;
            MatlabNode field = ref.isDynamicAccess() ? resolve(ref.getField()) : ref.getField();
            return new StructRef(resolveLhs(ref.getBase()), field, ref.isDynamicAccess());
        } else if (target instanceof Array) {
            Array array = (Array) target;
            List<List<MatlabNode>> rows = new ArrayList<>();
            for (List<MatlabNode> row : array.getRows()) {
                List<MatlabNode> elements = new ArrayList<>();
                for (MatlabNode element : row) {
                    elements.add(resolveLhs(element));
                }
                rows.add(elements);
            }
            return new Array(array.isCell(), rows);
        }
        return resolve(target);
    }

    private static boolean hasColonArgument(List<MatlabNode> args) {
        for (MatlabNode arg : args) {
            if (arg instanceof Special && ((Special) arg).isColon()) {
                return true;
            }
        }
        return false;
    }

    // =====================================================================
    // REFERENCES
    // =====================================================================

    @Override
    public MatlabNode visitArrayOrFunCall(ArrayOrFunCall node) {
        MatlabNode name = resolve(node.getName());
        List<MatlabNode> args = resolveAll(node.getArgs());
        String baseName = MatlabNode.getBaseName(name);

        if (hasColonArgument(args) || isVariable(baseName)) {
            log.trace("{} resolved to an array reference", baseName);
            return new ArrayRef(name, args, false);
        }
        if (name instanceof Identifier && knownFunctions.contains(baseName)) {
            log.trace("{} resolved to a function call", baseName);
            FunCall call = new FunCall(name, args);
            current().addCall(baseName, call.getArgs());
            return call;
        }
        log.trace("{} left unresolved", baseName);
        return new ArrayOrFunCall(name, args);
    }

    @Override
    public MatlabNode visitFunCall(FunCall node) {
        MatlabNode name = resolve(node.getName());
        FunCall call = new FunCall(name, resolveAll(node.getArgs()));
        String baseName = MatlabNode.getBaseName(name);
        if (baseName != null) {
            current().addCall(baseName, call.getArgs());
        }
        return call;
    }

    @Override
    public MatlabNode visitArrayRef(ArrayRef node) {
        return new ArrayRef(resolve(node.getName()), resolveAll(node.getArgs()), node.isCell());
    }

    @Override
    public MatlabNode visitStructRef(StructRef node) {
        MatlabNode base = resolve(node.getBase());
        MatlabNode field = node.isDynamicAccess() ? resolve(node.getField()) : node.getField();
        return new StructRef(base, field, node.isDynamicAccess());
    }

    @Override
    public MatlabNode visitIdentifier(Identifier node) {
        return node;
    }

    // =====================================================================
    // VALUES
    // =====================================================================

    @Override
    public MatlabNode visitNumberLiteral(NumberLiteral node) {
        return node;
    }

    @Override
    public MatlabNode visitStringLiteral(StringLiteral node) {
        return node;
    }

    @Override
    public MatlabNode visitBooleanLiteral(BooleanLiteral node) {
        return node;
    }

    @Override
    public MatlabNode visitSpecial(Special node) {
        return node;
    }

    @Override
    public MatlabNode visitArray(Array node) {
        List<List<MatlabNode>> rows = new ArrayList<>();
        for (List<MatlabNode> row : node.getRows()) {
            rows.add(resolveAll(row));
        }
        return new Array(node.isCell(), rows);
    }

    @Override
    public MatlabNode visitFunHandle(FunHandle node) {
        return node;
    }

    @Override
    public MatlabNode visitAnonFun(AnonFun node) {
        Set<String> params = new HashSet<>();
        for (MatlabNode param : node.getParams()) {
            if (param instanceof Identifier) {
                params.add(((Identifier) param).getName());
            }
        }
        anonymousParameters.push(params);
        try {
            return new AnonFun(node.getParams(), resolve(node.getBody()));
        } finally {
            anonymousParameters.pop();
        }
    }

    // =====================================================================
    // OPERATORS
    // =====================================================================

    @Override
    public MatlabNode visitUnaryOp(UnaryOp node) {
        return new UnaryOp(node.getOp(), resolve(node.getOperand()));
    }

    @Override
    public MatlabNode visitBinaryOp(BinaryOp node) {
        MatlabNode left = resolve(node.getLeft());
        return new BinaryOp(node.getOp(), left, resolve(node.getRight()));
    }

    @Override
    public MatlabNode visitTernaryOp(TernaryOp node) {
        MatlabNode left = resolve(node.getLeft());
        MatlabNode middle = resolve(node.getMiddle());
        return new TernaryOp(left, middle, resolve(node.getRight()));
    }

    @Override
    public MatlabNode visitTranspose(Transpose node) {
        return new Transpose(node.getOp(), resolve(node.getOperand()));
    }

    // =====================================================================
    // STATEMENTS
    // =====================================================================

    /** The right-hand side is resolved before the target is recorded, so "x = x(1)" never sees itself. */
    @Override
    public MatlabNode visitAssignment(Assignment node) {
        MatlabNode rhs = resolve(node.getRhs());
        MatlabNode lhs = resolveLhs(node.getLhs());

        current().putAssignment(MatlabFormatter.toKey(lhs), rhs);
        declareVariable(lhs);
        return new Assignment(lhs, rhs);
    }

    @Override
    public MatlabNode visitFunDef(FunDef node) {
        MatlabContext parent = current();
        String name = node.getName().getName();
        // A variable assigned earlier in this scope stays a variable
        if (parent.getTypes().get(name) != SymbolType.VARIABLE) {
            parent.putType(name, SymbolType.FUNCTION);
        }

        MatlabContext function = new MatlabContext(name, parent);
        function.setFile(parent.getFile());
        function.setParameters(node.getParams());
        function.setReturns(node.getReturns());
        parent.addFunction(function);

        List<MatlabNode> body;
        pushContext(function);
        try {
            for (MatlabNode param : node.getParams()) {
                declareVariable(param);
            }
            for (MatlabNode output : node.getReturns()) {
                declareVariable(output);
            }
            body = resolveAll(node.getBody());
        } finally {
            popContext();
        }

        FunDef resolved = new FunDef(node.getName(), node.getParams(), node.getReturns(), body);
        function.setDefinition(resolved);
        function.setNodes(resolved.getBody());
        return resolved;
    }

    @Override
    public MatlabNode visitIf(If node) {
        MatlabNode condition = resolve(node.getCondition());
        List<MatlabNode> body = resolveAll(node.getBody());
        List<Elseif> elseifs = new ArrayList<>();
        for (Elseif clause : node.getElseifs()) {
            elseifs.add((Elseif) resolve(clause));
        }
        Else elseClause = node.getElseClause() == null ? null : (Else) resolve(node.getElseClause());
        return new If(condition, body, elseifs, elseClause);
    }

    @Override
    public MatlabNode visitElseif(Elseif node) {
        MatlabNode condition = resolve(node.getCondition());
        return new Elseif(condition, resolveAll(node.getBody()));
    }

    @Override
    public MatlabNode visitElse(Else node) {
        return new Else(resolveAll(node.getBody()));
    }

    @Override
    public MatlabNode visitWhile(While node) {
        MatlabNode condition = resolve(node.getCondition());
        return new While(condition, resolveAll(node.getBody()));
    }

    @Override
    public MatlabNode visitFor(For node) {
        MatlabNode expression = resolve(node.getExpression());
        declareVariable(node.getVariable());
        return new For(node.getVariable(), expression, resolveAll(node.getBody()));
    }

    @Override
    public MatlabNode visitSwitch(Switch node) {
        MatlabNode subject = resolve(node.getSubject());
        List<Case> cases = new ArrayList<>();
        for (Case clause : node.getCases()) {
            cases.add((Case) resolve(clause));
        }
        Otherwise otherwise = node.getOtherwise() == null ? null : (Otherwise) resolve(node.getOtherwise());
        return new Switch(subject, cases, otherwise);
    }

    @Override
    public MatlabNode visitCase(Case node) {
        MatlabNode value = resolve(node.getValue());
        return new Case(value, resolveAll(node.getBody()));
    }

    @Override
    public MatlabNode visitOtherwise(Otherwise node) {
        return new Otherwise(resolveAll(node.getBody()));
    }

    @Override
    public MatlabNode visitTryCatch(TryCatch node) {
        List<MatlabNode> body = resolveAll(node.getBody());
        if (node.getCatchVariable() != null) {
            declareVariable(node.getCatchVariable());
        }
        return new TryCatch(body, node.getCatchVariable(), resolveAll(node.getCatchBody()));
    }

    @Override
    public MatlabNode visitBranch(Branch node) {
        return node;
    }

    @Override
    public MatlabNode visitShellCommand(ShellCommand node) {
        return node;
    }

    @Override
    public MatlabNode visitMatlabCommand(MatlabCommand node) {
        if ("global".equals(node.getName()) || "persistent".equals(node.getName())) {
            for (String name : node.getArgs()) {
                current().putType(name, SymbolType.VARIABLE);
            }
        }
        return node;
    }

    @Override
    public MatlabNode visitComment(Comment node) {
        return node;
    }
}
