package matlabode;

import matlabode.MatlabNode.FunDef;

import java.nio.file.Path;
import java.util.*;

/**
 * Lexical scope produced by {@link MatlabSemanticAnalyzer}: the file itself
 * at the root, one child per function definition.
 *
 * A context owns its statement list only at the root. A function context's
 * nodes are a view of its {@link FunDef} body, and the parent link and the
 * function table are plain references. Lookups consult this context and then
 * its ancestors, never siblings or children.
 */
public class MatlabContext {

    public enum SymbolType {
        VARIABLE,
        FUNCTION;

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final String name;
    private final MatlabContext parent;

    private List<MatlabNode> nodes = Collections.emptyList();
    private List<MatlabNode> parameters = Collections.emptyList();
    private List<MatlabNode> returns = Collections.emptyList();
    private final Map<String, MatlabContext> functions = new LinkedHashMap<>();
    private final Map<String, MatlabNode> assignments = new LinkedHashMap<>();
    private final Map<String, SymbolType> types = new LinkedHashMap<>();
    private final Map<String, List<List<MatlabNode>>> calls = new LinkedHashMap<>();

    private Path file;
    private FunDef definition;

    public MatlabContext(String name, MatlabContext parent) {
        this.name = Objects.requireNonNull(name);
        this.parent = parent;
    }

    // Getters
    public String getName() { return name; }
    public MatlabContext getParent() { return parent; }
    public List<MatlabNode> getNodes() { return nodes; }
    public List<MatlabNode> getParameters() { return parameters; }
    public List<MatlabNode> getReturns() { return returns; }
    public Map<String, MatlabContext> getFunctions() { return Collections.unmodifiableMap(functions); }

    /** Normalized LHS text (see {@link MatlabFormatter#toKey}) to the most recent RHS. */
    public Map<String, MatlabNode> getAssignments() { return Collections.unmodifiableMap(assignments); }

    public Map<String, SymbolType> getTypes() { return Collections.unmodifiableMap(types); }

    /** Function name to the argument list of every call, in document order. */
    public Map<String, List<List<MatlabNode>>> getCalls() {
        Map<String, List<List<MatlabNode>>> view = new LinkedHashMap<>();
        for (Map.Entry<String, List<List<MatlabNode>>> entry : calls.entrySet()) {
            view.put(entry.getKey(), Collections.unmodifiableList(entry.getValue()));
        }
        return Collections.unmodifiableMap(view);
    }

    /** Source file, when parsed from one; null for the contexts of parsed strings. */
    public Path getFile() { return file; }

    /** The definition this context belongs to; null at the root. */
    public FunDef getDefinition() { return definition; }

    public boolean isRoot() { return parent == null; }

    /** Slash-separated names from the root, e.g. "model.m/main/rhs". */
    public String getPath() {
        return parent == null ? name : parent.getPath() + "/" + name;
    }

    // =====================================================================
    // LOOKUPS
    // =====================================================================

    public SymbolType lookupType(String symbol) {
        for (MatlabContext context = this; context != null; context = context.parent) {
            SymbolType type = context.types.get(symbol);
            if (type != null) {
                return type;
            }
        }
        return null;
    }

    public MatlabNode lookupAssignment(String key) {
        for (MatlabContext context = this; context != null; context = context.parent) {
            MatlabNode value = context.assignments.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public MatlabContext lookupFunction(String functionName) {
        for (MatlabContext context = this; context != null; context = context.parent) {
            MatlabContext function = context.functions.get(functionName);
            if (function != null) {
                return function;
            }
        }
        return null;
    }

    public boolean isVariable(String symbol) {
        return lookupType(symbol) == SymbolType.VARIABLE;
    }

    // =====================================================================
    // POPULATED BY THE ANALYZER
    // =====================================================================

    void setNodes(List<MatlabNode> nodes) {
        this.nodes = Collections.unmodifiableList(nodes);
    }

    void setParameters(List<MatlabNode> parameters) {
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    void setReturns(List<MatlabNode> returns) {
        this.returns = Collections.unmodifiableList(new ArrayList<>(returns));
    }

    void addFunction(MatlabContext function) {
        functions.put(function.getName(), function);
    }

    void putAssignment(String key, MatlabNode value) {
        assignments.put(key, value);
    }

    void putType(String symbol, SymbolType type) {
        types.put(symbol, type);
    }

    void addCall(String functionName, List<MatlabNode> args) {
        calls.computeIfAbsent(functionName, k -> new ArrayList<>()).add(args);
    }

    void setFile(Path file) {
        this.file = file;
    }

    void setDefinition(FunDef definition) {
        this.definition = definition;
    }

    @Override
    public String toString() {
        return String.format("MatlabContext{path=%s, nodes=%d, functions=%s, variables=%s}",
                             getPath(), nodes.size(), functions.keySet(), variableNames());
    }

    private List<String> variableNames() {
        List<String> names = new ArrayList<>();
        for (Map.Entry<String, SymbolType> entry : types.entrySet()) {
            if (entry.getValue() == SymbolType.VARIABLE) {
                names.add(entry.getKey());
            }
        }
        return names;
    }
}
