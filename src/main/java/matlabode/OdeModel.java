package matlabode;

import java.util.*;

/**
 * Normalized ODE system found in a MATLAB file: the solver invocation, the
 * right-hand side of every state equation and the scalar parameters the
 * equations refer to. Expressions are kept as resolved {@link MatlabNode}s;
 * turning them into SBML or XPP is left to an {@link OdeModelEmitter}.
 */
public final class OdeModel {

    /** d(state[stateIndex])/dt = rhs, with 1-based indices as in MATLAB. */
    public static final class Equation {
        private final int stateIndex;
        private final MatlabNode rhs;

        public Equation(int stateIndex, MatlabNode rhs) {
            this.stateIndex = stateIndex;
            this.rhs = Objects.requireNonNull(rhs);
        }

        public int getStateIndex() { return stateIndex; }
        public MatlabNode getRhs() { return rhs; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Equation)) {
                return false;
            }
            Equation other = (Equation) o;
            return stateIndex == other.stateIndex && rhs.equals(other.rhs);
        }

        @Override
        public int hashCode() { return Objects.hash(stateIndex, rhs); }

        @Override
        public String toString() {
            return "d[" + stateIndex + "]/dt = " + MatlabFormatter.format(rhs);
        }
    }

    public static final class ParameterBinding {
        private final String name;
        private final MatlabNode expression;

        public ParameterBinding(String name, MatlabNode expression) {
            this.name = Objects.requireNonNull(name);
            this.expression = Objects.requireNonNull(expression);
        }

        public String getName() { return name; }
        public MatlabNode getExpression() { return expression; }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ParameterBinding)) {
                return false;
            }
            ParameterBinding other = (ParameterBinding) o;
            return name.equals(other.name) && expression.equals(other.expression);
        }

        @Override
        public int hashCode() { return Objects.hash(name, expression); }

        @Override
        public String toString() {
            return name + " = " + MatlabFormatter.format(expression);
        }
    }

    private final String solverName;
    private final MatlabNode derivative;
    private final String derivativeFunctionName;
    private final String independentVariable;
    private final String stateVariable;
    private final MatlabNode timeSpan;
    private final MatlabNode initialConditions;
    private final List<Equation> equations;
    private final List<ParameterBinding> parameters;
    private final List<ParameterBinding> localParameters;
    private final List<String> outputVariables;
    private final List<MatlabNode> extraArguments;
    private final SortedMap<Integer, String> stateNames;

    OdeModel(String solverName, MatlabNode derivative, String derivativeFunctionName,
             String independentVariable, String stateVariable,
             MatlabNode timeSpan, MatlabNode initialConditions,
             List<Equation> equations, List<ParameterBinding> parameters,
             List<ParameterBinding> localParameters, List<String> outputVariables,
             List<MatlabNode> extraArguments, Map<Integer, String> stateNames) {
        this.solverName = solverName;
        this.derivative = derivative;
        this.derivativeFunctionName = derivativeFunctionName;
        this.independentVariable = independentVariable;
        this.stateVariable = stateVariable;
        this.timeSpan = timeSpan;
        this.initialConditions = initialConditions;
        this.equations = Collections.unmodifiableList(new ArrayList<>(equations));
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.localParameters = Collections.unmodifiableList(new ArrayList<>(localParameters));
        this.outputVariables = Collections.unmodifiableList(new ArrayList<>(outputVariables));
        this.extraArguments = Collections.unmodifiableList(new ArrayList<>(extraArguments));
        this.stateNames = Collections.unmodifiableSortedMap(new TreeMap<>(stateNames));
    }

    public String getSolverName() { return solverName; }

    /** The {@link MatlabNode.FunHandle} or {@link MatlabNode.AnonFun} passed to the solver. */
    public MatlabNode getDerivative() { return derivative; }

    /** Name of the derivative function, or null when the derivative is an anonymous function. */
    public String getDerivativeFunctionName() { return derivativeFunctionName; }

    public String getIndependentVariable() { return independentVariable; }
    public String getStateVariable() { return stateVariable; }
    public MatlabNode getTimeSpan() { return timeSpan; }
    public MatlabNode getInitialConditions() { return initialConditions; }
    public List<Equation> getEquations() { return equations; }
    public List<ParameterBinding> getParameters() { return parameters; }

    /** Scalar assignments inside the derivative function body. */
    public List<ParameterBinding> getLocalParameters() { return localParameters; }

    /** Variables receiving the solver result, e.g. t and y in "[t, y] = ode45(...)". */
    public List<String> getOutputVariables() { return outputVariables; }

    /** Solver arguments after the initial conditions (options and extra parameters). */
    public List<MatlabNode> getExtraArguments() { return extraArguments; }

    /**
     * Names for state variables taken from comments such as "% x(1) [IFNb_mRNA]",
     * keyed by 1-based state index. States without such a comment are absent.
     */
    public SortedMap<Integer, String> getStateNames() { return stateNames; }

    public int getStateCount() { return equations.size(); }

    @Override
    public String toString() {
        return String.format("OdeModel{solver=%s, derivative=%s, states=%d, parameters=%s}",
                             solverName, MatlabFormatter.format(derivative), equations.size(), parameters);
    }
}
