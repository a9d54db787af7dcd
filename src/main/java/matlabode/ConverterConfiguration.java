package matlabode;

import java.util.*;

/**
 * Settings shared by the parser and the ODE extractor. Every getter falls
 * back to a default, so a freshly constructed instance is usable as is.
 */
public class ConverterConfiguration {

    public static final String DEFAULT_KNOWN_FUNCTIONS_RESOURCE = "matlabode/matlab-functions.txt";

    private String knownFunctionsResource;
    private Set<String> solverNames;
    private Set<String> ignoredBindingFunctions;
    private Set<String> arrayConstructors;

    // Extraction options
    private boolean useFunctionFileContext = true;
    private boolean collectLocalParameters = true;

    public String getKnownFunctionsResource() {
        return knownFunctionsResource != null ? knownFunctionsResource : DEFAULT_KNOWN_FUNCTIONS_RESOURCE;
    }

    public void setKnownFunctionsResource(String resource) {
        this.knownFunctionsResource = resource;
    }

    /** MATLAB ODE solvers whose calls mark the model to convert. */
    public Set<String> getSolverNames() {
        if (solverNames == null) {
            solverNames = new LinkedHashSet<>(Arrays.asList(
                "ode113", "ode15i", "ode15s", "ode23", "ode23s", "ode23t", "ode23tb", "ode45"));
        }
        return solverNames;
    }

    public void setSolverNames(Collection<String> names) {
        this.solverNames = new LinkedHashSet<>(names);
    }

    /**
     * Calls whose results are solver settings rather than model parameters,
     * so "opts = odeset(...)" never becomes a parameter binding.
     */
    public Set<String> getIgnoredBindingFunctions() {
        if (ignoredBindingFunctions == null) {
            ignoredBindingFunctions = new LinkedHashSet<>(Arrays.asList("odeset", "odeget"));
        }
        return ignoredBindingFunctions;
    }

    public void setIgnoredBindingFunctions(Collection<String> names) {
        this.ignoredBindingFunctions = new LinkedHashSet<>(names);
    }

    /** Functions that build arrays, so "M = zeros(2, 2)" is not a scalar parameter. */
    public Set<String> getArrayConstructors() {
        if (arrayConstructors == null) {
            arrayConstructors = new LinkedHashSet<>(Arrays.asList(
                "cat", "cell", "colon", "diag", "eye", "horzcat", "linspace", "logspace", "magic",
                "meshgrid", "ndgrid", "ones", "rand", "randi", "randn", "repmat", "reshape",
                "struct", "vertcat", "zeros"));
        }
        return arrayConstructors;
    }

    public void setArrayConstructors(Collection<String> names) {
        this.arrayConstructors = new LinkedHashSet<>(names);
    }

    /** Whether a file holding a single function and nothing else is analyzed inside that function. */
    public boolean isUseFunctionFileContext() {
        return useFunctionFileContext;
    }

    public void setUseFunctionFileContext(boolean useFunctionFileContext) {
        this.useFunctionFileContext = useFunctionFileContext;
    }

    public boolean isCollectLocalParameters() {
        return collectLocalParameters;
    }

    public void setCollectLocalParameters(boolean collectLocalParameters) {
        this.collectLocalParameters = collectLocalParameters;
    }

    public void loadDefaults() {
        knownFunctionsResource = DEFAULT_KNOWN_FUNCTIONS_RESOURCE;
        solverNames = null;
        ignoredBindingFunctions = null;
        arrayConstructors = null;
        getSolverNames();
        getIgnoredBindingFunctions();
        getArrayConstructors();
        useFunctionFileContext = true;
        collectLocalParameters = true;
    }

    public List<String> validate() {
        List<String> issues = new ArrayList<>();

        if (getKnownFunctionsResource().trim().isEmpty()) {
            issues.add("Known function resource path must not be empty");
        }
        if (getSolverNames().isEmpty()) {
            issues.add("At least one ODE solver name must be configured");
        }
        for (String solver : getSolverNames()) {
            if (solver == null || !solver.matches("[A-Za-z_][A-Za-z0-9_]*")) {
                issues.add("Solver name is not a MATLAB identifier: " + solver);
            }
        }

        return issues;
    }

    @Override
    public String toString() {
        return String.format("ConverterConfiguration{functions=%s, solvers=%s, functionFileContext=%s, localParameters=%s}",
                             getKnownFunctionsResource(), getSolverNames(), useFunctionFileContext, collectLocalParameters);
    }
}
