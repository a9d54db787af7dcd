package matlabode;

import java.util.List;

public class MultipleSolverCallsFoundException extends ModelShapeException {

    private static final long serialVersionUID = 1L;

    private final List<String> solvers;

    public MultipleSolverCallsFoundException(List<String> solvers) {
        super("it contains " + solvers.size() + " ODE solver calls " + solvers + " and only one is supported");
        this.solvers = solvers;
    }

    /** Solver name of each call found, in the order the calls were recorded. */
    public List<String> getSolvers() { return solvers; }
}
