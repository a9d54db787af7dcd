package matlabode;

public class NoSolverCallFoundException extends ModelShapeException {

    private static final long serialVersionUID = 1L;

    public NoSolverCallFoundException(String contextName) {
        super("no call to a supported ODE solver was found in " + contextName);
    }
}
