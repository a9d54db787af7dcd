package matlabode;

public class MalformedDerivativeBodyException extends ModelShapeException {

    private static final long serialVersionUID = 1L;

    public MalformedDerivativeBodyException(String message) {
        super(message);
    }
}
