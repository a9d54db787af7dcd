package matlabode;

public class UnresolvableDerivativeReferenceException extends ModelShapeException {

    private static final long serialVersionUID = 1L;

    public UnresolvableDerivativeReferenceException(String message) {
        super(message);
    }
}
