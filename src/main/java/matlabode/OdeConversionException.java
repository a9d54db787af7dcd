package matlabode;

/**
 * Base class for every reason a MATLAB file cannot be converted to an ODE model.
 * Messages complete the sentence "this file cannot be converted, because ...".
 */
public class OdeConversionException extends Exception {

    private static final long serialVersionUID = 1L;

    public OdeConversionException(String message) {
        super(message);
    }

    public OdeConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
