package matlabode;

/**
 * The input parsed, but its shape falls outside what the converter handles.
 * A caller converting many files can report these and move on.
 */
public class ModelShapeException extends OdeConversionException {

    private static final long serialVersionUID = 1L;

    public ModelShapeException(String message) {
        super(message);
    }
}
