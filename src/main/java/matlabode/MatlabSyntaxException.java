package matlabode;

/**
 * The source text is not valid MATLAB. Raised on the first error found;
 * the parser does not attempt recovery.
 */
public class MatlabSyntaxException extends OdeConversionException {

    private static final long serialVersionUID = 1L;

    private final String sourceName;
    private final int line;
    private final int column;

    public MatlabSyntaxException(String sourceName, int line, int column, String message) {
        super(sourceName + ":" + line + ":" + column + ": " + message);
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
    }

    public String getSourceName() { return sourceName; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
}
