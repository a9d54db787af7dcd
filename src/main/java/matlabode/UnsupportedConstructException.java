package matlabode;

public class UnsupportedConstructException extends ModelShapeException {

    private static final long serialVersionUID = 1L;

    private final String construct;
    private final int line;
    private final int column;

    public UnsupportedConstructException(String construct, int line, int column) {
        super("it uses " + construct + " (line " + line + ", column " + column + "), which is not supported");
        this.construct = construct;
        this.line = line;
        this.column = column;
    }

    public String getConstruct() { return construct; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
}
