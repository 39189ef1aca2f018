package org.oxygen.compiler.frontend.lexer;

/**
 * The position of the {@link Lexer} within a file. One instance is threaded through
 * all lines of a file so that line and column numbers stay continuous.
 */
public final class ScanState {

    private int line;
    private int column;

    /**
     * Creates a state positioned at line 1, column 1.
     */
    public ScanState() {
        this(1, 1);
    }

    ScanState(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    void advance(int columns) {
        column += columns;
    }

    void nextLine() {
        line++;
        column = 1;
    }

    @Override
    public String toString() {
        return "ScanState[" + line + ":" + column + "]";
    }
}
