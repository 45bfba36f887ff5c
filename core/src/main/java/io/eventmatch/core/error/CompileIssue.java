package io.eventmatch.core.error;

/**
 * A single problem found while parsing or type-checking an expression.
 *
 * @param message description of the problem
 * @param line    1-based line, or {@code -1} if unknown
 * @param column  0-based column, or {@code -1} if unknown
 */
public record CompileIssue(String message, int line, int column) {

    public static CompileIssue of(String message) {
        return new CompileIssue(message, -1, -1);
    }

    @Override
    public String toString() {
        return line < 0 ? message : "line " + line + ", column " + column + ": " + message;
    }
}
