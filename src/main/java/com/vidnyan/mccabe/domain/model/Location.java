package com.vidnyan.mccabe.domain.model;

/**
 * Source code location.
 */
public record Location(
    String filePath,
    int line,
    int column
) {

    public static Location at(String filePath, int line, int column) {
        return new Location(filePath, line, column);
    }

    /**
     * Format as {@code file:line:column}.
     */
    public String format() {
        return filePath + ":" + line + ":" + column;
    }
}
