package org.dxworks.tabcheck.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A span in a source file. Lines and columns are 1-based; columns count UTF-8 bytes,
 * as reported by tree-sitter.
 */
@JsonPropertyOrder({"startLine", "startColumn", "endLine", "endColumn"})
public class SourceLocation {
    public int startLine;
    public int startColumn;
    public int endLine;
    public int endColumn;
    @JsonIgnore
    public int startByte;
    @JsonIgnore
    public int endByte;

    public SourceLocation(int startLine, int startColumn, int endLine, int endColumn, int startByte, int endByte) {
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.startByte = startByte;
        this.endByte = endByte;
    }

    public static SourceLocation at(int line, int column) {
        return new SourceLocation(line, column, line, column, -1, -1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return startLine == that.startLine && startColumn == that.startColumn
                && endLine == that.endLine && endColumn == that.endColumn
                && startByte == that.startByte && endByte == that.endByte;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, startColumn, endLine, endColumn, startByte, endByte);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn;
    }
}
