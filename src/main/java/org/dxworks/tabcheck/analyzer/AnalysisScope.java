package org.dxworks.tabcheck.analyzer;

import org.dxworks.tabcheck.model.SourceLocation;
import org.treesitter.TSNode;

import java.util.List;

/**
 * One unit of analysis: the top-level statements of an initialization routine.
 */
public class AnalysisScope {
    public final String name;
    public final SourceLocation location;
    public final List<TSNode> statements;

    public AnalysisScope(String name, SourceLocation location, List<TSNode> statements) {
        this.name = name;
        this.location = location;
        this.statements = List.copyOf(statements);
    }
}
