package org.dxworks.tabcheck.analyzer;

import org.treesitter.TSNode;

import java.util.List;

/**
 * Finds the statement lists to analyze in a parsed compilation unit. Each returned scope
 * is analyzed on its own, with its own tracking state.
 * <p>
 * {@link MethodScopeCollector} covers initialization methods. Field initializers of the
 * same class are not collected; another implementation can add them.
 */
public interface ScopeCollector {
    List<AnalysisScope> collect(SourceFile source, TSNode rootNode);
}
