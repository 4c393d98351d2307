package org.dxworks.tabcheck.analyzer;

import org.treesitter.TSNode;

import java.util.Optional;

import static org.dxworks.tabcheck.analyzer.TreeSitterHelper.*;

/**
 * Derives the textual key of the control an expression refers to.
 * <p>
 * Keys are compared as text; there is no symbol resolution, so {@code button1} and
 * {@code this.button1} are different controls.
 */
public class ControlKeyExtractor {

    private final SourceFile source;

    public ControlKeyExtractor(SourceFile source) {
        this.source = source;
    }

    public Optional<String> extract(TSNode expression) {
        if (expression == null || expression.isNull()) {
            return Optional.empty();
        }
        switch (expression.getType()) {
            // local variable, e.g. "button3.TabIndex = 0" --> "button3", "@class" --> "class"
            case "identifier":
                return nonEmpty(stripVerbatimPrefix(getNodeText(source, expression)));
            // field, e.g. "this.button1.TabIndex = 1" --> "this.button1"
            case "member_access_expression":
                return nonEmpty(getCompactText(source, expression));
            default:
                return Optional.empty();
        }
    }

    static String stripVerbatimPrefix(String identifier) {
        return identifier != null && identifier.startsWith("@") ? identifier.substring(1) : identifier;
    }

    private static Optional<String> nonEmpty(String text) {
        return (text == null || text.isBlank()) ? Optional.empty() : Optional.of(text.trim());
    }
}
