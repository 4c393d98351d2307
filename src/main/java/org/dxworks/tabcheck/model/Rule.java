package org.dxworks.tabcheck.model;

import java.util.List;
import java.util.Optional;

/**
 * Diagnostic rules reported by the tab order analysis. Ids are stable and used as keys
 * in the configuration file.
 */
public enum Rule {
    NON_NUMERIC_ORDER_VALUE(
            "SWFA0001",
            "NonNumericOrderValue",
            "Ensure numeric controls tab order value",
            "Control '{0}' has unexpected TabIndex value.",
            "Avoid manually editing \"InitializeComponent()\" method."),
    INCONSISTENT_ORDER(
            "SWFA0010",
            "InconsistentOrder",
            "Verify correct controls tab order",
            "Control '{0}' has a different TabIndex value to its order in the parent's control collection.",
            "Remove TabIndex assignments and re-order controls in the parent's control collection.");

    public static final String CATEGORY = "Accessibility";

    private final String id;
    private final String ruleName;
    private final String title;
    private final String messageFormat;
    private final String help;

    Rule(String id, String ruleName, String title, String messageFormat, String help) {
        this.id = id;
        this.ruleName = ruleName;
        this.title = title;
        this.messageFormat = messageFormat;
        this.help = help;
    }

    public String getId() {
        return id;
    }

    public String getRuleName() {
        return ruleName;
    }

    public String getTitle() {
        return title;
    }

    public String getHelp() {
        return help;
    }

    public Severity getDefaultSeverity() {
        return Severity.WARNING;
    }

    /**
     * Fills the {@code {n}} placeholders of the message format. Quotes are literal,
     * unlike {@link java.text.MessageFormat}.
     */
    public String formatMessage(List<String> arguments) {
        String message = messageFormat;
        for (int i = 0; i < arguments.size(); i++) {
            message = message.replace("{" + i + "}", arguments.get(i));
        }
        return message;
    }

    /**
     * Looks a rule up by id ({@code SWFA0001}) or by name ({@code NonNumericOrderValue}).
     */
    public static Optional<Rule> fromKey(String key) {
        if (key == null) return Optional.empty();
        String trimmed = key.trim();
        for (Rule rule : values()) {
            if (rule.id.equalsIgnoreCase(trimmed) || rule.ruleName.equalsIgnoreCase(trimmed)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}
