package org.dxworks.tabcheck.model;

/**
 * {@code <control>.TabIndex = <value>}. {@link #value} is null when the right-hand side
 * is not an integer literal.
 */
public class OrderAssignment implements StatementOperation {
    public final String control;
    public final Integer value;
    public final String valueText;
    // location of the right-hand side expression
    public final SourceLocation location;

    public OrderAssignment(String control, Integer value, String valueText, SourceLocation location) {
        this.control = control;
        this.value = value;
        this.valueText = valueText;
        this.location = location;
    }

    public static OrderAssignment numeric(String control, int value, SourceLocation location) {
        return new OrderAssignment(control, value, Integer.toString(value), location);
    }

    public static OrderAssignment nonNumeric(String control, String valueText, SourceLocation location) {
        return new OrderAssignment(control, null, valueText, location);
    }

    public boolean isNumeric() {
        return value != null;
    }

    @Override
    public String toString() {
        return control + ".TabIndex = " + valueText;
    }
}
