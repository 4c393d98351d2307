package org.dxworks.tabcheck.model;

import java.util.Objects;

/**
 * A defect found by the analysis, before it is rendered as a {@link Diagnostic}.
 * {@link #container}, {@link #position} and {@link #declaredOrder} are only set for
 * {@link Rule#INCONSISTENT_ORDER}.
 */
public class Finding {
    public final Rule rule;
    public final String control;
    public final SourceLocation location;
    public final String container;
    public final Integer position;
    public final Integer declaredOrder;

    private Finding(Rule rule, String control, SourceLocation location,
                    String container, Integer position, Integer declaredOrder) {
        this.rule = rule;
        this.control = control;
        this.location = location;
        this.container = container;
        this.position = position;
        this.declaredOrder = declaredOrder;
    }

    public static Finding nonNumericOrderValue(OrderAssignment assignment) {
        return new Finding(Rule.NON_NUMERIC_ORDER_VALUE, assignment.control, assignment.location,
                null, null, null);
    }

    public static Finding inconsistentOrder(String control, String container, int position,
                                            int declaredOrder, SourceLocation location) {
        return new Finding(Rule.INCONSISTENT_ORDER, control, location, container, position, declaredOrder);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Finding)) return false;
        Finding finding = (Finding) o;
        return rule == finding.rule
                && Objects.equals(control, finding.control)
                && Objects.equals(location, finding.location)
                && Objects.equals(container, finding.container)
                && Objects.equals(position, finding.position)
                && Objects.equals(declaredOrder, finding.declaredOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rule, control, location, container, position, declaredOrder);
    }

    @Override
    public String toString() {
        if (rule == Rule.INCONSISTENT_ORDER) {
            return rule.getRuleName() + "(" + control + " in " + container
                    + ": position " + position + ", TabIndex " + declaredOrder + ")";
        }
        return rule.getRuleName() + "(" + control + ")";
    }
}
