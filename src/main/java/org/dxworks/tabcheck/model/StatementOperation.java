package org.dxworks.tabcheck.model;

/**
 * Marker for the statements of an initialization routine that the tab order analysis
 * cares about: {@link AttachOperation} and {@link OrderAssignment}.
 */
public interface StatementOperation {
}
