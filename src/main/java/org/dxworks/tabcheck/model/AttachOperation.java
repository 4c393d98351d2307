package org.dxworks.tabcheck.model;

/**
 * {@code <container>.Controls.Add(<control>)}.
 */
public class AttachOperation implements StatementOperation {
    public final String container;
    public final String control;
    public final SourceLocation location;

    public AttachOperation(String container, String control, SourceLocation location) {
        this.container = container;
        this.control = control;
        this.location = location;
    }

    @Override
    public String toString() {
        return container + ".Add(" + control + ")";
    }
}
