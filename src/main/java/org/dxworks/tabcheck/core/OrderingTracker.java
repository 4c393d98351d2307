package org.dxworks.tabcheck.core;

import org.dxworks.tabcheck.model.AttachOperation;
import org.dxworks.tabcheck.model.OrderAssignment;
import org.dxworks.tabcheck.model.StatementOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Accumulates the attach order and the declared TabIndex values of one scope.
 * <p>
 * Instances hold mutable state and belong to a single scope; create a new one for each
 * routine analyzed and do not share it between threads.
 */
public class OrderingTracker {

    // container -> attach calls, in source order
    private final Map<String, List<AttachOperation>> attachSequences = new LinkedHashMap<>();
    private final Map<String, OrderAssignment> declaredOrders = new HashMap<>();
    // controls that got a non-literal TabIndex somewhere in the scope
    private final Set<String> nonNumericControls = new HashSet<>();

    public void observe(StatementOperation operation) {
        if (operation instanceof AttachOperation) {
            AttachOperation attach = (AttachOperation) operation;
            attachSequences.computeIfAbsent(attach.container, k -> new ArrayList<>()).add(attach);
        } else if (operation instanceof OrderAssignment) {
            observeOrderAssignment((OrderAssignment) operation);
        } else if (operation != null) {
            throw new IllegalArgumentException("Unsupported operation: " + operation.getClass().getName());
        }
    }

    private void observeOrderAssignment(OrderAssignment assignment) {
        if (!assignment.isNumeric()) {
            nonNumericControls.add(assignment.control);
            declaredOrders.remove(assignment.control);
            return;
        }
        if (nonNumericControls.contains(assignment.control)) {
            return;
        }
        declaredOrders.put(assignment.control, assignment);
    }

    /**
     * Containers in the order they were first attached to, each with its children in
     * attach order. Duplicated children are kept.
     */
    public Map<String, List<AttachOperation>> getAttachSequences() {
        Map<String, List<AttachOperation>> view = new LinkedHashMap<>();
        attachSequences.forEach((container, children) -> view.put(container, Collections.unmodifiableList(children)));
        return Collections.unmodifiableMap(view);
    }

    /**
     * The last literal TabIndex assignment of a control, if it has one and never received
     * a non-literal value in this scope.
     */
    public Optional<OrderAssignment> getDeclaredOrder(String control) {
        return Optional.ofNullable(declaredOrders.get(control));
    }
}
