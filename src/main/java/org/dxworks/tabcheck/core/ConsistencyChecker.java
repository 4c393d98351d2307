package org.dxworks.tabcheck.core;

import org.dxworks.tabcheck.model.AttachOperation;
import org.dxworks.tabcheck.model.Finding;
import org.dxworks.tabcheck.model.OrderAssignment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Compares each child's position in its container with its declared TabIndex.
 * <p>
 * Positions are zero-based and counted per container. A child without a declared
 * TabIndex is never reported. A control that appears more than once, in one container
 * or in several, is checked at every position it occupies. The checker does not modify
 * the tracker, so checking the same tracker twice gives the same findings.
 */
public class ConsistencyChecker {

    public List<Finding> check(OrderingTracker tracker) {
        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<String, List<AttachOperation>> entry : tracker.getAttachSequences().entrySet()) {
            String container = entry.getKey();
            List<AttachOperation> children = entry.getValue();
            for (int position = 0; position < children.size(); position++) {
                String control = children.get(position).control;
                Optional<OrderAssignment> declared = tracker.getDeclaredOrder(control);
                if (declared.isEmpty()) {
                    continue;
                }
                OrderAssignment assignment = declared.get();
                if (assignment.value != position) {
                    findings.add(Finding.inconsistentOrder(control, container, position,
                            assignment.value, assignment.location));
                }
            }
        }
        return findings;
    }
}
