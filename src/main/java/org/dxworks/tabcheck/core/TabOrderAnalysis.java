package org.dxworks.tabcheck.core;

import org.dxworks.tabcheck.model.Finding;
import org.dxworks.tabcheck.model.OrderAssignment;
import org.dxworks.tabcheck.model.StatementOperation;
import org.dxworks.tabcheck.report.DiagnosticEmitter;

/**
 * Runs the tab order analysis over the classified statements of one scope.
 * <p>
 * Non-literal TabIndex values are reported as soon as they are seen. Position mismatches
 * are reported once every statement of the scope has been observed. This class keeps no
 * state between calls and may be shared between threads.
 */
public class TabOrderAnalysis {

    private final ConsistencyChecker checker = new ConsistencyChecker();

    /**
     * @return the tracker built for the scope, for callers that want to inspect it
     */
    public OrderingTracker analyzeScope(Iterable<? extends StatementOperation> operations, DiagnosticEmitter emitter) {
        OrderingTracker tracker = new OrderingTracker();
        for (StatementOperation operation : operations) {
            if (operation instanceof OrderAssignment && !((OrderAssignment) operation).isNumeric()) {
                emitter.emit(Finding.nonNumericOrderValue((OrderAssignment) operation));
            }
            tracker.observe(operation);
        }
        for (Finding finding : checker.check(tracker)) {
            emitter.emit(finding);
        }
        return tracker;
    }
}
