package org.dxworks.tabcheck.core;

import org.dxworks.tabcheck.model.AttachOperation;
import org.dxworks.tabcheck.model.Finding;
import org.dxworks.tabcheck.model.OrderAssignment;
import org.dxworks.tabcheck.model.Rule;
import org.dxworks.tabcheck.model.SourceLocation;
import org.dxworks.tabcheck.model.StatementOperation;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsistencyCheckerTest {

    private final ConsistencyChecker checker = new ConsistencyChecker();

    private static AttachOperation attach(String container, String control) {
        return new AttachOperation(container, control, SourceLocation.at(1, 1));
    }

    private static OrderAssignment tabIndex(String control, int value, int line) {
        return OrderAssignment.numeric(control, value, SourceLocation.at(line, 20));
    }

    private static OrderingTracker track(StatementOperation... operations) {
        OrderingTracker tracker = new OrderingTracker();
        for (StatementOperation operation : operations) {
            tracker.observe(operation);
        }
        return tracker;
    }

    @Test
    void matchingOrderProducesNoFindings() {
        OrderingTracker tracker = track(
                attach("container.Controls", "btn1"),
                attach("container.Controls", "btn2"),
                tabIndex("btn1", 0, 3),
                tabIndex("btn2", 1, 4));

        assertTrue(checker.check(tracker).isEmpty());
    }

    @Test
    void mismatchIsReportedAtTheAssignedValue() {
        OrderingTracker tracker = track(
                attach("container.Controls", "btn1"),
                attach("container.Controls", "btn2"),
                tabIndex("btn1", 0, 3),
                tabIndex("btn2", 5, 4));

        List<Finding> findings = checker.check(tracker);

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals(Rule.INCONSISTENT_ORDER, finding.rule);
        assertEquals("btn2", finding.control);
        assertEquals("container.Controls", finding.container);
        assertEquals(1, finding.position);
        assertEquals(5, finding.declaredOrder);
        assertEquals(SourceLocation.at(4, 20), finding.location);
    }

    @Test
    void containersAreCheckedIndependently() {
        OrderingTracker tracker = track(
                attach("panelA.Controls", "x"),
                attach("panelB.Controls", "y"),
                tabIndex("x", 0, 3),
                tabIndex("y", 0, 4));

        assertTrue(checker.check(tracker).isEmpty());
    }

    @Test
    void controlsWithoutDeclaredOrderAreNotReported() {
        OrderingTracker tracker = track(
                attach("this.Controls", "a"),
                attach("this.Controls", "b"),
                attach("this.Controls", "c"),
                tabIndex("c", 2, 5));

        assertTrue(checker.check(tracker).isEmpty());
    }

    @Test
    void everyMismatchingPositionOfADuplicateIsReported() {
        OrderingTracker tracker = track(
                attach("this.Controls", "btn1"),
                attach("this.Controls", "btn1"),
                attach("this.Controls", "btn1"),
                tabIndex("btn1", 1, 4));

        List<Finding> findings = checker.check(tracker);

        assertEquals(2, findings.size());
        assertEquals(0, findings.get(0).position);
        assertEquals(2, findings.get(1).position);
    }

    @Test
    void controlAttachedToTwoContainersIsCheckedInEach() {
        OrderingTracker tracker = track(
                attach("panelA.Controls", "shared"),
                attach("panelB.Controls", "other"),
                attach("panelB.Controls", "shared"),
                tabIndex("shared", 1, 4));

        List<Finding> findings = checker.check(tracker);

        assertEquals(1, findings.size());
        assertEquals("panelA.Controls", findings.get(0).container);
        assertEquals(0, findings.get(0).position);
    }

    @Test
    void checkingTwiceGivesTheSameFindings() {
        OrderingTracker tracker = track(
                attach("this.Controls", "a"),
                attach("this.Controls", "b"),
                tabIndex("a", 1, 3),
                tabIndex("b", 0, 4));

        List<Finding> first = checker.check(tracker);
        List<Finding> second = checker.check(tracker);

        assertEquals(2, first.size());
        assertEquals(new HashSet<>(first), new HashSet<>(second));
    }

    @Test
    void emptyTrackerHasNoFindings() {
        assertTrue(checker.check(new OrderingTracker()).isEmpty());
    }
}
