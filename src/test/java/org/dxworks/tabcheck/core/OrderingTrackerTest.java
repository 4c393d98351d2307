package org.dxworks.tabcheck.core;

import org.dxworks.tabcheck.model.AttachOperation;
import org.dxworks.tabcheck.model.OrderAssignment;
import org.dxworks.tabcheck.model.SourceLocation;
import org.dxworks.tabcheck.model.StatementOperation;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class OrderingTrackerTest {

    private static AttachOperation attach(String container, String control) {
        return new AttachOperation(container, control, SourceLocation.at(1, 1));
    }

    private static List<String> children(OrderingTracker tracker, String container) {
        return tracker.getAttachSequences().getOrDefault(container, List.of()).stream()
                .map(attach -> attach.control)
                .collect(Collectors.toList());
    }

    @Test
    void keepsAttachOrderPerContainer() {
        OrderingTracker tracker = new OrderingTracker();
        tracker.observe(attach("this.Controls", "btn1"));
        tracker.observe(attach("panel1.Controls", "x"));
        tracker.observe(attach("this.Controls", "btn2"));

        assertEquals(List.of("btn1", "btn2"), children(tracker, "this.Controls"));
        assertEquals(List.of("x"), children(tracker, "panel1.Controls"));
        assertEquals(List.of("this.Controls", "panel1.Controls"),
                List.copyOf(tracker.getAttachSequences().keySet()));
    }

    @Test
    void duplicatesAreKept() {
        OrderingTracker tracker = new OrderingTracker();
        tracker.observe(attach("this.Controls", "btn1"));
        tracker.observe(attach("this.Controls", "btn1"));

        assertEquals(List.of("btn1", "btn1"), children(tracker, "this.Controls"));
    }

    @Test
    void lastLiteralAssignmentWins() {
        OrderingTracker tracker = new OrderingTracker();
        tracker.observe(OrderAssignment.numeric("btn1", 3, SourceLocation.at(1, 1)));
        tracker.observe(OrderAssignment.numeric("btn1", 0, SourceLocation.at(2, 1)));

        assertEquals(0, tracker.getDeclaredOrder("btn1").orElseThrow().value);
        assertEquals(SourceLocation.at(2, 1), tracker.getDeclaredOrder("btn1").orElseThrow().location);
    }

    @Test
    void nonNumericAssignmentClearsAndBlocksDeclaredOrder() {
        OrderingTracker tracker = new OrderingTracker();
        tracker.observe(OrderAssignment.numeric("btn1", 1, SourceLocation.at(1, 1)));
        tracker.observe(OrderAssignment.nonNumeric("btn1", "someVariable", SourceLocation.at(2, 1)));
        tracker.observe(OrderAssignment.numeric("btn1", 0, SourceLocation.at(3, 1)));

        assertTrue(tracker.getDeclaredOrder("btn1").isEmpty());
    }

    @Test
    void orderAssignmentBeforeAttachIsTracked() {
        OrderingTracker tracker = new OrderingTracker();
        tracker.observe(OrderAssignment.numeric("btn1", 0, SourceLocation.at(1, 1)));
        tracker.observe(attach("this.Controls", "btn1"));

        assertEquals(0, tracker.getDeclaredOrder("btn1").orElseThrow().value);
        assertEquals(List.of("btn1"), children(tracker, "this.Controls"));
    }

    @Test
    void attachSequencesAreReadOnly() {
        OrderingTracker tracker = new OrderingTracker();
        tracker.observe(attach("this.Controls", "btn1"));

        assertThrows(UnsupportedOperationException.class,
                () -> tracker.getAttachSequences().get("this.Controls").clear());
        assertNull(tracker.getAttachSequences().get("panel1.Controls"));
    }

    @Test
    void unsupportedOperationIsRejected() {
        OrderingTracker tracker = new OrderingTracker();

        assertThrows(IllegalArgumentException.class, () -> tracker.observe(new StatementOperation() {
        }));
    }
}
