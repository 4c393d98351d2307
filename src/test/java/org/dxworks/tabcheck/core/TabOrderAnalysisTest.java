package org.dxworks.tabcheck.core;

import org.dxworks.tabcheck.TabcheckConfig;
import org.dxworks.tabcheck.model.AttachOperation;
import org.dxworks.tabcheck.model.Diagnostic;
import org.dxworks.tabcheck.model.OrderAssignment;
import org.dxworks.tabcheck.model.SourceLocation;
import org.dxworks.tabcheck.model.StatementOperation;
import org.dxworks.tabcheck.report.CollectingDiagnosticSink;
import org.dxworks.tabcheck.report.DiagnosticEmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class TabOrderAnalysisTest {

    private final TabOrderAnalysis analysis = new TabOrderAnalysis();
    private CollectingDiagnosticSink sink;
    private DiagnosticEmitter emitter;

    @BeforeEach
    void setUp() {
        sink = new CollectingDiagnosticSink();
        emitter = new DiagnosticEmitter(TabcheckConfig.defaults(), sink, "Form1.Designer.cs");
    }

    private static AttachOperation attach(String container, String control) {
        return new AttachOperation(container, control, SourceLocation.at(1, 1));
    }

    private static OrderAssignment tabIndex(String control, int value) {
        return OrderAssignment.numeric(control, value, SourceLocation.at(2, 1));
    }

    private List<String> ruleNames() {
        return sink.getDiagnostics().stream().map(d -> d.ruleName).collect(Collectors.toList());
    }

    @Test
    void scenarioA_matchingOrder() {
        analysis.analyzeScope(List.of(
                attach("container.Controls", "btn1"),
                attach("container.Controls", "btn2"),
                tabIndex("btn1", 0),
                tabIndex("btn2", 1)), emitter);

        assertTrue(sink.getDiagnostics().isEmpty());
    }

    @Test
    void scenarioB_mismatchedOrder() {
        analysis.analyzeScope(List.of(
                attach("container.Controls", "btn1"),
                attach("container.Controls", "btn2"),
                tabIndex("btn1", 0),
                tabIndex("btn2", 5)), emitter);

        List<Diagnostic> diagnostics = sink.getDiagnostics();
        assertEquals(1, diagnostics.size());
        assertEquals("SWFA0010", diagnostics.get(0).ruleId);
        assertEquals(List.of("btn2"), diagnostics.get(0).arguments);
        assertEquals(1, diagnostics.get(0).position);
        assertEquals(5, diagnostics.get(0).declaredOrder);
    }

    @Test
    void scenarioC_nonNumericValueIsReportedOnceAndNeverDeclared() {
        OrderingTracker tracker = analysis.analyzeScope(List.of(
                attach("container.Controls", "btn0"),
                attach("container.Controls", "btn1"),
                OrderAssignment.nonNumeric("btn1", "someVariable", SourceLocation.at(3, 30)),
                tabIndex("btn1", 7)), emitter);

        assertEquals(List.of("NonNumericOrderValue"), ruleNames());
        assertEquals(SourceLocation.at(3, 30), sink.getDiagnostics().get(0).location);
        assertTrue(tracker.getDeclaredOrder("btn1").isEmpty());
    }

    @Test
    void scenarioD_positionsArePerContainer() {
        analysis.analyzeScope(List.of(
                attach("panelA.Controls", "x"),
                attach("panelB.Controls", "y"),
                tabIndex("x", 0),
                tabIndex("y", 0)), emitter);

        assertTrue(sink.getDiagnostics().isEmpty());
    }

    @Test
    void nonNumericValuesAreReportedBeforeOrderMismatches() {
        analysis.analyzeScope(List.of(
                attach("this.Controls", "a"),
                tabIndex("a", 3),
                OrderAssignment.nonNumeric("b", "GetIndex()", SourceLocation.at(4, 1))), emitter);

        assertEquals(List.of("NonNumericOrderValue", "InconsistentOrder"), ruleNames());
    }

    @Test
    void eachScopeStartsFromEmptyState() {
        analysis.analyzeScope(List.of(attach("this.Controls", "a"), attach("this.Controls", "b")), emitter);
        analysis.analyzeScope(List.of(attach("this.Controls", "b"), tabIndex("b", 0)), emitter);

        assertTrue(sink.getDiagnostics().isEmpty());
    }

    @Test
    void concurrentScopesDoNotInterfere() {
        List<StatementOperation> consistent = List.of(
                attach("this.Controls", "a"),
                attach("this.Controls", "b"),
                tabIndex("a", 0),
                tabIndex("b", 1));
        List<StatementOperation> swapped = List.of(
                attach("this.Controls", "b"),
                attach("this.Controls", "a"),
                tabIndex("a", 0),
                tabIndex("b", 1));

        IntStream.range(0, 200).parallel().forEach(i ->
                analysis.analyzeScope(i % 2 == 0 ? consistent : swapped, emitter));

        // only the 100 swapped scopes report, two findings each
        assertEquals(200, sink.getDiagnostics().size());
    }
}
