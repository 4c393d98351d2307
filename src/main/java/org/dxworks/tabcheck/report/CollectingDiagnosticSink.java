package org.dxworks.tabcheck.report;

import org.dxworks.tabcheck.model.Diagnostic;

import java.util.ArrayList;
import java.util.List;

public class CollectingDiagnosticSink implements DiagnosticSink {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public synchronized void accept(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public synchronized List<Diagnostic> getDiagnostics() {
        return new ArrayList<>(diagnostics);
    }
}
