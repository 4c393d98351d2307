package org.dxworks.tabcheck.report;

import org.dxworks.tabcheck.model.Diagnostic;

/**
 * Receives rendered diagnostics. Implementations must accept concurrent calls from
 * independent scopes.
 */
public interface DiagnosticSink {
    void accept(Diagnostic diagnostic);
}
