package org.dxworks.tabcheck.report;

import org.dxworks.tabcheck.TabcheckConfig;
import org.dxworks.tabcheck.model.Diagnostic;
import org.dxworks.tabcheck.model.Finding;
import org.dxworks.tabcheck.model.Rule;

import java.util.List;

/**
 * Renders findings of one file as diagnostics and passes them to a sink. Findings of
 * disabled rules are dropped.
 */
public class DiagnosticEmitter {

    private final TabcheckConfig config;
    private final DiagnosticSink sink;
    private final String filePath;

    public DiagnosticEmitter(TabcheckConfig config, DiagnosticSink sink, String filePath) {
        if (config == null || sink == null) {
            throw new IllegalArgumentException("config and sink are required");
        }
        this.config = config;
        this.sink = sink;
        this.filePath = filePath;
    }

    public void emit(Finding finding) {
        Rule rule = finding.rule;
        if (!config.isRuleEnabled(rule)) {
            return;
        }
        sink.accept(render(finding));
    }

    Diagnostic render(Finding finding) {
        Rule rule = finding.rule;
        Diagnostic diagnostic = new Diagnostic();
        diagnostic.ruleId = rule.getId();
        diagnostic.ruleName = rule.getRuleName();
        diagnostic.title = rule.getTitle();
        diagnostic.severity = config.severityOf(rule);
        diagnostic.category = Rule.CATEGORY;
        diagnostic.arguments.addAll(List.of(finding.control));
        diagnostic.message = rule.formatMessage(diagnostic.arguments);
        diagnostic.help = rule.getHelp();
        diagnostic.filePath = filePath;
        diagnostic.location = finding.location;
        diagnostic.container = finding.container;
        diagnostic.position = finding.position;
        diagnostic.declaredOrder = finding.declaredOrder;
        return diagnostic;
    }
}
