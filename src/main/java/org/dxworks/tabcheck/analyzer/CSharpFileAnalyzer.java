package org.dxworks.tabcheck.analyzer;

import org.dxworks.tabcheck.TabcheckConfig;
import org.dxworks.tabcheck.core.TabOrderAnalysis;
import org.dxworks.tabcheck.model.FileReport;
import org.dxworks.tabcheck.model.StatementOperation;
import org.dxworks.tabcheck.report.CollectingDiagnosticSink;
import org.dxworks.tabcheck.report.DiagnosticEmitter;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterCSharp;

import java.io.IOException;
import java.lang.ref.Reference;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses a C# file and runs the tab order analysis on each of its initialization scopes.
 * Safe for concurrent use: every call creates its own parser and scope state.
 */
public class CSharpFileAnalyzer {

    private static final TSLanguage CSHARP = new TreeSitterCSharp();

    private final TabcheckConfig config;
    private final ScopeCollector scopeCollector;
    private final TabOrderAnalysis analysis = new TabOrderAnalysis();

    public CSharpFileAnalyzer(TabcheckConfig config) {
        this(config, new MethodScopeCollector(config.getScopeMethods()));
    }

    public CSharpFileAnalyzer(TabcheckConfig config, ScopeCollector scopeCollector) {
        this.config = config;
        this.scopeCollector = scopeCollector;
    }

    public FileReport analyzeFile(Path filePath) throws IOException {
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);
        return analyze(filePath.toString(), sourceCode);
    }

    public FileReport analyze(String filePath, String sourceCode) {
        SourceFile source = new SourceFile(filePath, sourceCode);

        TSParser parser = new TSParser();
        parser.setLanguage(CSHARP);
        TSTree tree = parser.parseString(null, source.getText());
        TSNode rootNode = tree.getRootNode();

        FileReport report = new FileReport(filePath);
        CollectingDiagnosticSink sink = new CollectingDiagnosticSink();
        DiagnosticEmitter emitter = new DiagnosticEmitter(config, sink, filePath);
        StatementClassifier classifier = new StatementClassifier(source);

        try {
            for (AnalysisScope scope : scopeCollector.collect(source, rootNode)) {
                report.scopes.add(scope.name);
                analysis.analyzeScope(classify(classifier, scope), emitter);
            }
        } finally {
            // nodes only point into the native tree
            Reference.reachabilityFence(tree);
        }

        report.diagnostics.addAll(sink.getDiagnostics());
        return report;
    }

    private static List<StatementOperation> classify(StatementClassifier classifier, AnalysisScope scope) {
        List<StatementOperation> operations = new ArrayList<>();
        for (TSNode statement : scope.statements) {
            Optional<StatementOperation> operation = classifier.classify(statement);
            operation.ifPresent(operations::add);
        }
        return operations;
    }
}
