package org.dxworks.tabcheck.analyzer;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.dxworks.tabcheck.analyzer.TreeSitterHelper.*;

/**
 * Collects the block bodies of methods with one of the configured names, typically
 * {@code InitializeComponent}. Only the top-level statements of the body are part of the
 * scope; nested blocks, lambdas and local functions are not looked into.
 */
public class MethodScopeCollector implements ScopeCollector {

    private final Set<String> methodNames;

    public MethodScopeCollector(Set<String> methodNames) {
        this.methodNames = Set.copyOf(methodNames);
    }

    @Override
    public List<AnalysisScope> collect(SourceFile source, TSNode rootNode) {
        List<AnalysisScope> scopes = new ArrayList<>();
        for (TSNode method : findAllDescendants(rootNode, "method_declaration")) {
            String name = getMethodName(source, method);
            if (name == null || !methodNames.contains(name)) {
                continue;
            }
            TSNode body = getChildByFieldName(method, "body");
            if (body == null || !"block".equals(body.getType())) {
                body = findFirstChild(method, "block");
            }
            if (body == null) {
                // abstract, partial or expression-bodied declaration
                continue;
            }
            scopes.add(new AnalysisScope(qualifiedName(source, method, name), getLocation(method), getCodeChildren(body)));
        }
        return scopes;
    }

    private String getMethodName(SourceFile source, TSNode method) {
        TSNode nameNode = getChildByFieldName(method, "name");
        if (nameNode == null) {
            nameNode = findFirstChild(method, "identifier");
        }
        return nameNode != null ? getNodeText(source, nameNode) : null;
    }

    private String qualifiedName(SourceFile source, TSNode method, String methodName) {
        TSNode type = findEnclosing(method, "class_declaration", "struct_declaration", "record_declaration");
        if (type == null) {
            return methodName;
        }
        TSNode typeName = getChildByFieldName(type, "name");
        if (typeName == null) {
            typeName = findFirstChild(type, "identifier");
        }
        return typeName != null ? getNodeText(source, typeName) + "." + methodName : methodName;
    }
}
