package org.dxworks.tabcheck.analyzer;

import org.dxworks.tabcheck.model.AttachOperation;
import org.dxworks.tabcheck.model.OrderAssignment;
import org.dxworks.tabcheck.model.StatementOperation;
import org.treesitter.TSNode;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

import static org.dxworks.tabcheck.analyzer.TreeSitterHelper.*;

/**
 * Recognizes the two statement shapes of generated Windows Forms code that the tab order
 * analysis needs:
 * <ul>
 *     <li>{@code <container>.Controls.Add(<control>);}</li>
 *     <li>{@code <control>.TabIndex = <value>;}</li>
 * </ul>
 * Everything else, including look-alikes whose control cannot be identified, is ignored.
 */
public class StatementClassifier {

    static final String ATTACH_SUFFIX = ".Controls.Add";
    static final String ORDER_PROPERTY = "TabIndex";

    private final SourceFile source;
    private final ControlKeyExtractor keyExtractor;

    public StatementClassifier(SourceFile source) {
        this.source = source;
        this.keyExtractor = new ControlKeyExtractor(source);
    }

    public Optional<StatementOperation> classify(TSNode statement) {
        if (statement == null || statement.isNull() || !"expression_statement".equals(statement.getType())) {
            return Optional.empty();
        }
        TSNode expression = getFirstCodeChild(statement);
        if (expression == null) {
            return Optional.empty();
        }
        switch (expression.getType()) {
            case "invocation_expression":
                return classifyAttach(expression);
            case "assignment_expression":
                return classifyOrderAssignment(expression);
            default:
                return Optional.empty();
        }
    }

    private Optional<StatementOperation> classifyAttach(TSNode invocation) {
        TSNode function = getChildByFieldName(invocation, "function");
        if (function == null) {
            function = getFirstCodeChild(invocation);
        }
        if (!isNodeTypeOneOf(function, "member_access_expression")) {
            return Optional.empty();
        }
        String callee = getCompactText(source, function);
        if (callee == null || !callee.endsWith(ATTACH_SUFFIX)) {
            return Optional.empty();
        }

        // this.Controls.Add(this.button2) --> this.button2
        List<TSNode> arguments = findAllChildren(getArgumentListNode(invocation), "argument");
        if (arguments.isEmpty()) {
            return Optional.empty();
        }
        // the expression comes after an optional "name:" prefix
        TSNode argumentExpression = getLastCodeChild(arguments.get(0));
        Optional<String> control = keyExtractor.extract(argumentExpression);
        if (control.isEmpty()) {
            return Optional.empty();
        }

        // this.Controls.Add --> this.Controls
        String container = getCompactText(source, getMemberReceiver(function));
        if (container == null || container.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new AttachOperation(container, control.get(), getLocation(argumentExpression)));
    }

    private Optional<StatementOperation> classifyOrderAssignment(TSNode assignment) {
        TSNode left = getChildByFieldName(assignment, "left");
        TSNode right = getChildByFieldName(assignment, "right");
        if (left == null) left = getFirstCodeChild(assignment);
        if (right == null) right = getLastCodeChild(assignment);
        if (left == null || right == null || left.getStartByte() >= right.getStartByte()) {
            return Optional.empty();
        }
        // Only plain "=", compound assignments do not declare a value
        String operator = source.slice(left.getEndByte(), right.getStartByte()).trim();
        if (!"=".equals(operator)) {
            return Optional.empty();
        }
        if (!"member_access_expression".equals(left.getType())) {
            return Optional.empty();
        }
        TSNode propertyName = getMemberName(left);
        if (propertyName == null || !ORDER_PROPERTY.equals(getNodeText(source, propertyName))) {
            return Optional.empty();
        }

        TSNode receiver = getMemberReceiver(left);
        Optional<String> control = keyExtractor.extract(receiver);
        if (control.isEmpty()) {
            System.err.println("Warning: Cannot identify the control of '" + getNodeText(source, left)
                    + "' in " + source.getPath() + " at " + getLocation(left) + ", skipping");
            return Optional.empty();
        }

        OptionalInt value = "integer_literal".equals(right.getType())
                ? parseIntegerLiteral(getNodeText(source, right))
                : OptionalInt.empty();
        if (value.isPresent()) {
            return Optional.of(OrderAssignment.numeric(control.get(), value.getAsInt(), getLocation(right)));
        }
        return Optional.of(OrderAssignment.nonNumeric(control.get(), getNodeText(source, right), getLocation(right)));
    }

    /**
     * Parses a C# integer literal ({@code 12}, {@code 0x1F}, {@code 0b101}, {@code 1_000},
     * {@code 3u}, {@code 4L}). Empty when the text is not a literal or does not fit an int.
     */
    static OptionalInt parseIntegerLiteral(String text) {
        if (text == null) {
            return OptionalInt.empty();
        }
        String literal = text.trim().replace("_", "").toLowerCase(Locale.ROOT);
        while (!literal.isEmpty() && (literal.endsWith("u") || literal.endsWith("l"))) {
            literal = literal.substring(0, literal.length() - 1);
        }
        int radix = 10;
        if (literal.startsWith("0x")) {
            radix = 16;
            literal = literal.substring(2);
        } else if (literal.startsWith("0b")) {
            radix = 2;
            literal = literal.substring(2);
        }
        if (literal.isEmpty()) {
            return OptionalInt.empty();
        }
        try {
            long parsed = Long.parseLong(literal, radix);
            if (parsed < 0 || parsed > Integer.MAX_VALUE) {
                return OptionalInt.empty();
            }
            return OptionalInt.of((int) parsed);
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
