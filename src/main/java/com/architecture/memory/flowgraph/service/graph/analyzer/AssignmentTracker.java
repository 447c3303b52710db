package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.ast.AstNode;
import com.architecture.memory.flowgraph.model.graph.NodeKind;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns initializers and binding targets into {@link ValueSource} trees.
 *
 * Call direction, all inside this class:
 * <pre>
 *   track / trackLoopBinding / describeAssignedValue
 *     -> trackPattern (recursive over nested patterns)
 *       -> describe
 *   describe -> describeExpression -> describe   (operand slots)
 *   describe -> describeAggregate  -> describe   (property and element values)
 * </pre>
 * {@code describe} is the only entry into the value recursion and never calls back into
 * the pattern methods, so the recursion is bounded by the depth of the expression tree.
 */
@Component
@RequiredArgsConstructor
public class AssignmentTracker {

    private static final Set<String> LOGICAL_ASSIGNMENT = Set.of("&&=", "||=", "??=");

    private final ExpressionClassifier classifier;
    private final ExpressionNodePolicy expressionPolicy;

    /**
     * Bindings produced by a declaration target and its optional initializer.
     */
    public List<PatternBinding> track(AstNode target, AstNode init, ScopeContext ctx) {
        List<PatternBinding> bindings = new ArrayList<>();
        trackPattern(target, init != null ? PatternSource.ast(init) : null, bindings, ctx);
        return bindings;
    }

    /**
     * Bindings of a for-in/for-of left-hand side. A plain identifier derives from the
     * iterable itself; names inside a pattern derive from an element path of it.
     */
    public List<PatternBinding> trackLoopBinding(AstNode target, AstNode iterable, ScopeContext ctx) {
        List<PatternBinding> bindings = new ArrayList<>();
        if (target.is("Identifier")) {
            bindings.add(new PatternBinding(target, describe(iterable, ctx)));
            return bindings;
        }
        PatternSource base = PatternSource.ast(iterable);
        trackPattern(target, PatternSource.derived(base, base.path(this) + "[]", target), bindings, ctx);
        return bindings;
    }

    /**
     * Value written by an assignment expression. Compound operators become a Binary or
     * Logical expression over the previous value and the right-hand side.
     */
    public ValueSource describeAssignedValue(AstNode assignment, ScopeContext ctx) {
        String operator = assignment.getText("operator");
        AstNode left = assignment.get("left");
        AstNode right = assignment.get("right");
        if (operator == null || "=".equals(operator) || left == null || !left.is("Identifier")) {
            return describe(right, ctx);
        }
        ExpressionKind kind = LOGICAL_ASSIGNMENT.contains(operator) ? ExpressionKind.LOGICAL : ExpressionKind.BINARY;
        ExpressionRecord record = ExpressionRecord.builder()
                .id(expressionPolicy.expressionId(kind, assignment, ctx))
                .kind(kind)
                .line(assignment.getLine())
                .column(assignment.getColumn())
                .operator(operator.substring(0, operator.length() - 1))
                .build();
        record.getAttributes().put("compound", true);
        record.getOperandSlots().add(OperandSlot.of("left", ValueSource.identifier(left.getName(), ctx.currentScopeId())));
        record.getOperandSlots().add(OperandSlot.of("right", describe(right, ctx)));
        return ValueSource.expression(record);
    }

    /**
     * Classifies {@code expression} and describes where its value comes from, recursing into
     * operands of compound expressions and entries of aggregate literals.
     */
    public ValueSource describe(AstNode expression, ScopeContext ctx) {
        if (expression == null) {
            return ValueSource.unresolved("<none>");
        }
        Classification classification = classifier.classify(expression);
        switch (classification.getKind()) {
            case IDENTIFIER:
                return ValueSource.identifier(((Classification.Identifier) classification).getName(), ctx.currentScopeId());
            case LITERAL:
                return ValueSource.literal(literalRecord(classification.getNode(),
                        ((Classification.Literal) classification).getExtraction(), ctx));
            case OBJECT_LITERAL:
            case ARRAY_LITERAL:
                return ValueSource.aggregate(describeAggregate((Classification.Aggregate) classification, ctx));
            case CALL:
                return ValueSource.reference(classifier.referenceId(classification, ctx),
                        ((Classification.Call) classification).getCallKind());
            case FUNCTION:
                return ValueSource.reference(classifier.referenceId(classification, ctx), NodeKind.FUNCTION);
            case CLASS:
                return ValueSource.reference(classifier.referenceId(classification, ctx), NodeKind.CLASS);
            case COMPLEX:
                if (expressionPolicy.producesExpressionNode(classification)) {
                    return ValueSource.expression(describeExpression((Classification.Complex) classification, ctx));
                }
                ctx.getCoverage().recordUnhandled(classification.getNode().getType());
                return ValueSource.unresolved(classification.getNode().getType());
            default:
                String type = ((Classification.Unsupported) classification).getAstType();
                ctx.getCoverage().recordUnhandled(type);
                return ValueSource.unresolved(type);
        }
    }

    ExpressionRecord describeExpression(Classification.Complex classification, ScopeContext ctx) {
        AstNode node = classification.getNode();
        ExpressionRecord record = ExpressionRecord.builder()
                .id(expressionPolicy.expressionId(classification, ctx))
                .kind(classification.getExpressionKind())
                .line(node.getLine())
                .column(node.getColumn())
                .build();
        List<OperandSlot> slots = record.getOperandSlots();

        switch (classification.getExpressionKind()) {
            case MEMBER -> {
                slots.add(OperandSlot.of("object", describe(node.get("object"), ctx)));
                AstNode property = node.get("property");
                boolean computed = node.getFlag("computed");
                record.getAttributes().put("computed", computed);
                if (node.getFlag("optional") || node.is("OptionalMemberExpression")) {
                    record.getAttributes().put("optional", true);
                }
                if (property != null && computed && !classifier.classify(property).is(Classification.Kind.LITERAL)) {
                    slots.add(OperandSlot.of("property", describe(property, ctx)));
                }
                String propertyName = propertyName(property, computed);
                if (propertyName != null) {
                    record.getAttributes().put("property", propertyName);
                }
                pathOf(node).ifPresent(path -> record.getAttributes().put("path", path));
            }
            case BINARY, LOGICAL -> {
                record.setOperator(node.getText("operator"));
                slots.add(OperandSlot.of("left", describe(node.get("left"), ctx)));
                slots.add(OperandSlot.of("right", describe(node.get("right"), ctx)));
            }
            case CONDITIONAL -> {
                // The test selects a value but is not one; it is linked from the ternary branch
                slots.add(OperandSlot.of("consequent", describe(node.get("consequent"), ctx)));
                slots.add(OperandSlot.of("alternate", describe(node.get("alternate"), ctx)));
            }
            case UNARY -> {
                record.setOperator(node.getText("operator"));
                slots.add(OperandSlot.of("unaryArgument", describe(node.get("argument"), ctx)));
            }
            case UPDATE -> {
                record.setOperator(node.getText("operator"));
                record.getAttributes().put("prefix", node.getFlag("prefix"));
                slots.add(OperandSlot.of("argument", describe(node.get("argument"), ctx)));
            }
            case TEMPLATE_LITERAL -> addSubstitutions(node, slots, ctx);
            case TAGGED_TEMPLATE -> {
                slots.add(OperandSlot.of("tag", describe(node.get("tag"), ctx)));
                AstNode quasi = node.get("quasi");
                if (quasi != null) {
                    addSubstitutions(quasi, slots, ctx);
                }
            }
        }
        return record;
    }

    AggregateLiteralRecord describeAggregate(Classification.Aggregate classification, ScopeContext ctx) {
        AstNode node = classification.getNode();
        AggregateLiteralRecord record = AggregateLiteralRecord.builder()
                .id(classifier.referenceId(classification, ctx))
                .kind(classification.getNodeKind())
                .line(node.getLine())
                .column(node.getColumn())
                .build();

        if (classification.is(Classification.Kind.OBJECT_LITERAL)) {
            for (AstNode property : node.getList("properties")) {
                if (property == null) {
                    continue;
                }
                if (property.is("SpreadElement")) {
                    record.getEntries().add(new AggregateLiteralRecord.Entry("...", describe(property.get("argument"), ctx)));
                } else if (property.is("ObjectMethod")) {
                    record.getEntries().add(new AggregateLiteralRecord.Entry(keyOf(property), describe(property, ctx)));
                } else {
                    record.getEntries().add(new AggregateLiteralRecord.Entry(keyOf(property), describe(property.get("value"), ctx)));
                }
            }
        } else {
            List<AstNode> elements = node.getList("elements");
            for (int i = 0; i < elements.size(); i++) {
                AstNode element = elements.get(i);
                if (element == null) {
                    continue;
                }
                if (element.is("SpreadElement")) {
                    record.getEntries().add(new AggregateLiteralRecord.Entry("...", describe(element.get("argument"), ctx)));
                } else {
                    record.getEntries().add(new AggregateLiteralRecord.Entry(String.valueOf(i), describe(element, ctx)));
                }
            }
        }

        record.setLiteralOnly(record.getEntries().stream().allMatch(entry -> isLiteralOnly(entry.getValue())));
        return record;
    }

    private void trackPattern(AstNode pattern, PatternSource source, List<PatternBinding> out, ScopeContext ctx) {
        if (pattern == null) {
            return;
        }
        switch (pattern.getType()) {
            case "Identifier" -> out.add(new PatternBinding(pattern, source != null ? source.value(this, ctx) : null));
            case "AssignmentPattern" -> {
                AstNode fallback = pattern.get("right");
                PatternSource effective;
                if (source == null || source.mode == PatternSource.Mode.MISSING) {
                    effective = PatternSource.ast(fallback);
                } else if (source.mode == PatternSource.Mode.DERIVED) {
                    source.fallback = fallback;
                    effective = source;
                } else {
                    effective = source;
                }
                trackPattern(pattern.get("left"), effective, out, ctx);
            }
            case "RestElement" -> trackPattern(pattern.get("argument"), source != null && source.mode != PatternSource.Mode.MISSING
                    ? PatternSource.derived(source, source.path(this) + "...", pattern).asRest() : source, out, ctx);
            case "ObjectPattern" -> trackObjectPattern(pattern, source, out, ctx);
            case "ArrayPattern" -> trackArrayPattern(pattern, source, out, ctx);
            default -> ctx.getCoverage().recordUnhandled(pattern.getType());
        }
    }

    private void trackObjectPattern(AstNode pattern, PatternSource source, List<PatternBinding> out, ScopeContext ctx) {
        AstNode literal = source != null ? source.decomposable(classifier, "ObjectExpression", "properties") : null;
        for (AstNode property : pattern.getList("properties")) {
            if (property == null) {
                continue;
            }
            if (property.is("RestElement")) {
                trackPattern(property, source, out, ctx);
                continue;
            }
            String key = keyOf(property);
            PatternSource child;
            if (source == null) {
                child = null;
            } else if (source.mode == PatternSource.Mode.MISSING) {
                child = PatternSource.missing(property);
            } else if (literal != null) {
                child = findProperty(literal, key)
                        .map(PatternSource::ast)
                        .orElseGet(() -> PatternSource.missing(property));
            } else {
                child = PatternSource.derived(source, source.path(this) + "." + key, property);
            }
            trackPattern(property.get("value"), child, out, ctx);
        }
    }

    private void trackArrayPattern(AstNode pattern, PatternSource source, List<PatternBinding> out, ScopeContext ctx) {
        AstNode literal = source != null ? source.decomposable(classifier, "ArrayExpression", "elements") : null;
        List<AstNode> elements = pattern.getList("elements");
        for (int i = 0; i < elements.size(); i++) {
            AstNode element = elements.get(i);
            if (element == null) {
                continue;
            }
            if (element.is("RestElement")) {
                trackPattern(element, source, out, ctx);
                continue;
            }
            PatternSource child;
            if (source == null) {
                child = null;
            } else if (source.mode == PatternSource.Mode.MISSING) {
                child = PatternSource.missing(element);
            } else if (literal != null) {
                List<AstNode> values = literal.getList("elements");
                AstNode value = i < values.size() ? values.get(i) : null;
                child = value != null ? PatternSource.ast(value) : PatternSource.missing(element);
            } else {
                child = PatternSource.derived(source, source.path(this) + "[" + i + "]", element);
            }
            trackPattern(element, child, out, ctx);
        }
    }

    private LiteralRecord literalRecord(AstNode node, LiteralExtraction extraction, ScopeContext ctx) {
        return LiteralRecord.builder()
                .id(classifier.positionalId(NodeKind.LITERAL, node, ctx))
                .line(node.getLine())
                .column(node.getColumn())
                .extraction(extraction)
                .build();
    }

    private void addSubstitutions(AstNode template, List<OperandSlot> slots, ScopeContext ctx) {
        List<AstNode> expressions = template.getList("expressions");
        for (int i = 0; i < expressions.size(); i++) {
            slots.add(OperandSlot.of("substitution[" + i + "]", describe(expressions.get(i), ctx)));
        }
    }

    private boolean isLiteralOnly(ValueSource value) {
        return value.is(ValueSource.Kind.LITERAL)
                || (value.is(ValueSource.Kind.AGGREGATE) && value.getAggregate().isLiteralOnly());
    }

    private Optional<AstNode> findProperty(AstNode objectLiteral, String key) {
        for (AstNode property : objectLiteral.getList("properties")) {
            if (property != null && !property.is("ObjectMethod") && key.equals(keyOf(property))) {
                return Optional.ofNullable(property.get("value"));
            }
        }
        return Optional.empty();
    }

    private String keyOf(AstNode property) {
        AstNode key = property.get("key");
        String name = propertyName(key, property.getFlag("computed"));
        return name != null ? name : "[computed]";
    }

    private String propertyName(AstNode key, boolean computed) {
        if (key == null) {
            return null;
        }
        if (!computed && key.is("Identifier")) {
            return key.getName();
        }
        if (key.is("PrivateName") && key.get("id") != null) {
            return "#" + key.get("id").getName();
        }
        Classification classification = classifier.classify(key);
        if (!classification.is(Classification.Kind.LITERAL)) {
            return null;
        }
        Object value = ((Classification.Literal) classification).getExtraction().getValue();
        return value != null ? String.valueOf(value) : null;
    }

    /**
     * Dotted access path of a static member chain, e.g. {@code config.db.host}.
     */
    Optional<String> pathOf(AstNode expression) {
        AstNode node = classifier.unwrap(expression);
        if (node == null) {
            return Optional.empty();
        }
        if (node.is("Identifier")) {
            return Optional.of(node.getName());
        }
        if (node.is("ThisExpression")) {
            return Optional.of("this");
        }
        if (node.isAnyOf("MemberExpression", "OptionalMemberExpression")) {
            String property = propertyName(node.get("property"), node.getFlag("computed"));
            if (property == null) {
                return Optional.empty();
            }
            String segment = node.getFlag("computed") ? "[" + property + "]" : "." + property;
            return pathOf(node.get("object")).map(object -> object + segment);
        }
        return Optional.empty();
    }

    /**
     * Value on the right side of a pattern position while the pattern is walked.
     */
    private static final class PatternSource {

        enum Mode { AST, MISSING, DERIVED }

        private final Mode mode;
        private final AstNode node;
        private final PatternSource base;
        private final String path;
        private boolean rest;
        private AstNode fallback;
        private ValueSource value;

        private PatternSource(Mode mode, AstNode node, PatternSource base, String path) {
            this.mode = mode;
            this.node = node;
            this.base = base;
            this.path = path;
        }

        static PatternSource ast(AstNode expression) {
            return new PatternSource(Mode.AST, expression, null, null);
        }

        static PatternSource missing(AstNode at) {
            return new PatternSource(Mode.MISSING, at, null, null);
        }

        static PatternSource derived(PatternSource base, String path, AstNode at) {
            return new PatternSource(Mode.DERIVED, at, base, path);
        }

        PatternSource asRest() {
            rest = true;
            return this;
        }

        String path(AssignmentTracker tracker) {
            if (path != null) {
                return path;
            }
            if (mode == Mode.AST) {
                return tracker.pathOf(node).orElse("<" + node.getType() + ">");
            }
            return "<missing>";
        }

        /**
         * The literal an initializer decomposes into, or null when names must be derived.
         * Spread entries make the positions unknowable.
         */
        AstNode decomposable(ExpressionClassifier classifier, String literalType, String entriesField) {
            if (mode != Mode.AST) {
                return null;
            }
            AstNode literal = classifier.unwrap(node);
            if (literal == null || !literal.is(literalType)) {
                return null;
            }
            for (AstNode entry : literal.getList(entriesField)) {
                if (entry != null && entry.is("SpreadElement")) {
                    return null;
                }
            }
            return literal;
        }

        ValueSource value(AssignmentTracker tracker, ScopeContext ctx) {
            if (value != null) {
                return value;
            }
            switch (mode) {
                case AST -> value = tracker.describe(node, ctx);
                case MISSING -> value = ValueSource.literal(LiteralRecord.builder()
                        .id(tracker.classifier.positionalId(NodeKind.LITERAL, node, ctx))
                        .line(node.getLine())
                        .column(node.getColumn())
                        .extraction(LiteralExtraction.undefinedValue())
                        .build());
                case DERIVED -> {
                    ExpressionRecord record = ExpressionRecord.builder()
                            .id(tracker.expressionPolicy.expressionId(ExpressionKind.MEMBER, node, ctx))
                            .kind(ExpressionKind.MEMBER)
                            .line(node.getLine())
                            .column(node.getColumn())
                            .build();
                    record.getAttributes().put("path", path);
                    record.getAttributes().put("destructured", true);
                    if (rest) {
                        record.getAttributes().put("rest", true);
                    }
                    record.getOperandSlots().add(OperandSlot.of("object", base.value(tracker, ctx)));
                    if (fallback != null) {
                        record.getOperandSlots().add(OperandSlot.of("default", tracker.describe(fallback, ctx)));
                    }
                    value = ValueSource.expression(record);
                }
            }
            return value;
        }
    }
}
