package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.ast.AstNode;
import com.architecture.memory.flowgraph.model.graph.EdgeType;
import com.architecture.memory.flowgraph.model.graph.NodeKind;
import com.architecture.memory.flowgraph.service.graph.CanonicalIdGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Walks one program AST and collects the records the graph builders consume.
 *
 * Single pass over statements and expressions:
 *   - declarations (variables, parameters, functions, classes, imports) are bound in a {@link ScopeContext}
 *   - initializers, defaults, reassignments and returns go through the {@link AssignmentTracker}
 *   - ternaries, if/switch, loops and try blocks go through the {@link BranchExtractor}
 *   - every call site becomes a {@link CallInfo}
 * Identifier references are not resolved here; the builders resolve them once the whole
 * unit has been walked, so hoisted declarations are visible.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UnitAnalyzer {

    private static final Set<String> IGNORED_STATEMENTS = Set.of(
            "EmptyStatement", "DebuggerStatement", "BreakStatement", "ContinueStatement",
            "ExportAllDeclaration", "TSTypeAliasDeclaration", "TSInterfaceDeclaration",
            "TSDeclareFunction", "TSModuleDeclaration", "TSEnumDeclaration", "TSImportEqualsDeclaration",
            "TSExportAssignment", "TSNamespaceExportDeclaration", "DeclareVariable", "DeclareFunction",
            "TypeAlias", "InterfaceDeclaration", "OpaqueType"
    );

    private static final Set<String> LOOP_STATEMENTS = Set.of(
            "ForStatement", "ForInStatement", "ForOfStatement", "WhileStatement", "DoWhileStatement");

    private final CanonicalIdGenerator idGenerator;
    private final ExpressionClassifier classifier;
    private final AssignmentTracker assignmentTracker;
    private final BranchExtractor branchExtractor;

    // ========================= PUBLIC API =========================

    /**
     * Analyze one program. The returned unit owns its scope context; nothing is shared
     * with other units.
     */
    public ParsedUnit analyze(AstNode program, String file) {
        if (program == null || !program.is("Program")) {
            throw new IllegalArgumentException("Expected a Program node for " + file + " but got " + program);
        }
        ScopeContext ctx = new ScopeContext(file, idGenerator, new ExtractorCoverage());
        ParsedUnit unit = ParsedUnit.builder()
                .file(file)
                .moduleId(ctx.getModuleId())
                .scope(ctx)
                .build();

        new Walk(unit, ctx).statements(program.getList("body"));

        log.debug("[analyzer] {}: declarations={}, assignments={}, calls={}, branches={}, returns={}, coverage: {}",
                file, unit.getDeclarations().size(), unit.getAssignments().size(), unit.getCalls().size(),
                unit.getBranches().size(), unit.getReturns().size(), ctx.getCoverage());
        return unit;
    }

    // ========================= WALK =========================

    private final class Walk {
        private final ParsedUnit unit;
        private final ScopeContext ctx;
        private final Deque<String> functions = new ArrayDeque<>();

        private Walk(ParsedUnit unit, ScopeContext ctx) {
            this.unit = unit;
            this.ctx = ctx;
        }

        void statements(List<AstNode> statements) {
            for (AstNode statement : statements) {
                statement(statement);
            }
        }

        void statement(AstNode node) {
            if (node == null) {
                return;
            }
            String type = node.getType();
            if (LOOP_STATEMENTS.contains(type)) {
                loop(node);
                return;
            }
            switch (type) {
                case "VariableDeclaration" -> variableDeclaration(node);
                case "FunctionDeclaration" -> functionDeclaration(node);
                case "ClassDeclaration" -> classDeclaration(node);
                case "ExpressionStatement" -> expression(node.get("expression"));
                case "ReturnStatement" -> returnStatement(node);
                case "IfStatement" -> ifStatement(node);
                case "SwitchStatement" -> switchStatement(node);
                case "BlockStatement", "StaticBlock" -> block(node);
                case "TryStatement" -> tryStatement(node);
                case "ThrowStatement" -> expression(node.get("argument"));
                case "LabeledStatement" -> statement(node.get("body"));
                case "WithStatement" -> {
                    expression(node.get("object"));
                    statement(node.get("body"));
                }
                case "ImportDeclaration" -> importDeclaration(node);
                case "ExportNamedDeclaration" -> statement(node.get("declaration"));
                case "ExportDefaultDeclaration" -> exportDefault(node.get("declaration"));
                default -> {
                    if (!IGNORED_STATEMENTS.contains(type)) {
                        ctx.getCoverage().recordUnhandled(type);
                    }
                }
            }
        }

        // ---------- declarations ----------

        private void variableDeclaration(AstNode declaration) {
            String kind = declaration.getText("kind") != null ? declaration.getText("kind") : "var";
            boolean functionScoped = "var".equals(kind);
            for (AstNode declarator : declaration.getList("declarations")) {
                if (declarator == null) {
                    continue;
                }
                AstNode init = declarator.get("init");
                expression(init);
                patternDefaults(declarator.get("id"));
                for (PatternBinding binding : assignmentTracker.track(declarator.get("id"), init, ctx)) {
                    String id = declare(binding.getIdentifier(), NodeKind.VARIABLE, functionScoped, Map.of("declarationKind", kind));
                    assign(id, binding, EdgeType.ASSIGNED_FROM);
                }
            }
        }

        private void functionDeclaration(AstNode node) {
            String name = nameOf(node.get("id"), "default");
            String functionId = ctx.declare(name, NodeKind.FUNCTION, true);
            addDeclaration(functionId, NodeKind.FUNCTION, name, node, functionAttributes(node));
            function(node, functionId, name);
        }

        private void classDeclaration(AstNode node) {
            String name = nameOf(node.get("id"), "default");
            String classId = ctx.declare(name, NodeKind.CLASS, false);
            addDeclaration(classId, NodeKind.CLASS, name, node, classAttributes(node));
            classBody(node, classId, name);
        }

        private void exportDefault(AstNode declaration) {
            if (declaration == null) {
                return;
            }
            if (declaration.isAnyOf("FunctionDeclaration", "ClassDeclaration", "TSDeclareFunction")) {
                statement(declaration);
            } else {
                expression(declaration);
            }
        }

        private void importDeclaration(AstNode node) {
            AstNode source = node.get("source");
            String module = source != null ? source.getText("value") : null;
            for (AstNode specifier : node.getList("specifiers")) {
                if (specifier == null || specifier.get("local") == null) {
                    continue;
                }
                String imported = switch (specifier.getType()) {
                    case "ImportDefaultSpecifier" -> "default";
                    case "ImportNamespaceSpecifier" -> "*";
                    default -> nameOf(specifier.get("imported"), specifier.get("imported") != null
                            ? specifier.get("imported").getText("value") : null);
                };
                Map<String, Object> attributes = new LinkedHashMap<>();
                attributes.put("source", module);
                attributes.put("imported", imported);
                declare(specifier.get("local"), NodeKind.IMPORT, false, attributes);
            }
        }

        // ---------- functions and classes ----------

        private void function(AstNode node, String functionId, String label) {
            ctx.enterScope(label, true);
            ctx.enterContainer(functionId);
            functions.push(functionId);
            try {
                List<AstNode> params = node.getList("params");
                for (int i = 0; i < params.size(); i++) {
                    AstNode param = params.get(i);
                    if (param != null && param.is("TSParameterProperty")) {
                        param = param.get("parameter");
                    }
                    if (param == null) {
                        continue;
                    }
                    patternDefaults(param);
                    for (PatternBinding binding : assignmentTracker.track(param, null, ctx)) {
                        String id = declare(binding.getIdentifier(), NodeKind.PARAMETER, true, Map.of("index", i));
                        assign(id, binding, EdgeType.ASSIGNED_FROM);
                    }
                }

                AstNode body = node.get("body");
                if (body != null && body.is("BlockStatement")) {
                    statements(body.getList("body"));
                } else if (body != null) {
                    // Expression-bodied arrow
                    expression(body);
                    unit.getReturns().add(ReturnInfo.builder()
                            .functionId(functionId)
                            .source(assignmentTracker.describe(body, ctx))
                            .line(body.getLine())
                            .column(body.getColumn())
                            .build());
                }
            } finally {
                functions.pop();
                ctx.exitContainer();
                ctx.exitScope();
            }
        }

        private void classBody(AstNode node, String classId, String label) {
            expression(node.get("superClass"));
            ctx.enterScope(label, false);
            ctx.enterContainer(classId);
            try {
                AstNode body = node.get("body");
                List<AstNode> members = body != null ? body.getList("body") : List.of();
                for (AstNode member : members) {
                    if (member == null) {
                        continue;
                    }
                    switch (member.getType()) {
                        case "ClassMethod", "ClassPrivateMethod" -> method(member, member);
                        case "MethodDefinition" -> method(member, member.get("value"));
                        case "ClassProperty", "ClassPrivateProperty", "PropertyDefinition", "ClassAccessorProperty" -> {
                            if (member.getFlag("computed")) {
                                expression(member.get("key"));
                            }
                            expression(member.get("value"));
                        }
                        case "StaticBlock" -> statement(member);
                        default -> {
                            // TSDeclareMethod, TSIndexSignature: no runtime value
                        }
                    }
                }
            } finally {
                ctx.exitContainer();
                ctx.exitScope();
            }
        }

        private void method(AstNode member, AstNode function) {
            if (function == null) {
                return;
            }
            String name = keyName(member);
            String methodId = ctx.declareMember(name, NodeKind.FUNCTION);
            Map<String, Object> attributes = functionAttributes(function);
            attributes.put("method", true);
            attributes.put("methodKind", member.getText("kind"));
            attributes.put("static", member.getFlag("static"));
            addDeclaration(methodId, NodeKind.FUNCTION, name, member, attributes);
            function(function, methodId, name);
        }

        // ---------- statements ----------

        private void returnStatement(AstNode node) {
            AstNode argument = node.get("argument");
            if (argument == null) {
                return;
            }
            expression(argument);
            if (functions.isEmpty()) {
                return;
            }
            unit.getReturns().add(ReturnInfo.builder()
                    .functionId(functions.peek())
                    .source(assignmentTracker.describe(argument, ctx))
                    .line(node.getLine())
                    .column(node.getColumn())
                    .build());
        }

        private void ifStatement(AstNode node) {
            unit.getBranches().add(branchExtractor.extractIf(node, ctx));
            expression(node.get("test"));
            statement(node.get("consequent"));
            statement(node.get("alternate"));
        }

        private void switchStatement(AstNode node) {
            unit.getBranches().add(branchExtractor.extractSwitch(node, ctx));
            expression(node.get("discriminant"));
            ctx.enterScope("switch@" + node.position(), false);
            try {
                for (AstNode switchCase : node.getList("cases")) {
                    if (switchCase == null) {
                        continue;
                    }
                    expression(switchCase.get("test"));
                    statements(switchCase.getList("consequent"));
                }
            } finally {
                ctx.exitScope();
            }
        }

        private void loop(AstNode node) {
            unit.getBranches().add(branchExtractor.extractLoop(node, ctx));
            boolean iterating = node.isAnyOf("ForInStatement", "ForOfStatement");
            if (iterating) {
                expression(node.get("right"));
            }
            ctx.enterScope("loop@" + node.position(), false);
            try {
                if (iterating) {
                    loopBinding(node.get("left"), node.get("right"));
                } else if (node.is("ForStatement")) {
                    AstNode init = node.get("init");
                    if (init != null && init.is("VariableDeclaration")) {
                        variableDeclaration(init);
                    } else {
                        expression(init);
                    }
                    expression(node.get("test"));
                    expression(node.get("update"));
                } else {
                    expression(node.get("test"));
                }
                statement(node.get("body"));
            } finally {
                ctx.exitScope();
            }
        }

        private void loopBinding(AstNode left, AstNode iterable) {
            if (left == null) {
                return;
            }
            if (left.is("VariableDeclaration")) {
                String kind = left.getText("kind") != null ? left.getText("kind") : "var";
                boolean functionScoped = "var".equals(kind);
                for (AstNode declarator : left.getList("declarations")) {
                    if (declarator == null) {
                        continue;
                    }
                    patternDefaults(declarator.get("id"));
                    for (PatternBinding binding : assignmentTracker.trackLoopBinding(declarator.get("id"), iterable, ctx)) {
                        String id = declare(binding.getIdentifier(), NodeKind.VARIABLE, functionScoped,
                                Map.of("declarationKind", kind));
                        assign(id, binding, EdgeType.DERIVES_FROM);
                    }
                }
                return;
            }
            patternDefaults(left);
            if (left.isAnyOf("MemberExpression", "OptionalMemberExpression")) {
                expression(left);
            }
            for (PatternBinding binding : assignmentTracker.trackLoopBinding(left, iterable, ctx)) {
                reassign(binding, EdgeType.DERIVES_FROM);
            }
        }

        private void block(AstNode node) {
            ctx.enterScope("block@" + node.position(), false);
            try {
                statements(node.getList("body"));
            } finally {
                ctx.exitScope();
            }
        }

        private void tryStatement(AstNode node) {
            unit.getBranches().addAll(branchExtractor.extractTry(node, ctx));
            statement(node.get("block"));

            AstNode handler = node.get("handler");
            if (handler != null) {
                ctx.enterScope("catch@" + handler.position(), false);
                try {
                    AstNode param = handler.get("param");
                    if (param != null) {
                        patternDefaults(param);
                        for (PatternBinding binding : assignmentTracker.track(param, null, ctx)) {
                            String id = declare(binding.getIdentifier(), NodeKind.PARAMETER, false, Map.of("catch", true));
                            assign(id, binding, EdgeType.ASSIGNED_FROM);
                        }
                    }
                    AstNode body = handler.get("body");
                    if (body != null) {
                        statements(body.getList("body"));
                    }
                } finally {
                    ctx.exitScope();
                }
            }
            statement(node.get("finalizer"));
        }

        // ---------- expressions ----------

        /**
         * Visits an expression tree for the things that live inside it: calls, nested
         * functions and classes, ternaries and assignments.
         */
        void expression(AstNode node) {
            if (node == null) {
                return;
            }
            switch (node.getType()) {
                case "CallExpression", "OptionalCallExpression", "NewExpression" -> {
                    call(node, node.getList("arguments"));
                    expression(node.get("callee"));
                    for (AstNode argument : node.getList("arguments")) {
                        expression(argument);
                    }
                }
                case "TaggedTemplateExpression" -> {
                    AstNode quasi = node.get("quasi");
                    List<AstNode> substitutions = quasi != null ? quasi.getList("expressions") : List.of();
                    call(node, substitutions);
                    expression(node.get("tag"));
                    for (AstNode substitution : substitutions) {
                        expression(substitution);
                    }
                }
                case "FunctionExpression", "ArrowFunctionExpression", "ObjectMethod" -> anonymousFunction(node);
                case "ClassExpression" -> {
                    String classId = classifier.positionalId(NodeKind.CLASS, node, ctx);
                    String name = nameOf(node.get("id"), null);
                    addDeclaration(classId, NodeKind.CLASS, name, node, classAttributes(node));
                    classBody(node, classId, "class@" + node.position());
                }
                case "ConditionalExpression" -> {
                    unit.getBranches().add(branchExtractor.extractTernary(node, ctx));
                    expression(node.get("test"));
                    expression(node.get("consequent"));
                    expression(node.get("alternate"));
                }
                case "AssignmentExpression" -> {
                    expression(node.get("right"));
                    AstNode left = node.get("left");
                    if (left != null && !left.is("Identifier")) {
                        patternDefaults(left);
                        if (left.isAnyOf("MemberExpression", "OptionalMemberExpression")) {
                            expression(left);
                        }
                    }
                    reassignment(node);
                }
                default -> {
                    for (AstNode child : node.children()) {
                        expression(child);
                    }
                }
            }
        }

        private void anonymousFunction(AstNode node) {
            String functionId = classifier.positionalId(NodeKind.FUNCTION, node, ctx);
            String name = node.is("ObjectMethod") ? keyName(node) : nameOf(node.get("id"), null);
            Map<String, Object> attributes = functionAttributes(node);
            addDeclaration(functionId, NodeKind.FUNCTION, name, node, attributes);
            if (node.is("ObjectMethod") && node.getFlag("computed")) {
                expression(node.get("key"));
            }
            function(node, functionId, "fn@" + node.position());
        }

        private void call(AstNode node, List<AstNode> arguments) {
            Classification classification = classifier.classify(node);
            if (!classification.is(Classification.Kind.CALL)) {
                return;
            }
            Classification.Call call = (Classification.Call) classification;
            CallInfo info = CallInfo.builder()
                    .id(classifier.referenceId(call, ctx))
                    .kind(call.getCallKind())
                    .name(call.getName())
                    .receiverName(call.getReceiverName())
                    .line(node.getLine())
                    .column(node.getColumn())
                    .containerId(ctx.currentContainerId())
                    .scopeId(ctx.currentScopeId())
                    .argumentCount(arguments.size())
                    .build();
            for (AstNode argument : arguments) {
                AstNode value = argument != null && argument.is("SpreadElement") ? argument.get("argument") : argument;
                AstNode unwrapped = classifier.unwrap(value);
                if (unwrapped != null && unwrapped.is("Identifier") && !"undefined".equals(unwrapped.getName())) {
                    info.getArgumentNames().add(unwrapped.getName());
                }
            }
            unit.getCalls().add(info);
        }

        private void reassignment(AstNode node) {
            AstNode left = node.get("left");
            if (left == null) {
                return;
            }
            if (left.is("Identifier")) {
                unit.getAssignments().add(AssignmentInfo.builder()
                        .targetName(left.getName())
                        .scopeId(ctx.currentScopeId())
                        .source(assignmentTracker.describeAssignedValue(node, ctx))
                        .line(node.getLine())
                        .column(node.getColumn())
                        .build());
            } else if (left.isAnyOf("ObjectPattern", "ArrayPattern") && "=".equals(node.getText("operator"))) {
                for (PatternBinding binding : assignmentTracker.track(left, node.get("right"), ctx)) {
                    reassign(binding, EdgeType.ASSIGNED_FROM);
                }
            }
            // Member targets mutate an object; property-level flow is not tracked
        }

        // ---------- helpers ----------

        /**
         * Default values inside patterns are expressions too and may contain calls.
         */
        private void patternDefaults(AstNode pattern) {
            if (pattern == null) {
                return;
            }
            switch (pattern.getType()) {
                case "AssignmentPattern" -> {
                    expression(pattern.get("right"));
                    patternDefaults(pattern.get("left"));
                }
                case "ObjectPattern" -> {
                    for (AstNode property : pattern.getList("properties")) {
                        if (property == null) {
                            continue;
                        }
                        if (property.getFlag("computed")) {
                            expression(property.get("key"));
                        }
                        patternDefaults(property.is("RestElement") ? property.get("argument") : property.get("value"));
                    }
                }
                case "ArrayPattern" -> pattern.getList("elements").forEach(this::patternDefaults);
                case "RestElement" -> patternDefaults(pattern.get("argument"));
                default -> {
                    // Identifier or member target
                }
            }
        }

        private String declare(AstNode identifier, NodeKind kind, boolean functionScoped, Map<String, Object> attributes) {
            String id = ctx.declare(identifier.getName(), kind, functionScoped);
            addDeclaration(id, kind, identifier.getName(), identifier, new LinkedHashMap<>(attributes));
            return id;
        }

        private void addDeclaration(String id, NodeKind kind, String name, AstNode at, Map<String, Object> attributes) {
            unit.getDeclarations().add(ParsedDeclaration.builder()
                    .id(id)
                    .kind(kind)
                    .name(name)
                    .line(at.getLine())
                    .column(at.getColumn())
                    .containerId(ctx.currentContainerId())
                    .attributes(attributes)
                    .build());
        }

        private void assign(String targetId, PatternBinding binding, EdgeType edgeType) {
            if (binding.getSource() == null) {
                return;
            }
            unit.getAssignments().add(AssignmentInfo.builder()
                    .targetId(targetId)
                    .targetName(binding.getName())
                    .scopeId(ctx.currentScopeId())
                    .edgeType(edgeType)
                    .source(binding.getSource())
                    .line(binding.getIdentifier().getLine())
                    .column(binding.getIdentifier().getColumn())
                    .build());
        }

        private void reassign(PatternBinding binding, EdgeType edgeType) {
            if (binding.getSource() == null) {
                return;
            }
            unit.getAssignments().add(AssignmentInfo.builder()
                    .targetName(binding.getName())
                    .scopeId(ctx.currentScopeId())
                    .edgeType(edgeType)
                    .source(binding.getSource())
                    .line(binding.getIdentifier().getLine())
                    .column(binding.getIdentifier().getColumn())
                    .build());
        }

        private Map<String, Object> functionAttributes(AstNode node) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("async", node.getFlag("async"));
            attributes.put("generator", node.getFlag("generator"));
            attributes.put("arrow", node.is("ArrowFunctionExpression"));
            attributes.put("paramCount", node.getList("params").size());
            return attributes;
        }

        private Map<String, Object> classAttributes(AstNode node) {
            Map<String, Object> attributes = new LinkedHashMap<>();
            AstNode superClass = classifier.unwrap(node.get("superClass"));
            if (superClass != null) {
                attributes.put("superClass", superClass.is("Identifier") ? superClass.getName() : superClass.getType());
            }
            return attributes;
        }

        private String keyName(AstNode member) {
            AstNode key = member.get("key");
            if (key == null) {
                return "<anonymous>";
            }
            if (key.is("PrivateName") && key.get("id") != null) {
                return "#" + key.get("id").getName();
            }
            if (!member.getFlag("computed") && key.is("Identifier")) {
                return key.getName();
            }
            String literal = key.getText("value");
            return literal != null ? literal : "[computed]";
        }

        private String nameOf(AstNode identifier, String fallback) {
            String name = identifier != null ? identifier.getName() : null;
            return name != null ? name : fallback;
        }
    }
}
