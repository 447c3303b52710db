package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.ast.AstNode;
import com.architecture.memory.flowgraph.model.graph.NodeKind;
import com.architecture.memory.flowgraph.service.graph.CanonicalIdGenerator;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one analysis unit: the lexical scope tree, name bindings, the
 * container stack used for Contains edges and the positional ids handed out so far.
 *
 * One instance per unit, created by the analyzer and discarded once the unit graph is
 * built. Not thread safe.
 */
public class ScopeContext {

    public static final String MODULE_SCOPE = "module";

    @Getter
    private final String file;
    @Getter
    private final String moduleId;
    @Getter
    private final CanonicalIdGenerator idGenerator;
    @Getter
    private final ExtractorCoverage coverage;

    private final Map<String, Scope> scopes = new HashMap<>();
    private final Deque<Scope> scopeStack = new ArrayDeque<>();
    private final Deque<String> containerStack = new ArrayDeque<>();
    private final Map<String, Integer> declarationCounts = new HashMap<>();
    private final Map<PositionKey, String> positionalIds = new HashMap<>();
    private final Set<String> usedPositionalIds = new HashSet<>();

    public ScopeContext(String file, CanonicalIdGenerator idGenerator, ExtractorCoverage coverage) {
        this.file = file;
        this.idGenerator = idGenerator;
        this.coverage = coverage;
        this.moduleId = idGenerator.generateModuleId(file);
        Scope root = new Scope(MODULE_SCOPE, null, true);
        scopes.put(root.id, root);
        scopeStack.push(root);
        containerStack.push(moduleId);
    }

    public String currentScopeId() {
        return scopeStack.peek().id;
    }

    /**
     * Opens a child scope of the current scope. Repeated labels under the same parent
     * get a {@code #n} suffix so scope paths stay unique.
     */
    public String enterScope(String label, boolean functionScope) {
        Scope parent = scopeStack.peek();
        int seen = parent.childLabels.merge(label, 1, Integer::sum) - 1;
        String id = parent.id + "." + (seen == 0 ? label : label + "#" + seen);
        Scope scope = new Scope(id, parent, functionScope);
        scopes.put(id, scope);
        scopeStack.push(scope);
        return id;
    }

    public void exitScope() {
        if (scopeStack.size() == 1) {
            throw new IllegalStateException("Cannot exit the module scope of " + file);
        }
        scopeStack.pop();
    }

    /**
     * Binds {@code name} in the current scope, or in the nearest function scope when
     * {@code functionScoped} (var and function declarations). Returns the declaration id.
     * A name already bound in the target scope keeps its first binding; the new
     * declaration still gets its own disambiguated id.
     */
    public String declare(String name, NodeKind kind, boolean functionScoped) {
        Scope target = scopeStack.peek();
        if (functionScoped) {
            while (!target.functionScope) {
                target = target.parent;
            }
        }
        String id = declarationId(target, name, kind);
        target.bindings.putIfAbsent(name, id);
        return id;
    }

    /**
     * Declaration id for a class member in the current scope. Members are reached through
     * {@code this} or the class, never by bare name, so no binding is added.
     */
    public String declareMember(String name, NodeKind kind) {
        return declarationId(scopeStack.peek(), name, kind);
    }

    private String declarationId(Scope target, String name, NodeKind kind) {
        String countKey = kind + "|" + target.id + "|" + name;
        int disambiguator = declarationCounts.merge(countKey, 1, Integer::sum) - 1;
        return idGenerator.generateDeclarationId(kind, file, target.id, name, disambiguator);
    }

    /**
     * Walks the scope chain outward from {@code scopeId}. Unit-local only.
     */
    public Optional<String> resolve(String scopeId, String name) {
        Scope scope = scopes.get(scopeId);
        while (scope != null) {
            String id = scope.bindings.get(name);
            if (id != null) {
                return Optional.of(id);
            }
            scope = scope.parent;
        }
        return Optional.empty();
    }

    /**
     * Stable id for a node identified by position. The first AST node at a position keeps
     * the plain id; another node of the same kind at the same position (the inner
     * {@code a.b} of {@code a.b.c}, the inner call of {@code f()()}) gets a {@code #n} suffix.
     * Asking again for the same AST node and base id returns the same id.
     */
    public String positionalId(AstNode node, String baseId) {
        PositionKey key = new PositionKey(node, baseId);
        String known = positionalIds.get(key);
        if (known != null) {
            return known;
        }
        String id = baseId;
        int n = 1;
        while (!usedPositionalIds.add(id)) {
            id = baseId + "#" + n++;
        }
        positionalIds.put(key, id);
        return id;
    }

    public String currentContainerId() {
        return containerStack.peek();
    }

    public void enterContainer(String containerId) {
        containerStack.push(containerId);
    }

    public void exitContainer() {
        if (containerStack.size() == 1) {
            throw new IllegalStateException("Cannot exit the module container of " + file);
        }
        containerStack.pop();
    }

    public Map<String, String> bindingsOf(String scopeId) {
        Scope scope = scopes.get(scopeId);
        return scope != null ? new LinkedHashMap<>(scope.bindings) : Map.of();
    }

    private record PositionKey(AstNode node, String baseId) {
    }

    private static final class Scope {
        private final String id;
        private final Scope parent;
        private final boolean functionScope;
        private final Map<String, String> bindings = new LinkedHashMap<>();
        private final Map<String, Integer> childLabels = new HashMap<>();

        private Scope(String id, Scope parent, boolean functionScope) {
            this.id = id;
            this.parent = parent;
            this.functionScope = functionScope;
        }
    }
}
