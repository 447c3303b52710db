package com.architecture.memory.flowgraph.service.graph;

import com.architecture.memory.flowgraph.model.graph.NodeKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Centralized service for generating stable, deterministic ids for graph nodes.
 * Edge ids are derived from their endpoints, see {@code GraphEdge#canonicalId()}.
 *
 * Ids are:
 * - Deterministic: the same source always produces the same id
 * - Pure: derived only from file, kind, name/disambiguator and source position
 * - Counter free: no per-run counters or UUIDs, so re-analysis is idempotent
 *
 * Format Rules:
 * - Module: module:{file}
 * - Declaration: {kind}:{file}:{scopePath}.{name}[#{n}]
 * - Positional: {kind}:{file}:{line}:{column}
 * - Expression: expression:{ExpressionType}:{file}:{line}:{column}
 * - Branch: branch:{branchKind}:{file}:{line}:{column}
 * - Issue: issue:{code}:{nodeId}
 */
@Service
@Slf4j
public class CanonicalIdGenerator {

    /**
     * Generate id for a Module node.
     * Format: module:{file}
     */
    public String generateModuleId(String file) {
        if (file == null) {
            log.warn("Cannot generate module id for null file");
            return "module:unknown";
        }
        return String.format("module:%s", file);
    }

    /**
     * Generate id for a named declaration (variable, parameter, function, class, import).
     * Format: {kind}:{file}:{scopePath}.{name}, with #{n} appended for the n-th redeclaration.
     */
    public String generateDeclarationId(NodeKind kind, String file, String scopePath, String name, int disambiguator) {
        if (kind == null || name == null) {
            log.warn("Cannot generate declaration id with null kind or name");
            return "declaration:unknown";
        }
        String base = String.format("%s:%s:%s.%s", kindKey(kind), file, scopePath, name);
        return disambiguator > 0 ? base + "#" + disambiguator : base;
    }

    /**
     * Generate id for a node identified by its source position
     * (literals, calls, aggregate literals, function and class expressions).
     * Format: {kind}:{file}:{line}:{column}
     */
    public String generatePositionalId(NodeKind kind, String file, int line, int column) {
        if (kind == null) {
            log.warn("Cannot generate positional id with null kind");
            return "positional:unknown";
        }
        return String.format("%s:%s:%d:%d", kindKey(kind), file, line, column);
    }

    /**
     * Generate id for an Expression node.
     * Format: expression:{ExpressionType}:{file}:{line}:{column}
     */
    public String generateExpressionId(String expressionType, String file, int line, int column) {
        if (expressionType == null) {
            log.warn("Cannot generate expression id with null expression type");
            return "expression:unknown";
        }
        return String.format("expression:%s:%s:%d:%d", expressionType, file, line, column);
    }

    /**
     * Generate id for a Branch node.
     * Format: branch:{branchKind}:{file}:{line}:{column}
     */
    public String generateBranchId(String branchKind, String file, int line, int column) {
        if (branchKind == null) {
            log.warn("Cannot generate branch id with null branch kind");
            return "branch:unknown";
        }
        return String.format("branch:%s:%s:%d:%d", branchKind, file, line, column);
    }

    /**
     * Generate id for an Issue node.
     * Format: issue:{code}:{nodeId}
     */
    public String generateIssueId(String code, String nodeId) {
        if (code == null || nodeId == null) {
            log.warn("Cannot generate issue id with null code or node id");
            return "issue:unknown";
        }
        return String.format("issue:%s:%s", code, nodeId);
    }

    private String kindKey(NodeKind kind) {
        return kind.name().toLowerCase();
    }
}
