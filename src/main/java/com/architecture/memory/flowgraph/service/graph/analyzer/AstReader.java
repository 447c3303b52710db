package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.ast.AstFormatException;
import com.architecture.memory.flowgraph.model.ast.AstNode;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads parser output (Babel or ESTree JSON) and returns the Program node.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AstReader {

    private final ObjectMapper objectMapper;

    public AstNode read(Path path) {
        try {
            return toProgram(objectMapper.readTree(Files.readString(path)));
        } catch (IOException e) {
            throw new AstFormatException("Failed to read AST from " + path + ": " + e.getMessage(), e);
        }
    }

    public AstNode read(String json) {
        try {
            return toProgram(objectMapper.readTree(json));
        } catch (IOException e) {
            throw new AstFormatException("Failed to parse AST JSON: " + e.getMessage(), e);
        }
    }

    public AstNode toProgram(JsonNode root) {
        AstNode node = AstNode.of(root);
        if (node == null) {
            throw new AstFormatException("Empty AST document");
        }
        if (node.is("File")) {
            node = node.get("program");
        }
        if (node == null || !node.is("Program")) {
            throw new AstFormatException("Expected a Program root but found " + (node == null ? "nothing" : node.getType()));
        }
        log.debug("[analyzer] Loaded Program with {} top-level statements", node.getList("body").size());
        return node;
    }
}
