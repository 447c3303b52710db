package com.architecture.memory.flowgraph.service.graph.analyzer;

import com.architecture.memory.flowgraph.model.ast.AstFormatException;
import com.architecture.memory.flowgraph.model.ast.AstNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AstReaderTest {

    private final AstReader reader = new AstReader(new ObjectMapper());

    @Test
    void unwrapsBabelFileRoot() {
        AstNode program = reader.read("""
                {"type": "File", "program": {"type": "Program", "body": [
                  {"type": "EmptyStatement", "loc": {"start": {"line": 1, "column": 0}}}
                ]}}
                """);

        assertThat(program.is("Program")).isTrue();
        assertThat(program.getList("body")).hasSize(1);
    }

    @Test
    void acceptsEstreeProgramRoot() {
        AstNode program = reader.read("{\"type\": \"Program\", \"body\": []}");

        assertThat(program.getList("body")).isEmpty();
    }

    @Test
    void rejectsNonProgramRoots() {
        assertThatThrownBy(() -> reader.read("{\"type\": \"ExpressionStatement\"}"))
                .isInstanceOf(AstFormatException.class)
                .hasMessageContaining("ExpressionStatement");
        assertThatThrownBy(() -> reader.read("{\"type\": \"File\"}"))
                .isInstanceOf(AstFormatException.class)
                .hasMessageContaining("nothing");
    }

    @Test
    void rejectsDocumentsWithoutAType() {
        assertThatThrownBy(() -> reader.read("{\"body\": []}"))
                .isInstanceOf(AstFormatException.class);
    }

    @Test
    void wrapsParseAndIoFailures(@TempDir Path dir) {
        assertThatThrownBy(() -> reader.read("{ not json"))
                .isInstanceOf(AstFormatException.class)
                .hasMessageStartingWith("Failed to parse AST JSON");
        assertThatThrownBy(() -> reader.read(dir.resolve("missing.json")))
                .isInstanceOf(AstFormatException.class)
                .hasMessageContaining("missing.json");
    }
}
