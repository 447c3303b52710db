package com.architecture.memory.flowgraph.dto;

import com.architecture.memory.flowgraph.model.ast.AstNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One parsed file handed to the pipeline: its path and its Program AST.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceUnit {
    private String file;
    private AstNode program;
}
