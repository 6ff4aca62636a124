package org.explorerscript.decompiler.graph;

import org.explorerscript.ssb.SsbOperation;

import java.util.Optional;

/**
 * Read-only view of the directed control flow graph of a routine set.
 * <p>
 * Vertices are addressed by index. A vertex may carry an operation (including labels and label
 * jumps); edges are possible execution transitions. Consumers only query the graph, they never
 * build or change it.
 */
public interface IRoutineGraph {

    /**
     * @return The number of vertices. Valid vertex indices are {@code 0 .. vertexCount() - 1}.
     */
    int vertexCount();

    /**
     * @param vertex The vertex index.
     * @return The operation attached to the vertex, or empty if it carries none.
     */
    Optional<SsbOperation> op(int vertex);

    /**
     * @param vertex The vertex index.
     * @return The number of edges leaving the vertex.
     */
    int outDegree(int vertex);

    /**
     * @param vertex The vertex index.
     * @return The number of edges entering the vertex.
     */
    int inDegree(int vertex);
}
