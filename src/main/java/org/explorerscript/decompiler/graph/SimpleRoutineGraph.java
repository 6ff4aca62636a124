package org.explorerscript.decompiler.graph;

import org.explorerscript.decompiler.label.SwitchCaseOperation;
import org.explorerscript.ssb.SsbOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * In-memory adjacency list implementation of {@link IRoutineGraph}.
 * Edges leaving a switch may be annotated with the {@link SwitchCaseOperation} they stand for.
 */
public class SimpleRoutineGraph implements IRoutineGraph {

    /**
     * A directed edge.
     *
     * @param from       The source vertex.
     * @param to         The target vertex.
     * @param switchCase The switch case this edge represents, or {@code null}.
     */
    public record Edge(int from, int to, SwitchCaseOperation switchCase) {

        public Optional<SwitchCaseOperation> switchCaseOp() {
            return Optional.ofNullable(switchCase);
        }
    }

    private final List<SsbOperation> ops = new ArrayList<>();
    private final List<List<Edge>> outEdges = new ArrayList<>();
    private final List<List<Edge>> inEdges = new ArrayList<>();

    /**
     * Adds a vertex.
     *
     * @param op The operation of the vertex, or {@code null} for a vertex without operation.
     * @return The index of the new vertex.
     */
    public int addVertex(SsbOperation op) {
        ops.add(op);
        outEdges.add(new ArrayList<>());
        inEdges.add(new ArrayList<>());
        return ops.size() - 1;
    }

    public int addVertex() {
        return addVertex(null);
    }

    public Edge addEdge(int from, int to) {
        return addEdge(from, to, null);
    }

    /**
     * Adds an edge.
     *
     * @param from       The source vertex.
     * @param to         The target vertex.
     * @param switchCase The switch case the edge represents, or {@code null}.
     * @return The new edge.
     * @throws IndexOutOfBoundsException if a vertex does not exist.
     */
    public Edge addEdge(int from, int to, SwitchCaseOperation switchCase) {
        checkVertex(from);
        checkVertex(to);
        Edge edge = new Edge(from, to, switchCase);
        outEdges.get(from).add(edge);
        inEdges.get(to).add(edge);
        return edge;
    }

    public List<Edge> outEdges(int vertex) {
        checkVertex(vertex);
        return Collections.unmodifiableList(outEdges.get(vertex));
    }

    public List<Edge> inEdges(int vertex) {
        checkVertex(vertex);
        return Collections.unmodifiableList(inEdges.get(vertex));
    }

    @Override
    public int vertexCount() {
        return ops.size();
    }

    @Override
    public Optional<SsbOperation> op(int vertex) {
        checkVertex(vertex);
        return Optional.ofNullable(ops.get(vertex));
    }

    @Override
    public int outDegree(int vertex) {
        return outEdges(vertex).size();
    }

    @Override
    public int inDegree(int vertex) {
        return inEdges(vertex).size();
    }

    private void checkVertex(int vertex) {
        if (vertex < 0 || vertex >= ops.size()) {
            throw new IndexOutOfBoundsException("Vertex " + vertex + " does not exist (vertex count: " + ops.size() + ")");
        }
    }
}
