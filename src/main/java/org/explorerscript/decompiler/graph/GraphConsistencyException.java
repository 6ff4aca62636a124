package org.explorerscript.decompiler.graph;

/**
 * Thrown when the routine graph does not match the markers attached to its operations,
 * e.g. a switch end whose switch start is not in the graph.
 * <p>
 * The graph builder guarantees this never happens; this exception indicates a defect upstream.
 */
public class GraphConsistencyException extends RuntimeException {

    public GraphConsistencyException(String message) {
        super(message);
    }
}
