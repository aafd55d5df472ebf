package co.fanki.flowgraph.shared;

import java.io.Serializable;

/**
 * Marker interface for the immutable values of the graph model.
 *
 * <p>Nodes, edges and edge constraints are compared by their attributes:
 * two edges with the same endpoints and constraints are the same edge,
 * which is what lets a graph store each transition once.</p>
 *
 * <p>Implementations must be immutable and validate themselves on
 * construction.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
