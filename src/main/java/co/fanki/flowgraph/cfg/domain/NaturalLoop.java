package co.fanki.flowgraph.cfg.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The natural loop of a back edge whose target dominates its source.
 *
 * @param header the loop header, target of the back edge
 * @param backEdge the back edge
 * @param body the nodes of the loop, header included
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record NaturalLoop(String header, CfgEdge backEdge, Set<String> body) {

    /**
     * Creates a loop, copying its body.
     */
    public NaturalLoop {
        body = Collections.unmodifiableSet(new LinkedHashSet<>(body));
    }

    /** Returns the number of nodes in the loop. */
    public int size() {
        return body.size();
    }

}
