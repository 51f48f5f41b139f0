package com.jreinhal.veritas.graph;

import java.util.List;
import java.util.Map;

/**
 * Read access to the knowledge graph, scoped to one workspace.
 *
 * <p>Callers construct parameterized, depth-bounded Cypher; the store only executes it. The
 * {@code workspace_id} parameter is bound by the store and must not be supplied by callers.</p>
 */
public interface GraphStore extends AutoCloseable {

    String WORKSPACE_PARAM = "workspace_id";

    /**
     * @return one map per row, keyed by the RETURN aliases
     * @throws GraphStoreException when the store is unavailable or the query fails
     */
    List<Map<String, Object>> query(String cypher, Map<String, Object> parameters);

    String workspaceId();

    @Override
    default void close() {
    }
}
