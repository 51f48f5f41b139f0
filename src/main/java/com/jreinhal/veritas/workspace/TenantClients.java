package com.jreinhal.veritas.workspace;

import com.jreinhal.veritas.graph.GraphStore;
import org.springframework.ai.vectorstore.VectorStore;

/**
 * Store handles for one workspace.
 */
public record TenantClients(String workspaceId, VectorStore vectorStore, GraphStore graphStore) implements AutoCloseable {
    @Override
    public void close() {
        this.graphStore.close();
    }
}
