package com.jreinhal.veritas.workspace;

import com.jreinhal.veritas.graph.Neo4jGraphStore;
import java.time.Duration;
import org.neo4j.driver.Driver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class DefaultTenantClientFactory implements TenantClientFactory {
    private static final Logger log = LoggerFactory.getLogger(DefaultTenantClientFactory.class);

    private final VectorStore vectorStore;
    private final Driver neo4jDriver;
    @Value("${veritas.neo4j.database:}")
    private String database;
    @Value("${veritas.neo4j.query-timeout-ms:8000}")
    private long queryTimeoutMs;

    public DefaultTenantClientFactory(VectorStore vectorStore, Driver neo4jDriver) {
        this.vectorStore = vectorStore;
        this.neo4jDriver = neo4jDriver;
    }

    @Override
    public TenantClients create(String workspaceId) {
        log.info("Creating store clients for workspace {}", workspaceId);
        Neo4jGraphStore graphStore = new Neo4jGraphStore(this.neo4jDriver, this.database, workspaceId, Duration.ofMillis(this.queryTimeoutMs));
        return new TenantClients(workspaceId, this.vectorStore, graphStore);
    }
}
