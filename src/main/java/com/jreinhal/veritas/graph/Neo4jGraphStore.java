package com.jreinhal.veritas.graph;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.TransactionConfig;
import org.neo4j.driver.exceptions.Neo4jException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Neo4j-backed {@link GraphStore}. The driver is shared; each instance binds one workspace and
 * runs every query in a read transaction with a server-side timeout.
 */
public class Neo4jGraphStore implements GraphStore {
    private static final Logger log = LoggerFactory.getLogger(Neo4jGraphStore.class);

    private final Driver driver;
    private final String database;
    private final String workspaceId;
    private final TransactionConfig transactionConfig;

    public Neo4jGraphStore(Driver driver, String database, String workspaceId, Duration queryTimeout) {
        this.driver = driver;
        this.database = database;
        this.workspaceId = workspaceId;
        this.transactionConfig = TransactionConfig.builder().withTimeout(queryTimeout).build();
    }

    @Override
    public List<Map<String, Object>> query(String cypher, Map<String, Object> parameters) {
        Map<String, Object> bound = new HashMap<>(parameters == null ? Map.of() : parameters);
        bound.put(WORKSPACE_PARAM, this.workspaceId);
        SessionConfig sessionConfig = this.database == null || this.database.isBlank()
                ? SessionConfig.defaultConfig()
                : SessionConfig.forDatabase(this.database);
        try (Session session = this.driver.session(sessionConfig)) {
            return session.executeRead(tx -> tx.run(cypher, bound).list(Record::asMap), this.transactionConfig);
        }
        catch (Neo4jException e) {
            log.warn("Graph query failed for workspace {}: {}", this.workspaceId, e.getMessage());
            throw new GraphStoreException("Graph query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String workspaceId() {
        return this.workspaceId;
    }

    @Override
    public void close() {
        log.debug("Released graph handle for workspace {}", this.workspaceId);
    }
}
