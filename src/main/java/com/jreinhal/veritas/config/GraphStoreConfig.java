package com.jreinhal.veritas.config;

import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GraphStoreConfig {
    private static final Logger log = LoggerFactory.getLogger(GraphStoreConfig.class);

    @Bean(destroyMethod = "close")
    public Driver neo4jDriver(@Value("${veritas.neo4j.uri:bolt://localhost:7687}") String uri,
                              @Value("${veritas.neo4j.username:neo4j}") String username,
                              @Value("${veritas.neo4j.password:neo4j}") String password) {
        log.info("Neo4j driver configured for {}", uri);
        return GraphDatabase.driver(uri, AuthTokens.basic(username, password));
    }
}
