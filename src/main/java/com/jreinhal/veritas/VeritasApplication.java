package com.jreinhal.veritas;

import com.jreinhal.veritas.constant.MetadataKeys;
import com.jreinhal.veritas.workspace.WorkspaceContext;
import jakarta.annotation.PostConstruct;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.mongodb.atlas.MongoDBAtlasVectorStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.data.mongodb.core.MongoTemplate;

@SpringBootApplication
public class VeritasApplication {
    private static final Logger log = LoggerFactory.getLogger(VeritasApplication.class);
    private final Environment environment;

    public VeritasApplication(Environment environment) {
        this.environment = environment;
    }

    public static void main(String[] args) {
        SpringApplication.run(VeritasApplication.class, args);
    }

    @PostConstruct
    public void validateConfiguration() {
        WorkspaceContext.setDefaultWorkspaceId(this.environment.getProperty("veritas.workspace.default-id", "workspace_default"));
        String neo4jPassword = this.environment.getProperty("veritas.neo4j.password", "neo4j");
        if ("neo4j".equals(neo4jPassword)) {
            log.warn("veritas.neo4j.password is the Neo4j factory default; set NEO4J_PASSWORD outside local development");
        }
        if (!Boolean.parseBoolean(this.environment.getProperty("veritas.validation.self-check-enabled", "true"))) {
            log.warn("Answer self-check is disabled; only evidence and citation checks will run");
        }
        log.info("Configuration validated:");
        log.info("  Default workspace: {}", WorkspaceContext.getDefaultWorkspaceId());
        log.info("  Fusion strategy: {}", this.environment.getProperty("veritas.fusion.strategy", "hybrid"));
    }

    @Bean
    public VectorStore vectorStore(MongoTemplate mongoTemplate, EmbeddingModel embeddingModel,
                                   @Value("${veritas.vector-store.collection:vector_store}") String collectionName,
                                   @Value("${veritas.vector-store.index:vector_index}") String indexName) {
        log.info("Using MongoDB Atlas vector store (collection={}, index={})", collectionName, indexName);
        return MongoDBAtlasVectorStore.builder(mongoTemplate, embeddingModel)
                .collectionName(collectionName)
                .vectorIndexName(indexName)
                .pathName("embedding")
                .metadataFieldsToFilter(List.of(MetadataKeys.WORKSPACE_ID, MetadataKeys.SOURCE))
                .initializeSchema(false)
                .build();
    }
}
