package com.jreinhal.veritas.conversation;

import com.jreinhal.veritas.model.ConversationTurn;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

@Component
public class MongoConversationStore implements ConversationStore {
    private static final Logger log = LoggerFactory.getLogger(MongoConversationStore.class);
    static final String COLLECTION_NAME = "conversation_turns";

    private final MongoTemplate mongoTemplate;

    public MongoConversationStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public List<ConversationTurn> recentTurns(String workspaceId, String conversationId, int limit) {
        if (conversationId == null || conversationId.isBlank() || limit <= 0) {
            return List.of();
        }
        Query query = new Query();
        query.addCriteria(Criteria.where("conversationId").is(conversationId));
        query.addCriteria(Criteria.where("workspaceId").is(workspaceId));
        query.with(Sort.by(Sort.Direction.DESC, "timestamp"));
        query.limit(limit);
        List<Document> rows = this.mongoTemplate.find(query, Document.class, COLLECTION_NAME);
        List<ConversationTurn> turns = new ArrayList<>(rows.size());
        for (Document row : rows) {
            String content = row.getString("content");
            if (content == null || content.isBlank()) {
                continue;
            }
            turns.add(new ConversationTurn(parseRole(row.getString("role")), content, toInstant(row.get("timestamp"))));
        }
        Collections.reverse(turns);
        log.debug("Loaded {} conversation turns", turns.size());
        return turns;
    }

    private static ConversationTurn.Role parseRole(String role) {
        return "assistant".equalsIgnoreCase(role) ? ConversationTurn.Role.ASSISTANT : ConversationTurn.Role.USER;
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        return Instant.EPOCH;
    }
}
