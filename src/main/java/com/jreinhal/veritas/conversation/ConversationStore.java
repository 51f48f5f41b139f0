package com.jreinhal.veritas.conversation;

import com.jreinhal.veritas.model.ConversationTurn;
import java.util.List;

/**
 * Read-only view of stored conversations. The pipeline never writes turns.
 */
public interface ConversationStore {

    /**
     * Last {@code limit} turns of a conversation, oldest first. Unknown ids yield an empty list.
     */
    List<ConversationTurn> recentTurns(String workspaceId, String conversationId, int limit);
}
