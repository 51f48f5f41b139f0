package com.jreinhal.veritas.constant;

import java.util.List;

/**
 * Metadata keys read from vector store documents and graph rows.
 */
public final class MetadataKeys {
    public static final String WORKSPACE_ID = "workspace_id";
    public static final String DOCUMENT_ID = "document_id";
    public static final String EPISODE_ID = "episode_id";
    public static final String TITLE = "title";
    public static final String EPISODE_TITLE = "episode_title";
    public static final String SOURCE = "source";
    public static final String TIMESTAMP = "timestamp";
    public static final String START_SECONDS = "start_seconds";
    public static final String OFFSET = "offset";
    public static final String SPEAKER_NAME = "speaker_name";
    public static final String SPEAKER = "speaker";
    public static final String AUTHOR = "author";

    public static final List<String> DOCUMENT_ID_KEYS = List.of(DOCUMENT_ID, EPISODE_ID, SOURCE);
    public static final List<String> LABEL_KEYS = List.of(TITLE, EPISODE_TITLE);
    public static final List<String> SPEAKER_KEYS = List.of(SPEAKER_NAME, SPEAKER, AUTHOR);

    private MetadataKeys() {
    }
}
