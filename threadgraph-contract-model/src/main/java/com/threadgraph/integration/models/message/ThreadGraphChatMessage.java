package com.threadgraph.integration.models.message;

import com.threadgraph.integration.enumerations.ThreadGraphMessageRole;

import java.io.Serializable;
import java.util.Objects;

/**
 * A single entry of the conversation history.
 */
public record ThreadGraphChatMessage(ThreadGraphMessageRole role, String content) implements Serializable {

    public ThreadGraphChatMessage {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(content, "content");
    }

    public static ThreadGraphChatMessage user(String content) {
        return new ThreadGraphChatMessage(ThreadGraphMessageRole.USER, content);
    }

    public static ThreadGraphChatMessage assistant(String content) {
        return new ThreadGraphChatMessage(ThreadGraphMessageRole.ASSISTANT, content);
    }

    public boolean isUser() {
        return role == ThreadGraphMessageRole.USER;
    }
}
