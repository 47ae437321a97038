package com.phillippitts.talkback.domain;

import java.util.Objects;

/**
 * One completed user/assistant exchange kept in a session's rolling history.
 */
public record ConversationExchange(String userText, String assistantText) {

    public ConversationExchange {
        Objects.requireNonNull(userText, "userText must not be null");
        Objects.requireNonNull(assistantText, "assistantText must not be null");
    }
}
