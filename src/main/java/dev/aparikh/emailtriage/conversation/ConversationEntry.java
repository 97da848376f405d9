package dev.aparikh.emailtriage.conversation;

import dev.aparikh.emailtriage.model.EmailDocument;

public record ConversationEntry(
        EmailDocument email,
        Direction direction
) {
}
