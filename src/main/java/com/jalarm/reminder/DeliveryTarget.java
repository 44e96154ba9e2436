package com.jalarm.reminder;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

import java.util.Objects;

/**
 * Where a reminder is delivered. Opaque to the scheduler; interpreted by the Notifier.
 */
@Embeddable
public class DeliveryTarget {

    @Column(name = "chat_id", nullable = false, length = 128)
    private String chatId;

    @Column(name = "bot_token", length = 256)
    private String botToken;

    @Column(name = "is_group", nullable = false)
    private boolean groupChat;

    public DeliveryTarget() {}

    public DeliveryTarget(String chatId, String botToken, boolean groupChat) {
        this.chatId = chatId;
        this.botToken = botToken;
        this.groupChat = groupChat;
    }

    public static DeliveryTarget chat(String chatId) {
        return new DeliveryTarget(chatId, null, chatId != null && chatId.startsWith("-"));
    }

    public String getChatId() { return chatId; }
    public String getBotToken() { return botToken; }
    public boolean isGroupChat() { return groupChat; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeliveryTarget other)) return false;
        return groupChat == other.groupChat
                && Objects.equals(chatId, other.chatId)
                && Objects.equals(botToken, other.botToken);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chatId, botToken, groupChat);
    }

    @Override
    public String toString() {
        return "DeliveryTarget[chatId=" + chatId + ", groupChat=" + groupChat + "]";
    }
}
