package com.relaychat.chatserver.web.dto;

import com.relaychat.chatserver.broker.ChatMessage;

public record ChatMessageDto(String from, String text, long timestampSeconds) {
    public static ChatMessageDto fromMessage(ChatMessage message) {
        return new ChatMessageDto(message.sender(), message.content(), message.timestamp().getEpochSecond());
    }
}
