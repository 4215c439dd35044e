package com.scholary.videoconcat.annotation;

/**
 * One turn of a training conversation.
 *
 * @param from {@code human} or {@code gpt}
 * @param value the turn text, or a streaming token such as {@code <image>}
 */
public record ConversationTurn(String from, String value) {}
