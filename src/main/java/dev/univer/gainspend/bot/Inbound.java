package dev.univer.gainspend.bot;

/** Входящее текстовое сообщение, уже без привязки к Telegram-объектам. */
public record Inbound(Long userId, Long chatId, String username, String firstName, String text) {
}
