package dev.univer.gainspend.service;

import dev.univer.gainspend.bot.BotReply;
import dev.univer.gainspend.bot.Keyboards;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

@Service
@RequiredArgsConstructor
public class TelegramSender {
    private final TelegramWrapper wrapper;

    public void send(Long chatId, String text) throws TelegramApiException {
        SendMessage sm = SendMessage.builder()
                .chatId(chatId.toString())
                .text(text)
                .build();
        wrapper.execute(sm);
    }

    public void send(Long chatId, BotReply reply) throws TelegramApiException {
        SendMessage sm = SendMessage.builder()
                .chatId(chatId.toString())
                .text(reply.text())
                .replyMarkup(Keyboards.markup(reply.keyboard()))
                .build();
        wrapper.execute(sm);
    }
}
