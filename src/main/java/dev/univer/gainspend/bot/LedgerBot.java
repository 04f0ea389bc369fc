package dev.univer.gainspend.bot;

import dev.univer.gainspend.service.TelegramSender;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerBot {

    private final CommandDispatcher dispatcher;
    private final TelegramSender telegramSender;

    @EventListener
    public void onUpdate(Update update) {
        try { handle(update); } catch (Exception e) { log.error("Error processing update {}", update.getUpdateId(), e); }
    }

    private void handle(Update update) throws TelegramApiException {
        if (!update.hasMessage()) return;
        Message msg = update.getMessage();
        if (!msg.hasText()) return;
        User from = msg.getFrom();
        if (from == null) return;

        Inbound in = new Inbound(from.getId(), msg.getChatId(), from.getUserName(), from.getFirstName(), msg.getText());
        List<BotReply> replies = dispatcher.dispatch(in);
        for (BotReply reply : replies) {
            telegramSender.send(in.chatId(), reply);
        }
    }
}
