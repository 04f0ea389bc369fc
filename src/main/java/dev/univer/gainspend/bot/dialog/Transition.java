package dev.univer.gainspend.bot.dialog;

import dev.univer.gainspend.bot.BotReply;

import java.util.List;

/**
 * Результат шага: следующее состояние ({@code null}, если диалог завершён) и ответы пользователю.
 */
public record Transition(DialogState next, List<BotReply> replies) {

    public static Transition to(DialogState next, BotReply reply) {
        return new Transition(next, List.of(reply));
    }

    public static Transition finish(BotReply reply) {
        return new Transition(null, List.of(reply));
    }

    public boolean isTerminal() {
        return next == null;
    }
}
