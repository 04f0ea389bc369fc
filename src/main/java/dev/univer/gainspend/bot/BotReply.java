package dev.univer.gainspend.bot;

public record BotReply(String text, Keyboard keyboard) {

    public static BotReply of(String text) {
        return new BotReply(text, Keyboard.NONE);
    }

    public static BotReply withMenu(String text) {
        return new BotReply(text, Keyboard.MAIN_MENU);
    }
}
