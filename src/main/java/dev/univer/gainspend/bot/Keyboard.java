package dev.univer.gainspend.bot;

/** Какую клавиатуру показать вместе с ответом. */
public enum Keyboard {
    NONE,
    REMOVE,
    MAIN_MENU,
    CATEGORIES,
    PERIODS,
    DETAIL_LEVELS
}
