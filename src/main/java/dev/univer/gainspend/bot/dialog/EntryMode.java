package dev.univer.gainspend.bot.dialog;

public enum EntryMode {
    /** Сначала сумма, потом описание отдельным сообщением. */
    STEPWISE,
    /** «Сумма, Описание» одной строкой. */
    SINGLE_LINE
}
