package dev.univer.gainspend.bot;

public final class Buttons {
    public static final String INCOME = "➕ Доход";
    public static final String EXPENSE = "➖ Расход";
    public static final String STATS = "📊 Статистика";

    public static final String CURRENT_MONTH = "Текущий месяц";
    public static final String PICK_MONTH = "Выбрать месяц";
    public static final String ALL_TIME = "За всё время";

    public static final String SUMMARY = "Кратко";
    public static final String DETAILED = "Подробно";

    private Buttons() {}
}
