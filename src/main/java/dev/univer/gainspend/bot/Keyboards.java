package dev.univer.gainspend.bot;

import dev.univer.gainspend.model.ExpenseCategory;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardRemove;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;

import java.util.ArrayList;
import java.util.List;

public final class Keyboards {

    private Keyboards() {}

    /** null, если клавиатуру трогать не нужно. */
    public static ReplyKeyboard markup(Keyboard keyboard) {
        if (keyboard == null) return null;
        return switch (keyboard) {
            case NONE -> null;
            case REMOVE -> ReplyKeyboardRemove.builder().removeKeyboard(true).build();
            case MAIN_MENU -> build(List.of(row(Buttons.INCOME, Buttons.EXPENSE), row(Buttons.STATS)), false);
            case CATEGORIES -> {
                List<KeyboardRow> rows = new ArrayList<>();
                for (ExpenseCategory c : ExpenseCategory.values()) rows.add(row(c.buttonText()));
                yield build(rows, true);
            }
            case PERIODS -> build(List.of(row(Buttons.CURRENT_MONTH, Buttons.PICK_MONTH), row(Buttons.ALL_TIME)), true);
            case DETAIL_LEVELS -> build(List.of(row(Buttons.SUMMARY, Buttons.DETAILED)), true);
        };
    }

    private static ReplyKeyboardMarkup build(List<KeyboardRow> rows, boolean oneTime) {
        return ReplyKeyboardMarkup.builder()
                .keyboard(rows)
                .resizeKeyboard(true)
                .oneTimeKeyboard(oneTime)
                .build();
    }

    private static KeyboardRow row(String... labels) {
        KeyboardRow row = new KeyboardRow();
        for (String label : labels) row.add(label);
        return row;
    }
}
