package dev.univer.gainspend.util;

import dev.univer.gainspend.exception.EntryFailure;
import dev.univer.gainspend.exception.EntryValidationException;
import dev.univer.gainspend.model.ExpenseCategory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;

public class EntryParser {

    public static final String CANCEL_KEYWORD = "отмена";
    public static final String CANCEL_COMMAND = "/cancel";

    // numeric(12,2): не больше 10 цифр до точки
    private static final int MAX_INTEGER_DIGITS = 10;
    private static final int MAX_FRACTION_DIGITS = 20;

    public record EntryLine(BigDecimal amount, String description) {}

    public static boolean isCancel(String text) {
        if (text == null) return false;
        String t = text.trim();
        return t.equalsIgnoreCase(CANCEL_KEYWORD) || t.equalsIgnoreCase(CANCEL_COMMAND);
    }

    /** Только сумма: «1500.50» или «1500,50». */
    public static BigDecimal parseAmount(String text) {
        requireNotCancel(text);
        return amountOf(text);
    }

    /** Свободный текст описания, не пустой. */
    public static String parseDescription(String text) {
        requireNotCancel(text);
        if (text == null || text.isBlank()) {
            throw new EntryValidationException(EntryFailure.EMPTY_DESCRIPTION, "Описание не может быть пустым");
        }
        return text.trim();
    }

    /** Одна строка «Сумма, Описание»; делим по первой запятой. */
    public static EntryLine parseLine(String text) {
        requireNotCancel(text);
        int comma = text == null ? -1 : text.indexOf(',');
        if (comma < 0) {
            throw new EntryValidationException(EntryFailure.MALFORMED_LINE, "Нет запятой между суммой и описанием");
        }
        BigDecimal amount = amountOf(text.substring(0, comma));
        String desc = text.substring(comma + 1).trim();
        if (desc.isEmpty()) {
            throw new EntryValidationException(EntryFailure.EMPTY_DESCRIPTION, "Описание после запятой пустое");
        }
        return new EntryLine(amount, desc);
    }

    /** Первая категория из списка, чья подпись входит в текст кнопки. */
    public static ExpenseCategory parseCategory(String text) {
        requireNotCancel(text);
        String t = text == null ? "" : text.trim();
        for (ExpenseCategory c : ExpenseCategory.values()) {
            if (t.contains(c.getLabel())) return c;
        }
        throw new EntryValidationException(EntryFailure.UNRECOGNIZED_CATEGORY, "Неизвестная категория: " + t);
    }

    /**
     * «ММ-ГГ» → месяц. Год всегда 2000 + ГГ: «11-25» → ноябрь 2025.
     * Годы после 2099 и 19xx этим форматом не выразить.
     */
    public static YearMonth parseMonth(String text) {
        requireNotCancel(text);
        String[] parts = text == null ? new String[0] : text.trim().split("-", -1);
        if (parts.length != 2) {
            throw new EntryValidationException(EntryFailure.INVALID_MONTH_FORMAT, "Нужен формат ММ-ГГ");
        }
        try {
            int month = Integer.parseInt(parts[0].trim());
            int year2 = Integer.parseInt(parts[1].trim());
            if (month < 1 || month > 12 || year2 < 0 || year2 > 99) {
                throw new EntryValidationException(EntryFailure.INVALID_MONTH_FORMAT, "Неверный месяц: " + month);
            }
            return YearMonth.of(2000 + year2, month);
        } catch (NumberFormatException e) {
            throw new EntryValidationException(EntryFailure.INVALID_MONTH_FORMAT, "Нужен формат ММ-ГГ", e);
        }
    }

    private static BigDecimal amountOf(String raw) {
        String s = raw == null ? "" : raw.trim().replace(',', '.');
        BigDecimal amount;
        try {
            amount = new BigDecimal(s);
        } catch (NumberFormatException e) {
            throw new EntryValidationException(EntryFailure.INVALID_AMOUNT, "Не число: " + raw, e);
        }
        // long: при экспоненте вроде 1E+2147483647 разность в int переполняется
        if ((long) amount.precision() - amount.scale() > MAX_INTEGER_DIGITS) {
            throw new EntryValidationException(EntryFailure.INVALID_AMOUNT, "Слишком большая сумма");
        }
        if (amount.scale() > MAX_FRACTION_DIGITS) {
            throw new EntryValidationException(EntryFailure.INVALID_AMOUNT, "Слишком много знаков после точки");
        }
        amount = amount.setScale(2, RoundingMode.HALF_UP);
        if (amount.signum() <= 0) {
            throw new EntryValidationException(EntryFailure.INVALID_AMOUNT, "Сумма должна быть > 0");
        }
        return amount;
    }

    private static void requireNotCancel(String text) {
        if (isCancel(text)) {
            throw new EntryValidationException(EntryFailure.CANCEL_REQUESTED, "Отмена");
        }
    }
}
