package dev.univer.gainspend.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Закрытый набор категорий расходов. Порядок объявления задаёт порядок кнопок,
 * порядок поиска по тексту кнопки и порядок строк в статистике.
 */
@Getter
@RequiredArgsConstructor
public enum ExpenseCategory {
    FOOD("Еда", "🍽️"),
    HOME("Дом", "🏠"),
    UTILITIES("Коммуналка", "💡"),
    LEISURE("Досуг", "🎉"),
    RESERVE("НЗ", "📦");

    private final String label;
    private final String emoji;

    /** Текст кнопки, например «🍽️ Еда». */
    public String buttonText() {
        return emoji + " " + label;
    }

    public boolean isReserve() {
        return this == RESERVE;
    }

    public static Optional<ExpenseCategory> fromLabel(String label) {
        for (ExpenseCategory c : values()) {
            if (c.label.equals(label)) return Optional.of(c);
        }
        return Optional.empty();
    }
}
