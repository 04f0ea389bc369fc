package dev.univer.gainspend.service;

import dev.univer.gainspend.model.ExpenseCategory;
import dev.univer.gainspend.model.FinanceRecord;
import dev.univer.gainspend.model.RecordKind;
import dev.univer.gainspend.util.DateRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StatsFormatterTest {

    private StatsFormatter formatter;

    @BeforeEach
    void setUp() {
        TelegramProperties props = new TelegramProperties();
        props.setCurrency("₽");
        formatter = new StatsFormatter(props);
    }

    @Test
    void summary_listsReserveInItsOwnSection() {
        String text = formatter.render(report(false, List.of()), "Месяц 11-25");

        assertThat(text).isEqualTo(String.join("\n",
                "📊 Статистика: Месяц 11-25",
                "",
                "Доход: 1000.00 ₽",
                "Расход: 250.00 ₽",
                "Баланс: 750.00 ₽",
                "",
                "Расходы по категориям:",
                "• 🍽️ Еда: 200.00 ₽",
                "",
                "НЗ (Запас):",
                "• 📦 НЗ: 50.00 ₽"));
    }

    @Test
    void summary_withoutReserve_omitsReserveSection() {
        Map<RecordKind, BigDecimal> sums = new EnumMap<>(RecordKind.class);
        sums.put(RecordKind.EXPENSE, new BigDecimal("10"));
        Map<ExpenseCategory, BigDecimal> cats = new LinkedHashMap<>();
        cats.put(ExpenseCategory.LEISURE, new BigDecimal("10"));

        String text = formatter.render(new StatsReport(DateRange.allTime(), sums, cats, List.of(), false), "За всё время");

        assertThat(text).doesNotContain("НЗ (Запас)");
        assertThat(text).contains("Доход: 0.00 ₽", "Баланс: -10.00 ₽", "• 🎉 Досуг: 10.00 ₽");
    }

    @Test
    void detailed_rendersOnHandAndItemizedRecords() {
        List<FinanceRecord> rows = List.of(
                FinanceRecord.builder().kind(RecordKind.INCOME).amount(new BigDecimal("1000"))
                        .description("salary").createdAt(LocalDateTime.of(2025, 11, 5, 9, 0)).build(),
                FinanceRecord.builder().kind(RecordKind.EXPENSE).category(ExpenseCategory.FOOD).amount(new BigDecimal("200"))
                        .description("lunch").createdAt(LocalDateTime.of(2025, 11, 6, 13, 0)).build());

        String text = formatter.render(report(true, rows), "Месяц 11-25");

        assertThat(text).startsWith("📊 Статистика: Месяц 11-25 (подробно)");
        assertThat(text).contains("На руках: 750.00 ₽", "Доходы:", "• 05.11 1000.00 ₽ · salary",
                "Расходы:", "• 06.11 🍽️ Еда 200.00 ₽ · lunch");
        assertThat(text).doesNotContain(StatsFormatter.NO_RECORDS);
    }

    @Test
    void detailed_withNoRecords_rendersNoRecordsMessage() {
        StatsReport empty = new StatsReport(DateRange.allTime(), new EnumMap<>(RecordKind.class),
                new LinkedHashMap<>(), List.of(), true);

        String text = formatter.render(empty, "За всё время");

        assertThat(text).endsWith(StatsFormatter.NO_RECORDS);
        assertThat(text).contains("Доход: 0.00 ₽", "Расход: 0.00 ₽");
        assertThat(text).doesNotContain("Доходы:", "Расходы по категориям:");
    }

    @Test
    void money_alwaysHasTwoFractionDigits() {
        assertThat(formatter.money(new BigDecimal("12"))).isEqualTo("12.00 ₽");
        assertThat(formatter.money(new BigDecimal("0.5"))).isEqualTo("0.50 ₽");
        assertThat(formatter.money(null)).isEqualTo("0.00 ₽");
    }

    @Test
    void unknownCategory_hasNoEmojiPrefix() {
        assertThat(StatsFormatter.categoryTitle(null)).isEqualTo("Без категории");
        assertThat(StatsFormatter.categoryTitle(ExpenseCategory.HOME)).isEqualTo("🏠 Дом");
    }

    private static StatsReport report(boolean detailed, List<FinanceRecord> rows) {
        Map<RecordKind, BigDecimal> sums = new EnumMap<>(RecordKind.class);
        sums.put(RecordKind.INCOME, new BigDecimal("1000"));
        sums.put(RecordKind.EXPENSE, new BigDecimal("250"));
        Map<ExpenseCategory, BigDecimal> cats = new LinkedHashMap<>();
        cats.put(ExpenseCategory.FOOD, new BigDecimal("200"));
        cats.put(ExpenseCategory.RESERVE, new BigDecimal("50"));
        return new StatsReport(DateRange.allTime(), sums, cats, rows, detailed);
    }
}
