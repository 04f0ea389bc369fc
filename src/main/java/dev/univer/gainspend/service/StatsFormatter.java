package dev.univer.gainspend.service;

import dev.univer.gainspend.model.ExpenseCategory;
import dev.univer.gainspend.model.FinanceRecord;
import dev.univer.gainspend.model.RecordKind;
import dev.univer.gainspend.util.MoneyFormat;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class StatsFormatter {

    public static final String NO_RECORDS = "За этот период записей нет.";
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("dd.MM");

    private final TelegramProperties props;

    public String render(StatsReport report, String periodLabel) {
        List<String> lines = new ArrayList<>();
        lines.add("📊 Статистика: " + periodLabel + (report.detailed() ? " (подробно)" : ""));
        lines.add("");
        lines.add("Доход: " + money(report.income()));
        lines.add("Расход: " + money(report.expense()));
        lines.add("Баланс: " + money(report.balance()));

        Map<ExpenseCategory, BigDecimal> spending = report.spendingCategories();
        if (!spending.isEmpty()) {
            lines.add("");
            lines.add("Расходы по категориям:");
            spending.forEach((c, amt) -> lines.add("• " + categoryTitle(c) + ": " + money(amt)));
        }

        if (report.reserve().signum() != 0) {
            lines.add("");
            lines.add("НЗ (Запас):");
            lines.add("• " + categoryTitle(ExpenseCategory.RESERVE) + ": " + money(report.reserve()));
        }

        if (report.detailed()) {
            lines.add("");
            lines.add("На руках: " + money(report.onHand()));
            lines.add("");
            if (report.records().isEmpty()) {
                lines.add(NO_RECORDS);
            } else {
                appendRecords(lines, "Доходы:", report.recordsOf(RecordKind.INCOME));
                appendRecords(lines, "Расходы:", report.recordsOf(RecordKind.EXPENSE));
            }
        }
        return String.join("\n", lines).trim();
    }

    private void appendRecords(List<String> lines, String title, List<FinanceRecord> records) {
        if (records.isEmpty()) return;
        if (!lines.get(lines.size() - 1).isEmpty()) lines.add("");
        lines.add(title);
        for (FinanceRecord r : records) {
            StringBuilder sb = new StringBuilder("• ").append(r.getCreatedAt().format(DAY)).append(' ');
            if (r.getKind() == RecordKind.EXPENSE) sb.append(categoryTitle(r.getCategory())).append(' ');
            sb.append(money(r.getAmount()));
            if (r.getDescription() != null && !r.getDescription().isBlank()) {
                sb.append(" · ").append(r.getDescription().trim());
            }
            lines.add(sb.toString());
        }
    }

    public String money(BigDecimal amount) {
        return MoneyFormat.format(amount, props.getCurrency());
    }

    // эмодзи есть только у известных категорий
    static String categoryTitle(ExpenseCategory c) {
        if (c == null) return "Без категории";
        String emoji = c.getEmoji();
        return (emoji == null || emoji.isEmpty()) ? c.getLabel() : emoji + " " + c.getLabel();
    }
}
