package dev.univer.gainspend.service;

import dev.univer.gainspend.model.ExpenseCategory;
import dev.univer.gainspend.model.FinanceRecord;
import dev.univer.gainspend.model.RecordKind;
import dev.univer.gainspend.util.DateRange;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Итоги за период. {@code records} заполнен только для подробного отчёта.
 */
public record StatsReport(DateRange range,
                          Map<RecordKind, BigDecimal> sums,
                          Map<ExpenseCategory, BigDecimal> categoryTotals,
                          List<FinanceRecord> records,
                          boolean detailed) {

    public BigDecimal income() {
        return sums.getOrDefault(RecordKind.INCOME, BigDecimal.ZERO);
    }

    public BigDecimal expense() {
        return sums.getOrDefault(RecordKind.EXPENSE, BigDecimal.ZERO);
    }

    public BigDecimal balance() {
        return income().subtract(expense());
    }

    // та же формула, что и баланс; в подробном отчёте подписана «На руках»
    public BigDecimal onHand() {
        return income().subtract(expense());
    }

    public BigDecimal reserve() {
        return categoryTotals.getOrDefault(ExpenseCategory.RESERVE, BigDecimal.ZERO);
    }

    /** Категории расходов без НЗ, в порядке списка категорий. */
    public Map<ExpenseCategory, BigDecimal> spendingCategories() {
        Map<ExpenseCategory, BigDecimal> out = new LinkedHashMap<>();
        categoryTotals.forEach((c, amt) -> {
            if (c == null || !c.isReserve()) out.put(c, amt);
        });
        return out;
    }

    public List<FinanceRecord> recordsOf(RecordKind kind) {
        return records.stream().filter(r -> r.getKind() == kind).toList();
    }
}
