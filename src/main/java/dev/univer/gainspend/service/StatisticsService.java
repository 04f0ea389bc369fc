package dev.univer.gainspend.service;

import dev.univer.gainspend.model.ExpenseCategory;
import dev.univer.gainspend.model.FinanceRecord;
import dev.univer.gainspend.model.RecordKind;
import dev.univer.gainspend.repo.RecordRepository;
import dev.univer.gainspend.repo.RecordSpecifications;
import dev.univer.gainspend.util.DateRange;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.*;

@Service
@RequiredArgsConstructor
public class StatisticsService {

    // доходы раньше расходов, категории по алфавиту (без категории первыми), затем по времени
    static final Comparator<FinanceRecord> DETAIL_ORDER = Comparator
            .comparing(FinanceRecord::getKind)
            .thenComparing(StatisticsService::categoryLabel, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .thenComparing(FinanceRecord::getCreatedAt);

    private final RecordRepository recordRepository;

    @Transactional(readOnly = true)
    public StatsReport compute(Long userId, DateRange range, boolean detailed) {
        List<FinanceRecord> records = recordRepository.findAll(RecordSpecifications.matching(userId, range, null));

        Map<RecordKind, BigDecimal> sums = new EnumMap<>(RecordKind.class);
        Map<ExpenseCategory, BigDecimal> byCategory = new HashMap<>();
        for (FinanceRecord r : records) {
            sums.merge(r.getKind(), r.getAmount(), BigDecimal::add);
            if (r.getKind() == RecordKind.EXPENSE) {
                byCategory.merge(r.getCategory(), r.getAmount(), BigDecimal::add);
            }
        }

        Map<ExpenseCategory, BigDecimal> categoryTotals = new LinkedHashMap<>();
        for (ExpenseCategory c : ExpenseCategory.values()) {
            if (byCategory.containsKey(c)) categoryTotals.put(c, byCategory.get(c));
        }
        // старые записи расходов без категории
        if (byCategory.containsKey(null)) categoryTotals.put(null, byCategory.get(null));

        List<FinanceRecord> details = detailed
                ? records.stream().sorted(DETAIL_ORDER).toList()
                : List.of();
        return new StatsReport(range, sums, categoryTotals, details, detailed);
    }

    private static String categoryLabel(FinanceRecord r) {
        return r.getCategory() == null ? null : r.getCategory().getLabel();
    }
}
