package dev.univer.gainspend.service;

import dev.univer.gainspend.model.ExpenseCategory;
import dev.univer.gainspend.model.FinanceRecord;
import dev.univer.gainspend.model.RecordKind;
import dev.univer.gainspend.repo.RecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {
    private final RecordRepository recordRepository;
    private final Clock clock;

    @Transactional
    public FinanceRecord addIncome(Long userId, BigDecimal amount, String description) {
        return add(userId, RecordKind.INCOME, null, amount, description);
    }

    @Transactional
    public FinanceRecord addExpense(Long userId, ExpenseCategory category, BigDecimal amount, String description) {
        if (category == null) throw new IllegalArgumentException("Расход без категории");
        return add(userId, RecordKind.EXPENSE, category, amount, description);
    }

    private FinanceRecord add(Long userId, RecordKind kind, ExpenseCategory category, BigDecimal amount, String description) {
        if (amount == null || amount.signum() <= 0) throw new IllegalArgumentException("Сумма должна быть > 0");
        if (kind == RecordKind.INCOME && category != null) throw new IllegalArgumentException("У дохода нет категории");

        FinanceRecord record = FinanceRecord.builder()
                .userId(userId)
                .kind(kind)
                .category(category)
                .amount(amount.setScale(2, RoundingMode.HALF_UP))
                .description(description)
                .createdAt(LocalDateTime.now(clock))
                .build();
        FinanceRecord saved = recordRepository.save(record);
        log.info("Saved {} {} for user {} (category {})", kind.getCode(), saved.getAmount(), userId,
                category == null ? "-" : category.getLabel());
        return saved;
    }
}
