package dev.univer.gainspend.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "records", indexes = {
        @Index(name = "idx_records_user_time", columnList = "userId, createdAt")
})
public class FinanceRecord {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long userId;

    @Convert(converter = RecordKindConverter.class)
    @Column(nullable = false, length = 16)
    private RecordKind kind;

    @Convert(converter = ExpenseCategoryConverter.class)
    @Column(length = 32)
    private ExpenseCategory category; // null для дохода

    @Column(precision = 12, scale = 2, nullable = false)
    private BigDecimal amount;

    @Column(columnDefinition = "text")
    private String description;

    // локальное «наивное» время бота, без зоны
    @Column(nullable = false)
    private LocalDateTime createdAt;
}
