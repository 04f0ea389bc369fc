package dev.univer.gainspend.repo;

import dev.univer.gainspend.model.FinanceRecord;
import dev.univer.gainspend.model.RecordKind;
import dev.univer.gainspend.util.DateRange;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDateTime;

/**
 * Типизированные фильтры для выборки записей. Отсутствующая граница периода
 * не добавляет условия, так что {@link DateRange#allTime()} сводится к фильтру по пользователю.
 */
public final class RecordSpecifications {

    private RecordSpecifications() {}

    public static Specification<FinanceRecord> ofUser(Long userId) {
        return (root, query, cb) -> cb.equal(root.get("userId"), userId);
    }

    public static Specification<FinanceRecord> createdFrom(LocalDateTime from) {
        return (root, query, cb) -> from == null ? null : cb.greaterThanOrEqualTo(root.get("createdAt"), from);
    }

    public static Specification<FinanceRecord> createdBefore(LocalDateTime to) {
        return (root, query, cb) -> to == null ? null : cb.lessThan(root.get("createdAt"), to);
    }

    public static Specification<FinanceRecord> ofKind(RecordKind kind) {
        return (root, query, cb) -> kind == null ? null : cb.equal(root.get("kind"), kind);
    }

    public static Specification<FinanceRecord> matching(Long userId, DateRange range, RecordKind kind) {
        return Specification.where(ofUser(userId))
                .and(createdFrom(range.from()))
                .and(createdBefore(range.to()))
                .and(ofKind(kind));
    }
}
