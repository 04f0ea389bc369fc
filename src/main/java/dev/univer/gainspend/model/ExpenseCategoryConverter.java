package dev.univer.gainspend.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

// в таблице храним подпись категории («Еда»), а не имя константы
@Converter
public class ExpenseCategoryConverter implements AttributeConverter<ExpenseCategory, String> {

    @Override
    public String convertToDatabaseColumn(ExpenseCategory category) {
        return category == null ? null : category.getLabel();
    }

    @Override
    public ExpenseCategory convertToEntityAttribute(String label) {
        if (label == null || label.isBlank()) return null;
        return ExpenseCategory.fromLabel(label)
                .orElseThrow(() -> new IllegalArgumentException("Unknown expense category: " + label));
    }
}
