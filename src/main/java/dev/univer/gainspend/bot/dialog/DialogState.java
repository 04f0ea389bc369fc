package dev.univer.gainspend.bot.dialog;

import dev.univer.gainspend.model.ExpenseCategory;
import dev.univer.gainspend.util.DateRange;

import java.math.BigDecimal;

/**
 * Шаг активного диалога. Каждый вариант несёт только свои промежуточные данные;
 * отсутствие состояния у пользователя означает, что диалога нет.
 */
public interface DialogState {

    record IncomeAmount() implements DialogState {}

    record IncomeDescription(BigDecimal amount) implements DialogState {}

    record IncomeLine() implements DialogState {}

    record ExpenseCategoryChoice() implements DialogState {}

    record ExpenseAmount(ExpenseCategory category) implements DialogState {}

    record ExpenseDescription(ExpenseCategory category, BigDecimal amount) implements DialogState {}

    record ExpenseLine(ExpenseCategory category) implements DialogState {}

    record StatsPeriod() implements DialogState {}

    record StatsCustomMonth() implements DialogState {}

    record StatsDetailLevel(DateRange range, String label) implements DialogState {}
}
