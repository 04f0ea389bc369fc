package dev.univer.gainspend.bot.dialog;

import dev.univer.gainspend.bot.BotReply;
import dev.univer.gainspend.bot.Buttons;
import dev.univer.gainspend.bot.Keyboard;
import dev.univer.gainspend.bot.dialog.DialogState.*;
import dev.univer.gainspend.exception.EntryFailure;
import dev.univer.gainspend.exception.EntryValidationException;
import dev.univer.gainspend.model.ExpenseCategory;
import dev.univer.gainspend.model.FinanceRecord;
import dev.univer.gainspend.service.LedgerService;
import dev.univer.gainspend.service.StatisticsService;
import dev.univer.gainspend.service.StatsFormatter;
import dev.univer.gainspend.service.StatsReport;
import dev.univer.gainspend.service.TelegramProperties;
import dev.univer.gainspend.util.DateRange;
import dev.univer.gainspend.util.EntryParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;

/**
 * Переходы диалогов дохода, расхода и статистики. Сам ничего не хранит:
 * получает текущее состояние и текст, возвращает {@link Transition}.
 * Ошибка ввода оставляет пользователя в том же состоянии с подсказкой.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConversationMachine {

    public static final String CANCELLED = "Действие отменено.";
    public static final String STORAGE_FAILURE = "⚠️ Не удалось обратиться к базе данных. Попробуй отправить сообщение ещё раз.";

    private static final String LINE_EXAMPLE = "Формат: Сумма, Описание\nНапример: 1500.50, зарплата";
    private static final DateTimeFormatter MM_YY = DateTimeFormatter.ofPattern("MM-yy");

    private final LedgerService ledgerService;
    private final StatisticsService statisticsService;
    private final StatsFormatter statsFormatter;
    private final TelegramProperties props;
    private final Clock clock;

    // ====== Точки входа ======

    public Transition beginIncome() {
        if (props.getEntryMode() == EntryMode.SINGLE_LINE) {
            return Transition.to(new IncomeLine(), new BotReply("Введи доход одной строкой.\n" + LINE_EXAMPLE, Keyboard.REMOVE));
        }
        return Transition.to(new IncomeAmount(), new BotReply("Введи сумму дохода (например: 1500.50):", Keyboard.REMOVE));
    }

    public Transition beginExpense() {
        return Transition.to(new ExpenseCategoryChoice(), new BotReply("Выбери категорию расхода:", Keyboard.CATEGORIES));
    }

    public Transition beginStats() {
        return Transition.to(new StatsPeriod(), new BotReply("За какой период показать статистику?", Keyboard.PERIODS));
    }

    public Transition cancel() {
        return Transition.finish(BotReply.withMenu(CANCELLED));
    }

    // ====== Шаг диалога ======

    public Transition apply(Long userId, DialogState state, String text) {
        if (EntryParser.isCancel(text)) return cancel();
        try {
            return step(userId, state, text == null ? "" : text.trim());
        } catch (EntryValidationException e) {
            if (e.getFailure() == EntryFailure.CANCEL_REQUESTED) return cancel();
            log.debug("User {} input rejected in {}: {}", userId, state, e.getFailure());
            return Transition.to(state, reprompt(state, e.getFailure()));
        } catch (DataAccessException e) {
            log.error("Storage failure for user {} in {}", userId, state, e);
            return Transition.to(state, BotReply.of(STORAGE_FAILURE));
        }
    }

    private Transition step(Long userId, DialogState state, String text) {
        if (state instanceof IncomeAmount) {
            BigDecimal amount = EntryParser.parseAmount(text);
            return Transition.to(new IncomeDescription(amount),
                    BotReply.of("За что ты получил этот доход? (например: зарплата, заказ, подработка)"));
        }
        if (state instanceof IncomeDescription s) {
            String desc = EntryParser.parseDescription(text);
            return savedIncome(ledgerService.addIncome(userId, s.amount(), desc));
        }
        if (state instanceof IncomeLine) {
            var line = EntryParser.parseLine(text);
            return savedIncome(ledgerService.addIncome(userId, line.amount(), line.description()));
        }
        if (state instanceof ExpenseCategoryChoice) {
            ExpenseCategory category = EntryParser.parseCategory(text);
            String chosen = "Категория: " + category.buttonText() + "\n";
            if (props.getEntryMode() == EntryMode.SINGLE_LINE) {
                return Transition.to(new ExpenseLine(category),
                        new BotReply(chosen + "Теперь введи расход одной строкой.\nФормат: Сумма, Описание\nНапример: 350, продукты", Keyboard.REMOVE));
            }
            return Transition.to(new ExpenseAmount(category), new BotReply(chosen + "Теперь введи сумму расхода:", Keyboard.REMOVE));
        }
        if (state instanceof ExpenseAmount s) {
            BigDecimal amount = EntryParser.parseAmount(text);
            return Transition.to(new ExpenseDescription(s.category(), amount),
                    BotReply.of("Напиши комментарий: за что потратил?\nНапример: продукты, кафе, аренда и т.п."));
        }
        if (state instanceof ExpenseDescription s) {
            String desc = EntryParser.parseDescription(text);
            return savedExpense(ledgerService.addExpense(userId, s.category(), s.amount(), desc));
        }
        if (state instanceof ExpenseLine s) {
            var line = EntryParser.parseLine(text);
            return savedExpense(ledgerService.addExpense(userId, s.category(), line.amount(), line.description()));
        }
        if (state instanceof StatsPeriod) {
            return choosePeriod(userId, text);
        }
        if (state instanceof StatsCustomMonth) {
            YearMonth month = EntryParser.parseMonth(text);
            return periodChosen(userId, DateRange.ofMonth(month), "Месяц " + month.format(MM_YY));
        }
        if (state instanceof StatsDetailLevel s) {
            if (Buttons.SUMMARY.equalsIgnoreCase(text)) return report(userId, s.range(), s.label(), false);
            if (Buttons.DETAILED.equalsIgnoreCase(text)) return report(userId, s.range(), s.label(), true);
            return Transition.to(state, new BotReply("Пожалуйста, выбери вариант с клавиатуры.", Keyboard.DETAIL_LEVELS));
        }
        throw new IllegalStateException("Unknown dialog state: " + state);
    }

    private Transition choosePeriod(Long userId, String choice) {
        if (Buttons.CURRENT_MONTH.equals(choice)) {
            LocalDate today = LocalDate.now(clock);
            return periodChosen(userId, DateRange.currentMonth(today), "Текущий месяц (" + YearMonth.from(today).format(MM_YY) + ")");
        }
        if (Buttons.ALL_TIME.equals(choice)) {
            return periodChosen(userId, DateRange.allTime(), "За всё время");
        }
        if (Buttons.PICK_MONTH.equals(choice)) {
            return Transition.to(new StatsCustomMonth(),
                    new BotReply("Введи месяц в формате ММ-ГГ (последние 2 цифры года), например: 11-25", Keyboard.REMOVE));
        }
        return Transition.to(new StatsPeriod(), new BotReply("Пожалуйста, выбери вариант с клавиатуры.", Keyboard.PERIODS));
    }

    private Transition periodChosen(Long userId, DateRange range, String label) {
        if (props.isDetailPrompt()) {
            return Transition.to(new StatsDetailLevel(range, label), new BotReply("Показать кратко или подробно?", Keyboard.DETAIL_LEVELS));
        }
        return report(userId, range, label, false);
    }

    private Transition report(Long userId, DateRange range, String label, boolean detailed) {
        StatsReport report = statisticsService.compute(userId, range, detailed);
        return Transition.finish(BotReply.withMenu(statsFormatter.render(report, label)));
    }

    private Transition savedIncome(FinanceRecord r) {
        return Transition.finish(BotReply.withMenu(
                "Доход " + statsFormatter.money(r.getAmount()) + " сохранён ✅\nОписание: " + r.getDescription()));
    }

    private Transition savedExpense(FinanceRecord r) {
        return Transition.finish(BotReply.withMenu(
                "Расход " + statsFormatter.money(r.getAmount()) + " сохранён ✅\n"
                + "Категория: " + r.getCategory().buttonText() + "\n"
                + "Комментарий: " + r.getDescription()));
    }

    private BotReply reprompt(DialogState state, EntryFailure failure) {
        return switch (failure) {
            case INVALID_AMOUNT -> (state instanceof IncomeLine || state instanceof ExpenseLine)
                    ? BotReply.of("Некорректная сумма. " + LINE_EXAMPLE)
                    : BotReply.of("Некорректная сумма. Введи положительное число:");
            case MALFORMED_LINE -> BotReply.of("Не вижу запятой между суммой и описанием. " + LINE_EXAMPLE);
            case EMPTY_DESCRIPTION -> (state instanceof IncomeLine || state instanceof ExpenseLine)
                    ? BotReply.of("После запятой нужно описание. " + LINE_EXAMPLE)
                    : BotReply.of("Описание не может быть пустым. Напиши пару слов:");
            case UNRECOGNIZED_CATEGORY -> new BotReply("Пожалуйста, выбери категорию с клавиатуры.", Keyboard.CATEGORIES);
            case INVALID_MONTH_FORMAT -> BotReply.of("Неверный формат. Нужен ММ-ГГ, например: 11-25 (ноябрь 2025).");
            case CANCEL_REQUESTED -> BotReply.withMenu(CANCELLED);
        };
    }
}
