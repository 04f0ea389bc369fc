package dev.univer.gainspend.bot;

import dev.univer.gainspend.bot.dialog.ConversationMachine;
import dev.univer.gainspend.bot.dialog.DialogState;
import dev.univer.gainspend.bot.dialog.SessionStore;
import dev.univer.gainspend.bot.dialog.Transition;
import dev.univer.gainspend.model.AllowedUser;
import dev.univer.gainspend.service.AccessRequest;
import dev.univer.gainspend.service.AccessService;
import dev.univer.gainspend.service.OwnerNotifier;
import dev.univer.gainspend.service.TelegramProperties;
import dev.univer.gainspend.util.EntryParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Разбирает входящее сообщение: проверка доступа, глобальные команды,
 * точки входа в диалоги и, если диалог уже идёт, передача текста в {@link ConversationMachine}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CommandDispatcher {

    // "/grant 123", "/grant@my_bot 123"
    private static final Pattern COMMAND = Pattern.compile("^/(\\w+)(?:@\\w+)?(?:\\s+(.*))?$", Pattern.DOTALL);

    private final SessionStore sessions;
    private final ConversationMachine machine;
    private final AccessService accessService;
    private final OwnerNotifier ownerNotifier;
    private final TelegramProperties props;

    public List<BotReply> dispatch(Inbound in) {
        try {
            return route(in);
        } catch (DataAccessException e) {
            log.error("Storage failure while handling message from user {}", in.userId(), e);
            return List.of(BotReply.of(ConversationMachine.STORAGE_FAILURE));
        }
    }

    private List<BotReply> route(Inbound in) {
        String text = in.text() == null ? "" : in.text().trim();
        Long userId = in.userId();

        Matcher cm = COMMAND.matcher(text);
        String command = cm.matches() ? cm.group(1).toLowerCase(Locale.ROOT) : null;
        String args = cm.matches() && cm.group(2) != null ? cm.group(2).trim() : "";

        if ("myid".equals(command)) {
            return List.of(BotReply.of("Твой ID: " + userId));
        }

        if (!accessService.isAllowed(userId)) {
            AccessRequest request = new AccessRequest(userId, in.username(), in.firstName());
            log.info("Rejected user {} ({})", userId, request.describe());
            accessService.rememberRequest(request);
            ownerNotifier.notifyAccessRequest(request);
            return List.of(new BotReply("⛔ У тебя нет доступа к этому боту.\n"
                                        + "Твой ID: " + userId + ". Владелец получил запрос на доступ.", Keyboard.REMOVE));
        }

        if (command != null) {
            return onCommand(in, command, args);
        }

        if (Buttons.INCOME.equals(text)) return begin(userId, machine.beginIncome());
        if (Buttons.EXPENSE.equals(text)) return begin(userId, machine.beginExpense());
        if (Buttons.STATS.equals(text)) return begin(userId, machine.beginStats());

        Optional<DialogState> state = sessions.current(userId);
        if (state.isPresent()) {
            Transition t = machine.apply(userId, state.get(), text);
            sessions.apply(userId, t);
            return t.replies();
        }
        if (EntryParser.isCancel(text)) {
            return List.of(BotReply.withMenu("Сейчас нечего отменять."));
        }
        return List.of(BotReply.withMenu("Выбери действие на клавиатуре."));
    }

    private List<BotReply> onCommand(Inbound in, String command, String args) {
        Long userId = in.userId();
        switch (command) {
            case "start" -> {
                sessions.clear(userId);
                String name = in.firstName() == null || in.firstName().isBlank() ? "" : ", " + in.firstName().trim();
                return List.of(BotReply.withMenu("Привет" + name + "!\n\n"
                                                 + "Я бот для учёта доходов и расходов.\n"
                                                 + "Выбери действие на клавиатуре."));
            }
            case "help" -> {
                return List.of(BotReply.withMenu(helpText(userId)));
            }
            case "income" -> {
                return begin(userId, machine.beginIncome());
            }
            case "expense" -> {
                return begin(userId, machine.beginExpense());
            }
            case "stats" -> {
                return begin(userId, machine.beginStats());
            }
            case "cancel" -> {
                if (!sessions.clear(userId)) return List.of(BotReply.withMenu("Сейчас нечего отменять."));
                log.debug("User {} cancelled dialog", userId);
                return machine.cancel().replies();
            }
            case "grant", "revoke", "users" -> {
                if (!props.isOwner(userId)) return List.of(BotReply.of("❌ Эта команда доступна только владельцу."));
                return ownerCommand(command, args);
            }
            default -> {
                return List.of(BotReply.of("Неизвестная команда. Список команд: /help"));
            }
        }
    }

    private List<BotReply> ownerCommand(String command, String args) {
        if ("users".equals(command)) {
            List<AllowedUser> all = accessService.listAllowed();
            if (all.isEmpty()) return List.of(BotReply.of("Список доступа пуст."));
            StringBuilder sb = new StringBuilder("Доступ есть у:\n");
            for (AllowedUser u : all) {
                sb.append("• ").append(new AccessRequest(u.getUserId(), u.getUsername(), u.getFirstName()).describe()).append("\n");
            }
            return List.of(BotReply.of(sb.toString().trim()));
        }

        Long target = parseUserId(args);
        if (target == null) return List.of(BotReply.of("Использование: /" + command + " <id>"));
        if (props.isOwner(target)) return List.of(BotReply.of("Владелец имеет доступ всегда."));

        if ("grant".equals(command)) {
            AllowedUser u = accessService.grant(target);
            return List.of(BotReply.of("✅ Доступ открыт: "
                                       + new AccessRequest(u.getUserId(), u.getUsername(), u.getFirstName()).describe()));
        }
        sessions.clear(target);
        return List.of(BotReply.of(accessService.revoke(target)
                                   ? "🗑 Доступ для " + target + " отозван."
                                   : "❌ Пользователя " + target + " нет в списке доступа."));
    }

    private List<BotReply> begin(Long userId, Transition t) {
        sessions.start(userId, t.next());
        return t.replies();
    }

    private static Long parseUserId(String raw) {
        try {
            return raw == null || raw.isBlank() ? null : Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String helpText(Long userId) {
        StringBuilder sb = new StringBuilder(String.join("\n", List.of(
                "Я бот учёта доходов и расходов.",
                "",
                "/income — записать доход",
                "/expense — записать расход",
                "/stats — статистика за период",
                "/cancel — отменить текущее действие",
                "/myid — показать твой ID"
        )));
        if (props.isAccessControl() && props.isOwner(userId)) {
            sb.append("\n\nДля владельца:\n")
              .append("/grant <id> — открыть доступ\n")
              .append("/revoke <id> — закрыть доступ\n")
              .append("/users — кому открыт доступ");
        }
        return sb.toString();
    }
}
