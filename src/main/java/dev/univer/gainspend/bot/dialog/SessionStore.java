package dev.univer.gainspend.bot.dialog;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Текущий шаг диалога по каждому пользователю. Один активный диалог на пользователя. */
@Component
public class SessionStore {
    private final Map<Long, DialogState> byUser = new ConcurrentHashMap<>();

    public Optional<DialogState> current(Long userId) {
        return Optional.ofNullable(byUser.get(userId));
    }

    // новый диалог молча вытесняет незаконченный
    public void start(Long userId, DialogState state) {
        byUser.put(userId, state);
    }

    public void apply(Long userId, Transition transition) {
        if (transition.isTerminal()) byUser.remove(userId);
        else byUser.put(userId, transition.next());
    }

    public boolean clear(Long userId) {
        return byUser.remove(userId) != null;
    }
}
