package dev.univer.gainspend.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Сообщает владельцу о чужих попытках воспользоваться ботом.
 * Отправка идёт в фоне; её сбой только логируется и не влияет на ответ пользователю.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OwnerNotifier {
    private final TelegramSender telegramSender;
    private final TelegramProperties props;

    @Async
    public void notifyAccessRequest(AccessRequest request) {
        Long ownerId = props.getOwnerId();
        if (ownerId == null) return;
        String text = "🔔 Запрос доступа: " + request.describe() + "\n"
                      + "Открыть доступ: /grant " + request.userId();
        try {
            telegramSender.send(ownerId, text);
        } catch (TelegramApiException | RuntimeException e) {
            log.warn("Failed to notify owner {} about user {}: {}", ownerId, request.userId(), e.getMessage());
        }
    }
}
