package dev.univer.gainspend.exception;

import lombok.Getter;

/**
 * Ввод пользователя не прошёл проверку. По {@link #getFailure()} диалог выбирает,
 * что переспросить; {@link EntryFailure#CANCEL_REQUESTED} завершает диалог.
 */
@Getter
public class EntryValidationException extends IllegalArgumentException {
    private final EntryFailure failure;

    public EntryValidationException(EntryFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public EntryValidationException(EntryFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
