package dev.univer.gainspend.exception;

/** Не задана обязательная внешняя настройка; приложение не стартует. */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
