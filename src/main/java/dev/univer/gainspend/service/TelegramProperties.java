package dev.univer.gainspend.service;

import dev.univer.gainspend.bot.dialog.EntryMode;
import dev.univer.gainspend.exception.ConfigurationException;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "bot")
@Getter @Setter
public class TelegramProperties {
    private String username;
    private String token;

    // единственный владелец бота; всегда имеет доступ
    private Long ownerId;
    private boolean accessControl;

    private EntryMode entryMode = EntryMode.STEPWISE;
    private boolean detailPrompt = true;
    private String currency = "₽";
    private String zoneId;

    public void validate() {
        if (token == null || token.isBlank()) {
            throw new ConfigurationException("BOT_TOKEN is not set");
        }
        if (accessControl && ownerId == null) {
            throw new ConfigurationException("OWNER_ID is required when bot.access-control is enabled");
        }
    }

    public boolean isOwner(Long userId) {
        return ownerId != null && ownerId.equals(userId);
    }
}
