package dev.univer.gainspend.config;

import dev.univer.gainspend.exception.ConfigurationException;
import dev.univer.gainspend.service.TelegramProperties;
import dev.univer.gainspend.service.TelegramWrapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

@Configuration
@Profile("!test")
@RequiredArgsConstructor
@Slf4j
public class TelegramBotConfig {

    private final TelegramWrapper telegramWrapper;
    private final TelegramProperties props;

    @Bean
    public TelegramBotsApi telegramBotsApi() throws TelegramApiException {
        return new TelegramBotsApi(DefaultBotSession.class);
    }

    @Bean
    public InitializingBean registerBot(TelegramBotsApi api) {
        return () -> {
            props.validate();
            try {
                api.registerBot(telegramWrapper);
                telegramWrapper.installCommands();
                log.info("Bot @{} registered, access control {}, entry mode {}",
                        props.getUsername(), props.isAccessControl() ? "on" : "off", props.getEntryMode());
            } catch (TelegramApiException e) {
                throw new ConfigurationException("Failed to register Telegram bot", e);
            }
        };
    }
}
