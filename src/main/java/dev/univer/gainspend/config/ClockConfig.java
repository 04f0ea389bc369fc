package dev.univer.gainspend.config;

import dev.univer.gainspend.service.TelegramProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ClockConfig {

    // «текущий месяц» и время записи считаются в этой зоне
    @Bean
    public Clock clock(TelegramProperties props) {
        String zone = props.getZoneId();
        return Clock.system(zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone));
    }
}
