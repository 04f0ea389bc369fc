package dev.univer.gainspend.config;

import dev.univer.gainspend.util.DatabaseUrl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import javax.sql.DataSource;

@Configuration
@Profile("!test")
@Slf4j
public class DataSourceConfig {

    @Bean
    public DataSource dataSource(@Value("${ledger.database-url:}") String databaseUrl) {
        DatabaseUrl url = DatabaseUrl.parse(databaseUrl);
        log.info("Using database {}", url.jdbcUrl().replaceAll("(?i)(password=)[^&]+", "$1***"));
        return DataSourceBuilder.create()
                .url(url.jdbcUrl())
                .username(url.username())
                .password(url.password())
                .build();
    }
}
