package dev.univer.gainspend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class GainSpendBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(GainSpendBotApplication.class, args);
    }
}
