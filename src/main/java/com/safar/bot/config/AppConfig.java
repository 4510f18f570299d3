package com.safar.bot.config;

import com.safar.bot.component.KeyedLocks;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock(@Value("${bot.timezone:Asia/Karachi}") String timezone) {
        return Clock.system(ZoneId.of(timezone));
    }

    /** Per-user locks around load/process/save of a session. */
    @Bean
    public KeyedLocks sessionLocks() {
        return new KeyedLocks(64);
    }

    /** Per-trip locks around seat commits. */
    @Bean
    public KeyedLocks tripLocks() {
        return new KeyedLocks(16);
    }
}
