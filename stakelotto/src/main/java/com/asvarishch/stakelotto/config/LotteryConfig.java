package com.asvarishch.stakelotto.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LotteryProperties.class)
public class LotteryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
