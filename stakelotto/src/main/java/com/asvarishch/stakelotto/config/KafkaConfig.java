package com.asvarishch.stakelotto.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class KafkaConfig {

    @Bean
    public NewTopic randomnessRequestTopic(LotteryProperties properties) {
        String topicName = properties.getRandomness().getRequestTopic();
        log.info("Creating Kafka topic '{}' with 1 partition and RF=1", topicName);
        return new NewTopic(topicName, 1, (short) 1);
    }

    @Bean
    public NewTopic randomnessFulfillmentTopic(LotteryProperties properties) {
        String topicName = properties.getRandomness().getFulfillmentTopic();
        log.info("Creating Kafka topic '{}' with 1 partition and RF=1", topicName);
        return new NewTopic(topicName, 1, (short) 1);
    }
}
