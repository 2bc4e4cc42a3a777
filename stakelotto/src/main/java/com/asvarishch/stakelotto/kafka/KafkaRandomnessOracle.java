package com.asvarishch.stakelotto.kafka;

import com.asvarishch.stakelotto.config.LotteryProperties;
import com.asvarishch.stakelotto.dto.RandomnessRequestMessage;
import com.asvarishch.stakelotto.service.RandomnessOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class KafkaRandomnessOracle implements RandomnessOracle {

    private final KafkaTemplate<String, RandomnessRequestMessage> kafkaTemplate;
    private final LotteryProperties properties;

    /** Uses roundId as key so all requests of a round land on one partition. */
    @Override
    public void requestRandomness(RandomnessRequestMessage message) {
        final String topic = properties.getRandomness().getRequestTopic();
        log.info("Publishing randomness request: requestId={}, roundId={}, numValues={}, topic={}",
                message.requestId(), message.roundId(), message.numValues(), topic);
        kafkaTemplate.send(topic, String.valueOf(message.roundId()), message);
    }
}
