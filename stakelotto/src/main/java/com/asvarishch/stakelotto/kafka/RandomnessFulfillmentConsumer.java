package com.asvarishch.stakelotto.kafka;

import com.asvarishch.stakelotto.dto.RandomnessFulfillmentMessage;
import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.service.RandomnessGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;


@Service
@Slf4j
@RequiredArgsConstructor
public class RandomnessFulfillmentConsumer {

    private final RandomnessGateway randomnessGateway;

    @KafkaListener(topics = "${lottery.randomness.fulfillment-topic}")
    public void readFromFulfillmentTopic(ConsumerRecord<String, RandomnessFulfillmentMessage> record) {
        final RandomnessFulfillmentMessage message = record.value();
        log.info("Randomness fulfillment received: key='{}', value='{}'", record.key(), message);
        if (message == null || message.requestId() == null) {
            log.warn("Dropping fulfillment without request id: key='{}'", record.key());
            return;
        }

        // Rejected deliveries never change state; committing the offset drops them.
        try {
            randomnessGateway.deliver(message.requestId(), message.values());
        } catch (LotteryException e) {
            log.warn("Fulfillment for requestId={} rejected: {} {}", message.requestId(), e.getCode(), e.getMessage());
        }
    }
}
