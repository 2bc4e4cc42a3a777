package com.asvarishch.stakelotto.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine constants. Amounts are in whole tokens (18 decimals allowed).
 * Values under {@code rounds.max-payout-per-round} and {@code gift.*} only seed the
 * database on first start; afterwards they change through the timelock.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "lottery")
public class LotteryProperties {

    private Token token = new Token();
    private Rounds rounds = new Rounds();
    private Gift gift = new Gift();
    private Admin admin = new Admin();
    private Accounts accounts = new Accounts();
    private Randomness randomness = new Randomness();
    private Access access = new Access();

    @Getter
    @Setter
    public static class Token {
        private BigDecimal minStake = new BigDecimal("10");
        private BigDecimal maxStakePerUser = new BigDecimal("1000000");
        private Duration minStakeDuration = Duration.ofHours(24);
        /** Weight equals stake up to this duration. */
        private Duration boostStart = Duration.ofDays(7);
        /** Weight reaches 2x stake at this duration. */
        private Duration boostFull = Duration.ofDays(30);
        private BigDecimal maxSupply = new BigDecimal("1000000000");
    }

    @Getter
    @Setter
    public static class Rounds {
        private Duration duration = Duration.ofDays(7);
        private BigDecimal minBet = new BigDecimal("1");
        private BigDecimal maxBetPerUserPerRound = new BigDecimal("1000");
        private int houseEdgeBps = 500;
        private BigDecimal maxPayoutPerRound = new BigDecimal("100000");
        private Duration emergencyDrawGrace = Duration.ofHours(1);
        private int consecutivePlayRequirement = 3;
        /** Open round 1 on startup when the database holds no round. */
        private boolean autoInitialize = true;
        /** match count -> multiplier on the bet amount, before house edge. */
        private Map<Integer, Long> payoutMultipliers = new LinkedHashMap<>(Map.of(
                5, 800L,
                4, 80L,
                3, 8L,
                2, 2L
        ));
    }

    @Getter
    @Setter
    public static class Gift {
        private BigDecimal creatorAmount = new BigDecimal("100");
        private BigDecimal userAmount = new BigDecimal("10");
        private int recipientsPerRound = 10;
        private Duration cooldown = Duration.ofDays(30);
    }

    @Getter
    @Setter
    public static class Admin {
        private Duration timelockDelay = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Accounts {
        /** Holds wagers and pays winnings. */
        private String engine = "lottery-engine";
        /** Holds the gift reserve's tokens. */
        private String giftReserve = "gift-reserve";
        private String creator = "creator";
    }

    @Getter
    @Setter
    public static class Randomness {
        private int numValues = 5;
        private String requestTopic = "randomness-requests";
        private String fulfillmentTopic = "randomness-fulfillments";
        private String keyHash = "0x474e34a077df58807dbe9c96d3c009b23b3c6d0cce433e59bbf5b34f823bc56c";
        private long subscriptionId = 0L;
        private int requestConfirmations = 3;
        private long callbackGasLimit = 2_500_000L;
    }

    @Getter
    @Setter
    public static class Access {
        /** Granted every role on first start. */
        private String bootstrapOwner = "owner";
    }
}
