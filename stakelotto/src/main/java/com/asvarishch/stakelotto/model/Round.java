package com.asvarishch.stakelotto.model;

import com.asvarishch.stakelotto.enums.DrawSource;
import com.asvarishch.stakelotto.enums.RoundPhase;
import com.asvarishch.stakelotto.model.base.AuditableEntity;
import com.asvarishch.stakelotto.model.converter.LotteryNumbersConverter;
import com.asvarishch.stakelotto.util.TokenMath;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;


@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "roundId", callSuper = false)
@Entity
@Table(
        name = "rounds",
        indexes = {
                @Index(name = "ix_round_status", columnList = "status")
        }
)
public class Round extends AuditableEntity<Long> {

    /** Monotonic, assigned by the engine, starting at 1. */
    @Id
    @Column(name = "round_id", nullable = false)
    private Long roundId;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    /** Stored status; never CLOSED, see {@link #phaseAt(Instant)}. */
    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 32, nullable = false)
    private RoundPhase status = RoundPhase.OPEN;

    @Builder.Default
    @Convert(converter = LotteryNumbersConverter.class)
    @Column(name = "winning_numbers", length = 32, nullable = false)
    private List<Integer> winningNumbers = new ArrayList<>();

    @Builder.Default
    @Column(name = "total_bet_amount", precision = 38, scale = 18, nullable = false)
    private BigDecimal totalBetAmount = TokenMath.ZERO;

    /** Bets net of house edge. */
    @Builder.Default
    @Column(name = "total_prize_pool", precision = 38, scale = 18, nullable = false)
    private BigDecimal totalPrizePool = TokenMath.ZERO;

    @Column(name = "bet_count", nullable = false)
    private int betCount;

    @Column(name = "gifts_distributed", nullable = false)
    private boolean giftsDistributed;

    @Column(name = "pending_randomness_request_id")
    private Long pendingRandomnessRequestId;

    @Column(name = "randomness_requested_at")
    private Instant randomnessRequestedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "draw_source", length = 16)
    private DrawSource drawSource;

    @Column(name = "drawn_at")
    private Instant drawnAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public boolean isDrawn() {
        return status == RoundPhase.DRAWN;
    }

    public boolean hasEnded(Instant now) {
        return !now.isBefore(endTime);
    }

    public RoundPhase phaseAt(Instant now) {
        if (status == RoundPhase.OPEN && hasEnded(now)) {
            return RoundPhase.CLOSED;
        }
        return status;
    }

    public static Round open(long roundId, Instant startTime, Duration duration) {
        return Round.builder()
                .roundId(roundId)
                .startTime(startTime)
                .endTime(startTime.plus(duration))
                .build();
    }
}
