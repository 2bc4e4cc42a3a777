package com.asvarishch.stakelotto.model;

import com.asvarishch.stakelotto.model.base.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

/** Singleton row: current round pointer, pause flag and the timelocked payout cap. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "id", callSuper = false)
@Entity
@Table(name = "engine_state")
public class EngineState extends AuditableEntity<Integer> {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "id")
    private Integer id;

    @Column(name = "current_round_id", nullable = false)
    private long currentRoundId;

    @Column(name = "paused", nullable = false)
    private boolean paused;

    @Column(name = "max_payout_per_round", precision = 38, scale = 18, nullable = false)
    private BigDecimal maxPayoutPerRound;
}
