package com.asvarishch.stakelotto.model;

import com.asvarishch.stakelotto.enums.RandomnessRequestStatus;
import com.asvarishch.stakelotto.model.base.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * REQUESTED -> FULFILLED, or REQUESTED forever. Only a REQUESTED row accepts a delivery.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "requestId", callSuper = false)
@Entity
@Table(
        name = "randomness_requests",
        indexes = {
                @Index(name = "ix_randomness_round_id", columnList = "round_id")
        }
)
public class RandomnessRequest extends AuditableEntity<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "request_id")
    private Long requestId;

    @Column(name = "round_id", nullable = false)
    private Long roundId;

    @Column(name = "num_values", nullable = false)
    private int numValues;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 16, nullable = false)
    private RandomnessRequestStatus status = RandomnessRequestStatus.REQUESTED;

    @Column(name = "requested_at", nullable = false)
    private Instant requestedAt;

    @Column(name = "fulfilled_at")
    private Instant fulfilledAt;

    public boolean isOutstanding() {
        return status == RandomnessRequestStatus.REQUESTED;
    }
}
