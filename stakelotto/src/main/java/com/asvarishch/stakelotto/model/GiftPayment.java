package com.asvarishch.stakelotto.model;

import com.asvarishch.stakelotto.model.base.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "paymentId", callSuper = false)
@Entity
@Table(
        name = "gift_payments",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_gift_round_recipient", columnNames = {"round_id", "recipient"})
        },
        indexes = {
                @Index(name = "ix_gift_round_id", columnList = "round_id")
        }
)
public class GiftPayment extends AuditableEntity<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "payment_id")
    private Long paymentId;

    @Column(name = "round_id", nullable = false)
    private Long roundId;

    @Column(name = "recipient", length = 64, nullable = false)
    private String recipient;

    @Column(name = "amount", precision = 38, scale = 18, nullable = false)
    private BigDecimal amount;

    @Column(name = "creator_share", nullable = false)
    private boolean creatorShare;

    @Column(name = "paid_at", nullable = false)
    private Instant paidAt;
}
