package com.asvarishch.stakelotto.model;

import com.asvarishch.stakelotto.model.base.AuditableEntity;
import com.asvarishch.stakelotto.util.TokenMath;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "allowanceId", callSuper = false)
@Entity
@Table(
        name = "allowances",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_allowance_owner_spender", columnNames = {"owner_address", "spender_address"})
        }
)
public class Allowance extends AuditableEntity<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "allowance_id")
    private Long allowanceId;

    @Column(name = "owner_address", length = 64, nullable = false)
    private String owner;

    @Column(name = "spender_address", length = 64, nullable = false)
    private String spender;

    @Builder.Default
    @Column(name = "amount", precision = 38, scale = 18, nullable = false)
    private BigDecimal amount = TokenMath.ZERO;
}
