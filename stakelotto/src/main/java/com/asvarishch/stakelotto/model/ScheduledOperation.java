package com.asvarishch.stakelotto.model;

import com.asvarishch.stakelotto.enums.TimelockParameter;
import com.asvarishch.stakelotto.model.base.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;

/** A pending timelocked change, keyed by the hash of (parameter, value). */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "operationId", callSuper = false)
@Entity
@Table(name = "scheduled_operations")
public class ScheduledOperation extends AuditableEntity<String> {

    @Id
    @Column(name = "operation_id", length = 64, nullable = false)
    private String operationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "parameter", length = 48, nullable = false)
    private TimelockParameter parameter;

    @Column(name = "parameter_value", precision = 38, scale = 18, nullable = false)
    private BigDecimal value;

    @Column(name = "scheduled_by", length = 64, nullable = false)
    private String scheduledBy;

    @Column(name = "execute_time", nullable = false)
    private Instant executeTime;
}
