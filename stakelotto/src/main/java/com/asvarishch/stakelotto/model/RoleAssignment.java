package com.asvarishch.stakelotto.model;

import com.asvarishch.stakelotto.enums.Role;
import com.asvarishch.stakelotto.model.base.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "assignmentId", callSuper = false)
@Entity
@Table(
        name = "role_assignments",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_role_principal", columnNames = {"principal", "role"})
        }
)
public class RoleAssignment extends AuditableEntity<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "assignment_id")
    private Long assignmentId;

    @Column(name = "principal", length = 64, nullable = false)
    private String principal;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", length = 32, nullable = false)
    private Role role;
}
