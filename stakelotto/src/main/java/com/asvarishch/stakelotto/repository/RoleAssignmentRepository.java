package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.enums.Role;
import com.asvarishch.stakelotto.model.RoleAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RoleAssignmentRepository extends JpaRepository<RoleAssignment, Long> {

    boolean existsByPrincipalAndRole(String principal, Role role);

    Optional<RoleAssignment> findByPrincipalAndRole(String principal, Role role);

    List<RoleAssignment> findByPrincipal(String principal);
}
