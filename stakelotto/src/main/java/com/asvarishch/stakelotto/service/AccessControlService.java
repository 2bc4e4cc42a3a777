package com.asvarishch.stakelotto.service;

import com.asvarishch.stakelotto.enums.Role;
import com.asvarishch.stakelotto.exception.LotteryException;
import com.asvarishch.stakelotto.model.RoleAssignment;
import com.asvarishch.stakelotto.repository.RoleAssignmentRepository;
import com.asvarishch.stakelotto.util.Addresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Principal -> role capability sets. Entry points query it first, before looking at their
 * arguments, so an unauthorised caller gets the same answer whatever it sends.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessControlService {

    private final RoleAssignmentRepository roleAssignmentRepository;
    private final CallGuard callGuard;

    @Transactional(readOnly = true)
    public boolean hasRole(String principal, Role role) {
        return principal != null && roleAssignmentRepository.existsByPrincipalAndRole(principal, role);
    }

    public void requireRole(String principal, Role role) {
        if (!hasRole(principal, role)) {
            log.warn("[ACL] {} rejected: missing role {}", principal, role);
            throw LotteryException.unauthorized(principal, role);
        }
    }

    @Transactional(readOnly = true)
    public Set<Role> rolesOf(String principal) {
        return roleAssignmentRepository.findByPrincipal(principal).stream()
                .map(RoleAssignment::getRole)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Role.class)));
    }

    @Transactional
    public void grantRole(String caller, String principal, Role role) {
        callGuard.run("grantRole", () -> {
            requireRole(caller, Role.OWNER);
            Addresses.require(principal);
            grant(principal, role);
        });
    }

    @Transactional
    public void revokeRole(String caller, String principal, Role role) {
        callGuard.run("revokeRole", () -> {
            requireRole(caller, Role.OWNER);
            roleAssignmentRepository.findByPrincipalAndRole(principal, role).ifPresent(assignment -> {
                roleAssignmentRepository.delete(assignment);
                log.info("[ACL] Revoked role={} from principal={} by {}", role, principal, caller);
            });
        });
    }

    /** Grants every role to {@code owner} when nobody holds OWNER yet. */
    @Transactional
    public void bootstrap(String owner) {
        Addresses.require(owner);
        if (!roleAssignmentRepository.findAll().stream().anyMatch(a -> a.getRole() == Role.OWNER)) {
            for (Role role : Role.values()) {
                grant(owner, role);
            }
            log.info("[ACL] Bootstrapped owner={} with all roles", owner);
        }
    }

    private void grant(String principal, Role role) {
        if (roleAssignmentRepository.existsByPrincipalAndRole(principal, role)) {
            return;
        }
        roleAssignmentRepository.save(RoleAssignment.builder().principal(principal).role(role).build());
        log.info("[ACL] Granted role={} to principal={}", role, principal);
    }
}
