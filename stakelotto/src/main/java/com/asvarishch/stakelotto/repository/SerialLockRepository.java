package com.asvarishch.stakelotto.repository;

import com.asvarishch.stakelotto.model.SerialLock;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SerialLockRepository extends JpaRepository<SerialLock, String> {

    // Held until the surrounding transaction ends.
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
             SELECT l
             FROM SerialLock l
             WHERE l.lockName = :lockName
            """)
    Optional<SerialLock> findByIdForUpdate(@Param("lockName") String lockName);
}
