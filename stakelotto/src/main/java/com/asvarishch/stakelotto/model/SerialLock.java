package com.asvarishch.stakelotto.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Row locked FOR UPDATE by every mutating call; serialises writers until commit. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "serial_locks")
public class SerialLock {

    public static final String GLOBAL = "global";

    @Id
    @Column(name = "lock_name", length = 32, nullable = false)
    private String lockName;
}
