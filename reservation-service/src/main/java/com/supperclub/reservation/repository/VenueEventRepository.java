package com.supperclub.reservation.repository;

import com.supperclub.reservation.domain.VenueEvent;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface VenueEventRepository extends JpaRepository<VenueEvent, Long> {

    /**
     * Row lock on the event. Serializes pooled ticket sales so two payments cannot
     * both take the last seats.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM VenueEvent e WHERE e.id = :id")
    Optional<VenueEvent> findByIdForUpdate(@Param("id") Long id);
}
