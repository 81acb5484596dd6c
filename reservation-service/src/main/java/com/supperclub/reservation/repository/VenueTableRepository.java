package com.supperclub.reservation.repository;

import com.supperclub.reservation.domain.VenueTable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface VenueTableRepository extends JpaRepository<VenueTable, Long> {
}
