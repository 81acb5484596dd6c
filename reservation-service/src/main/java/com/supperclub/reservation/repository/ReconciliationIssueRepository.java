package com.supperclub.reservation.repository;

import com.supperclub.reservation.domain.IssueStatus;
import com.supperclub.reservation.domain.ReconciliationIssue;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ReconciliationIssueRepository extends JpaRepository<ReconciliationIssue, Long> {

    List<ReconciliationIssue> findByStatusOrderByCreatedAtAsc(IssueStatus status);
}
