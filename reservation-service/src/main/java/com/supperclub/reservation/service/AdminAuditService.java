package com.supperclub.reservation.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supperclub.reservation.domain.AdminLog;
import com.supperclub.reservation.repository.AdminLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Writes the audit trail within the caller's transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminAuditService {

    public static final String SYSTEM_ACTOR = "system";

    private final AdminLogRepository adminLogRepository;
    private final ObjectMapper objectMapper;

    public void record(String actorId, String action, String entityType, Object entityId,
                       Map<String, ?> details) {
        AdminLog entry = AdminLog.builder()
                .actorId(actorId == null ? SYSTEM_ACTOR : actorId)
                .action(action)
                .entityType(entityType)
                .entityId(String.valueOf(entityId))
                .details(serialize(details))
                .build();
        adminLogRepository.save(entry);
        log.debug("Audit: actor={}, action={}, {}={}", entry.getActorId(), action, entityType, entityId);
    }

    private String serialize(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit details", e);
        }
    }
}
