package com.aiPortfolio.secureGateway.audit.service;

import com.aiPortfolio.secureGateway.audit.model.AuditRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Writes each audit record as one JSON line on the {@code AUDIT} logger.
 */
@Slf4j
@Component
public class LoggingAuditSink implements AuditSink {

    private static final Logger auditLog = LoggerFactory.getLogger("AUDIT");

    private final ObjectMapper objectMapper;
    private final boolean logRequests;

    public LoggingAuditSink(ObjectMapper objectMapper,
                            @Value("${gateway.audit.log-requests:true}") boolean logRequests) {
        this.objectMapper = objectMapper;
        this.logRequests = logRequests;
    }

    @Override
    public void emit(AuditRecord record) {
        if (!logRequests) {
            return;
        }
        try {
            auditLog.info(objectMapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit record - requestId: {}", record.getRequestId(), e);
            auditLog.info(record.toString());
        }
    }
}
