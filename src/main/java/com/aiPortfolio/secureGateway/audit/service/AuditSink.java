package com.aiPortfolio.secureGateway.audit.service;

import com.aiPortfolio.secureGateway.audit.model.AuditRecord;

/**
 * Destination for audit records. The gateway calls {@link #emit(AuditRecord)} exactly once per
 * request; where the record ends up (log, file, collector) is up to the implementation.
 */
public interface AuditSink {

    void emit(AuditRecord record);
}
