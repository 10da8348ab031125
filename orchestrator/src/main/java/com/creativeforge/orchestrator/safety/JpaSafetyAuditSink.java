package com.creativeforge.orchestrator.safety;

import com.creativeforge.orchestrator.model.SafetyAuditRecord;
import com.creativeforge.orchestrator.repository.SafetyAuditRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class JpaSafetyAuditSink implements SafetyAuditSink {

    private static final Logger log = LoggerFactory.getLogger(JpaSafetyAuditSink.class);

    private final SafetyAuditRepository repository;

    public JpaSafetyAuditSink(SafetyAuditRepository repository) {
        this.repository = repository;
    }

    @Override
    public void append(SafetyAuditRecord record) {
        try {
            repository.save(record);
        } catch (RuntimeException e) {
            log.warn("Could not store safety verdict {} for job {} ({}): {}",
                    record.getVerdict(), record.getJobId(), record.getStage(), e.getMessage());
        }
    }
}
