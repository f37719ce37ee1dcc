package com.platform.governance.translation;

import com.platform.governance.observability.StructuredLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;

/**
 * Writes one translated event through a {@link ComplianceRecordStore} in a single
 * transaction, so a violation is never stored without its actions.
 */
@Slf4j
public class TranslatedEventPersister {
    
    private final ComplianceRecordStore recordStore;
    private final TransactionOperations transactionOperations;
    private final StructuredLogger structuredLogger;
    
    public TranslatedEventPersister(ComplianceRecordStore recordStore, 
            TransactionOperations transactionOperations,
            StructuredLogger structuredLogger) {
        this.recordStore = recordStore;
        this.transactionOperations = transactionOperations;
        this.structuredLogger = structuredLogger;
    }
    
    /**
     * @return number of actions written
     */
    public int persist(TranslatedEvent translated) {
        Integer written = transactionOperations.execute(status -> {
            int actions = 0;
            for (ComplianceViolation violation : translated.getViolations()) {
                String persistedId = recordStore.createComplianceViolation(violation);
                List<RequiredAction> planned = translated.actionsFor(violation);
                for (RequiredAction action : planned) {
                    recordStore.createRequiredAction(action.toBuilder().violationId(persistedId).build());
                    actions++;
                }
            }
            return actions;
        });
        int actions = written != null ? written : 0;
        structuredLogger.translation().persisted(translated.getEvent().getId(), 
            translated.getViolations().size(), actions);
        return actions;
    }
}
