package com.platform.governance.api;

import com.platform.governance.error.ValidationException;
import com.platform.governance.telemetry.TelemetryEvent;
import com.platform.governance.translation.TranslatedEvent;
import com.platform.governance.translation.TranslationOrchestrator;
import lombok.AllArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Runs translation on a normalized event without persisting anything.
 */
@RestController
@RequestMapping("/api/translations")
@AllArgsConstructor
public class TranslationController {
    
    private final TranslationOrchestrator orchestrator;
    private final Clock clock;
    
    @PostMapping("/preview")
    public TranslatedEvent preview(@RequestBody TelemetryEvent event) {
        if (event.getId() == null || event.getId().isBlank()) {
            throw ValidationException.missing("id");
        }
        if (event.getEventType() == null) {
            throw ValidationException.missing("eventType");
        }
        TelemetryEvent normalized = event.getProcessedAt() != null 
            ? event 
            : event.toBuilder().processedAt(clock.instant()).build();
        return orchestrator.translate(normalized);
    }
}
