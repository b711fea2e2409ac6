package com.ethval.ingestion.status;

import com.ethval.domain.CollectionLog;
import com.ethval.domain.CollectionLog.LogType;
import com.ethval.domain.CollectionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends entries to data_collection_logs. Best effort: a failed append is logged at debug and never
 * reaches the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CollectionLogWriter {

    private final CollectionLogRepository logRepository;
    private final Clock clock;

    public void append(String datasetName, LogType type, String message, Map<String, Object> details) {
        try {
            CollectionLog entry = new CollectionLog();
            entry.setDatasetName(datasetName);
            entry.setLogType(type);
            entry.setMessage(message);
            entry.setDetails(details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details));
            entry.setCreatedAt(clock.instant());
            logRepository.save(entry);
        } catch (RuntimeException e) {
            log.debug("Could not append {} log for {}: {}", type, datasetName, e.getMessage());
        }
    }

    public void info(String datasetName, String message, Map<String, Object> details) {
        append(datasetName, LogType.INFO, message, details);
    }

    public void warning(String datasetName, String message, Map<String, Object> details) {
        append(datasetName, LogType.WARNING, message, details);
    }

    public void error(String datasetName, String message, Map<String, Object> details) {
        append(datasetName, LogType.ERROR, message, details);
    }
}
