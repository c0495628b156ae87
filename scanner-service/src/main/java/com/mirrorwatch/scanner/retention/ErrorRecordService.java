package com.mirrorwatch.scanner.retention;

import com.mirrorwatch.common.model.ProbeError;
import com.mirrorwatch.common.retention.ErrorRecordRef;
import com.mirrorwatch.common.retention.ErrorRetentionPolicy;
import com.mirrorwatch.scanner.config.ScannerProperties;
import com.mirrorwatch.scanner.model.ErrorRecord;
import com.mirrorwatch.scanner.model.UtcTime;
import com.mirrorwatch.scanner.repository.ErrorRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Writes error records and keeps each instance within {@code scanner.retention.error-cap}.
 */
@Service
public class ErrorRecordService {

    private static final Logger log = LoggerFactory.getLogger(ErrorRecordService.class);

    private final ErrorRecordRepository repository;
    private final int                   cap;

    public ErrorRecordService(ErrorRecordRepository repository, ScannerProperties properties) {
        this.repository = repository;
        this.cap        = properties.retention().errorCap();
    }

    /** Inserts the record, then evicts the oldest records beyond the cap. */
    public Mono<ErrorRecord> record(long instanceId, ProbeError error) {
        return repository.save(ErrorRecord.from(instanceId, error))
            .flatMap(saved -> enforceCap(instanceId).thenReturn(saved));
    }

    /** @return number of evicted records */
    public Mono<Integer> enforceCap(long instanceId) {
        return repository.findByInstanceId(instanceId)
            .map(r -> new ErrorRecordRef(r.getId(), UtcTime.fromColumn(r.getOccurredAt())))
            .collectList()
            .flatMap(refs -> {
                List<Long> evicted = ErrorRetentionPolicy.evictions(refs, cap);
                if (evicted.isEmpty()) {
                    return Mono.just(0);
                }
                log.debug("Evicting error records. instanceId={} count={} cap={}", instanceId, evicted.size(), cap);
                return repository.deleteAllById(evicted).thenReturn(evicted.size());
            });
    }
}
