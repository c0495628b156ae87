package com.mirrorwatch.scanner.repository;

import com.mirrorwatch.scanner.model.ErrorRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface ErrorRecordRepository extends ReactiveCrudRepository<ErrorRecord, Long> {

    Flux<ErrorRecord> findByInstanceId(Long instanceId);

    @Query("SELECT DISTINCT instance_id FROM error_record")
    Flux<Long> findInstanceIds();

    @Query("""
        SELECT * FROM error_record
        WHERE instance_id = :instanceId
        ORDER BY occurred_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<ErrorRecord> findNewest(Long instanceId, int limit);
}
