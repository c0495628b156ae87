package com.mirrorwatch.scanner.repository;

import com.mirrorwatch.scanner.model.HealthCheckRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface HealthCheckRepository extends ReactiveCrudRepository<HealthCheckRecord, Long> {

    /** Time of the most recent tick; empty on a fresh store. */
    @Query("SELECT checked_at FROM health_check ORDER BY checked_at DESC LIMIT 1")
    Mono<LocalDateTime> findLatestCheckTime();

    /** Latest check of every instance that has one. */
    @Query("""
        SELECT DISTINCT ON (instance_id) * FROM health_check
        ORDER BY instance_id, checked_at DESC, id DESC
        """)
    Flux<HealthCheckRecord> findLatestPerInstance();

    @Query("""
        SELECT instance_id,
               COUNT(*) FILTER (WHERE healthy) AS healthy,
               COUNT(*)                        AS total
        FROM health_check
        WHERE checked_at >= :since
        GROUP BY instance_id
        """)
    Flux<WindowCount> countSince(LocalDateTime since);

    @Query("""
        SELECT instance_id,
               COUNT(*) FILTER (WHERE healthy) AS healthy,
               COUNT(*)                        AS total
        FROM health_check
        GROUP BY instance_id
        """)
    Flux<WindowCount> countAll();

    @Query("""
        SELECT instance_id, MAX(checked_at) AS last_healthy_at
        FROM health_check
        WHERE healthy
        GROUP BY instance_id
        """)
    Flux<LastHealthy> findLastHealthyPerInstance();

    /** Healthy checks with a response time since {@code since}, for response time statistics. */
    @Query("""
        SELECT * FROM health_check
        WHERE healthy AND response_time_ms IS NOT NULL AND checked_at >= :since
        """)
    Flux<HealthCheckRecord> findHealthySince(LocalDateTime since);

    @Query("""
        SELECT * FROM health_check
        WHERE instance_id = :instanceId
        ORDER BY checked_at DESC
        LIMIT :limit
        """)
    Flux<HealthCheckRecord> findRecent(Long instanceId, int limit);

    @Query("""
        SELECT checked_at                                          AS time,
               COUNT(*) FILTER (WHERE healthy)                     AS healthy,
               COUNT(*)                                            AS total,
               (AVG(response_time_ms) FILTER (WHERE healthy))::float8 AS avg_response_ms
        FROM health_check
        WHERE checked_at BETWEEN :start AND :end
        GROUP BY checked_at
        ORDER BY checked_at
        """)
    Flux<HistoryPoint> aggregateBetween(LocalDateTime start, LocalDateTime end);

    @Query("""
        SELECT checked_at                                          AS time,
               COUNT(*) FILTER (WHERE healthy)                     AS healthy,
               COUNT(*)                                            AS total,
               (AVG(response_time_ms) FILTER (WHERE healthy))::float8 AS avg_response_ms
        FROM health_check
        WHERE instance_id = :instanceId AND checked_at BETWEEN :start AND :end
        GROUP BY checked_at
        ORDER BY checked_at
        """)
    Flux<HistoryPoint> aggregateBetweenForInstance(Long instanceId, LocalDateTime start, LocalDateTime end);

    @Modifying
    @Query("DELETE FROM health_check WHERE checked_at < :cutoff")
    Mono<Integer> deleteOlderThan(LocalDateTime cutoff);
}
