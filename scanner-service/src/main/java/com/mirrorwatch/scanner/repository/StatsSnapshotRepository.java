package com.mirrorwatch.scanner.repository;

import com.mirrorwatch.scanner.model.StatsSnapshot;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface StatsSnapshotRepository extends ReactiveCrudRepository<StatsSnapshot, Long> {

    @Query("SELECT collected_at FROM stats_snapshot ORDER BY collected_at DESC LIMIT 1")
    Mono<LocalDateTime> findLatestCollectionTime();

    Flux<StatsSnapshot> findByCollectedAtBetweenOrderByCollectedAtAsc(LocalDateTime start, LocalDateTime end);

    Flux<StatsSnapshot> findByInstanceIdAndCollectedAtBetweenOrderByCollectedAtAsc(
        Long instanceId, LocalDateTime start, LocalDateTime end);
}
