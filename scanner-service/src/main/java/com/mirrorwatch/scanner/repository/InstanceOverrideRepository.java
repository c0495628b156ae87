package com.mirrorwatch.scanner.repository;

import com.mirrorwatch.scanner.model.InstanceOverride;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface InstanceOverrideRepository extends ReactiveCrudRepository<InstanceOverride, Long> {

    Flux<InstanceOverride> findByInstanceId(Long instanceId);
}
