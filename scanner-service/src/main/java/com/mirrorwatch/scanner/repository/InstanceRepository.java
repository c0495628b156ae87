package com.mirrorwatch.scanner.repository;

import com.mirrorwatch.scanner.model.Instance;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface InstanceRepository extends ReactiveCrudRepository<Instance, Long> {

    Flux<Instance> findByEnabledTrue();

    Mono<Instance> findByDomain(String domain);
}
