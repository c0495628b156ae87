package com.mirrorwatch.scanner.registry;

import com.mirrorwatch.common.exception.RegistryFetchException;
import com.mirrorwatch.common.model.ListedInstance;
import com.mirrorwatch.common.parser.InstanceListParser;
import com.mirrorwatch.common.registry.KnownInstance;
import com.mirrorwatch.common.registry.ReconciliationPlan;
import com.mirrorwatch.common.registry.ReconciliationPlanner;
import com.mirrorwatch.scanner.client.InstanceHttpClient;
import com.mirrorwatch.scanner.config.ScannerProperties;
import com.mirrorwatch.scanner.model.Instance;
import com.mirrorwatch.scanner.model.UtcTime;
import com.mirrorwatch.scanner.repository.InstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps the instance table in line with the public registry page plus the configured hosts.
 *
 * <pre>
 *   fetch page → parse → merge additional / bad hosts → plan against stored rows → write changed rows
 * </pre>
 * Only rows whose state changes are written, so an unchanged registry costs no writes.
 */
@Service
public class InstanceRegistryService {

    private static final Logger log = LoggerFactory.getLogger(InstanceRegistryService.class);

    private final InstanceHttpClient  httpClient;
    private final InstanceRepository  instanceRepository;
    private final ScannerProperties.Registry config;
    private final InstanceListParser  parser = new InstanceListParser();
    private final Clock               clock;

    public InstanceRegistryService(InstanceHttpClient httpClient,
                                   InstanceRepository instanceRepository,
                                   ScannerProperties properties,
                                   Clock clock) {
        this.httpClient         = httpClient;
        this.instanceRepository = instanceRepository;
        this.config             = properties.registry();
        this.clock              = clock;
    }

    /**
     * @return the pass summary; errors with {@link RegistryFetchException} when the page cannot be
     *         fetched and {@link com.mirrorwatch.common.exception.MarkupParseException} when it
     *         cannot be parsed. Nothing is written in either case.
     */
    public Mono<ReconciliationResult> reconcile() {
        return httpClient.fetch(config.listUrl())
            .onErrorMap(e -> new RegistryFetchException("Failed fetching instance list from " + config.listUrl(), e))
            .map(response -> parser.parse(response.body()))
            .map(parsed -> ReconciliationPlanner.mergeListing(
                parsed, config.additionalHosts(), config.additionalHostCountry(), config.badHosts()))
            .flatMap(listing -> instanceRepository.findAll()
                .collectList()
                .flatMap(rows -> apply(listing, rows)))
            .doOnNext(result -> log.info(
                "REGISTRY_RECONCILED added={} retained={} removedCandidates={} reactivated={} retired={}",
                result.added().size(), result.retained().size(), result.removedCandidates().size(),
                result.reactivated().size(), result.retired().size()))
            .doOnError(e -> log.error("Registry reconciliation failed. listUrl={}", config.listUrl(), e));
    }

    private Mono<ReconciliationResult> apply(Map<String, ListedInstance> listing, List<Instance> rows) {
        List<KnownInstance> known = rows.stream().map(InstanceRegistryService::toKnown).toList();
        ReconciliationPlan plan = ReconciliationPlanner.plan(listing, known, config.retireAfterMisses());

        LocalDateTime now = UtcTime.toColumn(clock.instant());
        Map<Long, Instance> byId = rows.stream().collect(Collectors.toMap(Instance::getId, Function.identity()));

        List<Instance> writes = new ArrayList<>();
        for (ListedInstance listed : plan.additions()) {
            writes.add(newInstance(listed, now));
        }
        for (KnownInstance update : plan.updates()) {
            Instance row = byId.get(update.id());
            boolean relisted = !row.isEnabled() || row.getMissedPasses() > 0;
            apply(row, update, now);
            if (update.enabled() && update.missedPasses() == 0 && relisted) {
                row.setListedSince(now);
            }
            writes.add(row);
        }

        ReconciliationResult result = new ReconciliationResult(
            plan.additions().stream().map(ListedInstance::domain).toList(),
            plan.retained(), plan.removedCandidates(), plan.reactivated(), plan.retired());

        plan.reactivated().forEach(domain -> log.info("Instance reactivated. domain={}", domain));
        plan.retired().forEach(domain -> log.warn("Instance retired after missing from registry. domain={}", domain));

        if (writes.isEmpty()) {
            return Mono.just(result);
        }
        return Flux.fromIterable(writes)
            .concatMap(instanceRepository::save)
            .then(Mono.just(result));
    }

    static KnownInstance toKnown(Instance row) {
        return new KnownInstance(row.getId(), row.getDomain(), row.getUrl(), row.getCountry(),
            row.isAdditional(), row.isBadHost(), row.isEnabled(), row.getMissedPasses());
    }

    private static Instance newInstance(ListedInstance listed, LocalDateTime now) {
        Instance row = new Instance();
        row.setDomain(listed.domain());
        row.setUrl(listed.url());
        row.setCountry(listed.country());
        row.setAdditional(listed.additional());
        row.setBadHost(listed.badHost());
        row.setEnabled(true);
        row.setMissedPasses(0);
        row.setListedSince(now);
        row.setUpdatedAt(now);
        return row;
    }

    private static void apply(Instance row, KnownInstance update, LocalDateTime now) {
        row.setUrl(update.url());
        row.setCountry(update.country());
        row.setAdditional(update.additional());
        row.setBadHost(update.badHost());
        row.setEnabled(update.enabled());
        row.setMissedPasses(update.missedPasses());
        row.setUpdatedAt(now);
    }
}
