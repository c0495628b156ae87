package com.mirrorwatch.scanner.controller;

import com.mirrorwatch.common.model.UpstreamVersion;
import com.mirrorwatch.scanner.dto.ErrorRecordDTO;
import com.mirrorwatch.scanner.dto.HistoryPointDTO;
import com.mirrorwatch.scanner.dto.InstanceSnapshotDTO;
import com.mirrorwatch.scanner.dto.StatsPointDTO;
import com.mirrorwatch.scanner.exception.InvalidQueryException;
import com.mirrorwatch.scanner.history.HistoryQueryService;
import com.mirrorwatch.scanner.scoring.InstanceSnapshotService;
import com.mirrorwatch.scanner.upstream.UpstreamVersionOracle;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Read-only status API.
 *
 * <pre>
 *   GET /api/v1/instances                         ranked snapshots
 *   GET /api/v1/instances/{domain}                one snapshot
 *   GET /api/v1/instances/{domain}/errors?limit=  newest error records
 *   GET /api/v1/history?start=&amp;end=&amp;domain=       health per tick
 *   GET /api/v1/stats?start=&amp;end=&amp;domain=         counters per collection run
 *   GET /api/v1/upstream                          current upstream head
 * </pre>
 */
@RestController
@RequestMapping("/api/v1")
public class StatusController {

    static final int MAX_ERROR_LIMIT = 100;

    private final InstanceSnapshotService snapshotService;
    private final HistoryQueryService     historyService;
    private final UpstreamVersionOracle   oracle;

    public StatusController(InstanceSnapshotService snapshotService,
                            HistoryQueryService historyService,
                            UpstreamVersionOracle oracle) {
        this.snapshotService = snapshotService;
        this.historyService  = historyService;
        this.oracle          = oracle;
    }

    @GetMapping("/instances")
    public Mono<List<InstanceSnapshotDTO>> instances() {
        return snapshotService.snapshots();
    }

    @GetMapping("/instances/{domain}")
    public Mono<InstanceSnapshotDTO> instance(@PathVariable String domain) {
        return snapshotService.snapshot(domain);
    }

    @GetMapping("/instances/{domain}/errors")
    public Flux<ErrorRecordDTO> errors(@PathVariable String domain,
                                       @RequestParam(defaultValue = "20") int limit) {
        if (limit < 1 || limit > MAX_ERROR_LIMIT) {
            return Flux.error(new InvalidQueryException("limit must be between 1 and " + MAX_ERROR_LIMIT));
        }
        return snapshotService.errors(domain, limit);
    }

    @GetMapping("/history")
    public Flux<HistoryPointDTO> history(
            @RequestParam Instant start,
            @RequestParam Instant end,
            @RequestParam(required = false) String domain) {
        return historyService.history(start, end, domain);
    }

    @GetMapping("/stats")
    public Flux<StatsPointDTO> stats(
            @RequestParam Instant start,
            @RequestParam Instant end,
            @RequestParam(required = false) String domain) {
        return historyService.stats(start, end, domain);
    }

    @GetMapping("/upstream")
    public UpstreamVersion upstream() {
        return oracle.current();
    }
}
