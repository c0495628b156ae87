package com.mirrorwatch.scanner.model;

import com.mirrorwatch.common.model.Connectivity;
import com.mirrorwatch.common.model.ProbeResult;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One probe result of one instance in one tick. Append-only.
 *
 * {@code errorDetail} is bounded to 512 characters; the full failure lives in {@link ErrorRecord}.
 */
@Data
@NoArgsConstructor
@Table("health_check")
public class HealthCheckRecord {

    @Id
    private Long id;

    private Long instanceId;

    private LocalDateTime checkedAt;

    private boolean healthy;

    /** Null when no HTTP response was received. */
    private Integer responseTimeMs;

    private Integer httpStatus;

    private String versionName;

    private String versionUrl;

    private boolean upstream;

    private boolean latestVersion;

    private boolean rss;

    /** Enum name of {@link Connectivity}. */
    private String connectivity;

    private String errorCategory;

    private String errorDetail;

    public static HealthCheckRecord from(ProbeResult result) {
        HealthCheckRecord record = new HealthCheckRecord();
        record.setInstanceId(result.instanceId());
        record.setCheckedAt(UtcTime.toColumn(result.checkedAt()));
        record.setHealthy(result.healthy());
        record.setResponseTimeMs(result.responseTimeMs());
        record.setHttpStatus(result.httpStatus());
        record.setVersionName(result.versionName());
        record.setVersionUrl(result.versionUrl());
        record.setUpstream(result.upstream());
        record.setLatestVersion(result.latestVersion());
        record.setRss(result.rss());
        record.setConnectivity(result.connectivity().name());
        if (result.error() != null) {
            record.setErrorCategory(result.error().category().name());
            record.setErrorDetail(result.error().message());
        }
        return record;
    }

    public Connectivity connectivityValue() {
        if (connectivity == null) return Connectivity.UNKNOWN;
        try {
            return Connectivity.valueOf(connectivity);
        } catch (IllegalArgumentException e) {
            return Connectivity.UNKNOWN;
        }
    }
}
