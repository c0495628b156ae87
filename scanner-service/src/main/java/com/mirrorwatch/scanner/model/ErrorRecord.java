package com.mirrorwatch.scanner.model;

import com.mirrorwatch.common.model.ProbeError;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Full detail of one probe failure. At most {@code scanner.retention.error-cap} rows per instance.
 */
@Data
@NoArgsConstructor
@Table("error_record")
public class ErrorRecord {

    @Id
    private Long id;

    private Long instanceId;

    private LocalDateTime occurredAt;

    /** Enum name of {@link com.mirrorwatch.common.exception.ErrorCategory}. */
    private String category;

    private String message;

    private Integer httpStatus;

    /** Truncated response body, null when none was kept. */
    private String httpBody;

    public static ErrorRecord from(long instanceId, ProbeError error) {
        ErrorRecord record = new ErrorRecord();
        record.setInstanceId(instanceId);
        record.setOccurredAt(UtcTime.toColumn(error.occurredAt()));
        record.setCategory(error.category().name());
        record.setMessage(error.message());
        record.setHttpStatus(error.httpStatus());
        record.setHttpBody(error.httpBody());
        return record;
    }
}
