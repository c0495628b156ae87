package com.mirrorwatch.scanner.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Per-instance override of probe behaviour. Keys are the wire names of {@link OverrideKey}.
 */
@Data
@NoArgsConstructor
@Table("instance_override")
public class InstanceOverride {

    @Id
    private Long id;

    private Long instanceId;

    private String overrideKey;

    private String overrideValue;
}
