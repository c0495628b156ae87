package com.mirrorwatch.common.retention;

import java.time.Instant;

/** Identity and age of one stored error record. */
public record ErrorRecordRef(long id, Instant occurredAt) {}
