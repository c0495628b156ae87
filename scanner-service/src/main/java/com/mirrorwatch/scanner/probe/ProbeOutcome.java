package com.mirrorwatch.scanner.probe;

import com.mirrorwatch.common.exception.ErrorCategory;
import com.mirrorwatch.common.model.ProbeResult;

/**
 * What a single probe invocation produced inside a tick. A crash is a value, so one host's
 * failure can never end the dispatch of the others.
 */
public interface ProbeOutcome {

    long instanceId();

    record Completed(ProbeResult result) implements ProbeOutcome {
        @Override
        public long instanceId() {
            return result.instanceId();
        }
    }

    record Crashed(long instanceId, ErrorCategory category, String message) implements ProbeOutcome {}
}
