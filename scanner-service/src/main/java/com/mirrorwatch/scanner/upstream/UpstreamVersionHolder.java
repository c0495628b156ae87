package com.mirrorwatch.scanner.upstream;

import com.mirrorwatch.common.model.UpstreamVersion;
import com.mirrorwatch.scanner.config.ScannerProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide current upstream head. Written by the oracle loop only, read by probes and the API.
 */
@Component
public class UpstreamVersionHolder {

    private final AtomicReference<UpstreamVersion> current;

    public UpstreamVersionHolder(ScannerProperties properties) {
        this.current = new AtomicReference<>(UpstreamVersion.unknown(properties.upstream().branch()));
    }

    public UpstreamVersion get() {
        return current.get();
    }

    /** @return the replaced value */
    public UpstreamVersion set(UpstreamVersion version) {
        return current.getAndSet(version);
    }
}
