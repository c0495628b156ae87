package com.mirrorwatch.common.registry;

import com.mirrorwatch.common.model.ListedInstance;

import java.util.List;

/**
 * Outcome of one reconciliation pass, before anything is written.
 *
 * <ul>
 *   <li>{@code additions} – listed domains with no row yet.</li>
 *   <li>{@code updates} – existing rows whose stored state changes; unchanged rows are absent.</li>
 *   <li>{@code retained} – enabled rows still listed.</li>
 *   <li>{@code reactivated} – disabled rows listed again.</li>
 *   <li>{@code removedCandidates} – enabled rows absent from the listing this pass.</li>
 *   <li>{@code retired} – subset of {@code removedCandidates} disabled by this pass.</li>
 * </ul>
 */
public record ReconciliationPlan(
    List<ListedInstance> additions,
    List<KnownInstance>  updates,
    List<String>         retained,
    List<String>         reactivated,
    List<String>         removedCandidates,
    List<String>         retired
) {

    public boolean isNoop() {
        return additions.isEmpty() && updates.isEmpty();
    }
}
