package com.mirrorwatch.scanner.upstream;

import com.mirrorwatch.common.model.CommitState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CommitLineageCacheTest {

    @Test
    @DisplayName("keys ignore case")
    void caseInsensitive() {
        CommitLineageCache cache = new CommitLineageCache();
        cache.put("ABCDEF1", CommitState.OUTDATED);

        assertEquals(Optional.of(CommitState.OUTDATED), cache.get("abcdef1"));
    }

    @Test
    @DisplayName("entries untouched for two epochs are dropped")
    void expiresUnusedEntries() {
        CommitLineageCache cache = new CommitLineageCache();
        cache.put("aaaaaaa", CommitState.OUTDATED);
        cache.put("bbbbbbb", CommitState.OUTDATED);

        cache.advanceEpoch(false);
        cache.get("aaaaaaa");
        cache.advanceEpoch(false);

        assertTrue(cache.get("aaaaaaa").isPresent());
        assertTrue(cache.get("bbbbbbb").isEmpty());
    }

    @Test
    @DisplayName("head change keeps only ancestor answers")
    void headChangeKeepsOutdated() {
        CommitLineageCache cache = new CommitLineageCache();
        cache.put("aaaaaaa", CommitState.OUTDATED);
        cache.put("bbbbbbb", CommitState.CUSTOM_BRANCH);
        cache.put("ccccccc", CommitState.CURRENT);

        assertEquals(1, cache.advanceEpoch(true));
        assertEquals(Optional.of(CommitState.OUTDATED), cache.get("aaaaaaa"));
    }
}
