package com.mirrorwatch.common.model;

/**
 * Position of an instance's reported commit relative to the tracked upstream branch.
 */
public enum CommitState {
    /** Equal to the current branch head. */
    CURRENT,
    /** Reachable from the branch head, but older. */
    OUTDATED,
    /** Not reachable from the branch: a fork, a side branch or a foreign repository. */
    CUSTOM_BRANCH,
    /** The upstream repository does not know the commit, or the lookup failed. */
    UNKNOWN_COMMIT;

    public boolean isUpstream() {
        return this == CURRENT || this == OUTDATED;
    }

    public boolean isLatest() {
        return this == CURRENT;
    }
}
