package com.mirrorwatch.scanner.upstream;

/**
 * Answer of the upstream compare endpoint for {@code <commit>...<branch>}.
 */
public enum ComparisonStatus {
    /** Commit is the branch head. */
    IDENTICAL,
    /** Branch is ahead of the commit: the commit is an older upstream commit. */
    AHEAD,
    /** Commit is ahead of the branch. */
    BEHIND,
    DIVERGED,
    /** Repository does not know the commit. */
    NOT_FOUND;

    public static ComparisonStatus fromApi(String status) {
        if (status == null) return NOT_FOUND;
        return switch (status) {
            case "identical" -> IDENTICAL;
            case "ahead"     -> AHEAD;
            case "behind"    -> BEHIND;
            case "diverged"  -> DIVERGED;
            default          -> NOT_FOUND;
        };
    }
}
