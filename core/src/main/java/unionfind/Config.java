package unionfind;

import java.util.Objects;

public class Config {
    private FindStrategy findStrategy = FindStrategy.TWO_PASS;
    private boolean statsEnabled = false;

    public static Config withDefaults() {
        return new Config();
    }

    /**
     * How `find` walks to the representative and compresses the visited path.
     * defaults to TWO_PASS, which never recurses.
     */
    public Config withFindStrategy(FindStrategy findStrategy) {
        this.findStrategy = Objects.requireNonNull(findStrategy, "findStrategy");
        return this;
    }

    /* If specified, DisjointSetUnion will count finds, compressed links and merges, see `OperationStats`. */
    public Config withStatsEnabled() {
        this.statsEnabled = true;
        return this;
    }

    public FindStrategy getFindStrategy() {
        return findStrategy;
    }

    public boolean isStatsEnabled() {
        return statsEnabled;
    }

    public enum FindStrategy {
        TWO_PASS,  // locate the root, then walk the path again re-linking every node to it
        RECURSIVE; // re-link on the way back out of the recursion; depth is bounded by tree height

        public boolean isRecursive() {
            return this == RECURSIVE;
        }
    }
}
