package org.ascenoria.content.derived;

import java.util.List;

/**
 * Research tree metrics of one technology.
 *
 * @param prerequisites         Direct prerequisites, in merge order.
 * @param unlocks               Technologies that directly require this one, in merge order.
 * @param depth                 Length of the longest prerequisite chain; 0 for a root technology.
 * @param cumulativeScienceCost Own cost plus the cost of every transitive prerequisite, each counted once.
 */
public record TechnologyStats(
        List<String> prerequisites,
        List<String> unlocks,
        int depth,
        long cumulativeScienceCost
) implements DerivedStats {

    public TechnologyStats {
        prerequisites = List.copyOf(prerequisites);
        unlocks = List.copyOf(unlocks);
    }
}
