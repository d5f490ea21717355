package org.ascenoria.content.derived;

/**
 * Stats value for collections without derived metrics.
 */
public final class NoDerivedStats implements DerivedStats {

    public static final NoDerivedStats INSTANCE = new NoDerivedStats();

    private NoDerivedStats() {
    }

    @Override
    public String toString() {
        return "NoDerivedStats";
    }
}
