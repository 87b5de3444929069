package me.golemcore.coder.domain.model;

/**
 * Severity of a risk item, also used as the overall risk level of a batch.
 * Ordering is low &lt; medium &lt; high.
 */
public enum RiskSeverity {

    LOW(0), MEDIUM(1), HIGH(2);

    private final int weight;

    RiskSeverity(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    public boolean isHigherThan(RiskSeverity other) {
        return other == null || weight > other.weight;
    }

    public String getValue() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
