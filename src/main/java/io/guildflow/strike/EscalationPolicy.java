package io.guildflow.strike;

public final class EscalationPolicy {
    private EscalationPolicy() {
    }

    // Most severe rule wins; rules never combine.
    public static Escalation classify(SeverityCounts counts) {
        if (counts.severe() >= 1) {
            return Escalation.DIRECT_TERMINATION_RISK;
        }
        if (counts.minor() >= 5) {
            return Escalation.TERMINATION_RISK_MINOR;
        }
        if (counts.moderate() >= 3) {
            return Escalation.TERMINATION_RISK_MODERATE;
        }
        if (counts.minor() >= 3) {
            return Escalation.WARNING_MINOR;
        }
        if (counts.moderate() >= 2) {
            return Escalation.WARNING_MODERATE;
        }
        return Escalation.NONE;
    }
}
