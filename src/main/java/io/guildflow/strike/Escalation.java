package io.guildflow.strike;

public enum Escalation {
    DIRECT_TERMINATION_RISK(Tier.DIRECT_TERMINATION_RISK, "POSSIBLE DIRECT DISMISSAL (1+ severe strikes)"),
    TERMINATION_RISK_MINOR(Tier.TERMINATION_RISK, "POSSIBLE DISMISSAL (5+ minor strikes)"),
    TERMINATION_RISK_MODERATE(Tier.TERMINATION_RISK, "POSSIBLE DISMISSAL (3+ moderate strikes)"),
    WARNING_MINOR(Tier.WARNING, "WARNING (3+ minor strikes)"),
    WARNING_MODERATE(Tier.WARNING, "WARNING (2+ moderate strikes)"),
    NONE(Tier.NONE, "Within limits");

    public enum Tier {
        NONE,
        WARNING,
        TERMINATION_RISK,
        DIRECT_TERMINATION_RISK
    }

    private final Tier tier;
    private final String message;

    Escalation(Tier tier, String message) {
        this.tier = tier;
        this.message = message;
    }

    public Tier tier() {
        return tier;
    }

    public String message() {
        return message;
    }

    public boolean escalated() {
        return tier != Tier.NONE;
    }
}
