package io.guildflow.strike;

import java.time.LocalDate;

public record StrikeEntry(Severity severity, String reason, LocalDate date, String issuer) {
}
