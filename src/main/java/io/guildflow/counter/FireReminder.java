package io.guildflow.counter;

public record FireReminder(String counter, int threshold) {
}
