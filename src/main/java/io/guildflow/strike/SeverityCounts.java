package io.guildflow.strike;

import java.util.List;

public record SeverityCounts(int minor, int moderate, int severe) {
    public static final SeverityCounts NONE = new SeverityCounts(0, 0, 0);

    public static SeverityCounts of(List<StrikeEntry> entries) {
        int minor = 0;
        int moderate = 0;
        int severe = 0;
        for (StrikeEntry entry : entries) {
            switch (entry.severity()) {
                case MINOR -> minor++;
                case MODERATE -> moderate++;
                case SEVERE -> severe++;
            }
        }
        return new SeverityCounts(minor, moderate, severe);
    }

    public int total() {
        return minor + moderate + severe;
    }
}
