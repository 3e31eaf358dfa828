package com.tripplanner.routing.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "UsageSummary", description = "Routing provider calls for one month")
public class UsageSummary {
    @Schema(description = "Month (UTC)", example = "2025-06")
    private String month;
    @Schema(description = "Per-provider counters")
    private List<ProviderUsage> providers;
    @Schema(description = "In-memory route cache counters since startup")
    private CacheUsage fastCache;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "ProviderUsage")
    public static class ProviderUsage {
        @Schema(example = "stadia")
        private String provider;
        @Schema(description = "Successful calls this month", example = "1234")
        private long count;
        @Schema(description = "Monthly ceiling, absent for unmetered providers", example = "10000")
        private Long quota;
        @Schema(description = "Calls left before the ceiling", example = "8766")
        private Long remaining;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "CacheUsage")
    public static class CacheUsage {
        @Schema(example = "412")
        private int entries;
        @Schema(example = "1830")
        private long hits;
        @Schema(example = "612")
        private long misses;
        @Schema(description = "hits / (hits + misses)", example = "0.75")
        private double hitRate;
    }
}
