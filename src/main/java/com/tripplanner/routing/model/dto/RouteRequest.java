package com.tripplanner.routing.model.dto;

import com.tripplanner.routing.model.Coordinate;
import com.tripplanner.routing.model.StylePreference;
import com.tripplanner.routing.model.TransportProfile;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "RouteRequest", description = "Road route through two or more points")
public class RouteRequest {
    @NotNull
    @Size(min = 2)
    @Schema(description = "Ordered stops, origin first")
    private List<@NotNull @Valid Coordinate> coordinates;
    @Builder.Default
    @Schema(description = "Transport profile", example = "driving", defaultValue = "driving")
    private TransportProfile profile = TransportProfile.DRIVING;
    @Schema(description = "Route style, omitted for the default route", example = "scenic")
    private StylePreference preference;
    @Schema(description = "Ignore cached routes (the result is still cached)", example = "false")
    private boolean bustCache;
}
