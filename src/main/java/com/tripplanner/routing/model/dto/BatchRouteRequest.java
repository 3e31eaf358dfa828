package com.tripplanner.routing.model.dto;

import com.tripplanner.routing.model.Coordinate;
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
@Schema(name = "BatchRouteRequest", description = "One route per consecutive pair of locations")
public class BatchRouteRequest {
    @NotNull
    @Size(min = 2)
    private List<@NotNull @Valid Coordinate> locations;
    @Builder.Default
    @Schema(example = "driving", defaultValue = "driving")
    private TransportProfile profile = TransportProfile.DRIVING;
}
