package com.tripplanner.routing.model.external.valhalla;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValhallaRouteRequest {
    private List<Location> locations;
    private String costing;
    @JsonProperty("costing_options")
    private Map<String, Map<String, Object>> costingOptions;
    private Integer alternates;
    private String units;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Location {
        private double lat;
        private double lon;
    }
}
