package com.tripplanner.routing.model.external.valhalla;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValhallaRouteResponse {
    private Trip trip;
    private List<Alternate> alternates;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Alternate {
        private Trip trip;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Trip {
        private Integer status;
        private List<Leg> legs;
        private Summary summary;
        private String units;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Leg {
        /** Encoded polyline, precision 6. */
        private String shape;
        private Summary summary;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Summary {
        /** Kilometers when requested with {@code units=kilometers}. */
        private Double length;
        /** Seconds. */
        private Double time;
    }
}
