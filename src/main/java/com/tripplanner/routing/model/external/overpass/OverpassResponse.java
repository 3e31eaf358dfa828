package com.tripplanner.routing.model.external.overpass;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OverpassResponse {
    private List<Element> elements;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Element {
        private String type;
        private Long id;
        private Double lat;
        private Double lon;
        private Center center;
        private Map<String, String> tags;

        public String tag(String key) {
            return tags == null ? null : tags.get(key);
        }

        /** Node position, or the way centroid from {@code out center}. */
        public Double latitude() {
            return lat != null ? lat : center != null ? center.getLat() : null;
        }

        public Double longitude() {
            return lon != null ? lon : center != null ? center.getLon() : null;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Center {
        private Double lat;
        private Double lon;
    }
}
