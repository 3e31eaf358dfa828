package com.tripplanner.routing.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "route_cache", indexes = @Index(name = "idx_route_cache_created_at", columnList = "created_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RouteCacheEntity {

    @Id
    @Column(name = "cache_key", length = 2048)
    private String cacheKey;

    /** GeoJSON LineString as JSON text. */
    @Lob
    @Column(name = "geometry_json", nullable = false)
    private String geometryJson;

    @Column(name = "distance_m", nullable = false)
    private double distance;

    @Column(name = "duration_s", nullable = false)
    private double duration;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
