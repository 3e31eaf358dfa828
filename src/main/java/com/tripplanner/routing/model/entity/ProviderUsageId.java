package com.tripplanner.routing.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.io.Serializable;

@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class ProviderUsageId implements Serializable {

    /** {@code YYYY-MM} in UTC. */
    @Column(name = "usage_month", length = 7, nullable = false)
    private String month;

    @Column(name = "provider", length = 32, nullable = false)
    private String provider;
}
