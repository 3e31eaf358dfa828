package com.tripplanner.routing.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "provider_usage")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ProviderUsageEntity {

    @EmbeddedId
    private ProviderUsageId id;

    @Column(name = "call_count", nullable = false)
    private long callCount;
}
