package org.operaton.fitjourney.model.entity;

import jakarta.persistence.*;
import lombok.*;
import org.operaton.fitjourney.model.converter.IsoDateTimeConverter;

import java.time.LocalDateTime;

/**
 * A body-weight measurement. The latest one drives WeightTarget goal progress.
 */
@Entity
@Table(name = "user_metrics")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BodyWeightMeasurement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "metric_id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "weight_kg", nullable = false)
    private Double weightKg;

    @Convert(converter = IsoDateTimeConverter.class)
    @Column(name = "measured_at", nullable = false)
    private LocalDateTime measuredAt;
}
