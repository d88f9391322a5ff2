package com.ibstrader.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the hourly_candles table. The window-end timestamp is unique. */
@Entity
@Table(name = "hourly_candles", uniqueConstraints = @UniqueConstraint(name = "uk_hourly_candles_timestamp", columnNames = "timestamp"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BarEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 40, nullable = false)
    private String timestamp;

    private Double open;
    private Double high;
    private Double low;
    private Double close;
    private Double volume;
}
