package com.ibstrader.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trade_signals table.
 * The {@code executed} column holds 0 (pending), 1 (executed) or 2 (failed).
 */
@Entity
@Table(name = "trade_signals", indexes = @Index(name = "idx_trade_signals_executed", columnList = "executed"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SignalEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 40, nullable = false)
    private String timestamp;

    @Column(length = 16, nullable = false)
    private String action;

    @Column(length = 20, nullable = false)
    private String symbol;

    @Column(length = 8)
    private String side;

    private Double price;

    private Double leverage;

    @Column(nullable = false)
    private int executed;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
