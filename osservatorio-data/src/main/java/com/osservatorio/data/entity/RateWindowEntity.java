package com.osservatorio.data.entity;

import jakarta.persistence.*;
import lombok.*;

import java.io.Serializable;

/**
 * One counter window per (identifier, tier). The window start is epoch-aligned in
 * milliseconds; a row whose window has passed is reset in place on the next use.
 */
@Entity
@Table(name = "rate_windows")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RateWindowEntity {

    @EmbeddedId
    private Key id;

    @Column(name = "window_start", nullable = false)
    private Long windowStart;

    @Column(name = "request_count", nullable = false)
    private Integer requestCount;

    @Column(name = "request_limit", nullable = false)
    private Integer requestLimit;

    @Embeddable
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Key implements Serializable {

        @Column(name = "identifier", length = 256)
        private String identifier;

        @Column(name = "tier", length = 16)
        private String tier;
    }
}
