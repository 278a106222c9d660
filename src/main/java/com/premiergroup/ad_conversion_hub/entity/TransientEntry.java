package com.premiergroup.ad_conversion_hub.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "transients")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransientEntry {

    @Id
    @Column(name = "name", nullable = false, length = 191)
    private String name;

    @Column(name = "entry_value", columnDefinition = "TEXT")
    private String value;

    // null means the entry never expires
    @Column(name = "expires_at")
    private Instant expiresAt;
}
