package com.premiergroup.ad_conversion_hub.entity;

import com.premiergroup.ad_conversion_hub.enums.JobStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "conversion_queue", indexes = {
        @Index(name = "idx_conversion_queue_status_next", columnList = "status, next_attempt_at"),
        @Index(name = "idx_conversion_queue_reporter", columnList = "reporter")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversionJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "reporter", nullable = false, length = 64)
    private String reporter;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private JobStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "processed_at")
    private Instant processedAt;
}
