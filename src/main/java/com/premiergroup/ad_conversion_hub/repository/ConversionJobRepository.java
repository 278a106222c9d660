package com.premiergroup.ad_conversion_hub.repository;

import com.premiergroup.ad_conversion_hub.entity.ConversionJob;
import com.premiergroup.ad_conversion_hub.enums.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

public interface ConversionJobRepository extends JpaRepository<ConversionJob, Long> {

    /**
     * Due jobs: never scheduled, or scheduled at or before {@code now}.
     */
    @Query("""
            SELECT j FROM ConversionJob j
            WHERE j.status = :status
              AND (j.nextAttemptAt IS NULL OR j.nextAttemptAt <= :now)
            ORDER BY j.id ASC
            """)
    List<ConversionJob> findDue(@Param("status") JobStatus status,
                                @Param("now") Instant now,
                                Pageable pageable);

    /**
     * Puts every failed job of one reporter back in line with a fresh attempt budget.
     *
     * @return number of jobs reset
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE ConversionJob j
            SET j.status = com.premiergroup.ad_conversion_hub.enums.JobStatus.PENDING,
                j.attempts = 0,
                j.errorMessage = NULL,
                j.nextAttemptAt = NULL
            WHERE j.reporter = :reporter
              AND j.status = com.premiergroup.ad_conversion_hub.enums.JobStatus.FAILED
            """)
    int resetFailedJobs(@Param("reporter") String reporter);
}
