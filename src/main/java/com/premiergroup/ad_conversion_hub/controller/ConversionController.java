package com.premiergroup.ad_conversion_hub.controller;

import com.premiergroup.ad_conversion_hub.dto.AttributionEvent;
import com.premiergroup.ad_conversion_hub.dto.ConversionContext;
import com.premiergroup.ad_conversion_hub.dto.EnqueueResponse;
import com.premiergroup.ad_conversion_hub.queue.ConversionQueueService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.format.DateTimeParseException;

@RestController
@RequestMapping("/api/conversions")
@Log4j2
@RequiredArgsConstructor
public class ConversionController {

    private final ConversionQueueService queueService;

    /**
     * Queues one attribution event for every registered reporter.
     * <p>
     * Example: POST api/conversions
     * {"attributions": {"h1": 1.0}, "clickIds": {"h1": {"google_ads": "gclid"}}, "timestamp": "2026-05-01T10:00:00+02:00"}
     */
    @PostMapping
    public ResponseEntity<EnqueueResponse> enqueue(@Valid @RequestBody AttributionEvent event) {
        try {
            int queued = queueService.enqueueConversion(
                    event.attributions(),
                    event.clickIds(),
                    event.campaigns(),
                    new ConversionContext(event.timestamp()));
            return ResponseEntity.ok(new EnqueueResponse(queued));
        } catch (DateTimeParseException e) {
            log.warn("Rejected conversion with unreadable timestamp '{}'", event.timestamp());
            return ResponseEntity.badRequest().build();
        }
    }
}
