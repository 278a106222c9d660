package com.premiergroup.ad_conversion_hub.queue;

import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
@Log4j2
@RequiredArgsConstructor
public class QueueProcessingTrigger {

    private final ApplicationEventPublisher eventPublisher;

    public void scheduleImmediateRun() {
        log.debug("Requesting an immediate conversion queue run");
        eventPublisher.publishEvent(new QueueRunRequestedEvent("immediate"));
    }
}
