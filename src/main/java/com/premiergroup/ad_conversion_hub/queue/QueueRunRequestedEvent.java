package com.premiergroup.ad_conversion_hub.queue;

/**
 * Asks the queue to run as soon as possible instead of waiting for the next poll.
 */
public record QueueRunRequestedEvent(String reason) {
}
