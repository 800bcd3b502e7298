package com.github.dimitryivaniuta.paydispatch.queue;

/**
 * Approximate queue depth as reported by the transport.
 *
 * @param provider transport name
 * @param visible  messages available for retrieval
 * @param inFlight messages received but not yet deleted
 * @param delayed  messages not yet available
 */
public record QueueMetrics(String provider, long visible, long inFlight, long delayed) {}
