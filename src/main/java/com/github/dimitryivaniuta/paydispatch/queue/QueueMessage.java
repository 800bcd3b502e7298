package com.github.dimitryivaniuta.paydispatch.queue;

/**
 * A serialized message ready to be handed to a queue transport.
 *
 * @param id      client-side id, unique within a batch
 * @param key     ordering/partition key
 * @param payload JSON body
 */
public record QueueMessage(String id, String key, String payload) {}
