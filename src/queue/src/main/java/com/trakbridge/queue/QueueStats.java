package com.trakbridge.queue;

/**
 * Point-in-time view of one destination queue.
 *
 * <p>Counters are cumulative since the queue was registered.
 */
public record QueueStats(
    String destinationId,
    int size,
    int maxDevices,
    int trackedDevices,
    int maxSizeReached,
    long accepted,
    long replaced,
    long rejectedStale,
    long rejectedMalformed,
    long droppedCapacity,
    long rejectedClosed,
    long drained,
    long flushed,
    long staleEvicted,
    boolean closed) {}
