package com.acme.overwrite.queue;

public record QueueSnapshot(
    int depth,
    int capacity,
    long pushedTotal,
    long poppedTotal,
    long overwrittenTotal,
    long tsNanos
) {}
