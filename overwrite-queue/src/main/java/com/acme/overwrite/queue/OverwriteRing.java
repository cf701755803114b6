package com.acme.overwrite.queue;

import java.time.Duration;

/**
 * Fixed-capacity ring that drops its oldest element when a push finds it full.
 */
public interface OverwriteRing<E> {
    int capacity();
    int count();
    void push(E e);
    E pop() throws InterruptedException;
    PopResult<E> popWithTimeout(Duration timeout) throws InterruptedException;
    QueueSnapshot snapshot();
}
