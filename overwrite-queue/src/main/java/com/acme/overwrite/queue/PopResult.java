package com.acme.overwrite.queue;

public sealed interface PopResult<E> permits PopResult.Item, PopResult.TimedOut {

    default boolean isPresent() {
        return this instanceof Item;
    }

    default E valueOrThrow() {
        if (this instanceof Item<E> item) {
            return item.value();
        }
        throw new IllegalStateException("Timeout: no element in queue");
    }

    record Item<E>(E value) implements PopResult<E> {}
    record TimedOut<E>(long waitedNanos) implements PopResult<E> {}
}
