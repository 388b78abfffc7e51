package org.github.rmqueue.client;

@FunctionalInterface
public interface QueueElementCreator<I, E, M, QE extends QueueElement<I, E, M>> {

    QE create(I id, E element, M metadata);
}
