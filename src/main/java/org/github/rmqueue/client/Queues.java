package org.github.rmqueue.client;

public class Queues {

    private Queues() {}

    /**
     * Wraps a byte-level queue so it exchanges UTF-8 text.
     */
    public static <I, M> Queue<I, String, M, QueueElement<I, String, M>> createStringQueue(
            Queue<I, byte[], M, ? extends QueueElement<I, byte[], M>> queue) {
        return new GenericQueueAdapter<I, String, M, QueueElement<I, String, M>, byte[]>(queue,
                Serializers.createUtf8Serializer(),
                Serializers.createUtf8Deserializer(),
                QueueElement::new);
    }

    /**
     * Wraps a byte-level queue so it exchanges java-serialized objects.
     */
    public static <I, E, M> Queue<I, E, M, QueueElement<I, E, M>> createGenericQueue(
            Queue<I, byte[], M, ? extends QueueElement<I, byte[], M>> queue) {
        return new GenericQueueAdapter<I, E, M, QueueElement<I, E, M>, byte[]>(queue,
                Serializers.<E>createPlainJavaSerializer(),
                Serializers.<E>createPlainJavaDeserializer(),
                QueueElement::new);
    }
}
