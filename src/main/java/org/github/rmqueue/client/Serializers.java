package org.github.rmqueue.client;

import java.io.*;
import java.util.function.Function;

import static java.nio.charset.StandardCharsets.UTF_8;

public class Serializers {

    private Serializers() {}

    public static Function<String, byte[]> createUtf8Serializer() {
        return s -> s.getBytes(UTF_8);
    }

    public static Function<byte[], String> createUtf8Deserializer() {
        return bytes -> new String(bytes, UTF_8);
    }

    public static <E> Function<E, byte[]> createPlainJavaSerializer() {
        return input -> {
            try (ByteArrayOutputStream bos = new ByteArrayOutputStream();
                 ObjectOutputStream out = new ObjectOutputStream(bos)) {
                out.writeObject(input);
                out.flush();
                return bos.toByteArray();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        };
    }

    public static <E> Function<byte[], E> createPlainJavaDeserializer() {
        return data -> {
            try (ByteArrayInputStream bis = new ByteArrayInputStream(data);
                 ObjectInputStream in = new ObjectInputStream(bis)) {
                return (E) in.readObject();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            } catch (ClassNotFoundException e) {
                throw new IllegalStateException(e);
            }
        };
    }
}
