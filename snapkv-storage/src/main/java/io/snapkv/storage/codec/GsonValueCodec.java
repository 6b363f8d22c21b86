package io.snapkv.storage.codec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;
import io.snapkv.common.InstantTypeAdapter;
import io.snapkv.common.exception.CorruptionException;

import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;

public final class GsonValueCodec<V> implements ValueCodec<V> {

    private final Gson gson;
    private final Type type;

    private GsonValueCodec(Gson gson, Type type) {
        this.gson = Objects.requireNonNull(gson, "gson must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public static <V> GsonValueCodec<V> of(Class<V> type) {
        return new GsonValueCodec<>(defaultGson(), type);
    }

    public static <V> GsonValueCodec<V> of(TypeToken<V> type) {
        return new GsonValueCodec<>(defaultGson(), type.getType());
    }

    public static <V> GsonValueCodec<V> of(Gson gson, Class<V> type) {
        return new GsonValueCodec<>(gson, type);
    }

    public static GsonBuilder defaultGsonBuilder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .registerTypeAdapter(Instant.class, new InstantTypeAdapter());
    }

    private static Gson defaultGson() {
        return defaultGsonBuilder().create();
    }

    @Override
    public byte[] encode(V value) {
        Objects.requireNonNull(value, "value must not be null");
        return gson.toJson(value, type).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public V decode(byte[] bytes) {
        V value;
        try {
            value = gson.fromJson(new String(bytes, StandardCharsets.UTF_8), type);
        } catch (RuntimeException e) {
            // record constructors that reject their arguments surface as plain RuntimeException
            throw new CorruptionException("Failed to decode " + type.getTypeName() + " value", e);
        }
        if (value == null) {
            throw new CorruptionException("Empty " + type.getTypeName() + " value");
        }
        return value;
    }
}
