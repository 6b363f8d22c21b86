package io.snapkv.common;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Stable content digest of structured values, suitable as an HTTP entity tag.
 *
 * <p>The value is rendered as a JSON tree with object members sorted by name and set
 * elements sorted by their canonical form, so the digest does not depend on map or set
 * iteration order. Members that are null, an empty array or an empty object are left out,
 * so an absent collection and an empty one digest the same. The canonical bytes are
 * digested with SHA-1 and rendered as unpadded URL-safe Base64.
 */
public final class ContentHash {

    public static final int LENGTH = 27;

    private static final String ALGORITHM = "SHA-1";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Gson GSON = new GsonBuilder()
        .disableHtmlEscaping()
        .registerTypeAdapter(Instant.class, new InstantTypeAdapter())
        .registerTypeAdapterFactory(new CanonicalSetAdapterFactory())
        .create();

    private ContentHash() {}

    public static String of(Object value) {
        JsonElement tree = GSON.toJsonTree(value);
        byte[] canonical = canonicalize(tree).toString().getBytes(StandardCharsets.UTF_8);
        return ENCODER.encodeToString(digest(canonical));
    }

    public static boolean matches(Object first, Object second) {
        return of(first).equals(of(second));
    }

    static JsonElement canonicalize(JsonElement element) {
        if (element.isJsonObject()) {
            Map<String, JsonElement> sorted = new TreeMap<>();
            for (Map.Entry<String, JsonElement> member : element.getAsJsonObject().entrySet()) {
                JsonElement value = canonicalize(member.getValue());
                if (!isEmpty(value)) {
                    sorted.put(member.getKey(), value);
                }
            }
            JsonObject result = new JsonObject();
            sorted.forEach(result::add);
            return result;
        }
        if (element.isJsonArray()) {
            JsonArray result = new JsonArray();
            for (JsonElement item : element.getAsJsonArray()) {
                result.add(canonicalize(item));
            }
            return result;
        }
        return element;
    }

    private static boolean isEmpty(JsonElement element) {
        return element.isJsonNull()
            || (element.isJsonArray() && element.getAsJsonArray().isEmpty())
            || (element.isJsonObject() && element.getAsJsonObject().size() == 0);
    }

    private static byte[] digest(byte[] bytes) {
        try {
            return MessageDigest.getInstance(ALGORITHM).digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " digest not available", e);
        }
    }

    private static final class CanonicalSetAdapterFactory implements TypeAdapterFactory {

        @Override
        public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
            if (!Set.class.isAssignableFrom(type.getRawType())) {
                return null;
            }
            TypeAdapter<T> delegate = gson.getDelegateAdapter(this, type);
            TypeAdapter<JsonElement> elementAdapter = gson.getAdapter(JsonElement.class);

            return new TypeAdapter<>() {
                @Override
                public void write(JsonWriter out, T value) throws IOException {
                    if (value == null) {
                        out.nullValue();
                        return;
                    }
                    List<JsonElement> elements = new ArrayList<>();
                    for (JsonElement item : delegate.toJsonTree(value).getAsJsonArray()) {
                        elements.add(canonicalize(item));
                    }
                    elements.sort(Comparator.comparing(JsonElement::toString));

                    JsonArray sorted = new JsonArray(elements.size());
                    elements.forEach(sorted::add);
                    elementAdapter.write(out, sorted);
                }

                @Override
                public T read(JsonReader in) throws IOException {
                    return delegate.read(in);
                }
            };
        }
    }
}
