package io.snapkv.channel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record PublishPoint(
    String id,
    String format,
    String url,
    List<String> drms,
    Map<String, String> headers
) {

    public PublishPoint {
        drms = Channel.copyOf(drms);
        headers = headers == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }
}
