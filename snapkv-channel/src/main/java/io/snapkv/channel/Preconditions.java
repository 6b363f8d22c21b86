package io.snapkv.channel;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Conditional request parameters evaluated before a write.
 *
 * <p>Entity tags are compared after stripping quotes and the weak {@code W/} prefix. Dates
 * are compared at second precision, the resolution of an HTTP date. A missing resource has
 * an empty entity tag and no modification time.
 */
public record Preconditions(
    List<String> ifMatch,
    List<String> ifNoneMatch,
    Instant ifModifiedSince,
    Instant ifUnmodifiedSince
) {

    private static final String WILDCARD = "*";

    public Preconditions {
        ifMatch = ifMatch == null ? List.of() : List.copyOf(ifMatch);
        ifNoneMatch = ifNoneMatch == null ? List.of() : List.copyOf(ifNoneMatch);
    }

    public static Preconditions none() {
        return new Preconditions(List.of(), List.of(), null, null);
    }

    public static Preconditions ifMatch(String... etags) {
        return new Preconditions(Arrays.asList(etags), List.of(), null, null);
    }

    public static Preconditions ifNoneMatch(String... etags) {
        return new Preconditions(List.of(), Arrays.asList(etags), null, null);
    }

    public Preconditions withIfModifiedSince(Instant instant) {
        return new Preconditions(ifMatch, ifNoneMatch, instant, ifUnmodifiedSince);
    }

    public Preconditions withIfUnmodifiedSince(Instant instant) {
        return new Preconditions(ifMatch, ifNoneMatch, ifModifiedSince, instant);
    }

    public boolean hasConditions() {
        return !ifMatch.isEmpty() || !ifNoneMatch.isEmpty() || ifModifiedSince != null || ifUnmodifiedSince != null;
    }

    /**
     * @param etag current entity tag, empty when the resource does not exist
     * @param lastModified current modification time, {@code null} when the resource does not exist
     * @throws ChannelException.PreconditionFailedException listing every failed condition
     */
    public void check(String etag, Instant lastModified) {
        Objects.requireNonNull(etag, "etag must not be null");
        List<String> failures = new ArrayList<>();

        if (!ifMatch.isEmpty() && !anyMatches(ifMatch, etag)) {
            failures.add("If-Match: etag " + quote(etag) + " does not match " + ifMatch);
        }
        if (!ifNoneMatch.isEmpty() && anyMatches(ifNoneMatch, etag)) {
            failures.add("If-None-Match: etag " + quote(etag) + " matches " + ifNoneMatch);
        }

        Instant modified = lastModified == null ? null : lastModified.truncatedTo(ChronoUnit.SECONDS);
        if (ifModifiedSince != null && (modified == null || !modified.isAfter(ifModifiedSince))) {
            failures.add("If-Modified-Since: not modified since " + ifModifiedSince);
        }
        if (ifUnmodifiedSince != null && modified != null && modified.isAfter(ifUnmodifiedSince)) {
            failures.add("If-Unmodified-Since: modified at " + modified + ", after " + ifUnmodifiedSince);
        }

        if (!failures.isEmpty()) {
            throw new ChannelException.PreconditionFailedException(failures);
        }
    }

    private static boolean anyMatches(List<String> candidates, String etag) {
        for (String candidate : candidates) {
            String normalized = normalize(candidate);
            if (WILDCARD.equals(normalized) ? !etag.isEmpty() : normalized.equals(etag)) {
                return true;
            }
        }
        return false;
    }

    static String normalize(String etag) {
        String value = etag.trim();
        if (value.startsWith("W/")) {
            value = value.substring(2);
        }
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static String quote(String etag) {
        return "\"" + etag + "\"";
    }
}
