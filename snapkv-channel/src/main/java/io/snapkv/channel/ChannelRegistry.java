package io.snapkv.channel;

import io.snapkv.common.ContentHash;
import io.snapkv.common.TraceContext;
import io.snapkv.storage.ConcurrentStore;
import io.snapkv.storage.KeyValueStore;
import io.snapkv.storage.codec.GsonValueCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Channel configurations keyed by channel id, with entity tags for optimistic concurrency.
 *
 * <p>Conditional writes are evaluated and applied under one lock, so two writers holding the
 * same entity tag cannot both succeed.
 */
public final class ChannelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChannelRegistry.class);

    private static final Comparator<ChannelMeta> NEWEST_FIRST = Comparator
        .comparing(ChannelMeta::lastModified, Comparator.reverseOrder())
        .thenComparing(ChannelMeta::id);

    private final KeyValueStore<ChannelMeta> store;
    private final Clock clock;
    private final ReentrantLock writeLock;

    public ChannelRegistry(KeyValueStore<ChannelMeta> store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.writeLock = new ReentrantLock();
    }

    public static ChannelRegistry open(ChannelRegistryConfig config) {
        KeyValueStore<ChannelMeta> store = ConcurrentStore.open(
            config.storeConfig(),
            GsonValueCodec.of(ChannelMeta.class)
        );
        return new ChannelRegistry(store, config.clock());
    }

    public List<ChannelMeta> list(TraceContext ctx) {
        List<ChannelMeta> channels = new ArrayList<>();
        store.range((id, meta) -> {
            channels.add(meta);
            return true;
        });
        channels.sort(NEWEST_FIRST);

        log.info("list channels -> {} [trace_id={}]", channels.size(), ctx.traceparent());
        return channels;
    }

    public ChannelMeta get(TraceContext ctx, String id) {
        Optional<ChannelMeta> meta = store.load(id);

        log.info("get channel {} -> {} [trace_id={}]", id, meta.isPresent() ? "found" : "not found", ctx.traceparent());
        return meta.orElseThrow(() -> new ChannelException.NotFoundException(id));
    }

    public PutResult put(TraceContext ctx, String id, Channel channel, Preconditions preconditions) {
        Objects.requireNonNull(preconditions, "preconditions must not be null");
        ChannelValidator.requireValid(id, channel);

        writeLock.lock();
        try {
            Optional<ChannelMeta> existing = store.load(id);

            if (preconditions.hasConditions()) {
                preconditions.check(
                    existing.map(ChannelMeta::etag).orElse(""),
                    existing.map(ChannelMeta::lastModified).orElse(null)
                );
            }

            String etag = ContentHash.of(channel);
            if (existing.isPresent() && existing.get().etag().equals(etag)) {
                log.info("put channel {} -> not modified [trace_id={}]", id, ctx.traceparent());
                return PutResult.notModified(existing.get());
            }

            ChannelMeta meta = new ChannelMeta(id, etag, clock.instant(), channel);
            store.store(id, meta);

            log.info("put channel {} -> {} etag={} [trace_id={}]",
                id, existing.isPresent() ? "updated" : "created", etag, ctx.traceparent());
            return PutResult.written(meta);
        } catch (ChannelException.PreconditionFailedException e) {
            log.info("put channel {} -> precondition failed [trace_id={}]", id, ctx.traceparent());
            throw e;
        } finally {
            writeLock.unlock();
        }
    }

    public void delete(TraceContext ctx, String id) {
        ChannelValidator.requireValidId(id);

        writeLock.lock();
        try {
            store.delete(id);
        } finally {
            writeLock.unlock();
        }

        log.info("delete channel {} [trace_id={}]", id, ctx.traceparent());
    }
}
