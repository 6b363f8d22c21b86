package io.snapkv.channel;

import io.snapkv.storage.StoreConfig;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

public record ChannelRegistryConfig(
    StoreConfig storeConfig,
    Clock clock
) {
    public static final String DEFAULT_DATA_FILE = "channels.db";

    public ChannelRegistryConfig {
        Objects.requireNonNull(storeConfig, "storeConfig must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
    }

    public static ChannelRegistryConfig create(Path dataFile) {
        return new ChannelRegistryConfig(StoreConfig.fileBacked(dataFile), Clock.systemUTC());
    }

    public static ChannelRegistryConfig inMemory() {
        return new ChannelRegistryConfig(StoreConfig.inMemory(), Clock.systemUTC());
    }

    public ChannelRegistryConfig withClock(Clock clock) {
        return new ChannelRegistryConfig(storeConfig, clock);
    }
}
