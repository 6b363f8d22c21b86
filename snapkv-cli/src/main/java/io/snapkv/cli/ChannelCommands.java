package io.snapkv.cli;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.snapkv.channel.Channel;
import io.snapkv.channel.ChannelException;
import io.snapkv.channel.ChannelMeta;
import io.snapkv.channel.ChannelRegistry;
import io.snapkv.channel.ChannelRegistryConfig;
import io.snapkv.channel.ErrorDetail;
import io.snapkv.channel.Preconditions;
import io.snapkv.channel.PutResult;
import io.snapkv.common.ContentHash;
import io.snapkv.common.TraceContext;
import io.snapkv.storage.StoreException;
import io.snapkv.storage.codec.GsonValueCodec;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

final class ChannelCommands {

    private static final Gson GSON = GsonValueCodec.defaultGsonBuilder()
        .setPrettyPrinting()
        .create();

    private final ChannelRegistryConfig config;
    private final TraceContext ctx;
    private final PrintStream out;
    private final PrintStream err;

    ChannelCommands(ChannelRegistryConfig config, TraceContext ctx, PrintStream out, PrintStream err) {
        this.config = config;
        this.ctx = ctx;
        this.out = out;
        this.err = err;
    }

    int list(String[] args) {
        if (args.length != 0) {
            return usageError("list takes no arguments");
        }
        return execute(registry -> {
            for (ChannelMeta meta : registry.list(ctx)) {
                out.println(meta.id() + "\t" + meta.etag() + "\t" + meta.lastModified() + "\t" + meta.channel().name());
            }
            return SnapKvCli.EXIT_OK;
        });
    }

    int get(String[] args) {
        if (args.length != 1) {
            return usageError("get requires exactly one <id>");
        }
        return execute(registry -> {
            out.println(GSON.toJson(registry.get(ctx, args[0])));
            return SnapKvCli.EXIT_OK;
        });
    }

    int put(String[] args) {
        List<String> positional = new ArrayList<>();
        List<String> ifMatch = new ArrayList<>();
        List<String> ifNoneMatch = new ArrayList<>();
        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--if-match" -> ifMatch.add(SnapKvCli.requireValue(args, ++i, "--if-match"));
                    case "--if-none-match" -> ifNoneMatch.add(SnapKvCli.requireValue(args, ++i, "--if-none-match"));
                    default -> {
                        if (args[i].startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + args[i]);
                        }
                        positional.add(args[i]);
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            return usageError(e.getMessage());
        }
        if (positional.size() != 2) {
            return usageError("put requires <id> and <json-file>");
        }

        Channel channel;
        try {
            channel = readChannel(Path.of(positional.get(1)));
        } catch (IOException | JsonParseException e) {
            err.println("Error: cannot read " + positional.get(1) + ": " + e.getMessage());
            return SnapKvCli.EXIT_ERROR;
        }

        Preconditions preconditions = new Preconditions(ifMatch, ifNoneMatch, null, null);
        return execute(registry -> {
            PutResult result = registry.put(ctx, positional.get(0), channel, preconditions);
            out.println(result.modified() ? "written" : "not modified");
            out.println("etag: " + result.etag());
            out.println("last_modified: " + result.lastModified());
            out.println("traceparent: " + ctx.traceparent());
            return SnapKvCli.EXIT_OK;
        });
    }

    int delete(String[] args) {
        if (args.length != 1) {
            return usageError("delete requires exactly one <id>");
        }
        return execute(registry -> {
            registry.delete(ctx, args[0]);
            out.println("deleted " + args[0]);
            return SnapKvCli.EXIT_OK;
        });
    }

    int hash(String[] args) {
        if (args.length != 1) {
            return usageError("hash requires exactly one <json-file>");
        }
        try {
            out.println(ContentHash.of(readChannel(Path.of(args[0]))));
            return SnapKvCli.EXIT_OK;
        } catch (IOException | JsonParseException e) {
            err.println("Error: cannot read " + args[0] + ": " + e.getMessage());
            return SnapKvCli.EXIT_ERROR;
        }
    }

    private static Channel readChannel(Path file) throws IOException {
        Channel channel = GSON.fromJson(Files.readString(file), Channel.class);
        if (channel == null) {
            throw new JsonParseException("empty document");
        }
        return channel;
    }

    private int execute(RegistryAction action) {
        ChannelRegistry registry;
        try {
            registry = ChannelRegistry.open(config);
        } catch (StoreException e) {
            err.println("Error: " + e.getMessage());
            if (e.getCause() != null) {
                err.println("  caused by: " + e.getCause().getMessage());
            }
            return SnapKvCli.EXIT_ERROR;
        }

        try {
            return action.run(registry);
        } catch (ChannelException.NotFoundException e) {
            err.println("Error: " + e.getMessage());
            return SnapKvCli.EXIT_NOT_FOUND;
        } catch (ChannelException.ValidationException e) {
            err.println("Error: validation failed");
            for (ErrorDetail error : e.errors()) {
                err.println("  " + error);
            }
            return SnapKvCli.EXIT_ERROR;
        } catch (ChannelException.PreconditionFailedException e) {
            err.println("Error: precondition failed");
            for (String failure : e.failures()) {
                err.println("  " + failure);
            }
            return SnapKvCli.EXIT_ERROR;
        } catch (StoreException e) {
            err.println("Error: " + e.getMessage());
            return SnapKvCli.EXIT_ERROR;
        }
    }

    private int usageError(String message) {
        err.println("Error: " + message);
        err.println();
        SnapKvCli.printUsage(err);
        return SnapKvCli.EXIT_ERROR;
    }

    @FunctionalInterface
    private interface RegistryAction {
        int run(ChannelRegistry registry);
    }
}
