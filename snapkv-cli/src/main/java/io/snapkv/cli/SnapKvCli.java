package io.snapkv.cli;

import io.snapkv.channel.ChannelRegistryConfig;
import io.snapkv.common.TraceContext;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;

public final class SnapKvCli {
    private static final String VERSION = "0.1.0-SNAPSHOT";

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_NOT_FOUND = 2;

    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        GlobalOptions options = new GlobalOptions();
        int index;
        try {
            index = parseGlobalOptions(args, options);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println();
            printUsage(err);
            return EXIT_ERROR;
        }

        if (index >= args.length) {
            printUsage(out);
            return EXIT_OK;
        }

        TraceContext ctx;
        try {
            ctx = options.traceparent == null ? TraceContext.start() : TraceContext.continueFrom(options.traceparent);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        String command = args[index];
        String[] commandArgs = Arrays.copyOfRange(args, index + 1, args.length);
        ChannelCommands channels = new ChannelCommands(ChannelRegistryConfig.create(options.dataFile), ctx, out, err);

        return switch (command) {
            case "list" -> channels.list(commandArgs);
            case "get" -> channels.get(commandArgs);
            case "put" -> channels.put(commandArgs);
            case "delete" -> channels.delete(commandArgs);
            case "hash" -> channels.hash(commandArgs);
            case "trace-id" -> {
                out.println(ctx.traceparent());
                yield EXIT_OK;
            }
            case "help", "--help", "-h" -> {
                printUsage(out);
                yield EXIT_OK;
            }
            case "version", "--version", "-v" -> {
                out.println("snapkv " + VERSION);
                yield EXIT_OK;
            }
            default -> {
                err.println("Unknown command: " + command);
                err.println();
                printUsage(err);
                yield EXIT_ERROR;
            }
        };
    }

    private static int parseGlobalOptions(String[] args, GlobalOptions options) {
        int i = 0;
        while (i < args.length && args[i].startsWith("-") && !isCommandFlag(args[i])) {
            switch (args[i]) {
                case "--data-file", "-d" -> options.dataFile = Path.of(requireValue(args, ++i, "--data-file"));
                case "--traceparent" -> options.traceparent = requireValue(args, ++i, "--traceparent");
                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
            i++;
        }
        return i;
    }

    private static boolean isCommandFlag(String arg) {
        return switch (arg) {
            case "--help", "-h", "--version", "-v" -> true;
            default -> false;
        };
    }

    static String requireValue(String[] args, int index, String optionName) {
        if (index >= args.length) {
            throw new IllegalArgumentException(optionName + " requires a value");
        }
        return args[index];
    }

    static void printUsage(PrintStream out) {
        out.println("Usage: snapkv [options] <command> [args]");
        out.println();
        out.println("Commands:");
        out.println("  list                       List channels, most recently modified first");
        out.println("  get <id>                   Show a channel");
        out.println("  put <id> <json-file>       Create or replace a channel");
        out.println("      --if-match <etag>      Only write if the current etag matches (repeatable)");
        out.println("      --if-none-match <etag> Only write if the current etag does not match (repeatable)");
        out.println("  delete <id>                Delete a channel");
        out.println("  hash <json-file>           Print the etag a channel body would receive");
        out.println("  trace-id                   Print a new traceparent value");
        out.println("  help                       Show this help message");
        out.println("  version                    Show version information");
        out.println();
        out.println("Options:");
        out.println("  -d, --data-file <path>     Snapshot file (default: " + ChannelRegistryConfig.DEFAULT_DATA_FILE + ")");
        out.println("      --traceparent <value>  Continue an existing trace instead of starting one");
    }

    private static final class GlobalOptions {
        Path dataFile = Path.of(ChannelRegistryConfig.DEFAULT_DATA_FILE);
        String traceparent;
    }
}
