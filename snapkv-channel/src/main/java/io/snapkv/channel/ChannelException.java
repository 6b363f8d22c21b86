package io.snapkv.channel;

import java.util.List;
import java.util.stream.Collectors;

public sealed class ChannelException extends RuntimeException
    permits ChannelException.NotFoundException,
            ChannelException.PreconditionFailedException,
            ChannelException.ValidationException {

    public ChannelException(String message) {
        super(message);
    }

    public static final class NotFoundException extends ChannelException {
        private final String channelId;

        public NotFoundException(String channelId) {
            super("Channel not found: " + channelId);
            this.channelId = channelId;
        }

        public String channelId() {
            return channelId;
        }
    }

    public static final class PreconditionFailedException extends ChannelException {
        private final List<String> failures;

        public PreconditionFailedException(List<String> failures) {
            super("Precondition failed: " + String.join("; ", failures));
            this.failures = List.copyOf(failures);
        }

        public List<String> failures() {
            return failures;
        }
    }

    public static final class ValidationException extends ChannelException {
        private final List<ErrorDetail> errors;

        public ValidationException(List<ErrorDetail> errors) {
            super("Validation failed: " + errors.stream()
                .map(ErrorDetail::toString)
                .collect(Collectors.joining("; ")));
            this.errors = List.copyOf(errors);
        }

        public List<ErrorDetail> errors() {
            return errors;
        }
    }
}
