package io.github.pgnmode.server;

import java.io.IOException;

/** Failures talking to the backend rules-engine process. */
public abstract class BackendException extends IOException {
    protected BackendException(String message) {
        super(message);
    }

    protected BackendException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Thrown by {@code send}/{@code receive} when no session is live. */
    public static class SessionNotRunningException extends BackendException {
        public SessionNotRunningException(String message) {
            super(message);
        }
    }

    /** Thrown by a non-forced {@code start} while a session is live. */
    public static class AlreadyRunningException extends BackendException {
        public AlreadyRunningException() {
            super("backend session is already running");
        }
    }

    /** Thrown when the backend process cannot be spawned or never acknowledges readiness. */
    public static class StartupFailedException extends BackendException {
        private final String output;

        public StartupFailedException(String message, String output) {
            super(message);
            this.output = output;
        }

        public StartupFailedException(String message, String output, Throwable cause) {
            super(message, cause);
            this.output = output;
        }

        /** Whatever the process printed before startup was abandoned. */
        public String getOutput() {
            return output;
        }
    }

    /** A reply that violates the wire protocol. */
    public abstract static class ProtocolException extends BackendException {
        private final String response;

        protected ProtocolException(String message, String response) {
            super(message);
            this.response = response;
        }

        public String getResponse() {
            return response;
        }
    }

    public static class EmptyResponseException extends ProtocolException {
        public EmptyResponseException() {
            super("empty response from backend", "");
        }
    }

    public static class MissingVersionException extends ProtocolException {
        public MissingVersionException(String response) {
            super("response does not start with a valid :version token", response);
        }
    }

    public static class VersionMismatchException extends ProtocolException {
        private final String expected;
        private final String actual;

        public VersionMismatchException(String expected, String actual, String response) {
            super("backend version %s does not match client version %s".formatted(actual, expected), response);
            this.expected = expected;
            this.actual = actual;
        }

        public String getExpected() {
            return expected;
        }

        public String getActual() {
            return actual;
        }
    }

    public static class MalformedTagException extends ProtocolException {
        public MalformedTagException(String response) {
            super("response has no tag after its version", response);
        }
    }

    public static class UnexpectedTagException extends ProtocolException {
        private final String tag;

        public UnexpectedTagException(String command, String tag, String response) {
            super("unexpected tag %s in reply to %s".formatted(tag, command), response);
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }
    }
}
