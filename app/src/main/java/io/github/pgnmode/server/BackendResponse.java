package io.github.pgnmode.server;

/** A parsed backend reply: {@code :version <version> <tag> <content>}. */
public record BackendResponse(String version, String tag, String content) {}
