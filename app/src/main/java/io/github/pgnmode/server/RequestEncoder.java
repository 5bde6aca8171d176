package io.github.pgnmode.server;

import com.google.common.base.CharMatcher;
import java.util.Map;

/**
 * Encodes backend requests.
 *
 * <p>Wire format, one line per request:
 *
 * <pre>:version &lt;client-version&gt; &lt;command&gt; &lt;options&gt; -- &lt;payload-type&gt; &lt;payload&gt;\n</pre>
 */
public final class RequestEncoder {
    private static final CharMatcher SHELL_SAFE = CharMatcher.inRange('a', 'z')
            .or(CharMatcher.inRange('A', 'Z'))
            .or(CharMatcher.inRange('0', '9'))
            .or(CharMatcher.anyOf("_./:@%+,=-"))
            .precomputed();

    private RequestEncoder() {}

    public static String encode(
            String clientVersion,
            String command,
            Map<String, ?> options,
            String payloadType,
            String payload) {
        return ":version " + clientVersion + " " + command + encodeOptions(options) + " -- " + payloadType + " "
                + escapePayload(payload);
    }

    /**
     * Encodes options in map order. {@code true} yields a bare {@code -key}; {@code null} and {@code false} yield
     * nothing; any other value yields {@code -key=value}, shell-quoted when needed. Each emitted option carries a
     * leading space.
     */
    public static String encodeOptions(Map<String, ?> options) {
        var sb = new StringBuilder();
        for (var entry : options.entrySet()) {
            var value = entry.getValue();
            if (value == null || Boolean.FALSE.equals(value)) {
                continue;
            }
            sb.append(" -").append(entry.getKey());
            if (!Boolean.TRUE.equals(value)) {
                sb.append('=').append(quote(value.toString()));
            }
        }
        return sb.toString();
    }

    /** Quotes a value so the backend's POSIX-shell style splitting yields it back unchanged. */
    static String quote(String value) {
        if (!value.isEmpty() && SHELL_SAFE.matchesAllOf(value)) {
            return value;
        }
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }

    /**
     * Puts a payload on one line: line breaks are canonicalized, trailing ones dropped, the rest escaped as the two
     * characters {@code \n}, and a single real newline terminates the result.
     */
    public static String escapePayload(String payload) {
        String canonical = payload.replace("\r\n", "\n").replace('\r', '\n');
        int end = canonical.length();
        while (end > 0 && canonical.charAt(end - 1) == '\n') {
            end--;
        }
        return canonical.substring(0, end).replace("\n", "\\n") + "\n";
    }
}
