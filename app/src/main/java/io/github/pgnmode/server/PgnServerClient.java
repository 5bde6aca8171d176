package io.github.pgnmode.server;

import io.github.pgnmode.navigation.PgnExtractor;
import io.github.pgnmode.server.BackendException.UnexpectedTagException;
import io.github.pgnmode.syntax.PgnDocument;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Typed requests against a {@link BackendSession}. Each call extracts the game text leading to a position, either
 * literally or with the enclosing variation promoted to the mainline, and asks the backend about it.
 */
public class PgnServerClient {
    private static final Logger logger = LogManager.getLogger(PgnServerClient.class);

    private final BackendSession session;

    public PgnServerClient(BackendSession session) {
        this.session = session;
    }

    public BackendSession session() {
        return session;
    }

    /** FEN of the position reached at {@code pos}. */
    public String fen(PgnDocument document, int pos, boolean asVariation)
            throws BackendException, InterruptedException {
        return request(BackendCommand.PGN_TO_FEN, Map.of(), extract(document, pos, asVariation)).content();
    }

    /**
     * Board picture of the position reached at {@code pos}: SVG markup, or a multi-line text diagram for
     * {@link BoardFormat#TEXT}.
     */
    public String board(PgnDocument document, int pos, boolean asVariation, BoardOptions options)
            throws BackendException, InterruptedException {
        var response = request(BackendCommand.PGN_TO_BOARD, options.toOptions(), extract(document, pos, asVariation));
        if (":board-text".equals(response.tag())) {
            return response.content().replace("\\n", "\n");
        }
        return response.content();
    }

    /** Mainline leading to {@code pos} in SAN, without headers, comments, variations or result. */
    public String mainline(PgnDocument document, int pos, boolean asVariation)
            throws BackendException, InterruptedException {
        return request(BackendCommand.PGN_TO_MAINLINE, Map.of(), extract(document, pos, asVariation)).content();
    }

    /**
     * Engine evaluation of the position reached at {@code pos}.
     *
     * @param engine path of the UCI engine the backend should run, or null for its default
     * @param depth search depth in plies, or null for the backend default
     */
    public String score(
            PgnDocument document, int pos, boolean asVariation, @Nullable String engine, @Nullable Integer depth)
            throws BackendException, InterruptedException {
        var options = new LinkedHashMap<String, Object>();
        if (engine != null) {
            options.put("engine", engine);
        }
        if (depth != null) {
            options.put("depth", depth);
        }
        return request(BackendCommand.PGN_TO_SCORE, options, extract(document, pos, asVariation)).content();
    }

    BackendResponse request(BackendCommand command, Map<String, ?> options, String pgn)
            throws BackendException, InterruptedException {
        var raw = session.query(command.token(), options, BackendCommand.PGN_PAYLOAD, pgn);
        var response = session.parseResponse(raw);
        if (!command.acceptsTag(response.tag())) {
            logger.warn("Backend answered {} with {}", command.token(), response.tag());
            throw new UnexpectedTagException(command.token(), response.tag(), raw);
        }
        return response;
    }

    private static String extract(PgnDocument document, int pos, boolean asVariation) {
        var extractor = new PgnExtractor(document);
        return asVariation ? extractor.extractAsVariation(pos) : extractor.extractAt(pos);
    }
}
