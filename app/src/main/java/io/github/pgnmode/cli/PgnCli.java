package io.github.pgnmode.cli;

import io.github.pgnmode.navigation.MoveNavigator;
import io.github.pgnmode.navigation.NoMoreMovesException;
import io.github.pgnmode.navigation.PgnExtractor;
import io.github.pgnmode.server.BackendException;
import io.github.pgnmode.server.BackendLauncher;
import io.github.pgnmode.server.BackendSession;
import io.github.pgnmode.server.BoardFormat;
import io.github.pgnmode.server.BoardOptions;
import io.github.pgnmode.server.PgnServerClient;
import io.github.pgnmode.syntax.PgnDocument;
import io.github.pgnmode.util.BackendConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.stream.Stream;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "pgn-mode",
        mixinStandardHelpOptions = true,
        versionProvider = PgnCli.VersionProvider.class,
        description = "Runs one PGN navigation or backend operation against a file and prints the result.")
public final class PgnCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(PgnCli.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "PGN file to read.")
    private Path file;

    @CommandLine.Option(names = "--pos", description = "Character offset to operate on. Defaults to end of file.")
    @Nullable
    private Integer pos;

    @CommandLine.Option(names = "--extract", description = "Print the game text leading to the position.")
    private boolean extract = false;

    @CommandLine.Option(names = "--next", description = "Print the offset of the next move.")
    private boolean next = false;

    @CommandLine.Option(names = "--previous", description = "Print the offset of the previous move.")
    private boolean previous = false;

    @CommandLine.Option(names = "--fen", description = "Ask the backend for the FEN at the position.")
    private boolean fen = false;

    @CommandLine.Option(names = "--board", description = "Ask the backend for a board picture at the position.")
    private boolean board = false;

    @CommandLine.Option(names = "--mainline", description = "Ask the backend for the SAN mainline to the position.")
    private boolean mainline = false;

    @CommandLine.Option(names = "--score", description = "Ask the backend for an engine evaluation at the position.")
    private boolean score = false;

    @CommandLine.Option(names = "--tree", description = "Print the parsed syntax tree.")
    private boolean tree = false;

    @CommandLine.Option(
            names = "--as-variation",
            description = "Promote the variation enclosing the position to the mainline before extracting.")
    private boolean asVariation = false;

    @CommandLine.Option(names = "--count", description = "Number of moves for --next/--previous.", defaultValue = "1")
    private int count = 1;

    @CommandLine.Option(names = "--text", description = "Render --board as text instead of SVG.")
    private boolean textBoard = false;

    @CommandLine.Option(names = "--pixels", description = "Size of an SVG board.", defaultValue = "400")
    private int pixels = BoardOptions.DEFAULT_PIXELS;

    @CommandLine.Option(names = "--flipped", description = "Draw the board from Black's side.")
    private boolean flipped = false;

    @CommandLine.Option(names = "--engine", description = "UCI engine for --score.")
    @Nullable
    private String engine;

    @CommandLine.Option(names = "--depth", description = "Search depth in plies for --score.")
    @Nullable
    private Integer depth;

    @Nullable
    private final BackendLauncher launcherOverride;

    public PgnCli() {
        this(null);
    }

    /** @param launcherOverride launches the backend instead of the configured command line */
    PgnCli(@Nullable BackendLauncher launcherOverride) {
        this.launcherOverride = launcherOverride;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PgnCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        long actionCount = Stream.of(extract, next, previous, fen, board, mainline, score, tree)
                .filter(b -> b)
                .count();
        if (actionCount != 1) {
            err.println("Exactly one of --extract, --next, --previous, --fen, --board, --mainline, --score, --tree"
                    + " is required.");
            return CommandLine.ExitCode.USAGE;
        }
        if (count < 1) {
            err.println("--count must be at least 1.");
            return CommandLine.ExitCode.USAGE;
        }

        PgnDocument document;
        try {
            document = PgnDocument.parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            err.println("Error reading " + file + ": " + e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        }
        int position = pos == null ? document.length() : pos;
        if (position < 0 || position > document.length()) {
            err.println("--pos must be between 0 and " + document.length() + ".");
            return CommandLine.ExitCode.USAGE;
        }

        try {
            if (tree) {
                out.println(document.toSExpression());
            } else if (extract) {
                var extractor = new PgnExtractor(document);
                out.println(asVariation ? extractor.extractAsVariation(position) : extractor.extractAt(position));
            } else if (next) {
                out.println(new MoveNavigator(document).nextMove(position, count));
            } else if (previous) {
                out.println(new MoveNavigator(document).previousMove(position, count));
            } else {
                out.println(queryBackend(document, position));
            }
        } catch (NoMoreMovesException e) {
            err.println(e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        } catch (BackendException e) {
            logger.warn("Backend request failed", e);
            err.println("Backend error: " + e.getMessage());
            return CommandLine.ExitCode.SOFTWARE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Interrupted.");
            return CommandLine.ExitCode.SOFTWARE;
        }
        out.flush();
        return CommandLine.ExitCode.OK;
    }

    private String queryBackend(PgnDocument document, int position) throws BackendException, InterruptedException {
        var config = BackendConfig.load();
        try (var session = launcherOverride == null
                ? new BackendSession(config)
                : new BackendSession(
                        launcherOverride,
                        config.clientVersion(),
                        config.pollInterval(),
                        config.receiveTimeout(),
                        config.startupTimeout())) {
            var client = new PgnServerClient(session);
            if (fen) {
                return client.fen(document, position, asVariation);
            } else if (board) {
                var format = textBoard ? BoardFormat.TEXT : BoardFormat.SVG;
                return client.board(document, position, asVariation, new BoardOptions(pixels, format, flipped));
            } else if (mainline) {
                return client.mainline(document, position, asVariation);
            } else {
                return client.score(document, position, asVariation, engine, depth);
            }
        }
    }

    public static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {"pgn-mode client protocol " + BackendConfig.load().clientVersion()};
        }
    }
}
