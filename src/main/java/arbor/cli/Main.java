// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package arbor.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import arbor.dom.Node;
import arbor.dom.Query;
import arbor.dom.Serializer;
import arbor.html.HtmlParser;
import arbor.util.Trace;
import arbor.util.condition.ConditionContext;
import arbor.util.condition.Handler;
import arbor.util.condition.exception.IOExceptionCondition;

/**
 * Command line front end: {@code arbor <file> [<id>]}.
 * <p>
 * Parses the given UTF-8 HTML file and prints it back in normalized form, with every omitted end tag written out.
 * With an id, only the element carrying that id is printed.
 */
public final class Main {
    private Main() {
    }

    public static void main(final String[] args) {
        System.exit(run(args, System.out, System.err).value);
    }

    static ExitCode run(final String[] args, final PrintStream out, final PrintStream err) {
        if (args.length < 1 || args.length > 2) {
            err.println("Usage: arbor <file> [<id>]");
            return ExitCode.USAGE;
        }
        final var path = Path.of(args[0]);
        final var id = (args.length == 2) ? args[1] : null;

        try (final var handler = new Handler(new FallbackHandler(err))) {
            handler.use();
            final var exitCode = ConditionContext.withRestart("abort-process", restart -> {
                final var document = parseFile(path);
                final Node output;
                if (id == null) {
                    output = document;
                } else {
                    output = Query.getElementById(document, id);
                    if (output == null) {
                        err.println("No element with id '" + id + "' found in " + path);
                        return ExitCode.ERROR;
                    }
                }
                print(out, output);
                return ExitCode.SUCCESS;
            });
            return (exitCode != null) ? exitCode : ExitCode.ERROR;
        }
    }

    private static Node.Document parseFile(final Path path) {
        try (final var trace = new Trace(() -> "Parsing file " + path)) {
            trace.use();
            final String html;
            try {
                html = Files.readString(path, StandardCharsets.UTF_8);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            return HtmlParser.parse(html);
        }
    }

    private static void print(final PrintStream out, final Node node) {
        final var writer = new PrintWriter(out, false, StandardCharsets.UTF_8);
        try {
            Serializer.serialize(writer, node);
        } catch (final IOException e) {
            throw ConditionContext.error(new IOExceptionCondition(e));
        }
        writer.println();
        writer.flush();
    }

    enum ExitCode {
        SUCCESS(0),
        ERROR(1),
        USAGE(64);

        ExitCode(final int value) {
            this.value = value;
        }

        private final int value;
    }
}
