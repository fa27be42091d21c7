package io.github.dumbconf;

import io.github.dumbconf.grammar.AstParser;
import io.github.dumbconf.grammar.DumbconfParseException;
import io.github.dumbconf.grammar.Unparser;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Objects;
import java.util.logging.Logger;

/// Reading and writing dumbconf text.
///
/// Two ways in:
/// - one-shot: [#loads(String)] gives plain Java values and
///   [#dumps(Object, DumpOptions)] writes them back in house style;
/// - round-trip: [#loadsRoundtrip(String)] gives an [AstProxy] whose edits
///   keep every comment, blank line and quote of the original text, and
///   [#dumpsRoundtrip(AstProxy)] renders the edited document.
///
/// ```java
/// AstProxy config = Dumbconf.loadsRoundtrip(text);
/// config.get("server").set("port", 8081);
/// String updated = Dumbconf.dumpsRoundtrip(config);
/// ```
public final class Dumbconf {

    private static final Logger LOG = Logger.getLogger(Dumbconf.class.getName());

    private Dumbconf() {}

    /// Parses `text` into plain Java values.
    /// @throws DumbconfParseException if the text is not a valid document
    public static Object loads(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return NativeValues.project(AstParser.parse(text).val());
    }

    /// Reads the whole of `reader` and parses it into plain Java values.
    public static Object load(Reader reader) throws IOException {
        return loads(readAll(reader));
    }

    /// Writes `value` with [DumpOptions#DEFAULT].
    public static String dumps(Object value) {
        return dumps(value, DumpOptions.DEFAULT);
    }

    /// Writes `value` as dumbconf text.
    ///
    /// @param value a `String`, `Boolean`, `null`, integral or floating number,
    ///        `Map`, `List` or array, nested arbitrarily
    /// @param options the layout to use
    /// @throws IllegalArgumentException if `value` contains something with no dumbconf form
    public static String dumps(Object value, DumpOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        LOG.fine(() -> "Dumping with " + options);
        return Unparser.unparse(TokenSynthesizer.toAst(value, options.settings(), options.topLevelMap()));
    }

    public static void dump(Object value, Writer writer) throws IOException {
        dump(value, writer, DumpOptions.DEFAULT);
    }

    public static void dump(Object value, Writer writer, DumpOptions options) throws IOException {
        Objects.requireNonNull(writer, "writer must not be null");
        writer.write(dumps(value, options));
    }

    /// Parses `text` into an editable document.
    /// @return a proxy for the document root
    /// @throws DumbconfParseException if the text is not a valid document
    public static AstProxy loadsRoundtrip(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LOG.fine(() -> "Loading round-trip document of " + text.length() + " chars");
        return AstProxy.of(AstParser.parse(text));
    }

    public static AstProxy loadRoundtrip(Reader reader) throws IOException {
        return loadsRoundtrip(readAll(reader));
    }

    /// Renders the whole document `proxy` belongs to, whichever path it points at.
    public static String dumpsRoundtrip(AstProxy proxy) {
        Objects.requireNonNull(proxy, "proxy must not be null");
        return Unparser.unparse(proxy.document());
    }

    public static void dumpRoundtrip(AstProxy proxy, Writer writer) throws IOException {
        Objects.requireNonNull(writer, "writer must not be null");
        writer.write(dumpsRoundtrip(proxy));
    }

    private static String readAll(Reader reader) throws IOException {
        Objects.requireNonNull(reader, "reader must not be null");
        final var out = new StringWriter();
        reader.transferTo(out);
        return out.toString();
    }
}
