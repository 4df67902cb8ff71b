package org.dimacs.parser;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.UnbufferedCharStream;
import org.dimacs.lexer.ParseError;
import org.dimacs.support.Instance;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Punti di ingresso per il parsing di testi DIMACS (.cnf e .sat).
 *
 * Le varianti su {@link Reader} e {@link InputStream} leggono l'input in
 * streaming, senza caricarlo interamente in memoria.
 */
public final class Dimacs {

    private static final int STREAM_BUFFER_SIZE = 4096;

    private Dimacs() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param text testo DIMACS completo
     * @return istanza letta
     * @throws ParseError al primo errore
     */
    public static Instance parseDimacs(String text) {
        return parse(CharStreams.fromString(text));
    }

    public static Instance readDimacs(Reader reader) {
        return parse(new UnbufferedCharStream(reader, STREAM_BUFFER_SIZE));
    }

    /**
     * @param input byte in UTF-8
     */
    public static Instance readDimacs(InputStream input) {
        return parse(new UnbufferedCharStream(input, STREAM_BUFFER_SIZE, StandardCharsets.UTF_8));
    }

    /**
     * @param file file .cnf o .sat in UTF-8
     * @throws IOException se il file non è leggibile
     */
    public static Instance readDimacs(Path file) throws IOException {
        return parse(CharStreams.fromPath(file, StandardCharsets.UTF_8));
    }

    private static Instance parse(CharStream input) {
        return new DimacsParser(input).parseDimacs();
    }
}
