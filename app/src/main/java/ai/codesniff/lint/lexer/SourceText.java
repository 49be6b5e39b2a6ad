package ai.codesniff.lint.lexer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads source files, degrading to one character per byte when the content is not valid in the configured
 * encoding.
 */
public final class SourceText {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceText.class);

    private SourceText() {
    }

    public static String read(Path path, Charset charset) {
        Objects.requireNonNull(path, "path");
        try {
            return decode(Files.readAllBytes(path), charset);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read source file: " + path, ex);
        }
    }

    public static String decode(byte[] bytes, Charset charset) {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(charset, "charset");
        try {
            return charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException ex) {
            LOGGER.debug("Content is not valid {}; counting columns by byte", charset.name());
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }
}
