package software.amazon.ahocorasick;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Feeds patterns from line-oriented text into an {@link AutomatonBuilder}, one pattern per line. Lines are trimmed and
 * blank lines are skipped. Failures are passed to the caller as they are.
 */
public class PatternLoader {

    private static final Logger log = LoggerFactory.getLogger(PatternLoader.class);

    private PatternLoader() { }

    /**
     * Adds one pattern per line, each line being the hexadecimal form of the pattern's bytes.
     *
     * @param builder receives the patterns
     * @param path UTF-8 text file
     * @return the number of patterns added
     * @throws IOException if the file can't be read
     * @throws DecoderException if a line is not valid hex
     */
    public static int loadPatterns(@Nonnull final AutomatonBuilder builder, @Nonnull final Path path)
            throws IOException, DecoderException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            final int added = loadPatterns(builder, reader);
            log.debug("Loaded {} hex patterns from {}", added, path);
            return added;
        }
    }

    public static int loadPatterns(@Nonnull final AutomatonBuilder builder, @Nonnull final Reader reader)
            throws IOException, DecoderException {
        final BufferedReader lines = buffered(reader);
        int added = 0;
        String line;
        while ((line = lines.readLine()) != null) {
            final String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                builder.addPattern(Hex.decodeHex(trimmed));
                added++;
            }
        }
        return added;
    }

    /**
     * Adds one pattern per line, taking each trimmed line literally.
     *
     * @param builder receives the patterns
     * @param path UTF-8 text file
     * @return the number of patterns added
     * @throws IOException if the file can't be read
     */
    public static int loadStrings(@Nonnull final AutomatonBuilder builder, @Nonnull final Path path)
            throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            final int added = loadStrings(builder, reader);
            log.debug("Loaded {} string patterns from {}", added, path);
            return added;
        }
    }

    public static int loadStrings(@Nonnull final AutomatonBuilder builder, @Nonnull final Reader reader)
            throws IOException {
        final BufferedReader lines = buffered(reader);
        int added = 0;
        String line;
        while ((line = lines.readLine()) != null) {
            final String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                builder.addString(trimmed);
                added++;
            }
        }
        return added;
    }

    private static BufferedReader buffered(final Reader reader) {
        return reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
    }
}
