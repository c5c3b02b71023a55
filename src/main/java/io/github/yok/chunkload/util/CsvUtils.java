package io.github.yok.chunkload.util;

import io.github.yok.chunkload.exception.SourceIoException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import lombok.Generated;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.QuoteMode;
import org.apache.commons.io.input.BOMInputStream;

/**
 * Utility class for reading and writing chunk CSV files.
 *
 * <p>
 * Files are read as UTF-8 with malformed bytes replaced by {@code U+FFFD} and a leading byte order
 * mark removed, and written as UTF-8 with minimal quoting and {@code \n} record separators. The
 * header is handled as an ordinary first record so that duplicate header names survive parsing.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CsvUtils {

    /**
     * Format used to parse source and chunk files.
     */
    public static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder().get();

    /**
     * Format used to write chunk files.
     */
    public static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setQuoteMode(QuoteMode.MINIMAL).setRecordSeparator("\n").get();

    @Generated
    private CsvUtils() {
        throw new AssertionError("No CsvUtils instances for you!");
    }

    /**
     * Opens a UTF-8 reader that replaces malformed input instead of failing.
     *
     * @param file file to read
     * @return buffered reader positioned after an optional byte order mark
     * @throws IOException if the file cannot be opened
     */
    public static Reader openLenientReader(Path file) throws IOException {
        InputStream in = BOMInputStream.builder().setPath(file).get();
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        return new BufferedReader(new InputStreamReader(in, decoder));
    }

    /**
     * Opens a parser over a CSV file; the header is its first record.
     *
     * @param file file to parse
     * @return parser, to be closed by the caller
     * @throws IOException if the file cannot be opened
     */
    public static CSVParser openParser(Path file) throws IOException {
        return READ_FORMAT.parse(openLenientReader(file));
    }

    /**
     * Creates a printer writing a new UTF-8 CSV file.
     *
     * @param file file to create or truncate
     * @return printer, to be closed by the caller
     * @throws IOException if the file cannot be created
     */
    public static CSVPrinter openPrinter(Path file) throws IOException {
        Writer writer = new BufferedWriter(
                new OutputStreamWriter(Files.newOutputStream(file), StandardCharsets.UTF_8));
        return new CSVPrinter(writer, WRITE_FORMAT);
    }

    /**
     * Reads the header record of a CSV file.
     *
     * @param file CSV file
     * @return header names in file order, empty for an empty file
     * @throws SourceIoException if the file cannot be read
     */
    public static List<String> readHeader(Path file) {
        try (CSVParser parser = openParser(file)) {
            Iterator<CSVRecord> it = parser.iterator();
            if (!it.hasNext()) {
                return List.of();
            }
            return toList(it.next());
        } catch (IOException | UncheckedIOException e) {
            throw new SourceIoException("Failed to read CSV header: " + file, e);
        }
    }

    /**
     * Copies the values of a record into a list.
     *
     * @param record CSV record
     * @return values in column order
     */
    public static List<String> toList(CSVRecord record) {
        List<String> values = new ArrayList<>(record.size());
        for (String value : record) {
            values.add(value);
        }
        return values;
    }
}
