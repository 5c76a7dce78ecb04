package com.elclab.components.util;

import com.elclab.components.domain.CandidateRecord;
import com.elclab.components.domain.Component;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * CsvRecordParser - turns delimited component text into candidate records.
 *
 * <p>INPUT FORMAT:
 * <ul>
 *   <li>UTF-8, optional BOM (stripped).</li>
 *   <li>The first non-blank line is the header and must name the columns
 *       {@code ITEM}, {@code PRICE} and {@code DESCRIPTION}, in any order
 *       and any case. Extra columns are ignored.</li>
 *   <li>The delimiter is {@code ;} when the first 1024 characters contain
 *       more semicolons than commas, otherwise {@code ,}.</li>
 *   <li>Fields follow RFC 4180 quoting: quoted fields may contain the
 *       delimiter, and {@code ""} inside quotes is a literal quote. A record
 *       occupies exactly one line.</li>
 * </ul>
 *
 * <p>ROW RULES:
 * Every field is trimmed and an empty description becomes absent. A row is
 * skipped, never thrown, when its identifier is empty, its price is empty,
 * not a number or negative, or it has an unclosed quote. Blank lines are
 * not rows at all and are passed over silently.
 *
 * <p>ITERATION:
 * The parser is a lazy, restartable {@link Iterable}: every call to
 * {@link #iterator()} opens the source again and reads it line by line.
 * A missing or unusable header makes {@code iterator()} throw
 * {@link CsvFormatException}; a read failure surfaces as
 * {@link UncheckedIOException}. Callers that may stop early should close
 * the returned {@link RowIterator}.
 */
public class CsvRecordParser implements Iterable<ParsedRow> {

    private static final Logger log = LoggerFactory.getLogger(CsvRecordParser.class);

    // -----------------------------------------------------------------------
    // CONSTANTS
    // -----------------------------------------------------------------------

    public static final String COLUMN_ITEM        = "ITEM";
    public static final String COLUMN_PRICE       = "PRICE";
    public static final String COLUMN_DESCRIPTION = "DESCRIPTION";

    private static final List<String> REQUIRED_COLUMNS =
            List.of(COLUMN_ITEM, COLUMN_PRICE, COLUMN_DESCRIPTION);

    /** Number of leading characters inspected for delimiter detection. */
    static final int DELIMITER_SAMPLE_SIZE = 1024;

    private static final char BOM = '\uFEFF';

    // -----------------------------------------------------------------------
    // SOURCE
    // -----------------------------------------------------------------------

    /** Opens a fresh reader over the source for each iteration. */
    @FunctionalInterface
    public interface ReaderSource {
        Reader open() throws IOException;
    }

    private final ReaderSource source;
    private final String       sourceName;

    public CsvRecordParser(ReaderSource source, String sourceName) {
        if (source == null) {
            throw new IllegalArgumentException("ReaderSource must not be null.");
        }
        this.source     = source;
        this.sourceName = sourceName == null ? "<csv>" : sourceName;
    }

    /**
     * @param file UTF-8 CSV file
     * @return a parser that re-reads {@code file} on every iteration
     */
    public static CsvRecordParser forFile(Path file) {
        return new CsvRecordParser(
                () -> Files.newBufferedReader(file, StandardCharsets.UTF_8),
                file.getFileName().toString());
    }

    /**
     * @param text CSV content
     * @return a parser over in-memory text
     */
    public static CsvRecordParser forText(String text) {
        return new CsvRecordParser(() -> new StringReader(text), "<text>");
    }

    // -----------------------------------------------------------------------
    // ITERATION
    // -----------------------------------------------------------------------

    /**
     * Opens the source, detects the delimiter and reads the header.
     *
     * @return an iterator over the data rows
     * @throws CsvFormatException   if the header is missing or incomplete
     * @throws UncheckedIOException if the source cannot be read
     */
    @Override
    public RowIterator iterator() {
        BufferedReader reader;
        try {
            reader = new BufferedReader(source.open());
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot open CSV source " + sourceName, ex);
        }

        try {
            char delimiter = detectDelimiter(reader);
            return new RowIterator(reader, delimiter);
        } catch (IOException ex) {
            closeQuietly(reader);
            throw new UncheckedIOException("Cannot read CSV source " + sourceName, ex);
        } catch (RuntimeException ex) {
            closeQuietly(reader);
            throw ex;
        }
    }

    /**
     * Peeks at the first {@value #DELIMITER_SAMPLE_SIZE} characters without
     * consuming them.
     */
    static char detectDelimiter(BufferedReader reader) throws IOException {
        reader.mark(DELIMITER_SAMPLE_SIZE + 1);
        char[] sample = new char[DELIMITER_SAMPLE_SIZE];
        int read = 0;
        while (read < sample.length) {
            int n = reader.read(sample, read, sample.length - read);
            if (n < 0) {
                break;
            }
            read += n;
        }
        reader.reset();

        int semicolons = 0;
        int commas = 0;
        for (int i = 0; i < read; i++) {
            if (sample[i] == ';') {
                semicolons++;
            } else if (sample[i] == ',') {
                commas++;
            }
        }
        return semicolons > commas ? ';' : ',';
    }

    /**
     * Splits one line into fields following RFC 4180 quoting.
     *
     * <p>Handles plain fields, quoted fields containing the delimiter,
     * doubled quotes inside quoted fields, and empty fields
     * ({@code a,,c} gives three fields).
     *
     * @param line      raw line without its terminator
     * @param delimiter field separator
     * @return field values, quotes removed and escapes resolved
     * @throws IllegalArgumentException if a quoted field is not closed
     */
    public static List<String> splitFields(String line, char delimiter) {
        List<String> fields = new ArrayList<>();
        StringBuilder currentField = new StringBuilder();
        boolean inQuotes = false;
        int length = line.length();

        for (int i = 0; i < length; i++) {
            char c = line.charAt(i);

            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < length && line.charAt(i + 1) == '"') {
                        currentField.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    currentField.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
            } else if (c == delimiter) {
                fields.add(currentField.toString());
                currentField.setLength(0);
            } else {
                currentField.append(c);
            }
        }
        fields.add(currentField.toString());

        if (inQuotes) {
            throw new IllegalArgumentException("Unclosed quoted field.");
        }
        return fields;
    }

    private static void closeQuietly(Reader reader) {
        try {
            reader.close();
        } catch (IOException ex) {
            log.warn("Failed to close CSV reader: {}", ex.getMessage());
        }
    }

    // -----------------------------------------------------------------------
    // ROW ITERATOR
    // -----------------------------------------------------------------------

    /**
     * Iterator over the data rows of one pass through the source. Closes the
     * underlying reader when exhausted or when {@link #close()} is called.
     */
    public final class RowIterator implements Iterator<ParsedRow>, AutoCloseable {

        private final BufferedReader reader;
        private final char           delimiter;
        private final int            itemIndex;
        private final int            priceIndex;
        private final int            descriptionIndex;

        private int       lineNumber = 0;
        private ParsedRow next;
        private boolean   finished;

        RowIterator(BufferedReader reader, char delimiter) throws IOException {
            this.reader    = reader;
            this.delimiter = delimiter;

            String header = nextNonBlankLine();
            if (header == null) {
                throw new CsvFormatException(sourceName + " is empty; expected a header row with "
                        + String.join(", ", REQUIRED_COLUMNS) + ".");
            }
            Map<String, Integer> columns = buildColumnIndexMap(header);
            this.itemIndex        = columns.get(COLUMN_ITEM);
            this.priceIndex       = columns.get(COLUMN_PRICE);
            this.descriptionIndex = columns.get(COLUMN_DESCRIPTION);

            log.debug("{}: delimiter '{}', header at line {}, columns {}.",
                    sourceName, delimiter, lineNumber, columns);
        }

        /** @return the delimiter detected for this source */
        public char getDelimiter() {
            return delimiter;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            try {
                String line = nextNonBlankLine();
                if (line == null) {
                    close();
                    return false;
                }
                next = parseRow(lineNumber, line);
                return true;
            } catch (IOException ex) {
                close();
                throw new UncheckedIOException("Failed reading " + sourceName
                        + " after line " + lineNumber, ex);
            }
        }

        @Override
        public ParsedRow next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ParsedRow row = next;
            next = null;
            return row;
        }

        @Override
        public void close() {
            if (!finished) {
                finished = true;
                closeQuietly(reader);
            }
        }

        private String nextNonBlankLine() throws IOException {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BOM) {
                    line = line.substring(1);
                    log.debug("UTF-8 BOM detected and stripped.");
                }
                if (!line.isBlank()) {
                    return line;
                }
            }
            return null;
        }

        private Map<String, Integer> buildColumnIndexMap(String headerLine) {
            List<String> headers;
            try {
                headers = splitFields(headerLine, delimiter);
            } catch (IllegalArgumentException ex) {
                throw new CsvFormatException("Header row of " + sourceName
                        + " is malformed: " + ex.getMessage());
            }

            Map<String, Integer> map = new HashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                map.putIfAbsent(headers.get(i).trim().toUpperCase(Locale.ROOT), i);
            }

            List<String> missing = new ArrayList<>();
            for (String required : REQUIRED_COLUMNS) {
                if (!map.containsKey(required)) {
                    missing.add(required);
                }
            }
            if (!missing.isEmpty()) {
                throw new CsvFormatException("Header row of " + sourceName
                        + " is missing column(s) " + String.join(", ", missing)
                        + "; found: " + headerLine);
            }
            return map;
        }

        private ParsedRow parseRow(int rowLine, String rawLine) {
            List<String> fields;
            try {
                fields = splitFields(rawLine, delimiter);
            } catch (IllegalArgumentException ex) {
                return ParsedRow.skipped(rowLine, rawLine, ex.getMessage());
            }

            String identifier  = field(fields, itemIndex);
            String priceText   = field(fields, priceIndex);
            String description = field(fields, descriptionIndex);

            if (identifier.isEmpty()) {
                return ParsedRow.skipped(rowLine, rawLine, "Missing identifier.");
            }
            if (priceText.isEmpty()) {
                return ParsedRow.skipped(rowLine, rawLine, "Missing price.");
            }

            BigDecimal price;
            try {
                price = new BigDecimal(priceText);
            } catch (NumberFormatException ex) {
                return ParsedRow.skipped(rowLine, rawLine,
                        "Price '" + priceText + "' is not a number.");
            }
            if (!Component.isPriceInRange(price)) {
                return ParsedRow.skipped(rowLine, rawLine, "Price out of range.");
            }
            if (price.signum() < 0) {
                return ParsedRow.skipped(rowLine, rawLine,
                        "Price " + priceText + " is negative.");
            }

            return ParsedRow.candidate(rowLine, rawLine,
                    new CandidateRecord(identifier, price, description.isEmpty() ? null : description));
        }

        private String field(List<String> fields, int index) {
            return index < fields.size() ? fields.get(index).trim() : "";
        }
    }
}
