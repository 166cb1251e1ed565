package utils;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVParser;
import com.opencsv.ICSVWriter;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;

/**
 * Delimited-file helpers shared by the row sources, the sink and the JSON to CSV converter.
 * <p>
 * Quoting follows RFC 4180 (a quote inside a quoted cell is doubled, backslash has no
 * special meaning) in both directions.
 */
public final class CsvUtil {

    /**
     * {@code yyyy-MM-dd HH:mm:ss} with an optional fraction of second, printed only when non-zero.
     */
    public static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter();

    private CsvUtil() {
    }

    public static ICSVParser parser(char delimiter) {
        return new RFC4180ParserBuilder().withSeparator(delimiter).build();
    }

    public static CSVReader openReader(Path file, char delimiter) throws IOException {
        Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        return new CSVReaderBuilder(reader).withCSVParser(parser(delimiter)).build();
    }

    public static ICSVWriter openWriter(Writer writer, char delimiter) {
        return new CSVWriter(writer, delimiter, ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_QUOTE_CHARACTER, ICSVWriter.DEFAULT_LINE_END);
    }

    /**
     * Reads the next record, translating OpenCSV's validation failure into an {@link IOException}.
     *
     * @return the record, or {@code null} at end of file
     */
    public static String[] readRecord(CSVReader reader) throws IOException {
        try {
            return reader.readNext();
        } catch (CsvValidationException e) {
            throw new IOException("Malformed delimited record at line " + reader.getLinesRead(), e);
        }
    }

    /**
     * @return the header of {@code file}, or {@code null} if the file is empty
     */
    public static String[] readHeader(Path file, char delimiter) throws IOException {
        try (CSVReader reader = openReader(file, delimiter)) {
            return readRecord(reader);
        }
    }

    /**
     * True for the record OpenCSV returns for a blank line.
     */
    public static boolean isBlank(String[] record) {
        return record.length == 0 || (record.length == 1 && record[0].isEmpty());
    }

    /**
     * Renders a scalar cell. Doubles use their shortest exact decimal form without exponent,
     * so that reading the cell back yields the same bits.
     */
    public static String format(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double) {
            return formatDouble((Double) value);
        }
        if (value instanceof LocalDateTime) {
            return TIMESTAMP_FORMAT.format((LocalDateTime) value);
        }
        if (value instanceof LocalDate) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format((LocalDate) value);
        }
        return value.toString();
    }

    /**
     * Shortest decimal that parses back to {@code value}, keeping at least one fraction digit
     * ({@code 300.0}, {@code 0.00001}, {@code -0.0}).
     */
    static String formatDouble(double value) {
        // BigDecimal has no negative zero
        if (!Double.isFinite(value) || value == 0.0) {
            return Double.toString(value);
        }
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        String plain = decimal.toPlainString();
        return decimal.scale() > 0 ? plain : plain + ".0";
    }
}
