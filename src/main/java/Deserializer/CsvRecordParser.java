package Deserializer;

import Dto.RawTransaction;
import Engine.TransactionSchema;
import com.opencsv.ICSVParser;
import org.apache.flink.api.common.functions.RichFlatMapFunction;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.util.Collector;
import utils.CsvUtil;

import java.util.Arrays;
import java.util.List;

/**
 * Parses the text lines of one delimited input file into {@link RawTransaction} rows.
 * <p>
 * This function is the bridge between Flink's line-oriented file source and the transaction
 * schema: each instance is bound to a single file and maps every record through that file's
 * own header, so files listing their columns in different orders can be unioned.
 * <p>
 * <strong>Limitation:</strong> the file source splits on line breaks, so quoted cells with
 * embedded newlines are not supported by the Flink backend.
 */
public class CsvRecordParser extends RichFlatMapFunction<String, RawTransaction> {

    private static final long serialVersionUID = 1L;

    private final String source;
    private final String headerLine;
    private final String[] columns;
    private final char delimiter;

    /**
     * The OpenCSV parser is not serializable; it is created on the task side in {@link #open(Configuration)}.
     */
    private transient ICSVParser parser;
    private transient List<String> columnList;

    /**
     * @param source     file name used in error messages
     * @param headerLine the raw first line of the file, dropped when it comes by
     * @param columns    the parsed header
     */
    public CsvRecordParser(String source, String headerLine, List<String> columns, char delimiter) {
        this.source = source;
        this.headerLine = headerLine;
        this.columns = columns.toArray(new String[0]);
        this.delimiter = delimiter;
    }

    @Override
    public void open(Configuration parameters) throws Exception {
        super.open(parameters);
        parser = CsvUtil.parser(delimiter);
        columnList = Arrays.asList(columns);
    }

    /**
     * Emits one row per data line; the header line and blank lines produce nothing.
     *
     * @throws Exceptions.SchemaMismatchException if the line does not have one value per column
     * @throws java.io.IOException if the line is not a well-formed delimited record
     */
    @Override
    public void flatMap(String line, Collector<RawTransaction> out) throws Exception {
        if (line.isBlank() || line.equals(headerLine)) {
            return;
        }
        String[] values = parser.parseLine(line);
        out.collect(TransactionSchema.toRawTransaction(columnList, values, source));
    }
}
