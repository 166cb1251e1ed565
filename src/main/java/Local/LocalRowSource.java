package Local;

import Dto.RawTransaction;
import Engine.Dataset;
import Engine.InputFiles;
import Engine.LocalDataset;
import Engine.RowSource;
import Engine.TransactionSchema;
import Exceptions.InputReadException;
import Exceptions.PipelineException;
import com.opencsv.CSVReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import utils.CsvUtil;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads every input file into memory, file after file, rows in file order.
 * <p>
 * Files may list their columns in different orders; each record is mapped through its own
 * file's header, and the dataset takes the column order of the first file.
 */
public class LocalRowSource implements RowSource {

    private static final Logger log = LoggerFactory.getLogger(LocalRowSource.class);

    private final char delimiter;
    private final String extension;

    public LocalRowSource(char delimiter, String extension) {
        this.delimiter = delimiter;
        this.extension = extension;
    }

    @Override
    public Dataset<RawTransaction> load(Set<Path> locations) throws PipelineException {
        List<Path> files = InputFiles.resolve(locations, extension);
        List<List<String>> headers = InputFiles.readHeaders(files, delimiter);

        List<RawTransaction> rows = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            log.debug("Loading {}", file);
            readRows(file, headers.get(i), rows);
        }

        List<String> columns = headers.get(0);
        log.info("Loaded {} files with {} total records and {} columns", files.size(), rows.size(), columns.size());
        return new LocalDataset<>(columns, rows);
    }

    private void readRows(Path file, List<String> columns, List<RawTransaction> into) throws PipelineException {
        try (CSVReader reader = CsvUtil.openReader(file, delimiter)) {
            // header was validated already
            CsvUtil.readRecord(reader);
            String[] record;
            while ((record = CsvUtil.readRecord(reader)) != null) {
                if (CsvUtil.isBlank(record)) {
                    continue;
                }
                into.add(TransactionSchema.toRawTransaction(columns, record, file + ":" + reader.getLinesRead()));
            }
        } catch (IOException e) {
            throw new InputReadException(file, e);
        }
    }
}
