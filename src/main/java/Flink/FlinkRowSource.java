package Flink;

import Deserializer.CsvRecordParser;
import Dto.RawTransaction;
import Engine.Dataset;
import Engine.InputFiles;
import Engine.RowSource;
import Exceptions.InputReadException;
import Exceptions.PipelineException;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.file.src.FileSource;
import org.apache.flink.connector.file.src.reader.TextLineInputFormat;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Reads the input files with one bounded {@link FileSource} per file, unioned into a single
 * stream. Headers are validated on the client before the job is built.
 */
public class FlinkRowSource implements RowSource {

    private static final Logger log = LoggerFactory.getLogger(FlinkRowSource.class);

    private final StreamExecutionEnvironment env;
    private final char delimiter;
    private final String extension;

    public FlinkRowSource(StreamExecutionEnvironment env, char delimiter, String extension) {
        this.env = env;
        this.delimiter = delimiter;
        this.extension = extension;
    }

    @Override
    public Dataset<RawTransaction> load(Set<Path> locations) throws PipelineException {
        List<Path> files = InputFiles.resolve(locations, extension);
        List<List<String>> headers = InputFiles.readHeaders(files, delimiter);

        DataStream<RawTransaction> rows = null;
        for (int i = 0; i < files.size(); i++) {
            DataStream<RawTransaction> fileRows = readFile(files.get(i), headers.get(i));
            rows = (rows == null) ? fileRows : rows.union(fileRows);
        }

        List<String> columns = headers.get(0);
        long recordCount = FlinkJobs.count(rows, "Load " + files.size() + " input files");
        log.info("Loaded CSV data with {} records and {} columns", recordCount, columns.size());
        return new FlinkDataset<>(columns, rows, "input rows");
    }

    private DataStream<RawTransaction> readFile(Path file, List<String> columns) throws PipelineException {
        FileSource<String> source = FileSource
                .forRecordStreamFormat(new TextLineInputFormat(), new org.apache.flink.core.fs.Path(file.toUri()))
                .build();
        String name = file.getFileName().toString();
        return env.fromSource(source, WatermarkStrategy.noWatermarks(), "File Source: " + name)
                .flatMap(new CsvRecordParser(file.toString(), firstLine(file), columns, delimiter))
                .name("Parse " + name);
    }

    private static String firstLine(Path file) throws PipelineException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return reader.readLine();
        } catch (IOException e) {
            throw new InputReadException(file, e);
        }
    }
}
