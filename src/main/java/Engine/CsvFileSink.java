package Engine;

import Dto.TabularRecord;
import Exceptions.PipelineException;
import Exceptions.SinkWriteException;
import com.opencsv.ICSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import utils.CsvUtil;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Set;

/**
 * Writes datasets as delimited files with a header row.
 * <p>
 * <strong>Atomicity:</strong> rows go to a temporary file next to the target, which is then
 * moved over the target. Readers see either the previous artifact or the complete new one.
 * On filesystems without atomic rename the move falls back to a plain replace.
 * <p>
 * On POSIX filesystems a replaced artifact keeps its permissions and a new one gets
 * {@code rw-r--r--}, the mode of a plainly created file.
 * <p>
 * Used by both backends; a Flink dataset is collected to the client before writing, like a
 * single-partition write.
 */
public class CsvFileSink implements Sink {

    private static final Logger log = LoggerFactory.getLogger(CsvFileSink.class);

    private static final Set<PosixFilePermission> DEFAULT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private final char delimiter;

    public CsvFileSink(char delimiter) {
        this.delimiter = delimiter;
    }

    @Override
    public void persist(String name, Dataset<? extends TabularRecord> dataset, Path target) throws PipelineException {
        List<String> columns = dataset.columns();
        List<? extends TabularRecord> rows = dataset.collect();

        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + absolute.getFileName(), ".tmp");
            try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 ICSVWriter writer = CsvUtil.openWriter(out, delimiter)) {
                writer.writeNext(columns.toArray(new String[0]), false);
                String[] line = new String[columns.size()];
                for (TabularRecord row : rows) {
                    for (int i = 0; i < line.length; i++) {
                        line[i] = CsvUtil.format(row.get(columns.get(i)));
                    }
                    writer.writeNext(line, false);
                }
            }
            copyPermissions(temp, absolute);
            moveIntoPlace(temp, absolute);
        } catch (IOException e) {
            SinkWriteException failure = new SinkWriteException(target, e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
        log.info("Saved {} to {} ({} rows)", name, target, rows.size());
    }

    private static void copyPermissions(Path temp, Path target) throws IOException {
        if (!Files.getFileStore(temp).supportsFileAttributeView(PosixFileAttributeView.class)) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.exists(target)
                ? Files.getPosixFilePermissions(target)
                : DEFAULT_PERMISSIONS;
        Files.setPosixFilePermissions(temp, permissions);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing instead", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
