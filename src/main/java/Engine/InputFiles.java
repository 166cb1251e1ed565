package Engine;

import Exceptions.EmptyInputException;
import Exceptions.InputReadException;
import Exceptions.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import utils.CsvUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Input resolution and header validation shared by the row source implementations.
 */
public final class InputFiles {

    private static final Logger log = LoggerFactory.getLogger(InputFiles.class);

    private InputFiles() {
    }

    /**
     * Expands the locations into a sorted list of files. Directories contribute their regular
     * files ending in {@code .extension} (not recursively); files are taken as given.
     *
     * @throws EmptyInputException if nothing resolves
     */
    public static List<Path> resolve(Set<Path> locations, String extension) throws PipelineException {
        Set<Path> files = new TreeSet<>();
        String suffix = "." + extension;
        for (Path location : locations) {
            if (Files.isDirectory(location)) {
                try (Stream<Path> listing = Files.list(location)) {
                    files.addAll(listing
                            .filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().endsWith(suffix))
                            .collect(Collectors.toList()));
                } catch (IOException e) {
                    throw new InputReadException(location, e);
                }
            } else if (Files.isRegularFile(location)) {
                files.add(location);
            } else {
                log.warn("Input location {} does not exist, skipping", location);
            }
        }
        if (files.isEmpty()) {
            throw new EmptyInputException("No ." + extension + " files found in " + locations);
        }
        log.info("Found {} {} files to load", files.size(), extension.toUpperCase());
        return Collections.unmodifiableList(new ArrayList<>(files));
    }

    /**
     * Reads and validates the header of every file.
     *
     * @return one column list per file, in file order; all share the same column set
     */
    public static List<List<String>> readHeaders(List<Path> files, char delimiter) throws PipelineException {
        List<List<String>> headers = new ArrayList<>(files.size());
        for (Path file : files) {
            String[] header;
            try {
                header = CsvUtil.readHeader(file, delimiter);
            } catch (IOException e) {
                throw new InputReadException(file, e);
            }
            List<String> columns = TransactionSchema.validateHeader(file.toString(), header);
            if (!headers.isEmpty()) {
                TransactionSchema.requireSameColumns(headers.get(0), file.toString(), columns);
            }
            headers.add(columns);
        }
        return headers;
    }
}
