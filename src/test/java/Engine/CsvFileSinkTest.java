package Engine;

import Dto.SalesByCategory;
import Dto.SalesByDate;
import Exceptions.ErrorKind;
import Exceptions.SinkWriteException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class CsvFileSinkTest {

    @TempDir
    Path tempDir;

    private final CsvFileSink sink = new CsvFileSink(',');

    @Test
    void writesHeaderAndRowsCreatingParentDirectories() throws Exception {
        Path target = tempDir.resolve("curated/nested/sales_by_category.csv");
        LocalDataset<SalesByCategory> dataset = new LocalDataset<>(
                AggregationViews.SALES_BY_CATEGORY.getOutputColumns(),
                List.of(new SalesByCategory("Books", 30.0, 3, 2),
                        new SalesByCategory("Home & Kitchen, Garden", 2699.9700000000003, 3, 1)));

        sink.persist("sales_by_category", dataset, target);

        assertEquals(List.of(
                "category,total_price,quantity,num_transactions",
                "Books,30.0,3,2",
                "\"Home & Kitchen, Garden\",2699.9700000000003,3,1"),
                Files.readAllLines(target, StandardCharsets.UTF_8));
    }

    @Test
    void replacesExistingArtifactAndLeavesNoTemporaryFile() throws Exception {
        Path target = tempDir.resolve("sales_by_date.csv");
        Files.write(target, List.of("stale"), StandardCharsets.UTF_8);

        sink.persist("sales_by_date", new LocalDataset<>(AggregationViews.SALES_BY_DATE.getOutputColumns(),
                List.of(new SalesByDate(LocalDate.of(2024, 3, 1), 10.0, 1, 1))), target);

        assertEquals(List.of("date,total_price,quantity,num_transactions", "2024-03-01,10.0,1,1"),
                Files.readAllLines(target, StandardCharsets.UTF_8));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(target), files.collect(Collectors.toList()));
        }
    }

    @Test
    void nullsBecomeEmptyCells() throws Exception {
        Path target = tempDir.resolve("nulls.csv");
        sink.persist("nulls", new LocalDataset<>(AggregationViews.SALES_BY_CATEGORY.getOutputColumns(),
                List.of(new SalesByCategory(null, 5.0, 1, 1))), target);

        assertEquals(",5.0,1,1", Files.readAllLines(target, StandardCharsets.UTF_8).get(1));
    }

    @Test
    void emptyDatasetWritesHeaderOnly() throws Exception {
        Path target = tempDir.resolve("empty.csv");
        sink.persist("empty", new LocalDataset<SalesByCategory>(
                AggregationViews.SALES_BY_CATEGORY.getOutputColumns(), List.of()), target);

        assertEquals(List.of("category,total_price,quantity,num_transactions"),
                Files.readAllLines(target, StandardCharsets.UTF_8));
    }

    @Test
    void unwritableTargetIsAnIoError() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.write(blocker, List.of("not a directory"), StandardCharsets.UTF_8);

        SinkWriteException e = assertThrows(SinkWriteException.class, () -> sink.persist("view",
                new LocalDataset<SalesByCategory>(AggregationViews.SALES_BY_CATEGORY.getOutputColumns(), List.of()),
                blocker.resolve("view.csv")));
        assertEquals(ErrorKind.IO, e.getKind());
        assertTrue(e.getMessage().contains("view.csv"));
    }

    @Test
    void newArtifactIsReadableByOthers() throws Exception {
        assumeTrue(Files.getFileStore(tempDir).supportsFileAttributeView(PosixFileAttributeView.class));
        Path target = tempDir.resolve("sales_by_category.csv");

        sink.persist("sales_by_category", new LocalDataset<SalesByCategory>(
                AggregationViews.SALES_BY_CATEGORY.getOutputColumns(), List.of()), target);

        assertEquals("rw-r--r--", PosixFilePermissions.toString(Files.getPosixFilePermissions(target)));
    }

    @Test
    void replacedArtifactKeepsItsPermissions() throws Exception {
        assumeTrue(Files.getFileStore(tempDir).supportsFileAttributeView(PosixFileAttributeView.class));
        Path target = tempDir.resolve("sales_by_category.csv");
        Files.write(target, List.of("stale"), StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(target, PosixFilePermissions.fromString("rw-rw----"));

        sink.persist("sales_by_category", new LocalDataset<SalesByCategory>(
                AggregationViews.SALES_BY_CATEGORY.getOutputColumns(), List.of()), target);

        assertEquals("rw-rw----", PosixFilePermissions.toString(Files.getPosixFilePermissions(target)));
    }
}
