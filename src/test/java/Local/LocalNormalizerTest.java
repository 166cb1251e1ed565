package Local;

import Dto.RawTransaction;
import Dto.Transaction;
import Engine.CsvFileSink;
import Engine.Dataset;
import Engine.LocalDataset;
import Engine.TransactionSchema;
import Exceptions.ErrorKind;
import Exceptions.TypeCoercionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static utils.TransactionFixtures.MINIMAL_HEADER;
import static utils.TransactionFixtures.writeFile;
import static utils.TransactionFixtures.writeSalesFiles;

class LocalNormalizerTest {

    @TempDir
    Path tempDir;

    private final LocalRowSource source = new LocalRowSource(',', "csv");
    private final LocalNormalizer normalizer = new LocalNormalizer();

    @Test
    void appendsDerivedColumnsAfterInputColumns() throws Exception {
        Dataset<RawTransaction> raw = source.load(Set.of(writeSalesFiles(tempDir)));
        Dataset<Transaction> cleaned = normalizer.normalize(raw);

        assertEquals(TransactionSchema.normalizedColumns(raw.columns()), cleaned.columns());
        assertEquals(List.of("date", "year", "month", "day", "day_of_week", "total_price"),
                cleaned.columns().subList(raw.columns().size(), cleaned.columns().size()));
        assertEquals(12, cleaned.collect().size());
    }

    @Test
    void normalizingPersistedOutputReproducesIt() throws Exception {
        Dataset<Transaction> first = normalizer.normalize(source.load(Set.of(writeSalesFiles(tempDir.resolve("in")))));
        Path persisted = tempDir.resolve("out/cleaned_data.csv");
        new CsvFileSink(',').persist("cleaned_data", first, persisted);

        Dataset<Transaction> second = normalizer.normalize(source.load(Set.of(persisted)));

        assertEquals(first.columns(), second.columns());
        assertEquals(first.collect(), second.collect());
    }

    @Test
    void giftStaysNullWithoutGiftColumn() throws Exception {
        writeFile(tempDir.resolve("a.csv"), MINIMAL_HEADER,
                "t1,c1,Laptop,Electronics,100.0,3,,2024-05-15 10:30:45");

        Transaction row = normalizer.normalize(source.load(Set.of(tempDir))).collect().get(0);

        assertEquals(300.0, row.getTotalPrice());
        assertEquals(0.0, row.getRating());
        assertNull(row.getIsGift());
    }

    @Test
    void firstBadRowFailsTheStage() {
        RawTransaction good = RawTransaction.builder().transactionId("t1").price("1.0").quantity("1")
                .timestamp("2024-01-01 00:00:00").build();
        RawTransaction bad = RawTransaction.builder().transactionId("t2").price("1.0").quantity("many")
                .timestamp("2024-01-01 00:00:00").build();

        TypeCoercionException e = assertThrows(TypeCoercionException.class,
                () -> normalizer.normalize(new LocalDataset<>(List.of(MINIMAL_HEADER.split(",")), List.of(good, bad))));
        assertEquals(ErrorKind.TYPE_COERCION, e.getKind());
        assertEquals("quantity", e.getColumn());
    }
}
