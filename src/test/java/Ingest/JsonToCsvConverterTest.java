package Ingest;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import utils.TransactionFixtures;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonToCsvConverterTest {

    @TempDir
    Path tempDir;

    private final JsonToCsvConverter converter = new JsonToCsvConverter(',', "csv");

    @Test
    void flattensNestedObjectsAndArrays() throws Exception {
        Path json = TransactionFixtures.writeFile(tempDir.resolve("raw/t.json"),
                "[",
                "  {\"transaction_id\": \"a\", \"price\": 899.99, \"is_gift\": false, \"rating\": null,",
                "   \"shipping_address\": {\"city\": \"New York\", \"zip_code\": \"10001\"},",
                "   \"tags\": [\"new\", \"trending\"]},",
                "  {\"transaction_id\": \"b\", \"price\": 10, \"quantity\": 2, \"tags\": []}",
                "]");
        Path csv = tempDir.resolve("t.csv");

        assertTrue(converter.convert(json, csv));

        assertEquals(List.of(
                "is_gift,price,quantity,rating,shipping_address_city,shipping_address_zip_code,tags,transaction_id",
                "false,899.99,,,New York,10001,\"new,trending\",a",
                ",10,2,,,,,b"), Files.readAllLines(csv, StandardCharsets.UTF_8));
    }

    @Test
    void emptyArrayWritesNothing() throws Exception {
        Path json = TransactionFixtures.writeFile(tempDir.resolve("empty.json"), "[]");
        Path csv = tempDir.resolve("empty.csv");

        assertFalse(converter.convert(json, csv));
        assertFalse(Files.exists(csv));
    }

    @Test
    void rejectsDocumentsThatAreNotArrays() throws Exception {
        Path json = TransactionFixtures.writeFile(tempDir.resolve("object.json"), "{\"a\": 1}");

        assertThrows(IOException.class, () -> converter.convert(json, tempDir.resolve("object.csv")));
    }

    @Test
    void convertsEveryJsonFileOfADirectory() throws Exception {
        Path raw = tempDir.resolve("raw");
        TransactionFixtures.writeFile(raw.resolve("b.json"), "[{\"x\": 1}]");
        TransactionFixtures.writeFile(raw.resolve("a.json"), "[{\"x\": 2}]");
        TransactionFixtures.writeFile(raw.resolve("c.json"), "[]");
        TransactionFixtures.writeFile(raw.resolve("notes.txt"), "skip me");

        List<Path> written = converter.convertAll(raw, tempDir.resolve("processed"));

        assertEquals(List.of(tempDir.resolve("processed/a.csv"), tempDir.resolve("processed/b.csv")), written);
    }

    @Test
    void missingInputDirectoryConvertsNothing() throws Exception {
        assertTrue(converter.convertAll(tempDir.resolve("nowhere"), tempDir.resolve("processed")).isEmpty());
        assertTrue(Files.isDirectory(tempDir.resolve("processed")));
    }

    @Test
    void generatedFilesConvertToTheTransactionSchema() throws Exception {
        Path raw = tempDir.resolve("raw");
        new TransactionDataGenerator(new Random(5), Clock.systemUTC()).generate(1, 10, raw);

        List<Path> written = converter.convertAll(raw, tempDir.resolve("processed"));

        assertEquals(TransactionFixtures.GENERATED_HEADER,
                Files.readAllLines(written.get(0), StandardCharsets.UTF_8).get(0));
    }
}
