package Ingest;

import Dto.TransactionEvent;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import utils.JsonUtil;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransactionDataGeneratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-19T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private static TransactionDataGenerator generator(long seed) {
        return new TransactionDataGenerator(new Random(seed), CLOCK);
    }

    @Test
    void writesNumberedFilesWithTheRequestedRecordCount() throws Exception {
        List<Path> files = generator(1).generate(3, 25, tempDir.resolve("raw"));

        assertEquals(List.of(tempDir.resolve("raw/transactions_001.json"), tempDir.resolve("raw/transactions_002.json"),
                tempDir.resolve("raw/transactions_003.json")), files);
        for (Path file : files) {
            JsonNode array = JsonUtil.readTree(file);
            assertTrue(array.isArray());
            assertEquals(25, array.size());
        }
    }

    @Test
    void sameSeedAndClockGiveIdenticalFiles() throws Exception {
        Path first = generator(42).generate(1, 50, tempDir.resolve("a")).get(0);
        Path second = generator(42).generate(1, 50, tempDir.resolve("b")).get(0);

        assertArrayEquals(Files.readAllBytes(first), Files.readAllBytes(second));
    }

    @Test
    void eventsStayWithinTheirDomains() {
        TransactionDataGenerator generator = generator(7);
        LocalDateTime now = LocalDateTime.now(CLOCK);
        DateTimeFormatter format = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
        boolean sawMissingRating = false;

        for (int i = 0; i < 500; i++) {
            TransactionEvent event = generator.nextEvent();

            assertEquals(36, event.getTransactionId().length());
            assertEquals('4', event.getTransactionId().charAt(14));
            assertEquals(8, event.getCustomerId().length());
            assertEquals(8, event.getProductId().length());

            LocalDateTime timestamp = LocalDateTime.parse(event.getTimestamp(), format);
            assertFalse(timestamp.isAfter(now));
            assertTrue(timestamp.isAfter(now.minusDays(368)));

            assertTrue(TransactionDataGenerator.PRODUCTS.get(event.getCategory()).contains(event.getProductName()));
            assertTrue(TransactionDataGenerator.PAYMENT_METHODS.contains(event.getPaymentMethod()));
            assertTrue(event.getPrice() >= 10.0 && event.getPrice() <= 1000.0);
            assertEquals(event.getPrice(), Math.round(event.getPrice() * 100) / 100.0);
            assertTrue(event.getQuantity() >= 1 && event.getQuantity() <= 10);
            assertEquals("USA", event.getShippingAddress().getCountry());
            assertEquals(5, event.getShippingAddress().getZipCode().length());
            assertNotNull(event.getIsGift());

            if (event.getRating() == null) {
                sawMissingRating = true;
            } else {
                assertTrue(event.getRating() >= 1 && event.getRating() <= 5);
            }
            assertTrue(event.getTags().size() <= 3);
            assertEquals(event.getTags().size(), new HashSet<>(event.getTags()).size());
            assertTrue(TransactionDataGenerator.TAGS.containsAll(event.getTags()));
        }
        assertTrue(sawMissingRating);
    }

    @Test
    void serializesWithSnakeCaseNames() throws Exception {
        Path file = generator(3).generate(1, 1, tempDir).get(0);
        JsonNode event = JsonUtil.readTree(file).get(0);

        assertTrue(event.has("transaction_id"));
        assertTrue(event.has("is_gift"));
        assertTrue(event.get("shipping_address").has("zip_code"));
        assertTrue(event.get("tags").isArray());
    }
}
