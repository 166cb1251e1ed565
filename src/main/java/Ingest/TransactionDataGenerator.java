package Ingest;

import Dto.ShippingAddress;
import Dto.TransactionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import utils.JsonUtil;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Generates the raw JSON fixtures the pipeline starts from.
 * <p>
 * Each file {@code transactions_NNN.json} holds an array of {@link TransactionEvent}s with
 * timestamps spread over the year before {@link Clock#instant() now}. Runs with the same seed
 * and clock produce identical files.
 */
public class TransactionDataGenerator {

    private static final Logger log = LoggerFactory.getLogger(TransactionDataGenerator.class);

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final Map<String, List<String>> PRODUCTS = new LinkedHashMap<>();

    static {
        PRODUCTS.put("Electronics", List.of("Smartphone", "Laptop", "Headphones", "Tablet", "Smart Watch", "Camera", "TV"));
        PRODUCTS.put("Clothing", List.of("T-shirt", "Jeans", "Dress", "Jacket", "Shoes", "Hat", "Socks"));
        PRODUCTS.put("Home & Kitchen", List.of("Blender", "Coffee Maker", "Toaster", "Microwave", "Knife Set", "Plates"));
        PRODUCTS.put("Books", List.of("Fiction Novel", "Biography", "Cookbook", "Self-Help", "Science Fiction", "History"));
        PRODUCTS.put("Sports", List.of("Basketball", "Tennis Racket", "Yoga Mat", "Dumbbells", "Running Shoes", "Bicycle"));
        PRODUCTS.put("Beauty", List.of("Shampoo", "Lipstick", "Face Cream", "Perfume", "Hair Dryer", "Nail Polish"));
        PRODUCTS.put("Toys", List.of("Action Figure", "Board Game", "Puzzle", "Stuffed Animal", "Building Blocks", "Doll"));
        PRODUCTS.put("Automotive", List.of("Car Wax", "Floor Mats", "Air Freshener", "Tire Gauge", "Jump Starter"));
        PRODUCTS.put("Health", List.of("Vitamins", "First Aid Kit", "Thermometer", "Pain Reliever", "Bandages"));
        PRODUCTS.put("Grocery", List.of("Cereal", "Coffee", "Pasta", "Snacks", "Canned Goods", "Frozen Meals"));
    }

    static final List<String> CATEGORIES = List.copyOf(PRODUCTS.keySet());

    static final List<String> PAYMENT_METHODS =
            List.of("Credit Card", "Debit Card", "PayPal", "Cash", "Bank Transfer", "Gift Card");

    static final List<String> TAGS = List.of("sale", "new", "trending", "limited", "exclusive");

    private static final List<String> STREETS = List.of("Main", "Oak", "Pine", "Maple", "Cedar");
    private static final List<String> CITIES = List.of("New York", "Los Angeles", "Chicago", "Houston", "Phoenix");
    private static final List<String> STATES = List.of("NY", "CA", "IL", "TX", "AZ");

    private final Random random;
    private final Clock clock;

    public TransactionDataGenerator(Random random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }

    /**
     * A generator on the system clock, seeded when {@code seed} is not null.
     */
    public static TransactionDataGenerator create(Long seed) {
        Random random = (seed == null) ? new Random() : new Random(seed);
        return new TransactionDataGenerator(random, Clock.systemDefaultZone());
    }

    /**
     * Writes {@code numFiles} files of {@code recordsPerFile} events each into {@code outputDir},
     * replacing files of the same name.
     *
     * @return the written files, in order
     */
    public List<Path> generate(int numFiles, int recordsPerFile, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        log.info("Generating {} files with {} records each", numFiles, recordsPerFile);

        List<Path> written = new ArrayList<>(numFiles);
        for (int fileNum = 1; fileNum <= numFiles; fileNum++) {
            List<TransactionEvent> events = new ArrayList<>(recordsPerFile);
            for (int i = 0; i < recordsPerFile; i++) {
                events.add(nextEvent());
            }
            Path file = outputDir.resolve(String.format("transactions_%03d.json", fileNum));
            JsonUtil.writeJson(file, events);
            written.add(file);
            log.info("Generated {} with {} records", file, recordsPerFile);
        }

        log.info("Data generation completed: {} files created with {} records each", numFiles, recordsPerFile);
        return written;
    }

    TransactionEvent nextEvent() {
        LocalDateTime timestamp = LocalDateTime.now(clock)
                .minusDays(random.nextInt(366))
                .minusHours(random.nextInt(25))
                .minusMinutes(random.nextInt(61));

        String category = pick(CATEGORIES);
        String productName = pick(PRODUCTS.get(category));

        ShippingAddress address = ShippingAddress.builder()
                .street(between(100, 9999) + " " + pick(STREETS) + " St")
                .city(pick(CITIES))
                .state(pick(STATES))
                .zipCode(String.valueOf(between(10000, 99999)))
                .country("USA")
                .build();

        return TransactionEvent.builder()
                .transactionId(uuid().toString())
                .customerId(uuid().toString().substring(0, 8))
                .timestamp(TIMESTAMP_FORMAT.format(timestamp))
                .productId(uuid().toString().substring(0, 8))
                .productName(productName)
                .category(category)
                .price(price())
                .quantity(between(1, 10))
                .paymentMethod(pick(PAYMENT_METHODS))
                .shippingAddress(address)
                .isGift(random.nextBoolean())
                .rating(random.nextDouble() > 0.3 ? between(1, 5) : null)
                .tags(tags())
                .build();
    }

    /**
     * Uniform in [10, 1000], rounded to cents.
     */
    private double price() {
        double raw = 10.0 + random.nextDouble() * 990.0;
        return BigDecimal.valueOf(raw).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Zero to three distinct tags.
     */
    private List<String> tags() {
        List<String> shuffled = new ArrayList<>(TAGS);
        Collections.shuffle(shuffled, random);
        return new ArrayList<>(shuffled.subList(0, random.nextInt(4)));
    }

    /**
     * A version 4 UUID drawn from this generator's random source.
     */
    private UUID uuid() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        bytes[6] = (byte) ((bytes[6] & 0x0f) | 0x40);
        bytes[8] = (byte) ((bytes[8] & 0x3f) | 0x80);
        long most = 0;
        long least = 0;
        for (int i = 0; i < 8; i++) {
            most = (most << 8) | (bytes[i] & 0xff);
        }
        for (int i = 8; i < 16; i++) {
            least = (least << 8) | (bytes[i] & 0xff);
        }
        return new UUID(most, least);
    }

    private int between(int lowInclusive, int highInclusive) {
        return lowInclusive + random.nextInt(highInclusive - lowInclusive + 1);
    }

    private String pick(List<String> values) {
        return values.get(random.nextInt(values.size()));
    }
}
