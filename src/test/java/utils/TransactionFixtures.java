package utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Delimited input files for tests.
 */
public final class TransactionFixtures {

    public static final String MINIMAL_HEADER =
            "transaction_id,customer_id,product_name,category,price,quantity,rating,timestamp";

    public static final String FULL_HEADER = MINIMAL_HEADER + ",payment_method,is_gift";

    /**
     * Header of a converted generator file: every key, sorted.
     */
    public static final String GENERATED_HEADER = "category,customer_id,is_gift,payment_method,price,product_id,"
            + "product_name,quantity,rating,shipping_address_city,shipping_address_country,shipping_address_state,"
            + "shipping_address_street,shipping_address_zip_code,tags,timestamp,transaction_id";

    private TransactionFixtures() {
    }

    public static Path writeFile(Path file, String... lines) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
        return file;
    }

    /**
     * A {@link #FULL_HEADER} row.
     */
    public static String row(String id, String category, String product, String price, String quantity,
                             String rating, String timestamp, String paymentMethod, String isGift) {
        return String.join(",", id, "c-" + id, product, category, price, quantity, rating, timestamp,
                paymentMethod, isGift);
    }

    /**
     * Twelve transactions over four categories, three days and three payment methods; one has
     * no rating.
     */
    public static Path writeSalesFiles(Path dir) throws IOException {
        writeFile(dir.resolve("sales_001.csv"),
                FULL_HEADER,
                row("t01", "Books", "Cookbook", "10.0", "1", "5", "2024-03-01 09:00:00", "Cash", "true"),
                row("t02", "Books", "Cookbook", "10.0", "2", "3", "2024-03-01 10:30:00", "PayPal", "false"),
                row("t03", "Books", "Biography", "24.99", "1", "", "2024-03-02 11:00:00", "Cash", "false"),
                row("t04", "Electronics", "Laptop", "899.99", "1", "4", "2024-03-02 12:00:00", "Credit Card", "true"),
                row("t05", "Electronics", "Camera", "450.5", "2", "5", "2024-03-03 08:15:00", "Credit Card", "false"),
                row("t06", "Toys", "Puzzle", "15.75", "4", "2", "2024-03-03 18:45:00", "Cash", "true"));
        writeFile(dir.resolve("sales_002.csv"),
                FULL_HEADER,
                row("t07", "Toys", "Puzzle", "15.75", "1", "4", "2024-03-01 13:00:00", "PayPal", "false"),
                row("t08", "Grocery", "Coffee", "12.4", "3", "5", "2024-03-02 07:30:00", "Cash", "false"),
                row("t09", "Grocery", "Pasta", "3.3", "10", "1", "2024-03-03 19:00:00", "PayPal", "true"),
                row("t10", "Electronics", "Laptop", "1099.0", "1", "3", "2024-03-01 21:00:00", "Credit Card", "false"),
                row("t11", "Books", "History", "30.0", "1", "4", "2024-03-02 14:20:00", "PayPal", "true"),
                row("t12", "Grocery", "Coffee", "12.4", "2", "2", "2024-03-03 16:00:00", "Cash", "false"));
        return dir;
    }
}
