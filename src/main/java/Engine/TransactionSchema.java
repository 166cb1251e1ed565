package Engine;

import Dto.RawTransaction;
import Exceptions.SchemaMismatchException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The fixed transaction schema: which columns an input file must, may and may not carry, and
 * how a delimited record maps onto a {@link RawTransaction}.
 */
public final class TransactionSchema {

    public static final String TRANSACTION_ID = "transaction_id";
    public static final String CUSTOMER_ID = "customer_id";
    public static final String PRODUCT_ID = "product_id";
    public static final String PRODUCT_NAME = "product_name";
    public static final String CATEGORY = "category";
    public static final String PRICE = "price";
    public static final String QUANTITY = "quantity";
    public static final String RATING = "rating";
    public static final String TIMESTAMP = "timestamp";
    public static final String PAYMENT_METHOD = "payment_method";
    public static final String IS_GIFT = "is_gift";
    public static final String TAGS = "tags";
    public static final String SHIPPING_ADDRESS_STREET = "shipping_address_street";
    public static final String SHIPPING_ADDRESS_CITY = "shipping_address_city";
    public static final String SHIPPING_ADDRESS_STATE = "shipping_address_state";
    public static final String SHIPPING_ADDRESS_ZIP_CODE = "shipping_address_zip_code";
    public static final String SHIPPING_ADDRESS_COUNTRY = "shipping_address_country";

    public static final String DATE = "date";
    public static final String YEAR = "year";
    public static final String MONTH = "month";
    public static final String DAY = "day";
    public static final String DAY_OF_WEEK = "day_of_week";
    public static final String TOTAL_PRICE = "total_price";

    public static final List<String> REQUIRED_COLUMNS = List.of(
            CATEGORY, CUSTOMER_ID, PRICE, PRODUCT_NAME, QUANTITY, RATING, TIMESTAMP, TRANSACTION_ID);

    public static final List<String> OPTIONAL_COLUMNS = List.of(
            IS_GIFT, PAYMENT_METHOD, PRODUCT_ID, TAGS,
            SHIPPING_ADDRESS_CITY, SHIPPING_ADDRESS_COUNTRY, SHIPPING_ADDRESS_STATE,
            SHIPPING_ADDRESS_STREET, SHIPPING_ADDRESS_ZIP_CODE);

    /**
     * Columns added by the normalizer, in the order they are appended.
     */
    public static final List<String> DERIVED_COLUMNS = List.of(DATE, YEAR, MONTH, DAY, DAY_OF_WEEK, TOTAL_PRICE);

    private static final Set<String> KNOWN_COLUMNS = new HashSet<>();

    static {
        KNOWN_COLUMNS.addAll(REQUIRED_COLUMNS);
        KNOWN_COLUMNS.addAll(OPTIONAL_COLUMNS);
        KNOWN_COLUMNS.addAll(DERIVED_COLUMNS);
    }

    private TransactionSchema() {
    }

    /**
     * Checks a file header against the schema.
     *
     * @param source file name used in error messages
     * @return the header as a column list
     */
    public static List<String> validateHeader(String source, String[] header) throws SchemaMismatchException {
        if (header == null || header.length == 0) {
            throw new SchemaMismatchException(source + " has no header row");
        }
        List<String> columns = List.of(header);
        Set<String> seen = new HashSet<>();
        List<String> unknown = new ArrayList<>();
        for (String column : columns) {
            if (!seen.add(column)) {
                throw new SchemaMismatchException(source + " declares column '" + column + "' more than once");
            }
            if (!KNOWN_COLUMNS.contains(column)) {
                unknown.add(column);
            }
        }
        if (!unknown.isEmpty()) {
            throw new SchemaMismatchException(source + " has unknown column(s) " + unknown);
        }
        List<String> missing = new ArrayList<>();
        for (String column : REQUIRED_COLUMNS) {
            if (!seen.contains(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaMismatchException(source + " lacks required column(s) " + missing);
        }
        return columns;
    }

    /**
     * Fails unless {@code actual} has exactly the column set of {@code expected}; order is free.
     */
    public static void requireSameColumns(List<String> expected, String source, List<String> actual)
            throws SchemaMismatchException {
        if (!new HashSet<>(expected).equals(new HashSet<>(actual))) {
            throw new SchemaMismatchException(source + " has columns " + actual
                    + " which differ from the first input's columns " + expected);
        }
    }

    /**
     * The columns of a dataset after normalization: the input columns in their order, followed by
     * the derived columns the input did not already carry.
     */
    public static List<String> normalizedColumns(List<String> inputColumns) {
        List<String> columns = new ArrayList<>(inputColumns);
        for (String derived : DERIVED_COLUMNS) {
            if (!columns.contains(derived)) {
                columns.add(derived);
            }
        }
        return columns;
    }

    /**
     * Maps one delimited record onto a row. Empty cells become {@code null}; values of derived
     * columns are dropped because normalization recomputes them.
     *
     * @param location file and line, used in error messages
     */
    public static RawTransaction toRawTransaction(List<String> columns, String[] values, String location)
            throws SchemaMismatchException {
        if (values.length != columns.size()) {
            throw new SchemaMismatchException(location + " has " + values.length
                    + " values but the header declares " + columns.size() + " columns");
        }
        RawTransaction row = new RawTransaction();
        for (int i = 0; i < values.length; i++) {
            String value = values[i].isEmpty() ? null : values[i];
            switch (columns.get(i)) {
                case TRANSACTION_ID: row.setTransactionId(value); break;
                case CUSTOMER_ID: row.setCustomerId(value); break;
                case PRODUCT_ID: row.setProductId(value); break;
                case PRODUCT_NAME: row.setProductName(value); break;
                case CATEGORY: row.setCategory(value); break;
                case PRICE: row.setPrice(value); break;
                case QUANTITY: row.setQuantity(value); break;
                case RATING: row.setRating(value); break;
                case TIMESTAMP: row.setTimestamp(value); break;
                case PAYMENT_METHOD: row.setPaymentMethod(value); break;
                case IS_GIFT: row.setIsGift(value); break;
                case TAGS: row.setTags(value); break;
                case SHIPPING_ADDRESS_STREET: row.setShippingAddressStreet(value); break;
                case SHIPPING_ADDRESS_CITY: row.setShippingAddressCity(value); break;
                case SHIPPING_ADDRESS_STATE: row.setShippingAddressState(value); break;
                case SHIPPING_ADDRESS_ZIP_CODE: row.setShippingAddressZipCode(value); break;
                case SHIPPING_ADDRESS_COUNTRY: row.setShippingAddressCountry(value); break;
                default:
                    // derived column
                    break;
            }
        }
        return row;
    }
}
