package Engine;

import Dto.RawTransaction;
import Dto.Transaction;
import Exceptions.TypeCoercionException;
import org.apache.flink.api.common.functions.MapFunction;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;

/**
 * Row-level normalization rules, shared by the local and the Flink normalizer.
 * <ol>
 *   <li>{@code timestamp} is parsed and {@code date}, {@code year}, {@code month}, {@code day}
 *       and {@code day_of_week} (Monday = 0 ... Sunday = 6) are derived from it.</li>
 *   <li>{@code price} and {@code rating} become doubles, {@code quantity} an int.</li>
 *   <li>{@code total_price = price * quantity}.</li>
 *   <li>A missing {@code rating} becomes {@code 0.0}.</li>
 *   <li>{@code is_gift}, when the column exists, becomes 1 or 0.</li>
 * </ol>
 * Every derived value is a pure function of the source columns, and the sink writes source
 * values back in a form that parses to the same value, so normalizing re-read cleaned data
 * is a no-op.
 * <p>
 * Being a Flink {@link MapFunction}, an instance is shipped to the task managers as is.
 */
public class TransactionNormalizer implements MapFunction<RawTransaction, Transaction> {

    private static final long serialVersionUID = 1L;

    /**
     * {@code yyyy-MM-dd}, optionally followed by a space or {@code T} and an ISO local time.
     */
    private static final DateTimeFormatter TIMESTAMP_PARSER = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .optionalStart().appendLiteral('T').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalEnd()
            .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
            .toFormatter();

    private final boolean giftColumnPresent;

    public TransactionNormalizer(boolean giftColumnPresent) {
        this.giftColumnPresent = giftColumnPresent;
    }

    @Override
    public Transaction map(RawTransaction raw) throws TypeCoercionException {
        return normalizeRow(raw);
    }

    public Transaction normalizeRow(RawTransaction raw) throws TypeCoercionException {
        String id = raw.getTransactionId();
        LocalDateTime timestamp = parseTimestamp(raw.getTimestamp(), id);
        double price = parseDouble(TransactionSchema.PRICE, raw.getPrice(), id);
        int quantity = parseInt(TransactionSchema.QUANTITY, raw.getQuantity(), id);
        double rating = raw.getRating() == null ? 0.0 : parseDouble(TransactionSchema.RATING, raw.getRating(), id);
        Integer isGift = giftColumnPresent ? parseFlag(TransactionSchema.IS_GIFT, raw.getIsGift(), id) : null;

        LocalDate date = timestamp.toLocalDate();
        return Transaction.builder()
                .transactionId(id)
                .customerId(raw.getCustomerId())
                .productId(raw.getProductId())
                .productName(raw.getProductName())
                .category(raw.getCategory())
                .price(price)
                .quantity(quantity)
                .rating(rating)
                .timestamp(timestamp)
                .paymentMethod(raw.getPaymentMethod())
                .isGift(isGift)
                .tags(raw.getTags())
                .shippingAddressStreet(raw.getShippingAddressStreet())
                .shippingAddressCity(raw.getShippingAddressCity())
                .shippingAddressState(raw.getShippingAddressState())
                .shippingAddressZipCode(raw.getShippingAddressZipCode())
                .shippingAddressCountry(raw.getShippingAddressCountry())
                .date(date)
                .year(date.getYear())
                .month(date.getMonthValue())
                .day(date.getDayOfMonth())
                .dayOfWeek(date.getDayOfWeek().getValue() - 1)
                .totalPrice(price * quantity)
                .build();
    }

    static LocalDateTime parseTimestamp(String value, String id) throws TypeCoercionException {
        if (value == null) {
            throw new TypeCoercionException(TransactionSchema.TIMESTAMP, "", id);
        }
        try {
            return LocalDateTime.parse(value.trim(), TIMESTAMP_PARSER);
        } catch (DateTimeParseException e) {
            throw new TypeCoercionException(TransactionSchema.TIMESTAMP, value, id);
        }
    }

    static double parseDouble(String column, String value, String id) throws TypeCoercionException {
        if (value == null) {
            throw new TypeCoercionException(column, "", id);
        }
        double parsed;
        try {
            parsed = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new TypeCoercionException(column, value, id);
        }
        if (!Double.isFinite(parsed)) {
            throw new TypeCoercionException(column, value, id);
        }
        return parsed;
    }

    static int parseInt(String column, String value, String id) throws TypeCoercionException {
        if (value == null) {
            throw new TypeCoercionException(column, "", id);
        }
        try {
            // accepts "3" as well as "3.0", rejects "3.5"
            return new BigDecimal(value.trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new TypeCoercionException(column, value, id);
        }
    }

    static int parseFlag(String column, String value, String id) throws TypeCoercionException {
        if (value != null) {
            String text = value.trim();
            if (text.equalsIgnoreCase("true") || text.equals("1") || text.equals("1.0")) {
                return 1;
            }
            if (text.equalsIgnoreCase("false") || text.equals("0") || text.equals("0.0")) {
                return 0;
            }
        }
        throw new TypeCoercionException(column, value == null ? "" : value, id);
    }
}
