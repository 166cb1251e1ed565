package Engine;

import Dto.RawTransaction;
import Dto.Transaction;
import Exceptions.ErrorKind;
import Exceptions.TypeCoercionException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransactionNormalizerTest {

    private final TransactionNormalizer withGift = new TransactionNormalizer(true);
    private final TransactionNormalizer withoutGift = new TransactionNormalizer(false);

    private static RawTransaction.RawTransactionBuilder raw() {
        return RawTransaction.builder()
                .transactionId("t1")
                .customerId("c1")
                .productName("Laptop")
                .category("Electronics")
                .price("100.0")
                .quantity("3")
                .rating("4")
                .timestamp("2024-05-15 10:30:45")
                .isGift("True");
    }

    @Test
    void derivesCalendarColumnsAndTotal() throws Exception {
        Transaction row = withGift.normalizeRow(raw().build());

        assertEquals(LocalDateTime.of(2024, 5, 15, 10, 30, 45), row.getTimestamp());
        assertEquals(LocalDate.of(2024, 5, 15), row.getDate());
        assertEquals(2024, row.getYear());
        assertEquals(5, row.getMonth());
        assertEquals(15, row.getDay());
        // 2024-05-15 is a Wednesday
        assertEquals(2, row.getDayOfWeek());
        assertEquals(300.0, row.getTotalPrice());
        assertEquals(4.0, row.getRating());
        assertEquals(1, row.getIsGift());
    }

    @Test
    void mondayIsZeroAndSundayIsSix() throws Exception {
        assertEquals(0, withGift.normalizeRow(raw().timestamp("2024-05-13 00:00:00").build()).getDayOfWeek());
        assertEquals(6, withGift.normalizeRow(raw().timestamp("2024-05-19 23:59:59").build()).getDayOfWeek());
    }

    @Test
    void acceptsDateOnlyAndIsoTimestamps() throws Exception {
        assertEquals(LocalDateTime.of(2024, 5, 15, 0, 0),
                withGift.normalizeRow(raw().timestamp("2024-05-15").build()).getTimestamp());
        assertEquals(LocalDateTime.of(2024, 5, 15, 10, 30, 45, 500_000_000),
                withGift.normalizeRow(raw().timestamp("2024-05-15T10:30:45.5").build()).getTimestamp());
    }

    @Test
    void missingRatingBecomesZero() throws Exception {
        assertEquals(0.0, withGift.normalizeRow(raw().rating(null).build()).getRating());
    }

    @Test
    void giftFlagSpellings() throws Exception {
        String[] truthy = {"true", "True", "1", "1.0"};
        String[] falsy = {"false", "False", "0", "0.0"};
        for (String value : truthy) {
            assertEquals(1, withGift.normalizeRow(raw().isGift(value).build()).getIsGift(), value);
        }
        for (String value : falsy) {
            assertEquals(0, withGift.normalizeRow(raw().isGift(value).build()).getIsGift(), value);
        }
    }

    @Test
    void giftIsLeftNullWithoutTheColumn() throws Exception {
        assertNull(withoutGift.normalizeRow(raw().isGift(null).build()).getIsGift());
    }

    @Test
    void invalidGiftFlagIsRejected() {
        TypeCoercionException e = assertThrows(TypeCoercionException.class,
                () -> withGift.normalizeRow(raw().isGift("yes").build()));
        assertEquals("is_gift", e.getColumn());
        assertEquals("yes", e.getValue());

        assertThrows(TypeCoercionException.class, () -> withGift.normalizeRow(raw().isGift(null).build()));
    }

    @Test
    void badPriceNamesColumnValueAndTransaction() {
        TypeCoercionException e = assertThrows(TypeCoercionException.class,
                () -> withGift.normalizeRow(raw().price("abc").build()));
        assertEquals(ErrorKind.TYPE_COERCION, e.getKind());
        assertEquals("price", e.getColumn());
        assertEquals("abc", e.getValue());
        assertTrue(e.getMessage().contains("t1"));
    }

    @Test
    void emptyRequiredValuesAreRejected() {
        assertThrows(TypeCoercionException.class, () -> withGift.normalizeRow(raw().price(null).build()));
        assertThrows(TypeCoercionException.class, () -> withGift.normalizeRow(raw().quantity(null).build()));
        assertThrows(TypeCoercionException.class, () -> withGift.normalizeRow(raw().timestamp(null).build()));
    }

    @Test
    void quantityMustBeIntegral() throws Exception {
        assertEquals(3, withGift.normalizeRow(raw().quantity("3.0").build()).getQuantity());
        assertThrows(TypeCoercionException.class, () -> withGift.normalizeRow(raw().quantity("3.5").build()));
        assertThrows(TypeCoercionException.class, () -> withGift.normalizeRow(raw().price("NaN").build()));
        assertThrows(TypeCoercionException.class,
                () -> withGift.normalizeRow(raw().timestamp("15/05/2024").build()));
    }
}
