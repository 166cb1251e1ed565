package Dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One transaction row exactly as it was read from a delimited input file.
 * <p>
 * Every cell is kept as text; an empty cell is {@code null}. Typing happens in the normalizer,
 * which is the only place that may reject a value. Derived columns ({@code date},
 * {@code total_price}, ...) of re-ingested cleaned data are not stored since the normalizer
 * recomputes them.
 * <p>
 * Flink POJO compliant (public no-arg constructor and accessors).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawTransaction {
    private String transactionId;
    private String customerId;
    private String productId;
    private String productName;
    private String category;
    private String price;
    private String quantity;
    private String rating;
    private String timestamp;
    private String paymentMethod;
    private String isGift;
    private String tags;
    private String shippingAddressStreet;
    private String shippingAddressCity;
    private String shippingAddressState;
    private String shippingAddressZipCode;
    private String shippingAddressCountry;
}
