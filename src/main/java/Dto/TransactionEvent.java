package Dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A synthetic transaction as written to the raw JSON fixtures.
 * <p>
 * Serialized by {@link utils.JsonUtil} with snake_case property names, so
 * {@code shippingAddress.zipCode} becomes {@code shipping_address.zip_code} and, once
 * flattened by the JSON to CSV converter, the {@code shipping_address_zip_code} column.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionEvent {
    private String transactionId;
    private String customerId;
    private String timestamp;
    private String productId;
    private String productName;
    private String category;
    private double price;
    private int quantity;
    private String paymentMethod;
    private ShippingAddress shippingAddress;
    private Boolean isGift;
    private Integer rating;
    private List<String> tags;
}
