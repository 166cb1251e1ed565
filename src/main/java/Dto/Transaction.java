package Dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A normalized transaction: typed source columns plus the derived calendar and price columns.
 * <p>
 * <strong>Null handling:</strong> {@code rating} is never null after normalization (missing
 * ratings become {@code 0.0}). {@code isGift} stays {@code null} only when the input had no
 * {@code is_gift} column at all.
 * <p>
 * <strong>Calendar convention:</strong> {@code dayOfWeek} is 0 for Monday through 6 for Sunday.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Transaction implements TabularRecord {
    private String transactionId;
    private String customerId;
    private String productId;
    private String productName;
    private String category;
    private double price;
    private int quantity;
    private double rating;
    private LocalDateTime timestamp;
    private String paymentMethod;
    private Integer isGift;
    private String tags;
    private String shippingAddressStreet;
    private String shippingAddressCity;
    private String shippingAddressState;
    private String shippingAddressZipCode;
    private String shippingAddressCountry;

    // Derived
    private LocalDate date;
    private int year;
    private int month;
    private int day;
    private int dayOfWeek;
    private double totalPrice;

    @Override
    public Object get(String column) {
        switch (column) {
            case "transaction_id": return transactionId;
            case "customer_id": return customerId;
            case "product_id": return productId;
            case "product_name": return productName;
            case "category": return category;
            case "price": return price;
            case "quantity": return quantity;
            case "rating": return rating;
            case "timestamp": return timestamp;
            case "payment_method": return paymentMethod;
            case "is_gift": return isGift;
            case "tags": return tags;
            case "shipping_address_street": return shippingAddressStreet;
            case "shipping_address_city": return shippingAddressCity;
            case "shipping_address_state": return shippingAddressState;
            case "shipping_address_zip_code": return shippingAddressZipCode;
            case "shipping_address_country": return shippingAddressCountry;
            case "date": return date;
            case "year": return year;
            case "month": return month;
            case "day": return day;
            case "day_of_week": return dayOfWeek;
            case "total_price": return totalPrice;
            default:
                throw new IllegalArgumentException("Unknown transaction column: " + column);
        }
    }
}
