package Dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Revenue and transaction count per payment method ({@code payment_analysis}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaymentAnalysis implements TabularRecord {

    private String paymentMethod;
    private double totalPrice;
    private long numTransactions;

    @Override
    public Object get(String column) {
        switch (column) {
            case "payment_method": return paymentMethod;
            case "total_price": return totalPrice;
            case "num_transactions": return numTransactions;
            default:
                throw new IllegalArgumentException("Unknown payment_analysis column: " + column);
        }
    }
}
