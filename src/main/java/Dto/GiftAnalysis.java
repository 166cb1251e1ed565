package Dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Revenue and transaction count per (category, gift flag) pair ({@code gift_analysis}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GiftAnalysis implements TabularRecord {

    private String category;

    /**
     * 1 for gift purchases, 0 otherwise.
     */
    private Integer isGift;

    private double totalPrice;
    private long numTransactions;

    @Override
    public Object get(String column) {
        switch (column) {
            case "category": return category;
            case "is_gift": return isGift;
            case "total_price": return totalPrice;
            case "num_transactions": return numTransactions;
            default:
                throw new IllegalArgumentException("Unknown gift_analysis column: " + column);
        }
    }
}
