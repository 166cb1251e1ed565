package Dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated metrics per (category, product) pair ({@code product_performance}).
 * <p>
 * The average rating is not accumulated directly: the combiner adds up {@code ratingTotal}
 * and {@code numTransactions}, and {@link #getAvgRating()} divides at read time. A group
 * always holds at least one row, so the division is always defined.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductPerformance implements TabularRecord {

    private String category;
    private String productName;
    private double totalPrice;
    private long quantity;
    private long numTransactions;

    /**
     * Sum of ratings in the group (missing ratings already count as 0).
     */
    private double ratingTotal;

    public double getAvgRating() {
        return ratingTotal / numTransactions;
    }

    @Override
    public Object get(String column) {
        switch (column) {
            case "category": return category;
            case "product_name": return productName;
            case "total_price": return totalPrice;
            case "quantity": return quantity;
            case "num_transactions": return numTransactions;
            case "avg_rating": return getAvgRating();
            default:
                throw new IllegalArgumentException("Unknown product_performance column: " + column);
        }
    }
}
