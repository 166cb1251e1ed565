package Dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated sales metrics per product category ({@code sales_by_category}).
 * <p>
 * <strong>Role in the job:</strong>
 * One instance is seeded per transaction and instances sharing a category are folded
 * together by the view's combiner, so the same class is both accumulator and output row.
 * <p>
 * <strong>Serialization Note:</strong>
 * Flink POJO compliant (public class, public no-args constructor, public getters/setters),
 * which keeps Flink on its PojoSerializer instead of the Kryo fallback.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SalesByCategory implements TabularRecord {

    /**
     * The product category name (e.g., "Electronics", "Clothing"). The grouping key.
     */
    private String category;

    /**
     * Sum of {@code total_price}.
     * <p>
     * <strong>Precision:</strong> binary doubles, as in the source data. Sums computed by the
     * two backends may differ in the last bits because the summation order differs.
     */
    private double totalPrice;

    /**
     * Sum of item quantities.
     */
    private long quantity;

    /**
     * Number of transactions (rows) in the group.
     */
    private long numTransactions;

    @Override
    public Object get(String column) {
        switch (column) {
            case "category": return category;
            case "total_price": return totalPrice;
            case "quantity": return quantity;
            case "num_transactions": return numTransactions;
            default:
                throw new IllegalArgumentException("Unknown sales_by_category column: " + column);
        }
    }
}
