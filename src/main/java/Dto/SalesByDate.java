package Dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Aggregated sales metrics per calendar day ({@code sales_by_date}).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SalesByDate implements TabularRecord {

    /**
     * The business date of the transactions (event time, not processing time).
     */
    private LocalDate date;

    private double totalPrice;
    private long quantity;
    private long numTransactions;

    @Override
    public Object get(String column) {
        switch (column) {
            case "date": return date;
            case "total_price": return totalPrice;
            case "quantity": return quantity;
            case "num_transactions": return numTransactions;
            default:
                throw new IllegalArgumentException("Unknown sales_by_date column: " + column);
        }
    }
}
