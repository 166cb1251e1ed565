package Engine;

import Dto.GiftAnalysis;
import Dto.PaymentAnalysis;
import Dto.ProductPerformance;
import Dto.SalesByCategory;
import Dto.SalesByDate;
import Dto.TabularRecord;
import utils.GroupKey;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static Engine.TransactionSchema.CATEGORY;
import static Engine.TransactionSchema.DATE;
import static Engine.TransactionSchema.IS_GIFT;
import static Engine.TransactionSchema.PAYMENT_METHOD;
import static Engine.TransactionSchema.PRODUCT_NAME;
import static Engine.TransactionSchema.QUANTITY;
import static Engine.TransactionSchema.RATING;
import static Engine.TransactionSchema.TOTAL_PRICE;
import static Engine.TransactionSchema.TRANSACTION_ID;

/**
 * The fixed catalogue of analytical views.
 * <p>
 * Combiners follow the same pattern for every view: the running aggregate ({@code current})
 * absorbs the next one and is returned, so a group keeps a single accumulator.
 */
public final class AggregationViews {

    public static final String NUM_TRANSACTIONS = "num_transactions";
    public static final String AVG_RATING = "avg_rating";

    public static final ViewDefinition<SalesByCategory> SALES_BY_CATEGORY = ViewDefinition.<SalesByCategory>builder()
            .name("sales_by_category")
            .groupKey(CATEGORY)
            .reducedColumn(TOTAL_PRICE).reducedColumn(QUANTITY).reducedColumn(TRANSACTION_ID)
            .outputColumn(CATEGORY).outputColumn(TOTAL_PRICE).outputColumn(QUANTITY).outputColumn(NUM_TRANSACTIONS)
            .rowType(SalesByCategory.class)
            .seed(t -> new SalesByCategory(t.getCategory(), t.getTotalPrice(), t.getQuantity(), 1L))
            .combiner((current, next) -> {
                current.setTotalPrice(current.getTotalPrice() + next.getTotalPrice());
                current.setQuantity(current.getQuantity() + next.getQuantity());
                current.setNumTransactions(current.getNumTransactions() + next.getNumTransactions());
                return current;
            })
            .keySelector(row -> GroupKey.of(row.getCategory()))
            .ordering(Comparator.comparing(SalesByCategory::getCategory, nullsLast()))
            .build();

    public static final ViewDefinition<SalesByDate> SALES_BY_DATE = ViewDefinition.<SalesByDate>builder()
            .name("sales_by_date")
            .groupKey(DATE)
            .reducedColumn(TOTAL_PRICE).reducedColumn(QUANTITY).reducedColumn(TRANSACTION_ID)
            .outputColumn(DATE).outputColumn(TOTAL_PRICE).outputColumn(QUANTITY).outputColumn(NUM_TRANSACTIONS)
            .rowType(SalesByDate.class)
            .seed(t -> new SalesByDate(t.getDate(), t.getTotalPrice(), t.getQuantity(), 1L))
            .combiner((current, next) -> {
                current.setTotalPrice(current.getTotalPrice() + next.getTotalPrice());
                current.setQuantity(current.getQuantity() + next.getQuantity());
                current.setNumTransactions(current.getNumTransactions() + next.getNumTransactions());
                return current;
            })
            .keySelector(row -> GroupKey.of(row.getDate()))
            // ascending by date, whatever order the groups were produced in
            .ordering(Comparator.comparing(SalesByDate::getDate, nullsLast()))
            .build();

    public static final ViewDefinition<ProductPerformance> PRODUCT_PERFORMANCE = ViewDefinition.<ProductPerformance>builder()
            .name("product_performance")
            .groupKey(CATEGORY).groupKey(PRODUCT_NAME)
            .reducedColumn(TOTAL_PRICE).reducedColumn(QUANTITY).reducedColumn(TRANSACTION_ID).reducedColumn(RATING)
            .outputColumn(CATEGORY).outputColumn(PRODUCT_NAME).outputColumn(TOTAL_PRICE).outputColumn(QUANTITY)
            .outputColumn(NUM_TRANSACTIONS).outputColumn(AVG_RATING)
            .rowType(ProductPerformance.class)
            .seed(t -> new ProductPerformance(t.getCategory(), t.getProductName(), t.getTotalPrice(), t.getQuantity(),
                    1L, t.getRating()))
            .combiner((current, next) -> {
                current.setTotalPrice(current.getTotalPrice() + next.getTotalPrice());
                current.setQuantity(current.getQuantity() + next.getQuantity());
                current.setNumTransactions(current.getNumTransactions() + next.getNumTransactions());
                current.setRatingTotal(current.getRatingTotal() + next.getRatingTotal());
                return current;
            })
            .keySelector(row -> GroupKey.of(row.getCategory(), row.getProductName()))
            .ordering(Comparator.comparing(ProductPerformance::getCategory, nullsLast())
                    .thenComparing(ProductPerformance::getProductName, nullsLast()))
            .build();

    /**
     * Only produced when the input has a {@code payment_method} column.
     */
    public static final ViewDefinition<PaymentAnalysis> PAYMENT_ANALYSIS = ViewDefinition.<PaymentAnalysis>builder()
            .name("payment_analysis")
            .groupKey(PAYMENT_METHOD)
            .reducedColumn(TOTAL_PRICE).reducedColumn(TRANSACTION_ID)
            .outputColumn(PAYMENT_METHOD).outputColumn(TOTAL_PRICE).outputColumn(NUM_TRANSACTIONS)
            .rowType(PaymentAnalysis.class)
            .seed(t -> new PaymentAnalysis(t.getPaymentMethod(), t.getTotalPrice(), 1L))
            .combiner((current, next) -> {
                current.setTotalPrice(current.getTotalPrice() + next.getTotalPrice());
                current.setNumTransactions(current.getNumTransactions() + next.getNumTransactions());
                return current;
            })
            .keySelector(row -> GroupKey.of(row.getPaymentMethod()))
            .ordering(Comparator.comparing(PaymentAnalysis::getPaymentMethod, nullsLast()))
            .build();

    /**
     * Only produced when the input has an {@code is_gift} column.
     */
    public static final ViewDefinition<GiftAnalysis> GIFT_ANALYSIS = ViewDefinition.<GiftAnalysis>builder()
            .name("gift_analysis")
            .groupKey(CATEGORY).groupKey(IS_GIFT)
            .reducedColumn(TOTAL_PRICE).reducedColumn(TRANSACTION_ID)
            .outputColumn(CATEGORY).outputColumn(IS_GIFT).outputColumn(TOTAL_PRICE).outputColumn(NUM_TRANSACTIONS)
            .rowType(GiftAnalysis.class)
            .seed(t -> new GiftAnalysis(t.getCategory(), t.getIsGift(), t.getTotalPrice(), 1L))
            .combiner((current, next) -> {
                current.setTotalPrice(current.getTotalPrice() + next.getTotalPrice());
                current.setNumTransactions(current.getNumTransactions() + next.getNumTransactions());
                return current;
            })
            .keySelector(row -> GroupKey.of(row.getCategory(), row.getIsGift()))
            .ordering(Comparator.comparing(GiftAnalysis::getCategory, nullsLast())
                    .thenComparing(GiftAnalysis::getIsGift, nullsLast()))
            .build();

    private AggregationViews() {
    }

    /**
     * The views to produce for a dataset with the given columns: the three unconditional views,
     * then {@code payment_analysis} and {@code gift_analysis} when their column exists.
     */
    public static List<ViewDefinition<? extends TabularRecord>> applicableTo(List<String> columns) {
        List<ViewDefinition<? extends TabularRecord>> views = new ArrayList<>();
        views.add(SALES_BY_CATEGORY);
        views.add(SALES_BY_DATE);
        views.add(PRODUCT_PERFORMANCE);
        if (columns.contains(PAYMENT_METHOD)) {
            views.add(PAYMENT_ANALYSIS);
        }
        if (columns.contains(IS_GIFT)) {
            views.add(GIFT_ANALYSIS);
        }
        return views;
    }

    private static <T extends Comparable<? super T>> Comparator<T> nullsLast() {
        return Comparator.nullsLast(Comparator.naturalOrder());
    }
}
