package de.bsommerfeld.finance.core.report;

import de.bsommerfeld.finance.core.domain.Transaction;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregated view over a list of transactions, as shown in the reports view.
 * Sums use plain double arithmetic; small rounding drift is accepted.
 *
 * @param income           sum of all positive amounts
 * @param expenses         sum of all negative amounts (zero or negative)
 * @param count            number of transactions aggregated
 * @param categoryTotals   net amount per category, ordered by category name
 */
public record SpendingReport(double income, double expenses, int count, Map<String, Double> categoryTotals) {

    public SpendingReport {
        categoryTotals = Collections.unmodifiableMap(new TreeMap<>(categoryTotals));
    }

    public static SpendingReport of(List<Transaction> transactions) {
        double income = 0;
        double expenses = 0;
        Map<String, Double> totals = new TreeMap<>();
        for (Transaction tx : transactions) {
            if (tx.isExpense()) {
                expenses += tx.amount();
            } else {
                income += tx.amount();
            }
            totals.merge(tx.category(), tx.amount(), Double::sum);
        }
        return new SpendingReport(income, expenses, transactions.size(), totals);
    }

    public double net() {
        return income + expenses;
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
