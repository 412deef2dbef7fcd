package de.bsommerfeld.finance.core.util;

import de.bsommerfeld.finance.core.domain.Transaction;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Generates plausible household transactions for TEST mode and manual UI
 * checks.
 *
 * <h3>What the output looks like</h3>
 * <ul>
 * <li>one salary payment on the first of every month in range</li>
 * <li>one rent payment on the third of every month in range</li>
 * <li>everything else is a random expense from a small pool of
 * description/category pairs, amounts between 2 and 120, spread across the
 * last {@code days} days</li>
 * </ul>
 * Amounts are rounded to cents. The list is sorted newest first, matching
 * the order the store returns.
 */
public class SampleDataGenerator {

    private static final String[][] EXPENSES = {
            { "Groceries", "Food" },
            { "Coffee", "Food" },
            { "Bakery", "Food" },
            { "Bus ticket", "Transport" },
            { "Fuel", "Transport" },
            { "Cinema", "Entertainment" },
            { "Streaming subscription", "Entertainment" },
            { "Electricity", "Utilities" },
            { "Internet", "Utilities" },
            { "Pharmacy", "Other" }
    };

    private SampleDataGenerator() {
    }

    public static List<Transaction> generate(int count, int days, long seed) {
        return generate(count, days, LocalDate.now(), new Random(seed));
    }

    static List<Transaction> generate(int count, int days, LocalDate today, Random rnd) {
        List<Transaction> result = new ArrayList<>();
        LocalDate start = today.minusDays(Math.max(days, 1) - 1L);

        for (LocalDate month = start.withDayOfMonth(1); !month.isAfter(today); month = month.plusMonths(1)) {
            LocalDate payday = month;
            LocalDate rentDay = month.withDayOfMonth(3);
            if (!payday.isBefore(start))
                result.add(new Transaction("Salary", 2850.00, payday, "Salary"));
            if (!rentDay.isBefore(start) && !rentDay.isAfter(today))
                result.add(new Transaction("Monthly rent", -950.00, rentDay, "Rent"));
        }

        while (result.size() < count) {
            String[] pick = EXPENSES[rnd.nextInt(EXPENSES.length)];
            double amount = -Math.round((2 + rnd.nextDouble() * 118) * 100) / 100.0;
            LocalDate date = start.plusDays(rnd.nextInt(Math.max(days, 1)));
            result.add(new Transaction(pick[0], amount, date, pick[1]));
        }

        result.sort(Comparator.comparing(Transaction::date).reversed());
        return result;
    }
}
