package de.bsommerfeld.finance.ui.view;

import de.bsommerfeld.finance.core.report.SpendingReport;
import jakarta.inject.Inject;
import javafx.collections.ListChangeListener;
import javafx.geometry.Insets;
import javafx.scene.Scene;
import javafx.scene.chart.BarChart;
import javafx.scene.chart.CategoryAxis;
import javafx.scene.chart.NumberAxis;
import javafx.scene.chart.XYChart;
import javafx.scene.control.Label;
import javafx.scene.layout.HBox;
import javafx.scene.layout.VBox;
import javafx.stage.Stage;
import javafx.stage.Window;

import java.util.Locale;
import java.util.Map;

/**
 * Income, expense and per-category totals for whatever the main list
 * currently shows. Redraws whenever that list changes while the window is
 * open.
 */
public class ReportsView {

    private final MainViewModel viewModel;

    private final Label income = new Label();
    private final Label expenses = new Label();
    private final Label net = new Label();
    private final Label count = new Label();
    private final BarChart<String, Number> chart = new BarChart<>(new CategoryAxis(), new NumberAxis());

    private Stage stage;

    @Inject
    public ReportsView(MainViewModel viewModel) {
        this.viewModel = viewModel;
        chart.setLegendVisible(false);
        chart.setAnimated(false);
        chart.getXAxis().setLabel("Category");
        chart.getYAxis().setLabel("Total (" + viewModel.currency() + ")");
    }

    public void show(Window owner) {
        if (stage == null) {
            ListChangeListener<Object> redraw = change -> render(viewModel.currentReport());
            viewModel.getTransactions().addListener(redraw);

            HBox totals = new HBox(24, income, expenses, net, count);
            VBox root = new VBox(12, totals, chart);
            root.setPadding(new Insets(16));

            stage = new Stage();
            stage.initOwner(owner);
            stage.setTitle("Reports");
            stage.setScene(new Scene(root, 720, 480));
            stage.setOnHidden(e -> {
                viewModel.getTransactions().removeListener(redraw);
                stage = null;
            });
        }
        render(viewModel.currentReport());
        stage.show();
        stage.toFront();
    }

    private void render(SpendingReport report) {
        String currency = viewModel.currency();
        income.setText("Income: " + format(report.income(), currency));
        expenses.setText("Expenses: " + format(report.expenses(), currency));
        net.setText("Net: " + format(report.net(), currency));
        count.setText(report.count() + " transactions");

        XYChart.Series<String, Number> series = new XYChart.Series<>();
        for (Map.Entry<String, Double> entry : report.categoryTotals().entrySet()) {
            series.getData().add(new XYChart.Data<>(entry.getKey(), entry.getValue()));
        }
        chart.getData().setAll(series);
    }

    static String format(double amount, String currency) {
        return String.format(Locale.ROOT, "%,.2f %s", amount, currency);
    }
}
