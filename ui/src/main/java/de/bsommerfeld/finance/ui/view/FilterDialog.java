package de.bsommerfeld.finance.ui.view;

import de.bsommerfeld.finance.core.domain.TransactionFilter;
import javafx.collections.ObservableList;
import javafx.geometry.Insets;
import javafx.scene.control.ButtonType;
import javafx.scene.control.ComboBox;
import javafx.scene.control.DatePicker;
import javafx.scene.control.Dialog;
import javafx.scene.control.Label;
import javafx.scene.control.Spinner;
import javafx.scene.layout.GridPane;

/**
 * Picks category, date range and row limit for the main list. An empty
 * category or date leaves that criterion out.
 */
public class FilterDialog extends Dialog<FilterDialog.Selection> {

    /** Chosen criteria; {@code limit} 0 means no cap. */
    public record Selection(TransactionFilter filter, int limit) {
    }

    public FilterDialog(TransactionFilter current, int currentLimit, ObservableList<String> categories) {
        setTitle("Filter transactions");
        getDialogPane().getButtonTypes().addAll(ButtonType.OK, ButtonType.CANCEL);

        ComboBox<String> category = new ComboBox<>(categories);
        category.setEditable(true);
        category.getEditor().setText(current.hasCategory() ? current.category() : "");

        DatePicker start = new DatePicker(current.startDate());
        DatePicker end = new DatePicker(current.endDate());
        Spinner<Integer> limit = new Spinner<>(0, 100_000, Math.max(0, currentLimit), 10);
        limit.setEditable(true);

        GridPane grid = new GridPane();
        grid.setHgap(10);
        grid.setVgap(8);
        grid.setPadding(new Insets(16));
        grid.addRow(0, new Label("Category"), category);
        grid.addRow(1, new Label("From"), start);
        grid.addRow(2, new Label("To"), end);
        grid.addRow(3, new Label("Limit (0 = all)"), limit);
        getDialogPane().setContent(grid);

        setResultConverter(button -> {
            if (button != ButtonType.OK)
                return null;
            TransactionFilter filter = new TransactionFilter(
                    category.getEditor().getText(), start.getValue(), end.getValue());
            return new Selection(filter, limit.getValue());
        });
    }
}
