package de.bsommerfeld.finance.ui.view;

import de.bsommerfeld.finance.core.domain.InvalidTransactionException;
import de.bsommerfeld.finance.core.domain.InvalidTransactionException.Field;
import de.bsommerfeld.finance.core.domain.Transaction;
import javafx.collections.ObservableList;
import javafx.event.ActionEvent;
import javafx.geometry.Insets;
import javafx.scene.Node;
import javafx.scene.control.Button;
import javafx.scene.control.ButtonType;
import javafx.scene.control.ComboBox;
import javafx.scene.control.Dialog;
import javafx.scene.control.Label;
import javafx.scene.control.TextField;
import javafx.scene.layout.GridPane;

import java.time.LocalDate;
import java.util.Map;

/**
 * Add/edit form. The result is only produced once the input passes the
 * {@link Transaction} invariants; otherwise the dialog stays open and marks
 * the offending field.
 */
public class TransactionFormDialog extends Dialog<Transaction> {

    private static final String ERROR_STYLE = "-fx-border-color: #d9534f; -fx-border-width: 1;";

    private final TextField description = new TextField();
    private final TextField amount = new TextField();
    private final TextField date = new TextField();
    private final ComboBox<String> category = new ComboBox<>();
    private final Label error = new Label();
    private final Map<Field, Node> inputs;

    private final Long existingId;
    private Transaction validated;

    /**
     * @param existing   transaction to edit, {@code null} to create a new one
     * @param categories choices for the editable category box
     */
    public TransactionFormDialog(Transaction existing, ObservableList<String> categories) {
        this.existingId = existing == null ? null : existing.id();
        this.inputs = Map.of(
                Field.DESCRIPTION, description,
                Field.AMOUNT, amount,
                Field.DATE, date,
                Field.CATEGORY, category);

        setTitle(existing == null ? "Add transaction" : "Edit transaction #" + existing.id());
        getDialogPane().getButtonTypes().addAll(ButtonType.OK, ButtonType.CANCEL);

        category.setItems(categories);
        category.setEditable(true);
        date.setPromptText("YYYY-MM-DD");
        amount.setPromptText("-12.50");
        error.setStyle("-fx-text-fill: #d9534f;");
        error.setWrapText(true);

        if (existing != null) {
            description.setText(existing.description());
            amount.setText(Double.toString(existing.amount()));
            date.setText(existing.dateText());
            category.getEditor().setText(existing.category());
        } else {
            date.setText(LocalDate.now().toString());
        }

        GridPane grid = new GridPane();
        grid.setHgap(10);
        grid.setVgap(8);
        grid.setPadding(new Insets(16));
        grid.addRow(0, new Label("Description"), description);
        grid.addRow(1, new Label("Amount"), amount);
        grid.addRow(2, new Label("Date"), date);
        grid.addRow(3, new Label("Category"), category);
        grid.add(error, 0, 4, 2, 1);
        getDialogPane().setContent(grid);

        Button ok = (Button) getDialogPane().lookupButton(ButtonType.OK);
        ok.addEventFilter(ActionEvent.ACTION, event -> {
            if (!validate()) {
                event.consume();
            }
        });

        setResultConverter(button -> button == ButtonType.OK ? validated : null);
    }

    private boolean validate() {
        inputs.values().forEach(node -> node.setStyle(""));
        error.setText("");
        try {
            Transaction tx = Transaction.of(
                    description.getText(),
                    parseAmount(amount.getText()),
                    date.getText(),
                    category.getEditor().getText());
            validated = existingId == null ? tx : tx.withId(existingId);
            return true;
        } catch (InvalidTransactionException e) {
            inputs.get(e.getField()).setStyle(ERROR_STYLE);
            error.setText(e.getMessage());
            return false;
        }
    }

    static double parseAmount(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidTransactionException(Field.AMOUNT, "Amount cannot be empty");
        }
        try {
            return Double.parseDouble(text.trim().replace(',', '.'));
        } catch (NumberFormatException e) {
            throw new InvalidTransactionException(Field.AMOUNT, "Amount must be a number: " + text, e);
        }
    }
}
