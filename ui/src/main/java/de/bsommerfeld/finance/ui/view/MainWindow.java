package de.bsommerfeld.finance.ui.view;

import de.bsommerfeld.finance.core.domain.Transaction;
import jakarta.inject.Inject;
import javafx.beans.property.ReadOnlyObjectWrapper;
import javafx.beans.property.ReadOnlyStringWrapper;
import javafx.collections.ListChangeListener;
import javafx.geometry.Insets;
import javafx.scene.Scene;
import javafx.scene.control.Alert;
import javafx.scene.control.Button;
import javafx.scene.control.ButtonType;
import javafx.scene.control.Label;
import javafx.scene.control.TableColumn;
import javafx.scene.control.TableView;
import javafx.scene.control.ToolBar;
import javafx.scene.layout.BorderPane;
import javafx.stage.FileChooser;
import javafx.stage.Stage;

import java.io.File;
import java.util.Objects;

/**
 * Main window: transaction table, toolbar and status line. All state lives in
 * {@link MainViewModel}; this class only binds controls to it.
 */
public class MainWindow {

    private final MainViewModel viewModel;
    private final ReportsView reportsView;

    private final TableView<Transaction> table = new TableView<>();
    private Stage stage;

    @Inject
    public MainWindow(MainViewModel viewModel, ReportsView reportsView) {
        this.viewModel = viewModel;
        this.reportsView = reportsView;
    }

    public void show(Stage primaryStage) {
        this.stage = primaryStage;
        viewModel.setErrorReporter(this::showError);

        BorderPane root = new BorderPane();
        root.setTop(buildToolBar());
        root.setCenter(buildTable());
        root.setBottom(buildStatusLine());

        primaryStage.setTitle("Finance Tracker");
        primaryStage.setScene(new Scene(root, 960, 640));
        primaryStage.setMinWidth(720);
        primaryStage.setMinHeight(480);
        primaryStage.show();

        viewModel.loadCategories();
        viewModel.refresh();
    }

    private ToolBar buildToolBar() {
        Button add = new Button("Add");
        add.setOnAction(e -> new TransactionFormDialog(null, viewModel.getCategories())
                .showAndWait()
                .ifPresent(viewModel::add));

        Button edit = new Button("Edit");
        edit.setOnAction(e -> viewModel.selectedTransaction().ifPresent(tx -> new TransactionFormDialog(tx,
                viewModel.getCategories()).showAndWait().ifPresent(viewModel::update)));

        Button delete = new Button("Delete");
        delete.setOnAction(e -> viewModel.selectedTransaction().ifPresent(tx -> {
            if (confirm("Delete transaction #" + tx.id() + " '" + tx.description() + "'?")) {
                viewModel.delete(tx.id());
            }
        }));

        edit.disableProperty().bind(viewModel.selectedIdProperty().isNull());
        delete.disableProperty().bind(viewModel.selectedIdProperty().isNull());

        Button filter = new Button("Filter");
        filter.setOnAction(e -> new FilterDialog(viewModel.filterProperty().get(), viewModel.limitProperty().get(),
                viewModel.getCategories())
                .showAndWait()
                .ifPresent(sel -> viewModel.applyFilter(sel.filter(), sel.limit())));

        Button clearFilter = new Button("Clear filter");
        clearFilter.setOnAction(e -> viewModel.clearFilter());

        Button reports = new Button("Reports");
        reports.setOnAction(e -> reportsView.show(stage));

        Button importCsv = new Button("Import");
        importCsv.setOnAction(e -> {
            File file = csvChooser("Import CSV").showOpenDialog(stage);
            if (file != null)
                viewModel.importCsv(file.toPath());
        });

        Button exportCsv = new Button("Export");
        exportCsv.setOnAction(e -> {
            FileChooser chooser = csvChooser("Export CSV");
            chooser.setInitialFileName("transactions.csv");
            File file = chooser.showSaveDialog(stage);
            if (file != null)
                viewModel.exportCsv(file.toPath());
        });

        Button compact = new Button("Compact ids");
        compact.setOnAction(e -> {
            if (confirm("Renumber all transactions to 1..n? Ids shown before will change.")) {
                viewModel.compactIds();
            }
        });

        return new ToolBar(add, edit, delete, filter, clearFilter, reports, importCsv, exportCsv, compact);
    }

    private TableView<Transaction> buildTable() {
        TableColumn<Transaction, Long> id = new TableColumn<>("ID");
        id.setCellValueFactory(c -> new ReadOnlyObjectWrapper<>(c.getValue().id()));

        TableColumn<Transaction, String> date = new TableColumn<>("Date");
        date.setCellValueFactory(c -> new ReadOnlyStringWrapper(c.getValue().dateText()));

        TableColumn<Transaction, String> description = new TableColumn<>("Description");
        description.setCellValueFactory(c -> new ReadOnlyStringWrapper(c.getValue().description()));
        description.setPrefWidth(320);

        TableColumn<Transaction, String> category = new TableColumn<>("Category");
        category.setCellValueFactory(c -> new ReadOnlyStringWrapper(c.getValue().category()));
        category.setPrefWidth(160);

        TableColumn<Transaction, String> amount = new TableColumn<>("Amount");
        amount.setCellValueFactory(
                c -> new ReadOnlyStringWrapper(ReportsView.format(c.getValue().amount(), viewModel.currency())));
        amount.setStyle("-fx-alignment: CENTER-RIGHT;");
        amount.setPrefWidth(140);

        table.getColumns().setAll(id, date, description, category, amount);
        table.setItems(viewModel.getTransactions());
        table.setPlaceholder(new Label("No transactions"));

        table.getSelectionModel().selectedItemProperty().addListener((obs, o, n) -> {
            if (n != null)
                viewModel.selectedIdProperty().set(n.id());
        });
        // Reselect by id after the list was reloaded or renumbered.
        viewModel.getTransactions().addListener((ListChangeListener<Transaction>) change -> reselect());
        viewModel.selectedIdProperty().addListener((obs, o, n) -> reselect());
        return table;
    }

    private void reselect() {
        Long wanted = viewModel.selectedIdProperty().get();
        Transaction current = table.getSelectionModel().getSelectedItem();
        if (current != null && Objects.equals(current.id(), wanted))
            return;
        if (wanted == null) {
            table.getSelectionModel().clearSelection();
            return;
        }
        table.getItems().stream()
                .filter(t -> wanted.equals(t.id()))
                .findFirst()
                .ifPresent(t -> table.getSelectionModel().select(t));
    }

    private Label buildStatusLine() {
        Label status = new Label();
        status.textProperty().bind(viewModel.statusProperty());
        status.setPadding(new Insets(4, 8, 4, 8));
        viewModel.loadFailedProperty().addListener((obs, o, failed) -> status
                .setStyle(failed ? "-fx-text-fill: #d9534f; -fx-font-weight: bold;" : ""));
        return status;
    }

    private FileChooser csvChooser(String title) {
        FileChooser chooser = new FileChooser();
        chooser.setTitle(title);
        chooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("CSV files", "*.csv"));
        return chooser;
    }

    private boolean confirm(String message) {
        Alert alert = new Alert(Alert.AlertType.CONFIRMATION, message, ButtonType.OK, ButtonType.CANCEL);
        alert.initOwner(stage);
        return alert.showAndWait().filter(b -> b == ButtonType.OK).isPresent();
    }

    private void showError(String message) {
        Alert alert = new Alert(Alert.AlertType.ERROR, message, ButtonType.OK);
        alert.initOwner(stage);
        alert.setHeaderText(null);
        alert.showAndWait();
    }
}
