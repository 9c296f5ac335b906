package graph.engine.exec;

import java.util.List;

import graph.engine.catalog.ColumnSchema;
import graph.engine.catalog.GraphCatalog;
import graph.engine.error.GraphQueryException;
import graph.engine.expr.Expression;
import graph.engine.expr.ExpressionEvaluator;
import graph.engine.expr.PropertyRef;
import graph.engine.table.ColumnarTable;
import graph.engine.table.Datasets;
import graph.engine.table.Table;

/**
 * Reads the referenced columns of one dataset, qualified with the pattern variable.
 * A predicate pushed onto the scan is evaluated column-wise before any row is produced.
 * The dataset is looked up by table reference first, then by the label or type name.
 */
public class ScanOperator implements Operator {
    private final String variable;
    private final String tableReference;
    private final String bindingName;
    private final List<String> columns;
    private final Datasets datasets;
    private final Expression predicate; // may be null
    private final ExpressionEvaluator evaluator;
    private final RowSchema schema;

    private Table table;
    private int position;

    public ScanOperator(String variable, String tableReference, List<String> columns, Datasets datasets,
                        Expression predicate, ExpressionEvaluator evaluator) {
        this(variable, tableReference, tableReference, columns, datasets, predicate, evaluator);
    }

    public ScanOperator(String variable, String tableReference, String bindingName, List<String> columns,
                        Datasets datasets, Expression predicate, ExpressionEvaluator evaluator) {
        this.variable = variable;
        this.tableReference = tableReference;
        this.bindingName = bindingName;
        this.columns = List.copyOf(columns);
        this.datasets = datasets;
        this.predicate = predicate;
        this.evaluator = evaluator;
        this.schema = new RowSchema(columns.stream().map(c -> PropertyRef.qualify(variable, c)).toList());
    }

    @Override
    public void open() {
        Table source = datasets.find(tableReference)
            .or(() -> datasets.find(bindingName))
            .orElseThrow(() -> GraphQueryException.missingDataset(datasetNames()));
        for (String c : columns) {
            if (!source.hasColumn(c)) throw GraphQueryException.columnNotFound(c, tableReference);
        }
        Table selected = source.select(columns);
        ColumnarTable.Builder qualified = ColumnarTable.builder(variable);
        for (ColumnSchema cs : selected.schema()) {
            qualified.addColumn(PropertyRef.qualify(variable, cs.name()), cs.type(), selected.column(cs.name()));
        }
        Table t = qualified.build();
        table = predicate == null ? t : evaluator.filter(t, predicate);
        position = 0;
    }

    private String datasetNames() {
        return GraphCatalog.normalize(tableReference).equals(GraphCatalog.normalize(bindingName))
            ? tableReference : tableReference + " or " + bindingName;
    }

    @Override
    public Row next() {
        if (table == null || position >= table.rowCount()) return null;
        return new Row(schema, table.row(position++));
    }

    @Override
    public void close() { table = null; }

    @Override
    public RowSchema schema() { return schema; }
}
