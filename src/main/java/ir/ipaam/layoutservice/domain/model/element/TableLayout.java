package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.exception.MalformedTableException;
import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.layout.PageCanvas;
import ir.ipaam.layoutservice.domain.layout.RenderContext;
import ir.ipaam.layoutservice.domain.layout.RenderResult;
import ir.ipaam.layoutservice.domain.model.valueobject.Margins;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A grid of cells with column widths proportional to fixed weights.
 *
 * <p>Rows are atomic: a row that does not fit the rest of the page moves to the next
 * page as a whole. Only a row that does not fit even on an empty page is split; its
 * cells continue on the next page in a continuation row.
 */
@Slf4j
public class TableLayout implements Element {

    private final double[] weights;
    private final List<List<Element>> rows;
    private final CellDecorator decorator;
    private final int firstRow;
    private final boolean continued;

    public TableLayout(double... weights) {
        this(validated(weights), new ArrayList<>(), CellDecorator.NONE, 0, false);
    }

    private TableLayout(double[] weights, List<List<Element>> rows, CellDecorator decorator,
                        int firstRow, boolean continued) {
        this.weights = weights;
        this.rows = rows;
        this.decorator = decorator;
        this.firstRow = firstRow;
        this.continued = continued;
    }

    public static TableLayout equalColumns(int columns) {
        if (columns <= 0) {
            throw new MalformedTableException("A table needs at least one column, got " + columns);
        }
        double[] weights = new double[columns];
        Arrays.fill(weights, 1);
        return new TableLayout(weights);
    }

    private static double[] validated(double[] weights) {
        if (weights == null || weights.length == 0) {
            throw new MalformedTableException("A table needs at least one column");
        }
        double total = 0;
        for (double w : weights) {
            if (Double.isNaN(w) || Double.isInfinite(w) || w < 0) {
                throw new MalformedTableException("Invalid column weight: " + w);
            }
            total += w;
        }
        if (total <= 0) {
            throw new MalformedTableException("Column weights must not all be zero");
        }
        return weights.clone();
    }

    public TableLayout withDecorator(CellDecorator cellDecorator) {
        return new TableLayout(weights, new ArrayList<>(rows), cellDecorator == null ? CellDecorator.NONE : cellDecorator,
                firstRow, continued);
    }

    public TableLayout push(List<? extends Element> row) {
        if (row.size() != weights.length) {
            throw new MalformedTableException("Row " + rows.size() + " has " + row.size()
                    + " cells but the table has " + weights.length + " columns");
        }
        rows.add(List.copyOf(row));
        return this;
    }

    public RowBuilder row() {
        return new RowBuilder();
    }

    public int getColumnCount() {
        return weights.length;
    }

    public List<List<Element>> getRows() {
        return Collections.unmodifiableList(rows);
    }

    @Override
    public RenderResult render(RenderContext context, Area area, Style style) {
        int rowCount = firstRow + rows.size();
        double used = 0;
        for (int i = 0; i < rows.size(); i++) {
            int index = firstRow + i;
            boolean blank = area.isPageBlank();
            boolean rowContinued = continued && i == 0;
            RowOutcome outcome = renderRow(context, area, style, rows.get(i), index, rowCount, rowContinued);

            if (outcome.complete()) {
                outcome.commit();
                area.consume(outcome.height());
                used += outcome.height();
                continue;
            }
            if (blank) {
                log.debug("Table row {} is taller than a page and is split", index);
                outcome.commit();
                area.consume(outcome.height());
                used += outcome.height();
                List<List<Element>> rest = new ArrayList<>();
                rest.add(outcome.remainderRow());
                rest.addAll(rows.subList(i + 1, rows.size()));
                return RenderResult.partial(used, new TableLayout(weights, rest, decorator, index, true));
            }
            log.debug("Table row {} does not fit on page {} and is deferred", index, context.getPageNumber());
            if (i == 0) {
                return RenderResult.nothingFits(this);
            }
            return RenderResult.partial(used, new TableLayout(weights,
                    new ArrayList<>(rows.subList(i, rows.size())), decorator, index, true));
        }
        return RenderResult.done(used);
    }

    private RowOutcome renderRow(RenderContext context, Area area, Style style, List<Element> row,
                                 int index, int rowCount, boolean rowContinued) {
        List<PageCanvas> canvases = new ArrayList<>();
        List<Area> columns = area.splitHorizontally(weights);
        List<Element> remainders = new ArrayList<>();
        List<CellPosition> positions = new ArrayList<>();
        double height = 0;
        boolean complete = true;
        for (int c = 0; c < row.size(); c++) {
            PageCanvas canvas = area.getCanvas().fork();
            canvases.add(canvas);
            CellPosition position = new CellPosition(c, index, weights.length, rowCount, rowContinued, false);
            Margins insets = decorator.insets(position);
            Area cellArea = columns.get(c).withCanvas(canvas).inset(insets);
            Element cell = row.get(c);
            RenderResult result = cell.render(context, cellArea, style);
            height = Math.max(height, result.getHeight() + insets.vertical());
            if (result.isPartial()) {
                complete = false;
                remainders.add(result.getRemainder());
            } else {
                remainders.add(LinearLayout.vertical());
            }
            positions.add(position);
        }
        height = Math.min(height, area.getRemainingHeight());
        return new RowOutcome(canvases, columns, positions, remainders, height, complete);
    }

    private final class RowOutcome {
        private final List<PageCanvas> canvases;
        private final List<Area> columns;
        private final List<CellPosition> positions;
        private final List<Element> remainders;
        private final double height;
        private final boolean complete;

        RowOutcome(List<PageCanvas> canvases, List<Area> columns, List<CellPosition> positions,
                   List<Element> remainders, double height, boolean complete) {
            this.canvases = canvases;
            this.columns = columns;
            this.positions = positions;
            this.remainders = remainders;
            this.height = height;
            this.complete = complete;
        }

        boolean complete() {
            return complete;
        }

        double height() {
            return height;
        }

        List<Element> remainderRow() {
            return List.copyOf(remainders);
        }

        void commit() {
            for (int c = 0; c < canvases.size(); c++) {
                CellPosition p = positions.get(c);
                CellPosition position = new CellPosition(p.column(), p.row(), p.columnCount(), p.rowCount(),
                        p.continued(), !complete);
                decorator.decorate(columns.get(c).withCanvas(canvases.get(c)), position, height);
                canvases.get(c).commit();
            }
        }
    }

    /** Collects the cells of one row and appends it to the table. */
    public final class RowBuilder {
        private final List<Element> cells = new ArrayList<>();

        private RowBuilder() {
        }

        public RowBuilder element(Element cell) {
            cells.add(cell);
            return this;
        }

        public RowBuilder text(String text) {
            return element(new Paragraph(text));
        }

        public TableLayout push() {
            return TableLayout.this.push(cells);
        }
    }
}
