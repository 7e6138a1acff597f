package ir.ipaam.layoutservice.domain.model.element;

/**
 * Where a cell sits in its table. {@code continued} is set on the first row drawn on a
 * page after the table broke; {@code split} on a row whose cells continue on the next page.
 */
public record CellPosition(int column, int row, int columnCount, int rowCount, boolean continued, boolean split) {

    public boolean isFirstColumn() {
        return column == 0;
    }

    public boolean isLastColumn() {
        return column == columnCount - 1;
    }

    public boolean isFirstRow() {
        return row == 0;
    }

    public boolean isLastRow() {
        return row == rowCount - 1;
    }
}
