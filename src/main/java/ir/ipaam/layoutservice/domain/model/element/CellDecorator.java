package ir.ipaam.layoutservice.domain.model.element;

import ir.ipaam.layoutservice.domain.layout.Area;
import ir.ipaam.layoutservice.domain.model.valueobject.Margins;

/**
 * Draws cell decoration such as borders. Decorators hold no per-table state, so one
 * instance can serve any number of tables and their continuations.
 */
public interface CellDecorator {

    CellDecorator NONE = (area, position, height) -> { };

    /** Space kept free around the cell content. */
    default Margins insets(CellPosition position) {
        return Margins.NONE;
    }

    /**
     * Decorates a cell once its row is complete on the current page.
     *
     * @param area   the cell's column, starting at the top of the row
     * @param height the height of the row on this page
     */
    void decorate(Area area, CellPosition position, double height);
}
