package ir.ipaam.layoutservice.domain.model.page;

/**
 * One positioned drawing operation. Coordinates are page points measured from the
 * top-left corner, y growing downwards.
 */
public interface DrawInstruction {

    DrawInstruction translate(double dx, double dy);
}
