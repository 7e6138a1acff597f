package ir.ipaam.layoutservice.domain.model.valueobject;

public record Margins(double top, double right, double bottom, double left) {

    public static final Margins NONE = new Margins(0, 0, 0, 0);

    public Margins {
        if (top < 0 || right < 0 || bottom < 0 || left < 0) {
            throw new IllegalArgumentException("Margins must not be negative");
        }
    }

    public static Margins all(double value) {
        return new Margins(value, value, value, value);
    }

    public static Margins trbl(double top, double right, double bottom, double left) {
        return new Margins(top, right, bottom, left);
    }

    public static Margins vh(double vertical, double horizontal) {
        return new Margins(vertical, horizontal, vertical, horizontal);
    }

    public double horizontal() {
        return left + right;
    }

    public double vertical() {
        return top + bottom;
    }

    public Margins withBottom(double value) {
        return new Margins(top, right, value, left);
    }
}
