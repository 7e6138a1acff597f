package ir.ipaam.layoutservice.domain.model.valueobject;

import java.util.Locale;

public record RgbColor(int red, int green, int blue) {

    public static final RgbColor BLACK = new RgbColor(0, 0, 0);
    public static final RgbColor WHITE = new RgbColor(255, 255, 255);
    public static final RgbColor GRAY = new RgbColor(0x80, 0x80, 0x80);

    public RgbColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " channel out of range: " + value);
        }
    }

    /**
     * Parses {@code #RGB}, {@code #RRGGBB} or one of a few color names.
     */
    public static RgbColor parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Color value is empty");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith("#")) {
            String hex = v.substring(1);
            try {
                if (hex.length() == 3) {
                    int r = Integer.parseInt(hex.substring(0, 1) + hex.substring(0, 1), 16);
                    int g = Integer.parseInt(hex.substring(1, 2) + hex.substring(1, 2), 16);
                    int b = Integer.parseInt(hex.substring(2, 3) + hex.substring(2, 3), 16);
                    return new RgbColor(r, g, b);
                } else if (hex.length() == 6) {
                    int rgb = Integer.parseInt(hex, 16);
                    return new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed color: " + value, e);
            }
            throw new IllegalArgumentException("Malformed color: " + value);
        }
        return switch (v) {
            case "black" -> BLACK;
            case "white" -> WHITE;
            case "red" -> new RgbColor(0xFF, 0, 0);
            case "green" -> new RgbColor(0, 0xAA, 0);
            case "blue" -> new RgbColor(0, 0, 0xFF);
            case "gray", "grey" -> GRAY;
            default -> throw new IllegalArgumentException("Unknown color: " + value);
        };
    }
}
