package ir.ipaam.layoutservice.domain.model.page;

import ir.ipaam.layoutservice.domain.model.valueobject.Margins;
import ir.ipaam.layoutservice.domain.model.valueobject.PageSize;

import java.util.List;
import java.util.TreeMap;

/**
 * A finalized page: its dimensions and the draw instructions in draw order.
 */
public record Page(int number, PageSize size, Margins margins, List<DrawInstruction> instructions) {

    public Page {
        instructions = List.copyOf(instructions);
    }

    public List<DrawText> textRuns() {
        return instructions.stream()
                .filter(DrawText.class::isInstance)
                .map(DrawText.class::cast)
                .toList();
    }

    /**
     * Text runs grouped by baseline, top to bottom, runs on one baseline joined left to right.
     */
    public List<String> textLines() {
        TreeMap<Double, TreeMap<Double, String>> byBaseline = new TreeMap<>();
        for (DrawText run : textRuns()) {
            byBaseline.computeIfAbsent(run.baselineY(), k -> new TreeMap<>())
                    .merge(run.x(), run.text(), String::concat);
        }
        return byBaseline.values().stream()
                .map(Page::joinRuns)
                .toList();
    }

    private static String joinRuns(TreeMap<Double, String> runs) {
        StringBuilder line = new StringBuilder();
        for (String run : runs.values()) {
            boolean needsGap = line.length() > 0
                    && !Character.isWhitespace(line.charAt(line.length() - 1))
                    && !run.isEmpty() && !Character.isWhitespace(run.charAt(0));
            if (needsGap) {
                line.append(' ');
            }
            line.append(run);
        }
        return line.toString().strip();
    }
}
