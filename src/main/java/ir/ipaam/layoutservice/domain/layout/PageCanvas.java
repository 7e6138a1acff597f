package ir.ipaam.layoutservice.domain.layout;

import ir.ipaam.layoutservice.domain.model.page.DrawInstruction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Draw-instruction sink for the page being filled. A fork collects instructions
 * tentatively; they reach the parent only on {@link #commit()}. Besides the
 * instructions a canvas remembers whether any vertical space was taken on it, so that
 * a page holding only empty space no longer counts as fresh.
 */
public class PageCanvas {

    private final PageCanvas parent;
    private final List<DrawInstruction> instructions = new ArrayList<>();
    private boolean spaceTaken;

    public PageCanvas() {
        this(null);
    }

    private PageCanvas(PageCanvas parent) {
        this.parent = parent;
    }

    public void add(DrawInstruction instruction) {
        instructions.add(instruction);
    }

    public PageCanvas fork() {
        return new PageCanvas(this);
    }

    public void commit() {
        if (parent == null) {
            throw new IllegalStateException("Root canvas has nothing to commit to");
        }
        parent.instructions.addAll(instructions);
        parent.spaceTaken |= spaceTaken;
        instructions.clear();
    }

    void markSpaceTaken() {
        spaceTaken = true;
    }

    /** True when space was taken or content drawn here or on any canvas this was forked from. */
    public boolean isUsed() {
        return spaceTaken || !instructions.isEmpty() || (parent != null && parent.isUsed());
    }

    /** True when this canvas or any canvas it was forked from holds instructions. */
    public boolean hasContent() {
        return !instructions.isEmpty() || (parent != null && parent.hasContent());
    }

    public int size() {
        return instructions.size();
    }

    public List<DrawInstruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }
}
