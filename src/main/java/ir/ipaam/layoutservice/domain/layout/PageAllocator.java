package ir.ipaam.layoutservice.domain.layout;

import ir.ipaam.layoutservice.domain.exception.LayoutException;
import ir.ipaam.layoutservice.domain.model.element.Element;
import ir.ipaam.layoutservice.domain.model.page.DrawInstruction;
import ir.ipaam.layoutservice.domain.model.page.Page;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Fills pages from a queue of pending top-level elements.
 *
 * <p>In {@link State#FILLING} the next element renders into the active area. A partial
 * result puts the remainder back at the head of the queue and switches to
 * {@link State#PAGE_FULL}, as does a page break or an area whose remaining height drops
 * below the configured threshold. {@code PAGE_FULL} finalizes the page and opens a fresh
 * one. When the queue is empty the last page is kept only if something was drawn on it.
 */
@Slf4j
public class PageAllocator {

    public enum State {
        FILLING,
        PAGE_FULL
    }

    private final DocumentConfig config;
    private final PageDecorator decorator;
    private final RenderContext context;
    private final List<Page> pages = new ArrayList<>();

    private State state;
    private PageCanvas decoration;
    private PageCanvas body;
    private Area area;

    public PageAllocator(DocumentConfig config, PageDecorator decorator, RenderContext context) {
        this.config = config;
        this.decorator = decorator;
        this.context = context;
    }

    public List<Page> run(List<Element> elements) {
        Deque<Element> queue = new ArrayDeque<>(elements);
        openPage();
        while (!queue.isEmpty()) {
            if (state == State.PAGE_FULL) {
                finalizePage();
                openPage();
            }
            if (area.getRemainingHeight() < config.getMinRemainingHeight()) {
                if (area.isPageBlank()) {
                    throw new LayoutException("Page " + currentPageNumber() + " has no room for content");
                }
                state = State.PAGE_FULL;
                continue;
            }

            Element element = queue.pollFirst();
            boolean blankBefore = area.isPageBlank();
            RenderResult result = element.render(context, area.copy(), config.getDefaultStyle());
            area.consume(result.getHeight());

            if (result.isPartial()) {
                if (blankBefore && area.isPageBlank() && result.getHeight() == 0 && !result.isPageBreak()) {
                    throw new LayoutException("Element " + element.getClass().getSimpleName()
                            + " cannot be placed on an empty page " + currentPageNumber());
                }
                log.debug("Element {} continues after page {}", element.getClass().getSimpleName(), currentPageNumber());
                queue.addFirst(result.getRemainder());
                state = State.PAGE_FULL;
            } else if (result.isPageBreak()) {
                log.debug("Page break requested on page {}", currentPageNumber());
                state = State.PAGE_FULL;
            }
        }
        if (body.hasContent()) {
            finalizePage();
        }
        return getPages();
    }

    public List<Page> getPages() {
        return Collections.unmodifiableList(pages);
    }

    public State getState() {
        return state;
    }

    private int currentPageNumber() {
        return pages.size() + 1;
    }

    private void openPage() {
        int number = currentPageNumber();
        context.setPageNumber(number);
        decoration = new PageCanvas();
        body = new PageCanvas();
        Area pageArea = new Area(decoration,
                config.getMargins().left(),
                config.getMargins().top(),
                config.contentWidth(),
                config.contentHeight());
        Area bodyArea = decorator == null
                ? pageArea
                : decorator.decorate(context, pageArea, config.getDefaultStyle(), number);
        area = bodyArea.withCanvas(body);
        state = State.FILLING;
        log.debug("Opened page {} with {}pt of content height", number, area.getRemainingHeight());
    }

    private void finalizePage() {
        List<DrawInstruction> instructions = new ArrayList<>(decoration.getInstructions());
        instructions.addAll(body.getInstructions());
        Page page = new Page(currentPageNumber(), config.getPageSize(), config.getMargins(), instructions);
        pages.add(page);
        log.debug("Finalized page {} with {} draw instructions", page.number(), instructions.size());
    }
}
