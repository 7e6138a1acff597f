package ir.ipaam.layoutservice.domain.exception;

import ir.ipaam.layoutservice.domain.model.page.Page;

import java.util.List;

/**
 * Wraps a fatal error raised while driving a document. The pages finalized before the
 * failing element are complete and stay available to the caller.
 */
public class PaginationException extends LayoutException {

    private final List<Page> completedPages;

    public PaginationException(LayoutException cause, List<Page> completedPages) {
        super(cause.getMessage(), cause);
        this.completedPages = List.copyOf(completedPages);
    }

    public List<Page> getCompletedPages() {
        return completedPages;
    }

    @Override
    public synchronized LayoutException getCause() {
        return (LayoutException) super.getCause();
    }
}
