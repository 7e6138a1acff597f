package ir.ipaam.layoutservice.domain.layout;

import ir.ipaam.layoutservice.domain.model.page.Page;

import java.util.List;

/** Serializes finalized pages; the layout core never produces bytes itself. */
public interface DocumentWriter {

    byte[] write(List<Page> pages);
}
