package ir.ipaam.layoutservice.domain.layout;

import ir.ipaam.layoutservice.domain.model.element.Element;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Configuration plus the top-level elements of a document. Laying a document out never
 * modifies it, so the same instance can be laid out again, for example with another
 * page size through {@link #withConfig(DocumentConfig)}.
 */
@Getter
public class Document {

    private final DocumentConfig config;
    private final List<Element> elements;

    public Document(DocumentConfig config) {
        this(config, List.of());
    }

    public Document(DocumentConfig config, List<? extends Element> elements) {
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
        this.elements = new ArrayList<>(elements);
    }

    public Document push(Element element) {
        elements.add(Objects.requireNonNull(element, "element"));
        return this;
    }

    public Document withConfig(DocumentConfig other) {
        return new Document(other, elements);
    }

    public List<Element> getElements() {
        return Collections.unmodifiableList(elements);
    }
}
