package ir.ipaam.layoutservice.api.mapper;

import ir.ipaam.layoutservice.api.dto.DocumentRequest;
import ir.ipaam.layoutservice.api.dto.ElementRequest;
import ir.ipaam.layoutservice.api.dto.SpanRequest;
import ir.ipaam.layoutservice.api.dto.StyleRequest;
import ir.ipaam.layoutservice.domain.layout.Document;
import ir.ipaam.layoutservice.domain.layout.DocumentConfig;
import ir.ipaam.layoutservice.domain.layout.PageDecorator;
import ir.ipaam.layoutservice.domain.layout.SimplePageDecorator;
import ir.ipaam.layoutservice.domain.model.element.BulletPoint;
import ir.ipaam.layoutservice.domain.model.element.Element;
import ir.ipaam.layoutservice.domain.model.element.ExternalBlock;
import ir.ipaam.layoutservice.domain.model.element.FrameCellDecorator;
import ir.ipaam.layoutservice.domain.model.element.ImageElement;
import ir.ipaam.layoutservice.domain.model.element.LinearLayout;
import ir.ipaam.layoutservice.domain.model.element.ListLayout;
import ir.ipaam.layoutservice.domain.model.element.PageBreak;
import ir.ipaam.layoutservice.domain.model.element.Paragraph;
import ir.ipaam.layoutservice.domain.model.element.Spacer;
import ir.ipaam.layoutservice.domain.model.element.TableLayout;
import ir.ipaam.layoutservice.domain.model.element.Text;
import ir.ipaam.layoutservice.domain.model.page.DrawInstruction;
import ir.ipaam.layoutservice.domain.model.page.DrawRect;
import ir.ipaam.layoutservice.domain.model.valueobject.Alignment;
import ir.ipaam.layoutservice.domain.model.valueobject.ImageHandle;
import ir.ipaam.layoutservice.domain.model.valueobject.Margins;
import ir.ipaam.layoutservice.domain.model.valueobject.PageSize;
import ir.ipaam.layoutservice.domain.model.valueobject.RgbColor;
import ir.ipaam.layoutservice.domain.model.valueobject.Span;
import ir.ipaam.layoutservice.domain.model.valueobject.Style;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/** Turns request DTOs into the domain element tree. */
public final class DocumentRequestMapper {

    private DocumentRequestMapper() {}

    public static Document toDocument(DocumentRequest request, DocumentConfig defaults, Locale hyphenationLocale) {
        DocumentConfig.DocumentConfigBuilder config = defaults.toBuilder();
        if (request.getPageWidth() != null || request.getPageHeight() != null) {
            PageSize size = defaults.getPageSize();
            config.pageSize(new PageSize(
                    request.getPageWidth() != null ? request.getPageWidth() : size.width(),
                    request.getPageHeight() != null ? request.getPageHeight() : size.height()));
        }
        if (request.getMargins() != null) {
            DocumentRequest.MarginsRequest m = request.getMargins();
            config.margins(new Margins(m.getTop(), m.getRight(), m.getBottom(), m.getLeft()));
        }
        if (request.getDefaultStyle() != null) {
            config.defaultStyle(defaults.getDefaultStyle().and(toStyle(request.getDefaultStyle())));
        }
        if (request.getHyphenate() != null) {
            config.hyphenationLocale(request.getHyphenate() ? hyphenationLocale : null);
        }
        Document document = new Document(config.build());
        for (ElementRequest element : request.getElements()) {
            document.push(toElement(element));
        }
        return document;
    }

    /** {@code null} when the request asks for neither a header nor page numbers. */
    public static PageDecorator toDecorator(DocumentRequest request) {
        if (request.getHeader() == null && !request.isPageNumbers()) {
            return null;
        }
        Element header = request.getHeader() != null ? toElement(request.getHeader()) : null;
        return new SimplePageDecorator(header, request.isPageNumbers());
    }

    public static String fileName(DocumentRequest request) {
        String name = request.getFileName();
        if (name == null || name.isBlank()) {
            return "document.pdf";
        }
        return name.toLowerCase(Locale.ROOT).endsWith(".pdf") ? name : name + ".pdf";
    }

    public static Element toElement(ElementRequest request) {
        Element element = toBareElement(request);
        if (request.getStyle() != null) {
            element = element.styled(toStyle(request.getStyle()));
        }
        if (request.isFramed()) {
            element = element.framed();
        }
        if (request.getPadding() != null && request.getPadding() > 0) {
            element = element.padded(request.getPadding());
        }
        return element;
    }

    private static Element toBareElement(ElementRequest request) {
        if (request instanceof ElementRequest.ParagraphRequest p) {
            List<Span> spans = new ArrayList<>();
            for (SpanRequest span : p.getSpans()) {
                spans.add(new Span(span.getText(), toStyle(span.getStyle())));
            }
            if (p.getText() != null) {
                spans.add(Span.of(p.getText()));
            }
            return new Paragraph(spans, toAlignment(p.getAlignment()), Style.empty());
        }
        if (request instanceof ElementRequest.TextRequest t) {
            return new Text(t.getText(), Style.empty(), toAlignment(t.getAlignment()));
        }
        if (request instanceof ElementRequest.ContainerRequest c) {
            return toContainer(c);
        }
        if (request instanceof ElementRequest.TableRequest t) {
            return toTable(t);
        }
        if (request instanceof ElementRequest.ListRequest l) {
            ListLayout list = l.isOrdered()
                    ? ListLayout.ordered(l.getStart() != null ? l.getStart() : 1)
                    : ListLayout.unordered(l.getBullet() != null ? l.getBullet() : BulletPoint.DEFAULT_BULLET);
            l.getItems().forEach(item -> list.push(toElement(item)));
            return list;
        }
        if (request instanceof ElementRequest.ImageRequest i) {
            byte[] data = Base64.getDecoder().decode(i.getData());
            ImageHandle image = ImageHandle.fromBytes("image-" + Integer.toHexString(i.getData().hashCode()), data);
            return new ImageElement(image, i.getWidth(), i.getHeight(), toAlignment(i.getAlignment()));
        }
        if (request instanceof ElementRequest.BreakRequest) {
            return PageBreak.INSTANCE;
        }
        if (request instanceof ElementRequest.SpacerRequest s) {
            if (s.getPoints() != null) {
                return Spacer.points(s.getPoints());
            }
            return Spacer.lines(s.getLines() != null ? s.getLines() : 1);
        }
        if (request instanceof ElementRequest.ExternalRequest e) {
            List<DrawInstruction> instructions = new ArrayList<>();
            for (ElementRequest.RectRequest rect : e.getRects()) {
                RgbColor fill = rect.getColor() != null ? RgbColor.parse(rect.getColor()) : RgbColor.BLACK;
                instructions.add(new DrawRect(rect.getX(), rect.getY(), rect.getWidth(), rect.getHeight(), fill));
            }
            return new ExternalBlock(e.getKind(), e.getWidth(), e.getHeight(), instructions, toAlignment(e.getAlignment()));
        }
        throw new IllegalArgumentException("Unsupported element type: " + request.getClass().getSimpleName());
    }

    private static Element toContainer(ElementRequest.ContainerRequest request) {
        boolean horizontal = "horizontal".equalsIgnoreCase(request.getOrientation());
        LinearLayout layout;
        if (horizontal) {
            double[] weights = request.getWeights() != null
                    ? request.getWeights().stream().mapToDouble(Double::doubleValue).toArray()
                    : equalWeights(request.getChildren().size());
            if (request.getChildren().size() > weights.length) {
                throw new IllegalArgumentException("Horizontal container has " + request.getChildren().size()
                        + " children but only " + weights.length + " weights");
            }
            layout = LinearLayout.horizontal(weights);
        } else {
            layout = LinearLayout.vertical();
        }
        request.getChildren().forEach(child -> layout.push(toElement(child)));
        return layout;
    }

    private static Element toTable(ElementRequest.TableRequest request) {
        TableLayout table;
        if (request.getWeights() != null) {
            table = new TableLayout(request.getWeights().stream().mapToDouble(Double::doubleValue).toArray());
        } else {
            int columns = request.getColumns() != null
                    ? request.getColumns()
                    : request.getRows().isEmpty() ? 0 : request.getRows().get(0).size();
            table = TableLayout.equalColumns(columns);
        }
        if (request.isBorders()) {
            table = table.withDecorator(new FrameCellDecorator(true, true, true));
        }
        for (List<ElementRequest> row : request.getRows()) {
            table.push(row.stream().map(DocumentRequestMapper::toElement).toList());
        }
        return table;
    }

    private static double[] equalWeights(int count) {
        double[] weights = new double[Math.max(count, 1)];
        Arrays.fill(weights, 1);
        return weights;
    }

    public static Style toStyle(StyleRequest request) {
        if (request == null) {
            return Style.empty();
        }
        return Style.builder()
                .fontFamily(request.getFontFamily())
                .fontSize(request.getFontSize())
                .bold(request.getBold())
                .italic(request.getItalic())
                .underline(request.getUnderline())
                .strikethrough(request.getStrikethrough())
                .color(request.getColor() != null ? RgbColor.parse(request.getColor()) : null)
                .lineSpacing(request.getLineSpacing())
                .build();
    }

    private static Alignment toAlignment(String value) {
        if (value == null || value.isBlank()) {
            return Alignment.LEFT;
        }
        return Alignment.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
