package ir.ipaam.layoutservice.application.service.pdf;

import ir.ipaam.layoutservice.application.service.font.PdfBoxFontMetrics;
import ir.ipaam.layoutservice.domain.layout.DocumentWriter;
import ir.ipaam.layoutservice.domain.model.page.DrawImage;
import ir.ipaam.layoutservice.domain.model.page.DrawInstruction;
import ir.ipaam.layoutservice.domain.model.page.DrawLine;
import ir.ipaam.layoutservice.domain.model.page.DrawRect;
import ir.ipaam.layoutservice.domain.model.page.DrawText;
import ir.ipaam.layoutservice.domain.model.page.Page;
import ir.ipaam.layoutservice.domain.model.valueobject.ImageHandle;
import ir.ipaam.layoutservice.domain.model.valueobject.Point;
import ir.ipaam.layoutservice.domain.model.valueobject.RgbColor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes pages with PDFBox. Layout coordinates have their origin at the top-left, so
 * every y is flipped against the page height.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PdfBoxDocumentWriter implements DocumentWriter {

    private final PdfBoxFontMetrics fontMetrics;

    @Override
    public byte[] write(List<Page> pages) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream();
             PDDocument doc = new PDDocument()) {

            if (pages.isEmpty()) {
                // a PDF needs at least one page
                doc.addPage(new PDPage(PDRectangle.A4));
            }
            Map<String, PDImageXObject> images = new HashMap<>();
            for (Page page : pages) {
                float height = (float) page.size().height();
                PDPage pdPage = new PDPage(new PDRectangle((float) page.size().width(), height));
                doc.addPage(pdPage);
                try (PDPageContentStream content = new PDPageContentStream(doc, pdPage)) {
                    for (DrawInstruction instruction : page.instructions()) {
                        draw(doc, content, instruction, height, images);
                    }
                }
            }

            doc.save(out);
            log.debug("Wrote {} pages, {} bytes", Math.max(1, pages.size()), out.size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write PDF", e);
        }
    }

    private void draw(PDDocument doc, PDPageContentStream content, DrawInstruction instruction,
                      float pageHeight, Map<String, PDImageXObject> images) throws IOException {
        if (instruction instanceof DrawText text) {
            String glyphs = printable(text.text());
            if (glyphs.isEmpty()) {
                return;
            }
            setFill(content, text.style().resolvedColor());
            content.beginText();
            content.setFont(fontMetrics.pdFont(text.font()), (float) text.style().resolvedFontSize());
            content.newLineAtOffset((float) text.x(), pageHeight - (float) text.baselineY());
            content.showText(glyphs);
            content.endText();
        } else if (instruction instanceof DrawRect rect) {
            setFill(content, rect.fill());
            content.addRect((float) rect.x(), pageHeight - (float) (rect.y() + rect.height()),
                    (float) rect.width(), (float) rect.height());
            content.fill();
        } else if (instruction instanceof DrawLine line) {
            RgbColor c = line.lineStyle().color();
            content.setStrokingColor(c.red() / 255f, c.green() / 255f, c.blue() / 255f);
            content.setLineWidth((float) line.lineStyle().thickness());
            List<Point> points = line.points();
            content.moveTo((float) points.get(0).x(), pageHeight - (float) points.get(0).y());
            for (int i = 1; i < points.size(); i++) {
                content.lineTo((float) points.get(i).x(), pageHeight - (float) points.get(i).y());
            }
            content.stroke();
        } else if (instruction instanceof DrawImage image) {
            ImageHandle handle = image.image();
            PDImageXObject pdImage = images.get(handle.getId());
            if (pdImage == null) {
                pdImage = LosslessFactory.createFromImage(doc, handle.getImage());
                images.put(handle.getId(), pdImage);
            }
            content.drawImage(pdImage, (float) image.x(), pageHeight - (float) (image.y() + image.height()),
                    (float) image.width(), (float) image.height());
        } else {
            log.warn("Skipping unsupported draw instruction {}", instruction.getClass().getSimpleName());
        }
    }

    private static void setFill(PDPageContentStream content, RgbColor color) throws IOException {
        content.setNonStrokingColor(color.red() / 255f, color.green() / 255f, color.blue() / 255f);
    }

    private static String printable(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints()
                .filter(cp -> !Character.isISOControl(cp) && cp != 0x2028 && cp != 0x2029)
                .forEach(sb::appendCodePoint);
        return sb.toString();
    }
}
