package ir.ipaam.layoutservice.domain.model.valueobject;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Decoded raster image handed through to the PDF writer untouched.
 */
public final class ImageHandle {

    private final String id;
    private final BufferedImage image;

    public ImageHandle(String id, BufferedImage image) {
        this.id = Objects.requireNonNull(id, "id");
        this.image = Objects.requireNonNull(image, "image");
    }

    public static ImageHandle fromBytes(String id, byte[] data) {
        Objects.requireNonNull(data, "data");
        return fromStream(id, new ByteArrayInputStream(data));
    }

    public static ImageHandle fromStream(String id, InputStream in) {
        try (in) {
            BufferedImage bi = ImageIO.read(in);
            if (bi == null) {
                throw new IllegalArgumentException("Unsupported image format: " + id);
            }
            return new ImageHandle(id, bi);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading image " + id, e);
        }
    }

    public String getId() {
        return id;
    }

    public BufferedImage getImage() {
        return image;
    }

    public int getNaturalWidth() {
        return image.getWidth();
    }

    public int getNaturalHeight() {
        return image.getHeight();
    }

    @Override
    public String toString() {
        return "ImageHandle[" + id + ", " + image.getWidth() + "x" + image.getHeight() + "]";
    }
}
