package dev.nuclr.spherify.image;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Set;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.stream.ImageInputStream;

import lombok.extern.slf4j.Slf4j;

/**
 * Image decode, encode and raw-byte conversion on top of {@code javax.imageio}.
 *
 * <p>Every loaded image is normalised to non-premultiplied RGBA regardless of
 * its source colour model. Raw bytes are row-major {@code R,G,B,A} per pixel.
 */
@Slf4j
public final class ImageGateway {

    /** Formats whose ImageIO writers reject an alpha channel. */
    private static final Set<String> OPAQUE_FORMATS = Set.of("jpg", "jpeg", "bmp", "wbmp");

    // -------------------------------------------------------------------------
    // Load

    /**
     * Decodes {@code path} into an RGBA raster.
     *
     * <p>A file whose header decodes but whose pixel data ends early or is
     * damaged still loads: pixels the decoder never reached stay transparent
     * black and a warning is logged.
     *
     * @throws ImageLoadException {@code UNREADABLE} if the file is missing or not
     *         readable, {@code UNRECOGNIZED} if no decoder accepts its content
     */
    public RgbaImage load(Path path) throws ImageLoadException {
        if (!Files.exists(path)) {
            throw new ImageLoadException(ImageLoadException.Kind.UNREADABLE, path,
                    "No such file: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new ImageLoadException(ImageLoadException.Kind.UNREADABLE, path,
                    "No read permissions for file " + path);
        }

        BufferedImage decoded;
        try (InputStream raw = Files.newInputStream(path);
             ImageInputStream in = ImageIO.createImageInputStream(raw)) {
            log.debug("Opening {} ({} bytes)", path, Files.size(path));
            Iterator<ImageReader> readers = in == null ? null : ImageIO.getImageReaders(in);
            if (readers == null || !readers.hasNext()) {
                throw new ImageLoadException(ImageLoadException.Kind.UNRECOGNIZED, path,
                        "Could not identify image " + path);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                decoded = decode(reader, path);
            } finally {
                reader.dispose();
            }
        } catch (AccessDeniedException | NoSuchFileException e) {
            throw new ImageLoadException(ImageLoadException.Kind.UNREADABLE, path,
                    "Cannot read " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ImageLoadException(ImageLoadException.Kind.UNRECOGNIZED, path,
                    "Could not decode " + path + ": " + e.getMessage(), e);
        }

        RgbaImage image = fromBufferedImage(decoded);
        log.debug("Image of size {} x {} pixels loaded", image.width(), image.height());
        return image;
    }

    /**
     * Reads the first image into a destination allocated from the header, so
     * the rows decoded before a data error survive it.
     *
     * @throws IOException if the header itself cannot be decoded
     */
    private static BufferedImage decode(ImageReader reader, Path path) throws IOException {
        int width = reader.getWidth(0);
        int height = reader.getHeight(0);
        if ((long) width * height * RgbaImage.BYTES_PER_PIXEL > Integer.MAX_VALUE) {
            throw new IIOException("Image of " + width + "x" + height + " pixels is too large");
        }
        Iterator<ImageTypeSpecifier> types = reader.getImageTypes(0);
        if (!types.hasNext()) {
            return reader.read(0);
        }
        BufferedImage destination = types.next().createBufferedImage(width, height);
        ImageReadParam param = reader.getDefaultReadParam();
        param.setDestination(destination);
        try {
            return reader.read(0, param);
        } catch (IOException e) {
            log.warn("Image {} is truncated or damaged ({}); using the {} x {} pixels decoded so far",
                    path, e.getMessage(), width, height);
            return destination;
        }
    }

    // -------------------------------------------------------------------------
    // Raw bytes

    /** Returns a copy of the image's raw RGBA bytes. */
    public byte[] toBytes(RgbaImage image) {
        return image.pixels().clone();
    }

    /**
     * Builds an image from raw RGBA bytes. The array is copied.
     *
     * @throws IllegalArgumentException if {@code bytes.length != width * height * 4}
     */
    public RgbaImage fromBytes(byte[] bytes, int width, int height) {
        return new RgbaImage(width, height, bytes.clone());
    }

    // -------------------------------------------------------------------------
    // Save

    /**
     * Encodes the image in the format named by the destination's extension.
     * Missing parent directories are created.
     *
     * @throws ImageWriteException if the extension has no writer or the file
     *         cannot be written
     */
    public void save(RgbaImage image, Path path) throws ImageWriteException {
        String format = extension(path);
        if (format.isEmpty()) {
            throw new ImageWriteException(path, "no file extension to pick an image format from");
        }
        BufferedImage buffered = OPAQUE_FORMATS.contains(format)
                ? toOpaque(toBufferedImage(image))
                : toBufferedImage(image);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!ImageIO.write(buffered, format, path.toFile())) {
                throw new ImageWriteException(path, "no image writer for format '" + format + "'");
            }
        } catch (ImageWriteException e) {
            throw e;
        } catch (IOException e) {
            throw new ImageWriteException(path, e);
        }
    }

    // -------------------------------------------------------------------------
    // BufferedImage conversion

    /** Converts any decoded image to RGBA bytes via its sRGB ARGB view. */
    public static RgbaImage fromBufferedImage(BufferedImage img) {
        int w = img.getWidth();
        int h = img.getHeight();
        int[] argb = img.getRGB(0, 0, w, h, null, 0, w);
        byte[] rgba = new byte[argb.length * RgbaImage.BYTES_PER_PIXEL];
        for (int i = 0, j = 0; i < argb.length; i++) {
            int p = argb[i];
            rgba[j++] = (byte) (p >>> 16);
            rgba[j++] = (byte) (p >>> 8);
            rgba[j++] = (byte) p;
            rgba[j++] = (byte) (p >>> 24);
        }
        return new RgbaImage(w, h, rgba);
    }

    public static BufferedImage toBufferedImage(RgbaImage image) {
        int w = image.width();
        int h = image.height();
        byte[] rgba = image.pixels();
        int[] argb = new int[w * h];
        for (int i = 0, j = 0; i < argb.length; i++, j += RgbaImage.BYTES_PER_PIXEL) {
            argb[i] = (rgba[j + 3] & 0xFF) << 24
                    | (rgba[j] & 0xFF) << 16
                    | (rgba[j + 1] & 0xFF) << 8
                    | (rgba[j + 2] & 0xFF);
        }
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        out.setRGB(0, 0, w, h, argb, 0, w);
        return out;
    }

    private static BufferedImage toOpaque(BufferedImage argb) {
        BufferedImage rgb = new BufferedImage(argb.getWidth(), argb.getHeight(), BufferedImage.TYPE_INT_RGB);
        var g = rgb.createGraphics();
        try {
            g.drawImage(argb, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    static String extension(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return "";
        }
        String s = name.toString();
        int dot = s.lastIndexOf('.');
        return dot >= 0 ? s.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }
}
