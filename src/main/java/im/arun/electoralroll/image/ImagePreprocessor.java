package im.arun.electoralroll.image;

import im.arun.electoralroll.config.ElectoralRollConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;

/**
 * Prepares a rasterized page for character recognition.
 * Steps run in a fixed order: grayscale, contrast stretch, sharpen, upscale narrow pages.
 * The result depends only on the input pixels and the configured factors.
 */
public class ImagePreprocessor {
    private static final Logger logger = LoggerFactory.getLogger(ImagePreprocessor.class);

    private final double contrastFactor;
    private final double sharpnessFactor;
    private final int minimumWidth;

    public ImagePreprocessor(ElectoralRollConfig config) {
        this(config.getContrastFactor(), config.getSharpnessFactor(), config.getMinimumWidth());
    }

    public ImagePreprocessor(double contrastFactor, double sharpnessFactor, int minimumWidth) {
        this.contrastFactor = contrastFactor;
        this.sharpnessFactor = sharpnessFactor;
        this.minimumWidth = minimumWidth;
    }

    /**
     * Preprocess one page image. Never throws for image problems: when a transform fails
     * the original image is returned unchanged and the failure is logged.
     *
     * @param original  Page raster as rendered
     * @param pageIndex 1-based page number, for logging
     * @return A new processed image, or {@code original} if preprocessing failed
     */
    public BufferedImage preprocess(BufferedImage original, int pageIndex) {
        if (original == null) {
            logger.warn("Page {}: no image to preprocess", pageIndex);
            return null;
        }
        try {
            BufferedImage image = toGrayscale(original);
            image = enhanceContrast(image);
            image = sharpen(image);
            image = upscaleIfNarrow(image, pageIndex);
            logger.debug("Page {}: preprocessed to {}x{}", pageIndex, image.getWidth(), image.getHeight());
            return image;
        } catch (RuntimeException e) {
            logger.warn("Page {}: preprocessing failed, using original image: {}", pageIndex, e.getMessage());
            return original;
        }
    }

    BufferedImage toGrayscale(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage gray = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = gray.getRaster();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int rgb = source.getRGB(x, y);
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                // ITU-R 601 luma, integer arithmetic keeps results reproducible
                int luma = (r * 299 + g * 587 + b * 114 + 500) / 1000;
                raster.setSample(x, y, 0, luma);
            }
        }
        return gray;
    }

    /**
     * Moves every pixel away from the mean luminance by {@code contrastFactor}.
     */
    BufferedImage enhanceContrast(BufferedImage gray) {
        int width = gray.getWidth();
        int height = gray.getHeight();
        WritableRaster source = gray.getRaster();

        long total = 0;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                total += source.getSample(x, y, 0);
            }
        }
        int mean = (int) Math.round((double) total / ((long) width * height));

        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster target = result.getRaster();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int value = source.getSample(x, y, 0);
                target.setSample(x, y, 0, clamp(mean + contrastFactor * (value - mean)));
            }
        }
        return result;
    }

    /**
     * Unsharp blend against a 3x3 smoothed copy: {@code smooth + factor * (pixel - smooth)}.
     * Border pixels are copied unchanged.
     */
    BufferedImage sharpen(BufferedImage gray) {
        int width = gray.getWidth();
        int height = gray.getHeight();
        WritableRaster source = gray.getRaster();
        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster target = result.getRaster();

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int value = source.getSample(x, y, 0);
                if (x == 0 || y == 0 || x == width - 1 || y == height - 1) {
                    target.setSample(x, y, 0, value);
                    continue;
                }
                // same weights as the classic smooth kernel: centre 5, neighbours 1, total 13
                int sum = value * 5;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        if (dx != 0 || dy != 0) {
                            sum += source.getSample(x + dx, y + dy, 0);
                        }
                    }
                }
                double smooth = sum / 13.0;
                target.setSample(x, y, 0, clamp(smooth + sharpnessFactor * (value - smooth)));
            }
        }
        return result;
    }

    BufferedImage upscaleIfNarrow(BufferedImage image, int pageIndex) {
        int width = image.getWidth();
        if (width >= minimumWidth) {
            return image;
        }
        double scale = (double) minimumWidth / width;
        int newHeight = Math.max(1, (int) Math.round(image.getHeight() * scale));

        BufferedImage scaled = new BufferedImage(minimumWidth, newHeight, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(image, 0, 0, minimumWidth, newHeight, null);
        } finally {
            g.dispose();
        }
        logger.info("Page {}: resized image to {}x{}", pageIndex, minimumWidth, newHeight);
        return scaled;
    }

    private static int clamp(double value) {
        long rounded = Math.round(value);
        if (rounded < 0) {
            return 0;
        }
        return (int) Math.min(255, rounded);
    }
}
