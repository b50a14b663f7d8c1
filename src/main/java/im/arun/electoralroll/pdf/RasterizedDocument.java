package im.arun.electoralroll.pdf;

import java.awt.image.BufferedImage;

/**
 * An open document whose pages are rendered on demand. Not thread-safe: render pages from one thread.
 */
public interface RasterizedDocument extends AutoCloseable {

    int pageCount();

    /**
     * @param pageIndex 1-based page number
     * @throws RasterizationException If this page cannot be rendered
     */
    BufferedImage render(int pageIndex) throws RasterizationException;

    @Override
    void close();
}
