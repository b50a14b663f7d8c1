package im.arun.electoralroll.pdf;

import java.nio.file.Path;

/**
 * Opens a document for page-by-page rendering at a fixed resolution.
 */
public interface PageRasterizer {

    /**
     * @throws RasterizationException If the file is missing, unreadable or not a document
     */
    RasterizedDocument open(Path documentPath, int dpi) throws RasterizationException;
}
