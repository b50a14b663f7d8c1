package im.arun.electoralroll.pdf;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * PDF rasterizer using Apache PDFBox.
 */
public class PdfBoxRasterizer implements PageRasterizer {
    private static final Logger logger = LoggerFactory.getLogger(PdfBoxRasterizer.class);

    @Override
    public RasterizedDocument open(Path documentPath, int dpi) throws RasterizationException {
        if (!Files.isRegularFile(documentPath)) {
            throw new RasterizationException("PDF file not found: " + documentPath);
        }
        try {
            PDDocument document = Loader.loadPDF(documentPath.toFile());
            logger.info("Opened {} ({} pages) for rendering at {} DPI",
                documentPath.getFileName(), document.getNumberOfPages(), dpi);
            return new PdfBoxDocument(document, dpi);
        } catch (IOException e) {
            throw new RasterizationException("Cannot read PDF " + documentPath + ": " + e.getMessage(), e);
        }
    }

    private static class PdfBoxDocument implements RasterizedDocument {
        private final PDDocument document;
        private final PDFRenderer renderer;
        private final int dpi;

        PdfBoxDocument(PDDocument document, int dpi) {
            this.document = document;
            this.renderer = new PDFRenderer(document);
            this.dpi = dpi;
        }

        @Override
        public int pageCount() {
            return document.getNumberOfPages();
        }

        @Override
        public BufferedImage render(int pageIndex) throws RasterizationException {
            if (pageIndex < 1 || pageIndex > pageCount()) {
                throw new RasterizationException("Page " + pageIndex + " out of range 1.." + pageCount());
            }
            try {
                return renderer.renderImageWithDPI(pageIndex - 1, dpi, ImageType.RGB);
            } catch (IOException | RuntimeException e) {
                throw new RasterizationException("Cannot render page " + pageIndex + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            try {
                document.close();
            } catch (IOException e) {
                logger.warn("Failed to close PDF document: {}", e.getMessage());
            }
        }
    }
}
