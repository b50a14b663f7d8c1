package im.arun.electoralroll.pdf;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfBoxRasterizerTest {

    @TempDir
    Path dir;

    private final PdfBoxRasterizer rasterizer = new PdfBoxRasterizer();

    @Test
    void open_shouldRenderPagesAtRequestedResolution() throws Exception {
        Path pdf = dir.resolve("two-pages.pdf");
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage(new PDRectangle(144, 72)));
            document.addPage(new PDPage(new PDRectangle(144, 72)));
            document.save(pdf.toFile());
        }

        try (RasterizedDocument document = rasterizer.open(pdf, 144)) {
            assertThat(document.pageCount()).isEqualTo(2);
            BufferedImage page = document.render(2);
            assertThat(page.getWidth()).isEqualTo(288);
            assertThat(page.getHeight()).isEqualTo(144);
            assertThatThrownBy(() -> document.render(3)).isInstanceOf(RasterizationException.class);
        }
    }

    @Test
    void open_shouldRejectMissingFile() {
        assertThatThrownBy(() -> rasterizer.open(dir.resolve("absent.pdf"), 300))
            .isInstanceOf(RasterizationException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void open_shouldRejectFileThatIsNotPdf() throws IOException {
        Path junk = Files.writeString(dir.resolve("junk.pdf"), "this is not a pdf");

        assertThatThrownBy(() -> rasterizer.open(junk, 300))
            .isInstanceOf(RasterizationException.class)
            .hasCauseInstanceOf(IOException.class);
    }
}
