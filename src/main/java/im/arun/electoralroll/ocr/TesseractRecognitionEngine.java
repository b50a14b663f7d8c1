package im.arun.electoralroll.ocr;

import im.arun.electoralroll.config.ElectoralRollConfig;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;

/**
 * {@link RecognitionEngine} backed by Tess4J. A Tesseract handle is not thread-safe,
 * so every worker thread gets its own.
 */
public class TesseractRecognitionEngine implements RecognitionEngine {
    private static final Logger logger = LoggerFactory.getLogger(TesseractRecognitionEngine.class);

    private final String datapath;
    private final String language;
    private final int ocrEngineMode;
    private final ThreadLocal<Tesseract> tesseract;

    public TesseractRecognitionEngine(ElectoralRollConfig config) {
        this(config.getTessdataPath(), config.getLanguage(), config.getOcrEngineMode());
    }

    public TesseractRecognitionEngine(String datapath, String language, int ocrEngineMode) {
        this.datapath = datapath;
        this.language = language;
        this.ocrEngineMode = ocrEngineMode;
        this.tesseract = ThreadLocal.withInitial(this::createTesseract);
    }

    private Tesseract createTesseract() {
        Tesseract instance = new Tesseract();
        if (datapath != null && !datapath.isBlank()) {
            instance.setDatapath(datapath);
        }
        instance.setLanguage(language);
        instance.setOcrEngineMode(ocrEngineMode);
        logger.debug("Created Tesseract instance for {} (lang={}, oem={})",
            Thread.currentThread().getName(), language, ocrEngineMode);
        return instance;
    }

    @Override
    public String recognize(BufferedImage image, int pageSegMode) throws RecognitionException {
        if (image == null) {
            throw new RecognitionException("no image to recognize");
        }
        Tesseract instance = tesseract.get();
        instance.setPageSegMode(pageSegMode);
        try {
            String text = instance.doOCR(image);
            return text == null ? "" : text;
        } catch (TesseractException e) {
            throw new RecognitionException("Tesseract failed with page segmentation mode " + pageSegMode, e);
        } catch (LinkageError e) {
            // missing native library
            throw new RecognitionException("Tesseract is not available: " + e.getMessage(), e);
        }
    }
}
