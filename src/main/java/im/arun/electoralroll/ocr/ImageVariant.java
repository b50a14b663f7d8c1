package im.arun.electoralroll.ocr;

/**
 * Which raster of a page a recognition strategy reads.
 */
public enum ImageVariant {
    PROCESSED,
    ORIGINAL
}
