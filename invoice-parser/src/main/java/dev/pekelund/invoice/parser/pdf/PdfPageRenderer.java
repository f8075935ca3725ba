package dev.pekelund.invoice.parser.pdf;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rasterises the first page of a PDF with PDFBox and encodes it as a JPEG of a fixed size.
 * The page is stretched to the target size; its aspect ratio is not preserved.
 */
public class PdfPageRenderer {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfPageRenderer.class);

    private final int dpi;
    private final int width;
    private final int height;
    private final float jpegQuality;

    public PdfPageRenderer(int dpi, int width, int height, float jpegQuality) {
        this.dpi = dpi;
        this.width = width;
        this.height = height;
        this.jpegQuality = jpegQuality;
    }

    public byte[] renderFirstPage(Path pdfFile) {
        LOGGER.info("Rendering first page of '{}' at {} DPI", pdfFile.getFileName(), dpi);
        BufferedImage page;
        try (PDDocument document = PDDocument.load(pdfFile.toFile())) {
            if (document.getNumberOfPages() == 0) {
                throw new PdfRenderingException("PDF document has no pages");
            }
            page = new PDFRenderer(document).renderImageWithDPI(0, dpi, ImageType.RGB);
        } catch (IOException ex) {
            throw new PdfRenderingException("Unable to render PDF page: " + ex.getMessage(), ex);
        }

        BufferedImage resized = resize(page);
        byte[] jpeg = encodeJpeg(resized);
        LOGGER.info("Rendered page {}x{} resized to {}x{} ({} JPEG bytes)", page.getWidth(), page.getHeight(), width,
            height, jpeg.length);
        return jpeg;
    }

    private BufferedImage resize(BufferedImage source) {
        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = target.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            graphics.drawImage(source, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }
        return target;
    }

    private byte[] encodeJpeg(BufferedImage image) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new PdfRenderingException("No JPEG image writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (ImageOutputStream imageOutput = ImageIO.createImageOutputStream(output)) {
            writer.setOutput(imageOutput);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(jpegQuality);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException ex) {
            throw new PdfRenderingException("Unable to encode page image as JPEG", ex);
        } finally {
            writer.dispose();
        }
        return output.toByteArray();
    }
}
