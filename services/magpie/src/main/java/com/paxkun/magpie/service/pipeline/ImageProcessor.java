package com.paxkun.magpie.service.pipeline;

import com.paxkun.magpie.config.MagpieProperties;
import com.paxkun.magpie.exception.TransformException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLConnection;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;

/**
 * Normalizes downloaded images: decode, shrink to the configured maximum width,
 * flatten transparency onto white, optionally watermark, then re-encode as JPEG.
 * <p>
 * Never throws for a bad image. Anything that cannot be decoded or encoded is
 * stored as downloaded, and a watermark failure only drops the watermark.
 *
 * Author: Pax
 */
@Slf4j
@Component
public class ImageProcessor {

    static final String JPEG = "image/jpeg";
    static final String OCTET_STREAM = "application/octet-stream";

    private final MagpieProperties.Image settings;
    private final WatermarkRenderer watermarkRenderer;

    @Autowired
    public ImageProcessor(MagpieProperties properties) {
        this(properties.getImage(), new WatermarkRenderer());
    }

    ImageProcessor(MagpieProperties.Image settings, WatermarkRenderer watermarkRenderer) {
        this.settings = settings;
        this.watermarkRenderer = watermarkRenderer;
    }

    public ProcessedImage process(byte[] original, String watermarkText) {
        BufferedImage decoded;
        try {
            decoded = decode(original);
        } catch (TransformException e) {
            log.warn("⚠️ Storing original bytes, decode failed: {}", e.getMessage());
            return passthrough(original);
        }

        BufferedImage prepared = normalize(decoded);

        if (watermarkText != null && !watermarkText.isBlank()) {
            try {
                prepared = watermarkRenderer.render(prepared, watermarkText);
            } catch (TransformException e) {
                log.warn("⚠️ Skipping watermark: {}", e.getMessage());
            }
        }

        try {
            return new ProcessedImage(encode(prepared), JPEG, "jpg", true);
        } catch (TransformException e) {
            log.warn("⚠️ Storing original bytes, encode failed: {}", e.getMessage());
            return passthrough(original);
        }
    }

    BufferedImage decode(byte[] bytes) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(bytes));
        } catch (IOException | RuntimeException e) {
            throw new TransformException("Failed to decode image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new TransformException("No image reader recognizes the downloaded bytes");
        }
        return image;
    }

    /**
     * Scales down to {@code maxWidth} keeping the aspect ratio and always returns an
     * opaque RGB copy with transparent pixels composed over white.
     */
    BufferedImage normalize(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        if (width > settings.getMaxWidth()) {
            height = Math.max(1, (int) Math.round(height * (settings.getMaxWidth() / (double) width)));
            width = settings.getMaxWidth();
        }

        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    byte[] encode(BufferedImage image) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new TransformException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(settings.getQuality());
            if (settings.isProgressive()) {
                param.setProgressiveMode(ImageWriteParam.MODE_DEFAULT);
            }
            writer.setOutput(stream);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException | RuntimeException e) {
            throw new TransformException("Failed to encode JPEG: " + e.getMessage(), e);
        } finally {
            writer.dispose();
        }
        return out.toByteArray();
    }

    ProcessedImage passthrough(byte[] original) {
        String contentType = sniffContentType(original);
        return new ProcessedImage(original, contentType, extensionFor(contentType), false);
    }

    static String sniffContentType(byte[] bytes) {
        if (isWebp(bytes)) {
            return "image/webp";
        }
        try (InputStream in = new ByteArrayInputStream(bytes)) {
            String guessed = URLConnection.guessContentTypeFromStream(in);
            return guessed != null ? guessed : OCTET_STREAM;
        } catch (IOException e) {
            log.debug("Content type sniffing failed: {}", e.getMessage());
            return OCTET_STREAM;
        }
    }

    static String extensionFor(String contentType) {
        switch (contentType) {
            case JPEG:
                return "jpg";
            case "image/png":
                return "png";
            case "image/gif":
                return "gif";
            case "image/webp":
                return "webp";
            default:
                return "bin";
        }
    }

    private static boolean isWebp(byte[] bytes) {
        return bytes.length >= 12
                && "RIFF".equals(new String(bytes, 0, 4, StandardCharsets.US_ASCII))
                && "WEBP".equals(new String(bytes, 8, 4, StandardCharsets.US_ASCII));
    }
}
