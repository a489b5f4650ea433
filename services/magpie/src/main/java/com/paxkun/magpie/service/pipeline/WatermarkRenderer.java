package com.paxkun.magpie.service.pipeline;

import com.paxkun.magpie.exception.TransformException;

import java.awt.AlphaComposite;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.font.FontRenderContext;
import java.awt.font.TextLayout;
import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;

/**
 * Draws semi-transparent outlined text onto a copy of an image, once at each
 * {@link WatermarkAnchor}: the four corners and the center.
 * <p>
 * Fill is white at 40% opacity, outline black at 30% with a 2px stroke. Font size
 * scales with the image width ({@code width / 25}, never below 20) and the text is
 * inset from the edges by half the font size.
 */
public class WatermarkRenderer {

    static final int MIN_FONT_SIZE = 20;
    static final Color FILL = new Color(255, 255, 255, 102);
    static final Color OUTLINE = new Color(0, 0, 0, 77);
    private static final float STROKE_WIDTH = 2f;

    public BufferedImage render(BufferedImage source, String text) {
        if (text == null || text.isBlank()) {
            return source;
        }

        int width = source.getWidth();
        int height = source.getHeight();
        int fontSize = fontSize(width);
        int padding = fontSize / 2;

        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setComposite(AlphaComposite.SrcOver);
            g.setStroke(new BasicStroke(STROKE_WIDTH));

            Font font = new Font(Font.SANS_SERIF, Font.BOLD, fontSize);
            FontRenderContext context = g.getFontRenderContext();
            TextLayout layout = new TextLayout(text, font, context);
            float textWidth = (float) layout.getBounds().getWidth();

            for (WatermarkAnchor anchor : WatermarkAnchor.values()) {
                Point2D.Float origin = origin(anchor, width, height, textWidth, fontSize, padding);
                Shape outline = layout.getOutline(AffineTransform.getTranslateInstance(origin.x, origin.y));
                g.setColor(OUTLINE);
                g.draw(outline);
                g.setColor(FILL);
                g.fill(outline);
            }
        } catch (RuntimeException e) {
            throw new TransformException("Watermark rendering failed: " + e.getMessage(), e);
        } finally {
            g.dispose();
        }
        return canvas;
    }

    /**
     * Text baseline origin for one anchor.
     */
    static Point2D.Float origin(WatermarkAnchor anchor, int width, int height, float textWidth, int fontSize, int padding) {
        switch (anchor) {
            case TOP_LEFT:
                return new Point2D.Float(padding, fontSize + padding);
            case TOP_RIGHT:
                return new Point2D.Float(width - padding - textWidth, fontSize + padding);
            case CENTER:
                return new Point2D.Float((width - textWidth) / 2f, height / 2f);
            case BOTTOM_LEFT:
                return new Point2D.Float(padding, height - padding);
            case BOTTOM_RIGHT:
            default:
                return new Point2D.Float(width - padding - textWidth, height - padding);
        }
    }

    static int fontSize(int width) {
        return Math.max(width / 25, MIN_FONT_SIZE);
    }
}
