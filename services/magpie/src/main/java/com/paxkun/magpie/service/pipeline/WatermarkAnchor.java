package com.paxkun.magpie.service.pipeline;

/**
 * The five places the watermark text is stamped on every image.
 */
public enum WatermarkAnchor {
    TOP_LEFT,
    TOP_RIGHT,
    CENTER,
    BOTTOM_LEFT,
    BOTTOM_RIGHT
}
