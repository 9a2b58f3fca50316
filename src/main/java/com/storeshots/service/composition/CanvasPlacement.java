package com.storeshots.service.composition;

import com.storeshots.exception.GeometryException;
import com.storeshots.service.catalog.Dimensions;

/**
 * Where a screenshot lands on a canvas: its scaled size and the top-left corner that centers
 * it. Pure arithmetic, no raster access.
 */
public record CanvasPlacement(int x, int y, int width, int height, double scale) {

    // Absorbs rounding in w * (max / w) so an exact fit is not floored one pixel short.
    private static final double EPSILON = 1e-9;

    /**
     * Fits {@code source} inside {@code floor(canvas * scalePolicy)} on both axes, preserving
     * aspect ratio and never scaling above native resolution, then centers it on the canvas.
     */
    public static CanvasPlacement centered(Dimensions source, Dimensions canvas, double scalePolicy) {
        if (!source.isPositive()) {
            throw new GeometryException("Screenshot has no pixels: " + source);
        }
        if (!canvas.isPositive()) {
            throw new GeometryException("Canvas has no pixels: " + canvas);
        }
        if (!(scalePolicy > 0.0 && scalePolicy <= 1.0)) {
            throw new GeometryException("Scale policy must be within (0, 1] but was " + scalePolicy);
        }
        int maxWidth = (int) Math.floor(canvas.width() * scalePolicy);
        int maxHeight = (int) Math.floor(canvas.height() * scalePolicy);
        if (maxWidth < 1 || maxHeight < 1) {
            throw new GeometryException("Scale policy " + scalePolicy + " leaves no room on canvas " + canvas);
        }
        double scale = Math.min(1.0, Math.min(maxWidth / (double) source.width(), maxHeight / (double) source.height()));
        int width = Math.min(maxWidth, Math.max(1, (int) Math.floor(source.width() * scale + EPSILON)));
        int height = Math.min(maxHeight, Math.max(1, (int) Math.floor(source.height() * scale + EPSILON)));
        int x = (canvas.width() - width) / 2;
        int y = (canvas.height() - height) / 2;
        return new CanvasPlacement(x, y, width, height, scale);
    }

    /**
     * Scale that makes {@code source} cover {@code target} entirely; the overflow is meant to be
     * cropped symmetrically.
     */
    public static CanvasPlacement cover(Dimensions source, Dimensions target) {
        if (!source.isPositive() || !target.isPositive()) {
            throw new GeometryException("Cannot cover " + target + " with " + source);
        }
        double scale = Math.max(target.width() / (double) source.width(), target.height() / (double) source.height());
        int width = Math.max(target.width(), (int) Math.round(source.width() * scale));
        int height = Math.max(target.height(), (int) Math.round(source.height() * scale));
        return new CanvasPlacement((width - target.width()) / 2, (height - target.height()) / 2, width, height, scale);
    }

    public Dimensions size() {
        return new Dimensions(width, height);
    }
}
