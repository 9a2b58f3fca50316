package com.storeshots.service.raster;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.bytedeco.javacpp.indexer.UByteIndexer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.junit.jupiter.api.Test;

class RasterImagesTest {

    @Test
    void roundedMaskClearsCornersOnly() {
        Mat mask = RasterImages.roundedMask(100, 60, 20);
        UByteIndexer indexer = mask.createIndexer();
        try {
            assertEquals(0, indexer.get(0, 0));
            assertEquals(0, indexer.get(59, 99));
            assertEquals(255, indexer.get(30, 50));
            assertEquals(255, indexer.get(0, 50));
            assertEquals(255, indexer.get(30, 0));
        } finally {
            indexer.release();
        }
    }

    @Test
    void blendHonoursMaskOpacity() {
        Mat canvas = RasterImages.solid(4, 2, new Scalar(0, 0, 0, 255));
        Mat layer = RasterImages.solid(2, 2, new Scalar(200, 100, 50, 255));
        Mat mask = new Mat(2, 2, opencv_core.CV_8UC1, new Scalar(255.0));

        RasterImages.blendInto(canvas, layer, mask, new Rect(2, 0, 2, 2));

        UByteIndexer indexer = canvas.createIndexer();
        try {
            assertEquals(0, indexer.get(0, 0, 0));
            assertEquals(200, indexer.get(0, 2, 0));
            assertEquals(100, indexer.get(1, 3, 1));
            assertEquals(50, indexer.get(1, 3, 2));
        } finally {
            indexer.release();
        }
    }

    @Test
    void flattenFreesItsIntermediatesButNotTheSource() {
        Mat source = new Mat(2, 2, opencv_core.CV_16UC4, new Scalar(257 * 200, 257 * 100, 257 * 50, 65535));
        Mat flat = RasterImages.flatten(source, new Scalar(0, 0, 0, 255));
        try {
            assertFalse(source.isNull());
            assertEquals(4, source.channels());
            assertEquals(opencv_core.CV_16U, source.depth());
            assertEquals(3, flat.channels());
            UByteIndexer indexer = flat.createIndexer();
            try {
                assertEquals(200, indexer.get(1, 1, 0));
                assertEquals(100, indexer.get(1, 1, 1));
                assertEquals(50, indexer.get(1, 1, 2));
            } finally {
                indexer.release();
            }
        } finally {
            RasterImages.release(flat, source);
        }
    }

    @Test
    void releasingACopyLeavesTheOriginalIntact() {
        Mat original = RasterImages.solid(3, 3, new Scalar(10, 20, 30, 255));
        Mat cropped = RasterImages.crop(original, 1, 1, 2, 2);

        RasterImages.release(cropped, null);

        UByteIndexer indexer = original.createIndexer();
        try {
            assertEquals(30, indexer.get(2, 2, 2));
        } finally {
            indexer.release();
            RasterImages.release(original);
        }
        assertDoesNotThrow(() -> RasterImages.release((Mat) null));
    }

    @Test
    void parsesHexColorsAsBgr() {
        Scalar teal = RasterImages.color("#2A5F6D");

        assertEquals(0x6D, teal.get(0));
        assertEquals(0x5F, teal.get(1));
        assertEquals(0x2A, teal.get(2));
        assertThrows(IllegalArgumentException.class, () -> RasterImages.color("teal"));
    }
}
