package com.storeshots.service.composition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.storeshots.exception.GeometryException;
import com.storeshots.service.catalog.Dimensions;
import org.junit.jupiter.api.Test;

class CanvasPlacementTest {

    private static final Dimensions MAC_CANVAS = new Dimensions(2880, 1800);

    @Test
    void smallWindowKeepsNativeSizeAndIsCentered() {
        CanvasPlacement placement = CanvasPlacement.centered(new Dimensions(800, 652), MAC_CANVAS, 0.85);

        assertThat(placement.size()).isEqualTo(new Dimensions(800, 652));
        assertThat(placement.scale()).isEqualTo(1.0);
        assertThat(placement.x()).isEqualTo(1040);
        assertThat(placement.y()).isEqualTo(574);
    }

    @Test
    void largeCaptureIsScaledIntoTheSafeArea() {
        CanvasPlacement placement = CanvasPlacement.centered(new Dimensions(5120, 2880), MAC_CANVAS, 0.85);

        // floor(2880 * 0.85) = 2448, floor(1800 * 0.85) = 1530; width is the binding side
        assertThat(placement.width()).isEqualTo(2448);
        assertThat(placement.height()).isEqualTo(1377);
        assertThat(placement.x()).isEqualTo((2880 - 2448) / 2);
        assertThat(placement.y()).isEqualTo((1800 - 1377) / 2);
    }

    @Test
    void tallCaptureIsBoundByHeight() {
        CanvasPlacement placement = CanvasPlacement.centered(new Dimensions(1000, 3000), MAC_CANVAS, 0.85);

        assertThat(placement.height()).isEqualTo(1530);
        assertThat(placement.width()).isEqualTo(510);
    }

    @Test
    void fullScalePolicyUsesWholeCanvas() {
        CanvasPlacement placement = CanvasPlacement.centered(new Dimensions(5760, 3600), MAC_CANVAS, 1.0);

        assertThat(placement).isEqualTo(new CanvasPlacement(0, 0, 2880, 1800, 0.5));
    }

    @Test
    void rejectsInvalidGeometry() {
        assertThatThrownBy(() -> CanvasPlacement.centered(new Dimensions(0, 10), MAC_CANVAS, 0.85))
                .isInstanceOf(GeometryException.class);
        assertThatThrownBy(() -> CanvasPlacement.centered(new Dimensions(10, 10), MAC_CANVAS, 1.2))
                .isInstanceOf(GeometryException.class);
        assertThatThrownBy(() -> CanvasPlacement.centered(new Dimensions(10, 10), new Dimensions(1, 1), 0.5))
                .isInstanceOf(GeometryException.class);
    }

    @Test
    void coverCropsWatchCaptureSymmetrically() {
        CanvasPlacement cover = CanvasPlacement.cover(new Dimensions(416, 496), new Dimensions(396, 484));

        assertThat(cover.height()).isEqualTo(484);
        assertThat(cover.width()).isEqualTo(406);
        assertThat(cover.x()).isEqualTo(5);
        assertThat(cover.y()).isZero();
    }
}
