package io.reviewdeck.core.chart;

import java.util.Objects;

public record ChartImage(byte[] png, int width, int height) {

    public ChartImage {
        Objects.requireNonNull(png, "png must not be null");
    }

    public boolean isEmpty() {
        return png.length == 0;
    }
}
