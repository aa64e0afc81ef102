package io.reviewdeck.core.deck;

import io.reviewdeck.core.chart.ChartImage;
import java.util.List;

public interface DeckSlide {
    int number();

    String title();

    /**
     * Top-level shapes as of this call. Pictures inserted afterwards are not part of the returned list.
     */
    List<DeckShape> shapes();

    void insertPicture(ChartImage image, Bounds bounds);
}
