package io.reviewdeck.core.deck;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

public interface Deck extends Closeable {
    List<DeckSlide> slides();

    byte[] toBytes() throws IOException;
}
