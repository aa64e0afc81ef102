package io.reviewdeck.core.deck;

import java.io.IOException;
import java.nio.file.Path;

@FunctionalInterface
public interface DeckLoader {
    Deck open(Path template) throws IOException;
}
