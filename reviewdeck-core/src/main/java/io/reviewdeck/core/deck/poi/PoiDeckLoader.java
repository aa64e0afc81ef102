package io.reviewdeck.core.deck.poi;

import io.reviewdeck.core.deck.Deck;
import io.reviewdeck.core.deck.DeckLoader;
import io.reviewdeck.core.deck.TemplateNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.apache.poi.xslf.usermodel.XMLSlideShow;

public final class PoiDeckLoader implements DeckLoader {

    @Override
    public Deck open(Path template) throws IOException {
        Objects.requireNonNull(template, "template must not be null");
        if (!Files.isRegularFile(template)) {
            throw new TemplateNotFoundException(template, "Template file not found: " + template);
        }
        try (InputStream in = Files.newInputStream(template)) {
            return new PoiDeck(new XMLSlideShow(in));
        } catch (IOException | RuntimeException e) {
            throw new TemplateNotFoundException(template, "Template could not be loaded: " + template, e);
        }
    }
}
