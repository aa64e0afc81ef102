package io.reviewdeck.core.deck.poi;

import io.reviewdeck.core.deck.Deck;
import io.reviewdeck.core.deck.DeckSlide;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;

public final class PoiDeck implements Deck {
    private final XMLSlideShow slideShow;

    public PoiDeck(XMLSlideShow slideShow) {
        this.slideShow = Objects.requireNonNull(slideShow, "slideShow must not be null");
    }

    public static PoiDeck fromBytes(byte[] pptx) throws IOException {
        return new PoiDeck(new XMLSlideShow(new ByteArrayInputStream(pptx)));
    }

    public XMLSlideShow slideShow() {
        return slideShow;
    }

    @Override
    public List<DeckSlide> slides() {
        List<DeckSlide> slides = new ArrayList<>();
        for (XSLFSlide slide : slideShow.getSlides()) {
            slides.add(new PoiSlide(slideShow, slide));
        }
        return slides;
    }

    @Override
    public byte[] toBytes() throws IOException {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            slideShow.write(out);
            return out.toByteArray();
        }
    }

    @Override
    public void close() throws IOException {
        slideShow.close();
    }
}
