package io.reviewdeck.core.deck.poi;

import io.reviewdeck.core.chart.ChartImage;
import io.reviewdeck.core.deck.Bounds;
import io.reviewdeck.core.deck.DeckShape;
import io.reviewdeck.core.deck.DeckSlide;
import java.awt.geom.Rectangle2D;
import java.util.List;
import org.apache.poi.sl.usermodel.PictureData;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFPictureData;
import org.apache.poi.xslf.usermodel.XSLFPictureShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;

final class PoiSlide implements DeckSlide {
    private final XMLSlideShow slideShow;
    private final XSLFSlide slide;

    PoiSlide(XMLSlideShow slideShow, XSLFSlide slide) {
        this.slideShow = slideShow;
        this.slide = slide;
    }

    @Override
    public int number() {
        return slide.getSlideNumber();
    }

    @Override
    public String title() {
        String title = slide.getTitle();
        return title == null || title.isBlank() ? "Untitled" : title;
    }

    @Override
    public List<DeckShape> shapes() {
        return PoiShapes.adaptAll(slide.getShapes(), Placement.SLIDE);
    }

    @Override
    public void insertPicture(ChartImage image, Bounds bounds) {
        XSLFPictureData pictureData = slideShow.addPicture(image.png(), PictureData.PictureType.PNG);
        XSLFPictureShape picture = slide.createPicture(pictureData);
        picture.setAnchor(new Rectangle2D.Double(bounds.x(), bounds.y(), bounds.width(), bounds.height()));
    }
}
