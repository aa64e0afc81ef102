package io.reviewdeck.core.deck.poi;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;

import io.reviewdeck.core.deck.Bounds;
import io.reviewdeck.core.deck.DeckShape;
import io.reviewdeck.core.deck.DeckSlide;
import io.reviewdeck.core.deck.ShapeGroup;
import io.reviewdeck.core.deck.ShapeTable;
import io.reviewdeck.core.deck.TextUnit;
import io.reviewdeck.core.deck.TextVisitor;
import io.reviewdeck.core.template.TokenScanner;
import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.List;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableRow;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.junit.jupiter.api.Test;

class PoiDeckTest {

    @Test
    void shouldMapNestedGroupChildrenToSlideCoordinates() throws Exception {
        try (PoiDeck deck = new PoiDeck(new XMLSlideShow())) {
            XSLFSlide slide = deck.slideShow().createSlide();
            XSLFGroupShape outer = slide.createGroup();
            outer.setAnchor(new Rectangle2D.Double(100, 50, 200, 200));
            outer.setInteriorAnchor(new Rectangle2D.Double(0, 0, 400, 400));
            XSLFGroupShape inner = outer.createGroup();
            inner.setAnchor(new Rectangle2D.Double(200, 200, 200, 200));
            inner.setInteriorAnchor(new Rectangle2D.Double(0, 0, 200, 200));
            XSLFTextBox box = inner.createTextBox();
            box.setAnchor(new Rectangle2D.Double(20, 40, 100, 60));
            box.setText("nested");

            DeckShape top = deck.slides().get(0).shapes().get(0);
            List<TextUnit> units = new ArrayList<>();
            TextVisitor.walk(top, units::add);

            assertThat(top).isInstanceOf(ShapeGroup.class);
            assertThat(units).hasSize(1);
            assertThat(units.get(0).text()).isEqualTo("nested");
            assertThat(units.get(0).bounds()).isEqualTo(new Bounds(210, 170, 50, 30));
        }
    }

    @Test
    void shouldExposeTableCellsAsTextUnits() throws Exception {
        try (PoiDeck deck = new PoiDeck(new MasterTemplateBuilder().build())) {
            DeckSlide slaSlide = deck.slides().get(5);

            ShapeTable table = slaSlide.shapes().stream()
                .filter(ShapeTable.class::isInstance)
                .map(ShapeTable.class::cast)
                .findFirst()
                .orElseThrow();

            assertThat(table.rows()).hasSize(5);
            assertThat(table.rows().get(4).get(1).text()).isEqualTo("{{CRITICAL_RES_TIME}}");
        }
    }

    @Test
    void shouldGiveEachTableCellItsOwnGridBounds() throws Exception {
        try (PoiDeck deck = new PoiDeck(new XMLSlideShow())) {
            XSLFSlide slide = deck.slideShow().createSlide();
            XSLFTable grid = slide.createTable();
            grid.setAnchor(new Rectangle2D.Double(100, 200, 300, 90));
            for (int r = 0; r < 3; r++) {
                XSLFTableRow row = grid.addRow();
                row.setHeight(30);
                row.addCell().setText("r" + r + "c0");
                row.addCell().setText("r" + r + "c1");
            }
            grid.setColumnWidth(0, 120);
            grid.setColumnWidth(1, 180);

            ShapeTable table = (ShapeTable) deck.slides().get(0).shapes().get(0);
            TextUnit cell = table.rows().get(2).get(1);
            Bounds bounds = cell.bounds();

            assertThat(cell.text()).isEqualTo("r2c1");
            assertThat(bounds.x()).isCloseTo(220, offset(0.01));
            assertThat(bounds.y()).isCloseTo(260, offset(0.01));
            assertThat(bounds.width()).isCloseTo(180, offset(0.01));
            assertThat(bounds.height()).isCloseTo(30, offset(0.01));
            assertThat(table.rows().get(0).get(0).bounds().x()).isCloseTo(100, offset(0.01));
        }
    }

    @Test
    void shouldPersistRunEditsAcrossSerialisation() throws Exception {
        byte[] edited;
        try (PoiDeck deck = PoiDeck.fromBytes(new MasterTemplateBuilder().toBytes())) {
            DeckSlide title = deck.slides().get(0);
            for (DeckShape shape : title.shapes()) {
                TextVisitor.walk(shape, unit -> unit.runs().forEach(run ->
                    run.setText(run.text().replace("{{CLIENT_NAME}}", "Acme Corp"))));
            }
            edited = deck.toBytes();
        }

        try (PoiDeck reopened = PoiDeck.fromBytes(edited)) {
            assertThat(TokenScanner.scan(reopened)).doesNotContain("CLIENT_NAME");
            List<String> texts = new ArrayList<>();
            reopened.slides().get(0).shapes().forEach(shape -> TextVisitor.walk(shape, unit -> texts.add(unit.text())));
            assertThat(texts).contains("Acme Corp");
        }
    }
}
