package io.reviewdeck.core.deck.poi;

import io.reviewdeck.core.deck.Bounds;
import io.reviewdeck.core.deck.DeckShape;
import io.reviewdeck.core.deck.ShapeGroup;
import io.reviewdeck.core.deck.ShapeTable;
import io.reviewdeck.core.deck.TextRun;
import io.reviewdeck.core.deck.TextUnit;
import java.awt.geom.Rectangle2D;
import java.util.ArrayList;
import java.util.List;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableCell;
import org.apache.poi.xslf.usermodel.XSLFTableRow;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.apache.poi.xslf.usermodel.XSLFTextShape;

final class PoiShapes {

    private PoiShapes() {
    }

    static List<DeckShape> adaptAll(List<XSLFShape> shapes, Placement placement) {
        List<DeckShape> adapted = new ArrayList<>();
        for (XSLFShape shape : List.copyOf(shapes)) {
            DeckShape deckShape = adapt(shape, placement);
            if (deckShape != null) {
                adapted.add(deckShape);
            }
        }
        return adapted;
    }

    // Pictures, connectors and charts carry no text and are left out of the tree.
    private static DeckShape adapt(XSLFShape shape, Placement placement) {
        if (shape instanceof XSLFGroupShape group) {
            return new PoiGroup(group, placement);
        }
        if (shape instanceof XSLFTable table) {
            return new PoiTable(table, placement);
        }
        if (shape instanceof XSLFTextShape text) {
            return new PoiTextUnit(text, placement.map(text.getAnchor()));
        }
        return null;
    }

    record PoiTextUnit(XSLFTextShape shape, Bounds bounds) implements TextUnit {
        @Override
        public List<TextRun> runs() {
            List<TextRun> runs = new ArrayList<>();
            for (XSLFTextParagraph paragraph : shape.getTextParagraphs()) {
                for (XSLFTextRun run : paragraph.getTextRuns()) {
                    runs.add(new PoiTextRun(run));
                }
            }
            return runs;
        }
    }

    record PoiTextRun(XSLFTextRun run) implements TextRun {
        @Override
        public String text() {
            String raw = run.getRawText();
            return raw == null ? "" : raw;
        }

        @Override
        public void setText(String text) {
            run.setText(text);
        }
    }

    record PoiGroup(XSLFGroupShape group, Placement placement) implements ShapeGroup {
        @Override
        public List<DeckShape> children() {
            return adaptAll(group.getShapes(), placement.enter(group));
        }
    }

    // Cell bounds come from the grid: column widths across, stored row heights down.
    record PoiTable(XSLFTable table, Placement placement) implements ShapeTable {
        @Override
        public List<List<TextUnit>> rows() {
            Rectangle2D anchor = table.getAnchor();
            double top = anchor == null ? 0 : anchor.getY();
            double left = anchor == null ? 0 : anchor.getX();
            int columns = table.getNumberOfColumns();
            List<List<TextUnit>> rows = new ArrayList<>();
            for (XSLFTableRow row : table.getRows()) {
                List<TextUnit> cells = new ArrayList<>();
                double x = left;
                List<XSLFTableCell> rowCells = row.getCells();
                for (int c = 0; c < rowCells.size(); c++) {
                    double width = c < columns ? table.getColumnWidth(c) : 0;
                    Rectangle2D cellAnchor = new Rectangle2D.Double(x, top, width, row.getHeight());
                    cells.add(new PoiTextUnit(rowCells.get(c), placement.map(cellAnchor)));
                    x += width;
                }
                rows.add(cells);
                top += row.getHeight();
            }
            return rows;
        }
    }
}
