package io.reviewdeck.core.deck.poi;

import io.reviewdeck.core.deck.Bounds;
import java.awt.geom.Rectangle2D;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;

/**
 * Maps a shape anchor into slide coordinates. Group children are anchored in the group's
 * interior frame, so each group level contributes a scale and offset.
 */
record Placement(double offsetX, double offsetY, double scaleX, double scaleY) {
    static final Placement SLIDE = new Placement(0, 0, 1, 1);

    Bounds map(Rectangle2D anchor) {
        if (anchor == null) {
            return Bounds.EMPTY;
        }
        return new Bounds(
            offsetX + anchor.getX() * scaleX,
            offsetY + anchor.getY() * scaleY,
            anchor.getWidth() * scaleX,
            anchor.getHeight() * scaleY
        );
    }

    Placement enter(XSLFGroupShape group) {
        Rectangle2D outer = group.getAnchor();
        Rectangle2D interior = group.getInteriorAnchor();
        if (outer == null || interior == null) {
            return this;
        }
        double sx = interior.getWidth() == 0 ? 1 : outer.getWidth() / interior.getWidth();
        double sy = interior.getHeight() == 0 ? 1 : outer.getHeight() / interior.getHeight();
        Bounds origin = map(new Rectangle2D.Double(outer.getX() - interior.getX() * sx, outer.getY() - interior.getY() * sy, 0, 0));
        return new Placement(origin.x(), origin.y(), scaleX * sx, scaleY * sy);
    }
}
