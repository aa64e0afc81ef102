package io.reviewdeck.core.deck;

public interface ShapeVisitor<R> {
    R visitText(TextUnit text);

    R visitGroup(ShapeGroup group);

    R visitTable(ShapeTable table);
}
