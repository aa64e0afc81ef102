package io.reviewdeck.core.deck;

import java.util.List;

public non-sealed interface ShapeTable extends DeckShape {
    List<List<TextUnit>> rows();

    @Override
    default <R> R accept(ShapeVisitor<R> visitor) {
        return visitor.visitTable(this);
    }
}
