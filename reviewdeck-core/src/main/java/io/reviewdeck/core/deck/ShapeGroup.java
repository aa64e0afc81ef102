package io.reviewdeck.core.deck;

import java.util.List;

public non-sealed interface ShapeGroup extends DeckShape {
    List<DeckShape> children();

    @Override
    default <R> R accept(ShapeVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }
}
