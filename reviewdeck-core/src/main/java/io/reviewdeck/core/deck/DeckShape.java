package io.reviewdeck.core.deck;

/**
 * A node of a slide's shape tree: a text container, a group of shapes, or a table of text cells.
 * Callers dispatch on the variant through {@link ShapeVisitor}.
 */
public sealed interface DeckShape permits TextUnit, ShapeGroup, ShapeTable {

    <R> R accept(ShapeVisitor<R> visitor);
}
