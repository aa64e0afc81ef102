package io.reviewdeck.core.deck;

import java.util.function.Consumer;

public final class TextVisitor implements ShapeVisitor<Void> {
    private final Consumer<TextUnit> action;

    public TextVisitor(Consumer<TextUnit> action) {
        this.action = action;
    }

    public static void walk(DeckShape shape, Consumer<TextUnit> action) {
        shape.accept(new TextVisitor(action));
    }

    @Override
    public Void visitText(TextUnit text) {
        action.accept(text);
        return null;
    }

    @Override
    public Void visitGroup(ShapeGroup group) {
        for (DeckShape child : group.children()) {
            child.accept(this);
        }
        return null;
    }

    @Override
    public Void visitTable(ShapeTable table) {
        for (var row : table.rows()) {
            for (TextUnit cell : row) {
                cell.accept(this);
            }
        }
        return null;
    }
}
