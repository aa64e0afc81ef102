package io.reviewdeck.core.deck;

import java.util.List;

public non-sealed interface TextUnit extends DeckShape {
    List<TextRun> runs();

    /**
     * Position and size in slide coordinates (points).
     */
    Bounds bounds();

    default String text() {
        StringBuilder text = new StringBuilder();
        for (TextRun run : runs()) {
            text.append(run.text());
        }
        return text.toString();
    }

    default void clear() {
        for (TextRun run : runs()) {
            if (!run.text().isEmpty()) {
                run.setText("");
            }
        }
    }

    @Override
    default <R> R accept(ShapeVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
