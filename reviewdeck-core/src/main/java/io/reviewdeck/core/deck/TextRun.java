package io.reviewdeck.core.deck;

public interface TextRun {
    String text();

    void setText(String text);
}
