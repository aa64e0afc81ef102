package io.reviewdeck.core.deck;

public record Bounds(double x, double y, double width, double height) {

    public static final Bounds EMPTY = new Bounds(0, 0, 0, 0);
}
