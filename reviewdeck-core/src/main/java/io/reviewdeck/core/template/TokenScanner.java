package io.reviewdeck.core.template;

import io.reviewdeck.core.deck.Deck;
import io.reviewdeck.core.deck.DeckShape;
import io.reviewdeck.core.deck.DeckSlide;
import io.reviewdeck.core.deck.TextVisitor;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TokenScanner {
    private static final Pattern TOKEN = Pattern.compile("\\{\\{([A-Za-z0-9_]+)\\}\\}");

    private TokenScanner() {
    }

    public static Set<String> scan(Deck deck) {
        Set<String> found = new LinkedHashSet<>();
        for (DeckSlide slide : deck.slides()) {
            for (DeckShape shape : slide.shapes()) {
                TextVisitor.walk(shape, unit -> {
                    Matcher matcher = TOKEN.matcher(unit.text());
                    while (matcher.find()) {
                        found.add(matcher.group(1));
                    }
                });
            }
        }
        return found;
    }
}
