package io.reviewdeck.core.template;

import io.reviewdeck.core.deck.DeckShape;
import io.reviewdeck.core.deck.TextRun;
import io.reviewdeck.core.deck.TextUnit;
import io.reviewdeck.core.deck.TextVisitor;
import java.util.List;
import java.util.Map;

public final class PlaceholderResolver {

    public boolean resolve(DeckShape shape, TokenMap tokens) {
        boolean[] replaced = {false};
        TextVisitor.walk(shape, unit -> {
            List<TextRun> runs = unit.runs();
            if (joinSplitTokens(unit, runs, tokens)) {
                replaced[0] = true;
            }
            for (TextRun run : runs) {
                if (resolveRun(run, tokens)) {
                    replaced[0] = true;
                }
            }
        });
        return replaced[0];
    }

    // A token broken over several runs is folded into its first run; runs outside the token keep their text.
    private boolean joinSplitTokens(TextUnit unit, List<TextRun> runs, TokenMap tokens) {
        if (runs.size() < 2 || !unit.text().contains(Tokens.OPEN)) {
            return false;
        }
        boolean joined = false;
        for (String name : tokens.asMap().keySet()) {
            String delimited = Tokens.delimited(name);
            int from = 0;
            int start;
            while ((start = join(runs).indexOf(delimited, from)) >= 0) {
                int end = start + delimited.length();
                int first = runAt(runs, start);
                int last = runAt(runs, end - 1);
                if (first != last) {
                    fold(runs, first, last);
                    joined = true;
                }
                from = end;
            }
        }
        return joined;
    }

    private static String join(List<TextRun> runs) {
        StringBuilder text = new StringBuilder();
        for (TextRun run : runs) {
            text.append(run.text());
        }
        return text.toString();
    }

    private static int runAt(List<TextRun> runs, int offset) {
        int position = 0;
        for (int i = 0; i < runs.size(); i++) {
            int length = runs.get(i).text().length();
            if (offset < position + length) {
                return i;
            }
            position += length;
        }
        return runs.size() - 1;
    }

    private static void fold(List<TextRun> runs, int first, int last) {
        StringBuilder text = new StringBuilder();
        for (int i = first; i <= last; i++) {
            text.append(runs.get(i).text());
        }
        runs.get(first).setText(text.toString());
        for (int i = first + 1; i <= last; i++) {
            if (!runs.get(i).text().isEmpty()) {
                runs.get(i).setText("");
            }
        }
    }

    private boolean resolveRun(TextRun run, TokenMap tokens) {
        String original = run.text();
        if (!original.contains(Tokens.OPEN)) {
            return false;
        }
        String updated = original;
        for (Map.Entry<String, String> entry : tokens.asMap().entrySet()) {
            String delimited = Tokens.delimited(entry.getKey());
            if (updated.contains(delimited)) {
                updated = updated.replace(delimited, entry.getValue());
            }
        }
        if (updated.equals(original)) {
            return false;
        }
        run.setText(updated);
        return true;
    }
}
