package io.cifxform.core.dictionary;

import io.cifxform.core.format.TextBlockTracker;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Splits dictionary text into save blocks.
 *
 * <p>A line {@code save_<name>} opens a block and a line {@code save_} closes it. Marker lines
 * inside semicolon text fields are ignored, as is anything between blocks.
 */
final class SaveBlockReader {

    private static final String SAVE = "save_";

    /** One block: its name (without {@code save_}) and the raw lines in between. */
    record SaveBlock(String name, String body) {}

    private SaveBlockReader() {}

    static List<SaveBlock> read(String text) {
        List<SaveBlock> blocks = new ArrayList<>();
        TextBlockTracker tracker = new TextBlockTracker();
        String current = null;
        StringBuilder body = new StringBuilder();
        for (String line : text.split("\\r?\n", -1)) {
            if (tracker.advance(line) != TextBlockTracker.LineKind.CONTENT) {
                if (current != null) {
                    body.append(line).append('\n');
                }
                continue;
            }
            String trimmed = line.strip();
            if (trimmed.length() >= SAVE.length()
                    && trimmed.substring(0, SAVE.length()).toLowerCase(Locale.ROOT).equals(SAVE)
                    && trimmed.chars().noneMatch(Character::isWhitespace)) {
                String name = trimmed.substring(SAVE.length());
                if (name.isEmpty()) {
                    if (current != null) {
                        blocks.add(new SaveBlock(current, body.toString()));
                        current = null;
                    }
                } else {
                    // An unterminated block ends where the next one starts.
                    if (current != null) {
                        blocks.add(new SaveBlock(current, body.toString()));
                    }
                    current = name;
                    body.setLength(0);
                }
                continue;
            }
            if (current != null) {
                body.append(line).append('\n');
            }
        }
        if (current != null) {
            blocks.add(new SaveBlock(current, body.toString()));
        }
        return blocks;
    }
}
