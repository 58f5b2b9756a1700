/*
 * Where: emoji-notifier domain model
 * What: Structured batch summary handed to the delivery transport
 * Why: Keeps message layout independent from how it is sent
 */
package com.example.emojinotifier.model;

import java.time.Instant;
import java.util.List;

public record EmojiSummary(
    String title,
    int color,
    int emojiCount,
    List<String> lines,
    String footer,
    Instant timestamp) {

  /** Platform cap on an embed description, in characters. */
  public static final int DESCRIPTION_LIMIT = 4096;

  public EmojiSummary {
    lines = lines == null ? List.of() : List.copyOf(lines);
  }

  /**
   * Header plus one line per emoji. Lines that would push the text past {@link
   * #DESCRIPTION_LIMIT} are replaced by a single {@code +N more} line.
   */
  public String description() {
    final StringBuilder description =
        new StringBuilder(":new: **" + emojiCount + " emoji(s)** are added to the server!\n\n");
    for (int i = 0; i < lines.size(); i++) {
      final String separator = i == 0 ? "" : "\n";
      final int left = lines.size() - i - 1;
      final int reserved = left == 0 ? 0 : 1 + moreLine(left).length();
      if (description.length() + separator.length() + lines.get(i).length() + reserved
          > DESCRIPTION_LIMIT) {
        description.append(separator).append(moreLine(lines.size() - i));
        break;
      }
      description.append(separator).append(lines.get(i));
    }
    return description.toString();
  }

  private static String moreLine(int count) {
    return "+" + count + " more";
  }
}
