package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Strips characters that do not belong in a plain-text export cell.
 *
 * <p>
 * Removed: control, format (zero-width joiners), private-use, surrogate and unassigned
 * code points, enclosing marks (keycaps), variation selectors, emoji skin-tone
 * modifiers, and every "other symbol" above U+00FF, which covers emoji, pictographs,
 * dingbats and regional indicators. Emoji filed under other categories, such as U+203C,
 * U+2049, U+2139 or U+3030, are removed as well. Letters of every script, punctuation
 * and the Latin-1 symbols such as {@code ©} are kept. Tabs and line breaks become
 * spaces and the result is trimmed, so the output is never longer than the input.
 */
public final class TextSanitizer {

	private TextSanitizer() {
	}

	/**
	 * Clean a text value.
	 * @param text the raw value, may be null
	 * @return the cleaned value, empty for null input
	 */
	public static String clean(@Nullable String text) {
		if (text == null || text.isEmpty()) {
			return "";
		}
		StringBuilder cleaned = new StringBuilder(text.length());
		text.codePoints().forEach(codePoint -> {
			if (codePoint == '\t' || codePoint == '\n' || codePoint == '\r') {
				cleaned.append(' ');
			}
			else if (isKept(codePoint)) {
				cleaned.appendCodePoint(codePoint);
			}
		});
		return cleaned.toString().trim();
	}

	/**
	 * Returns true if the code point is an emoji or pictographic symbol.
	 * @param codePoint the code point
	 * @return true for pictographic code points
	 */
	public static boolean isPictographic(int codePoint) {
		int type = Character.getType(codePoint);
		return (type == Character.OTHER_SYMBOL && codePoint > 0xFF) || isEmojiModifier(codePoint)
				|| isVariationSelector(codePoint) || isPictographicOutsideSymbols(codePoint);
	}

	// Emoji whose general category is punctuation, math symbol or letter
	private static boolean isPictographicOutsideSymbols(int codePoint) {
		switch (codePoint) {
			case 0x203C:
			case 0x2049:
			case 0x2139:
			case 0x2194:
			case 0x2934:
			case 0x2935:
			case 0x3030:
			case 0x303D:
				return true;
			default:
				return codePoint >= 0x25FB && codePoint <= 0x25FE;
		}
	}

	private static boolean isKept(int codePoint) {
		if (isPictographic(codePoint)) {
			return false;
		}
		switch (Character.getType(codePoint)) {
			case Character.CONTROL:
			case Character.FORMAT:
			case Character.PRIVATE_USE:
			case Character.SURROGATE:
			case Character.UNASSIGNED:
			case Character.ENCLOSING_MARK:
				return false;
			default:
				return true;
		}
	}

	private static boolean isEmojiModifier(int codePoint) {
		return codePoint >= 0x1F3FB && codePoint <= 0x1F3FF;
	}

	private static boolean isVariationSelector(int codePoint) {
		return (codePoint >= 0xFE00 && codePoint <= 0xFE0F) || (codePoint >= 0xE0100 && codePoint <= 0xE01EF);
	}

}
