package org.springaicommunity.github.harvester;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TextSanitizer Tests")
class TextSanitizerTest {

	@ParameterizedTest(name = "[{index}] {0}")
	@CsvSource(delimiter = '|',
			value = { "Java dev 🚀☕|Java dev", "👋🏽 Hello|Hello",
					"Family 👨‍👩‍👧|Family",
					"I ❤️ open source|I  open source", "Flags 🇧🇷|Flags",
					"Press 1️⃣ now|Press 1 now", "✨ sparkles ✨|sparkles" })
	@DisplayName("Should strip emoji and pictographs")
	void shouldStripEmoji(String raw, String expected) {
		assertThat(TextSanitizer.clean(raw)).isEqualTo(expected);
	}

	@Test
	@DisplayName("Should strip emoji that are not classified as symbols")
	void shouldStripEmojiOutsideSymbolCategory() {
		assertThat(TextSanitizer.clean("ok\u203C\u2049 wait\u3030 \u2139\uFE0F info \u303D")).isEqualTo("ok wait  info");
		assertThat(TextSanitizer.clean("left \u2194\uFE0F right \u25FB")).isEqualTo("left  right");
		assertThat(TextSanitizer.clean("a - b, c! d?")).isEqualTo("a - b, c! d?");
	}

	@Test
	@DisplayName("Should keep letters of every script and Latin-1 symbols")
	void shouldKeepText() {
		String text = "José Müller © 2024, 東京 – Привет! ½ price @ ®";

		assertThat(TextSanitizer.clean(text)).isEqualTo(text);
	}

	@Test
	@DisplayName("Should replace line breaks and tabs by spaces and drop other controls")
	void shouldNormalizeWhitespace() {
		assertThat(TextSanitizer.clean("  line one\r\nline\ttwo\u0000\u0007 ")).isEqualTo("line one  line two");
	}

	@Test
	@DisplayName("Should drop private use and unpaired surrogate code points")
	void shouldDropPrivateUseAndSurrogates() {
		assertThat(TextSanitizer.clean("a\uE000b\uD800c")).isEqualTo("abc");
	}

	@Test
	@DisplayName("Should return empty string for null or empty input")
	void shouldHandleNull() {
		assertThat(TextSanitizer.clean(null)).isEmpty();
		assertThat(TextSanitizer.clean("")).isEmpty();
	}

	@ParameterizedTest
	@ValueSource(strings = { "plain", "😀😀😀", "mixed 🎉 text é",
			"\t\n", "☃ snow", "🧑‍💻 coder" })
	@DisplayName("Should never grow and never leave pictographs behind")
	void shouldNeverGrowOrKeepPictographs(String raw) {
		String cleaned = TextSanitizer.clean(raw);

		assertThat(cleaned.length()).isLessThanOrEqualTo(raw.length());
		assertThat(cleaned.codePoints().noneMatch(TextSanitizer::isPictographic)).isTrue();
	}

}
