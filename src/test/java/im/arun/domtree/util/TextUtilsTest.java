package im.arun.domtree.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TextUtils Tests")
class TextUtilsTest {

    @Test
    @DisplayName("should strip ASCII and no-break whitespace from both ends")
    void shouldStripUnicodeWhitespace() {
        assertThat(TextUtils.strip("  \tword \n")).isEqualTo("word");
        assertThat(TextUtils.strip("  ")).isEmpty();
        assertThat(TextUtils.strip("a b")).isEqualTo("a b");
        assertThat(TextUtils.strip(null)).isEmpty();
    }

    @Test
    @DisplayName("should split text into stripped sentences")
    void shouldSplitSentences() {
        assertThat(TextUtils.splitSentences("First one. Second one! Third?"))
            .containsExactly("First one.", "Second one!", "Third?");
    }

    @Test
    @DisplayName("should return no sentences for blank text")
    void shouldReturnNothingForBlankText() {
        assertThat(TextUtils.splitSentences("")).isEmpty();
        assertThat(TextUtils.splitSentences("   ")).isEmpty();
        assertThat(TextUtils.splitSentences(null)).isEmpty();
    }
}
