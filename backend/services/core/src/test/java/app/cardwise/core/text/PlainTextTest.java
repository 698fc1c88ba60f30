package app.cardwise.core.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PlainTextTest {

    @Test
    void strip_replacesTagsWithSpaceAndDecodesEntities() {
        assertThat(PlainText.strip("<td>a</td><td>b</td>")).isEqualTo("a b");
        assertThat(PlainText.strip("Tom &amp; Jerry&nbsp;&lt;3")).isEqualTo("Tom & Jerry <3");
    }

    @Test
    void strip_handlesNullAndEmpty() {
        assertThat(PlainText.strip(null)).isEmpty();
        assertThat(PlainText.strip("")).isEmpty();
        assertThat(PlainText.collapse(null)).isEmpty();
    }

    @Test
    void decodeEntities_decodesAmpersandLast() {
        assertThat(PlainText.decodeEntities("&amp;lt;")).isEqualTo("&lt;");
    }
}
