package app.cardwise.core.cloze;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClozeEngineTest {

    private final ClozeEngine engine = new ClozeEngine();

    @Test
    void listIndices_returnsDistinctSortedIndices() {
        String text = "{{c2::Paris}} is in {{c1::France}}, {{c2::capital}}";

        assertThat(engine.listIndices(text)).containsExactly(1, 2);
        assertThat(engine.count(text)).isEqualTo(2);
        assertThat(engine.nextIndex(text)).isEqualTo(3);
    }

    @Test
    void parse_readsHintAndContent() {
        List<ClozeMarker> markers = engine.parse("The {{c1::mitochondria::organelle}} is the powerhouse");

        assertThat(markers).hasSize(1);
        ClozeMarker marker = markers.get(0);
        assertThat(marker.index()).isEqualTo(1);
        assertThat(marker.content()).isEqualTo("mitochondria");
        assertThat(marker.hint()).isEqualTo("organelle");
        assertThat(marker.hasHint()).isTrue();
    }

    @Test
    void parse_balancesNestedMarkersAndMarkup() {
        String text = "{{c1::outer {{c2::inner}} text}} and {{c3::<b>{{tag}}</b>}}";

        List<ClozeMarker> markers = engine.parse(text);

        assertThat(markers).extracting(ClozeMarker::index).containsExactly(1, 3);
        assertThat(markers.get(0).children()).extracting(ClozeMarker::index).containsExactly(2);
        assertThat(markers.get(1).content()).isEqualTo("<b>{{tag}}</b>");
        assertThat(engine.listIndices(text)).containsExactly(1, 2, 3);
    }

    @Test
    void parse_ignoresMalformedMarkersWithoutThrowing() {
        assertThat(engine.parse("{{c::missing index}} {{c0::zero}} {{c1::unclosed")).isEmpty();
        assertThat(engine.listIndices(null)).isEmpty();
        assertThat(engine.count("")).isZero();
    }

    @Test
    void validate_reportsGapEmptyContentAndMalformedMarkers() {
        assertThat(engine.validate("{{c1::a}} {{c3::b}}"))
                .extracting(ClozeIssue::type)
                .containsExactly(ClozeIssue.Type.GAP);
        assertThat(engine.count("{{c1::a}} {{c3::b}}")).isEqualTo(2);

        assertThat(engine.validate("{{c1::  }}"))
                .extracting(ClozeIssue::type)
                .containsExactly(ClozeIssue.Type.EMPTY_CONTENT);

        assertThat(engine.validate("{{c1::open"))
                .extracting(ClozeIssue::type)
                .contains(ClozeIssue.Type.MALFORMED);

        assertThat(engine.validate("{{c1::a}} {{c2::b}}")).isEmpty();
    }

    @Test
    void renumber_mapsIndicesInOrderOfAppearance() {
        assertThat(engine.renumber("{{c3::a}} {{c5::b}} {{c3::c}}")).isEqualTo("{{c1::a}} {{c2::b}} {{c1::c}}");
        assertThat(engine.renumber("{{c5::a}} {{c2::b}}")).isEqualTo("{{c1::a}} {{c2::b}}");
    }

    @Test
    void renumber_leavesContiguousIndicesUntouched() {
        String text = "{{c2::a}} {{c1::b}}";

        assertThat(engine.renumber(text)).isSameAs(text);
    }

    @Test
    void extractPreviews_masksOnlyTheTargetIndex() {
        List<ClozePreview> previews = engine.extractPreviews("{{c1::Paris}} is the capital of {{c2::France::country}}");

        assertThat(previews).extracting(ClozePreview::index).containsExactly(1, 2);
        assertThat(previews.get(0).preview()).isEqualTo("[...] is the capital of France");
        assertThat(previews.get(1).preview()).isEqualTo("Paris is the capital of [country]");
    }

    @Test
    void extractPreviews_stripsHtml() {
        List<ClozePreview> previews = engine.extractPreviews("<div>{{c1::<i>H</i>2O}}&nbsp;is water</div>");

        assertThat(previews.get(0).preview()).isEqualTo("[...] is water");
    }

    @Test
    void insertAt_wrapsSelectionWithNextIndex() {
        ClozeInsertion insertion = engine.insertAt("{{c1::Paris}} is in France", new TextSelection(20, 26), null);

        assertThat(insertion.text()).isEqualTo("{{c1::Paris}} is in {{c2::France}}");
        assertThat(insertion.index()).isEqualTo(2);
        assertThat(insertion.text().substring(insertion.selection().start(), insertion.selection().end())).isEqualTo("France");
    }

    @Test
    void insertAt_usesPlaceholderForEmptySelection() {
        ClozeInsertion insertion = engine.insertAt("Capital: ", new TextSelection(9, 9), 4);

        assertThat(insertion.text()).isEqualTo("Capital: {{c4::...}}");
        assertThat(insertion.selection()).isEqualTo(new TextSelection(15, 18));
    }

    @Test
    void insertWithHint_appendsHint() {
        ClozeInsertion insertion = engine.insertWithHint("Water is H2O", new TextSelection(9, 12), "formula", null);

        assertThat(insertion.text()).isEqualTo("Water is {{c1::H2O::formula}}");
        assertThat(engine.parse(insertion.text()).get(0).hint()).isEqualTo("formula");
    }

    @Test
    void insertAt_rejectsSelectionBeyondText() {
        assertThatThrownBy(() -> engine.insertAt("abc", new TextSelection(1, 5), null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> engine.insertAt("abc", new TextSelection(0, 1), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
