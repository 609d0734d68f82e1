package im.arun.domtree.dom;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("JsoupParsedNode Tests")
class JsoupParsedNodeTest {

    @Test
    @DisplayName("should expose lower-case element names and no name for text or the document")
    void shouldExposeElementNames() {
        Document document = Jsoup.parseBodyFragment("<DIV>text<!-- c --></DIV>");
        Element div = document.body().child(0);

        assertThat(JsoupParsedNode.of(document).elementName()).isEmpty();
        assertThat(JsoupParsedNode.of(div).elementName()).contains("div");

        List<JsoupParsedNode> children = JsoupParsedNode.of(div).children();
        assertThat(children).hasSize(2);
        assertThat(children).allSatisfy(child -> assertThat(child.elementName()).isEmpty());
    }

    @Test
    @DisplayName("should keep class order and duplicates")
    void shouldKeepClassOrderAndDuplicates() {
        Element div = Jsoup.parseBodyFragment("<div class='  b a\tb '></div>").body().child(0);

        assertThat(JsoupParsedNode.of(div).classList()).containsExactly("b", "a", "b");
    }

    @Test
    @DisplayName("should return no classes when the attribute is missing or blank")
    void shouldReturnNoClasses() {
        Element body = Jsoup.parseBodyFragment("<p></p><p class=''></p>").body();

        assertThat(JsoupParsedNode.of(body.child(0)).classList()).isEmpty();
        assertThat(JsoupParsedNode.of(body.child(1)).classList()).isEmpty();
    }
}
