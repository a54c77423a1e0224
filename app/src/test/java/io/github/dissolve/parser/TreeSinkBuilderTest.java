package io.github.dissolve.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.github.dissolve.sink.Attribute;
import io.github.dissolve.sink.ElementFlags;
import io.github.dissolve.sink.QualifiedName;
import io.github.dissolve.sink.QuirksMode;
import io.github.dissolve.testutil.RecordingSink;
import java.util.List;
import nu.validator.htmlparser.common.DocumentMode;
import org.junit.jupiter.api.Test;

class TreeSinkBuilderTest {

    private static List<String> parse(RecordingSink sink, String html) {
        return Html5Parser.parse(sink, html, ParseOptions.defaults());
    }

    @Test
    void testDocumentAndRootComeFirst() {
        var sink = new RecordingSink();
        var events = parse(sink, "<html>Hello World!</html>");
        assertEquals("document", events.get(0));
        assertEquals("append(#document,<html>)", events.get(1));
        assertEquals("Hello World!", sink.textUnder("body"));
    }

    @Test
    void testFosterParentedTextGoesThroughAppendBasedOnParentNode() {
        var sink = new RecordingSink();
        var events = parse(sink, "<html>a<table> b<tr> <td>c</td> </tr>d </table>e</html>");

        assertTrue(events.stream().anyMatch(e -> e.startsWith("foster(table,body,\"")), events.toString());
        assertEquals(" bd ", sink.fosterParentedText());
        assertEquals("c", sink.textUnder("td"));
        assertEquals("a b c d e", sink.text());
    }

    @Test
    void testElementInTableIsCreatedFosterParented() {
        var sink = new RecordingSink();
        var events = parse(sink, "<html><table><b>x</b><tr><td>y</td></tr></table></html>");

        assertTrue(events.contains("foster(table,body,<b>)"), events.toString());
        assertEquals("x", sink.textUnder("b"));
        assertEquals("xy", sink.text());
    }

    @Test
    void testTemplateChildrenAreAddressedToTemplateContents() {
        var sink = new RecordingSink();
        var events =
                parse(sink, "<html>aaa <template id=\"aaa\">bbb <b>x</b></template><title>ccc ddd</title></html>");

        assertEquals(1, events.stream().filter(e -> e.startsWith("templateContents(")).count(), events.toString());
        assertEquals("bbb ", sink.textUnder("#contents(template)"));
        assertTrue(events.contains("append(#contents(template),<b>)"), events.toString());
        assertEquals("x", sink.textUnder("b"));
        assertEquals("", sink.textUnder("template"));
        assertEquals(List.of(new ElementFlags(true, false)), sink.templateFlags());
        assertEquals("aaa bbb xccc ddd", sink.text());
    }

    @Test
    void testAdoptionAgencyReparentsChildren() {
        var sink = new RecordingSink();
        var events = parse(sink, "<b>1<p>2</b>3</p>");

        assertTrue(events.contains("reparent(p,b)"), events.toString());
        assertEquals("123", sink.text());
    }

    @Test
    void testMissingDoctypeMeansQuirks() {
        var sink = new RecordingSink();
        parse(sink, "<html>x</html>");
        assertEquals(List.of(QuirksMode.QUIRKS), sink.quirksModes());
    }

    @Test
    void testHtml5DoctypeMeansNoQuirks() {
        var sink = new RecordingSink();
        var events = parse(sink, "<!DOCTYPE html><p>x</p>");
        assertEquals(List.of(QuirksMode.NO_QUIRKS), sink.quirksModes());
        assertTrue(events.contains("doctype(html)"), events.toString());
    }

    @Test
    void testTransitionalDoctypeMeansLimitedQuirks() {
        var sink = new RecordingSink();
        parse(
                sink,
                "<!DOCTYPE html PUBLIC \"-//W3C//DTD XHTML 1.0 Transitional//EN\" "
                        + "\"http://www.w3.org/TR/xhtml1/DTD/xhtml1-transitional.dtd\"><p>x</p>");
        assertEquals(List.of(QuirksMode.LIMITED_QUIRKS), sink.quirksModes());
    }

    @Test
    void testSrcdocDocumentIsNeverQuirks() {
        var sink = new RecordingSink();
        Html5Parser.parse(sink, "<p>x</p>", ParseOptions.defaults().withIframeSrcdoc(true));
        assertEquals(List.of(QuirksMode.NO_QUIRKS), sink.quirksModes());
    }

    @Test
    void testCommentsAreCreatedAndAppended() {
        var events = parse(new RecordingSink(), "<!--top--><p>y<!--inner--></p>");
        assertTrue(events.contains("comment(\"top\")"), events.toString());
        assertTrue(events.contains("append(#document,<#comment>)"), events.toString());
        assertTrue(events.contains("comment(\"inner\")"), events.toString());
        assertTrue(events.contains("append(p,<#comment>)"), events.toString());
    }

    @Test
    void testIgnoringCommentsSkipsCommentCallbacks() {
        var sink = new RecordingSink();
        var events = Html5Parser.parse(
                sink, "<!--top--><p>y<!--inner--></p>", ParseOptions.defaults().withIgnoreComments(true));
        assertTrue(events.stream().noneMatch(e -> e.startsWith("comment(")), events.toString());
        assertEquals("y", sink.text());
    }

    @Test
    void testMalformedMarkupIsReportedButNotFatal() {
        var sink = new RecordingSink();
        parse(sink, "<html>a<b</html>");
        assertFalse(sink.errors().isEmpty());
        assertEquals("a", sink.text());
    }

    @Test
    void testExactErrorsCarryLocation() {
        var sink = new RecordingSink();
        Html5Parser.parse(sink, "<!DOCTYPE html>\n<p>x</b>", ParseOptions.defaults().withExactErrors(true));
        assertFalse(sink.errors().isEmpty());
        assertTrue(sink.errors().stream().anyMatch(m -> m.matches("\\d+:\\d+: .*")), sink.errors().toString());
    }

    @Test
    void testDuplicateHtmlAttributesAreMerged() {
        var events = parse(new RecordingSink(), "<html><body><html lang=\"en\">x</body></html>");
        assertTrue(events.contains("addAttributes(html)"), events.toString());
    }

    @Test
    void testDocumentModeMapping() {
        assertEquals(QuirksMode.NO_QUIRKS, TreeSinkBuilder.toQuirksMode(DocumentMode.STANDARDS_MODE));
        assertEquals(QuirksMode.LIMITED_QUIRKS, TreeSinkBuilder.toQuirksMode(DocumentMode.ALMOST_STANDARDS_MODE));
        assertEquals(QuirksMode.QUIRKS, TreeSinkBuilder.toQuirksMode(DocumentMode.QUIRKS_MODE));
    }

    @Test
    void testElementFlags() {
        assertEquals(
                new ElementFlags(true, false),
                TreeSinkBuilder.flagsFor(QualifiedName.HTML_NAMESPACE, "template", List.of()));
        assertEquals(ElementFlags.NONE, TreeSinkBuilder.flagsFor(QualifiedName.SVG_NAMESPACE, "template", List.of()));

        var htmlEncoding = List.of(new Attribute(QualifiedName.of("", "encoding"), "Text/HTML"));
        assertEquals(
                new ElementFlags(false, true),
                TreeSinkBuilder.flagsFor(QualifiedName.MATHML_NAMESPACE, "annotation-xml", htmlEncoding));

        var otherEncoding = List.of(new Attribute(QualifiedName.of("", "encoding"), "application/mathml+xml"));
        assertEquals(
                ElementFlags.NONE,
                TreeSinkBuilder.flagsFor(QualifiedName.MATHML_NAMESPACE, "annotation-xml", otherEncoding));
    }

    @Test
    void testForeignContentText() {
        var sink = new RecordingSink();
        parse(sink, "<p>a<svg><title>b</title><text>c</text></svg><math><mi>d</mi></math>e</p>");
        assertEquals("abcde", sink.text());
    }
}
