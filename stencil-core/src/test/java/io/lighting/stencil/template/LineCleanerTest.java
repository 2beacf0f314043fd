package io.lighting.stencil.template;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.lighting.stencil.Stencil;
import io.lighting.stencil.filter.FilterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LineCleanerTest {
    private final Stencil stencil = Stencil.builder().filters(FilterRegistry.standard()).build();

    @Test
    void removesLinesHeldByStatementTags() {
        assertEquals("before\nX\nafter", stencil.render("before\n{{ if true }}\nX\n{{ end }}\nafter", Map.of()));
    }

    @Test
    void keepsIndentationOfBodyLines() {
        String source = "<ul>\n  {{ for i in items }}\n  <li>{{ i }}</li>\n  {{ end }}\n</ul>";
        assertEquals(
            "<ul>\n  <li>1</li>\n  <li>2</li>\n</ul>",
            stencil.render(source, Map.of("items", List.of(1, 2)))
        );
    }

    @Test
    void handlesWindowsLineEndings() {
        assertEquals("|\r\n|", stencil.render("|\r\n{{ if 1 }}\r\n{{ end }}\r\n|", Map.of()));
    }

    @Test
    void collapsesConsecutiveTagLines() {
        assertEquals("", stencil.render("{{ if 1 }}\n{{ end }}\n", Map.of()));
        assertEquals("#\n/\n", stencil.render("#{{ if 1 }}\n/\n  {{ end }}", Map.of()));
    }

    @Test
    void leavesOutputTagsAndInlineTagsAlone() {
        assertEquals("a\nv\nb", stencil.render("a\n{{ x }}\nb", Map.of("x", "v")));
        assertEquals("a\nv\nb", stencil.render("a\n{{ use }}\nb", Map.of("use", "v")));
        assertEquals("a\nb", stencil.render("a\n{{ assign use = 1 }}\nb", Map.of()));
        assertEquals(
            " YES\n GOOD\n",
            stencil.render(" {{ if 1 }}YES{{ end }}\n {{ if 1 }}GOOD{{ end }}\n", Map.of())
        );
    }

    @Test
    void canBeDisabled() {
        Stencil raw = Stencil.builder().filters(FilterRegistry.standard()).cleanLines(false).build();
        assertEquals("a\n\nb\n\n", raw.render("a\n{{ if true }}\nb\n{{ end }}\n", Map.of()));
    }
}
