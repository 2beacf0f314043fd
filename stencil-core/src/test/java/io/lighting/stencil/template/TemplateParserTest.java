package io.lighting.stencil.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.stencil.Stencil;
import io.lighting.stencil.TemplateSyntaxException;
import io.lighting.stencil.filter.FilterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateParserTest {
    private final Stencil stencil = Stencil.builder().filters(FilterRegistry.standard()).build();

    @Test
    void parsesConditionalChain() {
        SequenceNode root = TemplateParser.parse(null, "{{ if a }}A{{ elif b }}B{{ elseif c }}C{{ else }}D{{ endif }}", true);
        assertEquals(1, root.children().size());
        IfNode node = assertInstanceOf(IfNode.class, root.children().get(0));
        assertEquals(3, node.branches().size());
        assertNotNull(node.elseBody());
        assertEquals(List.of(new RawNode("D")), node.elseBody().children());
    }

    @Test
    void parsesLoopsWithEitherSeparator() {
        ForNode in = assertInstanceOf(ForNode.class, TemplateParser.parse(null, "{{ for x in xs }}{{ x }}{{ end }}", true).children().get(0));
        ForNode colon = assertInstanceOf(ForNode.class, TemplateParser.parse(null, "{{ for x : xs }}{{ x }}{{ endfor }}", true).children().get(0));
        assertEquals("x", in.variable());
        assertEquals("x", colon.variable());
        assertInstanceOf(OutputNode.class, colon.body().children().get(0));
    }

    @Test
    void keepsIncludeArgumentsInOrder() {
        SequenceNode root = TemplateParser.parse(null, "{{ include \"row.html\" b = 1, a = x | add: 1, 2 }}", true);
        IncludeNode node = assertInstanceOf(IncludeNode.class, root.children().get(0));
        assertEquals("row.html", node.path());
        assertEquals(List.of("b", "a"), List.copyOf(node.arguments().keySet()));
        assertEquals("row.html", assertInstanceOf(IncludeNode.class, TemplateParser.parse(null, "{{ use 'row.html' }}", true).children().get(0)).path());
    }

    @Test
    void assignAcceptsBothKeywords() {
        assertEquals("12", stencil.render("{{ set a = 1 }}{{ assign b = 2 }}{{ a }}{{ b }}", Map.of()));
    }

    @Test
    void statementAliasesDoubleAsNames() {
        assertEquals("x", stencil.render("{{ use }}", Map.of("use", "x")));
        assertEquals("y", stencil.render("{{ add | upper | lower }}", Map.of("add", "Y")));
        assertEquals("3", stencil.render("{{ assign | add: 1 }}", Map.of("assign", 2L)));
        assertEquals("5", stencil.render("{{ assign use = 5 }}{{ use }}", Map.of()));
        assertEquals("ab", stencil.render("{{ for add in [\"a\", \"b\"] }}{{ add }}{{ end }}", Map.of()));

        IncludeNode node = assertInstanceOf(
            IncludeNode.class,
            TemplateParser.parse(null, "{{ use \"row.html\" add = 1 }}", true).children().get(0)
        );
        assertEquals(List.of("add"), List.copyOf(node.arguments().keySet()));
    }

    @Test
    void appliesOperatorPrecedence() {
        assertEquals("true", stencil.render("{{ not a == b }}", Map.of("a", 1, "b", 2)));
        assertEquals("C", stencil.render("{{ a or b and c }}", Map.of("a", 0, "b", "B", "c", "C")));
        assertEquals("0", stencil.render("{{ (a or b) and c }}", Map.of("a", 0, "b", 0, "c", "C")));
        assertEquals("true", stencil.render("{{ \"abc\" | length == 3 }}", Map.of()));
    }

    @Test
    void parsesConstantsAndLists() {
        assertEquals("true|false|", stencil.render("{{ true }}|{{ false }}|{{ null }}", Map.of()));
        assertEquals("[1, two, 3.5]", stencil.render("{{ [1, \"two\", 3.5] }}", Map.of()));
        assertEquals("[]", stencil.render("{{ [] }}", Map.of()));
        assertEquals("b", stencil.render("{{ [\"a\", \"b\"][1] }}", Map.of()));
    }

    @Test
    void rejectsUnterminatedBlock() {
        TemplateSyntaxException error = assertThrows(
            TemplateSyntaxException.class,
            () -> TemplateParser.parse(null, "{{ if x }}open", true)
        );
        assertEquals("Expected one of elif, else, elseif, end, endif but found end of input", error.reason());
    }

    @Test
    void rejectsStrayKeyword() {
        TemplateSyntaxException error = assertThrows(
            TemplateSyntaxException.class,
            () -> TemplateParser.parse(null, "a {{ else }}", true)
        );
        assertEquals("Unexpected keyword 'else'", error.reason());
        assertEquals(5, error.offset());
    }

    @Test
    void rejectsMismatchedTerminator() {
        assertThrows(
            TemplateSyntaxException.class,
            () -> TemplateParser.parse(null, "{{ for x in xs }}{{ endif }}", true)
        );
    }

    @Test
    void rejectsChainedComparison() {
        TemplateSyntaxException error = assertThrows(
            TemplateSyntaxException.class,
            () -> TemplateParser.parse(null, "{{ a < b < c }}", true)
        );
        assertEquals("Comparison operators cannot be chained", error.reason());
    }

    @Test
    void reportsLineAndColumnOfUnexpectedToken() {
        TemplateSyntaxException error = assertThrows(
            TemplateSyntaxException.class,
            () -> stencil.compile("line1\n{{ x | }}", "page.html")
        );
        assertEquals("Expected identifier but found rdelim '}}'", error.reason());
        assertEquals(2, error.line());
        assertEquals(8, error.column());
        assertEquals("page.html", error.templateName());
        assertTrue(error.getMessage().endsWith("(in page.html at line 2, col 8)"));
    }

    @Test
    void rejectsMalformedStatements() {
        assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse(null, "{{ x ", true));
        assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse(null, "{{ }}", true));
        assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse(null, "{{ for x of xs }}{{ end }}", true));
        assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse(null, "{{ set = 1 }}", true));
        assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse(null, "{{ include page }}", true));
        assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse(null, "{{ include \"a\" b = 1, b = 2 }}", true));
        assertThrows(TemplateSyntaxException.class, () -> TemplateParser.parse(null, "{{ [1, 2 }}", true));
    }
}
