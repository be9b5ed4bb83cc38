package com.linetrace.instrument.source;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceNormalizerTest {

    // --- findIndentLevel ---

    @Test
    void indentOfFirstLine() {
        assertEquals(4, SourceNormalizer.findIndentLevel("    static void foo() {\n        int x = 1;\n    }"));
    }

    @Test
    void whitespaceOnlyFirstLineYieldsItsLength() {
        assertEquals(4, SourceNormalizer.findIndentLevel("    "));
    }

    @Test
    void emptyTextYieldsZero() {
        assertEquals(0, SourceNormalizer.findIndentLevel(""));
    }

    @Test
    void tabsCountAsOneColumn() {
        assertEquals(1, SourceNormalizer.findIndentLevel("\tvoid foo() {}"));
    }

    // --- stripIndent ---

    @Test
    void stripsIndentFromEveryLine() {
        String indented = String.join("\n",
            "    static void foo() {",
            "        int x = 3;",
            "",
            "        int y = 4;",
            "        // comment here",
            "        if (x == 3) {",
            "            y = 5;",
            "        }",
            "    }");
        String stripped = String.join("\n",
            "static void foo() {",
            "    int x = 3;",
            "",
            "    int y = 4;",
            "    // comment here",
            "    if (x == 3) {",
            "        y = 5;",
            "    }",
            "}");
        assertEquals(stripped, SourceNormalizer.stripIndent(indented));
    }

    @Test
    void shortBlankLinesBecomeEmpty() {
        assertEquals("void f() {\n\n}", SourceNormalizer.stripIndent("    void f() {\n  \n    }"));
    }

    @Test
    void underIndentedLineKeepsItsText() {
        assertEquals("void f() {\n}\n/* x */", SourceNormalizer.stripIndent("    void f() {\n    }\n  /* x */"));
    }

    @Test
    void lineShorterThanIndentKeepsItsText() {
        assertEquals("f();\n}\n", SourceNormalizer.stripIndent("        f();\n  }\n   "));
    }

    @Test
    void unindentedTextIsUnchanged() {
        String text = "static int f() {\n    return 1;\n}";
        assertEquals(text, SourceNormalizer.stripIndent(text));
    }

    @Test
    void strippingTwiceChangesNothing() {
        String once = SourceNormalizer.stripIndent("    void f() {\n        g();\n    }");
        assertEquals(once, SourceNormalizer.stripIndent(once));
    }
}
