package com.nei10u.taxmusr.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExpansionResponseParserTest {

    private final ExpansionResponseParser parser = new ExpansionResponseParser();

    @Test
    void recognisesBothPrefixesInOrder() {
        List<ExpansionResponseParser.ExpansionLine> lines = parser.parse("""
                Story Fact: "The couple is married."
                Rule: "Married couples may file together."
                Story Fact: Both partners live in Munich.
                """);

        assertEquals(3, lines.size());
        assertFalse(lines.get(0).rule());
        assertEquals("The couple is married.", lines.get(0).statement());
        assertTrue(lines.get(1).rule());
        assertEquals("Married couples may file together.", lines.get(1).statement());
        assertEquals("Both partners live in Munich.", lines.get(2).statement());
    }

    @Test
    void discardsUnknownAndEmptyLines() {
        List<ExpansionResponseParser.ExpansionLine> lines = parser.parse("""
                Fact: "Joint assessment is beneficial."
                Here are my facts:
                Story Fact: ""
                Rule:
                   Story Fact: "Indented lines still count."
                """);

        assertEquals(1, lines.size());
        assertEquals("Indented lines still count.", lines.get(0).statement());
    }

    @Test
    void keepsInnerQuotesAndHandlesWindowsLineEnds() {
        List<ExpansionResponseParser.ExpansionLine> lines =
                parser.parse("Story Fact: \"She calls it \"the tax thing\" at home.\"\r\nRule: “Curly quotes are trimmed.”");

        assertEquals("She calls it \"the tax thing\" at home.", lines.get(0).statement());
        assertEquals("Curly quotes are trimmed.", lines.get(1).statement());
    }

    @Test
    void nullOrBlankResponseYieldsNothing() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("  \n\n ").isEmpty());
    }
}
