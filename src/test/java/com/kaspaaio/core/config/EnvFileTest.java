package com.kaspaaio.core.config;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvFileTest {

    @Test
    void rendersSortedKeysAfterHeader() {
        var env = new LinkedHashMap<String, String>();
        env.put("ZETA", "1");
        env.put("ALPHA", "two");

        assertEquals(EnvFile.HEADER + "ALPHA=two\nZETA=1\n", EnvFile.render(env));
    }

    @Test
    void rejectsLineBreaksAndBadKeys() {
        assertThrows(IllegalArgumentException.class, () -> EnvFile.render(Map.of("KEY", "a\nb")));
        assertThrows(IllegalArgumentException.class, () -> EnvFile.render(Map.of("lower", "x")));
    }

    @Test
    void parsesCommentsBlanksAndQuotes() {
        String text = "# comment\n\nA=\"quoted value\"\nB='single'\r\nC = plain\nD=\n";

        Map<String, String> env = EnvFile.parse(text);

        assertEquals(Map.of("A", "quoted value", "B", "single", "C", "plain", "D", ""), env);
    }

    @Test
    void parseRejectsMalformedLines() {
        var e = assertThrows(IllegalArgumentException.class, () -> EnvFile.parse("A=1\nnot a pair\n"));
        assertTrue(e.getMessage().startsWith("Line 2"));
        assertThrows(IllegalArgumentException.class, () -> EnvFile.parse("bad-key=1"));
    }

    @Test
    void parseOfRenderedFileGivesTheSameMap() {
        Map<String, String> env = Map.of("KASPA_NETWORK", "mainnet", "PORT", "16110");
        assertEquals(env, EnvFile.parse(EnvFile.render(env)));
    }

    @Test
    void quotesValuesParseWouldAlter() {
        var env = Map.of("A", "\"x\"", "B", "'y'", "C", " padded ", "D", "plain");

        String text = EnvFile.render(env);

        assertTrue(text.contains("A=\"\"x\"\"\n"));
        assertTrue(text.contains("D=plain\n"));
        assertEquals(env, EnvFile.parse(text));
    }
}
