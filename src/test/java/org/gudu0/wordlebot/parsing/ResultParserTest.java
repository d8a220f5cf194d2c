package org.gudu0.wordlebot.parsing;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ResultParserTest {

    private final ResultParser parser = new ResultParser();
    private final FakeResolver resolver = new FakeResolver()
            .with(1L, "alice", "Alice")
            .with(2L, "bob", "Bob Smith")
            .with(3L, "carol", null);

    @Test
    public void testStructuredMentions() {
        List<ParsedRecord> out = parser.parse("👑 3/6: <@1> <@!2>\n5/6: <@3>", 100L, resolver);

        assertEquals(3, out.size());
        assertEquals(1L, out.get(0).participant().id());
        assertEquals(3, out.get(0).attemptCount());
        assertTrue(out.get(0).succeeded());
        assertEquals(2L, out.get(1).participant().id());
        assertEquals(3, out.get(1).attemptCount());
        assertEquals(3L, out.get(2).participant().id());
        assertEquals(5, out.get(2).attemptCount());
    }

    @Test
    public void testFailureMarker() {
        List<ParsedRecord> out = parser.parse("<@!7> X/6", 100L, resolver);

        assertEquals(1, out.size());
        assertEquals(7L, out.get(0).participant().id());
        assertEquals(6, out.get(0).attemptCount());
        assertFalse(out.get(0).succeeded());
        assertFalse(out.get(0).participant().hasNames());
    }

    @Test
    public void testLowercaseFailureMarker() {
        List<ParsedRecord> out = parser.parse("x/6: <@1>", 100L, resolver);

        assertEquals(1, out.size());
        assertFalse(out.get(0).succeeded());
    }

    @Test
    public void testBareNameWithSpacesAndPunctuation() {
        List<ParsedRecord> out = parser.parse("4/6: @Bob Smith, @alice!", 100L, resolver);

        assertEquals(2, out.size());
        assertEquals(2L, out.get(0).participant().id());
        assertEquals(1L, out.get(1).participant().id());
        assertEquals(4, out.get(1).attemptCount());
    }

    @Test
    public void testBareNamesIgnoredWhenLineHasMention() {
        List<ParsedRecord> out = parser.parse("2/6: <@3> @alice", 100L, resolver);

        assertEquals(1, out.size());
        assertEquals(3L, out.get(0).participant().id());
    }

    @Test
    public void testFirstScoreOnLineWins() {
        List<ParsedRecord> out = parser.parse("<@1> 2/6 then 5/6", 100L, resolver);

        assertEquals(1, out.size());
        assertEquals(2, out.get(0).attemptCount());
    }

    @Test
    public void testLinesMissingScoreOrParticipantContributeNothing() {
        String corpus = "Here are yesterday's results: Wordle No. 1234\n"
                + "<@1> great job\n"
                + "3/6: @nobody\n"
                + "\n"
                + "4/6:";

        assertTrue(parser.parse(corpus, 100L, resolver).isEmpty());
    }

    @Test
    public void testEmailLikeTextIsNotABareName() {
        assertTrue(parser.parse("3/6 mail me at alice@example.com", 100L, resolver).isEmpty());
    }

    @Test
    public void testRawLineIsKept() {
        List<ParsedRecord> out = parser.parse("  1/6: <@1>  ", 100L, resolver);

        assertEquals("1/6: <@1>", out.get(0).rawLine());
    }
}
