package com.example.meetingscheduler.parser;

import com.example.meetingscheduler.domain.model.MeetingPriority;
import com.example.meetingscheduler.domain.model.ParsedRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RequestParserTest {

    // a Wednesday
    private static final LocalDate TODAY = LocalDate.of(2025, 6, 11);

    private RequestParser parser;

    @BeforeEach
    public void setUp() {
        Clock clock = Clock.fixed(TODAY.atTime(8, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        parser = new RequestParser(clock);
    }

    @Test
    public void testFullRequestIsUnderstood() {
        ParsedRequest parsed = parser.parse("Schedule a meeting with John and Sarah tomorrow at 2pm for 1 hour");

        assertEquals(List.of("John", "Sarah"), parsed.getParticipantNames());
        assertTrue(parsed.getParticipantEmails().isEmpty());
        assertEquals(TODAY.plusDays(1), parsed.getDateMentioned());
        assertEquals("2:00 PM", parsed.getTimeMentioned());
        assertEquals("1 hour", parsed.getDurationMentioned());
        assertEquals("A Meeting With", parsed.getTitle());
        assertNull(parsed.getPriorityMentioned());
        assertEquals(1.0, parsed.getConfidence(), 1e-9);
        assertTrue(parsed.isUnderstood(0.3));
    }

    @Test
    public void testParseWithoutExplicitDateUsesClock() {
        ParsedRequest parsed = parser.parse("Call with Mike today");
        assertEquals(TODAY, parsed.getDateMentioned());
    }

    @Test
    public void testBlankTextHasZeroConfidence() {
        assertEquals(0.0, parser.parse("   ", TODAY).getConfidence());
        assertEquals(0.0, parser.parse(null, TODAY).getConfidence());
        assertFalse(parser.parse("", TODAY).isUnderstood(0.3));
    }

    @Test
    public void testSingleWordIsNotUnderstood() {
        ParsedRequest parsed = parser.parse("hello", TODAY);
        assertEquals(0.1, parsed.getConfidence(), 1e-9);
        assertFalse(parsed.isUnderstood(0.3));
    }

    @Test
    public void testConfidenceStaysInRange() {
        String[] inputs = {
                "urgent meeting call sync standup review demo with Amy and Chris tomorrow at 9am for 2 hours",
                "x",
                "!!!",
                "Lunch",
                "\"\" \"\"",
                "meet bob@corp.io 13/45/2025 99:99"
        };
        for (String input : inputs) {
            double confidence = parser.parse(input, TODAY).getConfidence();
            assertTrue(confidence >= 0.0 && confidence <= 1.0, input + " -> " + confidence);
        }
    }

    @Test
    public void testKeywordBonusIsCapped() {
        // base + title + 3 keywords capped at 0.15
        ParsedRequest parsed = parser.parse("sync call review demo", TODAY);
        assertEquals(0.1 + 0.1 + 0.15, parsed.getConfidence(), 1e-9);
    }

    @Test
    public void testEmailsAreDeduplicatedInOrder() {
        ParsedRequest parsed = parser.parse("Meet alice@example.io and bob@corp.org, then alice@example.io again", TODAY);
        assertEquals(List.of("alice@example.io", "bob@corp.org"), parsed.getParticipantEmails());
    }

    @Test
    public void testFullNamesAreCaptured() {
        ParsedRequest parsed = parser.parse("Meeting with John Smith and Jennifer Lee on Friday", TODAY);
        assertEquals(List.of("John Smith", "Jennifer Lee"), parsed.getParticipantNames());
    }

    @Test
    public void testCalendarWordsAreNotNames() {
        ParsedRequest parsed = parser.parse("Call with Team on Monday and Tuesday", TODAY);
        assertTrue(parsed.getParticipantNames().isEmpty());
    }

    @Test
    public void testCommaSeparatedNameAndDictionaryFallback() {
        ParsedRequest parsed = parser.parse("quick sync, Mike, let's also ping Amy", TODAY);
        assertEquals(List.of("Mike", "Amy"), parsed.getParticipantNames());
    }

    @Test
    public void testRelativeDates() {
        assertEquals(TODAY.minusDays(1), parser.parse("what about yesterday", TODAY).getDateMentioned());
        assertEquals(TODAY.plusDays(1), parser.parse("Tomorrow works", TODAY).getDateMentioned());
    }

    @Test
    public void testWeekdayOnSameDayMovesToNextWeek() {
        assertEquals(LocalDate.of(2025, 6, 18), parser.parse("review on wednesday", TODAY).getDateMentioned());
        assertEquals(LocalDate.of(2025, 6, 18), parser.parse("review next Wednesday", TODAY).getDateMentioned());
        assertEquals(LocalDate.of(2025, 6, 13), parser.parse("sync on Friday", TODAY).getDateMentioned());
        assertEquals(LocalDate.of(2025, 6, 16), parser.parse("this monday please", TODAY).getDateMentioned());
    }

    @Test
    public void testMonthNameDates() {
        assertEquals(LocalDate.of(2025, 7, 3), parser.parse("demo on July 3rd", TODAY).getDateMentioned());
        // already past this year
        assertEquals(LocalDate.of(2026, 3, 3), parser.parse("demo on March 3", TODAY).getDateMentioned());
        assertNull(parser.parse("demo on February 30", TODAY).getDateMentioned());
    }

    @Test
    public void testNumericDates() {
        assertEquals(LocalDate.of(2025, 7, 4), parser.parse("call on 7/4", TODAY).getDateMentioned());
        assertEquals(LocalDate.of(2026, 12, 25), parser.parse("call on 12/25/26", TODAY).getDateMentioned());
        assertEquals(LocalDate.of(2027, 1, 2), parser.parse("call on 1-2-2027", TODAY).getDateMentioned());
        assertNull(parser.parse("call on 13/45", TODAY).getDateMentioned());
    }

    @Test
    public void testTimes() {
        assertEquals("9:30 AM", parser.parse("standup at 9:30am", TODAY).getTimeMentioned());
        assertEquals("11:00 AM", parser.parse("standup at 11 AM", TODAY).getTimeMentioned());
        assertEquals("2:30 PM", parser.parse("standup at 14:30", TODAY).getTimeMentioned());
        assertEquals("12:15 AM", parser.parse("standup at 0:15", TODAY).getTimeMentioned());
        assertEquals("12:00 PM", parser.parse("standup at 12:00", TODAY).getTimeMentioned());
    }

    @Test
    public void testOutOfRangeTimesAreRejected() {
        assertNull(parser.parse("standup at 13pm", TODAY).getTimeMentioned());
        assertNull(parser.parse("standup at 25:00", TODAY).getTimeMentioned());
        assertNull(parser.parse("standup at 10:75", TODAY).getTimeMentioned());
    }

    @Test
    public void testDurations() {
        assertEquals("1.5 hours", parser.parse("review for 90 minutes", TODAY).getDurationMentioned());
        assertEquals("1.5 hours", parser.parse("review for 1 hour and 30 minutes", TODAY).getDurationMentioned());
        assertEquals("2.5 hours", parser.parse("review for 2.5 hours", TODAY).getDurationMentioned());
        assertEquals("45 minutes", parser.parse("review for 45 mins", TODAY).getDurationMentioned());
        assertEquals("100 minutes", parser.parse("review for 100 minutes", TODAY).getDurationMentioned());
        assertEquals("30 minutes", parser.parse("review for half an hour", TODAY).getDurationMentioned());
        assertNull(parser.parse("review for 0 minutes", TODAY).getDurationMentioned());
    }

    @Test
    public void testHalfHourFractionIsNotADate() {
        ParsedRequest parsed = parser.parse("chat for 1/2 hour", TODAY);
        assertEquals("30 minutes", parsed.getDurationMentioned());
        assertNull(parsed.getDateMentioned());

        ParsedRequest withArticle = parser.parse("Sync with John for 1/2 an hour", TODAY);
        assertEquals("30 minutes", withArticle.getDurationMentioned());
        assertNull(withArticle.getDateMentioned());

        assertNull(parser.parse("Quick 10-15 minute call with John", TODAY).getDateMentioned());
        assertNull(parser.parse("a 5/10 min check-in with Amy", TODAY).getDateMentioned());
        assertEquals(LocalDate.of(2025, 10, 15), parser.parse("call with John on 10/15", TODAY).getDateMentioned());
    }

    @Test
    public void testLeadingVerbIsNotPartOfAName() {
        ParsedRequest parsed = parser.parse("Meet John and Sarah tomorrow at 3pm", TODAY);
        assertEquals(2, parsed.getParticipantNames().size());
        assertTrue(parsed.getParticipantNames().containsAll(List.of("John", "Sarah")));

        assertEquals(List.of("Mike"), parser.parse("Invite Mike to the planning call", TODAY).getParticipantNames());
    }

    @Test
    public void testPriorities() {
        assertEquals(MeetingPriority.URGENT, parser.parse("urgent call with Amy", TODAY).getPriorityMentioned());
        assertEquals(MeetingPriority.HIGH, parser.parse("important review", TODAY).getPriorityMentioned());
        assertEquals(MeetingPriority.HIGH, parser.parse("high priority review", TODAY).getPriorityMentioned());
        assertEquals(MeetingPriority.LOW, parser.parse("low priority catch up", TODAY).getPriorityMentioned());
        assertNull(parser.parse("catch up with Amy", TODAY).getPriorityMentioned());
    }

    @Test
    public void testTitles() {
        assertEquals("Q3 Roadmap", parser.parse("Plan \"Q3 Roadmap\" review with Amy", TODAY).getTitle());
        assertEquals("Budget", parser.parse("Set up “Budget” with Chris", TODAY).getTitle());
        assertEquals("Design Review", parser.parse("Book a design review", TODAY).getTitle());
        assertEquals("Lunch Tomorrow With Amy", parser.parse("lunch tomorrow with Amy", TODAY).getTitle());
    }

    @Test
    public void testDescriptionNeedsMinimumLength() {
        assertNull(parser.parse("sync with Amy", TODAY).getDescription());
        String longText = "Quarterly planning session with the whole team";
        assertEquals(longText, parser.parse(longText, TODAY).getDescription());
    }

    @Test
    public void testFailingStrategyDegradesToAbsent() {
        ExtractorChain<String> chain = new ExtractorChain<>("title", List.<FieldExtractor<String>>of(
                (text, today) -> {
                    throw new IllegalStateException("boom");
                },
                (text, today) -> "fallback"));
        assertEquals("fallback", chain.firstMatch("anything", TODAY));
    }
}
