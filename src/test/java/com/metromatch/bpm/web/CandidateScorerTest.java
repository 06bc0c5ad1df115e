package com.metromatch.bpm.web;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CandidateScorerTest {

    @Test
    void testScoreCountsWholeTokensAndSubstringBonus() {
        assertEquals(4, CandidateScorer.score("get-lucky-radio-edit", "get-lucky"));
        assertEquals(1, CandidateScorer.score("lucky-star", "get-lucky"));
        assertEquals(0, CandidateScorer.score("luckystrike", "get-lucky"));
    }

    @Test
    void testHighestScoreWins() {
        CandidateScorer.Selection selection = CandidateScorer.select(
            List.of("/@daft-punk/lucky-star", "/@daft-punk/get-lucky", "/@daft-punk/one-more-time"), "get-lucky").orElseThrow();
        assertEquals("/@daft-punk/get-lucky", selection.candidate().urlPath());
        assertTrue(selection.hasEvidence());
    }

    @Test
    void testTieKeepsFirstCollected() {
        CandidateScorer.Selection selection = CandidateScorer.select(
            List.of("/@daft-punk/get-lucky-radio-edit", "/@daft-punk/get-lucky-live"), "get-lucky").orElseThrow();
        assertEquals("/@daft-punk/get-lucky-radio-edit", selection.candidate().urlPath());
        assertEquals(4, selection.bestScore());
    }

    @Test
    void testExcludedLinksAreNotScored() {
        CandidateScorer.Selection selection = CandidateScorer.select(
            List.of("/@rihanna/work-instrumental", "/@rihanna/umbrella"), "work").orElseThrow();
        assertEquals("/@rihanna/umbrella", selection.candidate().urlPath());
        assertFalse(selection.hasEvidence());
    }

    @Test
    void testOnlyExcludedLinksFallBackToFirstCollected() {
        CandidateScorer.Selection selection = CandidateScorer.select(
            List.of("/@rihanna/work-instrumental", "/@rihanna/work-remix"), "work").orElseThrow();
        assertEquals("/@rihanna/work-instrumental", selection.candidate().urlPath());
        assertEquals(0, selection.bestScore());
    }

    @Test
    void testNoLinksNoSelection() {
        assertTrue(CandidateScorer.select(List.of(), "work").isEmpty());
    }

    @Test
    void testStrongMatch() {
        assertTrue(CandidateScorer.isStrongMatch("one-more-time-remastered", "one-more-time"));
        assertTrue(CandidateScorer.isStrongMatch("time-one-more", "one-more-time"));
        assertFalse(CandidateScorer.isStrongMatch("more-time", "one-more-time"));
        assertFalse(CandidateScorer.isStrongMatch("anything", ""));
    }
}
