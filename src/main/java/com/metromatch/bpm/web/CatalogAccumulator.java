package com.metromatch.bpm.web;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * State carried through one catalog scan: collected song links in first-seen order and the listing pages visited.
 */
public class CatalogAccumulator {
    private final int maxPages;
    private final Set<String> songPaths = new LinkedHashSet<>();
    private final Set<String> visitedPages = new LinkedHashSet<>();

    public CatalogAccumulator(int maxPages) {
        this.maxPages = maxPages;
    }

    public boolean canVisitMore() {
        return visitedPages.size() < maxPages;
    }

    /**
     * Records a listing page as visited.
     * @return false if the page had already been visited
     */
    public boolean markVisited(String pageKey) {
        return visitedPages.add(pageKey);
    }

    public boolean wasVisited(String pageKey) {
        return visitedPages.contains(pageKey);
    }

    public int pagesVisited() {
        return visitedPages.size();
    }

    /**
     * Adds a song link; duplicates keep their first position.
     */
    public void addSongPath(String path) {
        songPaths.add(path);
    }

    public List<String> songPaths() {
        return Collections.unmodifiableList(new ArrayList<>(songPaths));
    }

    public boolean isEmpty() {
        return songPaths.isEmpty();
    }
}
