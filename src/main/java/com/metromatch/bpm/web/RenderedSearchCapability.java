package com.metromatch.bpm.web;

import java.util.Optional;

/**
 * Best-effort headless-browser search of the site. Implementations never throw: every failure, including a
 * missing browser or a timeout, is reported as empty. A pipeline without this capability simply skips the
 * rendered search.
 */
public interface RenderedSearchCapability {
    /**
     * Submits a free-text query through the site's search UI, follows the first song result and returns the
     * rendered HTML of that song page.
     * @param query "artist title"
     * @return rendered song page, or empty
     */
    Optional<FetchedPage> renderFirstResult(String query);
}
