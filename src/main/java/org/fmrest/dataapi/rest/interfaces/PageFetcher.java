package org.fmrest.dataapi.rest.interfaces;

import org.fmrest.dataapi.rest.Foundset;

/**
 * Fetches further pages of a query for a {@link Foundset}.
 */
public interface PageFetcher {

    /**
     * Fetches the page starting at the given 1-based offset.
     *
     * @param offset Offset of the first record of the page.
     * @return       The page; an empty page when no further data is available.
     */
    Foundset.Page fetch(int offset);

}
