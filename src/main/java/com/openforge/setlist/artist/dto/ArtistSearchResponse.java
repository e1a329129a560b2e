package com.openforge.setlist.artist.dto;

import java.util.List;

public record ArtistSearchResponse(
        List<ArtistSummary> artists,
        Pagination          pagination
) {

    /**
     * @param page  1-based page number
     * @param pages total number of pages for this limit
     */
    public record Pagination(
            int  page,
            int  limit,
            long total,
            int  pages
    ) {}
}
