package com.moviegraph.dto.catalog;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

// ========== Movie Listing ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MovieListing {
    private String title;
    private Integer year;
    private Double rating;
    private List<String> genres;
}
