package com.moviegraph.dto.catalog;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

// ========== Movie Details ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MovieDetails {
    private String title;
    private Integer year;
    private Double rating;
    private String tagline;
    private String description;
    private List<String> directors;
    private List<String> cast;
    private List<String> genres;
}
