package com.moviegraph.dto.catalog;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// ========== Graph Statistics ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphStatistics {
    private long totalMovies;
    private long totalPeople;
    private long totalGenres;
    private long totalRelationships;
}
