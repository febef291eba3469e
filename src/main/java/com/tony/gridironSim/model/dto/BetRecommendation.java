package com.tony.gridironSim.model.dto;

import com.tony.gridironSim.model.BetSide;
import lombok.Builder;
import lombok.Value;

/**
 * Au plus un pari écart et un pari total par match. Champs nuls = pas de pari.
 */
@Value
@Builder
public class BetRecommendation {

    public static final BetRecommendation NONE = BetRecommendation.builder().build();

    BetSide spreadPick;
    Double spreadLine;
    Double spreadEdge;      // points d'écart modèle - marché

    BetSide totalPick;
    Double totalLine;
    Double totalEdge;

    public boolean hasSpreadPick() {
        return spreadPick != null;
    }

    public boolean hasTotalPick() {
        return totalPick != null;
    }
}
