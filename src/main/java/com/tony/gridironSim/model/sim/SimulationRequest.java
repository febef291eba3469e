package com.tony.gridironSim.model.sim;

import com.tony.gridironSim.config.EngineConfig;
import com.tony.gridironSim.model.profile.MatchupContext;
import com.tony.gridironSim.model.profile.TeamProfile;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SimulationRequest {

    @NonNull TeamProfile home;
    @NonNull TeamProfile away;

    // Attaque domicile vs défense extérieure, et inversement
    @Builder.Default MatchupContext homeMatchup = MatchupContext.NEUTRAL;
    @Builder.Default MatchupContext awayMatchup = MatchupContext.NEUTRAL;

    @Builder.Default EngineConfig config = EngineConfig.defaults();

    // Null = graine aléatoire (enregistrée dans le batch pour rejouer)
    Long seed;

    // Lignes de marché optionnelles (spread du point de vue domicile)
    Double spread;
    Double total;

    boolean traceDrives;
}
