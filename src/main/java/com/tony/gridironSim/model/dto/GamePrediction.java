package com.tony.gridironSim.model.dto;

import com.tony.gridironSim.model.profile.ProfileMode;
import com.tony.gridironSim.model.sim.PredictionStatus;
import com.tony.gridironSim.model.sim.SimulationBatch;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class GamePrediction {
    Long gameId;
    String homeTeam;
    String awayTeam;
    int season;
    int week;

    PredictionStatus status;
    String message;

    ProfileMode homeMode;
    ProfileMode awayMode;

    SimulationBatch batch;
    @Builder.Default
    BetRecommendation recommendation = BetRecommendation.NONE;
}
