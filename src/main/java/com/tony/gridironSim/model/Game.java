package com.tony.gridironSim.model;

import com.tony.gridironSim.model.profile.RestCondition;
import com.tony.gridironSim.model.profile.WeatherSeverity;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "game")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Game {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private int season;
    private int week;

    @Column(nullable = false, length = 4)
    private String homeTeam;
    @Column(nullable = false, length = 4)
    private String awayTeam;

    private LocalDateTime kickoff;

    // Null tant que le match n'est pas joué
    private Integer homeScore;
    private Integer awayScore;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "offensivePlays", column = @Column(name = "home_plays")),
            @AttributeOverride(name = "epaPerPlay", column = @Column(name = "home_epa_per_play")),
            @AttributeOverride(name = "pressureRate", column = @Column(name = "home_pressure_rate")),
            @AttributeOverride(name = "sacks", column = @Column(name = "home_sacks"))
    })
    private GameBoxScore homeBox;

    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "offensivePlays", column = @Column(name = "away_plays")),
            @AttributeOverride(name = "epaPerPlay", column = @Column(name = "away_epa_per_play")),
            @AttributeOverride(name = "pressureRate", column = @Column(name = "away_pressure_rate")),
            @AttributeOverride(name = "sacks", column = @Column(name = "away_sacks"))
    })
    private GameBoxScore awayBox;

    // --- Contexte (fourni par les collaborateurs météo / blessures) ---
    @Enumerated(EnumType.STRING)
    private WeatherSeverity weather;
    @Enumerated(EnumType.STRING)
    private RestCondition homeRest;
    @Enumerated(EnumType.STRING)
    private RestCondition awayRest;
    private Double homeInjurySeverity;
    private Double awayInjurySeverity;

    public boolean isCompleted() {
        return homeScore != null && awayScore != null;
    }
}
