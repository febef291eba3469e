package com.tony.gridironSim.model.profile;

import com.tony.gridironSim.model.UnitGrades;
import lombok.RequiredArgsConstructor;

import java.util.function.Function;

@RequiredArgsConstructor
public enum GradeUnit {
    PASS_BLOCK(UnitGrades::getPassBlock),
    PASS_RUSH(UnitGrades::getPassRush),
    RUN_BLOCK(UnitGrades::getRunBlock),
    RUN_DEFENSE(UnitGrades::getRunDefense),
    RECEIVING(UnitGrades::getReceiving),
    COVERAGE(UnitGrades::getCoverage);

    private final Function<UnitGrades, Double> extractor;

    public Double from(UnitGrades grades) {
        return extractor.apply(grades);
    }
}
