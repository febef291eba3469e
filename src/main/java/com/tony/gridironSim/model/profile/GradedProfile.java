package com.tony.gridironSim.model.profile;

import com.tony.gridironSim.model.UnitGrades;
import lombok.Getter;
import lombok.experimental.SuperBuilder;

import java.util.OptionalDouble;

@Getter
@SuperBuilder(toBuilder = true)
public class GradedProfile extends TeamProfile {

    private static final double GRADE_MEAN = 65.0;
    private static final double GRADE_SD = 10.0;

    private final UnitGrades grades;

    @Override
    public boolean hasAdvancedGrades() {
        return true;
    }

    @Override
    public OptionalDouble grade(GradeUnit unit) {
        Double value = unit.from(grades);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    @Override
    public double lineStrength() {
        return (grades.getRunBlock() - GRADE_MEAN) / GRADE_SD;
    }
}
