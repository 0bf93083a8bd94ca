package uk.gegc.ergtracker.features.account.domain.service;

import org.springframework.stereotype.Component;
import uk.gegc.ergtracker.features.account.domain.model.AgeCategory;

/**
 * Maps a birth year to its age category for a given competition year.
 * Age is the plain difference of calendar years; birthdays are not considered.
 */
@Component
public class CategoryCalculator {

    public AgeCategory category(Integer birthYear, int currentYear) {
        if (birthYear == null) {
            return AgeCategory.NON_CLASSIFICATO;
        }
        int age = currentYear - birthYear;
        if (age >= 27) {
            return AgeCategory.MASTER;
        }
        if (age >= 23) {
            return AgeCategory.SENIOR;
        }
        if (age >= 19) {
            return AgeCategory.UNDER_23;
        }
        if (age >= 17) {
            return AgeCategory.JUNIOR;
        }
        if (age >= 15) {
            return AgeCategory.RAGAZZI;
        }
        return switch (age) {
            case 14 -> AgeCategory.CADETTI;
            case 13 -> AgeCategory.ALLIEVI_C;
            case 12 -> AgeCategory.ALLIEVI_B2;
            case 11 -> AgeCategory.ALLIEVI_B1;
            case 10 -> AgeCategory.ALLIEVI_A;
            default -> AgeCategory.NON_CLASSIFICATO;
        };
    }

    public String label(Integer birthYear, int currentYear) {
        return category(birthYear, currentYear).getLabel();
    }
}
