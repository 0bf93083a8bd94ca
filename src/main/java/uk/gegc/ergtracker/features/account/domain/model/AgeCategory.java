package uk.gegc.ergtracker.features.account.domain.model;

/**
 * Italian rowing age categories, ordered by age band.
 */
public enum AgeCategory {
    ALLIEVI_A("ALLIEVI A"),
    ALLIEVI_B1("ALLIEVI B1"),
    ALLIEVI_B2("ALLIEVI B2"),
    ALLIEVI_C("ALLIEVI C"),
    CADETTI("CADETTI"),
    RAGAZZI("RAGAZZI"),
    JUNIOR("JUNIOR"),
    UNDER_23("UNDER 23"),
    SENIOR("SENIOR"),
    MASTER("MASTER"),
    NON_CLASSIFICATO("NON CLASSIFICATO");

    private final String label;

    AgeCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
