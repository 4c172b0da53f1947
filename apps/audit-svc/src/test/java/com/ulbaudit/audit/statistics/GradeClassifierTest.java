package com.ulbaudit.audit.statistics;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class GradeClassifierTest {

    private final GradeClassifier classifier = new GradeClassifier();

    @Test
    void corporationNamesMapToMunicipalCorporation() {
        assertThat(classifier.extractGrade("Chennai Municipal Corporation")).isEqualTo("Municipal Corporation");
    }

    @Test
    void unmatchedNamesFallBackToUnclassified() {
        assertThat(classifier.extractGrade("XYZ Municipality")).isEqualTo("Municipality (Unclassified)");
        assertThat(classifier.extractGrade("Town Panchayat Kodaikanal")).isEqualTo(GradeClassifier.UNCLASSIFIED);
    }

    @Test
    void ordinalGradesAreExtracted() {
        assertThat(classifier.extractGrade("Arakkonam Municipality Grade II")).isEqualTo("Grade II");
        assertThat(classifier.extractGrade("grade iv municipality of Palani")).isEqualTo("Grade IV");
    }

    @Test
    void namedGradesAreExtracted() {
        assertThat(classifier.extractGrade("Hosur Selection Grade Municipality")).isEqualTo("Selection Grade");
        assertThat(classifier.extractGrade("Special Grade Municipality Kumbakonam")).isEqualTo("Special Grade");
    }

    @Test
    void firstMatchingPatternWins() {
        assertThat(classifier.extractGrade("Grade I Corporation Township")).isEqualTo("Grade I");
        assertThat(classifier.extractGrade("Special Grade Corporation")).isEqualTo("Special Grade");
    }

    @Test
    void gradeWordWithoutNumeralIsNotOrdinal() {
        assertThat(classifier.extractGrade("Gradeville Municipality")).isEqualTo(GradeClassifier.UNCLASSIFIED);
    }

    @Test
    void extractionIsTotalAndDeterministic() {
        for (String name : new String[]{"", "   ", null, "Salem Municipal Corporation", "Anything else"}) {
            String first = classifier.extractGrade(name);
            assertThat(first).isNotBlank();
            assertThat(classifier.extractGrade(name)).isEqualTo(first);
        }
    }

    @Test
    void patternsAreOrderedAndIndividuallyUsable() {
        assertThat(classifier.patterns())
                .extracting(GradeClassifier.GradePattern::name)
                .containsExactly("ordinal-grade", "named-grade", "corporation");
        assertThat(classifier.patterns().get(2).match("MADURAI CORPORATION")).contains("Municipal Corporation");
        assertThat(classifier.patterns().get(0).match("MADURAI CORPORATION")).isEmpty();
    }
}
