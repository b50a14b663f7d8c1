package im.arun.electoralroll.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        void normalize_shouldReturnEmptyForNullAndEmpty() {
            assertThat(normalizer.normalize(null)).isEmpty();
            assertThat(normalizer.normalize("")).isEmpty();
        }

        @Test
        void normalize_shouldFixLabelsSpacingAndDigits() {
            TextNormalizer.NormalizedText result =
                normalizer.normalizeWithReport("Nanre : Ramesh ,Aqe:4S\r\nSl No: l2");

            assertThat(result.getText()).isEqualTo("Name: Ramesh, Age: 45\nSl No: 12");
            // two label fixes, two digit fixes
            assertThat(result.getCorrections()).isEqualTo(4);
        }

        @Test
        void normalize_shouldSubstituteLettersAfterNumericLabel() {
            assertThat(normalizer.normalize("Age: SO")).isEqualTo("Age: 50");
            assertThat(normalizer.normalize("Sl No: lO")).isEqualTo("Sl No: 10");
        }

        @Test
        void normalize_shouldKeepWordsWhereNoNumberIsExpected() {
            assertThat(normalizer.normalize("Name: BOSS")).isEqualTo("Name: BOSS");
            assertThat(normalizer.normalize("Name: Sita, Gender: Female")).isEqualTo("Name: Sita, Gender: Female");
        }

        @Test
        void normalize_shouldKeepIdentifierShapedTokens() {
            assertThat(normalizer.normalize("EPIC: ABC1234567, House No: B12"))
                .isEqualTo("EPIC: ABC1234567, House No: B12");
        }

        @Test
        void normalize_shouldDropNoiseLinesAndCollapseBlankRuns() {
            assertThat(normalizer.normalize("Name: A\n----\n|||\n\n\nAge: 30"))
                .isEqualTo("Name: A\n\nAge: 30");
        }

        @Test
        void normalize_shouldStripNonPrintableCharacters() {
            assertThat(normalizer.normalize("\uFEFFNa\u200Bme: A\u0007")).isEqualTo("Name: A");
        }

        @Test
        void normalize_shouldStripInvisibleFormatCharacters() {
            assertThat(normalizer.normalize("Na\u00ADme:\u200E A\u200F, Age: 3\u2066O")).isEqualTo("Name: A, Age: 30");
        }

        @Test
        void normalize_shouldTreatUnicodeSpacesLikeSpaces() {
            assertThat(normalizer.normalize("Name\u00A0: A")).isEqualTo("Name: A");
            assertThat(normalizer.normalize("Age\u2009:\u202F2O\u3000,")).isEqualTo("Age: 20,");
            assertThat(normalizer.normalize("Name: A\u2028Age: 30")).isEqualTo("Name: A\nAge: 30");
        }

        @Test
        void normalize_shouldKeepLetterSuffixOfHouseNumbers() {
            assertThat(normalizer.normalize("Name: Ram, House No: 12B, Age: 3O"))
                .isEqualTo("Name: Ram, House No: 12B, Age: 30");
            assertThat(normalizer.normalize("Door No 4D")).isEqualTo("Door No 4D");
            assertThat(normalizer.normalize("House No: 4/12B")).isEqualTo("House No: 4/12B");
        }

        @Test
        void normalize_shouldCollapseHorizontalWhitespace() {
            assertThat(normalizer.normalize("  Name:\t\tRam   Kumar  ")).isEqualTo("Name: Ram Kumar");
        }
    }

    @Nested
    @DisplayName("idempotence")
    class Idempotence {

        @ParameterizedTest
        @ValueSource(strings = {
            "Nanre : Ramesh ,Aqe:4S\r\nSl No: l2",
            "Age: SO Gender: Fernale",
            "1 ABC1234567\nRamesh S/O Suresh\nHouse No: 4-B Age: 3O years",
            "Sl No:lO Name:Ram,Age:2I ,  Gender : Male",
            "::,,\n\n\n\n  OOO  lll  |||  \n BOSS DOS I0 l0l",
            "Image Sl. No. OS age:B",
            "\u200BNa\u200Bnre\t\t:\tX\r\r\n,,",
            "Husbamd's Nanre: Q, Agge: DD, Serial No: S",
            "Name\u00A0: A",
            "2O\u3000,",
            "Age\u2009:\u202FlO , House No\u00A0:\u00A012B"
        })
        void normalize_shouldBeIdempotent(String input) {
            String once = normalizer.normalize(input);

            assertThat(normalizer.normalize(once)).isEqualTo(once);
        }

        @Test
        void normalize_shouldBeIdempotentOnRandomFragmentMixes() {
            String[] fragments = {
                "Name", "Nanre", "Age", "Aqe", "Agge", "Sl No", "Serial No", "S. No", "House No", "Door No", "Hourse",
                "12B", "4D", "2O", "lO", "SO", "4S", "l2", "B12", "ABC1234567", "Female", "Fernale", "years",
                "O", "o", "I", "l", "|", "S", "B", "D", "Q", "Z", "0", "1", "5", "45",
                ":", ",", ".", "-", "/", "'", " ", "  ", "\t", "\n", "\n\n\n", "\r", "\r\n",
                "\u00A0", "\u2009", "\u202F", "\u3000", "\u2028", "\u200B", "\u00AD", "\u200E", "\uFEFF", "\u0085",
                "@@", "~~", "%"
            };
            Random random = new Random(42);
            List<String> unstable = new ArrayList<>();
            for (int i = 0; i < 20_000; i++) {
                StringBuilder input = new StringBuilder();
                int parts = 1 + random.nextInt(12);
                for (int p = 0; p < parts; p++) {
                    input.append(fragments[random.nextInt(fragments.length)]);
                }
                String once = normalizer.normalize(input.toString());
                if (!normalizer.normalize(once).equals(once)) {
                    unstable.add(input.toString());
                }
            }

            assertThat(unstable).isEmpty();
        }
    }

    @Nested
    @DisplayName("configuration tables")
    class Tables {

        @Test
        void normalize_shouldUseConfiguredSubstitutions() {
            TextNormalizer custom = new TextNormalizer(Map.of("G", "6"), Map.of("Aeg", "Age"));

            assertThat(custom.normalize("Aeg: 2G")).isEqualTo("Age: 26");
        }

        @Test
        void constructor_shouldSkipCorrectionsWhoseTargetIsAlsoCorrected() {
            TextNormalizer custom = new TextNormalizer(Map.of(), Map.of("Nanre", "Narne", "Narne", "Name"));

            // only Narne -> Name survives
            assertThat(custom.normalize("Nanre Narne")).isEqualTo("Nanre Name");
            assertThat(custom.normalize(custom.normalize("Nanre Narne"))).isEqualTo("Nanre Name");
        }
    }
}
