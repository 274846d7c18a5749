// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.test;

import java.nio.file.Files;
import java.nio.file.Path;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import texweave.config.CitationStyle;
import texweave.config.Configuration;
import texweave.config.ConfigurationErrorCondition;
import texweave.config.ConfigurationLoader;
import texweave.config.CounterRule;
import texweave.config.NumberingScheme;
import texweave.config.ResetScope;
import texweave.config.Tab;
import texweave.document.EnvironmentKind;
import texweave.util.condition.Condition;
import texweave.util.condition.exception.IOExceptionCondition;

final class ConfigurationLoaderTest {
    @Test
    void readsMetadataTabsAndMacros() {
        final var configuration = parse(String.join("\n",
            "{",
            "  \"_comment\": \"ignored\",",
            "  \"title\": \"Notes\",",
            "  \"author\": \"A. Writer\",",
            "  \"language\": \"vi\",",
            "  \"tabs\": [\"read\", {\"id\": \"practice\", \"label\": \"Practice\"}],",
            "  \"tab_labels\": {\"read\": \"Reading\"},",
            "  \"katex_macros\": {\"\\\\R\": \"\\\\mathbb{R}\", \"\\\\N\": \"N\"},",
            "  \"math_macros\": {\"\\\\N\": \"\\\\mathbb{N}\"},",
            "  \"search_path\": \"shared\",",
            "  \"bibliography\": [\"refs.bib\"],",
            "  \"citation_style\": \"numeric\",",
            "  \"unknown_key\": 42",
            "}"
        ));
        Assertions.assertThat(configuration.metadata().title()).isEqualTo("Notes");
        Assertions.assertThat(configuration.metadata().author()).isEqualTo("A. Writer");
        Assertions.assertThat(configuration.metadata().subtitle()).isNull();
        Assertions.assertThat(configuration.language()).isEqualTo("vi");
        Assertions.assertThat(configuration.tabs())
            .containsExactly(new Tab("read", "Reading"), new Tab("practice", "Practice"));
        Assertions.assertThat(configuration.mathMacros())
            .containsEntry("\\R", "\\mathbb{R}")
            .containsEntry("\\N", "\\mathbb{N}");
        Assertions.assertThat(configuration.searchPath()).containsExactly(Path.of("shared"));
        Assertions.assertThat(configuration.bibliography()).containsExactly("refs.bib");
        Assertions.assertThat(configuration.citationStyle()).isEqualTo(CitationStyle.NUMERIC);
    }

    @Test
    void emptyObjectGivesTheDefaults() {
        Assertions.assertThat(parse("{}")).isEqualTo(Configuration.defaults());
        Assertions.assertThat(Configuration.defaults().language()).isEqualTo("en");
    }

    @Test
    void readsEnvironmentsInBothForms() {
        final var configuration = parse(String.join("\n",
            "{\"environments\": {",
            "  \"claim\": [\"env-theorem\", \"Claim\"],",
            "  \"aside\": {\"css\": \"box-gray\", \"label\": \"Aside\"},",
            "  \"theorem\": {\"label\": \"Satz\", \"reset\": \"section\"},",
            "  \"fact\": {\"kind\": \"theorem\", \"counter\": \"theorem\"}",
            "}}"
        ));
        final var environments = configuration.environments();
        Assertions.assertThat(environments.get("claim")).satisfies(style -> {
            Assertions.assertThat(style.kind()).isEqualTo(EnvironmentKind.THEOREM_LIKE);
            Assertions.assertThat(style.displayLabel()).isEqualTo("Claim");
            Assertions.assertThat(style.isNumbered()).isTrue();
        });
        Assertions.assertThat(environments.get("aside")).satisfies(style -> {
            Assertions.assertThat(style.kind()).isEqualTo(EnvironmentKind.CUSTOM);
            Assertions.assertThat(style.cssClass()).isEqualTo("box-gray");
            Assertions.assertThat(style.isNumbered()).isFalse();
        });
        Assertions.assertThat(environments.get("theorem")).satisfies(style -> {
            Assertions.assertThat(style.displayLabel()).isEqualTo("Satz");
            Assertions.assertThat(style.cssClass()).isEqualTo("env-theorem");
            Assertions.assertThat(style.reset()).isEqualTo(ResetScope.PER_SECTION);
        });
        Assertions.assertThat(environments.get("fact")).satisfies(style -> {
            Assertions.assertThat(style.kind()).isEqualTo(EnvironmentKind.THEOREM_LIKE);
            Assertions.assertThat(style.counter()).isEqualTo("theorem");
            Assertions.assertThat(style.numbering()).isEqualTo(NumberingScheme.HIERARCHICAL);
        });
    }

    @Test
    void readsCounterRules() {
        final var configuration = parse(
            "{\"counters\": {\"equation\": {\"numbering\": \"sequential\", \"reset\": \"global\"}, \"figure\": {}}}");
        Assertions.assertThat(configuration.counters())
            .containsEntry("equation", CounterRule.global)
            .containsEntry("figure", CounterRule.perChapter);
        Assertions.assertThat(configuration.counterRule("equation")).isEqualTo(CounterRule.global);
        Assertions.assertThat(configuration.counterRule("table")).isEqualTo(CounterRule.perChapter);
        Assertions.assertThat(configuration.counterRule("footnote"))
            .isEqualTo(new CounterRule(NumberingScheme.SEQUENTIAL, ResetScope.PER_CHAPTER));
    }

    @ParameterizedTest
    @ValueSource(strings = {"chapter", "per-chapter", "per_chapter", "Chapter ", "PER-CHAPTER"})
    void acceptsResetScopeSpellings(final String spelling) {
        final var configuration = parse("{\"counters\": {\"figure\": {\"reset\": \"" + spelling + "\"}}}");
        Assertions.assertThat(configuration.counters().get("figure").reset()).isEqualTo(ResetScope.PER_CHAPTER);
    }

    @Test
    void rejectsMalformedJson() {
        final var condition = Conditions.fatalConditionOf(() -> parse("{\"title\": "));
        Assertions.assertThat(condition).isInstanceOf(ConfigurationErrorCondition.class);
        Assertions.assertThat(condition.message()).startsWith("config.json: malformed JSON");
    }

    @Test
    void rejectsValuesOfTheWrongShape() {
        Assertions.assertThat(Conditions.fatalConditionOf(() -> parse("[]")).message())
            .isEqualTo("config.json: the configuration must be a JSON object");
        Assertions.assertThat(Conditions.fatalConditionOf(() -> parse("{\"tabs\": \"read\"}")).message())
            .isEqualTo("config.json: tabs must be an array");
        Assertions.assertThat(Conditions.fatalConditionOf(() -> parse("{\"environments\": {\"x\": [\"a\"]}}")))
            .extracting(Condition::message)
            .isEqualTo("config.json: environment x must be given as [css, label]");
        Assertions.assertThat(Conditions.fatalConditionOf(() ->
                parse("{\"environments\": {\"x\": {\"kind\": \"odd\"}}}")))
            .isInstanceOf(ConfigurationErrorCondition.class);
        Assertions.assertThat(Conditions.fatalConditionOf(() -> parse("{\"counters\": {\"x\": {\"reset\": \"day\"}}}")))
            .isInstanceOf(ConfigurationErrorCondition.class);
        Assertions.assertThat(Conditions.fatalConditionOf(() -> parse("{\"citation_style\": \"footnote\"}")).message())
            .isEqualTo("config.json: unknown citation style footnote");
        Assertions.assertThat(Conditions.fatalConditionOf(() -> parse("{\"math_macros\": {\"\\\\x\": 1}}")))
            .isInstanceOf(ConfigurationErrorCondition.class);
    }

    @Test
    void loadsFiles(@TempDir final Path directory) throws Exception {
        final var file = directory.resolve("config.json");
        Files.writeString(file, "{\"title\": \"From disk\"}");
        Assertions.assertThat(ConfigurationLoader.load(file).metadata().title()).isEqualTo("From disk");
        final var missing = directory.resolve("none.json");
        Assertions.assertThat(Conditions.fatalConditionOf(() -> ConfigurationLoader.load(missing)))
            .isInstanceOf(IOExceptionCondition.class);
    }

    private static Configuration parse(final String json) {
        return ConfigurationLoader.parse(json, "config.json");
    }
}
