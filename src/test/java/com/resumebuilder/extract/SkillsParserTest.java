package com.resumebuilder.extract;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.resumebuilder.reader.LineNormalizer;

class SkillsParserTest {
  private final SkillsParser parser = new SkillsParser(ExtractionRules.defaults());

  @Test
  void splitsOnDelimitersAndWideGaps() {
    List<String> skills = parser.parse(LineNormalizer.fromText(String.join("\n",
        "Java, Kotlin; Python",
        "Docker | Kubernetes • Terraform",
        "PostgreSQL    MongoDB")));

    assertThat(skills).containsExactly(
        "Java", "Kotlin", "Python", "Docker", "Kubernetes", "Terraform", "PostgreSQL", "MongoDB");
  }

  @Test
  void dropsCategoryLabelsBulletsAndTrailingPeriods() {
    List<String> skills = parser.parse(LineNormalizer.fromText(String.join("\n",
        "Linguagens: Java, Go",
        "• Ferramentas de build: Maven, Gradle.",
        "- Node.js")));

    assertThat(skills).containsExactly("Java", "Go", "Maven", "Gradle", "Node.js");
  }

  @Test
  void duplicatesCollapseKeepingFirstSpellingAndPosition() {
    List<String> skills = parser.parse(LineNormalizer.fromText("SQL, Java, sql, JAVA, Git"));

    assertThat(skills).containsExactly("SQL", "Java", "Git");
  }

  @Test
  void emptyTokensAreDiscarded() {
    List<String> skills = parser.parse(LineNormalizer.fromText(" , ;Java,, |"));

    assertThat(skills).containsExactly("Java");
  }
}
