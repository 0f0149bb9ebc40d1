package com.resumebuilder.extract;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.resumebuilder.reader.LineNormalizer;
import com.resumebuilder.reader.TextLine;

class SectionSegmenterTest {
  private final SectionSegmenter segmenter = new SectionSegmenter(ExtractionRules.defaults());

  @Test
  void recognizesHeadingsRegardlessOfCaseAccentsAndColons() {
    assertThat(segmenter.detect(TextLine.of("EXPERIÊNCIA PROFISSIONAL"))).isEqualTo(SectionKind.EXPERIENCE);
    assertThat(segmenter.detect(TextLine.of("Formação Acadêmica:"))).isEqualTo(SectionKind.EDUCATION);
    assertThat(segmenter.detect(TextLine.of("skills"))).isEqualTo(SectionKind.SKILLS);
    assertThat(segmenter.detect(TextLine.of("Resultados Relevantes"))).isEqualTo(SectionKind.PROJECTS);
    assertThat(segmenter.detect(TextLine.of("Sobre"))).isEqualTo(SectionKind.SUMMARY);
  }

  @Test
  void proseMentioningAKeywordIsNotAHeading() {
    assertThat(segmenter.detect(TextLine.of("Tenho experiência com Java e Spring"))).isNull();
    assertThat(segmenter.detect(TextLine.of("Experiência com clientes do setor bancário"))).isNull();
  }

  @Test
  void contactHeadingOpensAContactSection() {
    assertThat(segmenter.detect(TextLine.of("Dados Pessoais"))).isEqualTo(SectionKind.CONTACT);
    assertThat(segmenter.detect(TextLine.of("CONTATO:"))).isEqualTo(SectionKind.CONTACT);
    assertThat(segmenter.detect(TextLine.of("Resumo e Contato", true, 0))).isEqualTo(SectionKind.SUMMARY);
  }

  @Test
  void keywordPrefixedLineNeedsHeadingShapeAndAtMostFourWords() {
    assertThat(segmenter.detect(TextLine.of("HABILIDADES TÉCNICAS E IDIOMAS"))).isEqualTo(SectionKind.SKILLS);
    assertThat(segmenter.detect(TextLine.of("HABILIDADES TÉCNICAS EM NUVEM E DADOS"))).isNull();
    assertThat(segmenter.detect(TextLine.of("Habilidades técnicas e idiomas"))).isNull();
  }

  @Test
  void listItemsAreNeverHeadings() {
    assertThat(segmenter.detect(TextLine.of("• Habilidades"))).isNull();
  }

  @Test
  void earliestKeywordWinsWhenHeadingNamesTwoSections() {
    TextLine hinted = TextLine.of("Experiência e Formação", true, 0);
    TextLine reversed = TextLine.of("Formação e Experiência", true, 0);

    assertThat(segmenter.detect(hinted)).isEqualTo(SectionKind.EXPERIENCE);
    assertThat(segmenter.detect(reversed)).isEqualTo(SectionKind.EDUCATION);
  }

  @Test
  void headingHintAllowsAKeywordInsideAShortLine() {
    assertThat(segmenter.detect(TextLine.of("Minhas Habilidades", true, 0))).isEqualTo(SectionKind.SKILLS);
    assertThat(segmenter.detect(TextLine.of("Minhas Habilidades"))).isNull();
  }

  @Test
  void splitsLinesIntoSectionsKeepingTheHeaderRegion() {
    List<TextLine> lines = LineNormalizer.fromText(String.join("\n",
        "Ana Lima",
        "ana@example.com",
        "",
        "RESUMO",
        "Texto do resumo",
        "",
        "HABILIDADES",
        "Java, Spring"));

    List<Section> sections = segmenter.segment(lines);

    assertThat(sections).extracting(Section::getKind)
        .containsExactly(SectionKind.UNASSIGNED, SectionKind.SUMMARY, SectionKind.SKILLS);
    assertThat(sections.get(0).getHeading()).isNull();
    assertThat(sections.get(0).getLines()).extracting(TextLine::getText)
        .containsExactly("Ana Lima", "ana@example.com");
    assertThat(sections.get(1).getHeading()).isEqualTo("RESUMO");
    assertThat(sections.get(1).getLines()).extracting(TextLine::getText).containsExactly("Texto do resumo");
    assertThat(sections.get(2).getLines()).extracting(TextLine::getText).containsExactly("Java, Spring");
  }

  @Test
  void documentStartingWithAHeadingHasNoHeaderRegion() {
    List<Section> sections = segmenter.segment(List.of(TextLine.of("Projetos"), TextLine.of("CV Builder")));

    assertThat(sections).extracting(Section::getKind).containsExactly(SectionKind.PROJECTS);
  }
}
