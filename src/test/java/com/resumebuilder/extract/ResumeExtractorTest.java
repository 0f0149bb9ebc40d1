package com.resumebuilder.extract;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.resumebuilder.EmptyDocumentException;
import com.resumebuilder.Entity;
import com.resumebuilder.reader.DocumentFormat;
import com.resumebuilder.reader.DocumentText;
import com.resumebuilder.reader.LineNormalizer;
import com.resumebuilder.reader.TextLine;

class ResumeExtractorTest {
  private static final String SAMPLE = String.join("\n",
      "Maria Souza",
      "maria.souza@email.com | (11) 98765-4321 | São Paulo, SP",
      "linkedin.com/in/mariasouza",
      "",
      "RESUMO PROFISSIONAL",
      "Engenheira de software com foco em sistemas distribuídos.",
      "",
      "EXPERIÊNCIA",
      "Engenheira de Software Sênior — Banco Azul",
      "03/2021 - Atual",
      "• Liderou a migração para microsserviços",
      "• Reduziu custos de infraestrutura em 30%",
      "",
      "Desenvolvedora Java na Loja Online",
      "2018 - 2021",
      "• Implementou o checkout",
      "",
      "FORMAÇÃO",
      "Bacharelado em Ciência da Computação - Universidade de São Paulo, 2014 - 2018",
      "",
      "HABILIDADES",
      "Java, Spring Boot, Kafka | Docker; java",
      "",
      "PROJETOS",
      "Gerador de Currículos: ferramenta de código aberto https://github.com/maria/cv");

  private final ResumeExtractor extractor = new ResumeExtractor();

  @Test
  void extractsClearlyDelimitedExperienceEntry() {
    List<TextLine> lines = List.of(
        TextLine.of("Experiência"),
        TextLine.of("Senior Developer — Tech Corp"),
        TextLine.of("Jan 2020 - Atual"),
        TextLine.of("• Led the migration to microservices"));

    Entity.ResumeEntity resume = extractor.extract(lines).getResume();

    assertThat(resume.experience).hasSize(1);
    Entity.Experience experience = resume.experience.get(0);
    assertThat(experience.role).isEqualTo("Senior Developer");
    assertThat(experience.organization).isEqualTo("Tech Corp");
    assertThat(experience.startDate).isEqualTo("Jan 2020");
    assertThat(experience.endDate).isEqualTo("Atual");
    assertThat(experience.current).isTrue();
    assertThat(experience.achievements).containsExactly("Led the migration to microservices");
  }

  @Test
  void emailTokenIsCopiedExactly() {
    Entity.ResumeEntity resume = extractor.extract(List.of(TextLine.of("joao.silva+cv@empresa.com.br"))).getResume();

    assertThat(resume.contact.email).isEqualTo("joao.silva+cv@empresa.com.br");
    assertThat(resume.contact.website).isNull();
  }

  @Test
  void noLinesIsAnEmptyDocument() {
    assertThatThrownBy(() -> extractor.extract(List.of()))
        .isInstanceOf(EmptyDocumentException.class);
    assertThatThrownBy(() -> extractor.extract(List.of(TextLine.blank(), TextLine.of("  "))))
        .isInstanceOf(EmptyDocumentException.class);
  }

  @Test
  void nonsenseStillYieldsAResumeFlaggedForReview() {
    List<TextLine> lines = List.of(TextLine.of("@@@ ###"), TextLine.of("qwerty 12345 zzz"), TextLine.of("???"));

    ExtractionReport report = extractor.extract(lines);

    Entity.ResumeEntity resume = report.getResume();
    assertThat(resume.experience).isEmpty();
    assertThat(resume.education).isEmpty();
    assertThat(resume.skills).isEmpty();
    assertThat(resume.projects).isEmpty();
    assertThat(report.needsReview()).isTrue();
    assertThat(report.getNotices())
        .contains(ExtractionReport.Notice.NO_SECTIONS_DETECTED, ExtractionReport.Notice.NO_CONTACT_DETAILS);
  }

  @Test
  void extractsEveryPartOfATypicalResume() {
    ExtractionReport report = extractor.extract(LineNormalizer.fromText(SAMPLE));
    Entity.ResumeEntity resume = report.getResume();

    assertThat(resume.contact.fullName).isEqualTo("Maria Souza");
    assertThat(resume.contact.email).isEqualTo("maria.souza@email.com");
    assertThat(resume.contact.phone).isEqualTo("(11) 98765-4321");
    assertThat(resume.contact.location).isEqualTo("São Paulo, SP");
    assertThat(resume.contact.linkedin).isEqualTo("linkedin.com/in/mariasouza");
    assertThat(resume.summary).isEqualTo("Engenheira de software com foco em sistemas distribuídos.");

    assertThat(resume.experience).hasSize(2);
    Entity.Experience first = resume.experience.get(0);
    assertThat(first.role).isEqualTo("Engenheira de Software Sênior");
    assertThat(first.organization).isEqualTo("Banco Azul");
    assertThat(first.startDate).isEqualTo("03/2021");
    assertThat(first.current).isTrue();
    assertThat(first.achievements).containsExactly(
        "Liderou a migração para microsserviços", "Reduziu custos de infraestrutura em 30%");
    Entity.Experience second = resume.experience.get(1);
    assertThat(second.role).isEqualTo("Desenvolvedora Java");
    assertThat(second.organization).isEqualTo("Loja Online");
    assertThat(second.startDate).isEqualTo("2018");
    assertThat(second.endDate).isEqualTo("2021");
    assertThat(second.current).isFalse();

    assertThat(resume.education).hasSize(1);
    assertThat(resume.education.get(0).degree).isEqualTo("Bacharelado em Ciência da Computação");
    assertThat(resume.education.get(0).institution).isEqualTo("Universidade de São Paulo");
    assertThat(resume.education.get(0).details).isEqualTo("2014 - 2018");

    assertThat(resume.skills).containsExactly("Java", "Spring Boot", "Kafka", "Docker");

    assertThat(resume.projects).hasSize(1);
    assertThat(resume.projects.get(0).name).isEqualTo("Gerador de Currículos");
    assertThat(resume.projects.get(0).description).isEqualTo("ferramenta de código aberto");
    assertThat(resume.projects.get(0).link).isEqualTo("https://github.com/maria/cv");

    assertThat(report.needsReview()).isFalse();
  }

  @Test
  void pdfInputIsFlaggedForApproximateReadingOrder() {
    DocumentText text = new DocumentText(DocumentFormat.PDF, LineNormalizer.fromText(SAMPLE), true);

    ExtractionReport report = extractor.extract(text);

    assertThat(report.getNotices()).containsExactly(ExtractionReport.Notice.READING_ORDER_APPROXIMATED);
    assertThat(report.needsReview()).isTrue();
  }

  @Test
  void unlabelledHeaderProseBecomesSummary() {
    List<TextLine> lines = LineNormalizer.fromText(String.join("\n",
        "Carlos Pereira",
        "carlos@example.org",
        "Desenvolvedor backend apaixonado por qualidade de código.",
        "",
        "Habilidades",
        "Go, Rust"));

    Entity.ResumeEntity resume = extractor.extract(lines).getResume();

    assertThat(resume.contact.fullName).isEqualTo("Carlos Pereira");
    assertThat(resume.summary).isEqualTo("Desenvolvedor backend apaixonado por qualidade de código.");
    assertThat(resume.skills).containsExactly("Go", "Rust");
  }

  @Test
  void repeatedSectionsAreMerged() {
    List<TextLine> lines = LineNormalizer.fromText(String.join("\n",
        "Skills",
        "Java",
        "",
        "Projetos",
        "Site pessoal",
        "",
        "Competências",
        "SQL, java"));

    Entity.ResumeEntity resume = extractor.extract(lines).getResume();

    assertThat(resume.skills).containsExactly("Java", "SQL");
  }
}
