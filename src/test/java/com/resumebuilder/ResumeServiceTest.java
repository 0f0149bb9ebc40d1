package com.resumebuilder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import com.resumebuilder.extract.ExtractionReport;
import com.resumebuilder.layout.LayoutDefinition;

class ResumeServiceTest {
  private final ResumeService service = new ResumeService();

  private static Entity.ResumeEntity resume() throws Exception {
    String json = "{ contato: { nome_completo: 'Marina Costa', email: 'marina@costa.dev' },"
        + " resumo_profissional: 'Analista de dados com foco em produto.',"
        + " experiencias: [ { cargo: 'Analista de Dados', empresa: 'Banco Azul', data_inicio: '2019', atual: true } ],"
        + " competencias: ['SQL', 'Python'], }";
    return Resources.MAPPER.readValue(json, Entity.ResumeEntity.class);
  }

  @Test
  void portugueseFieldNamesAreAccepted() throws Exception {
    Entity.ResumeEntity resume = resume();

    assertThat(resume.contact.fullName).isEqualTo("Marina Costa");
    assertThat(resume.experience.get(0).organization).isEqualTo("Banco Azul");
    assertThat(resume.experience.get(0).current).isTrue();
    assertThat(resume.skills).containsExactly("SQL", "Python");
  }

  @Test
  void renderedResumeCanBeExtractedAgain() throws Exception {
    byte[] pdf = service.render(resume(), "classico-serifado", "pdf");

    ExtractionReport report = service.extract(pdf, "curriculo.pdf");

    assertThat(report.getResume().contact.fullName).isEqualTo("Marina Costa");
    assertThat(report.getResume().contact.email).isEqualTo("marina@costa.dev");
  }

  @Test
  void extractionFailuresCarryTheirKind() {
    byte[] text = "just some text".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> service.extract(text, "notes.txt"))
        .isInstanceOfSatisfying(ResumeException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNSUPPORTED_FORMAT));
    assertThatThrownBy(() -> service.extract(new byte[0], null))
        .isInstanceOf(ResumeException.class);
  }

  @Test
  void renderFailuresCarryTheirKind() {
    assertThatThrownBy(() -> service.render(resume(), "sem-layout", "pdf"))
        .isInstanceOfSatisfying(ResumeException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNKNOWN_LAYOUT));
  }

  @Test
  void layoutsAreDiscoverable() {
    assertThat(service.layouts()).extracting(LayoutDefinition::getId).hasSize(4).contains("executivo-dourado");
  }
}
