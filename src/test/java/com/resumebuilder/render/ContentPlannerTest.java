package com.resumebuilder.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.resumebuilder.Entity;
import com.resumebuilder.layout.LayoutDefinition;
import com.resumebuilder.layout.LayoutRegistry;

class ContentPlannerTest {
  private final LayoutRegistry registry = LayoutRegistry.getInstance();
  private final ContentPlanner planner = new ContentPlanner(registry.getUntitledName(), registry.getOngoingLabel());

  @Test
  void fullResumeFollowsCanonicalOrder() {
    List<ContentBlock> blocks = planner.plan(Resumes.complete(), registry.get("moderno-azul"));

    assertThat(blocks).extracting(ContentBlock::getKind).containsExactly(
        ContentBlock.Kind.HEADER,
        ContentBlock.Kind.HEADING, ContentBlock.Kind.SUMMARY,
        ContentBlock.Kind.HEADING, ContentBlock.Kind.EXPERIENCE, ContentBlock.Kind.EXPERIENCE,
        ContentBlock.Kind.HEADING, ContentBlock.Kind.EDUCATION,
        ContentBlock.Kind.HEADING, ContentBlock.Kind.SKILLS,
        ContentBlock.Kind.HEADING, ContentBlock.Kind.PROJECT);
    assertThat(blocks).filteredOn(b -> b.getKind() == ContentBlock.Kind.HEADING)
        .extracting(ContentBlock::getTitle)
        .containsExactly("Resumo Profissional", "Experiência", "Formação", "Habilidades", "Projetos");
  }

  @Test
  void layoutsNameSectionsTheirOwnWay() {
    List<ContentBlock> blocks = planner.plan(Resumes.complete(), registry.get("executivo-dourado"));

    assertThat(blocks).filteredOn(b -> b.getKind() == ContentBlock.Kind.HEADING)
        .extracting(ContentBlock::getTitle)
        .containsExactly("Resumo Executivo", "Trajetória Profissional", "Formação Acadêmica",
            "Áreas de Expertise", "Resultados Relevantes");
  }

  @Test
  void emptyResumeKeepsOnlyTheHeaderWithPlaceholderName() {
    List<ContentBlock> blocks = planner.plan(new Entity.ResumeEntity(), registry.get("moderno-azul"));

    assertThat(blocks).hasSize(1);
    assertThat(blocks.get(0).getKind()).isEqualTo(ContentBlock.Kind.HEADER);
    assertThat(blocks.get(0).getTitle()).isEqualTo("Nome não informado");
    assertThat(blocks.get(0).getItems()).isEmpty();
  }

  @Test
  void blankEntriesDoNotOpenASection() {
    Entity.ResumeEntity resume = new Entity.ResumeEntity();
    resume.summary = "   ";
    resume.experience.add(new Entity.Experience());
    resume.skills.add(" ");

    List<ContentBlock> blocks = planner.plan(resume, registry.get("moderno-azul"));

    assertThat(blocks).extracting(ContentBlock::getKind).containsExactly(ContentBlock.Kind.HEADER);
  }

  @Test
  void experienceBlockCarriesPeriodAndAchievements() {
    LayoutDefinition layout = registry.get("moderno-azul");
    ContentBlock experience = planner.plan(Resumes.complete(), layout).get(4);

    assertThat(experience.getTitle()).isEqualTo("Senior Developer");
    assertThat(experience.getSubtitle()).isEqualTo("Tech Corp");
    assertThat(experience.getPeriod()).isEqualTo("Jan 2020 – Atual");
    assertThat(experience.getItems()).containsExactly("Led the migration to microservices");
  }

  @Test
  void periodFormatting() {
    assertThat(planner.period("2018", "2020", false)).isEqualTo("2018 – 2020");
    assertThat(planner.period("2018", null, true)).isEqualTo("2018 – Atual");
    assertThat(planner.period("2018", null, false)).isEqualTo("2018");
    assertThat(planner.period(null, "2020", false)).isEqualTo("2020");
    assertThat(planner.period(" ", null, false)).isNull();
  }

  @Test
  void skillsAreDedupedAndJoinedWithTheLayoutSeparator() {
    Entity.ResumeEntity resume = new Entity.ResumeEntity();
    resume.skills.addAll(Arrays.asList("Java", " Go ", null, "java", "", "SQL", "GO"));

    List<ContentBlock> blocks = planner.plan(resume, registry.get("classico-serifado"));

    assertThat(blocks.get(2).getBody()).isEqualTo("Java • Go • SQL");
  }
}
