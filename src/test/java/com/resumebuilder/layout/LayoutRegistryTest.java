package com.resumebuilder.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.resumebuilder.Resources;
import com.resumebuilder.UnknownLayoutException;

class LayoutRegistryTest {
  private final LayoutRegistry registry = LayoutRegistry.getInstance();

  @Test
  void listsTheFourLayoutsInCatalogOrder() {
    List<LayoutDefinition> first = registry.list();
    List<LayoutDefinition> second = registry.list();

    assertThat(first).extracting(LayoutDefinition::getId)
        .containsExactly("moderno-azul", "classico-serifado", "minimalista-grade", "executivo-dourado");
    assertThat(second).containsExactlyElementsOf(first);
  }

  @Test
  void listingCannotBeModified() {
    assertThatThrownBy(() -> registry.list().clear()).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void unknownIdentifierFails() {
    assertThatThrownBy(() -> registry.get("nonexistent-id"))
        .isInstanceOf(UnknownLayoutException.class)
        .hasMessageContaining("nonexistent-id");
    assertThatThrownBy(() -> registry.get(null)).isInstanceOf(UnknownLayoutException.class);
  }

  @Test
  void stylesCarryTheLayoutsVisualRules() {
    LayoutStyle modern = registry.get("moderno-azul").getStyle();
    LayoutStyle classic = registry.get("classico-serifado").getStyle();
    LayoutStyle grid = registry.get("minimalista-grade").getStyle();
    LayoutStyle executive = registry.get("executivo-dourado").getStyle();

    assertThat(modern.getAccentColor()).isEqualTo("#1F4E79");
    assertThat(modern.getAccentHex()).isEqualTo("1F4E79");
    assertThat(modern.getTypography()).isEqualTo(Typography.SANS);
    assertThat(classic.getTypography()).isEqualTo(Typography.SERIF);
    assertThat(classic.getBulletStyle()).isEqualTo(BulletStyle.NUMBERED);
    assertThat(grid.isTwoColumn()).isTrue();
    assertThat(grid.getHeaderAlignment()).isEqualTo(HeaderAlignment.LEFT);
    assertThat(executive.getAccentColor()).isEqualTo("#A57C00");
    assertThat(executive.getSkillSeparator()).isEqualTo(" | ");
    assertThat(registry.list()).filteredOn(l -> l.getStyle().getColumns() == 1).hasSize(3);
  }

  @Test
  void eachLayoutTitlesItsSections() {
    SectionTitles executive = registry.get("executivo-dourado").getTitles();

    assertThat(executive.getExperience()).isEqualTo("Trajetória Profissional");
    assertThat(executive.getProjects()).isEqualTo("Resultados Relevantes");
    assertThat(registry.get("classico-serifado").getTitles().getSummary()).isEqualTo("Perfil");
    assertThat(registry.getUntitledName()).isEqualTo("Nome não informado");
    assertThat(registry.getOngoingLabel()).isEqualTo("Atual");
  }

  @Test
  void publishedJsonOmitsRenderingDetails() throws Exception {
    JsonNode json = Resources.MAPPER.valueToTree(registry.get("moderno-azul"));

    assertThat(json.get("id").asText()).isEqualTo("moderno-azul");
    assertThat(json.get("name").asText()).isEqualTo("Moderno Azul");
    assertThat(json.get("tags")).hasSize(2);
    assertThat(json.has("style")).isFalse();
    assertThat(json.has("titles")).isFalse();
  }

  @Test
  void bulletStylesNumberFromOne() {
    assertThat(BulletStyle.BULLET.marker(3)).isEqualTo("• ");
    assertThat(BulletStyle.NUMBERED.marker(0)).isEqualTo("1. ");
    assertThat(BulletStyle.NUMBERED.marker(9)).isEqualTo("10. ");
  }
}
