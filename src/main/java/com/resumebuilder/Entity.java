package com.resumebuilder;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

/**
 * The canonical resume data model shared by extraction and rendering.
 * <p>
 * Every field is optional. Input accepts the Portuguese field names as aliases;
 * output always uses the English names.
 */
public class Entity {
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Contact {
    @JsonProperty @JsonAlias({"nome_completo", "full_name", "nome"})
    public String fullName;

    @JsonProperty
    public String email;

    @JsonProperty @JsonAlias("telefone")
    public String phone;

    @JsonProperty @JsonAlias("localizacao")
    public String location;

    @JsonProperty
    public String linkedin;

    @JsonProperty @JsonAlias("site")
    public String website;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Experience {
    @JsonProperty @JsonAlias("cargo")
    public String role;

    @JsonProperty @JsonAlias({"company", "empresa"})
    public String organization;

    @JsonProperty @JsonAlias({"start_date", "data_inicio"})
    public String startDate;

    /** Raw end date; may be an ongoing marker such as "Atual". */
    @JsonProperty @JsonAlias({"end_date", "data_fim"})
    public String endDate;

    @JsonProperty @JsonAlias("atual")
    public boolean current;

    @JsonProperty @JsonAlias({"summary", "resumo"})
    public String description;

    @JsonProperty @JsonAlias({"highlights", "conquistas"})
    @JsonDeserialize(as=ArrayList.class, contentAs=String.class)
    public List<String> achievements = new ArrayList<>();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Education {
    @JsonProperty @JsonAlias("curso")
    public String degree;

    @JsonProperty @JsonAlias("instituicao")
    public String institution;

    @JsonProperty @JsonAlias({"summary", "detalhes"})
    public String details;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Project {
    @JsonProperty @JsonAlias("nome")
    public String name;

    @JsonProperty @JsonAlias("descricao")
    public String description;

    @JsonProperty
    public String link;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ResumeEntity {
    @JsonProperty @JsonAlias("contato")
    public Contact contact = new Contact();

    @JsonProperty @JsonAlias({"professional_summary", "resumo_profissional"})
    public String summary;

    @JsonProperty @JsonAlias({"experiences", "experiencias"})
    @JsonDeserialize(as=ArrayList.class, contentAs=Experience.class)
    public List<Experience> experience = new ArrayList<>();

    @JsonProperty @JsonAlias({"educations", "formacoes"})
    @JsonDeserialize(as=ArrayList.class, contentAs=Education.class)
    public List<Education> education = new ArrayList<>();

    @JsonProperty @JsonAlias("competencias")
    @JsonDeserialize(as=ArrayList.class, contentAs=String.class)
    public List<String> skills = new ArrayList<>();

    @JsonProperty @JsonAlias("projetos")
    @JsonDeserialize(as=ArrayList.class, contentAs=Project.class)
    public List<Project> projects = new ArrayList<>();
  }

  /**
   * Body of a render call: which layout, which output format, and the resume itself.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class RenderRequest {
    @JsonProperty @JsonAlias({"layout_id", "template_id"})
    public String layoutId;

    @JsonProperty @JsonAlias("formato")
    public String format;

    @JsonProperty @JsonAlias("curriculo")
    public ResumeEntity resume;
  }

  public static class Headings {
    @JsonProperty
    public String summary;

    @JsonProperty
    public String experience;

    @JsonProperty
    public String education;

    @JsonProperty
    public String skills;

    @JsonProperty
    public String projects;
  }

  public static class StyleEntity {
    @JsonProperty
    public String accentColor;

    @JsonProperty
    public String textColor;

    @JsonProperty
    public int columns = 1;

    @JsonProperty
    public String typography;

    @JsonProperty
    public float baseFontSize = 11f;

    @JsonProperty
    public String headerAlignment = "center";

    @JsonProperty
    public String bulletStyle = "BULLET";

    @JsonProperty
    public String skillSeparator = ", ";
  }

  /** One entry of {@code layouts.json}. */
  public static class LayoutEntity {
    @JsonProperty
    public String id;

    @JsonProperty
    public String name;

    @JsonProperty
    public String description;

    @JsonProperty
    @JsonDeserialize(as=ArrayList.class, contentAs=String.class)
    public List<String> tags;

    @JsonProperty
    public StyleEntity style;

    @JsonProperty
    public Headings headings;
  }

  public static class LayoutCatalogEntity {
    @JsonProperty
    public String untitledName;

    @JsonProperty
    public String ongoingLabel;

    @JsonProperty
    @JsonDeserialize(as=ArrayList.class, contentAs=LayoutEntity.class)
    public List<LayoutEntity> layouts;
  }
}
