package com.resumebuilder.render;

import java.util.ArrayList;
import java.util.List;

import com.resumebuilder.Entity;
import com.resumebuilder.extract.SkillsParser;
import com.resumebuilder.layout.LayoutDefinition;
import com.resumebuilder.layout.SectionTitles;

/**
 * Decides what gets rendered and in which order, once for both backends: the header, then
 * summary, experience, education, skills and projects. A section with nothing to show is
 * left out together with its heading.
 */
public class ContentPlanner {
  static final String PERIOD_SEPARATOR = " – ";

  private final String untitledName;
  private final String ongoingLabel;

  public ContentPlanner(String untitledName, String ongoingLabel) {
    this.untitledName = untitledName;
    this.ongoingLabel = ongoingLabel;
  }

  public List<ContentBlock> plan(Entity.ResumeEntity resume, LayoutDefinition layout) {
    SectionTitles titles = layout.getTitles();
    List<ContentBlock> blocks = new ArrayList<>();
    blocks.add(header(resume.contact));

    String summary = clean(resume.summary);
    if (summary != null) {
      blocks.add(ContentBlock.heading(titles.getSummary()));
      blocks.add(ContentBlock.text(ContentBlock.Kind.SUMMARY, summary));
    }

    List<ContentBlock> entries = new ArrayList<>();
    for (Entity.Experience experience : nonNull(resume.experience)) {
      addIfPresent(entries, experience(experience));
    }
    addSection(blocks, titles.getExperience(), entries);

    entries = new ArrayList<>();
    for (Entity.Education education : nonNull(resume.education)) {
      addIfPresent(entries, education(education));
    }
    addSection(blocks, titles.getEducation(), entries);

    List<String> skills = SkillsParser.distinct(nonNull(resume.skills));
    if (!skills.isEmpty()) {
      blocks.add(ContentBlock.heading(titles.getSkills()));
      blocks.add(ContentBlock.text(ContentBlock.Kind.SKILLS,
          String.join(layout.getStyle().getSkillSeparator(), skills)));
    }

    entries = new ArrayList<>();
    for (Entity.Project project : nonNull(resume.projects)) {
      addIfPresent(entries, project(project));
    }
    addSection(blocks, titles.getProjects(), entries);
    return blocks;
  }

  private ContentBlock header(Entity.Contact contact) {
    if (contact == null) {
      contact = new Entity.Contact();
    }
    String name = clean(contact.fullName);
    List<String> details = new ArrayList<>();
    for (String value : new String[] {contact.email, contact.phone, contact.location, contact.linkedin, contact.website}) {
      String detail = clean(value);
      if (detail != null) {
        details.add(detail);
      }
    }
    return new ContentBlock(ContentBlock.Kind.HEADER, name == null ? untitledName : name, null, null, null, details);
  }

  private ContentBlock experience(Entity.Experience experience) {
    if (experience == null) {
      return null;
    }
    List<String> achievements = cleanAll(experience.achievements);
    String role = clean(experience.role);
    String organization = clean(experience.organization);
    String period = period(experience.startDate, experience.endDate, experience.current);
    String description = clean(experience.description);
    if (role == null && organization == null && period == null && description == null && achievements.isEmpty()) {
      return null;
    }
    if (role == null) {
      role = organization;
      organization = null;
    }
    return new ContentBlock(ContentBlock.Kind.EXPERIENCE, role, organization, period, description, achievements);
  }

  private ContentBlock education(Entity.Education education) {
    if (education == null) {
      return null;
    }
    String degree = clean(education.degree);
    String institution = clean(education.institution);
    String details = clean(education.details);
    if (degree == null && institution == null && details == null) {
      return null;
    }
    if (degree == null) {
      degree = institution;
      institution = null;
    }
    return new ContentBlock(ContentBlock.Kind.EDUCATION, degree, institution, null, details, List.of());
  }

  private ContentBlock project(Entity.Project project) {
    if (project == null) {
      return null;
    }
    String name = clean(project.name);
    String link = clean(project.link);
    String description = clean(project.description);
    if (name == null && link == null && description == null) {
      return null;
    }
    return new ContentBlock(ContentBlock.Kind.PROJECT, name, link, null, description, List.of());
  }

  /**
   * "start – end", with the ongoing label when the entry is current and has no end text.
   * @return null when there is nothing to print
   */
  String period(String startDate, String endDate, boolean current) {
    String start = clean(startDate);
    String end = clean(endDate);
    if (end == null && current && !ongoingLabel.isEmpty()) {
      end = ongoingLabel;
    }
    if (start == null) {
      return end;
    }
    return end == null ? start : start + PERIOD_SEPARATOR + end;
  }

  private static void addSection(List<ContentBlock> blocks, String title, List<ContentBlock> entries) {
    if (!entries.isEmpty()) {
      blocks.add(ContentBlock.heading(title));
      blocks.addAll(entries);
    }
  }

  private static void addIfPresent(List<ContentBlock> entries, ContentBlock entry) {
    if (entry != null) {
      entries.add(entry);
    }
  }

  private static List<String> cleanAll(List<String> values) {
    List<String> out = new ArrayList<>();
    for (String value : nonNull(values)) {
      String v = clean(value);
      if (v != null) {
        out.add(v);
      }
    }
    return out;
  }

  private static <T> List<T> nonNull(List<T> list) {
    return list == null ? List.of() : list;
  }

  private static String clean(String value) {
    if (value == null) {
      return null;
    }
    String v = value.strip();
    return v.isEmpty() ? null : v;
  }
}
