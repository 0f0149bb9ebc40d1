package com.resumebuilder.extract;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resumebuilder.EmptyDocumentException;
import com.resumebuilder.Entity;
import com.resumebuilder.reader.DocumentText;
import com.resumebuilder.reader.TextLine;

/**
 * Turns a line sequence into the resume schema: segment into sections, then run the parser
 * for each section kind over the concatenated lines of that kind.
 * <p>
 * Stateless after construction; one instance can serve concurrent calls.
 */
public class ResumeExtractor {
  private static final Logger LOGGER = LoggerFactory.getLogger(ResumeExtractor.class);

  private final SectionSegmenter segmenter;
  private final ContactExtractor contacts;
  private final ExperienceParser experiences;
  private final EducationParser educations;
  private final ProjectParser projects;
  private final SkillsParser skills;

  public ResumeExtractor() {
    this(ExtractionRules.defaults());
  }

  public ResumeExtractor(ExtractionRules rules) {
    EntryGrouper grouper = new EntryGrouper(rules);
    DateRangeMatcher dates = new DateRangeMatcher(rules);
    this.segmenter = new SectionSegmenter(rules);
    this.contacts = new ContactExtractor(rules);
    this.experiences = new ExperienceParser(rules, grouper, dates);
    this.educations = new EducationParser(rules, grouper, dates);
    this.projects = new ProjectParser(rules, grouper);
    this.skills = new SkillsParser(rules);
  }

  public ExtractionReport extract(DocumentText document) {
    Set<ExtractionReport.Notice> notices = EnumSet.noneOf(ExtractionReport.Notice.class);
    if (document.isReadingOrderApproximated()) {
      notices.add(ExtractionReport.Notice.READING_ORDER_APPROXIMATED);
    }
    return extract(document.getLines(), notices);
  }

  public ExtractionReport extract(List<TextLine> lines) {
    return extract(lines, EnumSet.noneOf(ExtractionReport.Notice.class));
  }

  private ExtractionReport extract(List<TextLine> lines, Set<ExtractionReport.Notice> notices) {
    if (lines.stream().allMatch(TextLine::isBlank)) {
      throw new EmptyDocumentException("The document has no extractable text");
    }

    List<Section> sections = segmenter.segment(lines);
    Map<SectionKind, List<TextLine>> byKind = new LinkedHashMap<>();
    for (Section section : sections) {
      List<TextLine> merged = byKind.computeIfAbsent(section.getKind(), k -> new ArrayList<>());
      if (!merged.isEmpty()) {
        merged.add(TextLine.blank());
      }
      merged.addAll(section.getLines());
    }

    Entity.ResumeEntity resume = new Entity.ResumeEntity();
    List<TextLine> header = new ArrayList<>(byKind.getOrDefault(SectionKind.UNASSIGNED, List.of()));
    header.addAll(byKind.getOrDefault(SectionKind.CONTACT, List.of()));
    ContactExtractor.Result contact = contacts.extract(header, resume.contact);

    List<String> summary = new ArrayList<>(contact.leftovers);
    for (TextLine line : byKind.getOrDefault(SectionKind.SUMMARY, List.of())) {
      if (!line.isBlank()) {
        summary.add(line.getText());
      }
    }
    resume.summary = summary.isEmpty() ? null : String.join(" ", summary);

    resume.experience.addAll(experiences.parse(byKind.getOrDefault(SectionKind.EXPERIENCE, List.of())));
    resume.education.addAll(educations.parse(byKind.getOrDefault(SectionKind.EDUCATION, List.of())));
    resume.skills.addAll(skills.parse(byKind.getOrDefault(SectionKind.SKILLS, List.of())));
    resume.projects.addAll(projects.parse(byKind.getOrDefault(SectionKind.PROJECTS, List.of())));

    review(resume, sections, notices);
    ExtractionReport report = new ExtractionReport(resume, notices);
    LOGGER.info("Extracted resume from {} lines: {} sections, {} experience, {} education, {} skills, {} projects, notices {}",
        lines.size(), sections.size(), resume.experience.size(), resume.education.size(),
        resume.skills.size(), resume.projects.size(), report.getNotices());
    return report;
  }

  private void review(Entity.ResumeEntity resume, List<Section> sections, Set<ExtractionReport.Notice> notices) {
    if (sections.stream().allMatch(s -> s.getKind() == SectionKind.UNASSIGNED)) {
      notices.add(ExtractionReport.Notice.NO_SECTIONS_DETECTED);
    }
    Entity.Contact contact = resume.contact;
    if (Text.isBlank(contact.fullName)) {
      notices.add(ExtractionReport.Notice.NAME_NOT_FOUND);
    }
    if (Text.isBlank(contact.email) && Text.isBlank(contact.phone)
        && Text.isBlank(contact.linkedin) && Text.isBlank(contact.website)) {
      notices.add(ExtractionReport.Notice.NO_CONTACT_DETAILS);
    }
    boolean unstructured = resume.experience.stream()
        .anyMatch(e -> e.organization == null && e.startDate == null)
        || resume.education.stream().anyMatch(e -> e.institution == null)
        || resume.projects.stream().anyMatch(p -> p.name == null);
    if (unstructured) {
      notices.add(ExtractionReport.Notice.UNSTRUCTURED_ENTRIES);
    }
  }
}
