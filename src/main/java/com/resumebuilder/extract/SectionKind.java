package com.resumebuilder.extract;

public enum SectionKind {
  /** Lines before the first recognized heading: contact and summary candidates. */
  UNASSIGNED,
  CONTACT,
  SUMMARY,
  EXPERIENCE,
  EDUCATION,
  SKILLS,
  PROJECTS;
}
