package com.resumebuilder.layout;

public final class SectionTitles {
  private final String summary;
  private final String experience;
  private final String education;
  private final String skills;
  private final String projects;

  SectionTitles(String summary, String experience, String education, String skills, String projects) {
    this.summary = summary;
    this.experience = experience;
    this.education = education;
    this.skills = skills;
    this.projects = projects;
  }

  public String getSummary() {
    return summary;
  }

  public String getExperience() {
    return experience;
  }

  public String getEducation() {
    return education;
  }

  public String getSkills() {
    return skills;
  }

  public String getProjects() {
    return projects;
  }
}
