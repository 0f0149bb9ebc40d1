package com.resumebuilder.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resumebuilder.Entity;
import com.resumebuilder.reader.TextLine;

/**
 * Pulls contact details out of the header region with an ordered list of field matchers.
 * Each matcher consumes what it recognizes, so later matchers only see the remainder of
 * the line. The first line nothing recognizes, seen before any contact detail, is taken as
 * the candidate's name; everything else left over is handed back for the summary.
 */
class ContactExtractor {
  private static final Logger LOGGER = LoggerFactory.getLogger(ContactExtractor.class);

  private static final int MAX_NAME_WORDS = 8;
  private static final int MAX_LOCATION_WORDS = 6;
  private static final String CONSUMED = " | ";
  private static final Pattern PIECE_SEPARATORS = Pattern.compile("\\s*[|•·●;]\\s*|\\s{2,}");
  private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[\\s|•·●;,:/-]+|[\\s|•·●;,:/-]+$");
  private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:)\\]]+$");
  private static final Pattern DIGIT = Pattern.compile("\\d");
  private static final Pattern SENTENCE_PUNCTUATION = Pattern.compile("[.!?]$|[;:]");
  private static final Pattern REGION_CODE = Pattern.compile("(?:,|\\s[-/])\\s*\\p{Lu}{2}$");

  private static final Pattern LOCATION = Pattern.compile(
      "^\\p{L}[\\p{L}'. -]*,\\s*\\p{L}[\\p{L}'. -]*(?:,\\s*\\p{L}[\\p{L}'. -]*)?$"
      + "|^\\p{L}[\\p{L}'. ]*\\s[-/]\\s\\p{Lu}{2}$");

  /** One recognizable contact field. */
  static final class FieldMatcher {
    final String name;
    final Pattern pattern;
    final Function<Matcher, String> value;
    final BiConsumer<Entity.Contact, String> setter;
    final Function<Entity.Contact, String> getter;

    FieldMatcher(String name, Pattern pattern, Function<Matcher, String> value,
        BiConsumer<Entity.Contact, String> setter, Function<Entity.Contact, String> getter) {
      this.name = name;
      this.pattern = pattern;
      this.value = value;
      this.setter = setter;
      this.getter = getter;
    }
  }

  /** What the header region yielded besides the contact fields. */
  static final class Result {
    final Entity.Contact contact;
    final List<String> leftovers;

    Result(Entity.Contact contact, List<String> leftovers) {
      this.contact = contact;
      this.leftovers = leftovers;
    }
  }

  private final ExtractionRules rules;
  private final List<FieldMatcher> matchers = new ArrayList<>();

  ContactExtractor(ExtractionRules rules) {
    this.rules = rules;
    matchers.add(new FieldMatcher("email",
        Pattern.compile("[\\w.+-]+@[\\w-]+(?:\\.[\\w-]+)+"),
        Matcher::group,
        (c, v) -> c.email = v, c -> c.email));
    matchers.add(new FieldMatcher("linkedin",
        Pattern.compile("(?i)(?:https?://)?(?:[a-z]{2,3}\\.)?linkedin\\.com/[^\\s|,;•]+"),
        m -> trimUrl(m.group()),
        (c, v) -> c.linkedin = v, c -> c.linkedin));
    matchers.add(new FieldMatcher("linkedin",
        Pattern.compile("(?i)linkedin\\s*:\\s*([^\\s|,;•]+)"),
        m -> trimUrl(m.group(1)),
        (c, v) -> c.linkedin = v, c -> c.linkedin));
    matchers.add(new FieldMatcher("website",
        Pattern.compile("(?i)(?:https?://|www\\.)[^\\s|,;•]+"
            + "|(?<![\\w@.])[a-z0-9-]+(?:\\.[a-z0-9-]+)*\\.(?:com|dev|me|org|app|site|br|pt)"
            + "(?:\\.br)?(?:/[^\\s|,;•]*)?(?![\\w.])"
            + "|(?<![\\w@.])[a-z0-9-]+(?:\\.[a-z0-9-]+)*\\.(?:io|net|tech)/[^\\s|,;•]*"),
        m -> trimUrl(m.group()),
        (c, v) -> c.website = v, c -> c.website));
    matchers.add(new FieldMatcher("phone",
        Pattern.compile("(?<![\\w@])(?:\\+\\d{1,3}[\\s.-]?)?(?:\\(?\\d{2,3}\\)?[\\s.-]?)?\\d{4,5}[\\s.-]?\\d{4}(?!\\d)"
            + "|\\+\\d{1,3}(?:[\\s.-]?\\(?\\d{1,4}\\)?){2,5}(?!\\d)"),
        m -> m.group().strip(),
        (c, v) -> c.phone = v, c -> c.phone));
    matchers.add(new FieldMatcher("location",
        Pattern.compile("(?i)(?:localiza[cç][aã]o|location|endere[cç]o|address|cidade)\\s*:\\s*([^|•;]+)"),
        m -> m.group(1).strip(),
        (c, v) -> c.location = v, c -> c.location));
  }

  Result extract(List<TextLine> header, Entity.Contact contact) {
    List<String> leftovers = new ArrayList<>();
    boolean contactSeen = hasAnyDetail(contact);

    for (TextLine line : header) {
      if (line.isBlank()) {
        continue;
      }
      String remaining = line.getText();
      boolean hit = false;
      for (FieldMatcher matcher : matchers) {
        Matcher m = matcher.pattern.matcher(remaining);
        if (!m.find()) {
          continue;
        }
        String value = matcher.value.apply(m);
        if (value.isEmpty()) {
          continue;
        }
        hit = true;
        if (matcher.getter.apply(contact) == null) {
          matcher.setter.accept(contact, value);
          LOGGER.debug("Header matched {}", matcher.name);
        } else {
          // a second value of the same kind is kept as text rather than dropped
          leftovers.add(value);
        }
        remaining = remaining.substring(0, m.start()) + CONSUMED + remaining.substring(m.end());
      }

      String residue = EDGE_SEPARATORS.matcher(remaining).replaceAll("");
      if (!hit) {
        boolean location = contact.location == null && isLocation(residue, false);
        if (!location && contact.fullName == null && !contactSeen && isPlausibleName(residue)) {
          contact.fullName = residue;
          continue;
        }
        if (location) {
          contact.location = residue;
          contactSeen = true;
          continue;
        }
        if (!rules.isHeaderNoise(residue)) {
          leftovers.add(residue);
        }
        continue;
      }

      contactSeen = true;
      for (String piece : PIECE_SEPARATORS.split(residue)) {
        String text = EDGE_SEPARATORS.matcher(piece).replaceAll("");
        if (text.isEmpty() || rules.isContactLabel(text)) {
          continue;
        }
        if (contact.location == null && isLocation(text, true)) {
          contact.location = text;
        } else {
          leftovers.add(text);
        }
      }
    }
    return new Result(contact, leftovers);
  }

  private boolean isPlausibleName(String text) {
    return !text.isEmpty()
        && !DIGIT.matcher(text).find()
        && !SENTENCE_PUNCTUATION.matcher(text).find()
        && Text.wordCount(text) <= MAX_NAME_WORDS
        && !rules.isHeaderNoise(text)
        && !rules.isBullet(text);
  }

  /**
   * A bare "City, Region" needs a short region code unless it shares a line with another
   * contact detail.
   */
  private static boolean isLocation(String text, boolean onContactLine) {
    return Text.wordCount(text) <= MAX_LOCATION_WORDS
        && LOCATION.matcher(text).matches()
        && !SENTENCE_PUNCTUATION.matcher(text).find()
        && (onContactLine || REGION_CODE.matcher(text).find());
  }

  private static boolean hasAnyDetail(Entity.Contact contact) {
    return contact.email != null || contact.phone != null || contact.linkedin != null
        || contact.website != null || contact.location != null;
  }

  private static String trimUrl(String url) {
    return TRAILING_PUNCTUATION.matcher(url.strip()).replaceAll("");
  }
}
