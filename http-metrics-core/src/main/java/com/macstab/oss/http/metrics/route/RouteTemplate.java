/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.http.metrics.route;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parsed route template: literal text interleaved with named placeholders.
 *
 * <p><strong>Recognised placeholder forms</strong> (Spring path pattern syntax):
 *
 * <ul>
 *   <li>{@code {name}} - plain variable
 *   <li>{@code {name:regex}} - variable with constraint, braces inside the regex are balanced
 *       ({@code {id:\d{3}}})
 *   <li>{@code {*name}} - capture-the-rest variable
 * </ul>
 *
 * <p>An opening brace without matching closing brace is kept as literal text.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
final class RouteTemplate {

  private final String template;
  private final List<Segment> segments;

  private RouteTemplate(final String template, final List<Segment> segments) {
    this.template = template;
    this.segments = segments;
  }

  /**
   * Parses a route template.
   *
   * @param template template such as {@code /posts/{language}/{slug}}
   * @return parsed template
   */
  static RouteTemplate parse(final String template) {
    Objects.requireNonNull(template, "template must not be null");

    final List<Segment> segments = new ArrayList<>();
    int literalStart = 0;
    int i = 0;

    while (i < template.length()) {
      if (template.charAt(i) != '{') {
        i++;
        continue;
      }
      final int close = findClosingBrace(template, i);
      if (close < 0) {
        break; // unbalanced, rest is literal
      }
      if (literalStart < i) {
        segments.add(Segment.literal(template.substring(literalStart, i)));
      }
      final String raw = template.substring(i, close + 1);
      segments.add(Segment.placeholder(raw, placeholderName(raw)));
      i = close + 1;
      literalStart = i;
    }
    if (literalStart < template.length()) {
      segments.add(Segment.literal(template.substring(literalStart)));
    }

    return new RouteTemplate(template, Collections.unmodifiableList(segments));
  }

  /**
   * Renders the template, substituting kept placeholders with their matched values.
   *
   * <p>Placeholders whose name is not kept, or has no matched value, stay literal (including any
   * regex constraint).
   *
   * @param override parameters to substitute
   * @param pathVariables matched values by parameter name
   * @return rendered label
   */
  String render(final CardinalityOverride override, final Map<String, String> pathVariables) {
    final var label = new StringBuilder(template.length() + 16);
    for (final Segment segment : segments) {
      if (segment.name != null && override.keeps(segment.name)) {
        final String value = pathVariables.get(segment.name);
        label.append(value != null ? value : segment.text);
      } else {
        label.append(segment.text);
      }
    }
    return label.toString();
  }

  private static int findClosingBrace(final String template, final int open) {
    int depth = 0;
    for (int j = open; j < template.length(); j++) {
      final char c = template.charAt(j);
      if (c == '{') {
        depth++;
      } else if (c == '}') {
        depth--;
        if (depth == 0) {
          return j;
        }
      }
    }
    return -1;
  }

  private static String placeholderName(final String raw) {
    String body = raw.substring(1, raw.length() - 1);
    final int colon = body.indexOf(':');
    if (colon >= 0) {
      body = body.substring(0, colon);
    }
    if (body.startsWith("*")) {
      body = body.substring(1);
    }
    return body.trim();
  }

  @Override
  public String toString() {
    return template;
  }

  /** Literal text ({@code name == null}) or placeholder. */
  private static final class Segment {

    final String text;
    final String name;

    private Segment(final String text, final String name) {
      this.text = text;
      this.name = name;
    }

    static Segment literal(final String text) {
      return new Segment(text, null);
    }

    static Segment placeholder(final String raw, final String name) {
      return new Segment(raw, name);
    }
  }
}
