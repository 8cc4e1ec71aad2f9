package io.github.kgov.console.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits and joins multi-document YAML text.
 */
public final class YamlDocuments {

  public static final String FILE_SEPARATOR = "\n---\n";

  // "---" optionally followed by whitespace and inline content, e.g. "--- # comment" or "--- {a: 1}"
  private static final Pattern START_MARKER = Pattern.compile("^---(?:\\s+(.*))?$");
  private static final Pattern END_MARKER = Pattern.compile("^\\.\\.\\.\\s*$");

  private YamlDocuments() {}

  /**
   * Splits text on document markers. A {@code ---} line starts a new document and any
   * content after the marker becomes that document's first line; a {@code ...} line ends
   * the current one. Documents holding only blank lines or comments are dropped and the
   * order of the remaining documents is preserved.
   *
   * @param text multi-document YAML, may be null
   * @return the documents, without markers
   */
  public static List<String> split(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<String> documents = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String line : text.split("\\r?\\n", -1)) {
      Matcher start = START_MARKER.matcher(line);
      if (start.matches()) {
        flush(current, documents);
        String inline = start.group(1);
        if (inline != null && !inline.isBlank()) {
          current.append(inline).append('\n');
        }
      } else if (END_MARKER.matcher(line).matches()) {
        flush(current, documents);
      } else {
        current.append(line).append('\n');
      }
    }
    flush(current, documents);
    return List.copyOf(documents);
  }

  /**
   * Joins file contents into one multi-document text.
   */
  public static String join(List<String> files) {
    return String.join(FILE_SEPARATOR, files);
  }

  private static void flush(StringBuilder current, List<String> documents) {
    String document = current.toString().strip();
    if (hasContent(document)) {
      documents.add(document);
    }
    current.setLength(0);
  }

  private static boolean hasContent(String document) {
    for (String line : document.split("\n")) {
      String trimmed = line.strip();
      if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
        return true;
      }
    }
    return false;
  }
}
