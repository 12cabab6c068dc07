package com.flamingo.ai.ragengine.service.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Lexical query analysis used by hybrid retrieval.
 *
 * <p>Pure and deterministic: no I/O, no shared state. Extracts keywords from a query and scores a
 * chunk text against them with a log-damped term-frequency measure bounded to [0, 1].
 */
@Service
@Slf4j
public class QueryPreprocessor {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s-]");
  private static final Pattern NUMERIC = Pattern.compile("\\d+");

  /** Ten occurrences of every keyword is treated as a perfect match. */
  private static final double SATURATION = Math.log(10);

  private static final int MIN_KEYWORD_LENGTH = 3;

  static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "that", "the", "to", "was", "will", "with", "this", "but",
          "they", "have", "had", "what", "said", "each", "which", "their", "if", "up", "out",
          "many", "then", "them", "these", "so", "some", "her", "would", "make", "like", "into",
          "him", "two", "more", "very", "after", "words", "long", "than", "first", "been", "call",
          "who", "oil", "sit", "now", "find", "down", "day", "did", "get", "come", "made", "may",
          "part", "how", "why", "when", "where", "does", "do", "can", "about", "or", "not", "we",
          "you", "your", "our", "i", "me", "my", "she", "his", "there", "were", "all", "any",
          "also", "such", "only", "own", "same", "too", "should", "could", "being", "those",
          "other", "over", "under", "between", "through", "during", "before", "because", "until",
          "while", "off", "again", "further", "once", "here", "both", "few", "most", "no", "nor");

  /**
   * Normalizes the query and extracts its keywords.
   *
   * @param query raw user query, may be {@code null}
   * @return the preprocessing result; all fields empty for a blank query
   */
  public QueryPreprocessingResult preprocess(String query) {
    if (query == null || query.isBlank()) {
      return QueryPreprocessingResult.empty(query);
    }

    String normalized = normalize(query);
    List<String> keywords = extractKeywords(normalized);
    String cleaned = keywords.isEmpty() ? normalized : String.join(" ", keywords);

    log.debug("Query keywords: {} (from '{}')", keywords, normalized);
    return new QueryPreprocessingResult(query, normalized, keywords, cleaned);
  }

  /**
   * Contiguous keyword phrases of the query: every 2-gram, plus every 3-gram when the query has at
   * least three keywords.
   */
  public List<String> extractKeyPhrases(String query) {
    List<String> keywords = preprocess(query).keywords();
    List<String> phrases = new ArrayList<>();
    for (int i = 0; i + 1 < keywords.size(); i++) {
      phrases.add(keywords.get(i) + " " + keywords.get(i + 1));
    }
    if (keywords.size() >= 3) {
      for (int i = 0; i + 2 < keywords.size(); i++) {
        phrases.add(keywords.get(i) + " " + keywords.get(i + 1) + " " + keywords.get(i + 2));
      }
    }
    return phrases;
  }

  /**
   * Scores how well {@code text} matches the keywords.
   *
   * <p>Each keyword with {@code k > 0} whole-word, case-insensitive occurrences adds {@code
   * ln(1 + k)}. The total is normalized by {@code |keywords| * ln(10)} and multiplied by the
   * fraction of keywords that matched at all, then capped at 1.
   *
   * @return a score in [0, 1]; 0 for no keywords or empty text
   */
  public double calculateKeywordScore(List<String> keywords, String text) {
    if (keywords == null || keywords.isEmpty() || text == null || text.isEmpty()) {
      return 0.0;
    }

    double total = 0.0;
    int matched = 0;
    for (String keyword : keywords) {
      int occurrences = countOccurrences(keyword, text);
      if (occurrences > 0) {
        total += Math.log(1 + occurrences);
        matched++;
      }
    }

    int n = keywords.size();
    double depth = total / (n * SATURATION);
    double breadth = (double) matched / n;
    return Math.min(1.0, depth * breadth);
  }

  private String normalize(String query) {
    return WHITESPACE.matcher(query.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
  }

  private List<String> extractKeywords(String normalized) {
    String stripped = NON_WORD.matcher(normalized).replaceAll(" ").trim();
    if (stripped.isEmpty()) {
      return List.of();
    }
    return Arrays.stream(WHITESPACE.split(stripped))
        .filter(token -> !STOP_WORDS.contains(token))
        .filter(token -> token.length() >= MIN_KEYWORD_LENGTH || NUMERIC.matcher(token).matches())
        .toList();
  }

  private int countOccurrences(String keyword, String text) {
    Pattern pattern =
        Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE);
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
