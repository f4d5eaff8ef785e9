package com.scholary.censor.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads term catalogs from files or JSON payloads.
 *
 * <p>Accepted file shapes:
 *
 * <pre>
 * ["damn", {"word": "heck", "threshold": 90}]
 *
 * {"profanities": ["damn", {"word": "use", "variant_strategy": "aggressive"}]}
 *
 * # plain text, one word per line
 * damn
 * heck
 * </pre>
 *
 * <p>Content that isn't valid JSON is read as plain text: blank lines and lines starting with
 * {@code #} are skipped.
 */
@Component
public class TermCatalogLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(TermCatalogLoader.class);

  static final String PROFANITIES_FIELD = "profanities";

  private final ObjectReader reader;

  public TermCatalogLoader(ObjectMapper objectMapper) {
    // "damn heck" must not parse as JSON just because the first token looks like one
    this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * Load a catalog file.
   *
   * @param path the catalog file
   * @param defaultThreshold threshold for entries without their own
   * @return the catalog, possibly empty
   * @throws TermCatalogException if the file can't be read or is JSON of the wrong shape
   */
  public TermCatalog load(Path path, double defaultThreshold) {
    String content;
    try {
      content = Files.readString(path, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new TermCatalogException("Failed to read term catalog: " + path, e);
    }

    TermCatalog catalog = TermCatalog.fromEntries(parse(content), defaultThreshold, path.toString());
    LOGGER.debug("Loaded {} terms from {}", catalog.size(), path);
    return catalog;
  }

  /**
   * Parse catalog content into raw entries.
   *
   * @param content the full catalog text
   * @return raw entries in file order
   */
  public List<CatalogEntry> parse(String content) {
    String text = stripBom(content == null ? "" : content);
    JsonNode root;
    try {
      root = reader.readTree(text);
    } catch (JsonProcessingException e) {
      LOGGER.debug("Catalog is not JSON ({}), reading it line by line", e.getOriginalMessage());
      return parseLines(text);
    }

    if (root == null || root.isMissingNode()) {
      return parseLines(text);
    }
    return parseJson(root);
  }

  /**
   * Convert a JSON catalog node into raw entries.
   *
   * @param root an array of entries, or an object with a {@code profanities} array
   * @return raw entries in order
   * @throws TermCatalogException if the node has neither shape
   */
  public List<CatalogEntry> parseJson(JsonNode root) {
    JsonNode items = root;
    if (root.isObject() && root.has(PROFANITIES_FIELD)) {
      items = root.get(PROFANITIES_FIELD);
      if (items.isNull()) {
        return List.of();
      }
    }
    if (!items.isArray()) {
      throw new TermCatalogException(
          "Profanity config must be a list or an object with '" + PROFANITIES_FIELD + "'");
    }

    List<CatalogEntry> entries = new ArrayList<>();
    for (JsonNode item : items) {
      if (item.isTextual()) {
        entries.add(new BareWordEntry(item.asText()));
      } else if (item.isObject()) {
        entries.add(toStructuredEntry(item));
      } else {
        LOGGER.debug("Skipping catalog entry of unsupported type: {}", item.getNodeType());
      }
    }
    return entries;
  }

  private CatalogEntry toStructuredEntry(JsonNode item) {
    JsonNode wordNode = item.get("word");
    String word = wordNode == null || wordNode.isNull() ? "" : wordNode.asText();

    JsonNode thresholdNode = item.has("threshold") ? item.get("threshold") : item.get("fuzzy_threshold");
    Double threshold = null;
    if (thresholdNode != null && !thresholdNode.isNull()) {
      if (thresholdNode.isNumber()) {
        threshold = thresholdNode.asDouble();
      } else {
        try {
          threshold = Double.parseDouble(thresholdNode.asText().trim());
        } catch (NumberFormatException e) {
          // NaN is rejected by Term, so the entry is dropped when the catalog is built
          threshold = Double.NaN;
        }
      }
    }

    JsonNode strategyNode = item.get("variant_strategy");
    boolean aggressive =
        item.path("aggressive").asBoolean(false)
            || (strategyNode != null && "aggressive".equalsIgnoreCase(strategyNode.asText().trim()));

    return new StructuredEntry(word, threshold, aggressive);
  }

  private List<CatalogEntry> parseLines(String text) {
    List<CatalogEntry> entries = new ArrayList<>();
    for (String line : text.split("\\R")) {
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      entries.add(new BareWordEntry(trimmed));
    }
    return entries;
  }

  private static String stripBom(String text) {
    return text.startsWith("\uFEFF") ? text.substring(1) : text;
  }
}
