package com.flamingo.ai.newsrag.service.chunking;

import com.flamingo.ai.newsrag.config.RagConfig;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link TextChunker} that greedily packs whole sentences up to a soft limit.
 *
 * <p>Texts at or under the soft limit become a single chunk. Longer texts are split on sentence
 * punctuation followed by whitespace; a sentence longer than the soft limit is cut at the limit.
 * If splitting yields nothing the text is sliced at fixed width. Chunks outside {@code [minLength,
 * maxLength]} are dropped.
 */
@Component
@Slf4j
public class SentencePackingChunker implements TextChunker {

  private static final Pattern CONTROL_CHARS =
      Pattern.compile("[\\u0000-\\u0008\\u000B\\u000C\\u000E-\\u001F\\u007F-\\u009F]");
  private static final Pattern ZERO_WIDTH_CHARS = Pattern.compile("[\\u200B-\\u200D\\uFEFF]");
  // matched per code point, so the printable range runs through the supplementary planes
  private static final Pattern NON_PRINTABLE =
      Pattern.compile("[^\\u0020-\\u007E\\u00A0-\\x{10FFFF}\\s]");
  private static final Pattern WHITESPACE_RUN =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

  private final RagConfig.Chunking config;

  public SentencePackingChunker(RagConfig ragConfig) {
    this.config = ragConfig.getChunking();
  }

  @Override
  public String clean(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String processed = CONTROL_CHARS.matcher(text).replaceAll("");
    processed = Normalizer.normalize(processed, Normalizer.Form.NFC);
    processed = ZERO_WIDTH_CHARS.matcher(processed).replaceAll("");
    processed = NON_PRINTABLE.matcher(processed).replaceAll("");
    return WHITESPACE_RUN.matcher(processed).replaceAll(" ").trim();
  }

  @Override
  public List<String> chunkText(String text) {
    String cleanText = clean(text);
    if (cleanText.length() < config.getMinLength()) {
      return List.of();
    }

    int softLimit = config.getSoftLimit();
    if (cleanText.length() <= softLimit) {
      return List.of(cleanText);
    }

    List<String> chunks = packSentences(cleanText, softLimit);
    if (chunks.isEmpty()) {
      for (int i = 0; i < cleanText.length(); i += softLimit) {
        chunks.add(cleanText.substring(i, Math.min(cleanText.length(), i + softLimit)));
      }
    }

    List<String> validChunks =
        chunks.stream()
            .filter(
                chunk -> {
                  int length = chunk.trim().length();
                  return length >= config.getMinLength() && length <= config.getMaxLength();
                })
            .toList();

    log.debug(
        "Processed text into {} chunks (original={} chars, cleaned={} chars)",
        validChunks.size(),
        text.length(),
        cleanText.length());
    return validChunks;
  }

  private List<String> packSentences(String cleanText, int softLimit) {
    List<String> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();

    for (String sentence : SENTENCE_BOUNDARY.split(cleanText)) {
      String trimmed = sentence.trim();
      if (trimmed.isEmpty()) {
        continue;
      }

      int candidateLength =
          current.length() == 0 ? trimmed.length() : current.length() + 1 + trimmed.length();
      if (candidateLength <= softLimit) {
        if (current.length() > 0) {
          current.append(' ');
        }
        current.append(trimmed);
        continue;
      }

      if (current.length() > 0) {
        chunks.add(current.toString());
      }
      current.setLength(0);
      current.append(trimmed.length() > softLimit ? trimmed.substring(0, softLimit) : trimmed);
    }

    if (current.length() > 0) {
      chunks.add(current.toString());
    }
    return chunks;
  }
}
