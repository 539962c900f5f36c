package com.flamingo.ai.newsrag.service.ingestion;

import com.flamingo.ai.newsrag.config.RagConfig;
import com.flamingo.ai.newsrag.domain.Article;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

/**
 * Reads the configured RSS feeds with jsoup's XML parser. Each {@code <item>} becomes an article
 * whose content is the description with HTML stripped.
 */
@Component
@Slf4j
public class RssArticleSource implements ArticleSource {

  private static final String USER_AGENT = "Mozilla/5.0 (news-rag ingestion)";

  private final RagConfig.Ingestion config;

  public RssArticleSource(RagConfig ragConfig) {
    this.config = ragConfig.getIngestion();
  }

  @Override
  public List<Article> fetchArticles() {
    Map<String, Article> unique = new LinkedHashMap<>();
    for (String feedUrl : config.getFeeds()) {
      try {
        List<Article> items = parseFeed(fetch(feedUrl));
        if (items.isEmpty()) {
          log.warn("No items in RSS: {}", feedUrl);
          continue;
        }
        log.info("Fetched {} items from {}", items.size(), feedUrl);
        for (Article article : items) {
          unique.putIfAbsent(article.link(), article);
        }
      } catch (IOException | RuntimeException e) {
        log.error("Failed to parse RSS {}: {}", feedUrl, e.getMessage());
      }
    }

    List<Article> articles = new ArrayList<>(unique.values());
    if (articles.size() > config.getMaxArticles()) {
      articles = new ArrayList<>(articles.subList(0, config.getMaxArticles()));
    }
    log.info(
        "Collected {} unique articles from {} feeds", articles.size(), config.getFeeds().size());
    return articles;
  }

  @Override
  public List<String> describeSources() {
    return List.copyOf(config.getFeeds());
  }

  Document fetch(String feedUrl) throws IOException {
    return Jsoup.connect(feedUrl)
        .parser(Parser.xmlParser())
        .ignoreContentType(true)
        .userAgent(USER_AGENT)
        .timeout((int) config.getFetchTimeout().toMillis())
        .get();
  }

  /** Maps feed items to articles, dropping items without a link. */
  static List<Article> parseFeed(Document feed) {
    List<Article> articles = new ArrayList<>();
    for (Element item : feed.select("item")) {
      String link = childText(item, "link");
      if (link.isEmpty()) {
        continue;
      }
      String content = childText(item, "description");
      if (content.isEmpty()) {
        content = childText(item, "content|encoded");
      }
      String title = childText(item, "title");
      articles.add(
          new Article(title.isEmpty() ? null : title, link, Jsoup.parse(content).text()));
    }
    return articles;
  }

  private static String childText(Element item, String selector) {
    Element child = item.selectFirst(selector);
    return child != null ? child.text().trim() : "";
  }
}
