package com.flamingo.ai.newsrag.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent adding search keywords to a news question before it is embedded. */
public interface QueryExpansionAgent {

  @SystemMessage(
      """
        You improve search queries for a semantic news search engine.

        Given a user question, return a short list of related keywords, names, places and
        synonyms that news articles answering it would likely contain.

        Rules:
        1. Return plain text only, keywords separated by spaces
        2. At most 15 words
        3. Do not repeat the question and do not answer it
        """)
  @UserMessage("Question: {{query}}")
  String expand(@V("query") String query);
}
