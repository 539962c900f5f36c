package com.flamingo.ai.newsrag.agent;

import com.flamingo.ai.newsrag.agent.dto.NewsClassificationResult;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent deciding whether a question is about current events and needs article retrieval. */
public interface NewsClassificationAgent {

  @SystemMessage(
      """
        You classify user questions for a news assistant that answers from recent articles.

        Return newsRelated=true when the question concerns current events, politics, elections,
        business, markets, world affairs, weather events, sports results, science or technology
        news, public figures, or anything that recent news coverage would help answer.

        Return newsRelated=false for arithmetic, general knowledge that does not change over time,
        programming help, greetings, small talk, or creative writing requests.

        Examples:
        - "Who won the election?" -> newsRelated=true
        - "What's happening with the storm in Florida?" -> newsRelated=true
        - "What's 2+2?" -> newsRelated=false
        - "Hello, how are you?" -> newsRelated=false

        Return JSON with these fields:
        - newsRelated (boolean)
        - reasoning (string) - one short sentence
        """)
  @UserMessage("Question: {{query}}")
  NewsClassificationResult classify(@V("query") String query);
}
