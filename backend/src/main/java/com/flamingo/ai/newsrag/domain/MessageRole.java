package com.flamingo.ai.newsrag.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Defines the role of a chat message sender. */
public enum MessageRole {
  /** Message from the user. */
  USER("user"),

  /** Message from the AI assistant. */
  ASSISTANT("assistant");

  private final String wireName;

  MessageRole(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String getWireName() {
    return wireName;
  }

  @JsonCreator
  public static MessageRole fromWireName(String value) {
    for (MessageRole role : values()) {
      if (role.wireName.equalsIgnoreCase(value)) {
        return role;
      }
    }
    throw new IllegalArgumentException("Unknown message role: " + value);
  }
}
