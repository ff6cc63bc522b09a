package com.flamingo.ai.askdocs.service.rag.answer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Reads the {@code {"answer", "sources"}} object returned by the grounded answer agent. */
@Component
@RequiredArgsConstructor
@Slf4j
public class CompletionResponseParser {

  private final ObjectMapper objectMapper;

  public ParsedCompletion parse(String raw) {
    String json = stripCodeFence(raw.trim());
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      log.warn("Completion was not JSON, using it verbatim: {}", e.getOriginalMessage());
      return new ParsedCompletion(raw.trim(), List.of(), false);
    }
    JsonNode answer = root == null ? null : root.get("answer");
    if (answer == null || !answer.isTextual()) {
      log.warn("Completion JSON has no answer field, using it verbatim");
      return new ParsedCompletion(raw.trim(), List.of(), false);
    }

    List<String> sources = new ArrayList<>();
    JsonNode sourcesNode = root.get("sources");
    if (sourcesNode != null && sourcesNode.isArray()) {
      for (JsonNode source : sourcesNode) {
        if (source.isTextual() && !source.asText().isBlank()) {
          sources.add(source.asText().trim());
        }
      }
    }
    return new ParsedCompletion(answer.asText().trim(), List.copyOf(sources), true);
  }

  private static String stripCodeFence(String text) {
    if (!text.startsWith("```")) {
      return text;
    }
    int firstNewline = text.indexOf('\n');
    int closing = text.lastIndexOf("```");
    if (firstNewline < 0 || closing <= firstNewline) {
      return text;
    }
    return text.substring(firstNewline + 1, closing).trim();
  }
}
