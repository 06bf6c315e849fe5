/*
 * どこで: Karma データアクセス
 * 何を: capabilities(jsonb 配列)と List<String> を相互変換する
 * なぜ: players と offers で同じ JSON 形状を保つため
 */
package com.example.karma.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class CapabilitiesJsonCodec {

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public String write(List<String> capabilities) {
    try {
      return objectMapper.writeValueAsString(capabilities == null ? List.of() : capabilities);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize capabilities", ex);
    }
  }

  public List<String> read(String json) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return objectMapper.readValue(json, STRING_LIST);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse capabilities", ex);
    }
  }
}
