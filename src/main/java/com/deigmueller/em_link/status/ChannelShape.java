package com.deigmueller.em_link.status;

import com.deigmueller.em_link.common.utils.Json;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The firmware response shapes carrying per-channel records, in the order they are tried.
 * Each shape extracts candidate records from the status payload or returns an empty list if
 * the payload does not have that shape.
 */
enum ChannelShape {
  /**
   * {@code {"result": {"status": [ {...}, ... ]}}} or {@code {"status": [...]}}
   */
  STATUS_ARRAY {
    @Override
    @NotNull List<Candidate> extract(@NotNull JsonNode payload, @NotNull JsonNode result) {
      List<Candidate> candidates = fromArray(result.get("status"));
      return candidates.isEmpty() ? fromArray(payload.get("status")) : candidates;
    }
  },

  /**
   * {@code {"result": [ {...}, ... ]}} or a bare array
   */
  TOP_LEVEL_ARRAY {
    @Override
    @NotNull List<Candidate> extract(@NotNull JsonNode payload, @NotNull JsonNode result) {
      List<Candidate> candidates = fromArray(result);
      return candidates.isEmpty() ? fromArray(payload) : candidates;
    }
  },

  /**
   * {@code {"em:0": {...}, "em:1": {...}}}, {@code {"ch_1": {...}}} and similar
   */
  PREFIX_KEYED {
    @Override
    @NotNull List<Candidate> extract(@NotNull JsonNode payload, @NotNull JsonNode result) {
      if (!result.isObject()) {
        return Collections.emptyList();
      }

      Map<String,Map<Integer,JsonNode>> families = new LinkedHashMap<>();
      Iterator<Map.Entry<String,JsonNode>> fields = result.fields();
      while (fields.hasNext()) {
        Map.Entry<String,JsonNode> field = fields.next();
        Matcher matcher = PREFIXED_KEY.matcher(field.getKey());
        if (matcher.matches() && ChannelReading.looksLikeChannel(field.getValue())) {
          families.computeIfAbsent(matcher.group(1), prefix -> new LinkedHashMap<>())
                .put(Integer.parseInt(matcher.group(2)), field.getValue());
        }
      }

      Map<Integer,JsonNode> largest = null;
      for (Map<Integer,JsonNode> family : families.values()) {
        if (largest == null || family.size() > largest.size()) {
          largest = family;
        }
      }

      return largest != null ? fromNumberedRecords(largest) : Collections.emptyList();
    }
  },

  /**
   * {@code {"1": {...}, "2": {...}}}, either directly or below {@code channels}
   */
  KEYED_OBJECT {
    @Override
    @NotNull List<Candidate> extract(@NotNull JsonNode payload, @NotNull JsonNode result) {
      JsonNode channels = result.get("channels");
      List<Candidate> candidates = fromKeyedObject(channels);
      if (candidates.isEmpty() && channels != null && channels.isArray()) {
        candidates = fromArray(channels);
      }
      return candidates.isEmpty() ? fromKeyedObject(result) : candidates;
    }
  },

  /**
   * Any array of channel records nested below container objects
   */
  NESTED {
    @Override
    @NotNull List<Candidate> extract(@NotNull JsonNode payload, @NotNull JsonNode result) {
      return search(result, 0);
    }

    private @NotNull List<Candidate> search(@NotNull JsonNode node, int depth) {
      if (depth > MAX_NESTING_DEPTH || !node.isObject()) {
        return Collections.emptyList();
      }

      Iterator<JsonNode> elements = node.elements();
      while (elements.hasNext()) {
        JsonNode child = elements.next();
        List<Candidate> candidates = child.isArray() ? fromArray(child) : search(child, depth + 1);
        if (!candidates.isEmpty()) {
          return candidates;
        }
      }

      return Collections.emptyList();
    }
  },

  /**
   * A single channel record as answered by {@code Em.Status.Get?id=<n>}
   */
  SINGLE_RECORD {
    @Override
    @NotNull List<Candidate> extract(@NotNull JsonNode payload, @NotNull JsonNode result) {
      if (result.isObject() && result.has("id") && ChannelReading.looksLikeChannel(result)
            && (result.has("power") || result.has("act_power") || result.has("voltage") || result.has("current"))) {
        return List.of(new Candidate(Json.toChannelId(result.get("id")), result));
      }
      return Collections.emptyList();
    }
  };

  private static final Pattern PREFIXED_KEY = Pattern.compile("^([A-Za-z]+)[:_](\\d{1,9})$");
  private static final Pattern NUMERIC_KEY = Pattern.compile("^\\d{1,9}$");
  private static final int MAX_NESTING_DEPTH = 3;

  abstract @NotNull List<Candidate> extract(@NotNull JsonNode payload, @NotNull JsonNode result);

  private static @NotNull List<Candidate> fromArray(@Nullable JsonNode node) {
    if (node == null || !node.isArray()) {
      return Collections.emptyList();
    }

    List<Candidate> candidates = new ArrayList<>();
    for (JsonNode element : node) {
      if (ChannelReading.looksLikeChannel(element)) {
        candidates.add(new Candidate(Json.toChannelId(element.get("id")), element));
      }
    }
    return candidates;
  }

  private static @NotNull List<Candidate> fromKeyedObject(@Nullable JsonNode node) {
    if (node == null || !node.isObject()) {
      return Collections.emptyList();
    }

    Map<Integer,JsonNode> records = new LinkedHashMap<>();
    Iterator<Map.Entry<String,JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String,JsonNode> field = fields.next();
      if (NUMERIC_KEY.matcher(field.getKey()).matches() && ChannelReading.looksLikeChannel(field.getValue())) {
        records.put(Integer.parseInt(field.getKey()), field.getValue());
      }
    }

    return fromNumberedRecords(records);
  }

  /**
   * Build candidates from records numbered by their key. Families counting from zero are
   * shifted so that channel ids start at one.
   */
  private static @NotNull List<Candidate> fromNumberedRecords(@NotNull Map<Integer,JsonNode> records) {
    int shift = records.containsKey(0) ? 1 : 0;

    List<Candidate> candidates = new ArrayList<>();
    for (Map.Entry<Integer,JsonNode> entry : records.entrySet()) {
      candidates.add(new Candidate(entry.getKey() + shift, entry.getValue()));
    }
    return candidates;
  }

  /**
   * A channel record found in the payload together with the id it declares, if any
   */
  record Candidate(
        @Nullable Integer declaredId,
        @NotNull JsonNode record
  ) {}
}
