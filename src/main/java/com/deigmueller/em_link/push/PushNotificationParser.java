package com.deigmueller.em_link.push;

import com.deigmueller.em_link.common.rpc.Rpc;
import com.deigmueller.em_link.common.utils.Json;
import com.deigmueller.em_link.status.ChannelReading;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the body of a webhook request, e.g.
 * <pre>
 * {"src":"em06p-...","method":"NotifyStatus","params":{"ts":1704695819000,"em":{"id":1,"power":123.4}}}
 * </pre>
 */
public class PushNotificationParser {
  private static final Pattern PREFIXED_KEY = Pattern.compile("^[A-Za-z]+[:_](\\d{1,9})$");

  /**
   * Parse a notification body
   * @param identity Normalized identity of the posting device
   * @param body Request body
   * @return Notification or null if the body carries no channel record
   * @throws JsonProcessingException if the body is not valid JSON
   */
  public @Nullable PushNotification parse(@NotNull String identity,
                                          @NotNull String body) throws JsonProcessingException {
    JsonNode root = Rpc.getObjectMapper().readTree(body);
    if (root == null || !root.isObject()) {
      return null;
    }

    String method = root.hasNonNull("method") ? root.get("method").asText() : null;
    JsonNode params = root.has("params") ? root.get("params") : root;

    Double timestamp = Json.readDoubleValue(params, "ts");

    JsonNode em = params.get("em");
    if (ChannelReading.looksLikeChannel(em)) {
      return create(identity, method, timestamp, em, null, false);
    }

    JsonNode emmerge = params.get("emmerge");
    if (ChannelReading.looksLikeChannel(emmerge)) {
      return create(identity, method, timestamp, emmerge, null, true);
    }

    Iterator<Map.Entry<String,JsonNode>> fields = params.fields();
    while (fields.hasNext()) {
      Map.Entry<String,JsonNode> field = fields.next();
      if (ChannelReading.looksLikeChannel(field.getValue())) {
        Matcher matcher = PREFIXED_KEY.matcher(field.getKey());
        Integer keyId = matcher.matches() ? Integer.valueOf(matcher.group(1)) : null;
        return create(identity, method, timestamp, field.getValue(), keyId, field.getKey().startsWith("emmerge"));
      }
    }

    return null;
  }

  private static @NotNull PushNotification create(@NotNull String identity,
                                                  @Nullable String method,
                                                  @Nullable Double timestamp,
                                                  @NotNull JsonNode record,
                                                  @Nullable Integer keyId,
                                                  boolean aggregate) {
    Integer channelId = Json.toChannelId(record.get("id"));
    if (channelId == null) {
      channelId = keyId != null && keyId > 0 ? keyId : 1;
    }

    return new PushNotification(
          identity,
          method,
          timestamp,
          ChannelReading.fromJson(channelId, record).withIdleDefaults(),
          aggregate);
  }
}
