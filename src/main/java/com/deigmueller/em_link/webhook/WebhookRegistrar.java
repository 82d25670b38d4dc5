package com.deigmueller.em_link.webhook;

import com.deigmueller.em_link.common.rpc.Rpc;
import com.deigmueller.em_link.common.rpc.RpcCaller;
import com.deigmueller.em_link.common.rpc.RpcException;
import com.deigmueller.em_link.common.utils.NetUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.regex.Pattern;

/**
 * Idempotent management of the device's webhook subscriptions. Every registration first
 * removes the hooks created by earlier runs (including legacy names), so repeated calls leave
 * exactly one set of hooks on the device.
 */
public class WebhookRegistrar {
  // Class members
  private static final Logger LOGGER = LoggerFactory.getLogger("em-link.webhook");

  public static final String HOOK_NAME = "emlink";
  public static final String CHANNEL_HOOK_PREFIX = "emlink-ch";
  public static final Set<String> LEGACY_HOOK_NAMES = Set.of("em-link", "emlink_push");
  public static final int MAX_HOOKS = 20;

  public static final String AGGREGATE_PREFIX = "emmerge.";
  public static final String CHANNEL_PREFIX = "em.";
  public static final String DEFAULT_EVENT = "em.status_update";
  public static final List<String> PREFERRED_EVENTS = List.of(
        "emmerge.power_change",
        "emmerge.current_change",
        "emmerge.voltage_change",
        "em.power_change",
        "em.current_change",
        "em.voltage_change");

  private static final Pattern CHANNEL_HOOK_NAME = Pattern.compile("^" + CHANNEL_HOOK_PREFIX + "\\d+$");

  // Instance members
  private final RpcCaller reader;
  private final RpcCaller mutator;

  /**
   * @param reader Used for listing and discovery
   * @param mutator Used for creating and deleting hooks; the device rejects these over plain HTTP
   */
  public WebhookRegistrar(@NotNull RpcCaller reader,
                          @NotNull RpcCaller mutator) {
    this.reader = reader;
    this.mutator = mutator;
  }

  /**
   * Register the webhook(s) pointing at the given URL
   * @param targetUrl URL the device shall post notifications to
   * @param eventHint Event type to use or null to discover it
   * @param channelIds Channel ids of the device, used for the per-channel fallback
   * @return Registration details
   */
  public CompletionStage<Registration> register(@NotNull String targetUrl,
                                                @Nullable String eventHint,
                                                @NotNull Collection<Integer> channelIds) {
    LOGGER.trace("WebhookRegistrar.register({})", targetUrl);

    return cleanup()
          .thenCompose(foreignHooks -> resolveEvent(eventHint)
                .thenCompose(event -> createPrimary(targetUrl, event))
                .thenCompose(primary -> {
                  if (primary.aggregate()) {
                    return CompletableFuture.completedFuture(primary);
                  }
                  int quota = Math.max(0, MAX_HOOKS - foreignHooks - 1);
                  return createChannelHooks(targetUrl, primary, channelIds, quota);
                }))
          .thenApply(registration -> {
            LOGGER.info("webhook registered with id {} for event {} ({} additional channel hook(s))",
                  registration.primaryId(), registration.event(), registration.perChannelIds().size());
            return registration;
          });
  }

  /**
   * Remove every hook created by this or an earlier version of the application
   * @return Number of hooks which could not be attributed to this application
   */
  public CompletionStage<Integer> unregister() {
    LOGGER.trace("WebhookRegistrar.unregister()");

    return cleanup();
  }

  /**
   * Find the event type to subscribe to
   * @param eventHint Explicitly configured event or null
   * @return Event type
   */
  public CompletionStage<String> resolveEvent(@Nullable String eventHint) {
    LOGGER.trace("WebhookRegistrar.resolveEvent({})", eventHint);

    if (eventHint != null && !eventHint.isBlank()) {
      return CompletableFuture.completedFuture(eventHint);
    }

    return reader.call("Webhook.Supported.List", Rpc.params())
          .thenApply(WebhookRegistrar::selectEvent)
          .exceptionally(throwable -> {
            LOGGER.warn("failed to discover supported webhook events, using {}: {}",
                  DEFAULT_EVENT, NetUtils.describe(throwable));
            return DEFAULT_EVENT;
          });
  }

  public static boolean isOwnHook(@Nullable String name) {
    return name != null
          && (name.equals(HOOK_NAME) || LEGACY_HOOK_NAMES.contains(name) || CHANNEL_HOOK_NAME.matcher(name).matches());
  }

  /**
   * Choose the preferred event from a {@code Webhook.Supported.List} result
   * @param supported Result in object-keyed or array form
   * @return Selected event type
   */
  static @NotNull String selectEvent(@Nullable JsonNode supported) {
    Set<String> events = collectEvents(supported);

    for (String preferred : PREFERRED_EVENTS) {
      if (events.contains(preferred)) {
        return preferred;
      }
    }
    for (String event : events) {
      if (event.startsWith(AGGREGATE_PREFIX) || event.startsWith(CHANNEL_PREFIX)) {
        return event;
      }
    }

    return DEFAULT_EVENT;
  }

  static @NotNull String eventSuffix(@NotNull String event) {
    int dot = event.indexOf('.');
    return dot >= 0 ? event.substring(dot + 1) : event;
  }

  private static @NotNull Set<String> collectEvents(@Nullable JsonNode node) {
    Set<String> events = new LinkedHashSet<>();
    if (node == null || node.isNull()) {
      return events;
    }

    if (node.isArray()) {
      for (JsonNode element : node) {
        if (element.isTextual()) {
          events.add(element.asText());
        } else if (element.isObject()) {
          JsonNode name = element.has("event") ? element.get("event") : element.get("name");
          if (name != null && name.isTextual()) {
            events.add(name.asText());
          }
        }
      }
    } else if (node.isObject()) {
      for (String container : new String[] { "types", "hook_types", "events" }) {
        if (node.has(container)) {
          events.addAll(collectEvents(node.get(container)));
        }
      }
      Iterator<String> fieldNames = node.fieldNames();
      while (fieldNames.hasNext()) {
        String fieldName = fieldNames.next();
        if (fieldName.contains(".")) {
          events.add(fieldName);
        }
      }
    }

    return events;
  }

  /**
   * List the hooks and delete ours one after the other
   * @return Number of foreign hooks remaining on the device
   */
  private CompletionStage<Integer> cleanup() {
    return reader.call("Webhook.List", Rpc.params())
          .thenApply(WebhookRegistrar::parseHooks)
          .thenCompose(hooks -> {
            List<Rpc.Hook> own = new ArrayList<>();
            for (Rpc.Hook hook : hooks) {
              if (isOwnHook(hook.name()) && hook.id() != null) {
                own.add(hook);
              }
            }
            int foreign = hooks.size() - own.size();

            CompletionStage<Void> chain = CompletableFuture.completedFuture(null);
            for (Rpc.Hook hook : own) {
              chain = chain.thenCompose(ignored -> deleteHook(hook));
            }
            return chain.thenApply(ignored -> foreign);
          })
          .exceptionally(throwable -> {
            LOGGER.warn("failed to list existing webhooks, continuing: {}", NetUtils.describe(throwable));
            return 0;
          });
  }

  private CompletionStage<Void> deleteHook(@NotNull Rpc.Hook hook) {
    LOGGER.debug("deleting webhook {} ({})", hook.id(), hook.name());

    ObjectNode params = Rpc.params().put("id", hook.id());
    return mutator.call("Webhook.Delete", params)
          .handle((result, throwable) -> {
            if (throwable != null) {
              LOGGER.warn("failed to delete webhook {} ({}): {}", hook.id(), hook.name(), NetUtils.describe(throwable));
            }
            return null;
          });
  }

  private CompletionStage<Registration> createPrimary(@NotNull String targetUrl,
                                                      @NotNull String event) {
    String suffix = eventSuffix(event);
    String aggregateEvent = AGGREGATE_PREFIX + suffix;
    String channelEvent = CHANNEL_PREFIX + suffix;

    return createHook(HOOK_NAME, aggregateEvent, 1, targetUrl)
          .thenApply(id -> new Registration(id, aggregateEvent, true, Collections.emptyMap()))
          .exceptionallyCompose(throwable -> {
            Throwable cause = NetUtils.unwrap(throwable);
            if (!(cause instanceof RpcException)) {
              return CompletableFuture.failedFuture(cause);
            }
            LOGGER.info("aggregate event {} rejected ({}), falling back to {}", aggregateEvent, cause.getMessage(), channelEvent);
            return createHook(HOOK_NAME, channelEvent, 1, targetUrl)
                  .thenApply(id -> new Registration(id, channelEvent, false, Collections.emptyMap()));
          });
  }

  private CompletionStage<Registration> createChannelHooks(@NotNull String targetUrl,
                                                           @NotNull Registration primary,
                                                           @NotNull Collection<Integer> channelIds,
                                                           int quota) {
    List<Integer> remaining = new ArrayList<>();
    for (Integer channelId : new LinkedHashSet<>(channelIds)) {
      if (channelId != null && channelId != 1) {
        remaining.add(channelId);
      }
    }
    if (remaining.size() > quota) {
      LOGGER.warn("device hook quota allows only {} of {} additional channel hook(s)", quota, remaining.size());
      remaining = remaining.subList(0, quota);
    }

    Map<Integer,Integer> perChannelIds = new LinkedHashMap<>();
    CompletionStage<Void> chain = CompletableFuture.completedFuture(null);
    for (Integer channelId : remaining) {
      chain = chain.thenCompose(ignored -> createHook(CHANNEL_HOOK_PREFIX + channelId, primary.event(), channelId, targetUrl)
            .handle((id, throwable) -> {
              if (throwable != null) {
                LOGGER.warn("failed to create webhook for channel {}: {}", channelId, NetUtils.describe(throwable));
              } else {
                perChannelIds.put(channelId, id);
              }
              return null;
            }));
    }

    return chain.thenApply(ignored ->
          new Registration(primary.primaryId(), primary.event(), false, Collections.unmodifiableMap(perChannelIds)));
  }

  private CompletionStage<Integer> createHook(@NotNull String name,
                                              @NotNull String event,
                                              int cid,
                                              @NotNull String targetUrl) {
    LOGGER.debug("creating webhook {} for event {} (cid {})", name, event, cid);

    ObjectNode params = Rpc.getObjectMapper().valueToTree(
          new Rpc.WebhookCreateParams(name, event, cid, true, List.of(targetUrl), 0));

    return mutator.call("Webhook.Create", params)
          .thenApply(result -> {
            JsonNode id = result.get("id");
            if (id == null || !id.canConvertToInt()) {
              throw new RpcException(-1, "Webhook.Create answered without an id: " + result);
            }
            return id.asInt();
          });
  }

  private static @NotNull List<Rpc.Hook> parseHooks(@NotNull JsonNode result) {
    try {
      Rpc.HookList hookList = Rpc.getObjectMapper().treeToValue(result, Rpc.HookList.class);
      return hookList != null && hookList.hooks() != null ? hookList.hooks() : Collections.emptyList();
    } catch (JsonProcessingException e) {
      throw new RpcException(-1, "unexpected Webhook.List result: " + e.getMessage());
    }
  }
}
