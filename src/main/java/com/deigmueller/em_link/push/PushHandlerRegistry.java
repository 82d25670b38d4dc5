package com.deigmueller.em_link.push;

import com.deigmueller.em_link.common.utils.NetUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe routing table from device identities ({@code AABBCCDDEEFF}) and channel keys
 * ({@code AABBCCDDEEFF:2}) to the consumers of push notifications. Keys are expected in the
 * form built by {@link #identityKey(String)} and {@link #channelKey(String, int)}.
 */
public class PushHandlerRegistry {
  // Class members
  private static final Logger LOGGER = LoggerFactory.getLogger("em-link.push");

  // Instance members
  private final Map<String,PushHandler> handlers = new ConcurrentHashMap<>();

  public static @NotNull String identityKey(@NotNull String identity) {
    return NetUtils.normalizeIdentity(identity);
  }

  public static @NotNull String channelKey(@NotNull String identity, int channelId) {
    return identityKey(identity) + ":" + channelId;
  }

  public void registerHandler(@NotNull String key,
                              @NotNull PushHandler handler) {
    LOGGER.debug("registering push handler for {}", key);

    handlers.put(key, handler);
  }

  public void unregisterHandler(@NotNull String key) {
    LOGGER.debug("unregistering push handler for {}", key);

    handlers.remove(key);
  }

  /**
   * Unregister a handler only if it is still the one registered under the key
   */
  public void unregisterHandler(@NotNull String key,
                                @NotNull PushHandler handler) {
    if (handlers.remove(key, handler)) {
      LOGGER.debug("unregistered push handler for {}", key);
    }
  }

  public boolean hasHandler(@NotNull String key) {
    return handlers.containsKey(key);
  }

  /**
   * Deliver a notification to the device consumer and to the consumer of the channel the
   * notification names. A failing consumer does not affect the other one.
   * @param notification Parsed notification
   * @return Number of consumers the notification was delivered to
   */
  public int dispatch(@NotNull PushNotification notification) {
    LOGGER.trace("PushHandlerRegistry.dispatch()");

    int delivered = 0;
    if (invoke(identityKey(notification.identity()), notification)) {
      delivered++;
    }
    if (dispatchToChannel(notification)) {
      delivered++;
    }

    if (delivered == 0) {
      LOGGER.debug("no push handler registered for {}", notification.identity());
    }

    return delivered;
  }

  /**
   * Deliver a notification to the channel consumer only
   * @param notification Notification carrying the channel reading
   * @return true if a consumer was found
   */
  public boolean dispatchToChannel(@NotNull PushNotification notification) {
    return invoke(channelKey(notification.identity(), notification.channelId()), notification);
  }

  private boolean invoke(@NotNull String key,
                         @NotNull PushNotification notification) {
    PushHandler handler = handlers.get(key);
    if (handler == null) {
      return false;
    }

    try {
      handler.onPush(notification);
    } catch (Exception e) {
      LOGGER.error("push handler for {} failed: {}", key, e.getMessage(), e);
    }

    return true;
  }
}
