package com.deigmueller.em_link.webhook;

import org.jetbrains.annotations.NotNull;

import java.util.Map;

/**
 * Outcome of a webhook registration
 * @param primaryId Id of the hook named {@code emlink}
 * @param event Event type the hooks were created for
 * @param aggregate true if the aggregate {@code emmerge.*} event was accepted by the device
 * @param perChannelIds Ids of the additional per-channel hooks by channel id
 */
public record Registration(
      int primaryId,
      @NotNull String event,
      boolean aggregate,
      @NotNull Map<Integer,Integer> perChannelIds
) {}
