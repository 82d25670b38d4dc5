package com.deigmueller.em_link.push;

import org.jetbrains.annotations.NotNull;

@FunctionalInterface
public interface PushHandler {
  void onPush(@NotNull PushNotification notification);
}
