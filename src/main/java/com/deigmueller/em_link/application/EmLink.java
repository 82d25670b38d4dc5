package com.deigmueller.em_link.application;

import com.deigmueller.em_link.device.ConnectionSettings;
import com.deigmueller.em_link.device.CoordinatorSettings;
import com.deigmueller.em_link.device.DeviceClientFactory;
import com.deigmueller.em_link.device.FreshnessCoordinator;
import com.deigmueller.em_link.device.LoggingDeviceHost;
import com.deigmueller.em_link.push.PushDispatchServer;
import com.deigmueller.em_link.push.PushHandlerRegistry;
import com.typesafe.config.Config;
import org.apache.commons.lang3.StringUtils;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.SupervisorStrategy;
import org.apache.pekko.actor.typed.Terminated;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.apache.pekko.actor.typed.javadsl.ReceiveBuilder;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Root actor: starts the push listener and one supervised coordinator per configured device
 */
public class EmLink extends AbstractBehavior<EmLink.Command> {
  // Instance members
  private final Logger logger = LoggerFactory.getLogger("em-link.controller");
  private final PushHandlerRegistry registry = new PushHandlerRegistry();
  private final ActorRef<PushDispatchServer.Command> pushServer;
  private final Map<ActorRef<FreshnessCoordinator.Command>, String> coordinators = new HashMap<>();

  public static Behavior<Command> create() {
    return Behaviors.setup(EmLink::new);
  }

  private EmLink(@NotNull ActorContext<Command> context) {
    super(context);

    try {
      Config config = context.getSystem().settings().config().getConfig("em-link");

      pushServer = createPushServer(config);
      getContext().watch(pushServer);

      createCoordinators(config);
    } catch (Exception e) {
      logger.error("failed to initialize the main controller", e);
      throw e;
    }
  }

  @Override
  public @NotNull ReceiveBuilder<Command> newReceiveBuilder() {
    return super.newReceiveBuilder()
          .onSignal(Terminated.class, this::onTerminated);
  }

  @Override
  public @NotNull Receive<Command> createReceive() {
    return newReceiveBuilder()
          .build();
  }

  protected @NotNull Behavior<Command> onTerminated(@NotNull Terminated signal) {
    logger.trace("EmLink.onTerminated()");

    if (signal.getRef().equals(pushServer)) {
      logger.error("the push dispatch server terminated");
      return Behaviors.stopped();
    }

    String device = coordinators.remove(signal.getRef());
    logger.warn("coordinator of device {} terminated", device);

    return Behaviors.same();
  }

  /**
   * Create the listener for the device webhooks
   */
  private @NotNull ActorRef<PushDispatchServer.Command> createPushServer(@NotNull Config config) {
    logger.trace("EmLink.createPushServer()");

    return getContext().spawn(
          PushDispatchServer.create(
                registry,
                config.getString("push-server.interface"),
                config.getInt("push-server.port"),
                config.getDuration("push-server.bind-retry-backoff")),
          "push-server");
  }

  /**
   * Create one coordinator for each configured device
   */
  private void createCoordinators(@NotNull Config config) {
    logger.trace("EmLink.createCoordinators()");

    CoordinatorSettings coordinatorSettings = CoordinatorSettings.fromConfig(config);
    DeviceClientFactory clientFactory = DeviceClientFactory.network(getContext().getSystem(), config);

    Duration minBackoff = config.getDuration("supervision.min-backoff");
    Duration maxBackoff = config.getDuration("supervision.max-backoff");
    double jitter = config.getDouble("supervision.jitter");

    List<? extends Config> devices = config.getConfigList("devices");
    if (devices.isEmpty()) {
      logger.warn("no devices configured");
    }

    int index = 0;
    for (Config device : devices) {
      index++;
      ConnectionSettings settings = ConnectionSettings.fromConfig(device, coordinatorSettings.defaultPollInterval());
      String name = StringUtils.isNotBlank(settings.identity()) ? settings.identity() : settings.host();

      logger.info("creating coordinator for device {}", name);

      ActorRef<FreshnessCoordinator.Command> coordinator = getContext().spawn(
            Behaviors.supervise(
                  FreshnessCoordinator.create(
                        settings,
                        coordinatorSettings,
                        new LoggingDeviceHost(name),
                        registry,
                        clientFactory)
            ).onFailure(SupervisorStrategy.restartWithBackoff(minBackoff, maxBackoff, jitter)),
            "device-" + index);

      getContext().watch(coordinator);
      coordinators.put(coordinator, name);
    }
  }

  public interface Command {}
}
