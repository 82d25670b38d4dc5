package com.deigmueller.em_link.device;

import com.deigmueller.em_link.common.http.TransportException;
import com.deigmueller.em_link.common.utils.NetUtils;
import com.deigmueller.em_link.push.PushDispatchServer;
import com.deigmueller.em_link.push.PushHandler;
import com.deigmueller.em_link.push.PushHandlerRegistry;
import com.deigmueller.em_link.push.PushNotification;
import com.deigmueller.em_link.status.ChannelReading;
import com.deigmueller.em_link.status.DeviceTelemetry;
import com.deigmueller.em_link.status.StatusNormalizer;
import com.deigmueller.em_link.webhook.Registration;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;
import org.apache.pekko.Done;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.PostStop;
import org.apache.pekko.actor.typed.PreRestart;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.apache.pekko.actor.typed.javadsl.ReceiveBuilder;
import org.apache.pekko.actor.typed.javadsl.TimerScheduler;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Keeps the view of one logical device fresh. Webhook pushes are the primary source; a
 * jittered poll acts as safety net (webhook active) or as the only source (polling only).
 * Availability follows a failure hysteresis.
 */
public class FreshnessCoordinator extends AbstractBehavior<FreshnessCoordinator.Command> {
  // Class members
  private static final Logger LOGGER = LoggerFactory.getLogger("em-link.coordinator");
  private static final String POLL_TIMER = "poll";
  private static final String RETRY_TIMER = "retry";
  private static final String PROBE_TIMER = "probe";

  // Instance members
  private final TimerScheduler<Command> timers;
  private final PushHandlerRegistry registry;
  private final DeviceClientFactory clientFactory;
  private final CoordinatorSettings coordinatorSettings;
  private final DeviceHost host;
  private final StatusNormalizer normalizer = new StatusNormalizer();
  private final ConnectionState state;
  private final PushHandler pushHandler;
  private CapabilityPublisher publisher;
  private DeviceClient client;
  private String handlerKey;
  private List<Integer> reportedChannelIds = Collections.emptyList();
  private boolean pollInFlight;
  private boolean pollRequested;
  private boolean webhookInFlight;
  private boolean webhookSetupPending;
  private DeviceClient pendingTeardownClient;
  private int generation;
  private boolean removing;
  private ActorRef<Done> removeReplyTo;

  public static Behavior<Command> create(@NotNull ConnectionSettings settings,
                                         @NotNull CoordinatorSettings coordinatorSettings,
                                         @NotNull DeviceHost host,
                                         @NotNull PushHandlerRegistry registry,
                                         @NotNull DeviceClientFactory clientFactory) {
    return Behaviors.setup(context ->
          Behaviors.withTimers(timers ->
                new FreshnessCoordinator(context, timers, settings, coordinatorSettings, host, registry, clientFactory)));
  }

  protected FreshnessCoordinator(@NotNull ActorContext<Command> context,
                                 @NotNull TimerScheduler<Command> timers,
                                 @NotNull ConnectionSettings settings,
                                 @NotNull CoordinatorSettings coordinatorSettings,
                                 @NotNull DeviceHost host,
                                 @NotNull PushHandlerRegistry registry,
                                 @NotNull DeviceClientFactory clientFactory) {
    super(context);

    this.timers = timers;
    this.registry = registry;
    this.clientFactory = clientFactory;
    this.coordinatorSettings = coordinatorSettings;
    this.host = host;
    this.state = new ConnectionState(settings, coordinatorSettings.failureThreshold());
    this.publisher = new CapabilityPublisher(host, settings.electricityPrice());
    this.client = clientFactory.create(settings);

    final ActorRef<Command> self = context.getSelf();
    this.pushHandler = notification -> self.tell(new PushReceived(notification));

    LOGGER.info("starting coordinator for {}", settings);

    if (settings.hasIdentity()) {
      registerPushHandler();
      startPoll(1);
    } else {
      probeIdentity();
    }
  }

  @Override
  public @NotNull Receive<Command> createReceive() {
    return newReceiveBuilder().build();
  }

  @Override
  public @NotNull ReceiveBuilder<Command> newReceiveBuilder() {
    return super.newReceiveBuilder()
          .onSignal(PostStop.class, this::onPostStop)
          .onSignal(PreRestart.class, this::onPreRestart)
          .onMessage(PollNow.class, this::onPollNow)
          .onMessage(PollTick.class, this::onPollTick)
          .onMessage(RetryPoll.class, this::onRetryPoll)
          .onMessage(PollSucceeded.class, this::onPollSucceeded)
          .onMessage(PollFailed.class, this::onPollFailed)
          .onMessage(PushReceived.class, this::onPushReceived)
          .onMessage(WebhookSetupSucceeded.class, this::onWebhookSetupSucceeded)
          .onMessage(WebhookSetupFailed.class, this::onWebhookSetupFailed)
          .onMessage(UpdateSettings.class, this::onUpdateSettings)
          .onMessage(GetState.class, this::onGetState)
          .onMessage(ProbeIdentity.class, this::onProbeIdentity)
          .onMessage(IdentityProbed.class, this::onIdentityProbed)
          .onMessage(IdentityProbeFailed.class, this::onIdentityProbeFailed)
          .onMessage(Remove.class, this::onRemove)
          .onMessage(TeardownCompleted.class, this::onTeardownCompleted);
  }

  private @NotNull Behavior<Command> onPostStop(@NotNull PostStop message) {
    LOGGER.trace("FreshnessCoordinator.onPostStop()");

    unregisterPushHandler();

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onPreRestart(@NotNull PreRestart message) {
    LOGGER.trace("FreshnessCoordinator.onPreRestart()");

    unregisterPushHandler();

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onPollNow(@NotNull PollNow message) {
    LOGGER.trace("FreshnessCoordinator.onPollNow()");

    requestPoll();

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onPollTick(@NotNull PollTick message) {
    LOGGER.trace("FreshnessCoordinator.onPollTick()");

    requestPoll();

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onRetryPoll(@NotNull RetryPoll message) {
    LOGGER.trace("FreshnessCoordinator.onRetryPoll()");

    if (!removing) {
      startPoll(message.attempt());
    }

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onPollSucceeded(@NotNull PollSucceeded message) {
    LOGGER.trace("FreshnessCoordinator.onPollSucceeded()");

    if (removing) {
      return Behaviors.same();
    }

    ConnectionSettings settings = state.getSettings();
    DeviceTelemetry telemetry = normalizer.normalize(message.raw());

    if (settings.isChannelMode()) {
      ChannelReading reading = telemetry.channel(settings.channelId());
      if (reading == null) {
        pollCompleted();
        recordFailure(new IllegalStateException("channel " + settings.channelId() + " not found in the status response"));
        return Behaviors.same();
      }
      publisher.publishReading(reading);
    } else {
      publisher.publishTotals(telemetry.totals(), telemetry.temperature());

      List<Integer> channelIds = new ArrayList<>();
      for (ChannelReading reading : telemetry.channels()) {
        channelIds.add(reading.channelId());
        registry.dispatchToChannel(new PushNotification(settings.identity(), "Poll", null, reading, false));
      }
      reportedChannelIds = channelIds;
    }

    pollCompleted();
    recordSuccess();

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onPollFailed(@NotNull PollFailed message) {
    LOGGER.trace("FreshnessCoordinator.onPollFailed()");

    if (removing) {
      return Behaviors.same();
    }

    if (message.attempt() == 1 && isTimeout(message.cause())) {
      LOGGER.debug("status request to {} timed out, retrying once", state.getSettings().host());
      timers.startSingleTimer(RETRY_TIMER, new RetryPoll(2), coordinatorSettings.retryDelay());
      return Behaviors.same();
    }

    pollCompleted();
    recordFailure(message.cause());

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onPushReceived(@NotNull PushReceived message) {
    LOGGER.trace("FreshnessCoordinator.onPushReceived()");

    if (removing) {
      return Behaviors.same();
    }

    PushNotification notification = message.notification();
    if (state.getSettings().isChannelMode()) {
      publisher.publishReading(notification.reading());
      recordSuccess();
    } else {
      LOGGER.debug("push from {} (method {}, channel {}), refreshing status",
            notification.identity(), notification.method(), notification.channelId());
      requestPoll();
    }

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onWebhookSetupSucceeded(@NotNull WebhookSetupSucceeded message) {
    LOGGER.trace("FreshnessCoordinator.onWebhookSetupSucceeded()");

    if (webhookSetupCompleted(message.generation())) {
      return Behaviors.same();
    }

    state.setWebhookId(message.registration().primaryId());
    state.setWebhookActive(true);

    if (state.getPhase() != ConnectionState.Phase.UNREACHABLE) {
      state.setPhase(ConnectionState.Phase.WEBHOOK_ACTIVE);
      startPollTimer(coordinatorSettings.safetyNetInterval());
    }

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onWebhookSetupFailed(@NotNull WebhookSetupFailed message) {
    LOGGER.trace("FreshnessCoordinator.onWebhookSetupFailed()");

    if (webhookSetupCompleted(message.generation())) {
      return Behaviors.same();
    }

    LOGGER.warn("webhook setup for {} failed, falling back to polling: {}",
          state.getSettings().identity(), NetUtils.describe(message.cause()));

    state.clearWebhook();

    if (state.getPhase() != ConnectionState.Phase.UNREACHABLE) {
      state.setPhase(ConnectionState.Phase.POLLING_ONLY);
      startPollTimer(state.getSettings().pollInterval());
    }

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onUpdateSettings(@NotNull UpdateSettings message) {
    LOGGER.trace("FreshnessCoordinator.onUpdateSettings()");

    ConnectionSettings previous = state.getSettings();
    ConnectionSettings next = message.settings();

    if (previous.hasIdentity()
          && !NetUtils.normalizeIdentity(previous.identity()).equals(NetUtils.normalizeIdentity(StringUtils.defaultString(next.identity())))) {
      if (next.hasIdentity()) {
        LOGGER.warn("the identity of a device cannot be changed, keeping {}", previous.identity());
      }
      next = next.withIdentity(previous.identity());
    }

    state.setSettings(next);
    if (previous.electricityPrice() != next.electricityPrice()) {
      publisher = new CapabilityPublisher(host, next.electricityPrice());
    }

    if (previous.connectionDiffers(next)) {
      LOGGER.info("connection settings of {} changed, rebuilding the webhook", next.identity());

      generation++;
      DeviceClient previousClient = client;
      client = clientFactory.create(next);

      if (next.manageWebhook() && next.hasIdentity()) {
        boolean wasActive = state.isWebhookActive();
        state.clearWebhook();
        if (webhookInFlight) {
          // the running registration may still create a hook through the previous client
          if (!webhookSetupPending) {
            pendingTeardownClient = previousClient;
          }
          webhookSetupPending = true;
        } else {
          setupWebhook(wasActive ? previousClient : null);
        }
      }

      requestPoll();
    } else if (!previous.pollInterval().equals(next.pollInterval())) {
      if (state.getPhase() != ConnectionState.Phase.WEBHOOK_ACTIVE) {
        startPollTimer(next.pollInterval());
      }
    }

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onGetState(@NotNull GetState message) {
    LOGGER.trace("FreshnessCoordinator.onGetState()");

    message.replyTo().tell(state.snapshot());

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onProbeIdentity(@NotNull ProbeIdentity message) {
    LOGGER.trace("FreshnessCoordinator.onProbeIdentity()");

    probeIdentity();

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onIdentityProbed(@NotNull IdentityProbed message) {
    LOGGER.trace("FreshnessCoordinator.onIdentityProbed()");

    String mac = message.deviceInfo().path("mac").asText("");
    if (StringUtils.isBlank(mac)) {
      return onIdentityProbeFailed(new IdentityProbeFailed(
            new IllegalStateException("device info of " + state.getSettings().host() + " carries no mac address")));
    }

    state.setSettings(state.getSettings().withIdentity(NetUtils.normalizeIdentity(mac)));
    LOGGER.info("device at {} identified as {}", state.getSettings().host(), state.getSettings().identity());

    registerPushHandler();
    startPoll(1);

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onIdentityProbeFailed(@NotNull IdentityProbeFailed message) {
    LOGGER.trace("FreshnessCoordinator.onIdentityProbeFailed()");

    LOGGER.warn("failed to identify the device at {}: {}", state.getSettings().host(), NetUtils.describe(message.cause()));

    if (state.getAvailability().recordFailure() == AvailabilityTracker.Transition.LOST) {
      publisher.setAvailable(false);
    }
    timers.startSingleTimer(PROBE_TIMER, ProbeIdentity.INSTANCE, state.getSettings().pollInterval());

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onRemove(@NotNull Remove message) {
    LOGGER.trace("FreshnessCoordinator.onRemove()");

    removing = true;
    removeReplyTo = message.replyTo();
    timers.cancelAll();
    unregisterPushHandler();

    if (state.isWebhookActive() && state.getSettings().manageWebhook()) {
      final ActorRef<Command> self = getContext().getSelf();
      client.getRegistrar().unregister()
            .whenComplete((foreignHooks, throwable) -> self.tell(new TeardownCompleted(throwable)));
      return Behaviors.same();
    }

    return stop();
  }

  private @NotNull Behavior<Command> onTeardownCompleted(@NotNull TeardownCompleted message) {
    LOGGER.trace("FreshnessCoordinator.onTeardownCompleted()");

    if (message.throwable() != null) {
      LOGGER.warn("failed to remove the webhook of {}: {}", state.getSettings().identity(), NetUtils.describe(message.throwable()));
    }
    state.clearWebhook();

    return stop();
  }

  private @NotNull Behavior<Command> stop() {
    LOGGER.info("coordinator for {} removed", state.getSettings().identity());

    if (removeReplyTo != null) {
      removeReplyTo.tell(Done.getInstance());
    }

    return Behaviors.stopped();
  }

  private void requestPoll() {
    if (removing || !state.getSettings().hasIdentity()) {
      return;
    }

    if (pollInFlight) {
      pollRequested = true;
    } else {
      startPoll(1);
    }
  }

  private void startPoll(int attempt) {
    LOGGER.trace("FreshnessCoordinator.startPoll({})", attempt);

    pollInFlight = true;

    final ActorRef<Command> self = getContext().getSelf();
    client.getStatus().whenComplete((raw, throwable) -> {
      if (throwable != null) {
        self.tell(new PollFailed(NetUtils.unwrap(throwable), attempt));
      } else {
        self.tell(new PollSucceeded(raw));
      }
    });
  }

  private void pollCompleted() {
    pollInFlight = false;
    if (pollRequested) {
      pollRequested = false;
      startPoll(1);
    }
  }

  private void recordSuccess() {
    AvailabilityTracker.Transition transition = state.getAvailability().recordSuccess();
    publisher.setAvailable(true);

    if (transition == AvailabilityTracker.Transition.RESTORED) {
      LOGGER.info("device {} is reachable again", state.getSettings().identity());
    }

    if (state.getPhase() == ConnectionState.Phase.INITIALIZING) {
      beginWebhookSetup();
    } else if (state.getPhase() == ConnectionState.Phase.UNREACHABLE) {
      state.setPhase(ConnectionState.Phase.POLLING_ONLY);
      startPollTimer(state.getSettings().pollInterval());
      beginWebhookSetup();
    }
  }

  private void recordFailure(@NotNull Throwable cause) {
    AvailabilityTracker availability = state.getAvailability();
    AvailabilityTracker.Transition transition = availability.recordFailure();

    LOGGER.warn("status poll of {} failed ({}/{}): {}", state.getSettings().identity(),
          availability.getConsecutiveFailures(), availability.getThreshold(), NetUtils.describe(cause));

    if (transition == AvailabilityTracker.Transition.LOST) {
      LOGGER.error("device {} is unreachable", state.getSettings().identity());
      publisher.setAvailable(false);
      state.setPhase(ConnectionState.Phase.UNREACHABLE);
      startPollTimer(state.getSettings().pollInterval());
    } else if (state.getPhase() == ConnectionState.Phase.INITIALIZING) {
      beginWebhookSetup();
    }
  }

  /**
   * Bookkeeping shared by both webhook setup outcomes. Starts a setup that was deferred while
   * the completed one was running.
   * @param completedGeneration Generation the completed setup was started for
   * @return true if the outcome has to be ignored
   */
  private boolean webhookSetupCompleted(int completedGeneration) {
    webhookInFlight = false;

    if (removing) {
      return true;
    }

    if (webhookSetupPending) {
      DeviceClient teardownClient = pendingTeardownClient;
      webhookSetupPending = false;
      pendingTeardownClient = null;
      setupWebhook(teardownClient);
      return true;
    }

    return completedGeneration != generation;
  }

  /**
   * Either register the webhook or, if another device takes care of it, rely on forwarded
   * pushes right away
   */
  private void beginWebhookSetup() {
    ConnectionSettings settings = state.getSettings();
    if (!settings.manageWebhook()) {
      state.setPhase(ConnectionState.Phase.WEBHOOK_ACTIVE);
      startPollTimer(coordinatorSettings.safetyNetInterval());
      return;
    }

    if (state.getPhase() == ConnectionState.Phase.INITIALIZING) {
      state.setPhase(ConnectionState.Phase.POLLING_ONLY);
      startPollTimer(settings.pollInterval());
    }

    if (!webhookInFlight) {
      setupWebhook(null);
    }
  }

  /**
   * Register the webhook, optionally removing the hooks of a previous connection first
   * @param previousClient Client of the previous connection whose hooks have to be removed
   */
  private void setupWebhook(@Nullable DeviceClient previousClient) {
    LOGGER.trace("FreshnessCoordinator.setupWebhook()");

    webhookInFlight = true;

    final ConnectionSettings settings = state.getSettings();
    final int currentGeneration = generation;
    final DeviceClient currentClient = client;
    final ActorRef<Command> self = getContext().getSelf();

    final String url = PushDispatchServer.webhookUrl(
          coordinatorSettings.advertisedAddress(), coordinatorSettings.pushPort(), settings.identity());
    final List<Integer> channelIds = settings.isChannelMode()
          ? List.of(settings.channelId())
          : settings.channelIds().isEmpty() ? reportedChannelIds : settings.channelIds();

    CompletionStage<Integer> teardown = previousClient != null
          ? previousClient.getRegistrar().unregister().exceptionally(throwable -> {
              LOGGER.warn("failed to remove the previous webhook: {}", NetUtils.describe(throwable));
              return 0;
            })
          : CompletableFuture.completedFuture(0);

    teardown
          .thenCompose(ignored -> currentClient.getRegistrar().register(url, settings.eventHint(), channelIds))
          .whenComplete((registration, throwable) -> {
            if (throwable != null) {
              self.tell(new WebhookSetupFailed(NetUtils.unwrap(throwable), currentGeneration));
            } else {
              self.tell(new WebhookSetupSucceeded(registration, currentGeneration));
            }
          });
  }

  private void startPollTimer(@NotNull Duration baseInterval) {
    Duration interval = jitteredInterval(
          baseInterval,
          coordinatorSettings.jitter(),
          coordinatorSettings.minimumInterval(),
          ThreadLocalRandom.current().nextDouble(-1.0, 1.0));

    LOGGER.debug("polling {} every {} ms", state.getSettings().identity(), interval.toMillis());

    timers.startTimerWithFixedDelay(POLL_TIMER, PollTick.INSTANCE, interval);
  }

  /**
   * Spread a poll interval
   * @param baseInterval Configured interval
   * @param jitter Maximum relative deviation, e.g. 0.1
   * @param minimum Lower bound of the result
   * @param random Random factor in [-1, 1]
   * @return Effective interval
   */
  static @NotNull Duration jitteredInterval(@NotNull Duration baseInterval,
                                            double jitter,
                                            @NotNull Duration minimum,
                                            double random) {
    long base = baseInterval.toMillis();
    long effective = base + Math.round(base * jitter * random);
    return Duration.ofMillis(Math.max(minimum.toMillis(), effective));
  }

  private void probeIdentity() {
    LOGGER.trace("FreshnessCoordinator.probeIdentity()");

    final ActorRef<Command> self = getContext().getSelf();
    client.getDeviceInfo().whenComplete((deviceInfo, throwable) -> {
      if (throwable != null) {
        self.tell(new IdentityProbeFailed(NetUtils.unwrap(throwable)));
      } else {
        self.tell(new IdentityProbed(deviceInfo));
      }
    });
  }

  private void registerPushHandler() {
    ConnectionSettings settings = state.getSettings();
    handlerKey = settings.isChannelMode()
          ? PushHandlerRegistry.channelKey(settings.identity(), settings.channelId())
          : PushHandlerRegistry.identityKey(settings.identity());
    registry.registerHandler(handlerKey, pushHandler);
  }

  private void unregisterPushHandler() {
    if (handlerKey != null) {
      registry.unregisterHandler(handlerKey, pushHandler);
      handlerKey = null;
    }
  }

  private static boolean isTimeout(@NotNull Throwable cause) {
    return cause instanceof TransportException transportException
          && transportException.getKind() == TransportException.Kind.TIMEOUT;
  }

  public interface Command {}

  public enum PollNow implements Command {
    INSTANCE
  }

  public record UpdateSettings(
        @NotNull ConnectionSettings settings
  ) implements Command {}

  public record GetState(
        @NotNull ActorRef<ConnectionState.Snapshot> replyTo
  ) implements Command {}

  public record Remove(
        @Nullable ActorRef<Done> replyTo
  ) implements Command {}

  protected enum PollTick implements Command {
    INSTANCE
  }

  protected enum ProbeIdentity implements Command {
    INSTANCE
  }

  protected record RetryPoll(
        int attempt
  ) implements Command {}

  protected record PollSucceeded(
        @NotNull JsonNode raw
  ) implements Command {}

  protected record PollFailed(
        @NotNull Throwable cause,
        int attempt
  ) implements Command {}

  protected record PushReceived(
        @NotNull PushNotification notification
  ) implements Command {}

  protected record WebhookSetupSucceeded(
        @NotNull Registration registration,
        int generation
  ) implements Command {}

  protected record WebhookSetupFailed(
        @NotNull Throwable cause,
        int generation
  ) implements Command {}

  protected record IdentityProbed(
        @NotNull JsonNode deviceInfo
  ) implements Command {}

  protected record IdentityProbeFailed(
        @NotNull Throwable cause
  ) implements Command {}

  protected record TeardownCompleted(
        @Nullable Throwable throwable
  ) implements Command {}
}
