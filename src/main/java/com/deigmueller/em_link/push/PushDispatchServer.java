package com.deigmueller.em_link.push;

import com.deigmueller.em_link.common.rpc.Rpc;
import com.deigmueller.em_link.common.utils.NetUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.pekko.actor.typed.ActorRef;
import org.apache.pekko.actor.typed.Behavior;
import org.apache.pekko.actor.typed.DispatcherSelector;
import org.apache.pekko.actor.typed.PostStop;
import org.apache.pekko.actor.typed.javadsl.AbstractBehavior;
import org.apache.pekko.actor.typed.javadsl.ActorContext;
import org.apache.pekko.actor.typed.javadsl.Adapter;
import org.apache.pekko.actor.typed.javadsl.Behaviors;
import org.apache.pekko.actor.typed.javadsl.Receive;
import org.apache.pekko.actor.typed.javadsl.ReceiveBuilder;
import org.apache.pekko.http.javadsl.Http;
import org.apache.pekko.http.javadsl.ServerBinding;
import org.apache.pekko.http.javadsl.marshallers.jackson.Jackson;
import org.apache.pekko.http.javadsl.model.HttpResponse;
import org.apache.pekko.http.javadsl.model.StatusCodes;
import org.apache.pekko.http.javadsl.server.AllDirectives;
import org.apache.pekko.http.javadsl.server.ExceptionHandler;
import org.apache.pekko.http.javadsl.server.RejectionHandler;
import org.apache.pekko.http.javadsl.server.Route;
import org.apache.pekko.http.javadsl.settings.ServerSettings;
import org.apache.pekko.http.scaladsl.model.headers.Server;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scala.concurrent.duration.FiniteDuration;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * The single inbound listener for device webhook requests. Requests are acknowledged
 * immediately; the body is parsed and dispatched on a separate executor afterwards.
 */
public class PushDispatchServer extends AbstractBehavior<PushDispatchServer.Command> {
  // Class members
  private static final Logger LOGGER = LoggerFactory.getLogger("em-link.push");
  private static final FiniteDuration ENTITY_TIMEOUT = FiniteDuration.apply(5, TimeUnit.SECONDS);

  // Instance members
  private final PushHandlerRegistry registry;
  private final PushNotificationParser parser = new PushNotificationParser();
  private final Executor executor;
  private final String bindInterface;
  private final int bindPort;
  private final Duration bindRetryBackoff;
  private ServerBinding binding;

  public static Behavior<Command> create(@NotNull PushHandlerRegistry registry,
                                         @NotNull String bindInterface,
                                         int bindPort,
                                         @NotNull Duration bindRetryBackoff) {
    return Behaviors.setup(context -> new PushDispatchServer(context, registry, bindInterface, bindPort, bindRetryBackoff));
  }

  /**
   * Build the URL a device has to post its notifications to
   * @param advertisedAddress Address of this host as seen from the device
   * @param port Listener port
   * @param identity Device identity
   * @return Webhook URL
   */
  public static @NotNull String webhookUrl(@NotNull String advertisedAddress,
                                           int port,
                                           @NotNull String identity) {
    return "http://" + advertisedAddress + ":" + port + "/webhook/" + PushHandlerRegistry.identityKey(identity);
  }

  protected PushDispatchServer(@NotNull ActorContext<Command> context,
                               @NotNull PushHandlerRegistry registry,
                               @NotNull String bindInterface,
                               int bindPort,
                               @NotNull Duration bindRetryBackoff) {
    super(context);

    this.registry = registry;
    this.executor = context.getSystem().dispatchers().lookup(DispatcherSelector.blocking());
    this.bindInterface = bindInterface;
    this.bindPort = bindPort;
    this.bindRetryBackoff = bindRetryBackoff;

    start();
  }

  @Override
  public @NotNull Receive<Command> createReceive() {
    return newReceiveBuilder().build();
  }

  @Override
  public @NotNull ReceiveBuilder<Command> newReceiveBuilder() {
    return super.newReceiveBuilder()
          .onSignal(PostStop.class, this::onPostStop)
          .onMessage(GetBinding.class, this::onGetBinding)
          .onMessage(NotifyBindFailed.class, this::onNotifyBindFailed)
          .onMessage(NotifyBindSuccess.class, this::onNotifyBindSuccess)
          .onMessage(RetryStartHttpServer.class, this::onRetryStartHttpServer);
  }

  private @NotNull Behavior<Command> onPostStop(@NotNull PostStop message) {
    LOGGER.trace("PushDispatchServer.onPostStop()");

    if (binding != null) {
      binding.unbind();
      binding = null;
    }

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onGetBinding(@NotNull GetBinding message) {
    LOGGER.trace("PushDispatchServer.onGetBinding()");

    message.replyTo().tell(new BindingState(binding != null ? binding.localAddress() : null));

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onNotifyBindFailed(@NotNull NotifyBindFailed message) {
    LOGGER.trace("PushDispatchServer.onNotifyBindFailed()");

    LOGGER.error("failed to bind push listener to {}:{}: {}", bindInterface, bindPort, message.throwable().getMessage());

    final ActorRef<Command> self = getContext().getSelf();
    getContext().getSystem().scheduler().scheduleOnce(
          bindRetryBackoff,
          () -> self.tell(RetryStartHttpServer.INSTANCE),
          getContext().getSystem().executionContext());

    return Behaviors.same();
  }

  /**
   * Handle the successful binding of the listener
   * @param message Notification that the listener has been successfully bound
   * @return Same behavior
   */
  private @NotNull Behavior<Command> onNotifyBindSuccess(@NotNull NotifyBindSuccess message) {
    LOGGER.trace("PushDispatchServer.onNotifyBindSuccess()");

    LOGGER.info("push listener is accepting webhook requests on {}", message.binding().localAddress());
    binding = message.binding();

    return Behaviors.same();
  }

  private @NotNull Behavior<Command> onRetryStartHttpServer(@NotNull RetryStartHttpServer message) {
    LOGGER.trace("PushDispatchServer.onRetryStartHttpServer()");

    start();

    return Behaviors.same();
  }

  private void start() {
    LOGGER.trace("PushDispatchServer.start()");

    final Http http = Http.get(getContext().getSystem());

    ServerSettings serverSettings = ServerSettings
          .create(Adapter.toClassic(getContext().getSystem()))
          .withServerHeader(Optional.of(Server.apply("em-link")));

    final ActorRef<Command> self = getContext().getSelf();

    http.newServerAt(bindInterface, bindPort)
          .withSettings(serverSettings)
          .bind(new RouteContainer().createMainRoute())
          .whenComplete((serverBinding, throwable) -> {
            if (throwable != null) {
              self.tell(new NotifyBindFailed(throwable));
            } else {
              self.tell(new NotifyBindSuccess(serverBinding));
            }
          });
  }

  /**
   * Parse and dispatch a webhook body. Runs on the executor after the request was answered.
   */
  void handleWebhook(@NotNull String identity,
                     @NotNull String body) {
    LOGGER.trace("PushDispatchServer.handleWebhook({})", identity);

    try {
      PushNotification notification = parser.parse(identity, body);
      if (notification == null) {
        LOGGER.debug("webhook request from {} carries no channel data: {}", identity, body);
        return;
      }

      LOGGER.debug("push from {} (method {}, channel {})", identity, notification.method(), notification.channelId());
      registry.dispatch(notification);
    } catch (JsonProcessingException e) {
      LOGGER.warn("dropping malformed webhook request from {}: {}", identity, e.getOriginalMessage());
    } catch (RuntimeException e) {
      LOGGER.error("failed to handle webhook request from {}: {}", identity, NetUtils.describe(e), e);
    }
  }

  public interface Command {}

  public record GetBinding(
        @NotNull ActorRef<BindingState> replyTo
  ) implements Command {}

  public record BindingState(
        @Nullable InetSocketAddress localAddress
  ) {}

  protected record NotifyBindFailed(
        @NotNull Throwable throwable
  ) implements Command {}

  protected record NotifyBindSuccess(
        @NotNull ServerBinding binding
  ) implements Command {}

  protected enum RetryStartHttpServer implements Command {
    INSTANCE
  }

  protected class RouteContainer extends AllDirectives {
    public @NotNull Route createMainRoute() {
      return handleExceptions(createExceptionHandler(), () ->
            handleRejections(createRejectionHandler(), this::createWebhookRoute)
      );
    }

    private @NotNull Route createWebhookRoute() {
      return concat(
            pathPrefix("webhook", () ->
                  path(identity ->
                        post(() -> extractStrictEntity(ENTITY_TIMEOUT, strict -> {
                          String normalized = PushHandlerRegistry.identityKey(identity);
                          String body = strict.getData().utf8String();
                          try {
                            executor.execute(() -> handleWebhook(normalized, body));
                          } catch (RejectedExecutionException e) {
                            LOGGER.warn("dropping webhook request from {}: {}", normalized, NetUtils.describe(e));
                          }
                          return completeOK(new Rpc.Acknowledge(true), Jackson.marshaller());
                        }))
                  )
            ),
            extractUnmatchedPath(unmatchedPath ->
                  extractMethod(method -> {
                    LOGGER.debug("unhandled HTTP method {} path: {}", method.name(), unmatchedPath);
                    return complete(StatusCodes.NOT_FOUND);
                  })
            )
      );
    }

    private ExceptionHandler createExceptionHandler() {
      return ExceptionHandler.newBuilder()
            .matchAny(e -> {
              LOGGER.error("exception in push listener: {}", e.getMessage());
              return complete(HttpResponse.create().withStatus(500));
            })
            .build();
    }

    private RejectionHandler createRejectionHandler() {
      return RejectionHandler.newBuilder()
            .handleNotFound(
                  extractUnmatchedPath(path -> {
                    LOGGER.debug("requested url {} not found", path);
                    return complete(StatusCodes.NOT_FOUND, "Resource not found!");
                  })
            )
            .build();
    }
  }
}
