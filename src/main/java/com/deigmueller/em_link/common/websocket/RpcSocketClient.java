package com.deigmueller.em_link.common.websocket;

import com.deigmueller.em_link.common.rpc.Rpc;
import com.deigmueller.em_link.common.rpc.RpcCaller;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal WebSocket JSON-RPC client. Every call opens its own connection, sends one request
 * frame, waits for the matching response and closes the connection again. The device only
 * accepts its mutating webhook methods over this channel.
 */
public class RpcSocketClient implements RpcCaller {
  // Class members
  private static final Logger LOGGER = LoggerFactory.getLogger("em-link.websocket");
  private static final String WEBSOCKET_GUID = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";
  private static final int MAX_HANDSHAKE_SIZE = 8192;
  private static final SecureRandom RANDOM = new SecureRandom();
  private static final AtomicLong REQUEST_IDS = new AtomicLong(System.currentTimeMillis() % 100000);

  public static final String SOURCE = "em-link";

  // Instance members
  private final String hostName;
  private final int port;
  private final Duration defaultTimeout;
  private final Duration closeGrace;
  private final Executor executor;
  private final WebSocketFrameCodec codec = new WebSocketFrameCodec();

  public RpcSocketClient(@NotNull String host,
                         @NotNull Duration defaultTimeout,
                         @NotNull Duration closeGrace,
                         @NotNull Executor executor) {
    int separator = host.lastIndexOf(':');
    if (separator > 0 && host.indexOf(':') == separator) {
      this.hostName = host.substring(0, separator);
      this.port = Integer.parseInt(host.substring(separator + 1));
    } else {
      this.hostName = host;
      this.port = 80;
    }
    this.defaultTimeout = defaultTimeout;
    this.closeGrace = closeGrace;
    this.executor = executor;
  }

  @Override
  public CompletionStage<JsonNode> call(@NotNull String method,
                                        @NotNull ObjectNode params) {
    return call(method, params, defaultTimeout);
  }

  /**
   * Execute an RPC call on the executor
   * @param method RPC method
   * @param params RPC parameters
   * @param timeout Deadline for connect, handshake and response together
   * @return The {@code result} member of the matching response
   */
  public CompletionStage<JsonNode> call(@NotNull String method,
                                        @NotNull ObjectNode params,
                                        @NotNull Duration timeout) {
    LOGGER.trace("RpcSocketClient.call({})", method);

    return CompletableFuture.supplyAsync(() -> execute(method, params, timeout), executor);
  }

  /**
   * Blocking variant of {@link #call(String, ObjectNode, Duration)}
   */
  public JsonNode execute(@NotNull String method,
                          @NotNull ObjectNode params,
                          @NotNull Duration timeout) {
    LOGGER.trace("RpcSocketClient.execute({})", method);

    final long deadline = System.nanoTime() + timeout.toNanos();
    final long requestId = REQUEST_IDS.incrementAndGet();

    Socket socket = new Socket();
    Connection connection = null;
    try {
      socket.setTcpNoDelay(true);
      socket.connect(new InetSocketAddress(hostName, port), remainingMillis(deadline, method));

      connection = new Connection(socket);
      connection.handshake(deadline, method);
      connection.send(WebSocketFrame.text(Rpc.toString(new Rpc.RequestFrame(requestId, SOURCE, method, params))));

      JsonNode response = connection.awaitResponse(requestId, deadline, method);
      Rpc.checkEnvelope(response);
      return Rpc.result(response);
    } catch (SocketTimeoutException e) {
      throw timeout(method, e);
    } catch (IOException e) {
      throw new ProtocolException(ProtocolException.Kind.CLOSED_BY_PEER,
            "connection to " + hostName + ":" + port + " failed during " + method + ": " + e.getMessage(), e);
    } finally {
      if (connection != null) {
        connection.closeGracefully();
      } else {
        closeQuietly(socket);
      }
    }
  }

  public static @NotNull String computeAcceptKey(@NotNull String key) {
    try {
      MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
      return Base64.getEncoder().encodeToString(
            sha1.digest((key + WEBSOCKET_GUID).getBytes(StandardCharsets.US_ASCII)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-1 is not available", e);
    }
  }

  private void closeQuietly(@NotNull Socket socket) {
    try {
      socket.close();
    } catch (IOException e) {
      LOGGER.debug("failed to close socket to {}: {}", hostName, e.getMessage());
    }
  }

  private ProtocolException timeout(@NotNull String method, @NotNull Throwable cause) {
    return new ProtocolException(ProtocolException.Kind.TIMEOUT,
          "no response to " + method + " from " + hostName + ":" + port + " in time", cause);
  }

  private int remainingMillis(long deadline, @NotNull String method) {
    long remaining = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
    if (remaining <= 0) {
      throw timeout(method, new SocketTimeoutException("deadline reached"));
    }
    return (int) Math.min(Integer.MAX_VALUE, remaining);
  }

  /**
   * State of one socket from the upgrade request to the close handshake
   */
  private class Connection {
    private final Socket socket;
    private final InputStream input;
    private final OutputStream output;
    private boolean upgraded;
    private boolean closeSent;
    private boolean closeReceived;

    private Connection(@NotNull Socket socket) throws IOException {
      this.socket = socket;
      this.input = new BufferedInputStream(socket.getInputStream());
      this.output = socket.getOutputStream();
    }

    private void handshake(long deadline, @NotNull String method) throws IOException {
      byte[] keyBytes = new byte[16];
      RANDOM.nextBytes(keyBytes);
      String key = Base64.getEncoder().encodeToString(keyBytes);

      String request = "GET /rpc HTTP/1.1\r\n" +
            "Host: " + hostName + ":" + port + "\r\n" +
            "Upgrade: websocket\r\n" +
            "Connection: Upgrade\r\n" +
            "Sec-WebSocket-Key: " + key + "\r\n" +
            "Sec-WebSocket-Version: 13\r\n" +
            "\r\n";
      output.write(request.getBytes(StandardCharsets.US_ASCII));
      output.flush();

      socket.setSoTimeout(remainingMillis(deadline, method));
      String head = readHead();

      String[] lines = head.split("\r\n");
      String[] statusLine = lines[0].split(" ", 3);
      if (statusLine.length < 2 || !statusLine[1].equals("101")) {
        throw new ProtocolException(ProtocolException.Kind.HANDSHAKE_FAILED,
              "upgrade to websocket rejected by " + hostName + ": " + lines[0]);
      }

      Map<String,String> headers = new HashMap<>();
      for (int i = 1; i < lines.length; i++) {
        int colon = lines[i].indexOf(':');
        if (colon > 0) {
          headers.put(lines[i].substring(0, colon).trim().toLowerCase(Locale.ROOT), lines[i].substring(colon + 1).trim());
        }
      }

      String accept = headers.get("sec-websocket-accept");
      if (accept != null && !accept.equals(computeAcceptKey(key))) {
        throw new ProtocolException(ProtocolException.Kind.HANDSHAKE_FAILED,
              "invalid Sec-WebSocket-Accept from " + hostName);
      }

      upgraded = true;
    }

    private @NotNull String readHead() throws IOException {
      ByteArrayOutputStream head = new ByteArrayOutputStream();
      int last = 0;
      while (last != 0x0D0A0D0A) {
        int value = input.read();
        if (value < 0) {
          throw new ProtocolException(ProtocolException.Kind.HANDSHAKE_FAILED,
                "connection closed during the websocket handshake with " + hostName);
        }
        head.write(value);
        if (head.size() > MAX_HANDSHAKE_SIZE) {
          throw new ProtocolException(ProtocolException.Kind.HANDSHAKE_FAILED,
                "handshake response from " + hostName + " is too large");
        }
        last = (last << 8) | value;
      }
      return head.toString(StandardCharsets.ISO_8859_1);
    }

    private void send(@NotNull WebSocketFrame frame) throws IOException {
      output.write(codec.encodeMasked(frame));
      output.flush();
    }

    private @NotNull JsonNode awaitResponse(long requestId,
                                            long deadline,
                                            @NotNull String method) throws IOException {
      ByteArrayOutputStream message = null;

      while (true) {
        socket.setSoTimeout(remainingMillis(deadline, method));

        WebSocketFrame frame;
        try {
          frame = codec.decode(input);
        } catch (EOFException e) {
          throw new ProtocolException(ProtocolException.Kind.CLOSED_BY_PEER,
                hostName + " closed the connection while waiting for " + method, e);
        }

        switch (frame.opcode()) {
          case WebSocketFrame.OPCODE_PING -> send(WebSocketFrame.pong(frame.payload()));
          case WebSocketFrame.OPCODE_PONG -> LOGGER.trace("pong from {}", hostName);
          case WebSocketFrame.OPCODE_CLOSE -> {
            closeReceived = true;
            throw new ProtocolException(ProtocolException.Kind.CLOSED_BY_PEER,
                  hostName + " sent a close frame while waiting for " + method);
          }
          case WebSocketFrame.OPCODE_TEXT, WebSocketFrame.OPCODE_BINARY -> {
            message = new ByteArrayOutputStream();
            message.write(frame.payload());
          }
          case WebSocketFrame.OPCODE_CONTINUATION -> {
            if (message == null) {
              throw new ProtocolException(ProtocolException.Kind.FRAME_ERROR,
                    "continuation frame without a preceding data frame");
            }
            message.write(frame.payload());
          }
          default -> throw new ProtocolException(ProtocolException.Kind.FRAME_ERROR,
                "unknown opcode " + frame.opcode());
        }

        if (!frame.isControl() && frame.fin() && message != null) {
          String text = message.toString(StandardCharsets.UTF_8);
          message = null;

          JsonNode json = parse(text);
          if (json != null && json.path("id").asLong(-1) == requestId) {
            return json;
          }
          LOGGER.debug("ignoring unrelated message from {}: {}", hostName, text);
        }
      }
    }

    private JsonNode parse(@NotNull String text) {
      try {
        return Rpc.getObjectMapper().readTree(text);
      } catch (JsonProcessingException e) {
        LOGGER.debug("ignoring non-JSON message from {}: {}", hostName, e.getMessage());
        return null;
      }
    }

    /**
     * Send a close frame, give the peer a short grace period to answer it and close the socket
     */
    private void closeGracefully() {
      LOGGER.trace("RpcSocketClient.Connection.closeGracefully()");

      try {
        if (!upgraded) {
          return;
        }

        if (!closeSent && !socket.isClosed()) {
          closeSent = true;
          send(WebSocketFrame.close(WebSocketFrame.CLOSE_NORMAL));
        }

        long graceEnd = System.nanoTime() + closeGrace.toNanos();
        while (!closeReceived && !socket.isClosed()) {
          long remaining = Duration.ofNanos(graceEnd - System.nanoTime()).toMillis();
          if (remaining <= 0) {
            break;
          }
          socket.setSoTimeout((int) remaining);
          if (codec.decode(input).opcode() == WebSocketFrame.OPCODE_CLOSE) {
            closeReceived = true;
          }
        }
      } catch (IOException | ProtocolException e) {
        LOGGER.debug("close handshake with {} incomplete: {}", hostName, e.getMessage());
      } finally {
        closeQuietly(socket);
      }
    }
  }
}
