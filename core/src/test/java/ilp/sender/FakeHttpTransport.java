/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package ilp.sender;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.logging.Logger;

/**
 * Answers each POST with the next scripted response, or 204 when the script is exhausted. Settings
 * requests are answered with {@link #settings}.
 */
class FakeHttpTransport extends BaseHttpTransport<String, byte[]> {
  static final class Builder extends BaseHttpTransport.Builder<Builder> {
    @Override protected Builder self() {
      return this;
    }
  }

  /** A status code with a body, or an exception to throw. */
  static final class Outcome {
    final int statusCode;
    final String body;
    final IOException exception;

    Outcome(int statusCode, String body, IOException exception) {
      this.statusCode = statusCode;
      this.body = body;
      this.exception = exception;
    }
  }

  final Deque<Outcome> script = new ArrayDeque<>();
  final List<String> bodies = new ArrayList<>();
  final List<String> authorizations = new ArrayList<>();
  final List<Integer> timeouts = new ArrayList<>();
  final List<String> settingsRequests = new ArrayList<>();
  Outcome settings = new Outcome(200, "{\"config\":{}}", null);

  /** close is typically called from a different thread */
  volatile boolean closeCalled;

  FakeHttpTransport(Logger logger, Builder builder) {
    super(logger, builder);
  }

  FakeHttpTransport respond(int statusCode, String body) {
    script.add(new Outcome(statusCode, body, null));
    return this;
  }

  FakeHttpTransport fail(IOException exception) {
    script.add(new Outcome(0, null, exception));
    return this;
  }

  @Override protected String newEndpoint(String endpoint) {
    try {
      return URI.create(endpoint).toURL().toString(); // validate
    } catch (MalformedURLException e) {
      throw new IllegalArgumentException(e.getMessage());
    }
  }

  @Override protected byte[] newBody(ByteBuffer rows) {
    byte[] body = new byte[rows.remaining()];
    rows.duplicate().get(body);
    return body;
  }

  @Override protected String postRows(String endpoint, byte[] body, String authorization,
    int timeoutMillis) throws IOException {
    bodies.add(new String(body, StandardCharsets.UTF_8));
    authorizations.add(authorization);
    timeouts.add(timeoutMillis);
    Outcome outcome = script.poll();
    if (outcome == null) return "";
    if (outcome.exception != null) throw outcome.exception;
    if (outcome.statusCode / 100 != 2) throw statusException(outcome.statusCode, outcome.body);
    return outcome.body;
  }

  @Override protected String getSettings(String settingsEndpoint, String authorization,
    int timeoutMillis) throws IOException {
    settingsRequests.add(settingsEndpoint);
    if (settings.exception != null) throw settings.exception;
    if (settings.statusCode / 100 != 2) throw statusException(settings.statusCode, settings.body);
    return settings.body;
  }

  FakeHttpTransport settings(int statusCode, String body) {
    settings = new Outcome(statusCode, body, null);
    return this;
  }

  @Override protected void doClose() {
    closeCalled = true;
  }
}
