/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.ferry.http;

import dev.mars.ferry.config.FerryConfiguration;
import dev.mars.ferry.core.TransferDirection;
import dev.mars.ferry.core.exceptions.RequestAlreadyRemovedException;
import dev.mars.ferry.core.exceptions.RequestCanceledException;
import dev.mars.ferry.core.exceptions.SubmissionException;
import dev.mars.ferry.core.exceptions.SubmissionFailure;
import dev.mars.ferry.core.exceptions.TransferException;
import dev.mars.ferry.gateway.GatewayRequest;
import dev.mars.ferry.gateway.GatewayStatus;
import dev.mars.ferry.gateway.SubmitRequest;
import dev.mars.ferry.gateway.TransferGateway;
import dev.mars.ferry.storage.TransferStorage;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.file.OpenOptions;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TransferGateway} that performs transfers over HTTP with a Vert.x {@link HttpClient}.
 *
 * <h3>Admission:</h3>
 * <ul>
 *   <li>switched off with {@link #setEnabled(boolean)}: {@link SubmissionFailure#SYSTEM_DISABLED}</li>
 *   <li>scheme other than http or https: {@link SubmissionFailure#TRANSPORT_ERROR}</li>
 *   <li>{@code ferry.http.max.requests} requests already held: {@link SubmissionFailure#CAPACITY_EXCEEDED}</li>
 *   <li>a held request uses the same staging path: {@link SubmissionFailure#DUPLICATE_REQUEST}</li>
 *   <li>less than {@code ferry.http.min.free.bytes} left on the storage: {@link SubmissionFailure#INSUFFICIENT_STORAGE}</li>
 * </ul>
 *
 * <h3>Exchange:</h3>
 * <p>Requests start {@link GatewayStatus#WAITING} and turn {@link GatewayStatus#TRANSFERRING}
 * once the exchange is under way. GET streams the response body into the staging file;
 * POST streams the staging file as the request body. A 5xx response is retried after
 * {@code retry.delay.ms * attempt} while reporting {@code WAITING} with the 5xx code,
 * up to {@code ferry.http.max.retries} times. Any other outcome completes the request:
 * 2xx without error, everything else with a {@link TransferException}; connection failures
 * complete with status code 0.</p>
 *
 * <p>The status code is passed through unchanged. The coordinator only accepts 200 and 206
 * as success, so upload targets must answer 200; a 201 or 204 is raised as an unhandled
 * status code and leaves the job in its last transient status.</p>
 *
 * <p>Completed requests stay listed until they are removed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class HttpTransferGateway implements TransferGateway {
    private static final Logger logger = Logger.getLogger(HttpTransferGateway.class.getName());

    private final Object lock = new Object();
    private final Map<String, HttpGatewayRequest> requests = new LinkedHashMap<>();

    private final Vertx vertx;
    private final HttpClient client;
    private final TransferStorage storage;
    private final int maxRequests;
    private final int maxRetries;
    private final long retryDelayMs;
    private final long minFreeBytes;

    private volatile boolean enabled = true;

    public HttpTransferGateway(Vertx vertx, TransferStorage storage, FerryConfiguration configuration) {
        this.vertx = vertx;
        this.storage = storage;
        this.maxRequests = configuration.getHttpMaxRequests();
        this.maxRetries = configuration.getHttpMaxRetries();
        this.retryDelayMs = configuration.getHttpRetryDelayMs();
        this.minFreeBytes = configuration.getHttpMinFreeBytes();
        this.client = vertx.createHttpClient(new HttpClientOptions()
                .setConnectTimeout(configuration.getHttpConnectTimeoutMs()));
        logger.info("HttpTransferGateway initialized: maxRequests=" + maxRequests + ", maxRetries=" + maxRetries);
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
        logger.info("Background transfers " + (enabled ? "enabled" : "disabled"));
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public List<GatewayRequest> listActiveRequests() {
        synchronized (lock) {
            return new ArrayList<>(requests.values());
        }
    }

    @Override
    public Optional<GatewayRequest> find(String requestId) {
        synchronized (lock) {
            return Optional.ofNullable(requests.get(requestId));
        }
    }

    @Override
    public GatewayRequest submit(SubmitRequest submitRequest) throws SubmissionException {
        String tag = submitRequest.getTag();
        if (!enabled) {
            throw new SubmissionException(tag, SubmissionFailure.SYSTEM_DISABLED, "Background transfers are disabled");
        }
        String scheme = submitRequest.getRemoteUri().getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new SubmissionException(tag, SubmissionFailure.TRANSPORT_ERROR, "Unsupported scheme: " + scheme);
        }

        HttpGatewayRequest request;
        synchronized (lock) {
            if (requests.size() >= maxRequests) {
                throw new SubmissionException(tag, SubmissionFailure.CAPACITY_EXCEEDED,
                        "Maximum number of requests reached (" + maxRequests + ")");
            }
            for (HttpGatewayRequest existing : requests.values()) {
                if (existing.getStagingPath().equals(submitRequest.getStagingPath())) {
                    throw new SubmissionException(tag, SubmissionFailure.DUPLICATE_REQUEST,
                            "A request for " + submitRequest.getStagingPath() + " has already been submitted");
                }
            }
            checkFreeSpace(tag);

            request = new HttpGatewayRequest(UUID.randomUUID().toString(), submitRequest);
            requests.put(request.getRequestId(), request);
        }

        logger.info("Accepted request " + request.getRequestId() + " for " + submitRequest);
        vertx.runOnContext(v -> startAttempt(request));
        return request;
    }

    private void checkFreeSpace(String tag) throws SubmissionException {
        if (minFreeBytes <= 0) {
            return;
        }
        long usable;
        try {
            usable = storage.getUsableSpace();
        } catch (IOException e) {
            throw new SubmissionException(tag, SubmissionFailure.INSUFFICIENT_STORAGE,
                    "Could not determine free space", e);
        }
        if (usable < minFreeBytes) {
            throw new SubmissionException(tag, SubmissionFailure.INSUFFICIENT_STORAGE,
                    "There is not enough space on the disk (" + usable + " bytes free)");
        }
    }

    @Override
    public void remove(GatewayRequest gatewayRequest) throws RequestAlreadyRemovedException {
        HttpGatewayRequest request;
        synchronized (lock) {
            request = requests.remove(gatewayRequest.getRequestId());
        }
        if (request == null || !request.markRemoved()) {
            throw new RequestAlreadyRemovedException(gatewayRequest.getRequestId());
        }

        long timerId = request.takeRetryTimer();
        if (timerId >= 0) {
            vertx.cancelTimer(timerId);
        }
        HttpClientRequest exchange = request.takeExchange();
        if (exchange != null) {
            exchange.reset();
        }
        closeFile(request);

        if (request.reportCompleted(0, new RequestCanceledException(request.getRequestId()), true)) {
            logger.info("Canceled request " + request.getRequestId());
        } else {
            logger.fine("Removed request " + request.getRequestId());
        }
    }

    /**
     * Closes the underlying HTTP client.
     */
    public Future<Void> close() {
        return client.close();
    }

    // ========== EXCHANGE ==========

    private void startAttempt(HttpGatewayRequest request) {
        int attempt = request.beginAttempt();
        if (attempt == 0) {
            return;
        }
        logger.fine("Starting attempt " + attempt + " for request " + request.getRequestId());

        SubmitRequest submitRequest = request.getSubmitRequest();
        RequestOptions options = new RequestOptions()
                .setMethod(HttpMethod.valueOf(submitRequest.getMethod().name()))
                .setAbsoluteURI(submitRequest.getRemoteUri().toString())
                .setFollowRedirects(true);

        if (submitRequest.getDirection() == TransferDirection.DOWNLOAD) {
            download(request, options);
        } else {
            upload(request, options);
        }
    }

    private void download(HttpGatewayRequest request, RequestOptions options) {
        client.request(options)
                .compose(exchange -> {
                    if (!request.attach(exchange)) {
                        exchange.reset();
                        return Future.failedFuture(new RequestCanceledException(request.getRequestId()));
                    }
                    return exchange.send();
                })
                .onSuccess(response -> {
                    if (isSuccess(response.statusCode())) {
                        receiveBody(request, response);
                    } else {
                        handleErrorResponse(request, response);
                    }
                })
                .onFailure(err -> handleConnectionFailure(request, err));
    }

    private void receiveBody(HttpGatewayRequest request, HttpClientResponse response) {
        response.pause();
        int statusCode = response.statusCode();
        long totalBytes = parseContentLength(response.getHeader(HttpHeaders.CONTENT_LENGTH));
        request.reportStatus(GatewayStatus.TRANSFERRING, statusCode);
        request.reportProgress(0, totalBytes);

        String target = storage.resolve(request.getStagingPath()).toString();
        OpenOptions openOptions = new OpenOptions().setWrite(true).setCreate(true).setTruncateExisting(true);
        vertx.fileSystem().open(target, openOptions)
                .onFailure(err -> {
                    request.takeExchange();
                    completeWithError(request, statusCode, "Could not open staging file " + target, err);
                })
                .onSuccess(file -> {
                    if (!request.attach(file)) {
                        file.close();
                        return;
                    }
                    long[] received = {0};
                    file.drainHandler(v -> response.resume());
                    response.handler(buffer -> {
                        file.write(buffer);
                        received[0] += buffer.length();
                        request.reportProgress(received[0], totalBytes);
                        if (file.writeQueueFull()) {
                            response.pause();
                        }
                    });
                    response.exceptionHandler(err -> {
                        request.takeExchange();
                        closeFile(request);
                        completeWithError(request, 0, "Download interrupted", err);
                    });
                    response.endHandler(v -> {
                        request.takeExchange();
                        AsyncFile staged = request.takeFile();
                        if (staged == null) {
                            return;
                        }
                        staged.close()
                                .onSuccess(done -> request.reportCompleted(statusCode, null, false))
                                .onFailure(err -> completeWithError(request, statusCode, "Could not write staging file", err));
                    });
                    response.resume();
                });
    }

    private void upload(HttpGatewayRequest request, RequestOptions options) {
        String source = storage.resolve(request.getStagingPath()).toString();
        vertx.fileSystem().props(source)
                .onFailure(err -> completeWithError(request, 0, "Could not read upload source " + source, err))
                .onSuccess(props -> vertx.fileSystem().open(source, new OpenOptions().setRead(true))
                        .onFailure(err -> completeWithError(request, 0, "Could not open upload source " + source, err))
                        .onSuccess(file -> {
                            file.pause();
                            if (!request.attach(file)) {
                                file.close();
                                return;
                            }
                            client.request(options)
                                    .onFailure(err -> {
                                        closeFile(request);
                                        handleConnectionFailure(request, err);
                                    })
                                    .onSuccess(exchange -> sendBody(request, exchange, file, props.size()));
                        }));
    }

    private void sendBody(HttpGatewayRequest request, HttpClientRequest exchange, AsyncFile file, long totalBytes) {
        if (!request.attach(exchange)) {
            exchange.reset();
            return;
        }
        exchange.putHeader(HttpHeaders.CONTENT_LENGTH, String.valueOf(totalBytes));
        exchange.response()
                .onSuccess(response -> {
                    closeFile(request);
                    if (isSuccess(response.statusCode())) {
                        response.body()
                                .onSuccess(body -> {
                                    request.takeExchange();
                                    request.reportCompleted(response.statusCode(), null, false);
                                })
                                .onFailure(err -> handleConnectionFailure(request, err));
                    } else {
                        handleErrorResponse(request, response);
                    }
                })
                .onFailure(err -> {
                    closeFile(request);
                    handleConnectionFailure(request, err);
                });

        request.reportStatus(GatewayStatus.TRANSFERRING, 0);
        request.reportProgress(0, totalBytes);
        long[] sent = {0};
        exchange.drainHandler(v -> file.resume());
        file.handler(buffer -> {
            exchange.write(buffer);
            sent[0] += buffer.length();
            request.reportProgress(sent[0], totalBytes);
            if (exchange.writeQueueFull()) {
                file.pause();
            }
        });
        file.exceptionHandler(err -> {
            exchange.reset();
            closeFile(request);
            completeWithError(request, 0, "Could not read upload source", err);
        });
        file.endHandler(v -> exchange.end());
        file.resume();
    }

    // ========== OUTCOMES ==========

    private void handleErrorResponse(HttpGatewayRequest request, HttpClientResponse response) {
        int statusCode = response.statusCode();
        request.takeExchange();
        // Drain the body so the connection can be reused.
        response.body().onComplete(ar -> {
            if (statusCode >= 500 && statusCode <= 599) {
                scheduleRetry(request, statusCode);
            } else {
                completeWithError(request, statusCode, "Rejected by server", null);
            }
        });
    }

    private void scheduleRetry(HttpGatewayRequest request, int statusCode) {
        int attempts = request.getAttempts();
        if (attempts > maxRetries) {
            completeWithError(request, statusCode,
                    "Server error " + statusCode + " after " + attempts + " attempts", null);
            return;
        }
        long delay = retryDelayMs * attempts;
        logger.info("Request " + request.getRequestId() + " got " + statusCode + ", retrying in " + delay + "ms");
        request.reportStatus(GatewayStatus.WAITING, statusCode);
        if (request.isRemoved()) {
            return;
        }
        request.setRetryTimer(vertx.setTimer(Math.max(1, delay), id -> startAttempt(request)));
    }

    private void handleConnectionFailure(HttpGatewayRequest request, Throwable err) {
        request.takeExchange();
        if (request.isRemoved()) {
            logger.fine("Exchange of removed request " + request.getRequestId() + " ended: " + err.getMessage());
            return;
        }
        completeWithError(request, 0, "Connection failed", err);
    }

    private void completeWithError(HttpGatewayRequest request, int statusCode, String message, Throwable cause) {
        String detail = cause == null ? message : message + ": " + cause.getMessage();
        TransferException error = new TransferException(request.getTag(), statusCode, detail, cause);
        if (request.reportCompleted(statusCode, error, false)) {
            logger.log(Level.WARNING, "Request " + request.getRequestId() + " failed: " + error.getMessage());
        }
    }

    private void closeFile(HttpGatewayRequest request) {
        AsyncFile file = request.takeFile();
        if (file != null) {
            file.close().onFailure(err ->
                    logger.warning("Failed to close staging file of request " + request.getRequestId()
                            + ": " + err.getMessage()));
        }
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode <= 299;
    }

    private static long parseContentLength(String value) {
        if (value == null) {
            return -1;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
