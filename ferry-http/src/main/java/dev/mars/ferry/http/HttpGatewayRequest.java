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

import dev.mars.ferry.core.TransferMethod;
import dev.mars.ferry.gateway.GatewayRequest;
import dev.mars.ferry.gateway.GatewayRequestListener;
import dev.mars.ferry.gateway.GatewayStatus;
import dev.mars.ferry.gateway.SubmitRequest;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.http.HttpClientRequest;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A request held by {@link HttpTransferGateway}.
 *
 * <p>State changes are made by the gateway on Vert.x event loop threads, or on the caller's
 * thread when the request is removed. Listeners are notified after the request's lock has
 * been released.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public class HttpGatewayRequest implements GatewayRequest {
    private static final Logger logger = Logger.getLogger(HttpGatewayRequest.class.getName());

    private final Object lock = new Object();
    private final String requestId;
    private final SubmitRequest submitRequest;
    private final List<GatewayRequestListener> listeners = new CopyOnWriteArrayList<>();

    private GatewayStatus status = GatewayStatus.WAITING;
    private int statusCode;
    private Throwable error;
    private long bytesTransferred;
    private long totalBytes = -1;

    private boolean removed;
    private int attempts;
    private long retryTimerId = -1;
    private HttpClientRequest exchange;
    private AsyncFile file;

    HttpGatewayRequest(String requestId, SubmitRequest submitRequest) {
        this.requestId = requestId;
        this.submitRequest = submitRequest;
    }

    @Override
    public String getRequestId() {
        return requestId;
    }

    @Override
    public String getTag() {
        return submitRequest.getTag();
    }

    @Override
    public TransferMethod getMethod() {
        return submitRequest.getMethod();
    }

    @Override
    public URI getRemoteUri() {
        return submitRequest.getRemoteUri();
    }

    @Override
    public String getStagingPath() {
        return submitRequest.getStagingPath();
    }

    SubmitRequest getSubmitRequest() {
        return submitRequest;
    }

    @Override
    public GatewayStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    @Override
    public int getStatusCode() {
        synchronized (lock) {
            return statusCode;
        }
    }

    @Override
    public Throwable getError() {
        synchronized (lock) {
            return error;
        }
    }

    @Override
    public long getBytesTransferred() {
        synchronized (lock) {
            return bytesTransferred;
        }
    }

    @Override
    public long getTotalBytes() {
        synchronized (lock) {
            return totalBytes;
        }
    }

    @Override
    public void subscribe(GatewayRequestListener listener) {
        if (!listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    @Override
    public void unsubscribe(GatewayRequestListener listener) {
        listeners.remove(listener);
    }

    public int getAttempts() {
        synchronized (lock) {
            return attempts;
        }
    }

    // ========== GATEWAY SIDE ==========

    boolean isRemoved() {
        synchronized (lock) {
            return removed;
        }
    }

    /**
     * @return {@code false} if the request was already removed
     */
    boolean markRemoved() {
        synchronized (lock) {
            if (removed) {
                return false;
            }
            removed = true;
            return true;
        }
    }

    /**
     * @return the attempt number, or {@code 0} if the request is removed or completed
     */
    int beginAttempt() {
        synchronized (lock) {
            if (removed || status == GatewayStatus.COMPLETED) {
                return 0;
            }
            retryTimerId = -1;
            return ++attempts;
        }
    }

    /**
     * @return {@code false} if the request was removed in the meantime
     */
    boolean attach(HttpClientRequest exchange) {
        synchronized (lock) {
            if (removed) {
                return false;
            }
            this.exchange = exchange;
            return true;
        }
    }

    boolean attach(AsyncFile file) {
        synchronized (lock) {
            if (removed) {
                return false;
            }
            this.file = file;
            return true;
        }
    }

    void setRetryTimer(long timerId) {
        synchronized (lock) {
            retryTimerId = timerId;
        }
    }

    long takeRetryTimer() {
        synchronized (lock) {
            long timerId = retryTimerId;
            retryTimerId = -1;
            return timerId;
        }
    }

    HttpClientRequest takeExchange() {
        synchronized (lock) {
            HttpClientRequest current = exchange;
            exchange = null;
            return current;
        }
    }

    AsyncFile takeFile() {
        synchronized (lock) {
            AsyncFile current = file;
            file = null;
            return current;
        }
    }

    void reportStatus(GatewayStatus newStatus, int code) {
        synchronized (lock) {
            if (removed || status == GatewayStatus.COMPLETED) {
                return;
            }
            status = newStatus;
            statusCode = code;
        }
        fireStatusChanged();
    }

    void reportProgress(long transferred, long total) {
        synchronized (lock) {
            if (removed || status == GatewayStatus.COMPLETED) {
                return;
            }
            bytesTransferred = transferred;
            totalBytes = total;
        }
        for (GatewayRequestListener listener : listeners) {
            try {
                listener.onProgress(this, transferred, total);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Progress listener failed for request " + requestId, e);
            }
        }
    }

    /**
     * Moves the request to {@link GatewayStatus#COMPLETED}. Ignored once completed; a removed
     * request only accepts the completion issued by the removal itself.
     */
    boolean reportCompleted(int code, Throwable failure, boolean fromRemoval) {
        synchronized (lock) {
            if (status == GatewayStatus.COMPLETED || (removed && !fromRemoval)) {
                return false;
            }
            status = GatewayStatus.COMPLETED;
            if (!fromRemoval) {
                statusCode = code;
            }
            error = failure;
        }
        fireStatusChanged();
        return true;
    }

    private void fireStatusChanged() {
        for (GatewayRequestListener listener : listeners) {
            try {
                listener.onStatusChanged(this);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Status listener failed for request " + requestId, e);
            }
        }
    }

    @Override
    public String toString() {
        return "HttpGatewayRequest{" +
                "requestId='" + requestId + '\'' +
                ", tag='" + getTag() + '\'' +
                ", status=" + getStatus() +
                ", statusCode=" + getStatusCode() +
                '}';
    }
}
