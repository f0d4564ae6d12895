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

package dev.mars.ferry.gateway;

/**
 * Callback interface for events on a single gateway request.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public interface GatewayRequestListener {

    /**
     * @param totalBytes total size, {@code -1} if unknown
     */
    void onProgress(GatewayRequest request, long bytesTransferred, long totalBytes);

    /**
     * Called after the request's status, status code or error changed. The new values are
     * read from the request itself.
     */
    void onStatusChanged(GatewayRequest request);
}
