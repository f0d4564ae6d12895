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

import dev.mars.ferry.core.TransferDirection;
import dev.mars.ferry.core.TransferMethod;
import dev.mars.ferry.core.TransferPreferences;

import java.net.URI;
import java.util.Objects;

/**
 * Immutable description of a request handed to {@link TransferGateway#submit(SubmitRequest)}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public final class SubmitRequest {

    private final String tag;
    private final TransferMethod method;
    private final URI remoteUri;
    private final TransferDirection direction;
    private final String stagingPath;
    private final TransferPreferences preferences;

    public SubmitRequest(String tag, TransferMethod method, URI remoteUri, TransferDirection direction,
                         String stagingPath, TransferPreferences preferences) {
        this.tag = Objects.requireNonNull(tag, "Tag cannot be null");
        this.method = Objects.requireNonNull(method, "Method cannot be null");
        this.remoteUri = Objects.requireNonNull(remoteUri, "Remote URI cannot be null");
        this.direction = Objects.requireNonNull(direction, "Direction cannot be null");
        this.stagingPath = Objects.requireNonNull(stagingPath, "Staging path cannot be null");
        this.preferences = Objects.requireNonNull(preferences, "Transfer preferences cannot be null");
    }

    public String getTag() { return tag; }
    public TransferMethod getMethod() { return method; }
    public URI getRemoteUri() { return remoteUri; }
    public TransferDirection getDirection() { return direction; }

    /**
     * @return the staging location: the download target or the upload source
     */
    public String getStagingPath() { return stagingPath; }
    public TransferPreferences getPreferences() { return preferences; }

    @Override
    public String toString() {
        return "SubmitRequest{tag='" + tag + "', method=" + method + ", remoteUri=" + remoteUri +
                ", stagingPath='" + stagingPath + "', preferences=" + preferences + '}';
    }
}
