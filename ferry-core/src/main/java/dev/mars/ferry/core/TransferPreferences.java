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

package dev.mars.ferry.core;

/**
 * Network and power policy handed to the gateway with every submission.
 *
 * <p>The coordinator does not interpret these values; they are owned by whoever
 * stores user settings and travel to the gateway through
 * {@link dev.mars.ferry.config.FerryConfiguration}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-02
 * @version 1.0
 */
public enum TransferPreferences {
    /** Transfer only on Wi-Fi and external power. */
    NONE,
    /** Cellular data may be used, external power is still required. */
    ALLOW_CELLULAR,
    /** Battery may be used, Wi-Fi is still required. */
    ALLOW_BATTERY,
    /** Transfer on any network and on battery. */
    ALLOW_CELLULAR_AND_BATTERY;

    public boolean allowsCellular() {
        return this == ALLOW_CELLULAR || this == ALLOW_CELLULAR_AND_BATTERY;
    }

    public boolean allowsBattery() {
        return this == ALLOW_BATTERY || this == ALLOW_CELLULAR_AND_BATTERY;
    }
}
