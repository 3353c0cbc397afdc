/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.fleettrust.protocol;

/**
 * Version tags of the documents exchanged between nodes.
 */
public final class Protocol {
    public static final String TRANSPORT_V1 = "fleet:transport:1";
    public static final String SECURE_REQUEST_V1 = "fleet:secure:request:1";
    public static final String SECURE_REPLY_V1 = "fleet:secure:reply:1";

    private Protocol() {}
}
